package org.zakariya.draftengine.history;

import com.fasterxml.jackson.annotation.JsonAutoDetect;

import java.time.Instant;

/**
 * One line of a draft's audit trail: who changed what, and when. Unlike revisions, entries
 * outlive undo and are never pruned by the engine.
 */
@JsonAutoDetect(fieldVisibility = JsonAutoDetect.Visibility.ANY)
public class EditHistoryEntry {

	private long draftId;
	private long userId;
	private EditType editType;
	private String description;
	private Instant editedAt;

	public EditHistoryEntry() {
	}

	public EditHistoryEntry(long draftId, long userId, EditType editType, String description, Instant editedAt) {
		this.draftId = draftId;
		this.userId = userId;
		this.editType = editType;
		this.description = description;
		this.editedAt = editedAt;
	}

	public long getDraftId() {
		return draftId;
	}

	public long getUserId() {
		return userId;
	}

	public EditType getEditType() {
		return editType;
	}

	public String getDescription() {
		return description;
	}

	public Instant getEditedAt() {
		return editedAt;
	}

	@Override
	public String toString() {
		return "EditHistoryEntry{draft=" + draftId + ", user=" + userId + ", type=" + editType.getWireName() + ", description='" + description + "'}";
	}
}
