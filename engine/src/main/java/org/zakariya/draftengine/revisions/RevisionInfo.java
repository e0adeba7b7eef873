package org.zakariya.draftengine.revisions;

import com.fasterxml.jackson.annotation.JsonAutoDetect;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;

/**
 * Revision metadata without the content, for lightweight history display.
 */
@JsonAutoDetect(fieldVisibility = JsonAutoDetect.Visibility.ANY)
public class RevisionInfo {

	private Instant timestamp;
	private long authorId;
	private String description;
	private List<Long> appliedChangeIds;
	private List<Long> dismissedChangeIds;

	public RevisionInfo() {
	}

	RevisionInfo(Instant timestamp, long authorId, String description, Set<Long> appliedChangeIds, Set<Long> dismissedChangeIds) {
		this.timestamp = timestamp;
		this.authorId = authorId;
		this.description = description;
		this.appliedChangeIds = new ArrayList<>(appliedChangeIds);
		this.dismissedChangeIds = new ArrayList<>(dismissedChangeIds);
	}

	public Instant getTimestamp() {
		return timestamp;
	}

	public long getAuthorId() {
		return authorId;
	}

	public String getDescription() {
		return description;
	}

	public List<Long> getAppliedChangeIds() {
		return appliedChangeIds;
	}

	public List<Long> getDismissedChangeIds() {
		return dismissedChangeIds;
	}
}
