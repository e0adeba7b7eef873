package org.zakariya.draftengine.changes;

import com.fasterxml.jackson.annotation.JsonAutoDetect;
import org.jetbrains.annotations.Nullable;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * A proposed, addressable edit to one section of a draft. Records are owned and persisted by a
 * {@link SectionChangeStore}; the engine only coordinates their applied/dismissed flags.
 */
@JsonAutoDetect(fieldVisibility = JsonAutoDetect.Visibility.ANY)
public class SectionChange {

	private long id;
	private long draftId;
	private ChangeType changeType;
	@Nullable
	private String path;
	private List<ProposedEdit> proposed = new ArrayList<>();
	private boolean applied;
	private boolean dismissed;
	@Nullable
	private Instant dismissedAt;
	@Nullable
	private Long dismissedBy;

	public SectionChange() {
	}

	public SectionChange(long id, long draftId, ChangeType changeType, @Nullable String path, List<ProposedEdit> proposed) {
		this.id = id;
		this.draftId = draftId;
		this.changeType = changeType;
		this.path = path;
		this.proposed = new ArrayList<>(proposed);
	}

	/**
	 * @return a field-by-field copy, so stores can hand out snapshots of their records
	 */
	public SectionChange copy() {
		SectionChange copy = new SectionChange(id, draftId, changeType, path, proposed);
		copy.applied = applied;
		copy.dismissed = dismissed;
		copy.dismissedAt = dismissedAt;
		copy.dismissedBy = dismissedBy;
		return copy;
	}

	public long getId() {
		return id;
	}

	public long getDraftId() {
		return draftId;
	}

	public ChangeType getChangeType() {
		return changeType;
	}

	/**
	 * @return the section path the change targets, e.g. "/Introduction"
	 */
	@Nullable
	public String getPath() {
		return path;
	}

	public List<ProposedEdit> getProposed() {
		return proposed;
	}

	public boolean isApplied() {
		return applied;
	}

	public void setApplied(boolean applied) {
		this.applied = applied;
	}

	public boolean isDismissed() {
		return dismissed;
	}

	public void setDismissed(boolean dismissed) {
		this.dismissed = dismissed;
	}

	@Nullable
	public Instant getDismissedAt() {
		return dismissedAt;
	}

	public void setDismissedAt(@Nullable Instant dismissedAt) {
		this.dismissedAt = dismissedAt;
	}

	@Nullable
	public Long getDismissedBy() {
		return dismissedBy;
	}

	public void setDismissedBy(@Nullable Long dismissedBy) {
		this.dismissedBy = dismissedBy;
	}

	/**
	 * @return description of the first proposed edit, falling back to the change type
	 */
	public String describe() {
		if (!proposed.isEmpty() && proposed.get(0).getDescription() != null) {
			return proposed.get(0).getDescription();
		}
		return changeType.getWireName() + " change";
	}

	@Override
	public String toString() {
		return "SectionChange{id=" + id + ", draftId=" + draftId + ", type=" + changeType
				+ ", applied=" + applied + ", dismissed=" + dismissed + "}";
	}
}
