package org.zakariya.draftengine.changes;

import org.jetbrains.annotations.Nullable;

import java.time.Instant;
import java.util.List;

/**
 * Persistent storage of section change records. Each call is a single-record write; there is
 * no multi-record atomicity.
 */
public interface SectionChangeStore {

	@Nullable
	SectionChange get(long changeId);

	List<SectionChange> listByDraft(long draftId);

	void setApplied(long changeId, boolean applied);

	/**
	 * @param changeId    the change
	 * @param dismissed   new dismissed flag
	 * @param dismissedBy the dismissing user, null when clearing
	 * @param dismissedAt when it was dismissed, null when clearing
	 */
	void setDismissed(long changeId, boolean dismissed, @Nullable Long dismissedBy, @Nullable Instant dismissedAt);

	/**
	 * @return true if a record was deleted
	 */
	boolean delete(long changeId);
}
