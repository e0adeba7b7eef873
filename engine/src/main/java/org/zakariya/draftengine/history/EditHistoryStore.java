package org.zakariya.draftengine.history;

import java.util.List;

/**
 * Persistent storage of draft edit history, provided by the host application.
 */
public interface EditHistoryStore {

	void record(EditHistoryEntry entry);

	/**
	 * @param draftId the draft
	 * @param limit   maximum number of entries to return
	 * @return the draft's most recent entries, newest first
	 */
	List<EditHistoryEntry> listByDraft(long draftId, int limit);
}
