package org.zakariya.draftengine.drafts;

import org.jetbrains.annotations.Nullable;

import java.time.Instant;

/**
 * Persistent storage of draft rows.
 */
public interface DraftStore {

	@Nullable
	Draft getDraft(long draftId);

	void updateContent(long draftId, String content, long editorId, Instant editedAt);

	void updateTitle(long draftId, String title, long editorId, Instant editedAt);

	/**
	 * Publish the draft as a document and remove the draft row.
	 *
	 * @return id of the created or updated document
	 */
	long saveAsDocument(long draftId, long userId);

	/**
	 * @return true if a draft row was deleted
	 */
	boolean deleteDraft(long draftId);
}
