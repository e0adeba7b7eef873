package org.zakariya.draftengine.revisions;

import java.util.Set;

/**
 * Outcome of a successful undo: the content of the revision now current, plus the change
 * flags recorded on the revision that was stepped back over.
 */
public class UndoResult {

	private final String content;
	private final Revision restoredRevision;
	private final Set<Long> undoneChangeIds;
	private final Set<Long> undismissedChangeIds;

	UndoResult(Revision restoredRevision, Revision undoneRevision) {
		this.content = restoredRevision.getContent();
		this.restoredRevision = restoredRevision;
		this.undoneChangeIds = undoneRevision.getAppliedChangeIds();
		this.undismissedChangeIds = undoneRevision.getDismissedChangeIds();
	}

	public String getContent() {
		return content;
	}

	/**
	 * @return the revision the cursor now points at
	 */
	public Revision getRestoredRevision() {
		return restoredRevision;
	}

	/**
	 * @return change ids to mark as no longer applied
	 */
	public Set<Long> getUndoneChangeIds() {
		return undoneChangeIds;
	}

	/**
	 * @return change ids to mark as no longer dismissed
	 */
	public Set<Long> getUndismissedChangeIds() {
		return undismissedChangeIds;
	}
}
