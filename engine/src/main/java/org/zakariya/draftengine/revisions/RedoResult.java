package org.zakariya.draftengine.revisions;

import java.util.Set;

/**
 * Outcome of a successful redo: the content of the revision stepped forward onto, plus the
 * change flags that revision carries.
 */
public class RedoResult {

	private final String content;
	private final Revision restoredRevision;
	private final Set<Long> reappliedChangeIds;
	private final Set<Long> redismissedChangeIds;

	RedoResult(Revision restoredRevision) {
		this.content = restoredRevision.getContent();
		this.restoredRevision = restoredRevision;
		this.reappliedChangeIds = restoredRevision.getAppliedChangeIds();
		this.redismissedChangeIds = restoredRevision.getDismissedChangeIds();
	}

	public String getContent() {
		return content;
	}

	public Revision getRestoredRevision() {
		return restoredRevision;
	}

	public Set<Long> getReappliedChangeIds() {
		return reappliedChangeIds;
	}

	public Set<Long> getRedismissedChangeIds() {
		return redismissedChangeIds;
	}
}
