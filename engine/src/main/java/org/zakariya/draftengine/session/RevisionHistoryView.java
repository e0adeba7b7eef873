package org.zakariya.draftengine.session;

import com.fasterxml.jackson.annotation.JsonAutoDetect;
import org.zakariya.draftengine.revisions.RevisionInfo;

import java.util.List;

@JsonAutoDetect(fieldVisibility = JsonAutoDetect.Visibility.ANY)
public class RevisionHistoryView {

	private List<RevisionInfo> revisions;
	private int currentIndex;
	private boolean canUndo;
	private boolean canRedo;

	public RevisionHistoryView() {
	}

	RevisionHistoryView(List<RevisionInfo> revisions, int currentIndex, boolean canUndo, boolean canRedo) {
		this.revisions = revisions;
		this.currentIndex = currentIndex;
		this.canUndo = canUndo;
		this.canRedo = canRedo;
	}

	public List<RevisionInfo> getRevisions() {
		return revisions;
	}

	/**
	 * @return cursor position, -1 when there is no history
	 */
	public int getCurrentIndex() {
		return currentIndex;
	}

	public boolean isCanUndo() {
		return canUndo;
	}

	public boolean isCanRedo() {
		return canRedo;
	}
}
