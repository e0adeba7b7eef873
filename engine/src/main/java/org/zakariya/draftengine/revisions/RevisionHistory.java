package org.zakariya.draftengine.revisions;

import org.jetbrains.annotations.Nullable;

import java.util.ArrayList;
import java.util.List;

/**
 * One draft's bounded undo/redo timeline. All access is synchronized on the instance, so
 * a single history is never mutated by two threads at once.
 */
class RevisionHistory {

	private final int maxRevisions;
	private final List<Revision> revisions = new ArrayList<>();
	private int currentIndex = -1;

	RevisionHistory(int maxRevisions) {
		this.maxRevisions = maxRevisions;
	}

	synchronized void add(Revision revision) {
		// a fresh edit after undo forks the timeline; the abandoned future is dropped
		if (currentIndex < revisions.size() - 1) {
			revisions.subList(currentIndex + 1, revisions.size()).clear();
		}

		revisions.add(revision);

		if (revisions.size() > maxRevisions) {
			// indices shift down by one, so the unchanged cursor lands on the new tail
			revisions.remove(0);
		} else {
			currentIndex++;
		}
	}

	@Nullable
	synchronized UndoResult undo() {
		if (currentIndex <= 0) {
			return null;
		}

		Revision undone = revisions.get(currentIndex);
		currentIndex--;
		return new UndoResult(revisions.get(currentIndex), undone);
	}

	@Nullable
	synchronized RedoResult redo() {
		if (currentIndex >= revisions.size() - 1) {
			return null;
		}

		currentIndex++;
		return new RedoResult(revisions.get(currentIndex));
	}

	@Nullable
	synchronized Revision peekUndoTarget() {
		return currentIndex > 0 ? revisions.get(currentIndex - 1) : null;
	}

	@Nullable
	synchronized Revision peekRedoTarget() {
		return currentIndex < revisions.size() - 1 ? revisions.get(currentIndex + 1) : null;
	}

	synchronized boolean canUndo() {
		return currentIndex > 0;
	}

	synchronized boolean canRedo() {
		return currentIndex >= 0 && currentIndex < revisions.size() - 1;
	}

	synchronized int getCurrentIndex() {
		return currentIndex;
	}

	synchronized int size() {
		return revisions.size();
	}

	@Nullable
	synchronized Revision get(int index) {
		if (index < 0 || index >= revisions.size()) {
			return null;
		}
		return revisions.get(index);
	}

	@Nullable
	synchronized Revision current() {
		return get(currentIndex);
	}

	synchronized List<RevisionInfo> info() {
		List<RevisionInfo> info = new ArrayList<>(revisions.size());
		for (Revision revision : revisions) {
			info.add(revision.toInfo());
		}
		return info;
	}
}
