package org.zakariya.draftengine.revisions;

import org.jetbrains.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;

/**
 * RevisionStore
 * In-memory, per-draft undo/redo history. Histories are created lazily on the first revision
 * pushed for a draft and dropped when the draft is saved, deleted or explicitly cleared. Nothing
 * here survives a process restart.
 * <p>
 * Different drafts may be used concurrently. Multi-step sequences against the same draft
 * (read, then push) must be serialized by the caller; see {@link org.zakariya.draftengine.session.DraftLocks}.
 */
public class RevisionStore {

	private static final Logger logger = LoggerFactory.getLogger(RevisionStore.class);

	public static final int DEFAULT_MAX_REVISIONS = 50;

	private final int maxRevisions;
	private final Clock clock;
	private final ConcurrentMap<Long, RevisionHistory> historiesByDraftId = new ConcurrentHashMap<>();

	public RevisionStore() {
		this(DEFAULT_MAX_REVISIONS);
	}

	public RevisionStore(int maxRevisions) {
		this(maxRevisions, Clock.systemUTC());
	}

	public RevisionStore(int maxRevisions, Clock clock) {
		checkArgument(maxRevisions > 0, "maxRevisions must be positive, got %s", maxRevisions);
		this.maxRevisions = maxRevisions;
		this.clock = checkNotNull(clock);
	}

	public int getMaxRevisions() {
		return maxRevisions;
	}

	/**
	 * Push a plain revision, one which neither applies nor dismisses any section change.
	 */
	public void addRevision(long draftId, String content, long authorId, String description) {
		addRevision(draftId, content, authorId, description, Collections.emptySet(), Collections.emptySet());
	}

	/**
	 * Push a revision which marks the given section changes as applied.
	 */
	public void addRevision(long draftId, String content, long authorId, String description, Collection<Long> appliedChangeIds) {
		addRevision(draftId, content, authorId, description, appliedChangeIds, Collections.emptySet());
	}

	/**
	 * Push a new revision onto a draft's timeline. If the cursor is not at the tail, every revision
	 * after it is discarded first. When the timeline is full, the oldest revision is evicted.
	 *
	 * @param draftId            the draft
	 * @param content            full document text at this revision
	 * @param authorId           the user who produced it
	 * @param description        free text, e.g. "Manual edit"
	 * @param appliedChangeIds   section changes newly applied by this revision
	 * @param dismissedChangeIds section changes newly dismissed by this revision
	 */
	public void addRevision(long draftId, String content, long authorId, String description,
	                        Collection<Long> appliedChangeIds, Collection<Long> dismissedChangeIds) {
		Revision revision = new Revision(content, clock.instant(), authorId, description,
				appliedChangeIds != null ? appliedChangeIds : Collections.emptySet(),
				dismissedChangeIds != null ? dismissedChangeIds : Collections.emptySet());

		RevisionHistory history = historiesByDraftId.computeIfAbsent(draftId, id -> new RevisionHistory(maxRevisions));
		history.add(revision);

		logger.debug("addRevision draft: {} {} - now {} revisions, cursor at {}",
				draftId, revision, history.size(), history.getCurrentIndex());
	}

	/**
	 * Step the cursor back by one.
	 *
	 * @return the restored content and the change flags to reverse, or null if there is nothing to undo
	 */
	@Nullable
	public UndoResult undo(long draftId) {
		RevisionHistory history = historiesByDraftId.get(draftId);
		return history != null ? history.undo() : null;
	}

	/**
	 * Step the cursor forward by one.
	 *
	 * @return the restored content and the change flags to reinstate, or null if there is nothing to redo
	 */
	@Nullable
	public RedoResult redo(long draftId) {
		RevisionHistory history = historiesByDraftId.get(draftId);
		return history != null ? history.redo() : null;
	}

	/**
	 * @return the revision an undo would restore, without moving the cursor
	 */
	@Nullable
	public Revision peekUndoTarget(long draftId) {
		RevisionHistory history = historiesByDraftId.get(draftId);
		return history != null ? history.peekUndoTarget() : null;
	}

	/**
	 * @return the revision a redo would restore, without moving the cursor
	 */
	@Nullable
	public Revision peekRedoTarget(long draftId) {
		RevisionHistory history = historiesByDraftId.get(draftId);
		return history != null ? history.peekRedoTarget() : null;
	}

	public boolean canUndo(long draftId) {
		RevisionHistory history = historiesByDraftId.get(draftId);
		return history != null && history.canUndo();
	}

	public boolean canRedo(long draftId) {
		RevisionHistory history = historiesByDraftId.get(draftId);
		return history != null && history.canRedo();
	}

	/**
	 * Drop a draft's history entirely. Called when the draft is saved or deleted.
	 */
	public void clear(long draftId) {
		if (historiesByDraftId.remove(draftId) != null) {
			logger.debug("clear draft: {}", draftId);
		}
	}

	public void clearAll() {
		historiesByDraftId.clear();
	}

	/**
	 * @return content of the revision under the cursor, or null if the draft has no history
	 */
	@Nullable
	public String getCurrentContent(long draftId) {
		RevisionHistory history = historiesByDraftId.get(draftId);
		if (history == null) {
			return null;
		}
		Revision current = history.current();
		return current != null ? current.getContent() : null;
	}

	/**
	 * @return the cursor position, -1 when the draft has no history
	 */
	public int getCurrentIndex(long draftId) {
		RevisionHistory history = historiesByDraftId.get(draftId);
		return history != null ? history.getCurrentIndex() : -1;
	}

	public int getRevisionCount(long draftId) {
		RevisionHistory history = historiesByDraftId.get(draftId);
		return history != null ? history.size() : 0;
	}

	/**
	 * @return metadata of every revision, oldest first; empty if the draft has no history
	 */
	public List<RevisionInfo> getRevisionInfo(long draftId) {
		RevisionHistory history = historiesByDraftId.get(draftId);
		return history != null ? history.info() : Collections.emptyList();
	}

	@Nullable
	public Revision getRevisionAt(long draftId, int index) {
		RevisionHistory history = historiesByDraftId.get(draftId);
		return history != null ? history.get(index) : null;
	}

	/**
	 * @return number of drafts currently holding history
	 */
	public int getDraftCount() {
		return historiesByDraftId.size();
	}
}
