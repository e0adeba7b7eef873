package org.zakariya.draftengine.session;

import org.jetbrains.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.zakariya.draftengine.changes.SectionAnnotation;
import org.zakariya.draftengine.changes.SectionChange;
import org.zakariya.draftengine.changes.SectionChangeCoordinator;
import org.zakariya.draftengine.changes.SectionChangeStore;
import org.zakariya.draftengine.changes.SectionMarkup;
import org.zakariya.draftengine.drafts.ContentDiff;
import org.zakariya.draftengine.drafts.DiffProvider;
import org.zakariya.draftengine.drafts.Draft;
import org.zakariya.draftengine.drafts.DraftStore;
import org.zakariya.draftengine.errors.ConflictException;
import org.zakariya.draftengine.errors.DraftEngineException;
import org.zakariya.draftengine.errors.NotFoundException;
import org.zakariya.draftengine.errors.UpstreamFailureException;
import org.zakariya.draftengine.history.EditHistoryEntry;
import org.zakariya.draftengine.history.EditHistoryStore;
import org.zakariya.draftengine.history.EditType;
import org.zakariya.draftengine.revisions.RedoResult;
import org.zakariya.draftengine.revisions.Revision;
import org.zakariya.draftengine.revisions.RevisionStore;
import org.zakariya.draftengine.revisions.UndoResult;
import org.zakariya.draftengine.services.ConnectionRegistry;
import org.zakariya.draftengine.services.DraftConnection;
import org.zakariya.draftengine.services.EventSink;
import org.zakariya.draftengine.transport.DraftEvent;

import java.time.Clock;
import java.time.Instant;
import java.util.Collections;
import java.util.List;
import java.util.function.Supplier;

import static com.google.common.base.Preconditions.checkNotNull;

/**
 * EditSessionOrchestrator
 * The entry point request handlers call for everything a collaborative editing session does:
 * edit, undo, redo, apply or dismiss a section change, save, delete, and viewer connect and
 * disconnect. Each call against a draft runs under that draft's lock, so revision bookkeeping
 * and broadcast order stay consistent per draft.
 * <p>
 * Failures surface as {@link DraftEngineException} subclasses. An external collaborator failing
 * during the primary mutation surfaces as {@link UpstreamFailureException} and leaves the
 * revision timeline as it was.
 * <p>
 * When an {@link EditHistoryStore} is supplied, content and title edits and section change
 * decisions are also written to the draft's edit history. That trail is informational: failing to
 * write it is logged and never fails the edit.
 */
public class EditSessionOrchestrator {

	private static final Logger logger = LoggerFactory.getLogger(EditSessionOrchestrator.class);

	static final String DESCRIPTION_MANUAL_EDIT = "Manual edit";
	static final int EDIT_HISTORY_LIMIT = 50;

	private final RevisionStore revisionStore;
	private final SectionChangeCoordinator coordinator;
	private final ConnectionRegistry connectionRegistry;
	private final DraftStore draftStore;
	private final SectionChangeStore changeStore;
	private final SectionMarkup markup;
	private final DiffProvider diffProvider;
	private final DraftLocks draftLocks;
	@Nullable
	private final EditHistoryStore editHistoryStore;
	private final Clock clock;

	public EditSessionOrchestrator(RevisionStore revisionStore,
	                               SectionChangeCoordinator coordinator,
	                               ConnectionRegistry connectionRegistry,
	                               DraftStore draftStore,
	                               SectionChangeStore changeStore,
	                               SectionMarkup markup,
	                               DiffProvider diffProvider,
	                               DraftLocks draftLocks,
	                               Clock clock) {
		this(revisionStore, coordinator, connectionRegistry, draftStore, changeStore, markup, diffProvider, draftLocks, null, clock);
	}

	/**
	 * @param editHistoryStore where the edit audit trail goes; null to keep none
	 */
	public EditSessionOrchestrator(RevisionStore revisionStore,
	                               SectionChangeCoordinator coordinator,
	                               ConnectionRegistry connectionRegistry,
	                               DraftStore draftStore,
	                               SectionChangeStore changeStore,
	                               SectionMarkup markup,
	                               DiffProvider diffProvider,
	                               DraftLocks draftLocks,
	                               @Nullable EditHistoryStore editHistoryStore,
	                               Clock clock) {
		this.revisionStore = checkNotNull(revisionStore);
		this.coordinator = checkNotNull(coordinator);
		this.connectionRegistry = checkNotNull(connectionRegistry);
		this.draftStore = checkNotNull(draftStore);
		this.changeStore = checkNotNull(changeStore);
		this.markup = checkNotNull(markup);
		this.diffProvider = checkNotNull(diffProvider);
		this.draftLocks = checkNotNull(draftLocks);
		this.editHistoryStore = editHistoryStore;
		this.clock = checkNotNull(clock);
	}

	public RevisionStore getRevisionStore() {
		return revisionStore;
	}

	public ConnectionRegistry getConnectionRegistry() {
		return connectionRegistry;
	}

	///////////////////////////////////////////////////////////////////
	// editing

	/**
	 * Update a draft's title and/or content. A content change is recorded as a revision and sent
	 * as a diff to every other viewer; the editor already has it locally.
	 *
	 * @param draftId  the draft
	 * @param editorId the editing user
	 * @param title    new title, or null to leave it
	 * @param content  new content, or null to leave it
	 * @return the draft as it now stands
	 */
	public Draft editDraft(long draftId, long editorId, @Nullable String title, @Nullable String content) {
		if (title == null && content == null) {
			throw new IllegalArgumentException("Must provide title or content");
		}
		if (title != null && title.trim().isEmpty()) {
			throw new IllegalArgumentException("Title cannot be empty");
		}

		return draftLocks.withLock(draftId, () -> {
			Draft draft = requireDraft(draftId);
			Instant now = clock.instant();

			boolean titleChanged = title != null && !title.equals(draft.getTitle());
			if (titleChanged) {
				upstream("update title of draft " + draftId, () -> draftStore.updateTitle(draftId, title, editorId, now));
			}

			if (content != null) {
				String previousContent = draft.getContent();
				List<ContentDiff> diffs = upstream("diff draft " + draftId, () -> diffProvider.diff(previousContent, content));
				upstream("update content of draft " + draftId, () -> draftStore.updateContent(draftId, content, editorId, now));

				coordinator.ensureBaseline(draftId, previousContent, editorId);
				revisionStore.addRevision(draftId, content, editorId, DESCRIPTION_MANUAL_EDIT);

				connectionRegistry.broadcast(draftId, new DraftEvent.ContentUpdate(draftId, editorId, diffs, now), editorId);
				logger.debug("editDraft draft: {} editor: {} - {} diff hunks", draftId, editorId, diffs.size());

				if (!content.equals(previousContent)) {
					recordHistory(draftId, editorId, EditType.CONTENT, "");
				}
			}

			if (titleChanged) {
				recordHistory(draftId, editorId, EditType.TITLE, "Changed to \"" + title + "\"");
			}

			return new Draft(draftId,
					title != null ? title : draft.getTitle(),
					content != null ? content : draft.getContent());
		});
	}

	/**
	 * Step back one revision. Changes applied by the undone revision become pending again, and
	 * dismissals it recorded are lifted. Nothing is broadcast: the acting user gets the full state
	 * back, and a broadcast would race with their own in-flight edits.
	 *
	 * @throws ConflictException if there is nothing to undo
	 */
	public EditResult undo(long draftId, long userId) {
		return draftLocks.withLock(draftId, () -> {
			requireDraft(draftId);

			Revision target = revisionStore.peekUndoTarget(draftId);
			if (target == null) {
				throw new ConflictException("Nothing to undo");
			}

			upstream("restore content of draft " + draftId,
					() -> draftStore.updateContent(draftId, target.getContent(), target.getAuthorId(), target.getTimestamp()));

			UndoResult undoResult = revisionStore.undo(draftId);
			if (undoResult == null) {
				throw new IllegalStateException("undo target vanished for draft " + draftId);
			}

			coordinator.revertFlags(draftId, undoResult);
			logger.info("undo draft: {} user: {} - cursor now at {}", draftId, userId, revisionStore.getCurrentIndex(draftId));

			return buildResult(draftId, undoResult.getContent());
		});
	}

	/**
	 * Step forward one revision, reinstating the change flags it carries. No broadcast, as with
	 * {@link #undo(long, long)}.
	 *
	 * @throws ConflictException if there is nothing to redo
	 */
	public EditResult redo(long draftId, long userId) {
		return draftLocks.withLock(draftId, () -> {
			requireDraft(draftId);

			Revision target = revisionStore.peekRedoTarget(draftId);
			if (target == null) {
				throw new ConflictException("Nothing to redo");
			}

			upstream("restore content of draft " + draftId,
					() -> draftStore.updateContent(draftId, target.getContent(), target.getAuthorId(), target.getTimestamp()));

			RedoResult redoResult = revisionStore.redo(draftId);
			if (redoResult == null) {
				throw new IllegalStateException("redo target vanished for draft " + draftId);
			}

			coordinator.restoreFlags(draftId, redoResult, userId);
			logger.info("redo draft: {} user: {} - cursor now at {}", draftId, userId, revisionStore.getCurrentIndex(draftId));

			return buildResult(draftId, redoResult.getContent());
		});
	}

	///////////////////////////////////////////////////////////////////
	// section changes

	/**
	 * Merge a proposed section change into the draft and tell every viewer, the actor included.
	 */
	public EditResult applyChange(long draftId, long changeId, long userId) {
		return draftLocks.withLock(draftId, () -> {
			Draft draft = requireDraft(draftId);
			SectionChange change = coordinator.findChange(draftId, changeId);

			String updatedContent = coordinator.apply(draftId, change, draft.getContent(), userId);
			recordHistory(draftId, userId, EditType.SECTION_APPLY, "Applied " + change.getChangeType().getWireName() + " change");
			EditResult result = buildResult(draftId, updatedContent);

			connectionRegistry.broadcast(draftId, new DraftEvent.SectionChangeApplied(draftId, changeId, clock.instant()));
			return result;
		});
	}

	/**
	 * Reject a proposed section change, leaving content alone, and tell every viewer.
	 */
	public EditResult dismissChange(long draftId, long changeId, long userId) {
		return draftLocks.withLock(draftId, () -> {
			Draft draft = requireDraft(draftId);
			SectionChange change = coordinator.findChange(draftId, changeId);

			coordinator.dismiss(draftId, change, draft.getContent(), userId);
			recordHistory(draftId, userId, EditType.SECTION_DISMISS, "Dismissed " + change.getChangeType().getWireName() + " change");
			EditResult result = buildResult(draftId, draft.getContent());

			connectionRegistry.broadcast(draftId, new DraftEvent.SectionChangeDismissed(draftId, changeId, clock.instant()));
			return result;
		});
	}

	/**
	 * Remove a section change record outright. Viewers see it as a dismissal. This is not
	 * recorded in the revision timeline and cannot be undone.
	 */
	public EditResult deleteChange(long draftId, long changeId, long userId) {
		return draftLocks.withLock(draftId, () -> {
			Draft draft = requireDraft(draftId);
			coordinator.findChange(draftId, changeId);

			upstream("delete section change " + changeId, () -> changeStore.delete(changeId));
			logger.info("deleteChange draft: {} change: {} user: {}", draftId, changeId, userId);

			EditResult result = buildResult(draftId, draft.getContent());
			connectionRegistry.broadcast(draftId, new DraftEvent.SectionChangeDismissed(draftId, changeId, clock.instant()));
			return result;
		});
	}

	///////////////////////////////////////////////////////////////////
	// lifecycle

	/**
	 * Publish the draft as a document. The draft's revision history ends here.
	 *
	 * @return id of the resulting document
	 */
	public long saveDraft(long draftId, long userId) {
		return draftLocks.withLock(draftId, () -> {
			requireDraft(draftId);

			long docId = upstream("save draft " + draftId, () -> draftStore.saveAsDocument(draftId, userId));
			revisionStore.clear(draftId);

			logger.info("saveDraft draft: {} user: {} - saved as doc {}", draftId, userId, docId);
			connectionRegistry.broadcast(draftId, new DraftEvent.DraftSaved(draftId, docId, userId, clock.instant()));
			return docId;
		});
	}

	/**
	 * Delete the draft and its revision history.
	 *
	 * @throws NotFoundException if the draft did not exist
	 */
	public void deleteDraft(long draftId, long userId) {
		draftLocks.withLock(draftId, () -> {
			boolean deleted = upstream("delete draft " + draftId, () -> draftStore.deleteDraft(draftId));
			if (!deleted) {
				throw new NotFoundException("Draft not found");
			}

			revisionStore.clear(draftId);

			logger.info("deleteDraft draft: {} user: {}", draftId, userId);
			connectionRegistry.broadcast(draftId, new DraftEvent.DraftDeleted(draftId, userId, clock.instant()));
		});
	}

	///////////////////////////////////////////////////////////////////
	// queries

	/**
	 * @return revision metadata and cursor for a draft's history display
	 */
	public RevisionHistoryView getRevisionHistory(long draftId) {
		return draftLocks.withLock(draftId, () -> {
			requireDraft(draftId);
			return new RevisionHistoryView(revisionStore.getRevisionInfo(draftId),
					revisionStore.getCurrentIndex(draftId),
					revisionStore.canUndo(draftId),
					revisionStore.canRedo(draftId));
		});
	}

	/**
	 * @return the draft's most recent edit history entries, newest first; empty when no history is kept
	 */
	public List<EditHistoryEntry> getEditHistory(long draftId) {
		return draftLocks.withLock(draftId, () -> {
			requireDraft(draftId);
			if (editHistoryStore == null) {
				return Collections.<EditHistoryEntry>emptyList();
			}
			return upstream("list edit history of draft " + draftId, () -> editHistoryStore.listByDraft(draftId, EDIT_HISTORY_LIMIT));
		});
	}

	/**
	 * @return the draft's full current state, for viewers re-fetching after a notification
	 */
	public EditResult getState(long draftId) {
		return draftLocks.withLock(draftId, () -> buildResult(draftId, requireDraft(draftId).getContent()));
	}

	///////////////////////////////////////////////////////////////////
	// viewers

	public DraftConnection connect(long draftId, long userId, EventSink sink) {
		return draftLocks.withLock(draftId, () -> connectionRegistry.connect(draftId, userId, sink));
	}

	public boolean disconnect(long draftId, long userId, EventSink sink) {
		return draftLocks.withLock(draftId, () -> connectionRegistry.disconnect(draftId, userId, sink));
	}

	///////////////////////////////////////////////////////////////////

	private Draft requireDraft(long draftId) {
		Draft draft = upstream("load draft " + draftId, () -> draftStore.getDraft(draftId));
		if (draft == null) {
			throw new NotFoundException("Draft not found");
		}
		return draft;
	}

	private void recordHistory(long draftId, long userId, EditType editType, String description) {
		if (editHistoryStore == null) {
			return;
		}

		try {
			editHistoryStore.record(new EditHistoryEntry(draftId, userId, editType, description, clock.instant()));
		} catch (RuntimeException e) {
			logger.error("Unable to record {} edit history for draft {}", editType.getWireName(), draftId, e);
		}
	}

	private EditResult buildResult(long draftId, String content) {
		List<SectionAnnotation> sections = upstream("annotate draft " + draftId, () -> markup.annotate(draftId, content));
		List<SectionChange> changes = upstream("list section changes of draft " + draftId, () -> changeStore.listByDraft(draftId));
		return new EditResult(content, sections, changes, revisionStore.canUndo(draftId), revisionStore.canRedo(draftId));
	}

	private static <T> T upstream(String what, Supplier<T> call) {
		try {
			return call.get();
		} catch (DraftEngineException e) {
			throw e;
		} catch (RuntimeException e) {
			throw new UpstreamFailureException("Unable to " + what, e);
		}
	}

	private static void upstream(String what, Runnable call) {
		upstream(what, () -> {
			call.run();
			return null;
		});
	}
}
