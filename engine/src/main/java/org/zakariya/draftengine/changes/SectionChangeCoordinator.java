package org.zakariya.draftengine.changes;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.zakariya.draftengine.drafts.DraftStore;
import org.zakariya.draftengine.errors.ConflictException;
import org.zakariya.draftengine.errors.ForbiddenException;
import org.zakariya.draftengine.errors.NotFoundException;
import org.zakariya.draftengine.errors.UpstreamFailureException;
import org.zakariya.draftengine.revisions.RedoResult;
import org.zakariya.draftengine.revisions.RevisionStore;
import org.zakariya.draftengine.revisions.UndoResult;

import java.time.Clock;
import java.time.Instant;
import java.util.Collections;

import static com.google.common.base.Preconditions.checkNotNull;

/**
 * SectionChangeCoordinator
 * Applies or dismisses a single section change against a draft's current content, keeping the
 * draft's revision timeline and the change record's own flags in step. Callers must hold the
 * draft's lock for the duration of each call.
 * <p>
 * Upstream writes happen before any revision is pushed, so a failed write leaves the timeline
 * untouched. A write that succeeds on the change record but fails afterwards is logged and left
 * as is; there is no rollback.
 */
public class SectionChangeCoordinator {

	private static final Logger logger = LoggerFactory.getLogger(SectionChangeCoordinator.class);

	static final String DESCRIPTION_BASELINE = "Initial content";
	static final String DESCRIPTION_APPLIED = "Applied section change";
	static final String DESCRIPTION_DISMISSED = "Dismissed section change";

	private final RevisionStore revisionStore;
	private final SectionChangeStore changeStore;
	private final SectionMarkup markup;
	private final DraftStore draftStore;
	private final Clock clock;

	public SectionChangeCoordinator(RevisionStore revisionStore, SectionChangeStore changeStore, SectionMarkup markup, DraftStore draftStore) {
		this(revisionStore, changeStore, markup, draftStore, Clock.systemUTC());
	}

	public SectionChangeCoordinator(RevisionStore revisionStore, SectionChangeStore changeStore, SectionMarkup markup, DraftStore draftStore, Clock clock) {
		this.revisionStore = checkNotNull(revisionStore);
		this.changeStore = checkNotNull(changeStore);
		this.markup = checkNotNull(markup);
		this.draftStore = checkNotNull(draftStore);
		this.clock = checkNotNull(clock);
	}

	/**
	 * Look up a change and confirm it belongs to the draft.
	 *
	 * @throws NotFoundException  if no such change exists
	 * @throws ForbiddenException if the change belongs to a different draft
	 */
	public SectionChange findChange(long draftId, long changeId) {
		SectionChange change;
		try {
			change = changeStore.get(changeId);
		} catch (RuntimeException e) {
			throw new UpstreamFailureException("Unable to load section change " + changeId, e);
		}

		if (change == null) {
			throw new NotFoundException("Section change not found");
		}

		requireSameDraft(draftId, change);
		return change;
	}

	private static void requireSameDraft(long draftId, SectionChange change) {
		if (change.getDraftId() != draftId) {
			throw new ForbiddenException("Section change does not belong to this draft");
		}
	}

	/**
	 * Merge a change into the draft content.
	 *
	 * @param draftId        the draft
	 * @param change         the change, previously obtained through {@link #findChange(long, long)}
	 * @param currentContent the draft's content before applying
	 * @param authorId       the acting user
	 * @return the updated content
	 * @throws ForbiddenException if the change belongs to a different draft
	 * @throws ConflictException  if the change is already applied
	 */
	public String apply(long draftId, SectionChange change, String currentContent, long authorId) {
		requireSameDraft(draftId, change);
		if (change.isApplied()) {
			throw new ConflictException("Change already applied");
		}

		String updatedContent;
		try {
			updatedContent = markup.applyChangeToContent(currentContent, change);
			draftStore.updateContent(draftId, updatedContent, authorId, clock.instant());
		} catch (RuntimeException e) {
			throw new UpstreamFailureException("Unable to apply section change " + change.getId() + " to draft " + draftId, e);
		}

		try {
			changeStore.setApplied(change.getId(), true);
		} catch (RuntimeException e) {
			logger.error("apply - draft {} content was updated, but marking change {} applied failed", draftId, change.getId(), e);
			throw new UpstreamFailureException("Unable to mark section change " + change.getId() + " applied", e);
		}
		change.setApplied(true);

		ensureBaseline(draftId, currentContent, authorId);
		revisionStore.addRevision(draftId, updatedContent, authorId, DESCRIPTION_APPLIED,
				Collections.singleton(change.getId()), Collections.emptySet());

		logger.info("apply - draft: {} applied change: {} ({})", draftId, change.getId(), change.describe());
		return updatedContent;
	}

	/**
	 * Reject a change without touching the draft content. A revision carrying the unchanged content
	 * is still pushed so the dismissal can be undone.
	 *
	 * @throws ForbiddenException if the change belongs to a different draft
	 * @throws ConflictException  if the change is already dismissed
	 */
	public void dismiss(long draftId, SectionChange change, String currentContent, long authorId) {
		requireSameDraft(draftId, change);
		if (change.isDismissed()) {
			throw new ConflictException("Change already dismissed");
		}

		Instant now = clock.instant();
		try {
			changeStore.setDismissed(change.getId(), true, authorId, now);
		} catch (RuntimeException e) {
			throw new UpstreamFailureException("Unable to dismiss section change " + change.getId(), e);
		}
		change.setDismissed(true);
		change.setDismissedBy(authorId);
		change.setDismissedAt(now);

		ensureBaseline(draftId, currentContent, authorId);
		revisionStore.addRevision(draftId, currentContent, authorId, DESCRIPTION_DISMISSED,
				Collections.emptySet(), Collections.singleton(change.getId()));

		logger.info("dismiss - draft: {} dismissed change: {} ({})", draftId, change.getId(), change.describe());
	}

	/**
	 * Reverse the change flags recorded on a revision that was just undone: applied changes become
	 * pending again, dismissed changes lose their dismissal and its metadata.
	 */
	public void revertFlags(long draftId, UndoResult undoResult) {
		try {
			for (Long changeId : undoResult.getUndoneChangeIds()) {
				changeStore.setApplied(changeId, false);
			}
			for (Long changeId : undoResult.getUndismissedChangeIds()) {
				changeStore.setDismissed(changeId, false, null, null);
			}
		} catch (RuntimeException e) {
			throw new UpstreamFailureException("Unable to revert section change flags for draft " + draftId, e);
		}

		logger.debug("revertFlags - draft: {} unapplied: {} undismissed: {}",
				draftId, undoResult.getUndoneChangeIds(), undoResult.getUndismissedChangeIds());
	}

	/**
	 * Reinstate the change flags carried by a revision that was just redone. Re-dismissal records a
	 * fresh dismissedAt/dismissedBy rather than the original ones.
	 */
	public void restoreFlags(long draftId, RedoResult redoResult, long userId) {
		Instant now = clock.instant();
		try {
			for (Long changeId : redoResult.getReappliedChangeIds()) {
				changeStore.setApplied(changeId, true);
			}
			for (Long changeId : redoResult.getRedismissedChangeIds()) {
				changeStore.setDismissed(changeId, true, userId, now);
			}
		} catch (RuntimeException e) {
			throw new UpstreamFailureException("Unable to restore section change flags for draft " + draftId, e);
		}

		logger.debug("restoreFlags - draft: {} reapplied: {} redismissed: {}",
				draftId, redoResult.getReappliedChangeIds(), redoResult.getRedismissedChangeIds());
	}

	/**
	 * Make sure there is a revision to undo back to before the first tracked mutation of a draft.
	 */
	public void ensureBaseline(long draftId, String currentContent, long authorId) {
		if (revisionStore.getRevisionCount(draftId) == 0) {
			revisionStore.addRevision(draftId, currentContent, authorId, DESCRIPTION_BASELINE);
		}
	}
}
