package org.zakariya.draftengine.changes;

import org.junit.Before;
import org.junit.Test;
import org.zakariya.draftengine.errors.ConflictException;
import org.zakariya.draftengine.errors.ForbiddenException;
import org.zakariya.draftengine.errors.NotFoundException;
import org.zakariya.draftengine.errors.UpstreamFailureException;
import org.zakariya.draftengine.fakes.AppendingMarkup;
import org.zakariya.draftengine.fakes.InMemoryDraftStore;
import org.zakariya.draftengine.fakes.InMemorySectionChangeStore;
import org.zakariya.draftengine.revisions.Revision;
import org.zakariya.draftengine.revisions.RevisionStore;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Collections;

import static org.junit.Assert.*;

/**
 * Test org.zakariya.draftengine.changes.SectionChangeCoordinator
 */
public class SectionChangeCoordinatorTest {

	private static final long DRAFT_ID = 1;
	private static final long OTHER_DRAFT_ID = 2;
	private static final long USER_ID = 10;
	private static final long CHANGE_ID = 7;
	private static final Instant NOW = Instant.parse("2024-03-01T12:00:00Z");

	private RevisionStore revisionStore;
	private InMemorySectionChangeStore changeStore;
	private InMemoryDraftStore draftStore;
	private AppendingMarkup markup;
	private SectionChangeCoordinator coordinator;

	@Before
	public void setUp() throws Exception {
		Clock clock = Clock.fixed(NOW, ZoneOffset.UTC);
		revisionStore = new RevisionStore(50, clock);
		changeStore = new InMemorySectionChangeStore();
		draftStore = new InMemoryDraftStore();
		markup = new AppendingMarkup();
		coordinator = new SectionChangeCoordinator(revisionStore, changeStore, markup, draftStore, clock);

		draftStore.putDraft(DRAFT_ID, "Draft", "A");
		changeStore.add(CHANGE_ID, DRAFT_ID, "B");
	}

	@Test
	public void findChange() throws Exception {
		SectionChange change = coordinator.findChange(DRAFT_ID, CHANGE_ID);
		assertEquals("should find change 7", CHANGE_ID, change.getId());
	}

	@Test(expected = NotFoundException.class)
	public void findMissingChange() throws Exception {
		coordinator.findChange(DRAFT_ID, 99);
	}

	@Test(expected = ForbiddenException.class)
	public void findChangeOfAnotherDraft() throws Exception {
		coordinator.findChange(OTHER_DRAFT_ID, CHANGE_ID);
	}

	@Test
	public void apply() throws Exception {
		SectionChange change = coordinator.findChange(DRAFT_ID, CHANGE_ID);
		String updated = coordinator.apply(DRAFT_ID, change, "A", USER_ID);

		assertEquals("applying should merge the proposed value", "AB", updated);
		assertEquals("draft store should hold the merged content", "AB", draftStore.getDraft(DRAFT_ID).getContent());
		assertTrue("change record should be applied", changeStore.get(CHANGE_ID).isApplied());
		assertTrue("the caller's copy should be applied", change.isApplied());

		assertEquals("a baseline plus the apply revision", 2, revisionStore.getRevisionCount(DRAFT_ID));
		Revision baseline = revisionStore.getRevisionAt(DRAFT_ID, 0);
		assertEquals("baseline holds the prior content", "A", baseline.getContent());
		assertEquals("baseline description", SectionChangeCoordinator.DESCRIPTION_BASELINE, baseline.getDescription());

		Revision applied = revisionStore.getRevisionAt(DRAFT_ID, 1);
		assertEquals("apply revision holds the new content", "AB", applied.getContent());
		assertEquals("apply revision records the change", Collections.singleton(CHANGE_ID), applied.getAppliedChangeIds());
	}

	@Test
	public void applyAlreadyAppliedIsConflict() throws Exception {
		coordinator.apply(DRAFT_ID, coordinator.findChange(DRAFT_ID, CHANGE_ID), "A", USER_ID);
		int revisionCount = revisionStore.getRevisionCount(DRAFT_ID);

		try {
			coordinator.apply(DRAFT_ID, coordinator.findChange(DRAFT_ID, CHANGE_ID), "AB", USER_ID);
			fail("applying twice should be a conflict");
		} catch (ConflictException e) {
			assertEquals("conflict maps to 409", 409, e.getStatusCode());
		}

		assertEquals("no revision should be pushed on conflict", revisionCount, revisionStore.getRevisionCount(DRAFT_ID));
	}

	@Test
	public void applyWithFailingMarkupPushesNoRevision() throws Exception {
		markup.setFailing(true);

		try {
			coordinator.apply(DRAFT_ID, coordinator.findChange(DRAFT_ID, CHANGE_ID), "A", USER_ID);
			fail("markup failure should propagate");
		} catch (UpstreamFailureException e) {
			assertEquals("upstream failure maps to 502", 502, e.getStatusCode());
		}

		assertEquals("no revision should be pushed", 0, revisionStore.getRevisionCount(DRAFT_ID));
		assertFalse("change should stay pending", changeStore.get(CHANGE_ID).isApplied());
		assertEquals("content should be untouched", "A", draftStore.getDraft(DRAFT_ID).getContent());
	}

	@Test
	public void applyWithFailingDraftStorePushesNoRevision() throws Exception {
		draftStore.setFailUpdates(true);

		try {
			coordinator.apply(DRAFT_ID, coordinator.findChange(DRAFT_ID, CHANGE_ID), "A", USER_ID);
			fail("draft store failure should propagate");
		} catch (UpstreamFailureException e) {
			assertNotNull("cause should be kept", e.getCause());
		}

		assertEquals("no revision should be pushed", 0, revisionStore.getRevisionCount(DRAFT_ID));
	}

	@Test
	public void dismiss() throws Exception {
		SectionChange change = coordinator.findChange(DRAFT_ID, CHANGE_ID);
		coordinator.dismiss(DRAFT_ID, change, "A", USER_ID);

		assertEquals("dismissing leaves content alone", "A", draftStore.getDraft(DRAFT_ID).getContent());
		assertEquals("dismissing does not write content", 0, draftStore.getContentUpdateCount());

		SectionChange stored = changeStore.get(CHANGE_ID);
		assertTrue("change should be dismissed", stored.isDismissed());
		assertFalse("change should not be applied", stored.isApplied());
		assertEquals("dismissedBy recorded", Long.valueOf(USER_ID), stored.getDismissedBy());
		assertEquals("dismissedAt recorded", NOW, stored.getDismissedAt());

		Revision dismissed = revisionStore.getRevisionAt(DRAFT_ID, 1);
		assertEquals("dismiss revision keeps the content", "A", dismissed.getContent());
		assertEquals("dismiss revision records the change", Collections.singleton(CHANGE_ID), dismissed.getDismissedChangeIds());
		assertTrue("dismiss revision applies nothing", dismissed.getAppliedChangeIds().isEmpty());
	}

	@Test(expected = ConflictException.class)
	public void dismissTwiceIsConflict() throws Exception {
		coordinator.dismiss(DRAFT_ID, coordinator.findChange(DRAFT_ID, CHANGE_ID), "A", USER_ID);
		coordinator.dismiss(DRAFT_ID, coordinator.findChange(DRAFT_ID, CHANGE_ID), "A", USER_ID);
	}

	@Test
	public void applyChangeOfAnotherDraftIsForbidden() throws Exception {
		SectionChange foreign = changeStore.add(9, OTHER_DRAFT_ID, "C");

		try {
			coordinator.apply(DRAFT_ID, foreign, "A", USER_ID);
			fail("applying another draft's change should be forbidden");
		} catch (ForbiddenException e) {
			assertEquals("forbidden maps to 403", 403, e.getStatusCode());
		}

		assertEquals("content should be untouched", "A", draftStore.getDraft(DRAFT_ID).getContent());
		assertFalse("foreign change should stay pending", changeStore.get(9).isApplied());
		assertEquals("no revision should be pushed", 0, revisionStore.getRevisionCount(DRAFT_ID));
	}

	@Test
	public void dismissChangeOfAnotherDraftIsForbidden() throws Exception {
		SectionChange foreign = changeStore.add(9, OTHER_DRAFT_ID, "C");

		try {
			coordinator.dismiss(DRAFT_ID, foreign, "A", USER_ID);
			fail("dismissing another draft's change should be forbidden");
		} catch (ForbiddenException e) {
			assertEquals("forbidden maps to 403", 403, e.getStatusCode());
		}

		assertFalse("foreign change should stay pending", changeStore.get(9).isDismissed());
		assertEquals("no revision should be pushed", 0, revisionStore.getRevisionCount(DRAFT_ID));
	}

	@Test
	public void baselineOnlySeededOnce() throws Exception {
		changeStore.add(8, DRAFT_ID, "C");

		String afterFirst = coordinator.apply(DRAFT_ID, coordinator.findChange(DRAFT_ID, CHANGE_ID), "A", USER_ID);
		coordinator.apply(DRAFT_ID, coordinator.findChange(DRAFT_ID, 8), afterFirst, USER_ID);

		assertEquals("baseline plus two applies", 3, revisionStore.getRevisionCount(DRAFT_ID));
		assertEquals("both changes merged", "ABC", revisionStore.getCurrentContent(DRAFT_ID));
	}

	@Test
	public void revertAndRestoreFlags() throws Exception {
		coordinator.apply(DRAFT_ID, coordinator.findChange(DRAFT_ID, CHANGE_ID), "A", USER_ID);

		coordinator.revertFlags(DRAFT_ID, revisionStore.undo(DRAFT_ID));
		assertFalse("undo should unapply", changeStore.get(CHANGE_ID).isApplied());

		coordinator.restoreFlags(DRAFT_ID, revisionStore.redo(DRAFT_ID), USER_ID);
		assertTrue("redo should reapply", changeStore.get(CHANGE_ID).isApplied());
	}

	@Test
	public void revertDismissClearsMetadata() throws Exception {
		coordinator.dismiss(DRAFT_ID, coordinator.findChange(DRAFT_ID, CHANGE_ID), "A", USER_ID);

		coordinator.revertFlags(DRAFT_ID, revisionStore.undo(DRAFT_ID));
		SectionChange stored = changeStore.get(CHANGE_ID);
		assertFalse("undo should lift the dismissal", stored.isDismissed());
		assertNull("dismissedBy cleared", stored.getDismissedBy());
		assertNull("dismissedAt cleared", stored.getDismissedAt());

		long redoUserId = 20;
		coordinator.restoreFlags(DRAFT_ID, revisionStore.redo(DRAFT_ID), redoUserId);
		stored = changeStore.get(CHANGE_ID);
		assertTrue("redo should re-dismiss", stored.isDismissed());
		assertEquals("re-dismissal is attributed to the redoing user", Long.valueOf(redoUserId), stored.getDismissedBy());
	}
}
