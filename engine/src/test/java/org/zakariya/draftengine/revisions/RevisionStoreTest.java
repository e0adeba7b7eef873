package org.zakariya.draftengine.revisions;

import org.junit.Before;
import org.junit.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Collections;
import java.util.List;

import static org.junit.Assert.*;

/**
 * Test org.zakariya.draftengine.revisions.RevisionStore
 */
public class RevisionStoreTest {

	private static final long DRAFT_ID = 1;
	private static final long OTHER_DRAFT_ID = 2;
	private static final long AUTHOR_ID = 10;
	private static final Instant NOW = Instant.parse("2024-03-01T12:00:00Z");

	private RevisionStore store;

	@Before
	public void setUp() throws Exception {
		store = new RevisionStore(3, Clock.fixed(NOW, ZoneOffset.UTC));
	}

	@Test
	public void addRevision() throws Exception {
		assertFalse("empty history can't undo", store.canUndo(DRAFT_ID));
		assertEquals("empty history has cursor -1", -1, store.getCurrentIndex(DRAFT_ID));
		assertNull("empty history has no content", store.getCurrentContent(DRAFT_ID));

		store.addRevision(DRAFT_ID, "v1", AUTHOR_ID, "first");
		assertFalse("a single revision can't be undone", store.canUndo(DRAFT_ID));
		assertEquals("current content should be v1", "v1", store.getCurrentContent(DRAFT_ID));

		store.addRevision(DRAFT_ID, "v2", AUTHOR_ID, "second");
		assertTrue("after the second revision we can undo", store.canUndo(DRAFT_ID));
		assertFalse("at the tail there is nothing to redo", store.canRedo(DRAFT_ID));
		assertEquals("current content should be the latest", "v2", store.getCurrentContent(DRAFT_ID));
		assertEquals("cursor should be at the tail", 1, store.getCurrentIndex(DRAFT_ID));

		Revision revision = store.getRevisionAt(DRAFT_ID, 1);
		assertNotNull(revision);
		assertEquals("revision should carry the clock's time", NOW, revision.getTimestamp());
		assertEquals("revision should carry its author", AUTHOR_ID, revision.getAuthorId());
		assertEquals("revision should carry its description", "second", revision.getDescription());
	}

	@Test
	public void evictsOldestWhenFull() throws Exception {
		store.addRevision(DRAFT_ID, "v1", AUTHOR_ID, "1");
		store.addRevision(DRAFT_ID, "v2", AUTHOR_ID, "2");
		store.addRevision(DRAFT_ID, "v3", AUTHOR_ID, "3");
		store.addRevision(DRAFT_ID, "v4", AUTHOR_ID, "4");

		assertEquals("history should be capped at the max", 3, store.getRevisionCount(DRAFT_ID));
		assertEquals("oldest revision should be gone", "v2", store.getRevisionAt(DRAFT_ID, 0).getContent());
		assertEquals("cursor should remain on the tail", 2, store.getCurrentIndex(DRAFT_ID));
		assertEquals("current content should be the latest", "v4", store.getCurrentContent(DRAFT_ID));

		assertNotNull(store.undo(DRAFT_ID));
		assertNotNull(store.undo(DRAFT_ID));
		assertNull("can't undo past the oldest retained revision", store.undo(DRAFT_ID));
		assertEquals("content should be the oldest retained", "v2", store.getCurrentContent(DRAFT_ID));
	}

	@Test
	public void undoRedo() throws Exception {
		store.addRevision(DRAFT_ID, "v1", AUTHOR_ID, "1");
		store.addRevision(DRAFT_ID, "v2", AUTHOR_ID, "2");

		UndoResult undoResult = store.undo(DRAFT_ID);
		assertNotNull("undo should succeed", undoResult);
		assertEquals("undo should return v1", "v1", undoResult.getContent());
		assertTrue("after undo we can redo", store.canRedo(DRAFT_ID));

		RedoResult redoResult = store.redo(DRAFT_ID);
		assertNotNull("redo should succeed", redoResult);
		assertEquals("redo should return v2", "v2", redoResult.getContent());

		store.addRevision(DRAFT_ID, "v3", AUTHOR_ID, "3");
		assertEquals("adding at the tail truncates nothing", 3, store.getRevisionCount(DRAFT_ID));
		assertFalse("nothing to redo after adding at the tail", store.canRedo(DRAFT_ID));
		assertEquals("current content should be v3", "v3", store.getCurrentContent(DRAFT_ID));
	}

	@Test
	public void addAfterUndoDiscardsRedoTail() throws Exception {
		store.addRevision(DRAFT_ID, "v1", AUTHOR_ID, "1");
		store.addRevision(DRAFT_ID, "v2", AUTHOR_ID, "2");
		store.addRevision(DRAFT_ID, "v3", AUTHOR_ID, "3");

		store.undo(DRAFT_ID);
		store.undo(DRAFT_ID);
		assertEquals("two undos land on the first revision", 0, store.getCurrentIndex(DRAFT_ID));

		store.addRevision(DRAFT_ID, "v4", AUTHOR_ID, "4");
		assertEquals("revisions after the cursor should be discarded", 2, store.getRevisionCount(DRAFT_ID));
		assertFalse("no redo after a fork", store.canRedo(DRAFT_ID));
		assertNull("redo should fail", store.redo(DRAFT_ID));
		assertEquals("v1 should precede v4", "v1", store.getRevisionAt(DRAFT_ID, 0).getContent());
		assertEquals("v4 is current", "v4", store.getCurrentContent(DRAFT_ID));
	}

	@Test
	public void undoReportsChangeFlagsOfUndoneRevision() throws Exception {
		store.addRevision(DRAFT_ID, "A", AUTHOR_ID, "baseline");
		store.addRevision(DRAFT_ID, "AB", AUTHOR_ID, "applied", Collections.singleton(7L));
		store.addRevision(DRAFT_ID, "AB", AUTHOR_ID, "dismissed", Collections.emptySet(), Collections.singleton(8L));

		UndoResult undoDismiss = store.undo(DRAFT_ID);
		assertEquals("undoing the dismissal lifts it", Collections.singleton(8L), undoDismiss.getUndismissedChangeIds());
		assertTrue("undoing the dismissal unapplies nothing", undoDismiss.getUndoneChangeIds().isEmpty());

		UndoResult undoApply = store.undo(DRAFT_ID);
		assertEquals("undoing the apply reverts change 7", Collections.singleton(7L), undoApply.getUndoneChangeIds());
		assertEquals("content goes back to the baseline", "A", undoApply.getContent());

		RedoResult redoApply = store.redo(DRAFT_ID);
		assertEquals("redo reapplies change 7", Collections.singleton(7L), redoApply.getReappliedChangeIds());
		assertTrue("redo of an apply dismisses nothing", redoApply.getRedismissedChangeIds().isEmpty());

		RedoResult redoDismiss = store.redo(DRAFT_ID);
		assertEquals("redo re-dismisses change 8", Collections.singleton(8L), redoDismiss.getRedismissedChangeIds());
	}

	@Test
	public void peekDoesNotMoveCursor() throws Exception {
		assertNull("nothing to peek on an empty history", store.peekUndoTarget(DRAFT_ID));

		store.addRevision(DRAFT_ID, "v1", AUTHOR_ID, "1");
		store.addRevision(DRAFT_ID, "v2", AUTHOR_ID, "2");

		assertEquals("undo target is v1", "v1", store.peekUndoTarget(DRAFT_ID).getContent());
		assertEquals("peeking leaves the cursor", 1, store.getCurrentIndex(DRAFT_ID));
		assertNull("nothing to redo at the tail", store.peekRedoTarget(DRAFT_ID));

		store.undo(DRAFT_ID);
		assertEquals("redo target is v2", "v2", store.peekRedoTarget(DRAFT_ID).getContent());
		assertEquals("peeking leaves the cursor", 0, store.getCurrentIndex(DRAFT_ID));
	}

	@Test
	public void draftsAreIndependent() throws Exception {
		store.addRevision(DRAFT_ID, "a1", AUTHOR_ID, "1");
		store.addRevision(DRAFT_ID, "a2", AUTHOR_ID, "2");
		store.addRevision(OTHER_DRAFT_ID, "b1", AUTHOR_ID, "1");

		assertEquals("two drafts hold history", 2, store.getDraftCount());
		assertFalse("other draft has a single revision", store.canUndo(OTHER_DRAFT_ID));

		store.clear(DRAFT_ID);
		assertEquals("cleared draft has no revisions", 0, store.getRevisionCount(DRAFT_ID));
		assertEquals("cleared draft has cursor -1", -1, store.getCurrentIndex(DRAFT_ID));
		assertNull("cleared draft can't undo", store.undo(DRAFT_ID));
		assertEquals("other draft is untouched", "b1", store.getCurrentContent(OTHER_DRAFT_ID));
	}

	@Test
	public void revisionInfo() throws Exception {
		assertTrue("no info for an unknown draft", store.getRevisionInfo(DRAFT_ID).isEmpty());

		store.addRevision(DRAFT_ID, "A", AUTHOR_ID, "Initial content");
		store.addRevision(DRAFT_ID, "AB", AUTHOR_ID, "Applied section change", Collections.singleton(7L));

		List<RevisionInfo> info = store.getRevisionInfo(DRAFT_ID);
		assertEquals("one entry per revision", 2, info.size());
		assertEquals("oldest first", "Initial content", info.get(0).getDescription());
		assertEquals("applied ids carried through", Collections.singletonList(7L), info.get(1).getAppliedChangeIds());
		assertTrue("no dismissals", info.get(1).getDismissedChangeIds().isEmpty());
	}

	@Test(expected = IllegalArgumentException.class)
	public void rejectsNonPositiveMax() throws Exception {
		new RevisionStore(0);
	}
}
