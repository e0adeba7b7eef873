package org.zakariya.draftengine.session;

import org.junit.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.Assert.*;

/**
 * Test org.zakariya.draftengine.session.DraftLocks
 */
public class DraftLocksTest {

	@Test
	public void serializesSameDraft() throws Exception {
		DraftLocks locks = new DraftLocks();
		AtomicInteger inside = new AtomicInteger();
		AtomicInteger maxInside = new AtomicInteger();
		List<Integer> order = new ArrayList<>();

		ExecutorService executor = Executors.newFixedThreadPool(4);
		for (int i = 0; i < 20; i++) {
			int n = i;
			executor.execute(() -> locks.withLock(1, () -> {
				int now = inside.incrementAndGet();
				maxInside.accumulateAndGet(now, Math::max);
				order.add(n);
				try {
					Thread.sleep(5);
				} catch (InterruptedException e) {
					Thread.currentThread().interrupt();
				}
				inside.decrementAndGet();
			}));
		}

		executor.shutdown();
		assertTrue("all operations should finish", executor.awaitTermination(10, TimeUnit.SECONDS));
		assertEquals("only one operation at a time per draft", 1, maxInside.get());
		assertEquals("every operation ran", 20, order.size());
		assertEquals("no lock kept once every operation is done", 0, locks.getLockCount());
	}

	@Test
	public void lockIsDroppedWhenUnused() throws Exception {
		DraftLocks locks = new DraftLocks();
		for (long draftId = 1; draftId <= 100; draftId++) {
			long id = draftId;
			assertEquals("operation result passes through", Long.valueOf(id), locks.withLock(id, () -> id));
		}
		assertEquals("no locks left behind", 0, locks.getLockCount());
		assertFalse("unknown draft is not locked", locks.isLocked(1));
	}

	@Test
	public void lockIsDroppedWhenOperationThrows() throws Exception {
		DraftLocks locks = new DraftLocks();
		try {
			locks.withLock(1, () -> {
				throw new IllegalStateException("boom");
			});
			fail("operation's exception should propagate");
		} catch (IllegalStateException expected) {
		}
		assertEquals("lock released and dropped", 0, locks.getLockCount());
	}

	@Test
	public void reentrantUseKeepsLockUntilOutermostReturns() throws Exception {
		DraftLocks locks = new DraftLocks();
		locks.withLock(1, () -> {
			locks.withLock(1, () -> assertEquals("one lock for the draft", 1, locks.getLockCount()));
			assertTrue("outer still holds the lock", locks.isLocked(1));
		});
		assertEquals("dropped after the outermost call", 0, locks.getLockCount());
	}

	@Test
	public void differentDraftsDoNotBlock() throws Exception {
		DraftLocks locks = new DraftLocks();
		CountDownLatch holding = new CountDownLatch(1);
		CountDownLatch release = new CountDownLatch(1);

		Thread holder = new Thread(() -> locks.withLock(1, () -> {
			holding.countDown();
			try {
				release.await();
			} catch (InterruptedException e) {
				Thread.currentThread().interrupt();
			}
		}));
		holder.start();
		assertTrue("holder should take the lock", holding.await(5, TimeUnit.SECONDS));

		assertTrue("draft 1 is locked", locks.isLocked(1));
		assertFalse("draft 2 is not", locks.isLocked(2));
		assertEquals("draft 2 runs while draft 1 is held", "ran", locks.withLock(2, () -> "ran"));

		release.countDown();
		holder.join(5000);
		assertFalse("draft 1 released", locks.isLocked(1));
	}
}
