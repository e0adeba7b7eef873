package org.zakariya.draftengine.session;

import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

/**
 * One lock per draft. Operations against the same draft run one at a time, in arrival order;
 * operations against different drafts never wait on each other.
 * <p>
 * A draft's lock exists only while some thread holds it or waits for it, so drafts that are no
 * longer edited, or were never real, leave nothing behind.
 */
public class DraftLocks {

	private static final boolean LOCK_IS_FAIR = true;

	private static final class LockEntry {
		final ReentrantLock lock = new ReentrantLock(LOCK_IS_FAIR);

		// threads holding or waiting; guarded by the map's per-key compute
		int users;
	}

	private final ConcurrentMap<Long, LockEntry> locksByDraftId = new ConcurrentHashMap<>();

	public <T> T withLock(long draftId, Supplier<T> operation) {
		LockEntry entry = acquire(draftId);
		try {
			entry.lock.lock();
			try {
				return operation.get();
			} finally {
				entry.lock.unlock();
			}
		} finally {
			release(draftId);
		}
	}

	public void withLock(long draftId, Runnable operation) {
		withLock(draftId, () -> {
			operation.run();
			return null;
		});
	}

	/**
	 * @return true if some thread currently holds the draft's lock
	 */
	public boolean isLocked(long draftId) {
		LockEntry entry = locksByDraftId.get(draftId);
		return entry != null && entry.lock.isLocked();
	}

	/**
	 * @return number of drafts with a lock currently held or awaited
	 */
	public int getLockCount() {
		return locksByDraftId.size();
	}

	private LockEntry acquire(long draftId) {
		return locksByDraftId.compute(draftId, (id, entry) -> {
			if (entry == null) {
				entry = new LockEntry();
			}
			entry.users++;
			return entry;
		});
	}

	private void release(long draftId) {
		locksByDraftId.computeIfPresent(draftId, (id, entry) -> --entry.users == 0 ? null : entry);
	}
}
