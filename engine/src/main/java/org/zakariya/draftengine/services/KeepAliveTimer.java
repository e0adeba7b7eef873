package org.zakariya.draftengine.services;

import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * A periodic task bound to the lifetime of one connection. Cancellation is idempotent and only
 * the first call reports having cancelled anything.
 */
public class KeepAliveTimer {

	private final ScheduledFuture<?> future;
	private final AtomicBoolean cancelled = new AtomicBoolean(false);

	private KeepAliveTimer(ScheduledFuture<?> future) {
		this.future = future;
	}

	/**
	 * Start running ping every intervalMilliseconds, first run after one interval.
	 *
	 * @param scheduler            the scheduler to run on
	 * @param ping                 the task; it must not throw, or the scheduler stops repeating it
	 * @param intervalMilliseconds period between runs
	 * @return a running timer
	 */
	public static KeepAliveTimer start(ScheduledExecutorService scheduler, Runnable ping, long intervalMilliseconds) {
		ScheduledFuture<?> future = scheduler.scheduleAtFixedRate(ping, intervalMilliseconds, intervalMilliseconds, TimeUnit.MILLISECONDS);
		return new KeepAliveTimer(future);
	}

	/**
	 * @return true if this call stopped the timer, false if it was already stopped
	 */
	public boolean cancel() {
		if (cancelled.compareAndSet(false, true)) {
			future.cancel(false);
			return true;
		}
		return false;
	}

	public boolean isCancelled() {
		return cancelled.get();
	}
}
