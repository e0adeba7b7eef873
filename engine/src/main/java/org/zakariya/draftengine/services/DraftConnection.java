package org.zakariya.draftengine.services;

import org.zakariya.draftengine.transport.DraftEvent;

import java.io.IOException;
import java.time.Instant;
import java.util.concurrent.Executor;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * One live viewer of a draft. A user may hold several (e.g. one per browser tab); connections
 * are told apart by their sink. Sends run one at a time, in order, on the connection's own
 * sequential executor, so events and keep-alive frames never interleave on the sink and a slow
 * sink only holds up itself.
 */
public class DraftConnection {

	private final long draftId;
	private final long userId;
	private final EventSink sink;
	private final Instant connectedAt;
	private final Executor sendExecutor;
	private final AtomicInteger pendingSends = new AtomicInteger();
	private final AtomicBoolean removed = new AtomicBoolean(false);
	private volatile KeepAliveTimer keepAliveTimer;

	DraftConnection(long draftId, long userId, EventSink sink, Instant connectedAt, Executor sendExecutor) {
		this.draftId = draftId;
		this.userId = userId;
		this.sink = sink;
		this.connectedAt = connectedAt;
		this.sendExecutor = sendExecutor;
	}

	public long getDraftId() {
		return draftId;
	}

	public long getUserId() {
		return userId;
	}

	public EventSink getSink() {
		return sink;
	}

	public Instant getConnectedAt() {
		return connectedAt;
	}

	/**
	 * @return sends queued or in flight on this connection
	 */
	public int getPendingSends() {
		return pendingSends.get();
	}

	/**
	 * @return true once the registry has let go of this connection
	 */
	public boolean isRemoved() {
		return removed.get();
	}

	Executor getSendExecutor() {
		return sendExecutor;
	}

	int incrementPendingSends() {
		return pendingSends.incrementAndGet();
	}

	void decrementPendingSends() {
		pendingSends.decrementAndGet();
	}

	/**
	 * @return true only for the first call
	 */
	boolean markRemoved() {
		return removed.compareAndSet(false, true);
	}

	KeepAliveTimer getKeepAliveTimer() {
		return keepAliveTimer;
	}

	void setKeepAliveTimer(KeepAliveTimer keepAliveTimer) {
		this.keepAliveTimer = keepAliveTimer;
	}

	synchronized void send(DraftEvent event) throws IOException {
		sink.send(event);
	}

	synchronized void sendKeepAlive() throws IOException {
		sink.sendKeepAlive();
	}

	/**
	 * @return true if this call stopped the keep-alive timer
	 */
	boolean stopKeepAlive() {
		return keepAliveTimer != null && keepAliveTimer.cancel();
	}

	@Override
	public String toString() {
		return "DraftConnection{draft=" + draftId + ", user=" + userId + ", sink=" + sink + "}";
	}
}
