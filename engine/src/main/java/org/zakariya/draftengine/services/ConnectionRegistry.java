package org.zakariya.draftengine.services;

import com.google.common.util.concurrent.MoreExecutors;
import com.google.common.util.concurrent.ThreadFactoryBuilder;
import org.jetbrains.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.zakariya.draftengine.relay.DraftEventRelay;
import org.zakariya.draftengine.transport.DraftEvent;

import java.io.IOException;
import java.time.Clock;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.Executor;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;

/**
 * ConnectionRegistry
 * Tracks the live viewers of each draft and fans events out to them. Delivery is best effort: a
 * viewer that is disconnected misses events until it reconnects and re-fetches state, and a send
 * failing on one connection never stops delivery to the others.
 * <p>
 * Sends never run on the caller's thread. Each connection queues its frames on its own sequential
 * executor over a shared delivery pool, so a viewer whose transport blocks holds up only itself.
 * A connection whose send or keep-alive fails, whose sink reports closed, or which has more than
 * {@link #MAX_PENDING_SENDS} frames outstanding is dropped: it is removed, its keep-alive is
 * stopped, its sink is closed and the remaining viewers get user_left.
 * <p>
 * After local delivery an event is handed to the optional {@link DraftEventRelay} on a separate
 * executor, so viewers attached to other processes see it too. The caller of
 * {@link #broadcast(long, DraftEvent, Long)} never waits on, or hears about, the relay.
 */
public class ConnectionRegistry {

	private static final Logger logger = LoggerFactory.getLogger(ConnectionRegistry.class);

	public static final long DEFAULT_KEEP_ALIVE_MILLISECONDS = 30_000;
	static final int MAX_PENDING_SENDS = 64;

	private interface SendAction {
		void run() throws IOException;
	}

	private final ConcurrentMap<Long, List<DraftConnection>> connectionsByDraftId = new ConcurrentHashMap<>();
	private final ScheduledExecutorService keepAliveScheduler;
	private final boolean ownsKeepAliveScheduler;
	private final Executor deliveryExecutor;
	@Nullable
	private final ExecutorService ownedDeliveryExecutor;
	private final long keepAliveMilliseconds;
	@Nullable
	private final DraftEventRelay relay;
	private final Executor relayExecutor;
	private final Clock clock;

	/**
	 * Create a registry with its own keep-alive scheduler and delivery pool, and no relay.
	 */
	public ConnectionRegistry(long keepAliveMilliseconds) {
		this(keepAliveMilliseconds, null, Runnable::run);
	}

	/**
	 * Create a registry with its own keep-alive scheduler and delivery pool, relaying on the given executor.
	 */
	public ConnectionRegistry(long keepAliveMilliseconds, @Nullable DraftEventRelay relay, Executor relayExecutor) {
		this(createKeepAliveScheduler(), true, createDeliveryExecutor(), true, keepAliveMilliseconds, relay, relayExecutor, Clock.systemUTC());
	}

	/**
	 * @param keepAliveScheduler    runs keep-alive pings; not shut down by {@link #close()}
	 * @param deliveryExecutor      pool the per-connection send queues run on; not shut down by {@link #close()}
	 * @param keepAliveMilliseconds period between pings on each connection
	 * @param relay                 optional distributed relay
	 * @param relayExecutor         where relay publication runs
	 * @param clock                 source of event timestamps
	 */
	public ConnectionRegistry(ScheduledExecutorService keepAliveScheduler, Executor deliveryExecutor, long keepAliveMilliseconds,
	                          @Nullable DraftEventRelay relay, Executor relayExecutor, Clock clock) {
		this(keepAliveScheduler, false, deliveryExecutor, false, keepAliveMilliseconds, relay, relayExecutor, clock);
	}

	private ConnectionRegistry(ScheduledExecutorService keepAliveScheduler, boolean ownsKeepAliveScheduler,
	                           Executor deliveryExecutor, boolean ownsDeliveryExecutor, long keepAliveMilliseconds,
	                           @Nullable DraftEventRelay relay, Executor relayExecutor, Clock clock) {
		checkArgument(keepAliveMilliseconds > 0, "keep-alive interval must be positive");
		this.keepAliveScheduler = checkNotNull(keepAliveScheduler);
		this.ownsKeepAliveScheduler = ownsKeepAliveScheduler;
		this.deliveryExecutor = checkNotNull(deliveryExecutor);
		this.ownedDeliveryExecutor = ownsDeliveryExecutor ? (ExecutorService) deliveryExecutor : null;
		this.keepAliveMilliseconds = keepAliveMilliseconds;
		this.relay = relay;
		this.relayExecutor = checkNotNull(relayExecutor);
		this.clock = checkNotNull(clock);
	}

	private static ScheduledExecutorService createKeepAliveScheduler() {
		return Executors.newSingleThreadScheduledExecutor(new ThreadFactoryBuilder()
				.setNameFormat("draft-keep-alive-%d")
				.setDaemon(true)
				.build());
	}

	private static ExecutorService createDeliveryExecutor() {
		return Executors.newCachedThreadPool(new ThreadFactoryBuilder()
				.setNameFormat("draft-delivery-%d")
				.setDaemon(true)
				.build());
	}

	/**
	 * Register a viewer, start its keep-alive, and tell the draft's other viewers it joined.
	 *
	 * @return the new connection
	 */
	public DraftConnection connect(long draftId, long userId, EventSink sink) {
		checkNotNull(sink, "sink");

		DraftConnection connection = new DraftConnection(draftId, userId, sink, clock.instant(),
				MoreExecutors.newSequentialExecutor(deliveryExecutor));

		connectionsByDraftId.compute(draftId, (id, connections) -> {
			if (connections == null) {
				connections = new CopyOnWriteArrayList<>();
			}
			connections.add(connection);
			return connections;
		});

		connection.setKeepAliveTimer(KeepAliveTimer.start(keepAliveScheduler, () -> ping(connection), keepAliveMilliseconds));
		if (connection.isRemoved()) {
			// dropped before its timer existed
			connection.stopKeepAlive();
		}

		logger.info("connect draft: {} user: {} - draft now has {} connections", draftId, userId, getConnectionCount(draftId));

		// the new viewer fetches full state itself, so only the others are told
		DraftEvent joined = new DraftEvent.UserJoined(draftId, userId, clock.instant());
		deliver(draftId, joined, null, connection);
		publishToRelay(draftId, joined, null);
		return connection;
	}

	/**
	 * Remove the connection using this sink, stop its keep-alive, and tell the remaining viewers.
	 * Only the connection matching the sink is touched; the user's other connections stay. The sink
	 * itself is left to its transport.
	 *
	 * @return true if a connection was removed
	 */
	public boolean disconnect(long draftId, long userId, EventSink sink) {
		DraftConnection found = null;
		List<DraftConnection> connections = connectionsByDraftId.get(draftId);
		if (connections != null) {
			for (DraftConnection connection : connections) {
				if (connection.getSink() == sink) {
					found = connection;
					break;
				}
			}
		}

		if (found == null || !removeConnection(found)) {
			logger.debug("disconnect draft: {} user: {} - no connection for sink {}", draftId, userId, sink);
			return false;
		}

		found.stopKeepAlive();
		logger.info("disconnect draft: {} user: {} - draft now has {} connections", draftId, userId, getConnectionCount(draftId));

		broadcast(draftId, new DraftEvent.UserLeft(draftId, userId, clock.instant()));
		return true;
	}

	/**
	 * Deliver an event to every viewer of a draft.
	 */
	public void broadcast(long draftId, DraftEvent event) {
		broadcast(draftId, event, null);
	}

	/**
	 * Deliver an event to every viewer of a draft except those owned by excludeUserId, then hand it
	 * to the relay. A draft without viewers is not an error.
	 *
	 * @param draftId       the draft
	 * @param event         the event
	 * @param excludeUserId the originating user, who already has the change locally; may be null
	 */
	public void broadcast(long draftId, DraftEvent event, @Nullable Long excludeUserId) {
		deliverLocally(draftId, event, excludeUserId);
		publishToRelay(draftId, event, excludeUserId);
	}

	/**
	 * Deliver to this process's viewers only. Used for events arriving through the relay.
	 *
	 * @return number of connections the event was queued to
	 */
	public int deliverLocally(long draftId, DraftEvent event, @Nullable Long excludeUserId) {
		return deliver(draftId, event, excludeUserId, null);
	}

	private int deliver(long draftId, DraftEvent event, @Nullable Long excludeUserId, @Nullable DraftConnection skip) {
		List<DraftConnection> connections = connectionsByDraftId.get(draftId);
		if (connections == null) {
			return 0;
		}

		String what = event.getType().getWireName();
		int queued = 0;
		for (DraftConnection connection : connections) {
			if (connection == skip || (excludeUserId != null && connection.getUserId() == excludeUserId)) {
				continue;
			}

			if (!connection.getSink().isOpen()) {
				logger.debug("deliver - dropping closed connection {}", connection);
				drop(connection);
				continue;
			}

			if (dispatch(connection, what, () -> connection.send(event))) {
				queued++;
			}
		}

		logger.debug("deliver draft: {} event: {} - queued to {} connections", draftId, what, queued);
		return queued;
	}

	/**
	 * Queue a send on the connection's own executor. A failing send, or one more frame than
	 * {@link #MAX_PENDING_SENDS} waiting behind a stuck transport, drops the connection.
	 *
	 * @return true if the send was queued
	 */
	private boolean dispatch(DraftConnection connection, String what, SendAction action) {
		if (connection.isRemoved()) {
			return false;
		}

		if (connection.incrementPendingSends() > MAX_PENDING_SENDS) {
			connection.decrementPendingSends();
			logger.warn("{} has {} sends outstanding; dropping it", connection, MAX_PENDING_SENDS);
			drop(connection);
			return false;
		}

		try {
			connection.getSendExecutor().execute(() -> {
				try {
					if (!connection.isRemoved()) {
						action.run();
					}
				} catch (Exception e) {
					logger.error("Unable to send {} to {}; dropping it", what, connection, e);
					drop(connection);
				} finally {
					connection.decrementPendingSends();
				}
			});
			return true;
		} catch (RejectedExecutionException e) {
			connection.decrementPendingSends();
			logger.warn("Delivery executor rejected {} for {}", what, connection, e);
			return false;
		}
	}

	/**
	 * Give up on a connection whose transport is broken. Only the first caller for a given
	 * connection has any effect.
	 */
	private void drop(DraftConnection connection) {
		if (!removeConnection(connection)) {
			return;
		}

		connection.stopKeepAlive();
		try {
			connection.getSink().close();
		} catch (RuntimeException e) {
			logger.warn("Unable to close sink of {}", connection, e);
		}

		long draftId = connection.getDraftId();
		logger.info("drop draft: {} user: {} - draft now has {} connections", draftId, connection.getUserId(), getConnectionCount(draftId));

		broadcast(draftId, new DraftEvent.UserLeft(draftId, connection.getUserId(), clock.instant()));
	}

	/**
	 * @return true if this call removed the connection
	 */
	private boolean removeConnection(DraftConnection connection) {
		boolean[] removed = {false};
		connectionsByDraftId.computeIfPresent(connection.getDraftId(), (id, connections) -> {
			removed[0] = connections.remove(connection);
			return connections.isEmpty() ? null : connections;
		});
		return removed[0] && connection.markRemoved();
	}

	private void publishToRelay(long draftId, DraftEvent event, @Nullable Long excludeUserId) {
		if (relay == null) {
			return;
		}

		try {
			relayExecutor.execute(() -> {
				try {
					relay.publish(draftId, event, excludeUserId);
				} catch (RuntimeException e) {
					logger.warn("Failed to relay draft event: {}", event.getType().getWireName(), e);
				}
			});
		} catch (RejectedExecutionException e) {
			logger.warn("Relay executor rejected draft event: {}", event.getType().getWireName(), e);
		}
	}

	private void ping(DraftConnection connection) {
		if (connection.isRemoved()) {
			connection.stopKeepAlive();
			return;
		}

		if (!connection.getSink().isOpen()) {
			logger.debug("ping - dropping closed connection {}", connection);
			drop(connection);
			return;
		}

		// queued like any other frame, so a stuck transport never holds the scheduler thread
		dispatch(connection, "keep-alive", connection::sendKeepAlive);
	}

	/**
	 * @return number of live connections to a draft
	 */
	public int getConnectionCount(long draftId) {
		List<DraftConnection> connections = connectionsByDraftId.get(draftId);
		return connections != null ? connections.size() : 0;
	}

	/**
	 * @return ids of users viewing a draft, in order of first connection
	 */
	public Set<Long> getConnectedUserIds(long draftId) {
		List<DraftConnection> connections = connectionsByDraftId.get(draftId);
		if (connections == null) {
			return Collections.emptySet();
		}

		Set<Long> userIds = new LinkedHashSet<>();
		for (DraftConnection connection : connections) {
			userIds.add(connection.getUserId());
		}
		return userIds;
	}

	/**
	 * @return count of connections across all drafts. Since users may open several tabs, this may be larger than the number of users.
	 */
	public int getTotalConnectionCount() {
		int count = 0;
		for (List<DraftConnection> connections : connectionsByDraftId.values()) {
			count += connections.size();
		}
		return count;
	}

	/**
	 * Stop every keep-alive and forget all connections. Sinks are left to their transports.
	 */
	public void close() {
		for (List<DraftConnection> connections : connectionsByDraftId.values()) {
			for (DraftConnection connection : connections) {
				connection.markRemoved();
				connection.stopKeepAlive();
			}
		}
		connectionsByDraftId.clear();

		if (ownsKeepAliveScheduler) {
			keepAliveScheduler.shutdownNow();
		}

		if (ownedDeliveryExecutor != null) {
			ownedDeliveryExecutor.shutdownNow();
		}
	}
}
