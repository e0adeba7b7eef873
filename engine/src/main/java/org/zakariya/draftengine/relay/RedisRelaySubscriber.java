package org.zakariya.draftengine.relay;

import com.google.common.util.concurrent.ThreadFactoryBuilder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.zakariya.draftengine.services.ConnectionRegistry;
import org.zakariya.draftengine.transport.JsonCodec;
import redis.clients.jedis.Jedis;
import redis.clients.jedis.JedisPool;
import redis.clients.jedis.JedisPubSub;
import redis.clients.jedis.exceptions.JedisException;

import java.io.IOException;

/**
 * RedisRelaySubscriber
 * Listens on every draft channel and delivers events published by other processes to this
 * process's viewers. Envelopes stamped with our own origin were already delivered locally and
 * are ignored. The subscription runs on its own daemon thread and reconnects after failures.
 */
public class RedisRelaySubscriber {

	private static final Logger logger = LoggerFactory.getLogger(RedisRelaySubscriber.class);
	private static final long RECONNECT_DELAY_MILLISECONDS = 2000;

	private final JedisPool jedisPool;
	private final String channelPrefix;
	private final String origin;
	private final ConnectionRegistry connectionRegistry;
	private final JedisPubSub pubSub;
	private Thread thread;
	private volatile boolean running;

	public RedisRelaySubscriber(JedisPool jedisPool, String channelPrefix, String origin, ConnectionRegistry connectionRegistry) {
		this.jedisPool = jedisPool;
		this.channelPrefix = channelPrefix;
		this.origin = origin;
		this.connectionRegistry = connectionRegistry;
		this.pubSub = new JedisPubSub() {
			@Override
			public void onPMessage(String pattern, String channel, String message) {
				handleMessage(message);
			}
		};
	}

	public synchronized void start() {
		if (running) {
			return;
		}

		running = true;
		thread = new ThreadFactoryBuilder()
				.setNameFormat("draft-relay-subscriber-%d")
				.setDaemon(true)
				.build()
				.newThread(this::run);
		thread.start();
	}

	public synchronized void stop() {
		running = false;
		if (pubSub.isSubscribed()) {
			pubSub.punsubscribe();
		}
		if (thread != null) {
			thread.interrupt();
			thread = null;
		}
	}

	public boolean isRunning() {
		return running;
	}

	private void run() {
		String pattern = RedisDraftEventRelay.getChannelPattern(channelPrefix);
		while (running) {
			try (Jedis jedis = jedisPool.getResource()) {
				logger.info("Subscribing to draft relay channels {}", pattern);
				// blocks until punsubscribe
				jedis.psubscribe(pubSub, pattern);
			} catch (JedisException e) {
				if (!running) {
					break;
				}
				logger.warn("Draft relay subscription failed, retrying in {}ms", RECONNECT_DELAY_MILLISECONDS, e);
				try {
					Thread.sleep(RECONNECT_DELAY_MILLISECONDS);
				} catch (InterruptedException ie) {
					Thread.currentThread().interrupt();
					break;
				}
			}
		}
		logger.info("Draft relay subscriber stopped");
	}

	/**
	 * Deliver one relayed message locally.
	 *
	 * @param message a JSON {@link RelayEnvelope}
	 * @return number of local connections the event reached
	 */
	int handleMessage(String message) {
		RelayEnvelope envelope;
		try {
			envelope = JsonCodec.fromJson(message, RelayEnvelope.class);
		} catch (IOException e) {
			logger.error("Unable to parse relayed draft event, dropping it: {}", message, e);
			return 0;
		}

		if (envelope.getEvent() == null) {
			logger.error("Relayed envelope of type {} carried no event, dropping it", envelope.getEventType());
			return 0;
		}

		if (origin.equals(envelope.getOrigin())) {
			return 0;
		}

		return connectionRegistry.deliverLocally(envelope.getDraftId(), envelope.getEvent(), envelope.getExcludeUserId());
	}
}
