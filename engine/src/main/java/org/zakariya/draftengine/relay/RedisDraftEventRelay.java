package org.zakariya.draftengine.relay;

import com.fasterxml.jackson.core.JsonProcessingException;
import org.jetbrains.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.zakariya.draftengine.transport.DraftEvent;
import org.zakariya.draftengine.transport.JsonCodec;
import redis.clients.jedis.Jedis;
import redis.clients.jedis.JedisPool;

/**
 * Relays draft events over Redis pub/sub, one channel per draft under a shared prefix:
 * "prefix/drafts/draftId". Processes pick them up with {@link RedisRelaySubscriber}.
 */
public class RedisDraftEventRelay implements DraftEventRelay {

	private static final Logger logger = LoggerFactory.getLogger(RedisDraftEventRelay.class);

	private final JedisPool jedisPool;
	private final String channelPrefix;
	private final String origin;

	/**
	 * @param jedisPool     pool brokering access to redis
	 * @param channelPrefix the namespace all draft channels live under
	 * @param origin        unique id of this process, stamped on every envelope
	 */
	public RedisDraftEventRelay(JedisPool jedisPool, String channelPrefix, String origin) {
		this.jedisPool = jedisPool;
		this.channelPrefix = channelPrefix;
		this.origin = origin;
	}

	public String getOrigin() {
		return origin;
	}

	static String getChannel(String channelPrefix, long draftId) {
		return channelPrefix + "/drafts/" + draftId;
	}

	static String getChannelPattern(String channelPrefix) {
		return channelPrefix + "/drafts/*";
	}

	@Override
	public void publish(long draftId, DraftEvent event, @Nullable Long excludeUserId) {
		String message;
		try {
			message = JsonCodec.toJson(new RelayEnvelope(origin, draftId, event, excludeUserId));
		} catch (JsonProcessingException e) {
			logger.error("Unable to serialize {} for relay", event, e);
			return;
		}

		try (Jedis jedis = jedisPool.getResource()) {
			long receivers = jedis.publish(getChannel(channelPrefix, draftId), message);
			logger.debug("publish draft: {} event: {} - {} subscribers", draftId, event.getType().getWireName(), receivers);
		}
	}
}
