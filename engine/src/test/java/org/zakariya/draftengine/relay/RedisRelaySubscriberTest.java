package org.zakariya.draftengine.relay;

import com.google.common.util.concurrent.MoreExecutors;
import org.junit.After;
import org.junit.Before;
import org.junit.Test;
import org.zakariya.draftengine.fakes.RecordingSink;
import org.zakariya.draftengine.services.ConnectionRegistry;
import org.zakariya.draftengine.transport.DraftEvent;
import org.zakariya.draftengine.transport.JsonCodec;
import redis.clients.jedis.JedisPool;

import java.time.Clock;
import java.time.Instant;
import java.util.Collections;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;

import static org.junit.Assert.*;

/**
 * Test org.zakariya.draftengine.relay.RedisRelaySubscriber message handling. No redis server
 * is needed; the pool is never asked for a connection.
 */
public class RedisRelaySubscriberTest {

	private static final String PREFIX = "test";
	private static final String LOCAL_ORIGIN = "local";
	private static final String REMOTE_ORIGIN = "remote";
	private static final long DRAFT_ID = 1;
	private static final long USER_1 = 10;
	private static final long USER_2 = 20;
	private static final Instant NOW = Instant.parse("2024-03-01T12:00:00Z");

	private ScheduledExecutorService scheduler;
	private JedisPool jedisPool;
	private ConnectionRegistry registry;
	private RedisRelaySubscriber subscriber;
	private RecordingSink user1Sink;
	private RecordingSink user2Sink;

	@Before
	public void setUp() throws Exception {
		jedisPool = new JedisPool("localhost", 6379);
		scheduler = Executors.newSingleThreadScheduledExecutor();
		registry = new ConnectionRegistry(scheduler, MoreExecutors.directExecutor(), ConnectionRegistry.DEFAULT_KEEP_ALIVE_MILLISECONDS,
				null, Runnable::run, Clock.systemUTC());
		subscriber = new RedisRelaySubscriber(jedisPool, PREFIX, LOCAL_ORIGIN, registry);

		user1Sink = new RecordingSink("user1");
		user2Sink = new RecordingSink("user2");
		registry.connect(DRAFT_ID, USER_1, user1Sink);
		registry.connect(DRAFT_ID, USER_2, user2Sink);
	}

	@After
	public void tearDown() throws Exception {
		registry.close();
		scheduler.shutdownNow();
		jedisPool.close();
	}

	private static String envelope(String origin, DraftEvent event, Long excludeUserId) throws Exception {
		return JsonCodec.toJson(new RelayEnvelope(origin, DRAFT_ID, event, excludeUserId));
	}

	@Test
	public void remoteEventDeliveredLocally() throws Exception {
		int before = user1Sink.getEvents().size();

		int delivered = subscriber.handleMessage(envelope(REMOTE_ORIGIN, new DraftEvent.SectionChangeApplied(DRAFT_ID, 7, NOW), null));

		assertEquals("both local viewers reached", 2, delivered);
		DraftEvent received = user1Sink.getEvents().get(before);
		assertEquals("event kind preserved", DraftEvent.Type.SECTION_CHANGE_APPLIED, received.getType());
		assertEquals("change id preserved", 7, ((DraftEvent.SectionChangeApplied) received).getChangeId());
	}

	@Test
	public void exclusionHonouredAcrossProcesses() throws Exception {
		int before = user1Sink.getEvents().size();

		int delivered = subscriber.handleMessage(envelope(REMOTE_ORIGIN, new DraftEvent.ContentUpdate(DRAFT_ID, USER_1,
				Collections.emptyList(), NOW), USER_1));

		assertEquals("only the other user reached", 1, delivered);
		assertEquals("editor's local tab gets nothing", before, user1Sink.getEvents().size());
	}

	@Test
	public void ownPublicationsIgnored() throws Exception {
		int delivered = subscriber.handleMessage(envelope(LOCAL_ORIGIN, new DraftEvent.SectionChangeApplied(DRAFT_ID, 7, NOW), null));
		assertEquals("own events were already delivered locally", 0, delivered);
	}

	@Test
	public void malformedMessagesDropped() throws Exception {
		assertEquals("garbage is dropped", 0, subscriber.handleMessage("not json"));
		assertEquals("envelope without event is dropped", 0,
				subscriber.handleMessage("{\"origin\":\"remote\",\"draftId\":1,\"eventType\":\"user_joined\"}"));
	}

	@Test
	public void channelNames() throws Exception {
		assertEquals("per-draft channel", "test/drafts/12", RedisDraftEventRelay.getChannel(PREFIX, 12));
		assertEquals("pattern covers every draft", "test/drafts/*", RedisDraftEventRelay.getChannelPattern(PREFIX));
	}
}
