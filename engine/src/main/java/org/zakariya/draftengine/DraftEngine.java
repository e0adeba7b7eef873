package org.zakariya.draftengine;

import com.google.common.util.concurrent.ThreadFactoryBuilder;
import org.jetbrains.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.zakariya.draftengine.changes.SectionChangeCoordinator;
import org.zakariya.draftengine.changes.SectionChangeStore;
import org.zakariya.draftengine.changes.SectionMarkup;
import org.zakariya.draftengine.drafts.DiffProvider;
import org.zakariya.draftengine.drafts.DraftStore;
import org.zakariya.draftengine.drafts.LineDiffProvider;
import org.zakariya.draftengine.history.EditHistoryStore;
import org.zakariya.draftengine.relay.RedisDraftEventRelay;
import org.zakariya.draftengine.relay.RedisRelaySubscriber;
import org.zakariya.draftengine.revisions.RevisionStore;
import org.zakariya.draftengine.services.ConnectionRegistry;
import org.zakariya.draftengine.session.DraftLocks;
import org.zakariya.draftengine.session.EditSessionOrchestrator;
import org.zakariya.draftengine.util.Configuration;
import redis.clients.jedis.JedisPool;
import redis.clients.jedis.JedisPoolConfig;

import java.time.Clock;
import java.util.UUID;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

/**
 * DraftEngine
 * Assembles the collaborative draft engine for one process from a {@link Configuration} and the
 * host application's storage and markup collaborators. All engine state is owned by the
 * instance and lives until {@link #close()}.
 * <p>
 * Configuration read:
 * <pre>
 * revisions/maxPerDraft         maximum revisions kept per draft (50)
 * connections/keepAliveSeconds  keep-alive period per viewer connection (30)
 * relay/enabled                 relay events to other processes through redis (false)
 * relay/redis/host              redis host
 * relay/redis/port              redis port (redis default)
 * relay/channelPrefix           namespace of the relay channels ("draft-engine")
 * </pre>
 */
public class DraftEngine implements AutoCloseable {

	private static final Logger logger = LoggerFactory.getLogger(DraftEngine.class);

	public static final String DEFAULT_CONFIGURATION_RESOURCE = "draft-engine.json";
	static final String DEFAULT_CHANNEL_PREFIX = "draft-engine";
	static final int DEFAULT_KEEP_ALIVE_SECONDS = 30;

	private final String origin;
	private final RevisionStore revisionStore;
	private final ConnectionRegistry connectionRegistry;
	private final EditSessionOrchestrator orchestrator;
	@Nullable
	private final JedisPool jedisPool;
	@Nullable
	private final ExecutorService relayExecutor;
	@Nullable
	private final RedisRelaySubscriber relaySubscriber;

	private DraftEngine(String origin,
	                    RevisionStore revisionStore,
	                    ConnectionRegistry connectionRegistry,
	                    EditSessionOrchestrator orchestrator,
	                    @Nullable JedisPool jedisPool,
	                    @Nullable ExecutorService relayExecutor,
	                    @Nullable RedisRelaySubscriber relaySubscriber) {
		this.origin = origin;
		this.revisionStore = revisionStore;
		this.connectionRegistry = connectionRegistry;
		this.orchestrator = orchestrator;
		this.jedisPool = jedisPool;
		this.relayExecutor = relayExecutor;
		this.relaySubscriber = relaySubscriber;
	}

	/**
	 * Build an engine using the default line diff.
	 */
	public static DraftEngine create(Configuration configuration, DraftStore draftStore, SectionChangeStore changeStore, SectionMarkup markup) {
		return create(configuration, draftStore, changeStore, markup, new LineDiffProvider());
	}

	public static DraftEngine create(Configuration configuration, DraftStore draftStore, SectionChangeStore changeStore,
	                                 SectionMarkup markup, DiffProvider diffProvider) {
		return create(configuration, draftStore, changeStore, markup, diffProvider, null);
	}

	/**
	 * @param editHistoryStore where the per-draft edit audit trail is kept; null to keep none
	 */
	public static DraftEngine create(Configuration configuration, DraftStore draftStore, SectionChangeStore changeStore,
	                                 SectionMarkup markup, DiffProvider diffProvider, @Nullable EditHistoryStore editHistoryStore) {
		String origin = UUID.randomUUID().toString();
		Clock clock = Clock.systemUTC();

		int maxRevisions = configuration.getInt("revisions/maxPerDraft", RevisionStore.DEFAULT_MAX_REVISIONS);
		long keepAliveMillis = configuration.getLong("connections/keepAliveSeconds", DEFAULT_KEEP_ALIVE_SECONDS) * 1000L;
		logger.info("Starting DraftEngine {} - maxRevisions: {} keepAlive: {}ms editHistory: {}",
				origin, maxRevisions, keepAliveMillis, editHistoryStore != null);

		RevisionStore revisionStore = new RevisionStore(maxRevisions, clock);

		JedisPool jedisPool = null;
		ExecutorService relayExecutor = null;
		RedisRelaySubscriber relaySubscriber = null;
		ConnectionRegistry connectionRegistry;

		if (configuration.getBoolean("relay/enabled", false)) {
			String channelPrefix = configuration.get("relay/channelPrefix", DEFAULT_CHANNEL_PREFIX);
			jedisPool = buildJedisPool(configuration);
			relayExecutor = Executors.newSingleThreadExecutor(new ThreadFactoryBuilder()
					.setNameFormat("draft-relay-%d")
					.setDaemon(true)
					.build());

			RedisDraftEventRelay relay = new RedisDraftEventRelay(jedisPool, channelPrefix, origin);
			connectionRegistry = new ConnectionRegistry(keepAliveMillis, relay, relayExecutor);

			relaySubscriber = new RedisRelaySubscriber(jedisPool, channelPrefix, origin, connectionRegistry);
			relaySubscriber.start();
		} else {
			logger.info("Draft event relay disabled; events reach this process's viewers only");
			connectionRegistry = new ConnectionRegistry(keepAliveMillis);
		}

		SectionChangeCoordinator coordinator = new SectionChangeCoordinator(revisionStore, changeStore, markup, draftStore, clock);
		EditSessionOrchestrator orchestrator = new EditSessionOrchestrator(revisionStore, coordinator, connectionRegistry,
				draftStore, changeStore, markup, diffProvider, new DraftLocks(), editHistoryStore, clock);

		return new DraftEngine(origin, revisionStore, connectionRegistry, orchestrator, jedisPool, relayExecutor, relaySubscriber);
	}

	/**
	 * Load the packaged defaults, then layer any files given on top.
	 */
	public static Configuration loadConfiguration(String... overridePaths) {
		Configuration configuration = new Configuration();
		configuration.addConfigJsonResource(DEFAULT_CONFIGURATION_RESOURCE);
		for (String path : overridePaths) {
			configuration.addConfigJsonFilePath(path);
		}
		return configuration;
	}

	static JedisPool buildJedisPool(Configuration configuration) {
		JedisPoolConfig jedisPoolConfig = new JedisPoolConfig();
		jedisPoolConfig.setMaxTotal(configuration.getInt("relay/redis/maxConnections", 16));
		jedisPoolConfig.setBlockWhenExhausted(true);

		String redisHost = configuration.get("relay/redis/host", "localhost");
		int redisPort = configuration.getInt("relay/redis/port", -1);
		if (redisPort != -1) {
			logger.info("Building jedisPool with host {} and port {}", redisHost, redisPort);
			return new JedisPool(jedisPoolConfig, redisHost, redisPort);
		} else {
			logger.info("Building jedisPool with host {} and default port", redisHost);
			return new JedisPool(jedisPoolConfig, redisHost);
		}
	}

	/**
	 * @return id of this process on the relay
	 */
	public String getOrigin() {
		return origin;
	}

	public EditSessionOrchestrator getOrchestrator() {
		return orchestrator;
	}

	public RevisionStore getRevisionStore() {
		return revisionStore;
	}

	public ConnectionRegistry getConnectionRegistry() {
		return connectionRegistry;
	}

	public boolean isRelayEnabled() {
		return relaySubscriber != null;
	}

	@Override
	public void close() {
		logger.info("Stopping DraftEngine {}", origin);

		if (relaySubscriber != null) {
			relaySubscriber.stop();
		}

		connectionRegistry.close();
		revisionStore.clearAll();

		if (relayExecutor != null) {
			relayExecutor.shutdown();
		}

		if (jedisPool != null) {
			jedisPool.close();
		}
	}
}
