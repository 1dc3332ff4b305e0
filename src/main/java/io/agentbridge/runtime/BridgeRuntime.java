package io.agentbridge.runtime;

import io.agentbridge.a2a.A2AClient;
import io.agentbridge.a2a.SubscriptionHub;
import io.agentbridge.adapter.AdapterRegistry;
import io.agentbridge.chain.ToolChainExecutor;
import io.agentbridge.config.BridgeConfig;
import io.agentbridge.config.BridgeSettings;
import io.agentbridge.health.HealthAggregator;
import io.agentbridge.observability.AuditLogger;
import io.agentbridge.storage.Database;
import io.agentbridge.storage.MessageStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Map;

public final class BridgeRuntime implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(BridgeRuntime.class);

    private final BridgeConfig config;
    private final BridgeSettings settings;
    private final Database database;
    private final MessageStore messageStore;
    private final SubscriptionHub subscriptions;
    private final A2AClient a2a;
    private final AdapterRegistry adapters;
    private final ToolChainExecutor chains;
    private final HealthAggregator health;
    private final AuditLogger auditLogger;

    public BridgeRuntime(BridgeConfig config) {
        this(config, BridgeSettings.load(config.settingsFile()));
    }

    public BridgeRuntime(BridgeConfig config, BridgeSettings settings) {
        this(config, settings, AdapterRegistry.fromSettings(settings));
    }

    public BridgeRuntime(BridgeConfig config, BridgeSettings settings, AdapterRegistry adapters) {
        this.config = config;
        this.settings = settings;
        this.database = new Database(config);
        this.messageStore = new MessageStore(database);
        this.subscriptions = new SubscriptionHub(settings.subscriberQueueCapacity());
        this.a2a = new A2AClient(messageStore, subscriptions, settings);
        this.adapters = adapters;
        this.chains = new ToolChainExecutor(adapters, Duration.ofMillis(settings.chainStepTimeoutMs()), settings.maxChainSteps());
        this.health = new HealthAggregator(adapters, a2a, Duration.ofMillis(settings.healthProbeTimeoutMs()));
        this.auditLogger = new AuditLogger(config.auditFile(), settings.auditSecret());
    }

    public void init() {
        database.init();
        log.info("AgentBridge initialized at {} (adapters configured: {})", config.rootDir(), configuredAdapters());
    }

    public BridgeConfig config() {
        return config;
    }

    public BridgeSettings settings() {
        return settings;
    }

    public Database database() {
        return database;
    }

    public SubscriptionHub subscriptions() {
        return subscriptions;
    }

    public A2AClient a2a() {
        return a2a;
    }

    public AdapterRegistry adapters() {
        return adapters;
    }

    public ToolChainExecutor chains() {
        return chains;
    }

    public HealthAggregator health() {
        return health;
    }

    public AuditLogger auditLogger() {
        return auditLogger;
    }

    public void audit(String action, String actor, String resource, String result, String requestId, Map<String, Object> details) {
        auditLogger.log(AuditLogger.AuditEvent.of(action, actor, resource, result, requestId, details));
    }

    private String configuredAdapters() {
        StringBuilder sb = new StringBuilder();
        adapters.adapters().forEach(a -> {
            if (a.configured()) {
                sb.append(sb.length() == 0 ? "" : ",").append(a.name());
            }
        });
        return sb.length() == 0 ? "none" : sb.toString();
    }

    @Override
    public void close() {
        chains.close();
        health.close();
    }
}
