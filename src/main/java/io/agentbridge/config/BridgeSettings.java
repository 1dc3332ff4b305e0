package io.agentbridge.config;

import io.agentbridge.util.Jsons;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.function.Function;

public record BridgeSettings(
        int gatewayPort,
        int gatewayThreads,
        long adapterTimeoutMs,
        long healthProbeTimeoutMs,
        long chainStepTimeoutMs,
        int maxChainSteps,
        int defaultInboxLimit,
        int maxInboxLimit,
        int retentionDays,
        int subscriberQueueCapacity,
        String auditSecret,
        PlatformSettings github,
        PlatformSettings vercel,
        PlatformSettings railway,
        PlatformSettings supabase
) {
    public static final int DEFAULT_GATEWAY_PORT = 3050;
    public static final int DEFAULT_GATEWAY_THREADS = 8;
    public static final long DEFAULT_ADAPTER_TIMEOUT_MS = 30_000L;
    public static final long DEFAULT_HEALTH_PROBE_TIMEOUT_MS = 5_000L;
    public static final long DEFAULT_CHAIN_STEP_TIMEOUT_MS = 60_000L;
    public static final int DEFAULT_MAX_CHAIN_STEPS = 50;
    public static final int DEFAULT_INBOX_LIMIT = 50;
    public static final int DEFAULT_MAX_INBOX_LIMIT = 500;
    public static final int DEFAULT_RETENTION_DAYS = 30;
    public static final int DEFAULT_SUBSCRIBER_QUEUE_CAPACITY = 256;
    public static final int DEFAULT_GITHUB_RATE_LIMIT_BUFFER = 100;
    public static final int DEFAULT_VERCEL_RATE_LIMIT_BUFFER = 10;
    private static final long MIN_TIMEOUT_MS = 1_000L;

    public static BridgeSettings defaults() {
        return new BridgeSettings(
                DEFAULT_GATEWAY_PORT,
                DEFAULT_GATEWAY_THREADS,
                DEFAULT_ADAPTER_TIMEOUT_MS,
                DEFAULT_HEALTH_PROBE_TIMEOUT_MS,
                DEFAULT_CHAIN_STEP_TIMEOUT_MS,
                DEFAULT_MAX_CHAIN_STEPS,
                DEFAULT_INBOX_LIMIT,
                DEFAULT_MAX_INBOX_LIMIT,
                DEFAULT_RETENTION_DAYS,
                DEFAULT_SUBSCRIBER_QUEUE_CAPACITY,
                "",
                new PlatformSettings("https://api.github.com", "", null, DEFAULT_GITHUB_RATE_LIMIT_BUFFER),
                new PlatformSettings("https://api.vercel.com", "", null, DEFAULT_VERCEL_RATE_LIMIT_BUFFER),
                new PlatformSettings("https://backboard.railway.app/graphql/v2", "", null, 0),
                new PlatformSettings("", "", null, 0)
        );
    }

    /**
     * Loads settings from {@code file} when it exists, then applies credential
     * overrides from {@code env}. Missing or null file fields keep their defaults.
     */
    public static BridgeSettings load(Path file, Function<String, String> env) {
        BridgeSettings base = defaults();
        if (file != null && Files.isRegularFile(file)) {
            try {
                SettingsFile parsed = Jsons.mapper().readValue(file.toFile(), SettingsFile.class);
                base = fromFile(parsed, base);
            } catch (IOException e) {
                throw new IllegalStateException("Failed to read settings file: " + file, e);
            }
        }
        return base.withEnvironment(env == null ? key -> null : env);
    }

    public static BridgeSettings load(Path file) {
        return load(file, System::getenv);
    }

    BridgeSettings withEnvironment(Function<String, String> env) {
        String deploymentToken = env.apply("DEPLOYMENT_PLATFORM_TOKEN");
        PlatformSettings gh = override(github, env.apply("GITHUB_TOKEN"), null);
        PlatformSettings vc = override(vercel, firstNonBlank(env.apply("VERCEL_TOKEN"), deploymentToken), null);
        String teamId = env.apply("VERCEL_TEAM_ID");
        if (teamId != null && !teamId.isBlank()) {
            vc = vc.withTeamId(teamId.trim());
        }
        PlatformSettings rw = override(railway, firstNonBlank(env.apply("RAILWAY_TOKEN"), deploymentToken), null);
        PlatformSettings sb = override(supabase, env.apply("SUPABASE_SERVICE_KEY"), env.apply("SUPABASE_URL"));
        String secret = firstNonBlank(env.apply("AGENTBRIDGE_AUDIT_SECRET"), auditSecret);
        return new BridgeSettings(
                gatewayPort,
                gatewayThreads,
                adapterTimeoutMs,
                healthProbeTimeoutMs,
                chainStepTimeoutMs,
                maxChainSteps,
                defaultInboxLimit,
                maxInboxLimit,
                retentionDays,
                subscriberQueueCapacity,
                secret == null ? "" : secret,
                gh,
                vc,
                rw,
                sb
        );
    }

    public BridgeSettings withPlatforms(
            PlatformSettings github,
            PlatformSettings vercel,
            PlatformSettings railway,
            PlatformSettings supabase
    ) {
        return new BridgeSettings(
                gatewayPort,
                gatewayThreads,
                adapterTimeoutMs,
                healthProbeTimeoutMs,
                chainStepTimeoutMs,
                maxChainSteps,
                defaultInboxLimit,
                maxInboxLimit,
                retentionDays,
                subscriberQueueCapacity,
                auditSecret,
                github,
                vercel,
                railway,
                supabase
        );
    }

    public BridgeSettings withTimeouts(long adapterTimeoutMs, long healthProbeTimeoutMs, long chainStepTimeoutMs) {
        return new BridgeSettings(
                gatewayPort,
                gatewayThreads,
                Math.max(MIN_TIMEOUT_MS, adapterTimeoutMs),
                Math.max(MIN_TIMEOUT_MS, healthProbeTimeoutMs),
                Math.max(MIN_TIMEOUT_MS, chainStepTimeoutMs),
                maxChainSteps,
                defaultInboxLimit,
                maxInboxLimit,
                retentionDays,
                subscriberQueueCapacity,
                auditSecret,
                github,
                vercel,
                railway,
                supabase
        );
    }

    private static BridgeSettings fromFile(SettingsFile f, BridgeSettings d) {
        int maxInbox = Math.max(1, valueOr(f.maxInboxLimit(), d.maxInboxLimit()));
        return new BridgeSettings(
                clamp(valueOr(f.gatewayPort(), d.gatewayPort()), 0, 65_535),
                Math.max(1, valueOr(f.gatewayThreads(), d.gatewayThreads())),
                Math.max(MIN_TIMEOUT_MS, valueOr(f.adapterTimeoutMs(), d.adapterTimeoutMs())),
                Math.max(MIN_TIMEOUT_MS, valueOr(f.healthProbeTimeoutMs(), d.healthProbeTimeoutMs())),
                Math.max(MIN_TIMEOUT_MS, valueOr(f.chainStepTimeoutMs(), d.chainStepTimeoutMs())),
                Math.max(1, valueOr(f.maxChainSteps(), d.maxChainSteps())),
                clamp(valueOr(f.defaultInboxLimit(), d.defaultInboxLimit()), 1, maxInbox),
                maxInbox,
                Math.max(0, valueOr(f.retentionDays(), d.retentionDays())),
                Math.max(1, valueOr(f.subscriberQueueCapacity(), d.subscriberQueueCapacity())),
                f.auditSecret() == null ? d.auditSecret() : f.auditSecret().trim(),
                mergePlatform(f.github(), d.github()),
                mergePlatform(f.vercel(), d.vercel()),
                mergePlatform(f.railway(), d.railway()),
                mergePlatform(f.supabase(), d.supabase())
        );
    }

    private static PlatformSettings mergePlatform(PlatformFile f, PlatformSettings d) {
        if (f == null) {
            return d;
        }
        return new PlatformSettings(
                f.baseUrl() == null || f.baseUrl().isBlank() ? d.baseUrl() : stripTrailingSlash(f.baseUrl().trim()),
                f.token() == null ? d.token() : f.token().trim(),
                f.teamId() == null ? d.teamId() : f.teamId().trim(),
                Math.max(0, valueOr(f.rateLimitBuffer(), d.rateLimitBuffer()))
        );
    }

    private static PlatformSettings override(PlatformSettings base, String token, String baseUrl) {
        PlatformSettings out = base;
        if (token != null && !token.isBlank()) {
            out = out.withToken(token.trim());
        }
        if (baseUrl != null && !baseUrl.isBlank()) {
            out = out.withBaseUrl(stripTrailingSlash(baseUrl.trim()));
        }
        return out;
    }

    private static String stripTrailingSlash(String url) {
        String out = url;
        while (out.endsWith("/")) {
            out = out.substring(0, out.length() - 1);
        }
        return out;
    }

    private static String firstNonBlank(String a, String b) {
        if (a != null && !a.isBlank()) {
            return a.trim();
        }
        return b == null || b.isBlank() ? null : b.trim();
    }

    private static int valueOr(Integer value, int fallback) {
        return value == null ? fallback : value;
    }

    private static long valueOr(Long value, long fallback) {
        return value == null ? fallback : value;
    }

    private static int clamp(int value, int min, int max) {
        return Math.max(min, Math.min(max, value));
    }

    private record SettingsFile(
            Integer gatewayPort,
            Integer gatewayThreads,
            Long adapterTimeoutMs,
            Long healthProbeTimeoutMs,
            Long chainStepTimeoutMs,
            Integer maxChainSteps,
            Integer defaultInboxLimit,
            Integer maxInboxLimit,
            Integer retentionDays,
            Integer subscriberQueueCapacity,
            String auditSecret,
            PlatformFile github,
            PlatformFile vercel,
            PlatformFile railway,
            PlatformFile supabase
    ) {
    }

    private record PlatformFile(String baseUrl, String token, String teamId, Integer rateLimitBuffer) {
    }
}
