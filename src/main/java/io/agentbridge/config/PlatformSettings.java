package io.agentbridge.config;

/**
 * Connection settings for one remote platform.
 *
 * <p>{@code token} is the bearer credential (the service key for Supabase);
 * {@code teamId} is only meaningful for Vercel.
 */
public record PlatformSettings(
        String baseUrl,
        String token,
        String teamId,
        int rateLimitBuffer
) {
    public boolean configured() {
        return baseUrl != null && !baseUrl.isBlank() && token != null && !token.isBlank();
    }

    PlatformSettings withToken(String value) {
        return new PlatformSettings(baseUrl, value, teamId, rateLimitBuffer);
    }

    PlatformSettings withBaseUrl(String value) {
        return new PlatformSettings(value, token, teamId, rateLimitBuffer);
    }

    PlatformSettings withTeamId(String value) {
        return new PlatformSettings(baseUrl, token, value, rateLimitBuffer);
    }
}
