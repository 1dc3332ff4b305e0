package io.agentbridge.adapter;

import com.fasterxml.jackson.databind.JsonNode;
import io.agentbridge.config.PlatformSettings;
import io.agentbridge.error.ErrorKind;
import io.agentbridge.util.Jsons;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.net.http.HttpClient;
import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.util.Base64;
import java.util.Map;

final class GitHubAdapterTest {

    @Test
    void getRepositoryProjectsSelectedFieldsAndSendsGitHubHeaders() throws Exception {
        try (FakeRemote remote = new FakeRemote()) {
            remote.respond(r -> FakeRemote.Reply.json(200,
                    "{\"name\":\"bridge\",\"full_name\":\"octo/bridge\",\"private\":false,\"default_branch\":\"main\",\"owner\":{\"login\":\"octo\"}}"));
            GitHubAdapter adapter = adapter(remote, "ghp_test");

            AdapterResult result = adapter.invoke("getRepository", Map.of("owner", "octo", "repo", "bridge"));

            Assertions.assertTrue(result.success(), result.error());
            Assertions.assertEquals("main", result.data().path("default_branch").asText());
            Assertions.assertTrue(result.data().path("description").isNull());
            Assertions.assertFalse(result.data().has("owner"));
            FakeRemote.Recorded request = remote.last();
            Assertions.assertEquals("/repos/octo/bridge", request.path());
            Assertions.assertEquals("Bearer ghp_test", request.header("Authorization"));
            Assertions.assertEquals("application/vnd.github+json", request.header("Accept"));
            Assertions.assertEquals("2022-11-28", request.header("X-GitHub-Api-Version"));
        }
    }

    @Test
    void createOrUpdateFileCreatesWhenMissingAndUpdatesWithExistingSha() throws Exception {
        try (FakeRemote remote = new FakeRemote()) {
            remote.respond(r -> "GET".equals(r.method())
                    ? FakeRemote.Reply.json(404, "{\"message\":\"Not Found\"}")
                    : FakeRemote.Reply.json(201, "{\"content\":{\"sha\":\"new\"}}"));
            GitHubAdapter adapter = adapter(remote, "ghp_test");
            Map<String, Object> params = Map.of(
                    "owner", "octo", "repo", "bridge", "path", "docs/read me.md",
                    "content", "hello", "message", "add docs", "branch", "dev");

            AdapterResult created = adapter.invoke("createOrUpdateFile", params);

            Assertions.assertTrue(created.success(), created.error());
            FakeRemote.Recorded put = remote.last();
            Assertions.assertEquals("PUT", put.method());
            Assertions.assertEquals("/repos/octo/bridge/contents/docs/read me.md", put.path());
            JsonNode body = Jsons.mapper().readTree(put.body());
            Assertions.assertEquals(Base64.getEncoder().encodeToString("hello".getBytes(StandardCharsets.UTF_8)),
                    body.path("content").asText());
            Assertions.assertFalse(body.has("sha"));
            Assertions.assertEquals("dev", body.path("branch").asText());

            remote.respond(r -> "GET".equals(r.method())
                    ? FakeRemote.Reply.json(200, "{\"sha\":\"abc123\"}")
                    : FakeRemote.Reply.json(200, "{}"));
            Assertions.assertTrue(adapter.invoke("createOrUpdateFile", params).success());
            Assertions.assertEquals("abc123", Jsons.mapper().readTree(remote.last().body()).path("sha").asText());
        }
    }

    @Test
    void createPullRequestAliasAndRequiredParameters() throws Exception {
        try (FakeRemote remote = new FakeRemote()) {
            remote.respond(r -> FakeRemote.Reply.json(201, "{\"number\":7}"));
            GitHubAdapter adapter = adapter(remote, "ghp_test");

            AdapterResult ok = adapter.invoke("createPR", Map.of(
                    "owner", "octo", "repo", "bridge", "title", "Fix", "head", "fix", "base", "main"));
            Assertions.assertTrue(ok.success());
            Assertions.assertEquals(7, ok.data().path("number").asInt());
            Assertions.assertEquals("/repos/octo/bridge/pulls", remote.last().path());

            AdapterResult missing = adapter.invoke("createPullRequest", Map.of("owner", "octo", "repo", "bridge"));
            Assertions.assertFalse(missing.success());
            Assertions.assertEquals(ErrorKind.VALIDATION, missing.errorKind());
            Assertions.assertEquals("Missing required parameter: title", missing.error());
        }
    }

    @Test
    void remoteStatusesMapToErrorKinds() throws Exception {
        try (FakeRemote remote = new FakeRemote()) {
            GitHubAdapter adapter = adapter(remote, "ghp_test");
            Map<String, Object> params = Map.of("owner", "octo", "repo", "bridge");

            remote.respond(r -> FakeRemote.Reply.json(401, "{\"message\":\"Bad credentials\"}"));
            AdapterResult auth = adapter.invoke("getRepository", params);
            Assertions.assertEquals(ErrorKind.AUTH, auth.errorKind());
            Assertions.assertTrue(auth.error().contains("Bad credentials"));

            remote.respond(r -> FakeRemote.Reply.json(404, "{\"message\":\"Not Found\"}"));
            Assertions.assertEquals(ErrorKind.NOT_FOUND, adapter.invoke("getRepository", params).errorKind());

            remote.respond(r -> FakeRemote.Reply.json(422, "{\"message\":\"Validation Failed\"}"));
            Assertions.assertEquals(ErrorKind.VALIDATION, adapter.invoke("getRepository", params).errorKind());

            remote.respond(r -> FakeRemote.Reply.json(503, "{}"));
            Assertions.assertEquals(ErrorKind.SERVICE_UNAVAILABLE, adapter.invoke("getRepository", params).errorKind());
        }
    }

    @Test
    void lowQuotaFailsFastUntilReset() throws Exception {
        try (FakeRemote remote = new FakeRemote()) {
            long reset = Instant.now().getEpochSecond() + 3_600L;
            remote.respond(r -> new FakeRemote.Reply(200, "{\"name\":\"bridge\"}",
                    Map.of("x-ratelimit-remaining", "5", "x-ratelimit-reset", String.valueOf(reset))));
            GitHubAdapter adapter = adapter(remote, "ghp_test");
            Map<String, Object> params = Map.of("owner", "octo", "repo", "bridge");

            Assertions.assertTrue(adapter.invoke("getRepository", params).success());
            AdapterResult limited = adapter.invoke("getRepository", params);

            Assertions.assertFalse(limited.success());
            Assertions.assertEquals(ErrorKind.RATE_LIMITED, limited.errorKind());
            Assertions.assertEquals(1, remote.requests().size());
        }
    }

    @Test
    void healthReportsQuotaWithoutFailingOnLowRemaining() throws Exception {
        try (FakeRemote remote = new FakeRemote()) {
            long reset = Instant.now().getEpochSecond() + 3_600L;
            remote.respond(r -> r.path().equals("/rate_limit")
                    ? FakeRemote.Reply.json(200, "{\"rate\":{\"remaining\":3,\"reset\":" + reset + "}}")
                    : FakeRemote.Reply.json(200, "{\"login\":\"octo\"}"));
            GitHubAdapter adapter = adapter(remote, "ghp_test");

            AdapterHealth health = adapter.healthCheck();

            Assertions.assertTrue(health.healthy());
            Assertions.assertEquals("octo", health.attributes().get("user"));
            Assertions.assertEquals(false, health.attributes().get("rate_limit_ok"));
            Assertions.assertEquals(3L, health.attributes().get("rate_limit_remaining"));
        }
    }

    @Test
    void unconfiguredAndUnknownOperationsNeverReachTheRemote() throws Exception {
        try (FakeRemote remote = new FakeRemote()) {
            GitHubAdapter unconfigured = adapter(remote, null);
            AdapterResult disabled = unconfigured.invoke("getRepository", Map.of("owner", "o", "repo", "r"));
            Assertions.assertEquals(ErrorKind.SERVICE_UNAVAILABLE, disabled.errorKind());
            Assertions.assertFalse(unconfigured.healthCheck().healthy());

            AdapterResult unknown = adapter(remote, "ghp_test").invoke("launchRocket", Map.of());
            Assertions.assertEquals(ErrorKind.VALIDATION, unknown.errorKind());
            Assertions.assertEquals("Unknown github operation: launchRocket", unknown.error());
            Assertions.assertTrue(remote.requests().isEmpty());
        }
    }

    @Test
    void unreachableRemoteIsANetworkFailure() {
        GitHubAdapter adapter = new GitHubAdapter(
                new PlatformSettings("http://127.0.0.1:1", "ghp_test", null, 100), 2_000L, HttpClient.newHttpClient());
        AdapterResult result = adapter.invoke("getRepository", Map.of("owner", "o", "repo", "r"));
        Assertions.assertFalse(result.success());
        Assertions.assertEquals(ErrorKind.NETWORK, result.errorKind());
    }

    private static GitHubAdapter adapter(FakeRemote remote, String token) {
        return new GitHubAdapter(new PlatformSettings(remote.baseUrl(), token, null, 100), 5_000L, HttpClient.newHttpClient());
    }
}
