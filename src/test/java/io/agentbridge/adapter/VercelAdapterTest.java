package io.agentbridge.adapter;

import io.agentbridge.config.PlatformSettings;
import io.agentbridge.error.ErrorKind;
import io.agentbridge.util.Jsons;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.net.http.HttpClient;
import java.util.Map;

final class VercelAdapterTest {

    @Test
    void teamIdIsAddedToEveryCall() throws Exception {
        try (FakeRemote remote = new FakeRemote()) {
            remote.respond(r -> FakeRemote.Reply.json(200, "{\"projects\":[]}"));
            VercelAdapter adapter = adapter(remote, "team_1");

            Assertions.assertTrue(adapter.invoke("listProjects", Map.of("limit", 5)).success());

            Assertions.assertEquals("/v9/projects", remote.last().path());
            Assertions.assertEquals("team_1", remote.last().query("teamId"));
            Assertions.assertEquals("5", remote.last().query("limit"));
        }
    }

    @Test
    void deployAliasPostsTheParameterMapAndRequiresName() throws Exception {
        try (FakeRemote remote = new FakeRemote()) {
            remote.respond(r -> FakeRemote.Reply.json(200, "{\"id\":\"dpl_1\",\"readyState\":\"QUEUED\"}"));
            VercelAdapter adapter = adapter(remote, null);

            AdapterResult missing = adapter.invoke("deploy", Map.of("target", "production"));
            Assertions.assertEquals(ErrorKind.VALIDATION, missing.errorKind());
            Assertions.assertTrue(remote.requests().isEmpty());

            AdapterResult ok = adapter.invoke("deploy", Map.of("name", "web", "target", "production"));
            Assertions.assertTrue(ok.success(), ok.error());
            Assertions.assertEquals("/v13/deployments", remote.last().path());
            Assertions.assertNull(remote.last().query("teamId"));
            Assertions.assertEquals("production", Jsons.mapper().readTree(remote.last().body()).path("target").asText());
        }
    }

    @Test
    void getStatusProjectsDeploymentState() throws Exception {
        try (FakeRemote remote = new FakeRemote()) {
            remote.respond(r -> FakeRemote.Reply.json(200,
                    "{\"uid\":\"dpl_1\",\"readyState\":\"READY\",\"url\":\"web.vercel.app\",\"createdAt\":1,\"ready\":2}"));
            AdapterResult result = adapter(remote, null).invoke("getStatus", Map.of("deploymentId", "dpl_1"));

            Assertions.assertTrue(result.success(), result.error());
            Assertions.assertEquals("dpl_1", result.data().path("id").asText());
            Assertions.assertEquals("READY", result.data().path("state").asText());
            Assertions.assertEquals(2, result.data().path("readyAt").asInt());
            Assertions.assertEquals("/v13/deployments/dpl_1", remote.last().path());
        }
    }

    @Test
    void throttlingIsReportedAsRateLimited() throws Exception {
        try (FakeRemote remote = new FakeRemote()) {
            remote.respond(r -> FakeRemote.Reply.json(429, "{\"error\":{\"message\":\"Too many requests\"}}"));
            AdapterResult result = adapter(remote, null).invoke("listDomains", Map.of());

            Assertions.assertEquals(ErrorKind.RATE_LIMITED, result.errorKind());
            Assertions.assertTrue(result.error().contains("Too many requests"));
        }
    }

    private static VercelAdapter adapter(FakeRemote remote, String teamId) {
        return new VercelAdapter(new PlatformSettings(remote.baseUrl(), "vc-token", teamId, 10), 5_000L, HttpClient.newHttpClient());
    }
}
