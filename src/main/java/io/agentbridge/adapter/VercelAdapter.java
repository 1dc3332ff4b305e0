package io.agentbridge.adapter;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.agentbridge.config.PlatformSettings;
import io.agentbridge.util.Jsons;

import java.net.http.HttpClient;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

public final class VercelAdapter extends HttpServiceAdapter {
    public static final String NAME = "vercel";
    private static final List<String> DEFAULT_ENV_TARGETS = List.of("production", "preview", "development");

    public VercelAdapter(PlatformSettings platform, long timeoutMs, HttpClient http) {
        super(NAME, platform, timeoutMs, http);
        register("listProjects", this::listProjects);
        register("getProject", this::getProject);
        register("listDeployments", this::listDeployments);
        register("getDeployment", this::getDeployment);
        register("createDeployment", this::createDeployment, "deploy");
        register("cancelDeployment", this::cancelDeployment);
        register("getDeploymentStatus", this::getDeploymentStatus, "getStatus");
        register("listEnvironmentVariables", this::listEnvironmentVariables);
        register("createEnvironmentVariable", this::createEnvironmentVariable);
        register("listDomains", this::listDomains);
    }

    @Override
    protected void decorate(RemoteRequest request) {
        String teamId = platform().teamId();
        if (teamId != null && !teamId.isBlank()) {
            request.query("teamId", teamId);
        }
    }

    @Override
    protected AdapterHealth probe() {
        JsonNode user = call(RemoteRequest.get("/v2/user").unguarded()).path("user");
        Map<String, Object> attributes = new LinkedHashMap<>();
        attributes.put("authenticated", true);
        attributes.put("user", user.path("username").asText(user.path("email").asText("")));
        rateWindow().ifPresent(w -> attributes.put("rate_limit_remaining", w.remaining()));
        return AdapterHealth.healthy(NAME, "authenticated", attributes);
    }

    private JsonNode listProjects(Params p) {
        return call(RemoteRequest.get("/v9/projects")
                .query("limit", p.optInt("limit"))
                .query("since", p.optString("since"))
                .query("until", p.optString("until")));
    }

    private JsonNode getProject(Params p) {
        return call(RemoteRequest.get("/v9/projects/" + segment(p.requireString("projectId"))));
    }

    private JsonNode listDeployments(Params p) {
        return call(RemoteRequest.get("/v6/deployments")
                .query("projectId", p.optString("projectId"))
                .query("limit", p.optInt("limit"))
                .query("state", p.optString("state"))
                .query("since", p.optString("since"))
                .query("until", p.optString("until")));
    }

    private JsonNode getDeployment(Params p) {
        return call(RemoteRequest.get("/v13/deployments/" + segment(p.requireString("deploymentId"))));
    }

    /**
     * The whole parameter map is the deployment request body; {@code name} is required.
     */
    private JsonNode createDeployment(Params p) {
        p.requireString("name");
        return call(RemoteRequest.post("/v13/deployments").body(p.asMap()));
    }

    private JsonNode cancelDeployment(Params p) {
        return call(RemoteRequest.patch("/v12/deployments/" + segment(p.requireString("deploymentId")) + "/cancel"));
    }

    private JsonNode getDeploymentStatus(Params p) {
        JsonNode deployment = getDeployment(p);
        ObjectNode out = Jsons.mapper().createObjectNode();
        out.set("id", orNull(deployment.has("uid") ? deployment.get("uid") : deployment.path("id")));
        out.set("state", orNull(deployment.path("readyState")));
        out.set("url", orNull(deployment.path("url")));
        out.set("createdAt", orNull(deployment.path("createdAt")));
        out.set("readyAt", orNull(deployment.has("readyAt") ? deployment.get("readyAt") : deployment.path("ready")));
        return out;
    }

    private JsonNode listEnvironmentVariables(Params p) {
        return call(RemoteRequest.get("/v9/projects/" + segment(p.requireString("projectId")) + "/env"));
    }

    private JsonNode createEnvironmentVariable(Params p) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("key", p.requireString("key"));
        body.put("value", p.requireString("value"));
        List<Object> target = p.optList("target");
        body.put("target", target == null ? DEFAULT_ENV_TARGETS : target);
        body.put("type", p.optString("type", "encrypted"));
        return call(RemoteRequest.post("/v10/projects/" + segment(p.requireString("projectId")) + "/env").body(body));
    }

    private JsonNode listDomains(Params p) {
        return call(RemoteRequest.get("/v5/domains")
                .query("limit", p.optInt("limit"))
                .query("since", p.optString("since"))
                .query("until", p.optString("until")));
    }
}
