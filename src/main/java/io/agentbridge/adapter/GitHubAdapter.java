package io.agentbridge.adapter;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.agentbridge.config.PlatformSettings;
import io.agentbridge.error.ErrorKind;
import io.agentbridge.util.Jsons;

import java.net.http.HttpClient;
import java.nio.charset.StandardCharsets;
import java.util.Base64;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * GitHub REST v3. Every repository operation takes {@code owner} and {@code repo}.
 */
public final class GitHubAdapter extends HttpServiceAdapter {
    public static final String NAME = "github";
    private static final List<String> REPOSITORY_FIELDS = List.of(
            "name", "full_name", "description", "private", "default_branch",
            "clone_url", "ssh_url", "created_at", "updated_at"
    );

    public GitHubAdapter(PlatformSettings platform, long timeoutMs, HttpClient http) {
        super(NAME, platform, timeoutMs, http);
        register("getRepository", this::getRepository);
        register("getContents", this::getContents);
        register("createOrUpdateFile", this::createOrUpdateFile);
        register("deleteFile", this::deleteFile);
        register("listBranches", this::listBranches);
        register("createBranch", this::createBranch);
        register("listPullRequests", this::listPullRequests);
        register("createPullRequest", this::createPullRequest, "createPR");
        register("mergePullRequest", this::mergePullRequest);
        register("createIssue", this::createIssue);
        register("listIssues", this::listIssues);
        register("listWorkflowRuns", this::listWorkflowRuns);
        register("triggerWorkflow", this::triggerWorkflow);
    }

    @Override
    protected void decorate(RemoteRequest request) {
        request.header("Accept", "application/vnd.github+json");
        request.header("X-GitHub-Api-Version", "2022-11-28");
    }

    /**
     * Reads the quota first so a low remaining count is reported rather than
     * blocking the probe. Low quota alone does not make the service unhealthy.
     */
    @Override
    protected AdapterHealth probe() {
        JsonNode rate = call(RemoteRequest.get("/rate_limit").unguarded()).path("rate");
        if (rate.has("remaining")) {
            updateRateWindow(rate.path("remaining").asLong(), rate.path("reset").asLong());
        }
        JsonNode user = call(RemoteRequest.get("/user").unguarded());
        Map<String, Object> attributes = new LinkedHashMap<>();
        attributes.put("authenticated", true);
        attributes.put("user", user.path("login").asText(""));
        attributes.put("rate_limit_ok", rateLimitOk());
        rateWindow().ifPresent(w -> attributes.put("rate_limit_remaining", w.remaining()));
        return AdapterHealth.healthy(NAME, "authenticated as " + user.path("login").asText("?"), attributes);
    }

    private JsonNode getRepository(Params p) {
        JsonNode repo = call(RemoteRequest.get(repoPath(p)));
        ObjectNode out = Jsons.mapper().createObjectNode();
        for (String field : REPOSITORY_FIELDS) {
            out.set(field, orNull(repo.path(field)));
        }
        return out;
    }

    private JsonNode getContents(Params p) {
        String path = p.optString("path", "");
        return call(RemoteRequest.get(repoPath(p) + "/contents/" + pathSegments(path))
                .query("ref", p.optString("ref")));
    }

    private JsonNode createOrUpdateFile(Params p) {
        String path = p.requireString("path");
        String content = p.requireString("content");
        String message = p.requireString("message");
        String branch = p.optString("branch");
        String sha = p.optString("sha");
        if (sha == null) {
            sha = existingSha(p, path, branch);
        }
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("message", message);
        body.put("content", Base64.getEncoder().encodeToString(content.getBytes(StandardCharsets.UTF_8)));
        if (sha != null) {
            body.put("sha", sha);
        }
        if (branch != null) {
            body.put("branch", branch);
        }
        return call(RemoteRequest.put(repoPath(p) + "/contents/" + pathSegments(path)).body(body));
    }

    private JsonNode deleteFile(Params p) {
        String path = p.requireString("path");
        String message = p.requireString("message");
        String branch = p.optString("branch");
        String sha = p.optString("sha");
        if (sha == null) {
            sha = existingSha(p, path, branch);
            if (sha == null) {
                throw new RemoteCallException(ErrorKind.NOT_FOUND, 404, "File not found: " + path);
            }
        }
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("message", message);
        body.put("sha", sha);
        if (branch != null) {
            body.put("branch", branch);
        }
        return call(RemoteRequest.delete(repoPath(p) + "/contents/" + pathSegments(path)).body(body));
    }

    private JsonNode listBranches(Params p) {
        return call(RemoteRequest.get(repoPath(p) + "/branches").query("per_page", p.optInt("per_page", 30)));
    }

    private JsonNode createBranch(Params p) {
        String branch = p.requireString("branch");
        String fromSha = p.requireString("fromSha");
        return call(RemoteRequest.post(repoPath(p) + "/git/refs")
                .body(Map.of("ref", "refs/heads/" + branch, "sha", fromSha)));
    }

    private JsonNode listPullRequests(Params p) {
        return call(RemoteRequest.get(repoPath(p) + "/pulls")
                .query("state", p.optString("state", "open"))
                .query("head", p.optString("head"))
                .query("base", p.optString("base"))
                .query("per_page", p.optInt("per_page", 30)));
    }

    private JsonNode createPullRequest(Params p) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("title", p.requireString("title"));
        body.put("head", p.requireString("head"));
        body.put("base", p.requireString("base"));
        body.put("body", p.optString("body", ""));
        body.put("draft", p.optBoolean("draft", false));
        return call(RemoteRequest.post(repoPath(p) + "/pulls").body(body));
    }

    private JsonNode mergePullRequest(Params p) {
        int number = p.requireInt("pullNumber");
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("merge_method", p.optString("mergeMethod", "merge"));
        if (p.has("commitTitle")) {
            body.put("commit_title", p.optString("commitTitle"));
        }
        if (p.has("commitMessage")) {
            body.put("commit_message", p.optString("commitMessage"));
        }
        return call(RemoteRequest.put(repoPath(p) + "/pulls/" + number + "/merge").body(body));
    }

    private JsonNode createIssue(Params p) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("title", p.requireString("title"));
        body.put("body", p.optString("body", ""));
        List<Object> labels = p.optList("labels");
        if (labels != null) {
            body.put("labels", labels);
        }
        List<Object> assignees = p.optList("assignees");
        if (assignees != null) {
            body.put("assignees", assignees);
        }
        return call(RemoteRequest.post(repoPath(p) + "/issues").body(body));
    }

    private JsonNode listIssues(Params p) {
        return call(RemoteRequest.get(repoPath(p) + "/issues")
                .query("state", p.optString("state", "open"))
                .query("labels", p.optString("labels"))
                .query("per_page", p.optInt("per_page", 30)));
    }

    private JsonNode listWorkflowRuns(Params p) {
        return call(RemoteRequest.get(repoPath(p) + "/actions/runs")
                .query("branch", p.optString("branch"))
                .query("status", p.optString("status"))
                .query("per_page", p.optInt("per_page", 30)));
    }

    private JsonNode triggerWorkflow(Params p) {
        String workflowId = p.requireString("workflowId");
        String ref = p.requireString("ref");
        Map<String, Object> inputs = p.optMap("inputs");
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("ref", ref);
        body.put("inputs", inputs == null ? Map.of() : inputs);
        call(RemoteRequest.post(repoPath(p) + "/actions/workflows/" + segment(workflowId) + "/dispatches").body(body));
        ObjectNode out = Jsons.mapper().createObjectNode();
        out.put("triggered", true);
        out.put("workflowId", workflowId);
        out.put("ref", ref);
        return out;
    }

    private String existingSha(Params p, String path, String branch) {
        try {
            JsonNode existing = call(RemoteRequest.get(repoPath(p) + "/contents/" + pathSegments(path))
                    .query("ref", branch));
            return existing.hasNonNull("sha") ? existing.get("sha").asText() : null;
        } catch (RemoteCallException e) {
            if (e.kind() == ErrorKind.NOT_FOUND) {
                return null;
            }
            throw e;
        }
    }

    private static String repoPath(Params p) {
        return "/repos/" + segment(p.requireString("owner")) + "/" + segment(p.requireString("repo"));
    }
}
