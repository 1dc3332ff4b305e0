package io.agentbridge.adapter;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.agentbridge.config.PlatformSettings;
import io.agentbridge.error.ErrorKind;
import io.agentbridge.util.Jsons;

import java.net.http.HttpClient;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Railway public GraphQL API. Every operation is one POST to the base URL.
 */
public final class RailwayAdapter extends HttpServiceAdapter {
    public static final String NAME = "railway";

    private static final String LIST_PROJECTS = """
            query {
              projects {
                edges { node { id name description createdAt updatedAt isPublic team { id name } } }
              }
            }
            """;
    private static final String GET_PROJECT = """
            query getProject($projectId: String!) {
              project(id: $projectId) {
                id name description createdAt updatedAt
                environments { edges { node { id name } } }
                services { edges { node { id name } } }
              }
            }
            """;
    private static final String LIST_SERVICES = """
            query getServices($projectId: String!) {
              project(id: $projectId) {
                services { edges { node { id name createdAt updatedAt } } }
              }
            }
            """;
    private static final String RESTART_SERVICE = """
            mutation restartService($environmentId: String!, $serviceId: String!) {
              serviceInstanceRestart(environmentId: $environmentId, serviceId: $serviceId)
            }
            """;
    private static final String LIST_DEPLOYMENTS = """
            query getDeployments($serviceId: String!, $first: Int!) {
              service(id: $serviceId) {
                deployments(first: $first) {
                  edges { node { id status createdAt updatedAt staticUrl url canRedeploy canRollback } }
                }
              }
            }
            """;
    private static final String GET_DEPLOYMENT = """
            query getDeployment($deploymentId: String!) {
              deployment(id: $deploymentId) {
                id status createdAt updatedAt staticUrl url canRedeploy canRollback
                service { id name }
              }
            }
            """;
    private static final String REDEPLOY = """
            mutation redeploy($deploymentId: String!) {
              deploymentRedeploy(id: $deploymentId) { id status createdAt }
            }
            """;
    private static final String ROLLBACK = """
            mutation rollback($deploymentId: String!) {
              deploymentRollback(id: $deploymentId) { id status createdAt }
            }
            """;
    private static final String SET_VARIABLE = """
            mutation setVariable($input: VariableUpsertInput!) {
              variableUpsert(input: $input)
            }
            """;
    private static final String ME = """
            query { me { id name email } }
            """;

    public RailwayAdapter(PlatformSettings platform, long timeoutMs, HttpClient http) {
        super(NAME, platform, timeoutMs, http);
        register("listProjects", this::listProjects);
        register("getProject", this::getProject);
        register("listServices", this::listServices);
        register("restartService", this::restartService, "restart");
        register("listDeployments", this::listDeployments);
        register("getDeployment", this::getDeployment);
        register("getDeploymentStatus", this::getDeploymentStatus);
        register("redeploy", this::redeploy);
        register("rollbackDeployment", this::rollbackDeployment);
        register("setVariable", this::setVariable);
    }

    @Override
    protected AdapterHealth probe() {
        JsonNode me = graphql(ME, Map.of(), true).path("me");
        Map<String, Object> attributes = new LinkedHashMap<>();
        attributes.put("authenticated", true);
        attributes.put("user", me.path("name").asText(me.path("email").asText("")));
        attributes.put("userId", me.path("id").asText(""));
        return AdapterHealth.healthy(NAME, "authenticated", attributes);
    }

    private JsonNode listProjects(Params p) {
        return nodes(graphql(LIST_PROJECTS, Map.of(), false).path("projects"));
    }

    private JsonNode getProject(Params p) {
        return graphql(GET_PROJECT, Map.of("projectId", p.requireString("projectId")), false).path("project");
    }

    private JsonNode listServices(Params p) {
        JsonNode project = graphql(LIST_SERVICES, Map.of("projectId", p.requireString("projectId")), false).path("project");
        return nodes(project.path("services"));
    }

    private JsonNode restartService(Params p) {
        Map<String, Object> vars = Map.of(
                "environmentId", p.requireString("environmentId"),
                "serviceId", p.requireString("serviceId")
        );
        JsonNode data = graphql(RESTART_SERVICE, vars, false);
        ObjectNode out = Jsons.mapper().createObjectNode();
        out.set("restarted", orNull(data.path("serviceInstanceRestart")));
        return out;
    }

    private JsonNode listDeployments(Params p) {
        Map<String, Object> vars = Map.of(
                "serviceId", p.requireString("serviceId"),
                "first", p.optInt("limit", 10)
        );
        return nodes(graphql(LIST_DEPLOYMENTS, vars, false).path("service").path("deployments"));
    }

    private JsonNode getDeployment(Params p) {
        return graphql(GET_DEPLOYMENT, Map.of("deploymentId", p.requireString("deploymentId")), false).path("deployment");
    }

    private JsonNode getDeploymentStatus(Params p) {
        JsonNode deployment = getDeployment(p);
        ObjectNode out = Jsons.mapper().createObjectNode();
        for (String field : List.of("id", "status", "url", "staticUrl", "createdAt", "updatedAt", "canRollback")) {
            out.set(field, orNull(deployment.path(field)));
        }
        return out;
    }

    private JsonNode redeploy(Params p) {
        return graphql(REDEPLOY, Map.of("deploymentId", p.requireString("deploymentId")), false).path("deploymentRedeploy");
    }

    private JsonNode rollbackDeployment(Params p) {
        return graphql(ROLLBACK, Map.of("deploymentId", p.requireString("deploymentId")), false).path("deploymentRollback");
    }

    private JsonNode setVariable(Params p) {
        Map<String, Object> input = new LinkedHashMap<>();
        input.put("projectId", p.optString("projectId"));
        input.put("environmentId", p.requireString("environmentId"));
        input.put("serviceId", p.requireString("serviceId"));
        input.put("name", p.requireString("name"));
        input.put("value", p.requireString("value"));
        input.values().removeIf(v -> v == null);
        JsonNode data = graphql(SET_VARIABLE, Map.of("input", input), false);
        ObjectNode out = Jsons.mapper().createObjectNode();
        out.set("updated", orNull(data.path("variableUpsert")));
        out.put("name", String.valueOf(input.get("name")));
        return out;
    }

    private JsonNode graphql(String query, Map<String, Object> variables, boolean probe) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("query", query);
        body.put("variables", variables);
        RemoteRequest request = RemoteRequest.post("").body(body);
        if (probe) {
            request.unguarded();
        }
        JsonNode response = call(request);
        JsonNode errors = response.path("errors");
        if (errors.isArray() && errors.size() > 0) {
            List<String> messages = new ArrayList<>();
            for (JsonNode error : errors) {
                messages.add(error.path("message").asText("unknown error"));
            }
            String joined = String.join(", ", messages);
            ErrorKind kind = joined.toLowerCase(Locale.ROOT).contains("not authorized")
                    ? ErrorKind.AUTH
                    : ErrorKind.REMOTE;
            throw new RemoteCallException(kind, 200, "GraphQL errors: " + joined);
        }
        return response.path("data");
    }

    private static ArrayNode nodes(JsonNode connection) {
        ArrayNode out = Jsons.mapper().createArrayNode();
        for (JsonNode edge : connection.path("edges")) {
            out.add(edge.path("node"));
        }
        return out;
    }
}
