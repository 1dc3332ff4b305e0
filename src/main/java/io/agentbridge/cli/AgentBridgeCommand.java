package io.agentbridge.cli;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import io.agentbridge.a2a.BroadcastOutcome;
import io.agentbridge.chain.ChainExecutionResult;
import io.agentbridge.chain.ToolInvocation;
import io.agentbridge.config.BridgeConfig;
import io.agentbridge.error.BridgeException;
import io.agentbridge.error.ValidationException;
import io.agentbridge.gateway.BridgeGateway;
import io.agentbridge.health.HealthReport;
import io.agentbridge.model.AgentRegistration;
import io.agentbridge.model.Message;
import io.agentbridge.model.MessageType;
import io.agentbridge.observability.AuditLogger;
import io.agentbridge.runtime.BridgeRuntime;
import io.agentbridge.storage.Database;
import io.agentbridge.util.Jsons;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.ParentCommand;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Callable;

@Command(
        name = "agentbridge",
        mixinStandardHelpOptions = true,
        description = "AgentBridge agent messaging and platform tool CLI",
        subcommands = {
                AgentBridgeCommand.InitCommand.class,
                AgentBridgeCommand.ServeCommand.class,
                AgentBridgeCommand.SendCommand.class,
                AgentBridgeCommand.InboxCommand.class,
                AgentBridgeCommand.ThreadCommand.class,
                AgentBridgeCommand.AckCommand.class,
                AgentBridgeCommand.UnreadCommand.class,
                AgentBridgeCommand.BroadcastCommand.class,
                AgentBridgeCommand.CleanupCommand.class,
                AgentBridgeCommand.AgentsCommand.class,
                AgentBridgeCommand.RegisterAgentCommand.class,
                AgentBridgeCommand.ChainCommand.class,
                AgentBridgeCommand.HealthCommand.class,
                AgentBridgeCommand.SchemaMigrationsCommand.class,
                AgentBridgeCommand.AuditVerifyCommand.class
        }
)
public final class AgentBridgeCommand implements Runnable {
    private static final String CLI_ACTOR = "cli";

    @Option(names = {"--root"}, description = "Runtime data root directory", defaultValue = BridgeConfig.DEFAULT_ROOT)
    String root;

    @Override
    public void run() {
        System.out.println("Use subcommands: init | serve | send | inbox | thread | ack | unread | broadcast | cleanup | agents | register-agent | chain | health | schema-migrations | audit-verify");
    }

    BridgeRuntime runtime() {
        BridgeRuntime runtime = new BridgeRuntime(BridgeConfig.fromRoot(root));
        runtime.init();
        return runtime;
    }

    /**
     * Prints domain failures as a JSON error body instead of a stack trace.
     */
    public static int handleExecutionException(Exception ex, CommandLine commandLine, CommandLine.ParseResult parseResult)
            throws Exception {
        if (!(ex instanceof BridgeException bridge)) {
            throw ex;
        }
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("success", false);
        body.put("error", bridge.getMessage());
        body.put("kind", bridge.kind().name());
        body.put("timestamp", Instant.now().toString());
        commandLine.getErr().println(Jsons.toJson(body));
        return 1;
    }

    private static void audit(BridgeRuntime runtime, String action, String resource, Map<String, Object> details) {
        runtime.audit(action, CLI_ACTOR, resource, "ok", null, details);
    }

    private static Map<String, Object> parseJsonObject(String raw, String what) {
        try {
            return Jsons.toMap(raw);
        } catch (IllegalArgumentException e) {
            throw new ValidationException(what + " must be a JSON object: " + e.getMessage());
        }
    }

    private static MessageType optionalType(String raw) {
        return raw == null || raw.isBlank() ? null : MessageType.fromString(raw);
    }

    @Command(name = "init", description = "Initialize directories and SQLite schema")
    static final class InitCommand implements Callable<Integer> {
        @ParentCommand
        AgentBridgeCommand parent;

        @Override
        public Integer call() {
            try (BridgeRuntime runtime = parent.runtime()) {
                System.out.println("Initialized AgentBridge at: " + runtime.config().rootDir());
            }
            return 0;
        }
    }

    @Command(name = "serve", description = "Run the HTTP gateway")
    static final class ServeCommand implements Callable<Integer> {
        @ParentCommand
        AgentBridgeCommand parent;

        @Option(names = {"--port"}, description = "Listen port (default from settings)")
        Integer port;

        @Override
        public Integer call() throws Exception {
            BridgeRuntime runtime = parent.runtime();
            BridgeGateway gateway = new BridgeGateway(runtime, port == null ? runtime.settings().gatewayPort() : port);
            Runtime.getRuntime().addShutdownHook(new Thread(() -> {
                gateway.close();
                runtime.close();
            }, "agentbridge-shutdown"));
            gateway.start();
            System.out.println("AgentBridge gateway: http://127.0.0.1:" + gateway.port() + "/health");
            Thread.currentThread().join();
            return 0;
        }
    }

    @Command(name = "send", description = "Send one message")
    static final class SendCommand implements Callable<Integer> {
        @ParentCommand
        AgentBridgeCommand parent;

        @Option(names = {"--from"}, required = true, description = "Sender agent id")
        String sender;

        @Option(names = {"--to"}, required = true, description = "Recipient agent id or All")
        String recipient;

        @Option(names = {"--type"}, required = true, description = "Message type, e.g. TASK_DELEGATION")
        String type;

        @Option(names = {"--payload"}, defaultValue = "{}", description = "Payload JSON object")
        String payload;

        @Option(names = {"--context"}, description = "Optional context thread id")
        String contextId;

        @Override
        public Integer call() {
            try (BridgeRuntime runtime = parent.runtime()) {
                Message message = runtime.a2a().send(sender, recipient, MessageType.fromString(type),
                        parseJsonObject(payload, "payload"), contextId);
                audit(runtime, "message.send", message.id(), Map.of("sender", sender, "recipient", recipient, "type", message.type().name()));
                System.out.println(Jsons.toJson(message));
            }
            return 0;
        }
    }

    @Command(name = "inbox", description = "List messages for a recipient, newest first")
    static final class InboxCommand implements Callable<Integer> {
        @ParentCommand
        AgentBridgeCommand parent;

        @Parameters(index = "0", description = "Recipient agent id")
        String recipient;

        @Option(names = {"--type"}, description = "Filter by message type")
        String type;

        @Option(names = {"--limit"}, description = "Max messages")
        Integer limit;

        @Option(names = {"--after"}, description = "Only messages newer than this message id")
        String afterId;

        @Override
        public Integer call() {
            try (BridgeRuntime runtime = parent.runtime()) {
                System.out.println(Jsons.toJson(runtime.a2a().getMessages(recipient, optionalType(type), limit, afterId)));
            }
            return 0;
        }
    }

    @Command(name = "thread", description = "List a context thread in creation order")
    static final class ThreadCommand implements Callable<Integer> {
        @ParentCommand
        AgentBridgeCommand parent;

        @Parameters(index = "0", description = "Context id")
        String contextId;

        @Override
        public Integer call() {
            try (BridgeRuntime runtime = parent.runtime()) {
                System.out.println(Jsons.toJson(runtime.a2a().getMessagesByContext(contextId)));
            }
            return 0;
        }
    }

    @Command(name = "ack", description = "Acknowledge a message")
    static final class AckCommand implements Callable<Integer> {
        @ParentCommand
        AgentBridgeCommand parent;

        @Parameters(index = "0", description = "Message id")
        String messageId;

        @Option(names = {"--by"}, required = true, description = "Acknowledging agent id")
        String acknowledger;

        @Override
        public Integer call() {
            try (BridgeRuntime runtime = parent.runtime()) {
                Message message = runtime.a2a().acknowledgeMessage(messageId, acknowledger);
                audit(runtime, "message.ack", messageId, Map.of("by", acknowledger));
                System.out.println(Jsons.toJson(message));
            }
            return 0;
        }
    }

    @Command(name = "unread", description = "Count unacknowledged messages for an agent")
    static final class UnreadCommand implements Callable<Integer> {
        @ParentCommand
        AgentBridgeCommand parent;

        @Parameters(index = "0", description = "Agent id")
        String agent;

        @Override
        public Integer call() {
            try (BridgeRuntime runtime = parent.runtime()) {
                System.out.println(Jsons.toJson(Map.of("agent", agent, "unread", runtime.a2a().getUnreadCount(agent))));
            }
            return 0;
        }
    }

    @Command(name = "broadcast", description = "Send one message per target (all registered agents when no target given)")
    static final class BroadcastCommand implements Callable<Integer> {
        @ParentCommand
        AgentBridgeCommand parent;

        @Option(names = {"--from"}, required = true, description = "Sender agent id")
        String sender;

        @Option(names = {"--type"}, required = true, description = "Message type")
        String type;

        @Option(names = {"--payload"}, defaultValue = "{}", description = "Payload JSON object")
        String payload;

        @Option(names = {"--target"}, description = "Target agent id, repeatable")
        List<String> targets = new ArrayList<>();

        @Option(names = {"--context"}, description = "Optional context thread id")
        String contextId;

        @Override
        public Integer call() {
            try (BridgeRuntime runtime = parent.runtime()) {
                BroadcastOutcome outcome = runtime.a2a().broadcast(sender, MessageType.fromString(type),
                        parseJsonObject(payload, "payload"), targets, contextId);
                audit(runtime, "message.broadcast", sender, Map.of("targets", outcome.totalTargets(), "successful", outcome.successful()));
                System.out.println(Jsons.toJson(outcome));
                return outcome.successful() == outcome.totalTargets() ? 0 : 1;
            }
        }
    }

    @Command(name = "cleanup", description = "Delete messages older than the retention window")
    static final class CleanupCommand implements Callable<Integer> {
        @ParentCommand
        AgentBridgeCommand parent;

        @Option(names = {"--age-days"}, description = "Age threshold in days (default from settings)")
        Integer ageDays;

        @Override
        public Integer call() {
            try (BridgeRuntime runtime = parent.runtime()) {
                int days = ageDays == null ? runtime.settings().retentionDays() : ageDays;
                int removed = runtime.a2a().cleanupOldMessages(days);
                audit(runtime, "message.cleanup", "messages", Map.of("ageDays", days, "removed", removed));
                System.out.println(Jsons.toJson(Map.of("ageDays", days, "removed", removed)));
            }
            return 0;
        }
    }

    @Command(name = "agents", description = "List registered agents")
    static final class AgentsCommand implements Callable<Integer> {
        @ParentCommand
        AgentBridgeCommand parent;

        @Override
        public Integer call() {
            try (BridgeRuntime runtime = parent.runtime()) {
                System.out.println(Jsons.toJson(runtime.a2a().listAgents()));
            }
            return 0;
        }
    }

    @Command(name = "register-agent", description = "Register or refresh an agent for broadcast fan-out")
    static final class RegisterAgentCommand implements Callable<Integer> {
        @ParentCommand
        AgentBridgeCommand parent;

        @Parameters(index = "0", description = "Agent id")
        String agentId;

        @Option(names = {"--metadata"}, defaultValue = "{}", description = "Metadata JSON object")
        String metadata;

        @Override
        public Integer call() {
            try (BridgeRuntime runtime = parent.runtime()) {
                AgentRegistration registration = runtime.a2a().registerAgent(agentId, parseJsonObject(metadata, "metadata"));
                audit(runtime, "agent.register", agentId, Map.of());
                System.out.println(Jsons.toJson(registration));
            }
            return 0;
        }
    }

    @Command(name = "chain", description = "Execute a tool chain from a JSON file ({steps:[...], context:{...}})")
    static final class ChainCommand implements Callable<Integer> {
        @ParentCommand
        AgentBridgeCommand parent;

        @Option(names = {"--file"}, required = true, description = "Chain JSON file path")
        Path file;

        @Override
        public Integer call() throws IOException {
            JsonNode root;
            try {
                root = Jsons.mapper().readTree(Files.readString(file, StandardCharsets.UTF_8));
            } catch (JsonProcessingException e) {
                throw new ValidationException("Chain file is not valid JSON: " + e.getOriginalMessage());
            }
            JsonNode rawSteps = root.isArray() ? root : root.path("steps");
            if (!rawSteps.isArray()) {
                throw new ValidationException("Chain file must be a list of steps or an object with steps");
            }
            List<ToolInvocation> steps = new ArrayList<>();
            for (JsonNode step : rawSteps) {
                steps.add(ToolInvocation.fromJson(step));
            }
            try (BridgeRuntime runtime = parent.runtime()) {
                ChainExecutionResult result = runtime.chains().execute(steps, Jsons.toMap(root.path("context")));
                Map<String, Object> details = new LinkedHashMap<>();
                details.put("steps", steps.size());
                details.put("executed", result.steps().size());
                details.put("halted", result.halted());
                runtime.audit("chain.execute", CLI_ACTOR, file.getFileName().toString(), result.success() ? "ok" : "error", null, details);
                System.out.println(Jsons.toJson(result));
                return result.success() ? 0 : 1;
            }
        }
    }

    @Command(name = "health", description = "Probe every configured adapter and the message store")
    static final class HealthCommand implements Callable<Integer> {
        @ParentCommand
        AgentBridgeCommand parent;

        @Override
        public Integer call() {
            try (BridgeRuntime runtime = parent.runtime()) {
                HealthReport report = runtime.health().aggregate();
                System.out.println(Jsons.toJson(report));
                return report.ok() ? 0 : 1;
            }
        }
    }

    @Command(name = "schema-migrations", description = "List applied schema migrations")
    static final class SchemaMigrationsCommand implements Callable<Integer> {
        @ParentCommand
        AgentBridgeCommand parent;

        @Option(names = {"--limit"}, defaultValue = "50", description = "Max rows to print")
        int limit;

        @Override
        public Integer call() {
            Database database = new Database(BridgeConfig.fromRoot(parent.root));
            database.init();
            System.out.println(Jsons.toJson(database.listSchemaMigrations(limit)));
            return 0;
        }
    }

    @Command(name = "audit-verify", description = "Verify the audit log hash chain and signatures")
    static final class AuditVerifyCommand implements Callable<Integer> {
        @ParentCommand
        AgentBridgeCommand parent;

        @Override
        public Integer call() {
            try (BridgeRuntime runtime = parent.runtime()) {
                AuditLogger.IntegrityOutcome out = runtime.auditLogger().verify();
                System.out.println(Jsons.toJson(out));
                return out.ok() ? 0 : 1;
            }
        }
    }
}
