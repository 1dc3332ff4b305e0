package io.agentbridge.runtime;

import io.agentbridge.adapter.AdapterRegistry;
import io.agentbridge.adapter.FakeServiceAdapter;
import io.agentbridge.adapter.ServiceAdapter;
import io.agentbridge.config.BridgeConfig;
import io.agentbridge.config.BridgeSettings;
import io.agentbridge.health.HealthReport;
import io.agentbridge.model.Message;
import io.agentbridge.model.MessageType;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.stream.Stream;

final class BridgeRuntimeTest {

    @Test
    void wiresStoreAdaptersHealthAndAudit() throws Exception {
        Path root = Files.createTempDirectory("agentbridge-runtime-");
        try {
            AdapterRegistry registry = new AdapterRegistry(List.of(
                    (ServiceAdapter) new FakeServiceAdapter("github"),
                    new FakeServiceAdapter("vercel", false)
            ));
            try (BridgeRuntime runtime = new BridgeRuntime(new BridgeConfig(root), BridgeSettings.defaults(), registry)) {
                runtime.init();
                Assertions.assertTrue(Files.exists(runtime.config().dbFile()));

                Message message = runtime.a2a().send("A", "B", MessageType.STATUS_REQUEST, Map.of(), null);
                Assertions.assertEquals(1, runtime.a2a().getUnreadCount("B"));

                HealthReport report = runtime.health().aggregate();
                Assertions.assertTrue(report.ok());
                Assertions.assertEquals(List.of("vercel"), report.disabled());
                Assertions.assertTrue(report.services().containsKey("github"));

                runtime.audit("message.send", "test", message.id(), "ok", null, Map.of());
                Assertions.assertTrue(runtime.auditLogger().verify().ok());
                Assertions.assertFalse(runtime.auditLogger().currentHash().isBlank());
            }
        } finally {
            deleteRecursively(root);
        }
    }

    private static void deleteRecursively(Path root) throws IOException {
        if (root == null || !Files.exists(root)) {
            return;
        }
        try (Stream<Path> walk = Files.walk(root)) {
            for (Path path : walk.sorted((a, b) -> Integer.compare(b.getNameCount(), a.getNameCount())).toList()) {
                Files.deleteIfExists(path);
            }
        }
    }
}
