package io.agentbridge.observability;

import io.agentbridge.util.Jsons;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.stream.Stream;

final class AuditLoggerTest {

    @Test
    void rowsAreHashChainedSignedAndMasked() throws Exception {
        Path root = Files.createTempDirectory("agentbridge-audit-chain-");
        try {
            Path file = root.resolve("audit").resolve("audit.log");
            AuditLogger logger = new AuditLogger(file, "secret");
            logger.log(AuditLogger.AuditEvent.of("message.send", "cli", "msg_1", "ok", "req_1",
                    Map.of("token", "ghp_abcdefghijklmnop", "recipient", "B")));
            logger.log(AuditLogger.AuditEvent.of("message.ack", "cli", "msg_1", "ok", null, null));

            List<String> lines = Files.readAllLines(file, StandardCharsets.UTF_8);
            Assertions.assertEquals(2, lines.size());
            Map<String, Object> first = Jsons.toMap(lines.get(0));
            Map<String, Object> second = Jsons.toMap(lines.get(1));
            Assertions.assertEquals("", first.get("prev_hash"));
            Assertions.assertEquals(first.get("hash"), second.get("prev_hash"));
            Assertions.assertNotNull(first.get("signature"));
            Assertions.assertFalse(lines.get(0).contains("ghp_abcdefghijklmnop"));
            Assertions.assertTrue(lines.get(0).contains("\"recipient\":\"B\""));

            AuditLogger.IntegrityOutcome outcome = logger.verify();
            Assertions.assertTrue(outcome.ok(), outcome.reason());
            Assertions.assertEquals(2, outcome.checkedRows());
            Assertions.assertEquals(logger.currentHash(), outcome.tailHash());
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void reopenedLoggerContinuesTheChain() throws Exception {
        Path root = Files.createTempDirectory("agentbridge-audit-reopen-");
        try {
            Path file = root.resolve("audit.log");
            AuditLogger first = new AuditLogger(file, "");
            first.log(AuditLogger.AuditEvent.of("a", "x", "r", "ok", null, Map.of()));

            AuditLogger reopened = new AuditLogger(file, "");
            Assertions.assertEquals(first.currentHash(), reopened.currentHash());
            reopened.log(AuditLogger.AuditEvent.of("b", "x", "r", "ok", null, Map.of()));
            Assertions.assertTrue(reopened.verify().ok());
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void tamperedRowIsDetected() throws Exception {
        Path root = Files.createTempDirectory("agentbridge-audit-tamper-");
        try {
            Path file = root.resolve("audit.log");
            AuditLogger logger = new AuditLogger(file, "secret");
            logger.log(AuditLogger.AuditEvent.of("a", "x", "r1", "ok", null, Map.of()));
            logger.log(AuditLogger.AuditEvent.of("b", "x", "r2", "ok", null, Map.of()));

            List<String> lines = Files.readAllLines(file, StandardCharsets.UTF_8);
            Files.write(file, List.of(lines.get(0), lines.get(1).replace("\"r2\"", "\"r3\"")), StandardCharsets.UTF_8);

            AuditLogger.IntegrityOutcome outcome = logger.verify();
            Assertions.assertFalse(outcome.ok());
            Assertions.assertEquals(2, outcome.brokenLine());
            Assertions.assertEquals("hash_mismatch", outcome.reason());
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void requestIdsAcceptWellFormedValuesOnly() {
        Assertions.assertEquals("trace-12345678", RequestIds.acceptOrCreate(" trace-12345678 "));
        String minted = RequestIds.acceptOrCreate("bad id with spaces");
        Assertions.assertTrue(minted.matches("req_[0-9a-f]{24}"));
        Assertions.assertNotEquals(RequestIds.newRequestId(), RequestIds.newRequestId());
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
