package io.agentbridge.observability;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.agentbridge.security.SensitiveDataMasker;
import io.agentbridge.util.Hashing;
import io.agentbridge.util.Jsons;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.FileAlreadyExistsException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Append-only JSONL audit trail. Each line carries the hash of the previous
 * line, and an HMAC signature when a secret is configured.
 */
public final class AuditLogger {
    private static final Logger log = LoggerFactory.getLogger(AuditLogger.class);
    private static final ObjectMapper COMPACT_MAPPER = new ObjectMapper();

    private final Path auditFile;
    private final String signingSecret;
    private String previousHash;

    public AuditLogger(Path auditFile, String signingSecret) {
        this.auditFile = auditFile;
        this.signingSecret = signingSecret == null ? "" : signingSecret.trim();
        try {
            Files.createDirectories(auditFile.getParent());
            if (!Files.exists(auditFile)) {
                try {
                    Files.createFile(auditFile);
                } catch (FileAlreadyExistsException e) {
                    log.debug("Audit file {} created concurrently", auditFile);
                }
            }
        } catch (IOException e) {
            throw new RuntimeException("Failed to initialize audit log file: " + auditFile, e);
        }
        this.previousHash = loadLastHash();
    }

    public synchronized void log(AuditEvent event) {
        Map<String, Object> row = new LinkedHashMap<>();
        row.put("timestamp", Instant.now().toString());
        row.put("action", event.action());
        row.put("actor", event.actor());
        row.put("resource", event.resource());
        row.put("result", event.result());
        row.put("request_id", event.requestId());
        row.put("details", SensitiveDataMasker.masked(event.details()));
        row.put("prev_hash", previousHash);
        String rowHash = Hashing.sha256Hex(toCompactJson(row));
        row.put("hash", rowHash);
        if (!signingSecret.isBlank()) {
            row.put("signature", Hashing.hmacSha256Hex(signingSecret, rowHash));
        }
        String line = toCompactJson(row) + System.lineSeparator();
        try {
            Files.writeString(auditFile, line, StandardCharsets.UTF_8,
                    StandardOpenOption.CREATE, StandardOpenOption.APPEND, StandardOpenOption.WRITE);
            previousHash = rowHash;
        } catch (IOException e) {
            throw new RuntimeException("Failed to write audit log", e);
        }
    }

    public synchronized String currentHash() {
        return previousHash;
    }

    /**
     * Recomputes every line's hash and checks the chain and signatures.
     */
    public synchronized IntegrityOutcome verify() {
        int rows = 0;
        String expectedPrev = "";
        try {
            List<String> lines = Files.readAllLines(auditFile, StandardCharsets.UTF_8);
            for (int i = 0; i < lines.size(); i++) {
                String line = lines.get(i);
                if (line == null || line.isBlank()) {
                    continue;
                }
                rows++;
                JsonNode parsed;
                try {
                    parsed = Jsons.mapper().readTree(line);
                } catch (JsonProcessingException e) {
                    return IntegrityOutcome.broken(rows - 1, i + 1, "invalid_json");
                }
                String hash = parsed.path("hash").asText("");
                if (!parsed.path("prev_hash").asText("").equals(expectedPrev)) {
                    return IntegrityOutcome.broken(rows - 1, i + 1, "prev_hash_mismatch");
                }
                ObjectNode canonical = parsed.deepCopy();
                canonical.remove("hash");
                canonical.remove("signature");
                if (!Hashing.sha256Hex(COMPACT_MAPPER.writeValueAsString(canonical)).equals(hash)) {
                    return IntegrityOutcome.broken(rows - 1, i + 1, "hash_mismatch");
                }
                String signature = parsed.path("signature").asText("");
                if (!signingSecret.isBlank() && !Hashing.hmacSha256Hex(signingSecret, hash).equals(signature)) {
                    return IntegrityOutcome.broken(rows - 1, i + 1, "signature_mismatch");
                }
                expectedPrev = hash;
            }
        } catch (IOException e) {
            throw new RuntimeException("Failed to verify audit log", e);
        }
        return new IntegrityOutcome(true, rows, 0, "", expectedPrev);
    }

    private String loadLastHash() {
        try {
            String last = "";
            for (String line : Files.readAllLines(auditFile, StandardCharsets.UTF_8)) {
                if (line != null && !line.isBlank()) {
                    last = line;
                }
            }
            if (last.isBlank()) {
                return "";
            }
            return Jsons.mapper().readTree(last).path("hash").asText("");
        } catch (IOException e) {
            log.warn("Audit log {} tail unreadable, starting a new hash chain: {}", auditFile, e.getMessage());
            return "";
        }
    }

    private String toCompactJson(Map<String, Object> row) {
        try {
            return COMPACT_MAPPER.writeValueAsString(row);
        } catch (JsonProcessingException e) {
            throw new RuntimeException("Failed to serialize audit row", e);
        }
    }

    public record AuditEvent(
            String action,
            String actor,
            String resource,
            String result,
            String requestId,
            Map<String, Object> details
    ) {
        public static AuditEvent of(
                String action,
                String actor,
                String resource,
                String result,
                String requestId,
                Map<String, Object> details
        ) {
            return new AuditEvent(action, actor, resource, result, requestId, details == null ? Map.of() : details);
        }
    }

    public record IntegrityOutcome(
            boolean ok,
            int checkedRows,
            int brokenLine,
            String reason,
            String tailHash
    ) {
        static IntegrityOutcome broken(int checkedRows, int line, String reason) {
            return new IntegrityOutcome(false, checkedRows, line, reason, "");
        }
    }
}
