package io.agentbridge.storage;

import io.agentbridge.config.BridgeConfig;

import java.io.IOException;
import java.nio.file.Files;
import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Properties;

public final class Database {
    private static final String MIGRATION_SCHEMA_VERSION = "agentbridge.schema.migration.v1";
    private static final String BUSY_TIMEOUT_MS = "5000";

    private final BridgeConfig config;
    private final String jdbcUrl;

    public Database(BridgeConfig config) {
        this.config = config;
        this.jdbcUrl = "jdbc:sqlite:" + config.dbFile().toString();
    }

    public void init() {
        initDirectories();
        initSchema();
        applyAndValidatePragmas();
    }

    public Connection openConnection() throws SQLException {
        Properties props = new Properties();
        props.setProperty("busy_timeout", BUSY_TIMEOUT_MS);
        props.setProperty("foreign_keys", "true");
        return DriverManager.getConnection(jdbcUrl, props);
    }

    private void initDirectories() {
        try {
            Files.createDirectories(config.rootDir());
            Files.createDirectories(config.auditRoot());
        } catch (IOException e) {
            throw new RuntimeException("Failed to initialize directories", e);
        }
    }

    private void initSchema() {
        try (Connection conn = openConnection(); Statement st = conn.createStatement()) {
            st.execute("""
                    CREATE TABLE IF NOT EXISTS messages (
                        seq INTEGER PRIMARY KEY AUTOINCREMENT,
                        id TEXT NOT NULL UNIQUE,
                        sender TEXT NOT NULL,
                        recipient TEXT NOT NULL,
                        type TEXT NOT NULL,
                        payload TEXT NOT NULL,
                        context_id TEXT,
                        status TEXT NOT NULL DEFAULT 'SENT',
                        created_at_ms INTEGER NOT NULL,
                        acknowledged_by TEXT,
                        acknowledged_at_ms INTEGER,
                        updated_at_ms INTEGER NOT NULL
                    )
                    """);
            ensureSchemaMigrationsTable(conn);
            applyVersionedMigrations(conn);

            st.execute("CREATE INDEX IF NOT EXISTS idx_messages_recipient_created ON messages(recipient, created_at_ms, seq)");
            st.execute("CREATE INDEX IF NOT EXISTS idx_messages_recipient_status ON messages(recipient, status)");
            st.execute("CREATE INDEX IF NOT EXISTS idx_messages_context_created ON messages(context_id, created_at_ms, seq)");
            st.execute("CREATE INDEX IF NOT EXISTS idx_messages_created ON messages(created_at_ms)");
        } catch (SQLException e) {
            throw new RuntimeException("Failed to initialize SQLite schema", e);
        }
    }

    private void ensureSchemaMigrationsTable(Connection conn) throws SQLException {
        try (Statement st = conn.createStatement()) {
            st.execute("""
                    CREATE TABLE IF NOT EXISTS schema_migrations (
                        version TEXT PRIMARY KEY,
                        description TEXT NOT NULL,
                        checksum TEXT NOT NULL,
                        applied_at_ms INTEGER NOT NULL,
                        success INTEGER NOT NULL
                    )
                    """);
            st.execute("CREATE INDEX IF NOT EXISTS idx_schema_migrations_applied ON schema_migrations(applied_at_ms)");
        }
    }

    private void applyVersionedMigrations(Connection conn) throws SQLException {
        List<MigrationStep> steps = new ArrayList<>();
        steps.add(new MigrationStep(
                "20261001_001_agent_directory",
                "Add agent directory used by broadcast fan-out",
                List.of(
                        """
                        CREATE TABLE IF NOT EXISTS agents (
                            agent_id TEXT PRIMARY KEY,
                            metadata TEXT NOT NULL DEFAULT '{}',
                            registered_at_ms INTEGER NOT NULL,
                            last_seen_at_ms INTEGER NOT NULL
                        )
                        """
                )
        ));
        steps.add(new MigrationStep(
                "20261001_002_unread_partial_index",
                "Partial index over unacknowledged messages for unread counts",
                List.of("CREATE INDEX IF NOT EXISTS idx_messages_unread ON messages(recipient) WHERE status='SENT'")
        ));
        for (MigrationStep step : steps) {
            if (isMigrationApplied(conn, step.version())) {
                continue;
            }
            applyMigration(conn, step);
        }
    }

    private boolean isMigrationApplied(Connection conn, String version) throws SQLException {
        try (PreparedStatement ps = conn.prepareStatement(
                "SELECT 1 FROM schema_migrations WHERE version=? AND success=1 LIMIT 1")) {
            ps.setString(1, version);
            try (ResultSet rs = ps.executeQuery()) {
                return rs.next();
            }
        }
    }

    private void applyMigration(Connection conn, MigrationStep step) throws SQLException {
        String checksum = checksum(step);
        try (Statement st = conn.createStatement()) {
            for (String sql : step.sql()) {
                st.execute(sql);
            }
        }
        try (PreparedStatement ps = conn.prepareStatement(
                "INSERT OR REPLACE INTO schema_migrations(version,description,checksum,applied_at_ms,success) VALUES(?,?,?,?,1)")) {
            ps.setString(1, step.version());
            ps.setString(2, step.description());
            ps.setString(3, checksum);
            ps.setLong(4, Instant.now().toEpochMilli());
            ps.executeUpdate();
        }
    }

    private String checksum(MigrationStep step) {
        StringBuilder sb = new StringBuilder();
        sb.append(MIGRATION_SCHEMA_VERSION).append('|')
                .append(step.version()).append('|')
                .append(step.description()).append('|');
        for (String sql : step.sql()) {
            sb.append(sql).append(';');
        }
        return Integer.toHexString(sb.toString().hashCode());
    }

    private record MigrationStep(String version, String description, List<String> sql) {
    }

    private void applyAndValidatePragmas() {
        try (Connection conn = openConnection(); Statement st = conn.createStatement()) {
            st.execute("PRAGMA journal_mode=WAL");
            st.execute("PRAGMA synchronous=NORMAL");

            validatePragma(st, "journal_mode", "wal");
            validatePragma(st, "synchronous", "1");
            validatePragma(st, "foreign_keys", "1");
        } catch (SQLException e) {
            throw new RuntimeException("Failed to apply SQLite pragmas", e);
        }
    }

    private void validatePragma(Statement st, String pragma, String expected) throws SQLException {
        try (ResultSet rs = st.executeQuery("PRAGMA " + pragma)) {
            if (!rs.next()) {
                throw new IllegalStateException("PRAGMA " + pragma + " did not return a value");
            }
            String actual = rs.getString(1);
            if (actual == null || !actual.equalsIgnoreCase(expected)) {
                throw new IllegalStateException(
                        "PRAGMA " + pragma + " mismatch, expected=" + expected + ", actual=" + actual
                );
            }
        }
    }

    public List<SchemaMigrationRow> listSchemaMigrations(int limit) {
        String sql = """
                SELECT version,description,checksum,applied_at_ms,success
                FROM schema_migrations
                ORDER BY applied_at_ms DESC, version DESC
                LIMIT ?
                """;
        int safeLimit = Math.max(1, limit);
        List<SchemaMigrationRow> out = new ArrayList<>();
        try (Connection c = openConnection(); PreparedStatement ps = c.prepareStatement(sql)) {
            ps.setInt(1, safeLimit);
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    out.add(new SchemaMigrationRow(
                            rs.getString("version"),
                            rs.getString("description"),
                            rs.getString("checksum"),
                            rs.getLong("applied_at_ms"),
                            rs.getInt("success") == 1
                    ));
                }
            }
            return out;
        } catch (SQLException e) {
            throw new RuntimeException("Failed to list schema migrations", e);
        }
    }

    public record SchemaMigrationRow(
            String version,
            String description,
            String checksum,
            long appliedAtMs,
            boolean success
    ) {
    }
}
