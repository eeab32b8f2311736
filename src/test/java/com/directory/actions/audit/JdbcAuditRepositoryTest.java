package com.directory.actions.audit;

import com.directory.actions.store.Database;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.sql.Connection;
import java.sql.SQLException;
import java.sql.Statement;
import java.time.Instant;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class JdbcAuditRepositoryTest {

    @TempDir
    Path tempDir;

    private Database database;
    private JdbcAuditRepository repository;

    @BeforeEach
    void setUp() {
        database = new Database(tempDir.resolve("audit.db"));
        database.init();
        repository = new JdbcAuditRepository(database);
    }

    private static AuditEntry entry(AuditAction action, String target, Instant at) {
        return AuditEntry.builder()
                .action(action)
                .target(target)
                .actorId("42")
                .details(Map.of("status", "failed", "reason", "timed out after 120s"))
                .timestamp(at)
                .build();
    }

    @Test
    @DisplayName("Entries round-trip with their details")
    void testSaveAndRead() {
        AuditEntry saved = repository.save(entry(AuditAction.DISABLE_ACCOUNT, "alice",
                Instant.parse("2025-01-10T15:00:01Z")));

        List<AuditEntry> found = repository.findByTarget("alice");

        assertEquals(1, found.size());
        assertEquals(saved, found.get(0));
        assertEquals("timed out after 120s", found.get(0).details().get("reason"));
    }

    @Test
    @DisplayName("Queries filter by action and keep insertion order")
    void testFindByActionAndRecent() {
        repository.save(entry(AuditAction.SCHEDULE_DISABLE, "alice", Instant.parse("2025-01-09T10:00:00Z")));
        repository.save(entry(AuditAction.DISABLE_ACCOUNT, "alice", Instant.parse("2025-01-10T15:00:00Z")));
        repository.save(entry(AuditAction.DISABLE_ACCOUNT, "bob", Instant.parse("2025-01-10T15:00:01Z")));

        assertEquals(List.of("alice", "bob"), repository.findByAction(AuditAction.DISABLE_ACCOUNT).stream()
                .map(AuditEntry::target).toList());
        assertEquals(List.of("alice", "bob"), repository.findRecent(2).stream()
                .map(AuditEntry::target).toList());
        assertEquals(3, repository.count());
    }

    @Test
    @DisplayName("Rows with unknown actions are skipped")
    void testUnknownAction() throws SQLException {
        try (Connection c = database.openConnection(); Statement st = c.createStatement()) {
            st.executeUpdate("INSERT INTO audit_logs(entry_id, ts, ts_ms, actor_id, action, target, details) "
                    + "VALUES('x', '2025-01-10T15:00:00Z', 0, '1', 'legacy_action', 'alice', NULL)");
        }

        assertTrue(repository.findByTarget("alice").isEmpty());
        assertEquals(1, repository.count());
    }
}
