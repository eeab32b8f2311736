package com.directory.actions.audit;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Map;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class AuditServiceTest {

    private static final Instant NOW = Instant.parse("2025-01-10T15:00:00Z");

    private AuditService auditService;

    @BeforeEach
    void setUp() {
        auditService = new AuditService(new InMemoryAuditRepository(), Clock.fixed(NOW, ZoneOffset.UTC));
    }

    @Test
    @DisplayName("Should record audit entries")
    void testRecordEntry() {
        AuditEntry entry = auditService.record("42", AuditAction.RESET_PASSWORD, "alice",
                Map.of("status", "ok")).orElseThrow();

        assertNotNull(entry.id());
        assertEquals(AuditAction.RESET_PASSWORD, entry.action());
        assertEquals("alice", entry.target());
        assertEquals("42", entry.actorId());
        assertEquals("ok", entry.details().get("status"));
        assertEquals(NOW, entry.timestamp());
    }

    @Test
    @DisplayName("Should filter by target and by action")
    void testFilters() {
        auditService.record("42", AuditAction.SCHEDULE_DISABLE, "alice");
        auditService.record("42", AuditAction.DISABLE_ACCOUNT, "alice");
        auditService.record("42", AuditAction.DISABLE_ACCOUNT, "bob");

        assertEquals(3, auditService.size());
        assertEquals(2, auditService.findByTarget("alice").size());
        assertEquals(2, auditService.findByAction(AuditAction.DISABLE_ACCOUNT).size());
    }

    @Test
    @DisplayName("Recent entries are the last ones, oldest first")
    void testFindRecent() {
        auditService.record("1", AuditAction.OPERATOR_ADDED, "a");
        auditService.record("1", AuditAction.OPERATOR_ADDED, "b");
        auditService.record("1", AuditAction.OPERATOR_ADDED, "c");

        var recent = auditService.findRecent(2);
        assertEquals(2, recent.size());
        assertEquals("b", recent.get(0).target());
        assertEquals("c", recent.get(1).target());
    }

    @Test
    @DisplayName("Null details become an empty map")
    void testNullDetails() {
        AuditEntry entry = auditService.record("1", AuditAction.SELECTION_EXPIRED, null).orElseThrow();

        assertTrue(entry.details().isEmpty());
        assertNull(entry.target());
    }

    @Test
    @DisplayName("Repository failures are swallowed and reported as empty")
    void testBestEffort(@Mock AuditRepository failing) {
        when(failing.save(any())).thenThrow(new IllegalStateException("disk full"));
        AuditService service = new AuditService(failing);

        Optional<AuditEntry> result = assertDoesNotThrow(
                () -> service.record("42", AuditAction.DISABLE_ACCOUNT, "alice", Map.of("status", "ok")));

        assertTrue(result.isEmpty());
        verify(failing).save(any());
    }

    @Test
    @DisplayName("Wire names are lower case and parse back")
    void testWireNames() {
        assertEquals("disable_account", AuditAction.DISABLE_ACCOUNT.wireName());
        assertEquals(Optional.of(AuditAction.MAIL_OFFBOARDING), AuditAction.fromWireName("mail_offboarding"));
        assertTrue(AuditAction.fromWireName("entity_merged").isEmpty());
        assertTrue(AuditAction.fromWireName(null).isEmpty());
    }
}
