package com.directory.actions.operator;

import com.directory.actions.audit.AuditAction;
import com.directory.actions.audit.AuditService;
import com.directory.actions.store.Database;
import com.directory.actions.store.JobPersistenceException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Operator roster kept in the {@code admins} table. Roster changes are audited.
 */
public class JdbcOperatorRegistry implements OperatorRegistry {
    private static final Logger log = LoggerFactory.getLogger(JdbcOperatorRegistry.class);

    private final Database database;
    private final String superAdminId;
    private final AuditService auditService;
    private final Clock clock;

    public JdbcOperatorRegistry(Database database, String superAdminId, AuditService auditService, Clock clock) {
        this.database = database;
        this.superAdminId = Objects.requireNonNull(superAdminId, "superAdminId is required");
        this.auditService = auditService;
        this.clock = clock;
    }

    @Override
    public boolean isSuperAdmin(String principal) {
        return superAdminId.equals(principal);
    }

    @Override
    public boolean isOperator(String principal) {
        if (principal == null || principal.isBlank()) {
            return false;
        }
        if (isSuperAdmin(principal)) {
            return true;
        }
        try (Connection c = database.openConnection();
             PreparedStatement ps = c.prepareStatement("SELECT 1 FROM admins WHERE user_id = ?")) {
            ps.setString(1, principal);
            try (ResultSet rs = ps.executeQuery()) {
                return rs.next();
            }
        } catch (SQLException e) {
            throw new JobPersistenceException("Failed to look up operator " + principal, e);
        }
    }

    @Override
    public RosterChange add(String actor, String operatorId) {
        requireOperatorId(operatorId);
        if (!isSuperAdmin(actor)) {
            log.warn("operator.add_denied actor={} operator={}", actor, operatorId);
            return RosterChange.DENIED;
        }
        int inserted = update("INSERT OR IGNORE INTO admins(user_id, added_by, added_at_ms) VALUES(?,?,?)",
                operatorId, actor, clock.millis());
        if (inserted == 0) {
            return RosterChange.UNCHANGED;
        }
        auditService.record(actor, AuditAction.OPERATOR_ADDED, operatorId, Map.of());
        log.info("operator.added actor={} operator={}", actor, operatorId);
        return RosterChange.ADDED;
    }

    @Override
    public RosterChange remove(String actor, String operatorId) {
        requireOperatorId(operatorId);
        if (!isSuperAdmin(actor)) {
            log.warn("operator.remove_denied actor={} operator={}", actor, operatorId);
            return RosterChange.DENIED;
        }
        int deleted = update("DELETE FROM admins WHERE user_id = ?", operatorId, null, null);
        if (deleted == 0) {
            return RosterChange.UNCHANGED;
        }
        auditService.record(actor, AuditAction.OPERATOR_REMOVED, operatorId, Map.of());
        log.info("operator.removed actor={} operator={}", actor, operatorId);
        return RosterChange.REMOVED;
    }

    @Override
    public List<String> list() {
        List<String> ids = new ArrayList<>();
        try (Connection c = database.openConnection();
             PreparedStatement ps = c.prepareStatement("SELECT user_id FROM admins ORDER BY user_id");
             ResultSet rs = ps.executeQuery()) {
            while (rs.next()) {
                ids.add(rs.getString(1));
            }
        } catch (SQLException e) {
            throw new JobPersistenceException("Failed to list operators", e);
        }
        return ids;
    }

    @Override
    public String superAdminId() {
        return superAdminId;
    }

    private int update(String sql, String id, String addedBy, Long addedAtMs) {
        try (Connection c = database.openConnection(); PreparedStatement ps = c.prepareStatement(sql)) {
            ps.setString(1, id);
            if (addedAtMs != null) {
                ps.setString(2, addedBy);
                ps.setLong(3, addedAtMs);
            }
            return ps.executeUpdate();
        } catch (SQLException e) {
            throw new JobPersistenceException("Failed to update operator " + id, e);
        }
    }

    private static void requireOperatorId(String operatorId) {
        if (operatorId == null || operatorId.isBlank()) {
            throw new IllegalArgumentException("operatorId must not be blank");
        }
    }
}
