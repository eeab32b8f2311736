package com.directory.actions.audit;

import com.directory.actions.store.Database;
import com.directory.actions.store.JobPersistenceException;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * SQLite-backed implementation of AuditRepository on the {@code audit_logs} table.
 * Details maps are serialized as JSON strings.
 */
public class JdbcAuditRepository implements AuditRepository {
    private static final Logger log = LoggerFactory.getLogger(JdbcAuditRepository.class);

    private static final TypeReference<Map<String, String>> DETAILS_TYPE = new TypeReference<>() {
    };
    private static final String COLUMNS = "entry_id, ts, actor_id, action, target, details";

    private final Database database;
    private final ObjectMapper objectMapper;

    public JdbcAuditRepository(Database database) {
        this.database = database;
        this.objectMapper = new ObjectMapper();
    }

    @Override
    public AuditEntry save(AuditEntry entry) {
        try (Connection c = database.openConnection();
             PreparedStatement ps = c.prepareStatement(
                     "INSERT INTO audit_logs(entry_id, ts, ts_ms, actor_id, action, target, details) "
                             + "VALUES(?,?,?,?,?,?,?)")) {
            ps.setString(1, entry.id());
            ps.setString(2, entry.timestamp().toString());
            ps.setLong(3, entry.timestamp().toEpochMilli());
            ps.setString(4, entry.actorId());
            ps.setString(5, entry.action().wireName());
            ps.setString(6, entry.target());
            ps.setString(7, serializeDetails(entry.details()));
            ps.executeUpdate();
        } catch (SQLException e) {
            throw new JobPersistenceException("Failed to write audit entry " + entry.action().wireName(), e);
        }
        log.debug("Persisted audit entry: {} for target {}", entry.action().wireName(), entry.target());
        return entry;
    }

    @Override
    public List<AuditEntry> findByTarget(String target) {
        return query("SELECT " + COLUMNS + " FROM audit_logs WHERE target = ? ORDER BY id ASC", target);
    }

    @Override
    public List<AuditEntry> findByAction(AuditAction action) {
        return query("SELECT " + COLUMNS + " FROM audit_logs WHERE action = ? ORDER BY id ASC", action.wireName());
    }

    @Override
    public List<AuditEntry> findRecent(int limit) {
        List<AuditEntry> newestFirst = new ArrayList<>();
        try (Connection c = database.openConnection();
             PreparedStatement ps = c.prepareStatement(
                     "SELECT " + COLUMNS + " FROM audit_logs ORDER BY id DESC LIMIT ?")) {
            ps.setInt(1, limit);
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    mapRow(rs).ifPresent(newestFirst::add);
                }
            }
        } catch (SQLException e) {
            throw new JobPersistenceException("Failed to read recent audit entries", e);
        }
        Collections.reverse(newestFirst);
        return newestFirst;
    }

    @Override
    public int count() {
        try (Connection c = database.openConnection();
             PreparedStatement ps = c.prepareStatement("SELECT COUNT(*) FROM audit_logs");
             ResultSet rs = ps.executeQuery()) {
            return rs.next() ? rs.getInt(1) : 0;
        } catch (SQLException e) {
            throw new JobPersistenceException("Failed to count audit entries", e);
        }
    }

    private List<AuditEntry> query(String sql, String param) {
        List<AuditEntry> entries = new ArrayList<>();
        try (Connection c = database.openConnection(); PreparedStatement ps = c.prepareStatement(sql)) {
            ps.setString(1, param);
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    mapRow(rs).ifPresent(entries::add);
                }
            }
        } catch (SQLException e) {
            throw new JobPersistenceException("Failed to query audit entries", e);
        }
        return entries;
    }

    private Optional<AuditEntry> mapRow(ResultSet rs) throws SQLException {
        String action = rs.getString("action");
        Optional<AuditAction> parsed = AuditAction.fromWireName(action);
        if (parsed.isEmpty()) {
            log.warn("Skipping audit row {} with unknown action '{}'", rs.getString("entry_id"), action);
            return Optional.empty();
        }
        return Optional.of(AuditEntry.builder()
                .id(rs.getString("entry_id"))
                .action(parsed.get())
                .target(rs.getString("target"))
                .actorId(rs.getString("actor_id"))
                .details(deserializeDetails(rs.getString("details")))
                .timestamp(Instant.parse(rs.getString("ts")))
                .build());
    }

    private String serializeDetails(Map<String, String> details) {
        try {
            return objectMapper.writeValueAsString(details);
        } catch (JsonProcessingException e) {
            log.warn("Failed to serialize audit details: {}", e.getMessage());
            return "{}";
        }
    }

    private Map<String, String> deserializeDetails(String json) {
        if (json == null || json.isEmpty()) {
            return Map.of();
        }
        try {
            return objectMapper.readValue(json, DETAILS_TYPE);
        } catch (JsonProcessingException e) {
            log.warn("Failed to deserialize audit details: {}", e.getMessage());
            return Map.of();
        }
    }
}
