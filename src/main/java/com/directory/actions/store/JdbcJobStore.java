package com.directory.actions.store;

import com.directory.actions.core.model.Job;
import com.directory.actions.core.model.JobStatus;
import com.directory.actions.core.model.JobType;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.sql.Types;
import java.time.Clock;
import java.time.Instant;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantLock;

/**
 * SQLite-backed {@link JobStore}.
 *
 * <p>All writes are serialised by one store-wide lock and run in a single transaction, so two
 * concurrent submissions of the same (type, handle, due second) collapse into one live row.
 * A partial unique index on live rows backs the same invariant at the storage level.</p>
 */
public class JdbcJobStore implements JobStore {
    private static final Logger log = LoggerFactory.getLogger(JdbcJobStore.class);

    private static final TypeReference<Map<String, String>> META_TYPE = new TypeReference<>() {
    };
    private static final String COLUMNS =
            "id, job_type, target_handle, run_at, status, created_by, meta, created_at_ms, finished_at_ms, last_error";

    private final Database database;
    private final Clock clock;
    private final ObjectMapper objectMapper = new ObjectMapper();
    private final ReentrantLock writeLock = new ReentrantLock();

    public JdbcJobStore(Database database) {
        this(database, Clock.systemUTC());
    }

    public JdbcJobStore(Database database, Clock clock) {
        this.database = database;
        this.clock = clock;
    }

    @Override
    public Job createJob(JobType jobType, String targetHandle, ZonedDateTime runAt,
                         String createdBy, Map<String, String> metadata) {
        Objects.requireNonNull(jobType, "jobType is required");
        Objects.requireNonNull(targetHandle, "targetHandle is required");
        Objects.requireNonNull(runAt, "runAt is required");
        ZonedDateTime due = runAt.truncatedTo(ChronoUnit.SECONDS);
        String meta = writeMeta(metadata);

        writeLock.lock();
        try (Connection c = database.openConnection()) {
            c.setAutoCommit(false);
            try {
                long id;
                boolean replaced;
                Optional<Long> existing = findLiveId(c, jobType, targetHandle, due.toEpochSecond());
                if (existing.isPresent()) {
                    id = existing.get();
                    replaced = true;
                    try (PreparedStatement ps = c.prepareStatement(
                            "UPDATE jobs SET created_by=?, meta=? WHERE id=?")) {
                        ps.setString(1, createdBy);
                        ps.setString(2, meta);
                        ps.setLong(3, id);
                        ps.executeUpdate();
                    }
                } else {
                    replaced = false;
                    try (PreparedStatement ps = c.prepareStatement(
                            "INSERT INTO jobs(job_type, target_handle, run_at, run_at_epoch, status, created_by, meta, created_at_ms) "
                                    + "VALUES(?,?,?,?,?,?,?,?)")) {
                        ps.setString(1, jobType.name());
                        ps.setString(2, targetHandle);
                        ps.setString(3, due.format(DateTimeFormatter.ISO_ZONED_DATE_TIME));
                        ps.setLong(4, due.toEpochSecond());
                        ps.setString(5, JobStatus.SCHEDULED.name());
                        ps.setString(6, createdBy);
                        ps.setString(7, meta);
                        ps.setLong(8, clock.millis());
                        ps.executeUpdate();
                    }
                    id = lastInsertId(c);
                }
                c.commit();
                log.info("job.persisted jobId={} type={} target={} runAt={} replaced={}",
                        id, jobType, targetHandle, due, replaced);
                return readById(c, id).orElseThrow(() ->
                        new JobPersistenceException("Job " + id + " vanished after commit"));
            } catch (SQLException | RuntimeException e) {
                c.rollback();
                throw e;
            } finally {
                c.setAutoCommit(true);
            }
        } catch (SQLException e) {
            throw new JobPersistenceException("Failed to persist job for " + targetHandle, e);
        } finally {
            writeLock.unlock();
        }
    }

    @Override
    public boolean claim(long id) {
        return transition(id, JobStatus.IN_PROGRESS, null, "status = 'SCHEDULED'");
    }

    @Override
    public boolean markDone(long id) {
        return transition(id, JobStatus.DONE, null, "status IN ('SCHEDULED', 'IN_PROGRESS')");
    }

    @Override
    public boolean markFailed(long id, String reason) {
        return transition(id, JobStatus.FAILED, reason, "status IN ('SCHEDULED', 'IN_PROGRESS')");
    }

    @Override
    public Optional<Job> findById(long id) {
        try (Connection c = database.openConnection()) {
            return readById(c, id);
        } catch (SQLException e) {
            throw new JobPersistenceException("Failed to read job " + id, e);
        }
    }

    @Override
    public ScheduledScan scanScheduled() {
        List<Job> jobs = new ArrayList<>();
        List<CorruptJobRow> corrupt = new ArrayList<>();
        try (Connection c = database.openConnection();
             PreparedStatement ps = c.prepareStatement(
                     "SELECT " + COLUMNS + " FROM jobs WHERE status = 'SCHEDULED' ORDER BY run_at_epoch ASC, id ASC")) {
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    try {
                        jobs.add(mapRow(rs));
                    } catch (DateTimeParseException | IllegalArgumentException e) {
                        CorruptJobRow row = new CorruptJobRow(
                                rs.getLong("id"), rs.getString("target_handle"), rs.getString("run_at"), e.getMessage());
                        log.error("job.corrupt jobId={} target={} runAt='{}': {}",
                                row.id(), row.targetHandle(), row.rawRunAt(), row.problem());
                        corrupt.add(row);
                    }
                }
            }
        } catch (SQLException e) {
            throw new JobPersistenceException("Failed to scan scheduled jobs", e);
        }
        return new ScheduledScan(jobs, corrupt);
    }

    @Override
    public List<Job> findByHandle(String targetHandle) {
        return query("SELECT " + COLUMNS + " FROM jobs WHERE target_handle = ? ORDER BY id DESC",
                ps -> ps.setString(1, targetHandle));
    }

    @Override
    public List<Job> listRecent(int limit) {
        if (limit <= 0) {
            throw new IllegalArgumentException("limit must be > 0");
        }
        return query("SELECT " + COLUMNS + " FROM jobs ORDER BY id DESC LIMIT ?",
                ps -> ps.setInt(1, limit));
    }

    @Override
    public List<Long> failInterrupted(String reason) {
        writeLock.lock();
        try (Connection c = database.openConnection()) {
            List<Long> ids = new ArrayList<>();
            try (PreparedStatement ps = c.prepareStatement("SELECT id FROM jobs WHERE status = 'IN_PROGRESS'");
                 ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    ids.add(rs.getLong(1));
                }
            }
            for (Long id : ids) {
                updateStatus(c, id, JobStatus.FAILED, reason, "status = 'IN_PROGRESS'");
                log.warn("job.interrupted jobId={} status=FAILED reason='{}'", id, reason);
            }
            return ids;
        } catch (SQLException e) {
            throw new JobPersistenceException("Failed to fail interrupted jobs", e);
        } finally {
            writeLock.unlock();
        }
    }

    // ========== Helpers ==========

    private boolean transition(long id, JobStatus target, String error, String guard) {
        writeLock.lock();
        try (Connection c = database.openConnection()) {
            boolean changed = updateStatus(c, id, target, error, guard);
            if (changed) {
                log.debug("job.transition jobId={} status={}", id, target);
            } else {
                log.debug("job.transition_skipped jobId={} target={}", id, target);
            }
            return changed;
        } catch (SQLException e) {
            throw new JobPersistenceException("Failed to move job " + id + " to " + target, e);
        } finally {
            writeLock.unlock();
        }
    }

    private boolean updateStatus(Connection c, long id, JobStatus target, String error, String guard)
            throws SQLException {
        boolean terminal = target.isTerminal();
        try (PreparedStatement ps = c.prepareStatement(
                "UPDATE jobs SET status=?, finished_at_ms=?, last_error=? WHERE id=? AND " + guard)) {
            ps.setString(1, target.name());
            if (terminal) {
                ps.setLong(2, clock.millis());
            } else {
                ps.setNull(2, Types.INTEGER);
            }
            ps.setString(3, error);
            ps.setLong(4, id);
            return ps.executeUpdate() == 1;
        }
    }

    private Optional<Long> findLiveId(Connection c, JobType type, String handle, long epoch) throws SQLException {
        try (PreparedStatement ps = c.prepareStatement(
                "SELECT id FROM jobs WHERE job_type=? AND target_handle=? AND run_at_epoch=? "
                        + "AND status IN ('SCHEDULED', 'IN_PROGRESS')")) {
            ps.setString(1, type.name());
            ps.setString(2, handle);
            ps.setLong(3, epoch);
            try (ResultSet rs = ps.executeQuery()) {
                return rs.next() ? Optional.of(rs.getLong(1)) : Optional.empty();
            }
        }
    }

    private static long lastInsertId(Connection c) throws SQLException {
        try (Statement st = c.createStatement(); ResultSet rs = st.executeQuery("SELECT last_insert_rowid()")) {
            if (!rs.next()) {
                throw new SQLException("last_insert_rowid() returned no row");
            }
            return rs.getLong(1);
        }
    }

    private Optional<Job> readById(Connection c, long id) throws SQLException {
        try (PreparedStatement ps = c.prepareStatement("SELECT " + COLUMNS + " FROM jobs WHERE id = ?")) {
            ps.setLong(1, id);
            try (ResultSet rs = ps.executeQuery()) {
                if (!rs.next()) {
                    return Optional.empty();
                }
                try {
                    return Optional.of(mapRow(rs));
                } catch (DateTimeParseException | IllegalArgumentException e) {
                    throw new JobPersistenceException("Job " + id + " is unreadable: " + e.getMessage(), e);
                }
            }
        }
    }

    private List<Job> query(String sql, StatementBinder binder) {
        List<Job> jobs = new ArrayList<>();
        try (Connection c = database.openConnection(); PreparedStatement ps = c.prepareStatement(sql)) {
            binder.bind(ps);
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    try {
                        jobs.add(mapRow(rs));
                    } catch (DateTimeParseException | IllegalArgumentException e) {
                        log.warn("Skipping unreadable job row {}: {}", rs.getLong("id"), e.getMessage());
                    }
                }
            }
        } catch (SQLException e) {
            throw new JobPersistenceException("Failed to query jobs", e);
        }
        return jobs;
    }

    private Job mapRow(ResultSet rs) throws SQLException {
        long finishedAt = rs.getLong("finished_at_ms");
        Instant finished = rs.wasNull() ? null : Instant.ofEpochMilli(finishedAt);
        return Job.builder()
                .id(rs.getLong("id"))
                .jobType(JobType.valueOf(rs.getString("job_type")))
                .targetHandle(rs.getString("target_handle"))
                .runAt(ZonedDateTime.parse(rs.getString("run_at"), DateTimeFormatter.ISO_ZONED_DATE_TIME))
                .status(JobStatus.valueOf(rs.getString("status")))
                .createdBy(rs.getString("created_by"))
                .metadata(readMeta(rs.getLong("id"), rs.getString("meta")))
                .createdAt(Instant.ofEpochMilli(rs.getLong("created_at_ms")))
                .finishedAt(finished)
                .lastError(rs.getString("last_error"))
                .build();
    }

    private String writeMeta(Map<String, String> metadata) {
        try {
            return objectMapper.writeValueAsString(metadata != null ? metadata : Map.of());
        } catch (JsonProcessingException e) {
            throw new JobPersistenceException("Failed to serialize job metadata", e);
        }
    }

    private Map<String, String> readMeta(long id, String json) {
        if (json == null || json.isBlank()) {
            return Map.of();
        }
        try {
            return objectMapper.readValue(json, META_TYPE);
        } catch (JsonProcessingException e) {
            log.warn("Job {} has unreadable metadata, using empty map: {}", id, e.getOriginalMessage());
            return Map.of();
        }
    }

    @FunctionalInterface
    private interface StatementBinder {
        void bind(PreparedStatement ps) throws SQLException;
    }
}
