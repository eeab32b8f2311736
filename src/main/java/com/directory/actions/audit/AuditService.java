package com.directory.actions.audit;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Records and queries audit entries.
 *
 * <p>Recording is best-effort: a repository failure is logged at WARN and never reaches the
 * caller, so an audit outage cannot fail a directory action or a job transition.</p>
 */
public class AuditService {
    private static final Logger log = LoggerFactory.getLogger(AuditService.class);

    private final AuditRepository repository;
    private final Clock clock;

    public AuditService() {
        this(new InMemoryAuditRepository());
    }

    public AuditService(AuditRepository repository) {
        this(repository, Clock.systemUTC());
    }

    public AuditService(AuditRepository repository, Clock clock) {
        this.repository = repository;
        this.clock = clock;
    }

    /**
     * Records an entry.
     *
     * @return the stored entry, or empty if the repository rejected it
     */
    public Optional<AuditEntry> record(String actorId, AuditAction action, String target,
                                       Map<String, String> details) {
        AuditEntry entry = AuditEntry.builder()
                .action(action)
                .target(target)
                .actorId(actorId)
                .details(details)
                .timestamp(clock.instant())
                .build();
        try {
            repository.save(entry);
            log.debug("audit.recorded action={} target={} actor={} outcome={}",
                    action.wireName(), target, actorId, entry.outcome().orElse("-"));
            return Optional.of(entry);
        } catch (RuntimeException e) {
            log.warn("audit.write_failed action={} target={} actor={}: {}",
                    action.wireName(), target, actorId, e.getMessage(), e);
            return Optional.empty();
        }
    }

    public Optional<AuditEntry> record(String actorId, AuditAction action, String target) {
        return record(actorId, action, target, null);
    }

    public List<AuditEntry> findByTarget(String target) {
        return repository.findByTarget(target);
    }

    public List<AuditEntry> findByAction(AuditAction action) {
        return repository.findByAction(action);
    }

    public List<AuditEntry> findRecent(int limit) {
        return repository.findRecent(limit);
    }

    public int size() {
        return repository.count();
    }
}
