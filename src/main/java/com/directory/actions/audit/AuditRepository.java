package com.directory.actions.audit;

import java.util.List;

/**
 * Append-only persistence for audit entries.
 * Implementations may throw unchecked exceptions; {@link AuditService} absorbs them.
 */
public interface AuditRepository {

    AuditEntry save(AuditEntry entry);

    /**
     * Entries for one target, oldest first.
     */
    List<AuditEntry> findByTarget(String target);

    /**
     * Entries of one action type, oldest first.
     */
    List<AuditEntry> findByAction(AuditAction action);

    /**
     * The most recent entries, oldest first, up to {@code limit}.
     */
    List<AuditEntry> findRecent(int limit);

    int count();
}
