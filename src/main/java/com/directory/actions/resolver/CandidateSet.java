package com.directory.actions.resolver;

import com.directory.actions.core.model.Identity;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Ranked candidates for one query, best first.
 * Transient: lives for one resolution call plus any pending disambiguation.
 */
public record CandidateSet(String query, List<ScoredIdentity> candidates) {

    public CandidateSet {
        Objects.requireNonNull(query, "query is required");
        candidates = candidates != null ? List.copyOf(candidates) : List.of();
    }

    public static CandidateSet empty(String query) {
        return new CandidateSet(query, List.of());
    }

    public boolean isEmpty() {
        return candidates.isEmpty();
    }

    public int size() {
        return candidates.size();
    }

    /**
     * Whether exactly one identity matched, so no confirmation round-trip is needed.
     */
    public boolean isUnambiguous() {
        return candidates.size() == 1;
    }

    public Optional<Identity> single() {
        return isUnambiguous() ? Optional.of(candidates.get(0).identity()) : Optional.empty();
    }

    public List<Identity> identities() {
        return candidates.stream().map(ScoredIdentity::identity).toList();
    }

    /**
     * Finds a candidate by handle, ignoring case.
     */
    public Optional<Identity> findByHandle(String handle) {
        if (handle == null) {
            return Optional.empty();
        }
        return candidates.stream()
                .map(ScoredIdentity::identity)
                .filter(identity -> identity.handle().equalsIgnoreCase(handle))
                .findFirst();
    }
}
