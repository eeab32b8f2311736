package com.directory.actions.disambiguation;

import com.directory.actions.core.model.PendingAction;
import com.directory.actions.resolver.CandidateSet;

import java.time.Instant;
import java.util.Objects;

/**
 * Pending action bound to the candidates the requester must choose from.
 *
 * @param pendingAction action to run once an identity is chosen
 * @param candidates    the choices that were presented
 * @param owner         principal expected to answer
 * @param openedAt      creation time
 */
public record DisambiguationSession(
        PendingAction pendingAction,
        CandidateSet candidates,
        String owner,
        Instant openedAt
) {
    public DisambiguationSession {
        Objects.requireNonNull(pendingAction, "pendingAction is required");
        Objects.requireNonNull(candidates, "candidates is required");
        Objects.requireNonNull(openedAt, "openedAt is required");
    }
}
