package com.directory.actions.disambiguation;

import java.util.Optional;

/**
 * Process-local storage for open disambiguation sessions.
 * Nothing here is durable: a restart only loses in-flight selections.
 */
public interface SessionStore {

    /**
     * Stores a session under a fresh token.
     */
    void put(DisambiguationToken token, DisambiguationSession session);

    /**
     * Atomically removes and returns the session for a token.
     *
     * @return the session, or empty if unknown, expired or already taken
     */
    Optional<DisambiguationSession> take(DisambiguationToken token);

    /**
     * Number of sessions currently held.
     */
    long size();
}
