package com.directory.actions.disambiguation;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * Session store without expiry. Sessions live until they are taken.
 */
public class InMemorySessionStore implements SessionStore {
    private static final Logger log = LoggerFactory.getLogger(InMemorySessionStore.class);

    private final ConcurrentMap<DisambiguationToken, DisambiguationSession> sessions = new ConcurrentHashMap<>();

    @Override
    public void put(DisambiguationToken token, DisambiguationSession session) {
        sessions.put(token, session);
        log.debug("Stored disambiguation session {} ({} candidates)", token, session.candidates().size());
    }

    @Override
    public Optional<DisambiguationSession> take(DisambiguationToken token) {
        return Optional.ofNullable(sessions.remove(token));
    }

    @Override
    public long size() {
        return sessions.size();
    }
}
