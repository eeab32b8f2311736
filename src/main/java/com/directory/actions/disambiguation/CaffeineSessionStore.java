package com.directory.actions.disambiguation;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.RemovalCause;
import com.github.benmanes.caffeine.cache.Ticker;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Optional;

/**
 * Caffeine-backed session store. Sessions expire a fixed time after they are opened,
 * and the oldest are evicted once the size bound is reached.
 */
public class CaffeineSessionStore implements SessionStore {
    private static final Logger log = LoggerFactory.getLogger(CaffeineSessionStore.class);

    private final Cache<DisambiguationToken, DisambiguationSession> sessions;

    public CaffeineSessionStore(SessionConfig config) {
        this(config, Ticker.systemTicker());
    }

    CaffeineSessionStore(SessionConfig config, Ticker ticker) {
        if (!config.expires()) {
            throw new IllegalArgumentException("CaffeineSessionStore needs a positive ttl");
        }
        this.sessions = Caffeine.newBuilder()
                .maximumSize(config.maxSessions())
                .expireAfterWrite(config.ttl())
                .ticker(ticker)
                .removalListener((DisambiguationToken token, DisambiguationSession session, RemovalCause cause) -> {
                    if (cause == RemovalCause.EXPIRED || cause == RemovalCause.SIZE) {
                        log.info("disambiguation.expired token={} cause={}", token, cause);
                    }
                })
                .build();
        log.info("CaffeineSessionStore initialized: maxSessions={}, ttl={}", config.maxSessions(), config.ttl());
    }

    @Override
    public void put(DisambiguationToken token, DisambiguationSession session) {
        sessions.put(token, session);
    }

    @Override
    public Optional<DisambiguationSession> take(DisambiguationToken token) {
        return Optional.ofNullable(sessions.asMap().remove(token));
    }

    @Override
    public long size() {
        sessions.cleanUp();
        return sessions.estimatedSize();
    }
}
