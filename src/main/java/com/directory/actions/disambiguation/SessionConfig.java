package com.directory.actions.disambiguation;

import java.time.Duration;

/**
 * Limits for the session store.
 *
 * @param maxSessions maximum number of open sessions
 * @param ttl         expiry after creation; {@link Duration#ZERO} disables expiry
 */
public record SessionConfig(int maxSessions, Duration ttl) {

    public SessionConfig {
        if (maxSessions <= 0) {
            throw new IllegalArgumentException("maxSessions must be > 0");
        }
        if (ttl == null || ttl.isNegative()) {
            throw new IllegalArgumentException("ttl must be zero or positive");
        }
    }

    /**
     * 1,000 sessions, 30 minute expiry.
     */
    public static SessionConfig defaults() {
        return new SessionConfig(1_000, Duration.ofMinutes(30));
    }

    public boolean expires() {
        return !ttl.isZero();
    }
}
