package com.directory.actions.disambiguation;

import com.directory.actions.core.model.Identity;
import com.directory.actions.core.model.PendingAction;
import com.directory.actions.resolver.CandidateSet;
import com.directory.actions.resolver.ScoredIdentity;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;

import static org.junit.jupiter.api.Assertions.*;

class CaffeineSessionStoreTest {

    private final AtomicLong nanos = new AtomicLong();
    private CaffeineSessionStore store;

    @BeforeEach
    void setUp() {
        store = new CaffeineSessionStore(new SessionConfig(100, Duration.ofMinutes(30)), nanos::get);
    }

    private static DisambiguationSession session() {
        CandidateSet candidates = new CandidateSet("Ivanova", List.of(
                new ScoredIdentity(new Identity("nivanova", "Ivanova N.", "", true), 0.95),
                new ScoredIdentity(new Identity("mivanova", "Ivanova M.", "", true), 0.94)));
        return new DisambiguationSession(PendingAction.reset("Ivanova", "42"), candidates, "42", Instant.EPOCH);
    }

    @Test
    @DisplayName("A stored session is taken exactly once")
    void testTakeOnce() {
        DisambiguationToken token = DisambiguationToken.generate();
        store.put(token, session());

        assertEquals(1, store.size());
        assertTrue(store.take(token).isPresent());
        assertTrue(store.take(token).isEmpty());
        assertEquals(0, store.size());
    }

    @Test
    @DisplayName("Sessions expire after the ttl")
    void testExpiry() {
        DisambiguationToken token = DisambiguationToken.generate();
        store.put(token, session());

        nanos.addAndGet(TimeUnit.MINUTES.toNanos(31));

        assertTrue(store.take(token).isEmpty());
    }

    @Test
    @DisplayName("Sessions within the ttl survive")
    void testWithinTtl() {
        DisambiguationToken token = DisambiguationToken.generate();
        store.put(token, session());

        nanos.addAndGet(TimeUnit.MINUTES.toNanos(29));

        assertTrue(store.take(token).isPresent());
    }

    @Test
    @DisplayName("A zero ttl is rejected")
    void testZeroTtl() {
        assertThrows(IllegalArgumentException.class,
                () -> new CaffeineSessionStore(new SessionConfig(10, Duration.ZERO)));
    }
}
