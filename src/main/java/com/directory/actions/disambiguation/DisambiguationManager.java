package com.directory.actions.disambiguation;

import com.directory.actions.core.model.Identity;
import com.directory.actions.core.model.PendingAction;
import com.directory.actions.resolver.CandidateSet;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.Optional;

/**
 * Binds a pending action to the candidates presented to the requester and settles it once a
 * choice comes back.
 *
 * <p>Tokens are single-use: {@link #resolve} removes the session on every lookup, whether or not
 * the chosen handle was one of the candidates. Stale, forged and replayed tokens fail closed.</p>
 */
public class DisambiguationManager {
    private static final Logger log = LoggerFactory.getLogger(DisambiguationManager.class);

    private final SessionStore store;
    private final Clock clock;

    public DisambiguationManager(SessionStore store) {
        this(store, Clock.systemUTC());
    }

    public DisambiguationManager(SessionStore store, Clock clock) {
        this.store = store;
        this.clock = clock;
    }

    /**
     * Opens a session for an ambiguous query.
     *
     * @param pending    the action waiting for an identity
     * @param candidates at least two candidates
     * @param owner      principal expected to choose
     * @return the token to send along with the choices
     * @throws IllegalArgumentException if fewer than two candidates are given
     */
    public DisambiguationToken open(PendingAction pending, CandidateSet candidates, String owner) {
        if (candidates.size() < 2) {
            throw new IllegalArgumentException(
                    "Disambiguation needs at least two candidates, got " + candidates.size());
        }
        DisambiguationToken token = DisambiguationToken.generate();
        store.put(token, new DisambiguationSession(pending, candidates, owner, clock.instant()));
        log.info("disambiguation.opened token={} kind={} query='{}' candidates={} owner={}",
                token, pending.kind(), pending.targetQuery(), candidates.size(), owner);
        return token;
    }

    /**
     * Consumes the session behind a token.
     *
     * @param token         token from the selection payload
     * @param chosenHandle  handle the requester picked
     * @return the pending action and chosen identity, or empty when the token is unknown,
     *         expired or already used, or the handle was not among the candidates
     */
    public Optional<ResolvedSelection> resolve(DisambiguationToken token, String chosenHandle) {
        Optional<DisambiguationSession> session = store.take(token);
        if (session.isEmpty()) {
            log.info("disambiguation.not_found token={}", token);
            return Optional.empty();
        }
        Optional<Identity> chosen = session.get().candidates().findByHandle(chosenHandle);
        if (chosen.isEmpty()) {
            log.warn("disambiguation.foreign_choice token={} handle={}", token, chosenHandle);
            return Optional.empty();
        }
        log.info("disambiguation.resolved token={} handle={}", token, chosen.get().handle());
        return Optional.of(new ResolvedSelection(
                session.get().pendingAction(), chosen.get(), session.get().owner()));
    }

    public long openSessions() {
        return store.size();
    }
}
