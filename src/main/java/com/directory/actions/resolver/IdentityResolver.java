package com.directory.actions.resolver;

import com.directory.actions.core.model.Identity;
import com.directory.actions.directory.DirectoryException;
import com.directory.actions.directory.DirectorySearch;
import com.directory.actions.directory.InputSanitizer;
import com.directory.actions.similarity.WeightedNameScorer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Turns a free-text query into a ranked {@link CandidateSet}.
 *
 * <p>The raw directory search does the loose substring filtering; ranking happens here with
 * {@link WeightedNameScorer}. A failed or empty search yields an empty set, never an exception,
 * so callers report "not found" instead of a fault.</p>
 */
public class IdentityResolver {
    private static final Logger log = LoggerFactory.getLogger(IdentityResolver.class);

    public static final int DEFAULT_LIMIT = 10;

    private final DirectorySearch directorySearch;
    private final WeightedNameScorer scorer;
    private final int defaultLimit;

    public IdentityResolver(DirectorySearch directorySearch) {
        this(directorySearch, new WeightedNameScorer(), DEFAULT_LIMIT);
    }

    public IdentityResolver(DirectorySearch directorySearch, WeightedNameScorer scorer, int defaultLimit) {
        if (defaultLimit <= 0) {
            throw new IllegalArgumentException("defaultLimit must be > 0");
        }
        this.directorySearch = directorySearch;
        this.scorer = scorer;
        this.defaultLimit = defaultLimit;
    }

    public CandidateSet resolve(String query) {
        return resolve(query, defaultLimit);
    }

    public CandidateSet resolve(String query, int limit) {
        if (limit <= 0) {
            throw new IllegalArgumentException("limit must be > 0");
        }
        if (query == null || query.isBlank()) {
            return CandidateSet.empty(query == null ? "" : query);
        }
        try {
            InputSanitizer.validateQuery(query);
        } catch (IllegalArgumentException e) {
            log.warn("resolver.rejected reason={}", e.getMessage());
            return CandidateSet.empty(query);
        }

        List<Identity> raw;
        try {
            raw = directorySearch.search(query.strip());
        } catch (DirectoryException | RuntimeException e) {
            log.warn("resolver.search_failed query='{}': {}", query, e.getMessage(), e);
            return CandidateSet.empty(query);
        }
        if (raw == null || raw.isEmpty()) {
            log.debug("resolver.no_match query='{}'", query);
            return CandidateSet.empty(query);
        }

        List<ScoredIdentity> scored = new ArrayList<>(raw.size());
        for (Identity identity : raw) {
            scored.add(new ScoredIdentity(identity, scorer.score(query, identity)));
        }
        // List.sort is stable: equal scores keep the directory's order
        scored.sort(Comparator.comparingDouble(ScoredIdentity::score).reversed());
        List<ScoredIdentity> top = scored.size() > limit ? scored.subList(0, limit) : scored;

        log.debug("resolver.ranked query='{}' raw={} returned={}", query, raw.size(), top.size());
        return new CandidateSet(query, top);
    }
}
