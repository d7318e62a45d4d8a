package com.tsl.tripsearch.search;

import com.tsl.tripsearch.fallback.FallbackAttempt;
import com.tsl.tripsearch.fallback.FallbackTier;
import com.tsl.tripsearch.query.ClassifiedTerm;
import com.tsl.tripsearch.query.SearchMode;
import com.tsl.tripsearch.surface.TripSurfaceMatch;
import java.util.List;

/**
 * Ranked matches plus how they were found. When {@code tier} is exhausted the match list is empty and
 * {@code suggestion} tells the caller how to narrow the query.
 */
public record TripSearchResult(
    String query,
    SearchMode mode,
    List<ClassifiedTerm> terms,
    String primaryTerm,
    FallbackTier tier,
    String strategy,
    List<TripSurfaceMatch> matches,
    String message,
    String suggestion,
    List<FallbackAttempt> attempts
) {
    public boolean hasMatches() {
        return !matches.isEmpty();
    }
}
