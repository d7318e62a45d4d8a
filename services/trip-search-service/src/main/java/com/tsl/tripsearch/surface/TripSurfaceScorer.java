package com.tsl.tripsearch.surface;

import com.tsl.tripsearch.config.TripSearchProperties;
import com.tsl.tripsearch.query.ClassifiedQuery;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import org.springframework.stereotype.Component;

/**
 * Additive relevance scoring over search surface rows.
 *
 * <p>Exact identifiers (slug, trip id, email) dominate token overlap. Each query token contributes only its first
 * matching signal. Ranking is by score, then most recently synced, then lowest trip id.
 */
@Component
public class TripSurfaceScorer {
    static final String SLUG_EXACT = "slug_exact";
    static final String TRIP_ID_EXACT = "trip_id_exact";
    static final String PRIMARY_EMAIL_EXACT = "primary_email_exact";
    static final String TRAVELER_EMAIL_MATCH = "traveler_email_match";
    static final String TOKEN_MATCH = "token_match";
    static final String PHONETIC_MATCH = "phonetic_match";
    static final String NORMALIZED_TRIP_NAME = "normalized_trip_name";
    static final String DESTINATION_MATCH = "destination_match";
    static final String TRAVELER_MATCH = "traveler_match";
    static final String EMAIL_TOKEN = "email_token";
    static final String PRIMARY_CLIENT_NAME = "primary_client_name";
    static final String TRIP_NAME_PARTIAL = "trip_name_partial";
    static final String CONFIRMED = "confirmed";

    private static final Comparator<Scored> RANKING = Comparator
        .comparingInt((Scored scored) -> scored.match().score()).reversed()
        .thenComparing(scored -> scored.lastSynced(), Comparator.nullsLast(Comparator.<Instant>reverseOrder()))
        .thenComparingLong(scored -> scored.match().tripId());

    private final ScoringWeights weights;

    public TripSurfaceScorer(TripSearchProperties properties) {
        this.weights = properties.getScoring().toWeights();
    }

    public List<TripSurfaceMatch> rank(ClassifiedQuery query, List<SearchSurfaceRow> rows, int limit) {
        Set<Long> seen = new HashSet<>();
        List<Scored> scored = new ArrayList<>();
        for (SearchSurfaceRow row : rows) {
            if (seen.add(row.tripId())) {
                scored.add(new Scored(score(query, row), row.lastSynced()));
            }
        }
        scored.sort(RANKING);
        return scored.stream()
            .limit(Math.max(0, limit))
            .map(Scored::match)
            .toList();
    }

    public TripSurfaceMatch score(ClassifiedQuery query, SearchSurfaceRow row) {
        int score = 0;
        Set<String> matched = new LinkedHashSet<>();
        List<String> reasons = new ArrayList<>();

        String slug = query.slugCandidate();
        if (slug != null && row.tripSlug() != null && slug.equals(row.tripSlug().toLowerCase(Locale.ROOT))) {
            score += weights.slugExact();
            matched.add(slug);
            reasons.add(SLUG_EXACT);
        }

        for (Long id : query.numericIds()) {
            if (id == row.tripId()) {
                score += weights.tripIdExact();
                matched.add(String.valueOf(id));
                reasons.add(TRIP_ID_EXACT);
            }
        }

        String travelerEmails = lower(String.join(" ", row.travelerEmails()));
        for (String email : query.emails()) {
            if (row.primaryClientEmail() != null && email.equals(lower(row.primaryClientEmail()))) {
                score += weights.primaryEmailExact();
                matched.add(email);
                reasons.add(PRIMARY_EMAIL_EXACT);
            } else if (travelerEmails.contains(email)) {
                score += weights.travelerEmailMatch();
                matched.add(email);
                reasons.add(TRAVELER_EMAIL_MATCH);
            }
        }

        Set<String> searchTokens = new HashSet<>(row.searchTokens());
        Set<String> phoneticTokens = new HashSet<>(row.phoneticTokens());
        String normalizedTripName = nullToEmpty(row.normalizedTripName());
        String destinations = lower(row.destinations());
        String normalizedDestinations = nullToEmpty(row.normalizedDestinations());
        String normalizedTravelers = nullToEmpty(row.normalizedTravelers());
        String travelerNames = lower(String.join(" ", row.travelerNames()));
        String normalizedEmails = nullToEmpty(row.normalizedEmails());
        String primaryName = lower(row.primaryClientName());
        String tripName = lower(row.tripName());

        for (String token : query.tokens()) {
            String reason;
            int points;
            if (searchTokens.contains(token)) {
                reason = TOKEN_MATCH;
                points = weights.tokenMatch();
            } else if (phoneticTokens.contains(token)) {
                reason = PHONETIC_MATCH;
                points = weights.phoneticMatch();
            } else if (normalizedTripName.contains(token)) {
                reason = NORMALIZED_TRIP_NAME;
                points = weights.normalizedTripName();
            } else if (destinations.contains(token) || normalizedDestinations.contains(token)) {
                reason = DESTINATION_MATCH;
                points = weights.destinationMatch();
            } else if (normalizedTravelers.contains(token) || travelerNames.contains(token)) {
                reason = TRAVELER_MATCH;
                points = weights.travelerMatch();
            } else if (normalizedEmails.contains(token)) {
                reason = EMAIL_TOKEN;
                points = weights.emailToken();
            } else if (primaryName.contains(token)) {
                reason = PRIMARY_CLIENT_NAME;
                points = weights.primaryClientName();
            } else if (tripName.contains(token)) {
                reason = TRIP_NAME_PARTIAL;
                points = weights.tripNamePartial();
            } else {
                continue;
            }
            score += points;
            matched.add(token);
            reasons.add(reason);
        }

        if (CONFIRMED.equals(lower(row.status()))) {
            score += weights.confirmedStatus();
        }
        if (row.travelerCount() > 0) {
            score += Math.min(row.travelerCount(), weights.maxTravelerBonus());
        }

        return TripSurfaceMatch.of(row, score, new ArrayList<>(matched), reasons);
    }

    private static String lower(String value) {
        return value == null ? "" : value.toLowerCase(Locale.ROOT);
    }

    private static String nullToEmpty(String value) {
        return value == null ? "" : value;
    }

    private record Scored(TripSurfaceMatch match, Instant lastSynced) {
    }
}
