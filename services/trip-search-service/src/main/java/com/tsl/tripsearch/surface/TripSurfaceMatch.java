package com.tsl.tripsearch.surface;

import java.time.LocalDate;
import java.util.List;

public record TripSurfaceMatch(
    long tripId,
    String tripName,
    String tripSlug,
    String status,
    LocalDate startDate,
    LocalDate endDate,
    String destinations,
    String primaryClientName,
    String primaryClientEmail,
    List<String> travelerNames,
    List<String> travelerEmails,
    int travelerCount,
    int score,
    List<String> matchedTokens,
    List<String> matchReasons
) {
    static TripSurfaceMatch of(SearchSurfaceRow row, int score, List<String> matchedTokens, List<String> reasons) {
        return new TripSurfaceMatch(
            row.tripId(),
            row.tripName(),
            row.tripSlug(),
            row.status(),
            row.startDate(),
            row.endDate(),
            row.destinations(),
            row.primaryClientName(),
            row.primaryClientEmail(),
            row.travelerNames(),
            row.travelerEmails(),
            row.travelerCount(),
            score,
            List.copyOf(matchedTokens),
            List.copyOf(reasons)
        );
    }
}
