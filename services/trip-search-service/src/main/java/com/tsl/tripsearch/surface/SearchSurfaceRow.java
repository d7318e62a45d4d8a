package com.tsl.tripsearch.surface;

import java.time.Instant;
import java.time.LocalDate;
import java.util.List;

/**
 * Denormalized, pre-tokenized projection of one trip used for candidate retrieval and scoring.
 */
public record SearchSurfaceRow(
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
    String normalizedTripName,
    String normalizedDestinations,
    String normalizedTravelers,
    String normalizedEmails,
    List<String> searchTokens,
    List<String> phoneticTokens,
    int travelerCount,
    Instant lastSynced
) {
    public SearchSurfaceRow {
        travelerNames = travelerNames == null ? List.of() : List.copyOf(travelerNames);
        travelerEmails = travelerEmails == null ? List.of() : List.copyOf(travelerEmails);
        searchTokens = searchTokens == null ? List.of() : List.copyOf(searchTokens);
        phoneticTokens = phoneticTokens == null ? List.of() : List.copyOf(phoneticTokens);
    }
}
