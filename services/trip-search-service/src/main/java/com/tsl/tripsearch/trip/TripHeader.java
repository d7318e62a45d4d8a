package com.tsl.tripsearch.trip;

import java.time.Instant;
import java.time.LocalDate;

/**
 * Trip columns without child rows, as returned by the narrower search tiers.
 */
public record TripHeader(
    long tripId,
    String name,
    String slug,
    TripStatus status,
    LocalDate startDate,
    LocalDate endDate,
    String destinations,
    String primaryClientEmail,
    String primaryClientName,
    Instant updatedAt
) {
}
