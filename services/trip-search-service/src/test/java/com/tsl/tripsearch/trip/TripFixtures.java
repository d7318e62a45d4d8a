package com.tsl.tripsearch.trip;

import java.time.Instant;
import java.time.LocalDate;
import java.util.List;

public final class TripFixtures {
    public static final Instant UPDATED_AT = Instant.parse("2025-03-01T10:00:00Z");

    private TripFixtures() {
    }

    public static SourceTrip trip(long tripId, String name, String destinations, String primaryEmail, String primaryName) {
        return trip(tripId, name, null, TripStatus.PLANNING, destinations, primaryEmail, primaryName, List.of(), List.of());
    }

    public static SourceTrip trip(
        long tripId,
        String name,
        String slug,
        TripStatus status,
        String destinations,
        String primaryEmail,
        String primaryName,
        List<Traveler> travelers,
        List<TripActivity> activities
    ) {
        return new SourceTrip(
            tripId,
            name,
            slug,
            status,
            null,
            null,
            destinations,
            primaryEmail,
            primaryName,
            travelers,
            activities,
            List.of(),
            0.0,
            0.0,
            null,
            UPDATED_AT
        );
    }

    public static SourceTrip dated(SourceTrip trip, LocalDate start, LocalDate end) {
        return new SourceTrip(
            trip.tripId(),
            trip.name(),
            trip.slug(),
            trip.status(),
            start,
            end,
            trip.destinations(),
            trip.primaryClientEmail(),
            trip.primaryClientName(),
            trip.travelers(),
            trip.activities(),
            trip.legs(),
            trip.totalCost(),
            trip.paidAmount(),
            trip.notes(),
            trip.updatedAt()
        );
    }
}
