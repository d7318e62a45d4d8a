package com.tsl.tripsearch.trip;

import java.time.Instant;
import java.time.LocalDate;
import java.util.List;

/**
 * Typed read model of a trip and its child rows. Every derived row is computed from this projection.
 */
public record SourceTrip(
    long tripId,
    String name,
    String slug,
    TripStatus status,
    LocalDate startDate,
    LocalDate endDate,
    String destinations,
    String primaryClientEmail,
    String primaryClientName,
    List<Traveler> travelers,
    List<TripActivity> activities,
    List<TransitLeg> legs,
    double totalCost,
    double paidAmount,
    String notes,
    Instant updatedAt
) {
    public SourceTrip {
        travelers = travelers == null ? List.of() : List.copyOf(travelers);
        activities = activities == null ? List.of() : List.copyOf(activities);
        legs = legs == null ? List.of() : List.copyOf(legs);
    }

    public TripHeader header() {
        return new TripHeader(
            tripId,
            name,
            slug,
            status,
            startDate,
            endDate,
            destinations,
            primaryClientEmail,
            primaryClientName,
            updatedAt
        );
    }
}
