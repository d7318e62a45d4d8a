package com.tsl.tripsearch.facts;

import com.tsl.tripsearch.trip.SourceTrip;

/**
 * A trip with its facts. {@code stale} is set when the facts were known to lag the trip and were not refreshed.
 */
public record TripWithFacts(SourceTrip trip, FactsRow facts, boolean stale) {
}
