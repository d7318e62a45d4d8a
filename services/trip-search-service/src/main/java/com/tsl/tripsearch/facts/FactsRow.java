package com.tsl.tripsearch.facts;

import java.time.Instant;

public record FactsRow(long tripId, TripFacts facts, long version, Instant lastComputed) {
}
