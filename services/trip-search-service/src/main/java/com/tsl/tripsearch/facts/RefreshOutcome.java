package com.tsl.tripsearch.facts;

/**
 * Result of recomputing a trip's derived rows. {@code facts} is null when the trip no longer exists.
 */
public record RefreshOutcome(long tripId, boolean removed, FactsRow facts, int componentCount) {
}
