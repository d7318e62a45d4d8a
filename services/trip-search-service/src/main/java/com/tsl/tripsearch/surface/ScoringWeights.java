package com.tsl.tripsearch.surface;

/**
 * Additive signal weights used by {@link TripSurfaceScorer}.
 */
public record ScoringWeights(
    int slugExact,
    int tripIdExact,
    int primaryEmailExact,
    int travelerEmailMatch,
    int tokenMatch,
    int phoneticMatch,
    int normalizedTripName,
    int destinationMatch,
    int travelerMatch,
    int emailToken,
    int primaryClientName,
    int tripNamePartial,
    int confirmedStatus,
    int maxTravelerBonus
) {
    public static ScoringWeights defaults() {
        return new ScoringWeights(160, 140, 120, 80, 22, 14, 12, 10, 9, 7, 6, 6, 3, 5);
    }
}
