package com.tsl.tripsearch.facts;

import java.util.List;

/**
 * Aggregates derived from one trip. Contains no bookkeeping fields, so two computations over the same source
 * compare equal.
 */
public record TripFacts(
    int totalNights,
    int totalHotels,
    int totalActivities,
    double totalCost,
    long transitMinutes,
    int travelerCount,
    List<String> travelerNames,
    List<String> travelerEmails,
    String primaryClientEmail,
    String primaryClientName
) {
    public TripFacts {
        travelerNames = travelerNames == null ? List.of() : List.copyOf(travelerNames);
        travelerEmails = travelerEmails == null ? List.of() : List.copyOf(travelerEmails);
    }
}
