package com.tsl.tripsearch.api.dto;

import com.tsl.tripsearch.facts.FactsRow;

public record FactsStatus(long tripId, boolean exists, FactsRow facts) {
}
