package com.tsl.tripsearch.api.dto;

public record ReindexSummary(long tripId, int componentCount) {
}
