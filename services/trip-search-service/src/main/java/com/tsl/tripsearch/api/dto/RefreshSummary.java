package com.tsl.tripsearch.api.dto;

public record RefreshSummary(String scope, int refreshed) {
}
