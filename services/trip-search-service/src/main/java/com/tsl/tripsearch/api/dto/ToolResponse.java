package com.tsl.tripsearch.api.dto;

/**
 * Envelope for every successful tool call.
 */
public record ToolResponse<T>(String traceId, String requestId, T result) {
}
