package com.tsl.tripsearch.dirty;

import java.time.Instant;

public record DirtyMarker(long id, long tripId, String reason, Instant createdAt) {
}
