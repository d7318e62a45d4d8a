package com.tsl.tripsearch.dirty;

import java.time.Instant;
import java.util.List;

/**
 * Durable, at-least-once queue of "derived rows for this trip are out of date" markers.
 *
 * <p>Markers are identified by an increasing id. Consumers read the highest id for a trip before recomputing and
 * acknowledge up to that id afterwards, so markers written during a recomputation stay pending.
 */
public interface DirtyMarkerQueue {

    /**
     * Adds a marker. Returns false when an identical (trip, reason, timestamp) marker already exists.
     */
    boolean enqueue(long tripId, DirtyReason reason, Instant createdAt);

    /**
     * Distinct trip ids with pending markers, oldest marker first.
     */
    List<Long> pendingTripIds(int limit);

    List<DirtyMarker> pendingMarkers(long tripId);

    /**
     * Highest pending marker id for the trip, or 0 when none is pending.
     */
    long latestMarkerId(long tripId);

    int acknowledge(long tripId, long upToMarkerId);
}
