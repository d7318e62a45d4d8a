package com.tsl.tripsearch.dirty;

import static org.assertj.core.api.Assertions.assertThat;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import org.junit.jupiter.api.Test;

class DirtyMarkingChangeListenerTest {

    @Test
    void everyMutationLeavesItsOwnMarker() {
        InMemoryQueue queue = new InMemoryQueue();
        DirtyMarkingChangeListener listener =
            new DirtyMarkingChangeListener(queue, new TickingClock(Instant.parse("2025-03-01T10:00:00Z")));

        listener.onTripChanged(5L, DirtyReason.TRIP_UPDATE);
        listener.onTripChanged(5L, DirtyReason.TRIP_UPDATE);
        listener.onTripChanged(5L, DirtyReason.ACTIVITY_INSERT);

        assertThat(queue.pendingMarkers(5L)).hasSize(3);
        assertThat(queue.pendingTripIds(10)).containsExactly(5L);
    }

    @Test
    void identicalMarkerIsStoredOnce() {
        InMemoryQueue queue = new InMemoryQueue();
        Clock fixed = Clock.fixed(Instant.parse("2025-03-01T10:00:00Z"), ZoneOffset.UTC);
        DirtyMarkingChangeListener listener = new DirtyMarkingChangeListener(queue, fixed);

        listener.onTripChanged(5L, DirtyReason.TRIP_UPDATE);
        listener.onTripChanged(5L, DirtyReason.TRIP_UPDATE);

        assertThat(queue.pendingMarkers(5L)).hasSize(1);
    }

    @Test
    void acknowledgedMarkersLeaveLaterOnesPending() {
        InMemoryQueue queue = new InMemoryQueue();
        DirtyMarkingChangeListener listener =
            new DirtyMarkingChangeListener(queue, new TickingClock(Instant.parse("2025-03-01T10:00:00Z")));

        listener.onTripChanged(5L, DirtyReason.TRIP_UPDATE);
        long watermark = queue.latestMarkerId(5L);
        listener.onTripChanged(5L, DirtyReason.LEG_DELETE);
        queue.acknowledge(5L, watermark);

        assertThat(queue.pendingMarkers(5L)).extracting(DirtyMarker::reason).containsExactly("leg_delete");
    }

    private static final class TickingClock extends Clock {
        private Instant current;

        private TickingClock(Instant start) {
            this.current = start;
        }

        @Override
        public ZoneId getZone() {
            return ZoneOffset.UTC;
        }

        @Override
        public Clock withZone(ZoneId zone) {
            return this;
        }

        @Override
        public Instant instant() {
            current = current.plus(Duration.ofNanos(1_000));
            return current;
        }
    }

    private static final class InMemoryQueue implements DirtyMarkerQueue {
        private final List<DirtyMarker> markers = new ArrayList<>();
        private long nextId = 1;

        @Override
        public boolean enqueue(long tripId, DirtyReason reason, Instant createdAt) {
            for (DirtyMarker marker : markers) {
                if (marker.tripId() == tripId && marker.reason().equals(reason.code()) && marker.createdAt().equals(createdAt)) {
                    return false;
                }
            }
            markers.add(new DirtyMarker(nextId++, tripId, reason.code(), createdAt));
            return true;
        }

        @Override
        public List<Long> pendingTripIds(int limit) {
            Set<Long> ids = new LinkedHashSet<>();
            for (DirtyMarker marker : markers) {
                ids.add(marker.tripId());
            }
            return ids.stream().limit(limit).toList();
        }

        @Override
        public List<DirtyMarker> pendingMarkers(long tripId) {
            return markers.stream().filter(marker -> marker.tripId() == tripId).toList();
        }

        @Override
        public long latestMarkerId(long tripId) {
            return pendingMarkers(tripId).stream().mapToLong(DirtyMarker::id).max().orElse(0L);
        }

        @Override
        public int acknowledge(long tripId, long upToMarkerId) {
            int before = markers.size();
            markers.removeIf(marker -> marker.tripId() == tripId && marker.id() <= upToMarkerId);
            return before - markers.size();
        }
    }
}
