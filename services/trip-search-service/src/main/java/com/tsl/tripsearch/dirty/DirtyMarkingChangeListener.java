package com.tsl.tripsearch.dirty;

import java.time.Clock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Records every reported trip change as a dirty marker. Recomputation happens later, on read or in batch.
 */
@Component
public class DirtyMarkingChangeListener implements TripChangeListener {
    private static final Logger logger = LoggerFactory.getLogger(DirtyMarkingChangeListener.class);

    private final DirtyMarkerQueue queue;
    private final Clock clock;

    public DirtyMarkingChangeListener(DirtyMarkerQueue queue, Clock clock) {
        this.queue = queue;
        this.clock = clock;
    }

    @Override
    public void onTripChanged(long tripId, DirtyReason reason) {
        boolean inserted = queue.enqueue(tripId, reason, clock.instant());
        if (!inserted) {
            logger.debug("dirty marker already present trip_id={} reason={}", tripId, reason.code());
        }
    }
}
