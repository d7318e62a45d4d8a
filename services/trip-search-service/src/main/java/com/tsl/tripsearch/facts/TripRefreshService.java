package com.tsl.tripsearch.facts;

import com.tsl.tripsearch.dirty.DirtyMarkerQueue;
import com.tsl.tripsearch.semantic.SemanticSearchService;
import com.tsl.tripsearch.surface.SearchSurfaceService;
import com.tsl.tripsearch.trip.SourceTrip;
import com.tsl.tripsearch.trip.SourceTripRepository;
import io.micrometer.core.instrument.MeterRegistry;
import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Recomputes every derived row of a trip (facts, search surface, semantic components) from the source tables.
 *
 * <p>Each write is an idempotent overwrite keyed by trip id, so concurrent refreshes of the same trip are safe.
 * Dirty markers are acknowledged only up to the newest marker seen before the source was read.
 */
@Service
public class TripRefreshService {
    private static final Logger logger = LoggerFactory.getLogger(TripRefreshService.class);

    private final SourceTripRepository sourceTripRepository;
    private final TripFactsRepository factsRepository;
    private final TripFactsCalculator calculator;
    private final SearchSurfaceService surfaceService;
    private final SemanticSearchService semanticSearchService;
    private final DirtyMarkerQueue dirtyQueue;
    private final MeterRegistry meterRegistry;
    private final Clock clock;

    public TripRefreshService(
        SourceTripRepository sourceTripRepository,
        TripFactsRepository factsRepository,
        TripFactsCalculator calculator,
        SearchSurfaceService surfaceService,
        SemanticSearchService semanticSearchService,
        DirtyMarkerQueue dirtyQueue,
        MeterRegistry meterRegistry,
        Clock clock
    ) {
        this.sourceTripRepository = sourceTripRepository;
        this.factsRepository = factsRepository;
        this.calculator = calculator;
        this.surfaceService = surfaceService;
        this.semanticSearchService = semanticSearchService;
        this.dirtyQueue = dirtyQueue;
        this.meterRegistry = meterRegistry;
        this.clock = clock;
    }

    public RefreshOutcome refresh(long tripId) {
        long watermark = dirtyQueue.latestMarkerId(tripId);
        Optional<SourceTrip> source = sourceTripRepository.findById(tripId);
        if (source.isEmpty()) {
            factsRepository.delete(tripId);
            surfaceService.remove(tripId);
            semanticSearchService.remove(tripId);
            dirtyQueue.acknowledge(tripId, watermark);
            meterRegistry.counter("ts_facts_refresh_total", "outcome", "removed").increment();
            logger.info("trip_id={} no longer exists, derived rows removed", tripId);
            return new RefreshOutcome(tripId, true, null, 0);
        }

        SourceTrip trip = source.get();
        TripFacts facts = calculator.calculate(trip);
        factsRepository.upsert(tripId, facts, computedAt(trip));
        surfaceService.apply(trip);
        int components = semanticSearchService.index(trip).size();
        dirtyQueue.acknowledge(tripId, watermark);

        FactsRow row = factsRepository.find(tripId).orElse(null);
        meterRegistry.counter("ts_facts_refresh_total", "outcome", "refreshed").increment();
        logger.debug("trip_id={} refreshed version={} components={}", tripId, row == null ? null : row.version(), components);
        return new RefreshOutcome(tripId, false, row, components);
    }

    /**
     * Refreshes up to {@code limit} trips that have pending dirty markers, oldest marker first.
     */
    public int refreshDirty(int limit) {
        List<Long> tripIds = dirtyQueue.pendingTripIds(limit);
        for (Long tripId : tripIds) {
            refresh(tripId);
        }
        return tripIds.size();
    }

    // never earlier than the source's own update time, whatever the skew between app and database clocks
    private Instant computedAt(SourceTrip trip) {
        Instant now = clock.instant();
        if (trip.updatedAt() != null && trip.updatedAt().isAfter(now)) {
            return trip.updatedAt();
        }
        return now;
    }
}
