package com.tsl.tripsearch.facts;

import com.tsl.tripsearch.config.TripSearchProperties;
import com.tsl.tripsearch.dirty.DirtyMarkerQueue;
import com.tsl.tripsearch.trip.SourceTrip;
import com.tsl.tripsearch.trip.SourceTripRepository;
import java.time.Instant;
import java.util.LinkedHashSet;
import java.util.Optional;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Consistency entry points for trip facts.
 *
 * <p>A trip is clean when its facts exist, were computed no earlier than the trip's last update and no dirty marker
 * is pending. Anything else is dirty and is healed either on read or by a bounded batch sweep.
 */
@Service
public class TripFactsService {
    private static final Logger logger = LoggerFactory.getLogger(TripFactsService.class);

    private final SourceTripRepository sourceTripRepository;
    private final TripFactsRepository factsRepository;
    private final DirtyMarkerQueue dirtyQueue;
    private final TripRefreshService refreshService;
    private final TripSearchProperties properties;

    public TripFactsService(
        SourceTripRepository sourceTripRepository,
        TripFactsRepository factsRepository,
        DirtyMarkerQueue dirtyQueue,
        TripRefreshService refreshService,
        TripSearchProperties properties
    ) {
        this.sourceTripRepository = sourceTripRepository;
        this.factsRepository = factsRepository;
        this.dirtyQueue = dirtyQueue;
        this.refreshService = refreshService;
        this.properties = properties;
    }

    /**
     * Refreshes the trip's derived rows when they are dirty. Returns false when the trip does not exist.
     */
    public boolean ensureFactsFresh(long tripId) {
        Optional<Instant> updatedAt = sourceTripRepository.findUpdatedAt(tripId);
        if (updatedAt.isEmpty()) {
            if (factsRepository.find(tripId).isPresent()) {
                refreshService.refresh(tripId);
            }
            return false;
        }
        if (isDirty(tripId, updatedAt.get(), factsRepository.find(tripId))) {
            refreshService.refresh(tripId);
        }
        return true;
    }

    /**
     * Returns the trip with its facts. Dirty facts are refreshed inline for small trips; larger trips get the
     * current facts flagged stale and are left to the batch sweep.
     */
    public Optional<TripWithFacts> getTripWithFacts(long tripId) {
        Optional<SourceTrip> source = sourceTripRepository.findById(tripId);
        if (source.isEmpty()) {
            return Optional.empty();
        }
        SourceTrip trip = source.get();
        Optional<FactsRow> facts = factsRepository.find(tripId);
        Instant updatedAt = trip.updatedAt() == null ? Instant.EPOCH : trip.updatedAt();
        if (!isDirty(tripId, updatedAt, facts)) {
            return Optional.of(new TripWithFacts(trip, facts.get(), false));
        }
        if (trip.activities().size() < properties.getFacts().getInlineRefreshMaxActivities()) {
            RefreshOutcome outcome = refreshService.refresh(tripId);
            return Optional.of(new TripWithFacts(trip, outcome.facts(), false));
        }
        logger.info("trip_id={} has {} activities, serving stale facts until the next sweep",
            tripId, trip.activities().size());
        return Optional.of(new TripWithFacts(trip, facts.orElse(null), true));
    }

    public Optional<FactsRow> findFacts(long tripId) {
        return factsRepository.find(tripId);
    }

    /**
     * Refreshes up to {@code limit} trips: pending dirty markers first, then trips whose facts are missing or older
     * than the trip, least recently updated first. Returns the number of trips refreshed.
     */
    public int bulkRefreshFacts(Integer limit) {
        int bounded = limit == null || limit <= 0 ? properties.getFacts().getBulkDefaultLimit() : limit;
        Set<Long> tripIds = new LinkedHashSet<>(dirtyQueue.pendingTripIds(bounded));
        if (tripIds.size() < bounded) {
            tripIds.addAll(factsRepository.findStaleTripIds(bounded));
        }
        int refreshed = 0;
        for (Long tripId : tripIds) {
            if (refreshed >= bounded) {
                break;
            }
            refreshService.refresh(tripId);
            refreshed++;
        }
        logger.info("bulk facts refresh completed refreshed={} limit={}", refreshed, bounded);
        return refreshed;
    }

    boolean isDirty(long tripId, Instant updatedAt, Optional<FactsRow> facts) {
        if (facts.isEmpty() || facts.get().lastComputed() == null) {
            return true;
        }
        if (facts.get().lastComputed().isBefore(updatedAt)) {
            return true;
        }
        return dirtyQueue.latestMarkerId(tripId) > 0;
    }
}
