package com.tsl.tripsearch.surface;

import com.tsl.tripsearch.trip.SourceTrip;
import com.tsl.tripsearch.trip.SourceTripRepository;
import java.time.Clock;
import java.util.List;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

@Service
public class SearchSurfaceService {
    private static final Logger logger = LoggerFactory.getLogger(SearchSurfaceService.class);

    private final TripSurfaceRepository surfaceRepository;
    private final SourceTripRepository sourceTripRepository;
    private final SearchSurfaceBuilder builder;
    private final Clock clock;

    public SearchSurfaceService(
        TripSurfaceRepository surfaceRepository,
        SourceTripRepository sourceTripRepository,
        SearchSurfaceBuilder builder,
        Clock clock
    ) {
        this.surfaceRepository = surfaceRepository;
        this.sourceTripRepository = sourceTripRepository;
        this.builder = builder;
        this.clock = clock;
    }

    /**
     * Rebuilds one trip's surface row, or removes it when the trip is gone.
     */
    public Optional<SearchSurfaceRow> refreshTrip(long tripId) {
        Optional<SourceTrip> trip = sourceTripRepository.findById(tripId);
        if (trip.isEmpty()) {
            remove(tripId);
            return Optional.empty();
        }
        return Optional.of(apply(trip.get()));
    }

    public SearchSurfaceRow apply(SourceTrip trip) {
        SearchSurfaceRow row = builder.build(trip, clock.instant());
        surfaceRepository.upsert(row);
        return row;
    }

    public void remove(long tripId) {
        surfaceRepository.delete(tripId);
    }

    /**
     * Rebuilds surface rows for up to {@code limit} trips in id order.
     */
    public int refreshAll(int limit) {
        List<Long> tripIds = sourceTripRepository.findTripIds(limit);
        for (Long tripId : tripIds) {
            refreshTrip(tripId);
        }
        logger.info("search surface rebuilt for {} trips", tripIds.size());
        return tripIds.size();
    }
}
