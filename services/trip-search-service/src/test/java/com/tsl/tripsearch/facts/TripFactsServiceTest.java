package com.tsl.tripsearch.facts;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.tsl.tripsearch.config.TripSearchProperties;
import com.tsl.tripsearch.dirty.DirtyMarkerQueue;
import com.tsl.tripsearch.trip.SourceTrip;
import com.tsl.tripsearch.trip.SourceTripRepository;
import com.tsl.tripsearch.trip.TripActivity;
import com.tsl.tripsearch.trip.TripFixtures;
import com.tsl.tripsearch.trip.TripStatus;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class TripFactsServiceTest {
    private static final Instant UPDATED_AT = TripFixtures.UPDATED_AT;

    @Mock
    private SourceTripRepository sourceTripRepository;

    @Mock
    private TripFactsRepository factsRepository;

    @Mock
    private DirtyMarkerQueue dirtyQueue;

    @Mock
    private TripRefreshService refreshService;

    private TripFactsService service;

    @BeforeEach
    void setUp() {
        service = new TripFactsService(
            sourceTripRepository,
            factsRepository,
            dirtyQueue,
            refreshService,
            new TripSearchProperties()
        );
    }

    @Test
    void ensureFactsFreshReportsMissingTrip() {
        when(sourceTripRepository.findUpdatedAt(5L)).thenReturn(Optional.empty());
        when(factsRepository.find(5L)).thenReturn(Optional.empty());

        assertThat(service.ensureFactsFresh(5L)).isFalse();

        verify(refreshService, never()).refresh(anyLong());
    }

    @Test
    void ensureFactsFreshPurgesFactsOfDeletedTrip() {
        when(sourceTripRepository.findUpdatedAt(5L)).thenReturn(Optional.empty());
        when(factsRepository.find(5L)).thenReturn(Optional.of(factsRow(5L, UPDATED_AT)));

        assertThat(service.ensureFactsFresh(5L)).isFalse();

        verify(refreshService).refresh(5L);
    }

    @Test
    void ensureFactsFreshSkipsCleanTrip() {
        when(sourceTripRepository.findUpdatedAt(5L)).thenReturn(Optional.of(UPDATED_AT));
        when(factsRepository.find(5L)).thenReturn(Optional.of(factsRow(5L, UPDATED_AT.plusSeconds(1))));
        when(dirtyQueue.latestMarkerId(5L)).thenReturn(0L);

        assertThat(service.ensureFactsFresh(5L)).isTrue();

        verify(refreshService, never()).refresh(anyLong());
    }

    @Test
    void ensureFactsFreshRefreshesWhenMarkerPending() {
        when(sourceTripRepository.findUpdatedAt(5L)).thenReturn(Optional.of(UPDATED_AT));
        when(factsRepository.find(5L)).thenReturn(Optional.of(factsRow(5L, UPDATED_AT.plusSeconds(1))));
        when(dirtyQueue.latestMarkerId(5L)).thenReturn(12L);

        assertThat(service.ensureFactsFresh(5L)).isTrue();

        verify(refreshService).refresh(5L);
    }

    @Test
    void ensureFactsFreshRefreshesFactsOlderThanTrip() {
        when(sourceTripRepository.findUpdatedAt(5L)).thenReturn(Optional.of(UPDATED_AT));
        when(factsRepository.find(5L)).thenReturn(Optional.of(factsRow(5L, UPDATED_AT.minusSeconds(60))));

        assertThat(service.ensureFactsFresh(5L)).isTrue();

        verify(refreshService).refresh(5L);
    }

    @Test
    void smallDirtyTripIsRefreshedInline() {
        SourceTrip trip = tripWithActivities(6L, 3);
        FactsRow refreshed = factsRow(6L, UPDATED_AT.plusSeconds(5));
        when(sourceTripRepository.findById(6L)).thenReturn(Optional.of(trip));
        when(factsRepository.find(6L)).thenReturn(Optional.empty());
        when(refreshService.refresh(6L)).thenReturn(new RefreshOutcome(6L, false, refreshed, 4));

        TripWithFacts result = service.getTripWithFacts(6L).orElseThrow();

        assertThat(result.stale()).isFalse();
        assertThat(result.facts()).isEqualTo(refreshed);
    }

    @Test
    void largeDirtyTripIsServedStale() {
        SourceTrip trip = tripWithActivities(6L, 10);
        FactsRow old = factsRow(6L, UPDATED_AT.minusSeconds(60));
        when(sourceTripRepository.findById(6L)).thenReturn(Optional.of(trip));
        when(factsRepository.find(6L)).thenReturn(Optional.of(old));

        TripWithFacts result = service.getTripWithFacts(6L).orElseThrow();

        assertThat(result.stale()).isTrue();
        assertThat(result.facts()).isEqualTo(old);
        verify(refreshService, never()).refresh(anyLong());
    }

    @Test
    void missingTripHasNoFactsView() {
        when(sourceTripRepository.findById(6L)).thenReturn(Optional.empty());

        assertThat(service.getTripWithFacts(6L)).isEmpty();
    }

    @Test
    void bulkRefreshTakesDirtyTripsFirstThenStaleOnes() {
        when(dirtyQueue.pendingTripIds(3)).thenReturn(List.of(5L, 6L));
        when(factsRepository.findStaleTripIds(3)).thenReturn(List.of(6L, 7L, 8L));

        assertThat(service.bulkRefreshFacts(3)).isEqualTo(3);

        verify(refreshService).refresh(5L);
        verify(refreshService).refresh(6L);
        verify(refreshService).refresh(7L);
        verify(refreshService, never()).refresh(8L);
    }

    @Test
    void bulkRefreshUsesDefaultLimit() {
        when(dirtyQueue.pendingTripIds(20)).thenReturn(List.of());
        when(factsRepository.findStaleTripIds(20)).thenReturn(List.of(1L));

        assertThat(service.bulkRefreshFacts(null)).isEqualTo(1);

        verify(refreshService).refresh(1L);
    }

    private static FactsRow factsRow(long tripId, Instant lastComputed) {
        TripFacts facts = new TripFacts(0, 0, 0, 0.0, 0L, 0, List.of(), List.of(), null, null);
        return new FactsRow(tripId, facts, 1L, lastComputed);
    }

    private static SourceTrip tripWithActivities(long tripId, int count) {
        List<TripActivity> activities = new ArrayList<>();
        for (int day = 1; day <= count; day++) {
            activities.add(new TripActivity(day, "tour", "Day " + day, 10.0));
        }
        return TripFixtures.trip(tripId, "Busy Trip", null, TripStatus.PLANNING, "Rome", null, null, List.of(), activities);
    }
}
