package com.tsl.tripsearch.search;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import com.tsl.tripsearch.config.TripSearchProperties;
import com.tsl.tripsearch.fallback.FallbackAttempt;
import com.tsl.tripsearch.fallback.FallbackTier;
import com.tsl.tripsearch.fallback.ProgressiveFallbackExecutor;
import com.tsl.tripsearch.query.QueryStrategy;
import com.tsl.tripsearch.query.QueryStrategyBuilder;
import com.tsl.tripsearch.query.SearchMode;
import com.tsl.tripsearch.query.TermClassifier;
import com.tsl.tripsearch.surface.SearchSurfaceBuilder;
import com.tsl.tripsearch.surface.SearchSurfaceRow;
import com.tsl.tripsearch.surface.TripSurfaceMatch;
import com.tsl.tripsearch.surface.TripSurfaceRepository;
import com.tsl.tripsearch.surface.TripSurfaceScorer;
import com.tsl.tripsearch.trip.SourceTripRepository;
import com.tsl.tripsearch.trip.TripFixtures;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.sql.SQLException;
import java.time.Instant;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.QueryTimeoutException;
import org.springframework.jdbc.BadSqlGrammarException;

@ExtendWith(MockitoExtension.class)
class TripSearchServiceTest {

    @Mock
    private TripSurfaceRepository surfaceRepository;

    @Mock
    private SourceTripRepository sourceTripRepository;

    private final SearchSurfaceBuilder surfaceBuilder = new SearchSurfaceBuilder();
    private TripSearchService service;

    @BeforeEach
    void setUp() {
        TripSearchProperties properties = new TripSearchProperties();
        service = new TripSearchService(
            new TermClassifier(properties),
            new QueryStrategyBuilder(),
            new ProgressiveFallbackExecutor(properties, new SimpleMeterRegistry()),
            surfaceRepository,
            sourceTripRepository,
            surfaceBuilder,
            new TripSurfaceScorer(properties),
            properties
        );
    }

    @Test
    void primaryTierAnswersFromSearchSurface() {
        when(surfaceRepository.findCandidates(any(), eq(25))).thenReturn(List.of(surfaceRow(1L, "Smith Hawaii Anniversary")));

        TripSearchResult result = service.search("Smith Hawaii", null);

        assertThat(result.tier()).isEqualTo(FallbackTier.PRIMARY);
        assertThat(result.strategy()).isEqualTo(QueryStrategy.COMPREHENSIVE);
        assertThat(result.mode()).isEqualTo(SearchMode.FUZZY);
        assertThat(result.matches()).extracting(TripSurfaceMatch::tripId).containsExactly(1L);
        assertThat(result.matches().get(0).score()).isEqualTo(44);
        verifyNoInteractions(sourceTripRepository);
    }

    @Test
    void complexityRejectionDegradesToTripTable() {
        when(surfaceRepository.findCandidates(any(), eq(25))).thenThrow(new QueryTimeoutException("statement timeout"));
        when(sourceTripRepository.searchTrips(any(), eq(5))).thenReturn(List.of(
            TripFixtures.trip(8L, "Hawaii Family Week", "Hawaii", "kai@example.com", "Kai Lee").header()
        ));

        TripSearchResult result = service.search("show me all Hawaii trips", null);

        assertThat(result.primaryTerm()).isEqualTo("hawaii");
        assertThat(result.tier()).isEqualTo(FallbackTier.SECONDARY);
        assertThat(result.strategy()).isEqualTo(TripSearchService.SECONDARY_STRATEGY);
        assertThat(result.matches()).extracting(TripSurfaceMatch::tripId).containsExactly(8L);
        assertThat(result.attempts()).extracting(FallbackAttempt::outcome)
            .containsExactly(FallbackAttempt.Outcome.TOO_COMPLEX, FallbackAttempt.Outcome.TOO_COMPLEX,
                FallbackAttempt.Outcome.SUCCESS);
    }

    @Test
    void clientTierIsLastResort() {
        when(surfaceRepository.findCandidates(any(), eq(25))).thenReturn(List.of());
        when(sourceTripRepository.searchTrips(any(), eq(5))).thenReturn(List.of());
        when(sourceTripRepository.searchTripsByClient(any(), eq(3))).thenReturn(List.of(
            TripFixtures.trip(4L, "Spring Break", "Cancun", "kim.park@example.com", "Kim Park").header()
        ));

        TripSearchResult result = service.search("kim.park@example.com", null);

        assertThat(result.tier()).isEqualTo(FallbackTier.EMERGENCY);
        assertThat(result.matches()).extracting(TripSurfaceMatch::tripId).containsExactly(4L);
        assertThat(result.matches().get(0).matchReasons()).contains("primary_email_exact");
    }

    @Test
    void exhaustedSearchReturnsSuggestion() {
        when(surfaceRepository.findCandidates(any(), eq(25))).thenReturn(List.of());
        when(sourceTripRepository.searchTrips(any(), eq(5))).thenReturn(List.of());
        when(sourceTripRepository.searchTripsByClient(any(), eq(3))).thenReturn(List.of());

        TripSearchResult result = service.search("zanzibar", 10);

        assertThat(result.tier()).isEqualTo(FallbackTier.EXHAUSTED);
        assertThat(result.hasMatches()).isFalse();
        assertThat(result.message()).isEqualTo("No results found for \"zanzibar\".");
        assertThat(result.suggestion()).isNotBlank();
    }

    @Test
    void limitBoundsRankedMatches() {
        when(surfaceRepository.findCandidates(any(), eq(25))).thenReturn(List.of(
            surfaceRow(1L, "Rome Escape"),
            surfaceRow(2L, "Rome Food Tour"),
            surfaceRow(3L, "Rome and Florence")
        ));

        TripSearchResult result = service.search("rome", 2);

        assertThat(result.matches()).hasSize(2);
    }

    @Test
    void storeErrorsOtherThanComplexityPropagate() {
        when(surfaceRepository.findCandidates(any(), eq(25)))
            .thenThrow(new BadSqlGrammarException("search", "SELECT", new SQLException("Unknown column 'x'")));

        assertThatThrownBy(() -> service.search("rome", null)).isInstanceOf(BadSqlGrammarException.class);
        verifyNoInteractions(sourceTripRepository);
    }

    @Test
    void blankQueryIsRejected() {
        assertThatThrownBy(() -> service.search("  ", null)).isInstanceOf(IllegalArgumentException.class);
    }

    private SearchSurfaceRow surfaceRow(long tripId, String name) {
        return surfaceBuilder.build(
            TripFixtures.trip(tripId, name, "Somewhere", "guest@example.com", "Guest"),
            Instant.parse("2025-03-02T08:00:00Z")
        );
    }
}
