package com.tsl.tripsearch.search;

import com.tsl.tripsearch.config.TripSearchProperties;
import com.tsl.tripsearch.fallback.FallbackResult;
import com.tsl.tripsearch.fallback.FallbackStep;
import com.tsl.tripsearch.fallback.FallbackTier;
import com.tsl.tripsearch.fallback.ProgressiveFallbackExecutor;
import com.tsl.tripsearch.query.ClassifiedQuery;
import com.tsl.tripsearch.query.QueryStrategy;
import com.tsl.tripsearch.query.QueryStrategyBuilder;
import com.tsl.tripsearch.query.TermClassifier;
import com.tsl.tripsearch.surface.SearchSurfaceBuilder;
import com.tsl.tripsearch.surface.SearchSurfaceRow;
import com.tsl.tripsearch.surface.TripSurfaceMatch;
import com.tsl.tripsearch.surface.TripSurfaceRepository;
import com.tsl.tripsearch.surface.TripSurfaceScorer;
import com.tsl.tripsearch.trip.SourceTripRepository;
import java.util.ArrayList;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Free-text trip search: classify, query the search surface with progressively simpler strategies, then the plain
 * trip table, then client records, and rank whatever comes back.
 */
@Service
public class TripSearchService {
    private static final Logger logger = LoggerFactory.getLogger(TripSearchService.class);
    static final String SECONDARY_STRATEGY = "trip_table_primary_term";
    static final String EMERGENCY_STRATEGY = "client_primary_term";
    private static final int SECONDARY_COLUMNS = 2;
    private static final int EMERGENCY_COLUMNS = 2;

    private final TermClassifier classifier;
    private final QueryStrategyBuilder strategyBuilder;
    private final ProgressiveFallbackExecutor executor;
    private final TripSurfaceRepository surfaceRepository;
    private final SourceTripRepository sourceTripRepository;
    private final SearchSurfaceBuilder surfaceBuilder;
    private final TripSurfaceScorer scorer;
    private final TripSearchProperties properties;

    public TripSearchService(
        TermClassifier classifier,
        QueryStrategyBuilder strategyBuilder,
        ProgressiveFallbackExecutor executor,
        TripSurfaceRepository surfaceRepository,
        SourceTripRepository sourceTripRepository,
        SearchSurfaceBuilder surfaceBuilder,
        TripSurfaceScorer scorer,
        TripSearchProperties properties
    ) {
        this.classifier = classifier;
        this.strategyBuilder = strategyBuilder;
        this.executor = executor;
        this.surfaceRepository = surfaceRepository;
        this.sourceTripRepository = sourceTripRepository;
        this.surfaceBuilder = surfaceBuilder;
        this.scorer = scorer;
        this.properties = properties;
    }

    public TripSearchResult search(String query, Integer limit) {
        if (query == null || query.isBlank()) {
            throw new IllegalArgumentException("query must not be blank");
        }
        TripSearchProperties.Search settings = properties.getSearch();
        int bounded = limit == null || limit <= 0
            ? settings.getDefaultLimit()
            : Math.min(limit, settings.getMaxLimit());

        ClassifiedQuery classified = classifier.classify(query);
        String primaryTerm = ProgressiveFallbackExecutor.primaryTerm(query);

        FallbackResult<SearchSurfaceRow> result = executor.execute(query, steps(classified, primaryTerm, settings));
        List<TripSurfaceMatch> matches = result.isExhausted()
            ? List.of()
            : scorer.rank(classified, result.rows(), bounded);

        logger.info("trip search mode={} terms={} tier={} strategy={} matches={}",
            classified.mode(), classified.termValues(), result.tier().label(), result.strategy(), matches.size());
        return new TripSearchResult(
            query,
            classified.mode(),
            classified.terms(),
            primaryTerm,
            result.tier(),
            result.strategy(),
            matches,
            result.message(),
            result.suggestion(),
            result.attempts()
        );
    }

    List<FallbackStep<SearchSurfaceRow>> steps(
        ClassifiedQuery classified,
        String primaryTerm,
        TripSearchProperties.Search settings
    ) {
        List<FallbackStep<SearchSurfaceRow>> steps = new ArrayList<>();
        for (QueryStrategy strategy : strategyBuilder.build(classified, TripSurfaceRepository.SURFACE_TARGET)) {
            steps.add(new FallbackStep<>(
                FallbackTier.PRIMARY,
                strategy.name(),
                () -> surfaceRepository.findCandidates(strategy.predicate(), settings.getCandidateLimit())
            ));
        }
        if (primaryTerm.length() >= 2) {
            steps.add(new FallbackStep<>(
                FallbackTier.SECONDARY,
                SECONDARY_STRATEGY,
                () -> sourceTripRepository.searchTrips(
                        strategyBuilder.primaryTermPredicate(primaryTerm, SourceTripRepository.TRIPS_TARGET, SECONDARY_COLUMNS),
                        settings.getSecondaryLimit()
                    ).stream()
                    .map(surfaceBuilder::fromHeader)
                    .toList()
            ));
            steps.add(new FallbackStep<>(
                FallbackTier.EMERGENCY,
                EMERGENCY_STRATEGY,
                () -> sourceTripRepository.searchTripsByClient(
                        strategyBuilder.primaryTermPredicate(primaryTerm, SourceTripRepository.CLIENTS_TARGET, EMERGENCY_COLUMNS),
                        settings.getEmergencyLimit()
                    ).stream()
                    .map(surfaceBuilder::fromHeader)
                    .toList()
            ));
        }
        return steps;
    }
}
