package com.tsl.tripsearch.semantic;

import com.tsl.tripsearch.config.TripSearchProperties;
import com.tsl.tripsearch.query.predicate.Predicates;
import com.tsl.tripsearch.query.predicate.SearchPredicate;
import com.tsl.tripsearch.semantic.SemanticComponentRepository.ComponentHit;
import com.tsl.tripsearch.trip.SourceTrip;
import com.tsl.tripsearch.trip.SourceTripRepository;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

@Service
public class SemanticSearchService {
    private static final Logger logger = LoggerFactory.getLogger(SemanticSearchService.class);

    private final SemanticComponentRepository componentRepository;
    private final SourceTripRepository sourceTripRepository;
    private final SemanticComponentExtractor componentExtractor;
    private final QueryComponentExtractor queryExtractor;
    private final TripSearchProperties properties;

    public SemanticSearchService(
        SemanticComponentRepository componentRepository,
        SourceTripRepository sourceTripRepository,
        SemanticComponentExtractor componentExtractor,
        QueryComponentExtractor queryExtractor,
        TripSearchProperties properties
    ) {
        this.componentRepository = componentRepository;
        this.sourceTripRepository = sourceTripRepository;
        this.componentExtractor = componentExtractor;
        this.queryExtractor = queryExtractor;
        this.properties = properties;
    }

    public List<SemanticMatch> semanticSearch(String query, Integer maxResults) {
        int limit = maxResults == null || maxResults <= 0 ? properties.getSemantic().getDefaultMaxResults() : maxResults;
        List<QueryComponent> queryComponents = queryExtractor.extract(query);
        if (queryComponents.isEmpty()) {
            logger.debug("semantic search found no components in query");
            return List.of();
        }

        List<ComponentHit> hits = componentRepository.findMatching(
            toPredicate(queryComponents),
            properties.getSemantic().getCandidateTripLimit()
        );

        Map<Long, List<ComponentHit>> byTrip = new LinkedHashMap<>();
        for (ComponentHit hit : hits) {
            byTrip.computeIfAbsent(hit.component().tripId(), id -> new ArrayList<>()).add(hit);
        }

        List<SemanticMatch> matches = new ArrayList<>();
        for (Map.Entry<Long, List<ComponentHit>> entry : byTrip.entrySet()) {
            List<SemanticComponent> matched = entry.getValue().stream().map(ComponentHit::component).toList();
            ComponentHit first = entry.getValue().get(0);
            matches.add(new SemanticMatch(
                entry.getKey(),
                first.tripName(),
                first.tripSlug(),
                SemanticScorer.score(queryComponents, matched),
                matched,
                SemanticMatch.METHOD
            ));
        }
        matches.sort(Comparator
            .comparingDouble(SemanticMatch::semanticScore).reversed()
            .thenComparing(Comparator.comparingDouble(SemanticSearchService::matchedWeight).reversed())
            .thenComparingLong(SemanticMatch::tripId));
        logger.info("semantic search components={} candidates={} returned={}",
            queryComponents.size(), matches.size(), Math.min(limit, matches.size()));
        return matches.stream().limit(limit).toList();
    }

    /**
     * Rebuilds the components of one trip from its current source row. Returns the number stored, 0 when the trip
     * no longer exists (its components are removed).
     */
    public int reindexComponents(long tripId) {
        Optional<SourceTrip> trip = sourceTripRepository.findById(tripId);
        if (trip.isEmpty()) {
            componentRepository.deleteByTrip(tripId);
            return 0;
        }
        return index(trip.get()).size();
    }

    public List<SemanticComponent> index(SourceTrip trip) {
        List<SemanticComponent> components = componentExtractor.extract(trip);
        componentRepository.replace(trip.tripId(), components);
        return components;
    }

    public void remove(long tripId) {
        componentRepository.deleteByTrip(tripId);
    }

    static SearchPredicate toPredicate(List<QueryComponent> queryComponents) {
        List<SearchPredicate> branches = new ArrayList<>();
        for (QueryComponent component : queryComponents) {
            branches.add(Predicates.allOf(List.of(
                Predicates.equalTo("tc.component_type", component.type().code()),
                Predicates.anyOf(List.of(
                    Predicates.like("tc.component_value", component.value()),
                    Predicates.like("tc.synonyms", component.value())
                ))
            )));
        }
        return Predicates.anyOf(branches);
    }

    private static double matchedWeight(SemanticMatch match) {
        return match.matchedComponents().stream().mapToDouble(SemanticComponent::weight).sum();
    }
}
