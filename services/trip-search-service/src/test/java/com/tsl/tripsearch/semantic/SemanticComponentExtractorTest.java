package com.tsl.tripsearch.semantic;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.tuple;

import com.tsl.tripsearch.trip.SourceTrip;
import com.tsl.tripsearch.trip.TripActivity;
import com.tsl.tripsearch.trip.TripFixtures;
import com.tsl.tripsearch.trip.TripStatus;
import java.time.LocalDate;
import java.util.List;
import org.junit.jupiter.api.Test;

class SemanticComponentExtractorTest {

    private final SemanticComponentExtractor extractor = new SemanticComponentExtractor();

    @Test
    void extractsEveryComponentType() {
        List<SemanticComponent> components = extractor.extract(anniversaryTrip());

        assertThat(components)
            .extracting(SemanticComponent::type, SemanticComponent::value)
            .containsExactlyInAnyOrder(
                tuple(ComponentType.CLIENT, "john.smith"),
                tuple(ComponentType.CLIENT, "john"),
                tuple(ComponentType.CLIENT, "jane"),
                tuple(ComponentType.DESTINATION, "hawaii"),
                tuple(ComponentType.DESTINATION, "maui"),
                tuple(ComponentType.DATE, "2025"),
                tuple(ComponentType.DATE, "june"),
                tuple(ComponentType.COST, "premium"),
                tuple(ComponentType.STATUS, "confirmed"),
                tuple(ComponentType.DESCRIPTOR, "anniversary"),
                tuple(ComponentType.DESCRIPTOR, "relaxation"),
                tuple(ComponentType.ACTIVITY, "snorkeling"),
                tuple(ComponentType.ACTIVITY, "luau")
            );
    }

    @Test
    void componentsCarryWeightsAndSynonyms() {
        List<SemanticComponent> components = extractor.extract(anniversaryTrip());

        SemanticComponent email = find(components, ComponentType.CLIENT, "john.smith");
        assertThat(email.weight()).isEqualTo(2.0);
        assertThat(email.synonyms()).containsExactly("john.smith@example.com");

        SemanticComponent hawaii = find(components, ComponentType.DESTINATION, "hawaii");
        assertThat(hawaii.synonyms()).contains("aloha state");

        SemanticComponent month = find(components, ComponentType.DATE, "june");
        assertThat(month.synonyms()).containsExactly("06", "2025-06");

        SemanticComponent cost = find(components, ComponentType.COST, "premium");
        assertThat(cost.synonyms()).containsExactly("7500", "$7500");

        assertThat(find(components, ComponentType.DESCRIPTOR, "anniversary").weight()).isEqualTo(1.3);
        assertThat(find(components, ComponentType.DESCRIPTOR, "relaxation").weight()).isEqualTo(1.1);
    }

    @Test
    void extractionIsRepeatable() {
        assertThat(extractor.extract(anniversaryTrip())).isEqualTo(extractor.extract(anniversaryTrip()));
    }

    @Test
    void duplicateActivitiesAreStoredOnce() {
        SourceTrip trip = TripFixtures.trip(
            9L, "Reef Week", null, null, null, null, null, List.of(),
            List.of(
                new TripActivity(1, "Snorkeling", "Reef", 50.0),
                new TripActivity(2, "snorkeling", "Reef again", 50.0),
                new TripActivity(3, "lodging", "Inn", 200.0)
            )
        );

        assertThat(extractor.extract(trip))
            .extracting(SemanticComponent::type, SemanticComponent::value)
            .containsExactly(tuple(ComponentType.ACTIVITY, "snorkeling"));
    }

    private static SemanticComponent find(List<SemanticComponent> components, ComponentType type, String value) {
        return components.stream()
            .filter(component -> component.type() == type && component.value().equals(value))
            .findFirst()
            .orElseThrow();
    }

    static SourceTrip anniversaryTrip() {
        SourceTrip base = TripFixtures.trip(
            7L,
            "John and Jane Smith Anniversary",
            "john-and-jane-smith-anniversary",
            TripStatus.CONFIRMED,
            "Hawaii, Maui",
            "john.smith@example.com",
            "John Smith",
            List.of(),
            List.of(
                new TripActivity(1, "hotel", "Beach resort", 4000.0),
                new TripActivity(2, "snorkeling", "Molokini crater", 250.0),
                new TripActivity(3, "luau", "Old Lahaina Luau", 300.0)
            )
        );
        return new SourceTrip(
            base.tripId(),
            base.name(),
            base.slug(),
            base.status(),
            LocalDate.of(2025, 6, 10),
            LocalDate.of(2025, 6, 17),
            base.destinations(),
            base.primaryClientEmail(),
            base.primaryClientName(),
            base.travelers(),
            base.activities(),
            base.legs(),
            7500.0,
            2000.0,
            "Relaxation focus, sunset dinners",
            base.updatedAt()
        );
    }
}
