package com.tsl.tripsearch.facts;

import static org.assertj.core.api.Assertions.assertThat;

import com.tsl.tripsearch.trip.SourceTrip;
import com.tsl.tripsearch.trip.TransitLeg;
import com.tsl.tripsearch.trip.Traveler;
import com.tsl.tripsearch.trip.TripActivity;
import com.tsl.tripsearch.trip.TripFixtures;
import com.tsl.tripsearch.trip.TripStatus;
import java.time.Instant;
import java.time.LocalDate;
import java.util.List;
import org.junit.jupiter.api.Test;

class TripFactsCalculatorTest {

    private final TripFactsCalculator calculator = new TripFactsCalculator();

    @Test
    void calculateAggregatesScheduleCostTransitAndRoster() {
        TripFacts facts = calculator.calculate(lisbonTrip());

        assertThat(facts.totalNights()).isEqualTo(7);
        assertThat(facts.totalHotels()).isEqualTo(2);
        assertThat(facts.totalActivities()).isEqualTo(3);
        assertThat(facts.totalCost()).isEqualTo(1600.49);
        assertThat(facts.transitMinutes()).isEqualTo(150L);
        assertThat(facts.travelerCount()).isEqualTo(2);
        assertThat(facts.travelerEmails()).containsExactly("sara.jones@example.com", "mark.lee@example.com");
        assertThat(facts.travelerNames()).containsExactly("Sara Jones", "Mark Lee");
        assertThat(facts.primaryClientName()).isEqualTo("Mark Lee");
    }

    @Test
    void recomputingUnchangedTripGivesEqualFacts() {
        assertThat(calculator.calculate(lisbonTrip())).isEqualTo(calculator.calculate(lisbonTrip()));
    }

    @Test
    void nightsFallBackToScheduleSpan() {
        SourceTrip trip = TripFixtures.trip(
            2L, "Open Dates", null, TripStatus.PLANNING, null, null, null, List.of(),
            List.of(new TripActivity(4, "tour", "Late", 0.0), new TripActivity(1, "tour", "Early", 0.0))
        );

        assertThat(TripFactsCalculator.nights(trip)).isEqualTo(3);
    }

    @Test
    void costFallsBackToTripTotalWithoutPricedActivities() {
        SourceTrip base = TripFixtures.trip(3L, "Quote Only", "Oslo", null, null);
        SourceTrip trip = new SourceTrip(
            base.tripId(), base.name(), base.slug(), base.status(), null, null, base.destinations(), null, null,
            List.of(), List.of(), List.of(), 2500.0, 0.0, null, base.updatedAt()
        );

        assertThat(TripFactsCalculator.totalCost(trip)).isEqualTo(2500.0);
    }

    @Test
    void emptyTripHasZeroFacts() {
        TripFacts facts = calculator.calculate(TripFixtures.trip(4L, "Blank", null, null, null));

        assertThat(facts.totalNights()).isZero();
        assertThat(facts.totalCost()).isZero();
        assertThat(facts.travelerCount()).isZero();
        assertThat(facts.primaryClientName()).isNull();
    }

    private static SourceTrip lisbonTrip() {
        Instant depart = Instant.parse("2025-06-10T08:00:00Z");
        SourceTrip base = TripFixtures.trip(
            1L,
            "Lisbon Week",
            "lisbon-week",
            TripStatus.CONFIRMED,
            "Lisbon",
            "mark.lee@example.com",
            null,
            List.of(
                new Traveler("Sara.Jones@example.com", "Sara Jones", "traveler"),
                new Traveler("sara.jones@example.com", null, "traveler")
            ),
            List.of(
                new TripActivity(1, "hotel", "Alfama hotel", 1200.50),
                new TripActivity(4, "Lodging", "Sintra guesthouse", 300.00),
                new TripActivity(5, "tour", "Tram 28", 99.99)
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
            List.of(
                new TransitLeg(depart, depart.plusSeconds(150 * 60)),
                new TransitLeg(depart, null),
                new TransitLeg(depart, depart.minusSeconds(600))
            ),
            0.0,
            0.0,
            null,
            base.updatedAt()
        );
    }
}
