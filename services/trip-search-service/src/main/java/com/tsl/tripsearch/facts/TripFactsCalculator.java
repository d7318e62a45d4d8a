package com.tsl.tripsearch.facts;

import com.tsl.tripsearch.surface.TextNormalizer;
import com.tsl.tripsearch.trip.SourceTrip;
import com.tsl.tripsearch.trip.TransitLeg;
import com.tsl.tripsearch.trip.Traveler;
import com.tsl.tripsearch.trip.TripActivity;
import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Duration;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import org.springframework.stereotype.Component;

@Component
public class TripFactsCalculator {
    private static final Set<String> LODGING_TYPES = Set.of("hotel", "lodging");

    public TripFacts calculate(SourceTrip trip) {
        Map<String, String> roster = roster(trip);
        return new TripFacts(
            nights(trip),
            (int) trip.activities().stream().filter(TripFactsCalculator::isLodging).count(),
            trip.activities().size(),
            totalCost(trip),
            transitMinutes(trip.legs()),
            roster.size(),
            new ArrayList<>(roster.values()),
            new ArrayList<>(roster.keySet()),
            trip.primaryClientEmail(),
            primaryClientName(trip)
        );
    }

    /**
     * Date range when both dates are known, otherwise the span of scheduled day numbers.
     */
    static int nights(SourceTrip trip) {
        if (trip.startDate() != null && trip.endDate() != null) {
            return (int) Math.max(0, ChronoUnit.DAYS.between(trip.startDate(), trip.endDate()));
        }
        int min = Integer.MAX_VALUE;
        int max = Integer.MIN_VALUE;
        for (TripActivity activity : trip.activities()) {
            if (activity.dayNumber() != null) {
                min = Math.min(min, activity.dayNumber());
                max = Math.max(max, activity.dayNumber());
            }
        }
        return min == Integer.MAX_VALUE ? 0 : max - min;
    }

    static double totalCost(SourceTrip trip) {
        BigDecimal sum = BigDecimal.ZERO;
        for (TripActivity activity : trip.activities()) {
            sum = sum.add(BigDecimal.valueOf(activity.cost()));
        }
        if (sum.signum() == 0 && trip.totalCost() > 0) {
            sum = BigDecimal.valueOf(trip.totalCost());
        }
        return sum.setScale(2, RoundingMode.HALF_UP).doubleValue();
    }

    static long transitMinutes(List<TransitLeg> legs) {
        long minutes = 0;
        for (TransitLeg leg : legs) {
            if (leg.departAt() == null || leg.arriveAt() == null || leg.arriveAt().isBefore(leg.departAt())) {
                continue;
            }
            minutes += Duration.between(leg.departAt(), leg.arriveAt()).toMinutes();
        }
        return minutes;
    }

    /**
     * Distinct travelers keyed by lower-cased email, primary client included, in assignment order.
     */
    static Map<String, String> roster(SourceTrip trip) {
        Map<String, String> byEmail = new LinkedHashMap<>();
        for (Traveler traveler : trip.travelers()) {
            if (traveler.email() == null || traveler.email().isBlank()) {
                continue;
            }
            String key = traveler.email().trim().toLowerCase(Locale.ROOT);
            byEmail.putIfAbsent(key, displayName(traveler.fullName(), key));
        }
        if (trip.primaryClientEmail() != null && !trip.primaryClientEmail().isBlank()) {
            String key = trip.primaryClientEmail().trim().toLowerCase(Locale.ROOT);
            byEmail.putIfAbsent(key, displayName(trip.primaryClientName(), key));
        }
        return byEmail;
    }

    private static String primaryClientName(SourceTrip trip) {
        if (trip.primaryClientEmail() == null) {
            return trip.primaryClientName();
        }
        return displayName(trip.primaryClientName(), trip.primaryClientEmail());
    }

    private static String displayName(String fullName, String email) {
        if (fullName != null && !fullName.isBlank()) {
            return fullName.trim();
        }
        String derived = TextNormalizer.nameFromEmail(email);
        return derived == null ? email : derived;
    }

    private static boolean isLodging(TripActivity activity) {
        return activity.activityType() != null
            && LODGING_TYPES.contains(activity.activityType().trim().toLowerCase(Locale.ROOT));
    }
}
