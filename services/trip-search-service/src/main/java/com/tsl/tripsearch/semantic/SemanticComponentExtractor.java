package com.tsl.tripsearch.semantic;

import com.tsl.tripsearch.trip.SourceTrip;
import com.tsl.tripsearch.trip.TripActivity;
import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.springframework.stereotype.Component;

/**
 * Extracts the semantic components of a trip. The result depends only on the trip, so re-extraction from an
 * unchanged trip yields the same set.
 */
@Component
public class SemanticComponentExtractor {
    private static final Set<String> LODGING_TYPES = Set.of("hotel", "lodging");
    private static final Pattern DESTINATION_SEPARATOR = Pattern.compile("[,;]");

    public List<SemanticComponent> extract(SourceTrip trip) {
        Map<String, SemanticComponent> components = new LinkedHashMap<>();
        long tripId = trip.tripId();

        String email = trip.primaryClientEmail();
        if (email != null && email.contains("@")) {
            String localPart = email.substring(0, email.indexOf('@')).toLowerCase(Locale.ROOT);
            if (!localPart.isEmpty()) {
                put(components, new SemanticComponent(tripId, ComponentType.CLIENT, localPart,
                    SemanticVocabulary.CLIENT_WEIGHT, List.of(email.toLowerCase(Locale.ROOT)), "primary_client_email"));
            }
        }

        if (trip.name() != null) {
            Matcher pair = SemanticVocabulary.NAME_PAIR.matcher(trip.name());
            if (pair.find()) {
                for (int group = 1; group <= 2; group++) {
                    String name = pair.group(group);
                    put(components, new SemanticComponent(tripId, ComponentType.CLIENT, name.toLowerCase(Locale.ROOT),
                        SemanticVocabulary.CLIENT_WEIGHT, List.of(name), "trip_name"));
                }
            }
        }

        if (trip.destinations() != null) {
            for (String destination : DESTINATION_SEPARATOR.split(trip.destinations())) {
                String value = destination.trim().toLowerCase(Locale.ROOT);
                if (!value.isEmpty()) {
                    put(components, new SemanticComponent(tripId, ComponentType.DESTINATION, value,
                        SemanticVocabulary.DESTINATION_WEIGHT,
                        SemanticVocabulary.DESTINATION_SYNONYMS.getOrDefault(value, List.of()), "destinations"));
                }
            }
        }

        if (trip.startDate() != null) {
            String year = String.valueOf(trip.startDate().getYear());
            String month = String.format(Locale.ROOT, "%02d", trip.startDate().getMonthValue());
            put(components, new SemanticComponent(tripId, ComponentType.DATE, year,
                SemanticVocabulary.YEAR_WEIGHT, List.of(trip.startDate().toString()), "start_date"));
            put(components, new SemanticComponent(tripId, ComponentType.DATE,
                SemanticVocabulary.MONTHS.get(trip.startDate().getMonthValue() - 1),
                SemanticVocabulary.MONTH_WEIGHT, List.of(month, year + "-" + month), "start_date"));
        }

        if (trip.totalCost() > 0) {
            String amount = BigDecimal.valueOf(trip.totalCost()).stripTrailingZeros().toPlainString();
            put(components, new SemanticComponent(tripId, ComponentType.COST,
                SemanticVocabulary.costBucket(trip.totalCost()), SemanticVocabulary.COST_WEIGHT,
                List.of(amount, "$" + amount), "total_cost"));
        }

        if (trip.status() != null) {
            String status = trip.status().code();
            put(components, new SemanticComponent(tripId, ComponentType.STATUS, status,
                SemanticVocabulary.STATUS_WEIGHT,
                SemanticVocabulary.STATUS_SYNONYMS.getOrDefault(status, List.of()), "status"));
        }

        for (String descriptor : descriptors(trip.name())) {
            put(components, descriptor(tripId, descriptor, SemanticVocabulary.TITLE_DESCRIPTOR_WEIGHT, "trip_name"));
        }
        for (String descriptor : descriptors(trip.notes())) {
            put(components, descriptor(tripId, descriptor, SemanticVocabulary.NOTES_DESCRIPTOR_WEIGHT, "notes"));
        }

        for (TripActivity activity : trip.activities()) {
            if (activity.activityType() == null || activity.activityType().isBlank()) {
                continue;
            }
            String type = activity.activityType().trim().toLowerCase(Locale.ROOT);
            if (!LODGING_TYPES.contains(type)) {
                put(components, new SemanticComponent(tripId, ComponentType.ACTIVITY, type,
                    SemanticVocabulary.ACTIVITY_WEIGHT, List.of(), "activities"));
            }
        }

        return new ArrayList<>(components.values());
    }

    static Set<String> descriptors(String text) {
        Set<String> found = new LinkedHashSet<>();
        if (text == null || text.isBlank()) {
            return found;
        }
        for (Pattern pattern : SemanticVocabulary.DESCRIPTOR_PATTERNS) {
            Matcher matcher = pattern.matcher(text);
            while (matcher.find()) {
                found.add(matcher.group(1).toLowerCase(Locale.ROOT));
            }
        }
        return found;
    }

    private static SemanticComponent descriptor(long tripId, String descriptor, double weight, String source) {
        return new SemanticComponent(tripId, ComponentType.DESCRIPTOR, descriptor, weight,
            SemanticVocabulary.DESCRIPTOR_SYNONYMS.getOrDefault(descriptor, List.of()), source);
    }

    // a (type, value) pair is stored once, with its highest weight
    private static void put(Map<String, SemanticComponent> components, SemanticComponent component) {
        String key = component.type().code() + ":" + component.value();
        SemanticComponent existing = components.get(key);
        if (existing == null || existing.weight() < component.weight()) {
            components.put(key, component);
        }
    }
}
