package com.tsl.tripsearch.semantic;

import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;

final class SemanticVocabulary {
    static final double CLIENT_WEIGHT = 2.0;
    static final double DESTINATION_WEIGHT = 1.5;
    static final double YEAR_WEIGHT = 1.3;
    static final double MONTH_WEIGHT = 1.2;
    static final double STATUS_WEIGHT = 1.2;
    static final double TITLE_DESCRIPTOR_WEIGHT = 1.3;
    static final double NOTES_DESCRIPTOR_WEIGHT = 1.1;
    static final double COST_WEIGHT = 1.1;
    static final double ACTIVITY_WEIGHT = 1.0;

    static final Pattern NAME_PAIR = Pattern.compile("([A-Z][a-z]+)\\s*(?:and|&)\\s*([A-Z][a-z]+)");

    static final List<Pattern> DESCRIPTOR_PATTERNS = List.of(
        Pattern.compile("\\b(anniversary|honeymoon|vacation|holiday|getaway|business|family|adventure|relaxation"
            + "|cultural|cruise|romantic|celebration|wedding)\\b", Pattern.CASE_INSENSITIVE),
        Pattern.compile("\\b(luxury|budget|premium|deluxe|standard|economy|first-class|business-class)\\b",
            Pattern.CASE_INSENSITIVE),
        Pattern.compile("\\b(group|solo|couple|couples|single|family|corporate)\\b", Pattern.CASE_INSENSITIVE)
    );

    static final List<String> MONTHS = List.of(
        "january", "february", "march", "april", "may", "june",
        "july", "august", "september", "october", "november", "december"
    );

    static final Map<String, List<String>> DESTINATION_SYNONYMS = Map.ofEntries(
        Map.entry("hawaii", List.of("hawaiian islands", "aloha state", "pacific islands")),
        Map.entry("mediterranean", List.of("med sea", "mediterranean sea", "med cruise")),
        Map.entry("caribbean", List.of("carribean", "west indies", "caribbean islands")),
        Map.entry("europe", List.of("european", "eu", "old continent")),
        Map.entry("paris", List.of("city of light", "france capital")),
        Map.entry("london", List.of("uk capital", "england capital", "britain")),
        Map.entry("rome", List.of("eternal city", "italy capital", "roman")),
        Map.entry("greece", List.of("greek islands", "hellenic", "greek")),
        Map.entry("italy", List.of("italian", "italia")),
        Map.entry("spain", List.of("spanish", "espana")),
        Map.entry("iceland", List.of("icelandic", "reykjavik")),
        Map.entry("norway", List.of("norwegian", "norge", "scandinavia")),
        Map.entry("thailand", List.of("thai", "siam", "bangkok")),
        Map.entry("japan", List.of("japanese", "nippon", "tokyo"))
    );

    static final Map<String, List<String>> STATUS_SYNONYMS = Map.of(
        "planning", List.of("draft", "in planning", "preliminary"),
        "confirmed", List.of("booked", "secured", "finalized"),
        "in_progress", List.of("ongoing", "active", "traveling", "current"),
        "completed", List.of("finished", "done", "past", "concluded"),
        "cancelled", List.of("canceled", "aborted", "scrapped")
    );

    static final Map<String, List<String>> DESCRIPTOR_SYNONYMS = Map.of(
        "anniversary", List.of("celebration", "milestone", "special occasion"),
        "honeymoon", List.of("newlyweds", "romantic", "wedding trip"),
        "vacation", List.of("holiday", "getaway", "trip", "break"),
        "business", List.of("work", "corporate", "conference"),
        "family", List.of("relatives", "kids", "children", "parents"),
        "adventure", List.of("exciting", "thrilling", "active"),
        "relaxation", List.of("peaceful", "calm", "restful", "spa"),
        "cultural", List.of("heritage", "historical", "museums"),
        "cruise", List.of("ship", "sailing", "maritime", "ocean")
    );

    static final List<String> DESTINATION_INDICATORS = List.of(
        "hawaii", "europe", "asia", "africa", "america", "mediterranean", "caribbean",
        "paris", "london", "rome", "tokyo", "bangkok", "istanbul", "barcelona",
        "italy", "france", "spain", "greece", "germany", "portugal", "iceland",
        "norway", "sweden", "denmark", "thailand", "vietnam", "singapore",
        "bath", "bristol", "york", "venice", "scotland", "ireland", "wales", "england", "japan",
        "cruise", "island", "beach", "mountain", "city", "country"
    );

    private SemanticVocabulary() {
    }

    static String costBucket(double cost) {
        if (cost < 1000) {
            return "budget";
        }
        if (cost < 5000) {
            return "moderate";
        }
        if (cost < 10000) {
            return "premium";
        }
        return "luxury";
    }

    static boolean isLikelyDestination(String word) {
        if (word.length() <= 2) {
            return false;
        }
        for (String indicator : DESTINATION_INDICATORS) {
            if (word.contains(indicator) || indicator.contains(word)) {
                return true;
            }
        }
        return false;
    }

    /**
     * Maps a status word or one of its synonyms to the canonical status code, or null.
     */
    static String canonicalStatus(String word) {
        if (STATUS_SYNONYMS.containsKey(word)) {
            return word;
        }
        for (Map.Entry<String, List<String>> entry : STATUS_SYNONYMS.entrySet()) {
            if (entry.getValue().contains(word)) {
                return entry.getKey();
            }
        }
        return null;
    }
}
