package com.tsl.tripsearch.query;

import java.util.List;
import java.util.Set;
import java.util.regex.Pattern;

public final class SearchVocabulary {
    public static final Pattern EMAIL = Pattern.compile("[A-Za-z0-9._%+-]+@[A-Za-z0-9-]+(?:\\.[A-Za-z0-9-]+)+");
    public static final Pattern PROPER_NOUN = Pattern.compile("^[A-Z][a-z]+");
    public static final Pattern DESCRIPTOR =
        Pattern.compile("^(anniversary|birthday|wedding|honeymoon|celebration|reunion|vacation|holiday|getaway)");

    public static final List<String> LOCATION_KEYWORDS = List.of(
        "bristol", "bath", "london", "paris", "hawaii", "york", "rome", "venice",
        "mediterranean", "caribbean", "europe", "asia", "america", "africa", "australia",
        "japan", "italy", "france", "spain", "greece", "turkey", "croatia", "iceland",
        "norway", "sweden", "denmark", "portugal", "scotland", "ireland", "wales", "england",
        "thailand", "vietnam", "singapore", "malaysia", "indonesia", "philippines", "china", "korea"
    );

    public static final Set<String> STOP_WORDS = Set.of(
        "the", "a", "an", "and", "or", "but", "in", "on", "at", "to", "for", "of", "with", "by",
        "from", "about", "as", "into", "through", "after", "me", "all", "show", "get", "find",
        "list", "display", "give", "tell", "their", "our", "my", "your", "his", "her", "its",
        "they", "we", "you", "details", "information", "data", "full", "complete", "everything",
        "itinerary", "trip", "travel", "accommodation", "transportation", "activities", "please",
        "need", "want", "would", "could", "should", "can", "will"
    );

    // command words skipped when picking a single primary term
    public static final Set<String> IMPERATIVE_WORDS = Set.of("show", "find", "get", "create", "all", "new");

    private SearchVocabulary() {
    }

    public static boolean containsLocation(String lowerToken) {
        for (String keyword : LOCATION_KEYWORDS) {
            if (lowerToken.contains(keyword)) {
                return true;
            }
        }
        return false;
    }
}
