package com.tsl.tripsearch.semantic;

import com.tsl.tripsearch.query.SearchVocabulary;
import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.springframework.stereotype.Component;

/**
 * Runs the trip-side vocabulary over query text so both sides can be matched type to type.
 */
@Component
public class QueryComponentExtractor {
    private static final Pattern CAPITALIZED = Pattern.compile("\\b[A-Z][a-z]+\\b");
    private static final Pattern YEAR = Pattern.compile("\\b(?:19|20)\\d{2}\\b");
    private static final Pattern COST = Pattern.compile("\\$(\\d+(?:[.,]\\d+)*)|\\b(budget|cheap|moderate|expensive|luxury|premium)\\b",
        Pattern.CASE_INSENSITIVE);
    private static final Pattern STATUS = Pattern.compile(
        "\\b(planning|confirmed|booked|completed|finished|cancelled|canceled|active|ongoing|traveling)\\b",
        Pattern.CASE_INSENSITIVE);
    private static final Pattern WORD = Pattern.compile("[a-z]+");

    public List<QueryComponent> extract(String query) {
        List<QueryComponent> components = new ArrayList<>();
        if (query == null || query.isBlank()) {
            return components;
        }
        String lower = query.toLowerCase(Locale.ROOT);

        Matcher names = CAPITALIZED.matcher(query);
        while (names.find()) {
            String name = names.group().toLowerCase(Locale.ROOT);
            if (isVocabularyWord(name)) {
                continue;
            }
            add(components, new QueryComponent(ComponentType.CLIENT, name, SemanticVocabulary.CLIENT_WEIGHT));
        }

        Matcher years = YEAR.matcher(query);
        while (years.find()) {
            add(components, new QueryComponent(ComponentType.DATE, years.group(), SemanticVocabulary.YEAR_WEIGHT));
        }
        for (String month : SemanticVocabulary.MONTHS) {
            if (Pattern.compile("\\b" + month + "\\b").matcher(lower).find()) {
                add(components, new QueryComponent(ComponentType.DATE, month, SemanticVocabulary.MONTH_WEIGHT));
            }
        }

        Matcher costs = COST.matcher(query);
        while (costs.find()) {
            add(components, new QueryComponent(ComponentType.COST, costLabel(costs), SemanticVocabulary.COST_WEIGHT));
        }

        Matcher statuses = STATUS.matcher(query);
        while (statuses.find()) {
            String status = SemanticVocabulary.canonicalStatus(statuses.group(1).toLowerCase(Locale.ROOT));
            if (status != null) {
                add(components, new QueryComponent(ComponentType.STATUS, status, SemanticVocabulary.STATUS_WEIGHT));
            }
        }

        for (String descriptor : SemanticComponentExtractor.descriptors(query)) {
            add(components, new QueryComponent(ComponentType.DESCRIPTOR, descriptor,
                SemanticVocabulary.TITLE_DESCRIPTOR_WEIGHT));
        }

        Matcher words = WORD.matcher(lower);
        while (words.find()) {
            String word = words.group();
            if (word.length() <= 2 || SearchVocabulary.STOP_WORDS.contains(word) || isCovered(components, word)) {
                continue;
            }
            if (SemanticVocabulary.isLikelyDestination(word)) {
                add(components, new QueryComponent(ComponentType.DESTINATION, word,
                    SemanticVocabulary.DESTINATION_WEIGHT));
            }
        }
        return components;
    }

    private static String costLabel(Matcher costs) {
        if (costs.group(1) != null) {
            try {
                return SemanticVocabulary.costBucket(new BigDecimal(costs.group(1).replace(",", "")).doubleValue());
            } catch (NumberFormatException ex) {
                return "moderate";
            }
        }
        String word = costs.group(2).toLowerCase(Locale.ROOT);
        if ("cheap".equals(word)) {
            return "budget";
        }
        if ("expensive".equals(word)) {
            return "luxury";
        }
        return word;
    }

    // capitalized words that name a place, month, status or descriptor are not client names
    private static boolean isVocabularyWord(String word) {
        return SemanticVocabulary.isLikelyDestination(word)
            || SemanticVocabulary.MONTHS.contains(word)
            || SemanticVocabulary.canonicalStatus(word) != null
            || !SemanticComponentExtractor.descriptors(word).isEmpty()
            || SearchVocabulary.STOP_WORDS.contains(word);
    }

    private static boolean isCovered(List<QueryComponent> components, String word) {
        for (QueryComponent component : components) {
            if (component.value().contains(word)) {
                return true;
            }
        }
        return false;
    }

    private static void add(List<QueryComponent> components, QueryComponent component) {
        for (QueryComponent existing : components) {
            if (existing.type() == component.type() && existing.value().equals(component.value())) {
                return;
            }
        }
        components.add(component);
    }
}
