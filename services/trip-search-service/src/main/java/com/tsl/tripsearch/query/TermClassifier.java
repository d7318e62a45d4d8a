package com.tsl.tripsearch.query;

import com.tsl.tripsearch.config.TripSearchProperties;
import java.util.ArrayList;
import java.util.Comparator;
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
 * Turns a raw query into a bounded list of weighted terms.
 *
 * <p>Categories are checked in priority order: email, proper noun, location keyword, token with a digit,
 * descriptor keyword, generic. Term count is capped so generated predicates stay within the engine's
 * pattern complexity limits.
 */
@Component
public class TermClassifier {
    private static final Pattern DIGIT = Pattern.compile("\\d");
    private static final Pattern DIGITS_ONLY = Pattern.compile("^\\d+$");
    private static final Pattern NUMBER_RUN = Pattern.compile("\\d+");
    private static final Pattern NON_ALNUM = Pattern.compile("[^a-z0-9]+");
    private static final Pattern TERM_STRIP = Pattern.compile("[^\\w@.-]");
    private static final int MAX_SCORING_TOKENS = 8;
    private static final int BROAD_WORD_COUNT = 4;
    private static final int STOP_WORD_FALLBACK_TERMS = 2;

    private final int maxTerms;

    public TermClassifier(TripSearchProperties properties) {
        this.maxTerms = Math.max(1, properties.getClassifier().getMaxTerms());
    }

    public ClassifiedQuery classify(String raw) {
        if (raw == null || raw.isBlank()) {
            return ClassifiedQuery.empty(raw);
        }
        String trimmed = raw.trim();

        Map<String, ClassifiedTerm> byTerm = new LinkedHashMap<>();
        for (String token : splitTokens(trimmed)) {
            if (token.length() < 2) {
                continue;
            }
            TermCategory category = categorize(token);
            String term = category == TermCategory.EMAIL ? token.toLowerCase(Locale.ROOT) : normalizeTerm(token);
            if (term.length() < 2) {
                continue;
            }
            ClassifiedTerm existing = byTerm.get(term);
            if (existing == null || existing.weight() < category.weight()) {
                byTerm.put(term, new ClassifiedTerm(term, category.weight(), category));
            }
        }

        List<ClassifiedTerm> sorted = new ArrayList<>(byTerm.values());
        sorted.sort(Comparator.comparingDouble(ClassifiedTerm::weight).reversed());
        List<ClassifiedTerm> capped = sorted.subList(0, Math.min(maxTerms, sorted.size()));

        List<ClassifiedTerm> terms = capped.stream()
            .filter(term -> !SearchVocabulary.STOP_WORDS.contains(term.term()))
            .toList();
        if (terms.isEmpty()) {
            terms = List.copyOf(sorted.subList(0, Math.min(STOP_WORD_FALLBACK_TERMS, sorted.size())));
        }

        List<String> emails = extractEmails(trimmed);
        return new ClassifiedQuery(
            raw,
            terms,
            determineMode(trimmed, emails),
            scoringTokens(trimmed),
            emails,
            extractNumericIds(trimmed),
            trimmed.toLowerCase(Locale.ROOT).replaceAll("\\s+", "-")
        );
    }

    static TermCategory categorize(String token) {
        if (SearchVocabulary.EMAIL.matcher(token).matches()) {
            return TermCategory.EMAIL;
        }
        if (SearchVocabulary.PROPER_NOUN.matcher(token).find()) {
            return TermCategory.NAME;
        }
        String lower = token.toLowerCase(Locale.ROOT);
        if (SearchVocabulary.containsLocation(lower)) {
            return TermCategory.LOCATION;
        }
        if (DIGIT.matcher(token).find()) {
            return TermCategory.NUMBER;
        }
        if (SearchVocabulary.DESCRIPTOR.matcher(lower).find()) {
            return TermCategory.DESCRIPTOR;
        }
        return TermCategory.GENERIC;
    }

    static SearchMode determineMode(String trimmed, List<String> emails) {
        if (DIGITS_ONLY.matcher(trimmed).matches() || !emails.isEmpty()) {
            return SearchMode.EXACT;
        }
        if (trimmed.split("\\s+").length > BROAD_WORD_COUNT) {
            return SearchMode.BROAD;
        }
        return SearchMode.FUZZY;
    }

    /**
     * Emails are kept whole; every other whitespace token has its punctuation normalized and may split further.
     */
    static List<String> splitTokens(String text) {
        List<String> tokens = new ArrayList<>();
        for (String piece : text.split("\\s+")) {
            String candidate = stripEdgePunctuation(piece);
            if (SearchVocabulary.EMAIL.matcher(candidate).matches()) {
                tokens.add(candidate);
                continue;
            }
            for (String part : normalizePunctuation(piece).split("\\s+")) {
                if (!part.isEmpty()) {
                    tokens.add(part);
                }
            }
        }
        return tokens;
    }

    static String normalizePunctuation(String text) {
        return text
            .replaceAll("[&+]", " and ")
            .replace("/", " or ")
            .replaceAll("[\"'`,;:]", "")
            .replaceAll("\\s+", " ")
            .trim();
    }

    static String normalizeTerm(String token) {
        String lower = TERM_STRIP.matcher(token.toLowerCase(Locale.ROOT)).replaceAll("");
        return lower.replaceAll("^[.-]+|[.-]+$", "");
    }

    private static String stripEdgePunctuation(String piece) {
        return piece.replaceAll("^[\"'(<\\[]+|[\"')>\\],;:.!?]+$", "");
    }

    private static List<String> extractEmails(String text) {
        Set<String> emails = new LinkedHashSet<>();
        Matcher matcher = SearchVocabulary.EMAIL.matcher(text);
        while (matcher.find()) {
            emails.add(matcher.group().toLowerCase(Locale.ROOT));
        }
        return List.copyOf(emails);
    }

    private static List<String> scoringTokens(String text) {
        Set<String> tokens = new LinkedHashSet<>();
        for (String token : NON_ALNUM.split(text.toLowerCase(Locale.ROOT))) {
            if (token.length() >= 2) {
                tokens.add(token);
            }
            if (tokens.size() == MAX_SCORING_TOKENS) {
                break;
            }
        }
        return List.copyOf(tokens);
    }

    private static List<Long> extractNumericIds(String text) {
        Set<Long> ids = new LinkedHashSet<>();
        Matcher matcher = NUMBER_RUN.matcher(text);
        while (matcher.find()) {
            String digits = matcher.group();
            if (digits.length() > 18) {
                continue;
            }
            long id = Long.parseLong(digits);
            if (id > 0) {
                ids.add(id);
            }
        }
        return List.copyOf(ids);
    }
}
