package com.tsl.tripsearch.surface;

import java.text.Normalizer;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Text helpers shared by the search surface and its scorer. All methods are pure.
 */
public final class TextNormalizer {
    private static final Pattern MARKS = Pattern.compile("\\p{M}+");
    private static final Pattern APOSTROPHES = Pattern.compile("['’]");
    private static final Pattern NON_ALNUM = Pattern.compile("[^a-z0-9]+");
    private static final Pattern REPEATED_LETTER = Pattern.compile("([a-z])\\1+");
    private static final Pattern EMAIL_SEPARATORS = Pattern.compile("[._-]+");

    private static final Map<String, List<String>> MANUAL_VARIANTS = Map.of(
        "chisholm", List.of("chisolm", "chissom", "chishom"),
        "stoneleigh", List.of("stonleigh", "stoneley", "stonely"),
        "brianne", List.of("breanne", "briane"),
        "stephanie", List.of("steffanie", "stephany", "steffany")
    );

    private TextNormalizer() {
    }

    public static String normalizeText(String value) {
        if (value == null || value.isEmpty()) {
            return "";
        }
        String stripped = MARKS.matcher(Normalizer.normalize(value, Normalizer.Form.NFD)).replaceAll("");
        stripped = APOSTROPHES.matcher(stripped).replaceAll("");
        return NON_ALNUM.matcher(stripped.toLowerCase(Locale.ROOT)).replaceAll(" ").trim();
    }

    public static List<String> tokenize(String value) {
        String normalized = normalizeText(value);
        if (normalized.isEmpty()) {
            return List.of();
        }
        List<String> tokens = new ArrayList<>();
        for (String token : normalized.split(" ")) {
            if (token.length() > 1) {
                tokens.add(token);
            }
        }
        return tokens;
    }

    /**
     * Spelling variants a caller is likely to type for a name token, e.g. "stoneley" for "stoneleigh".
     */
    public static Set<String> phoneticVariants(String token) {
        Set<String> variants = new LinkedHashSet<>(MANUAL_VARIANTS.getOrDefault(token, List.of()));
        if (token.endsWith("leigh")) {
            String stem = token.substring(0, token.length() - "leigh".length());
            variants.add(stem + "ley");
            variants.add(stem + "lee");
            variants.add(stem + "lay");
        }
        if (token.endsWith("holme")) {
            variants.add(token.substring(0, token.length() - 1));
        }
        if (token.contains("ph")) {
            variants.add(token.replace("ph", "f"));
        }
        if (token.contains("ck")) {
            variants.add(token.replace("ck", "k"));
        }
        String collapsed = REPEATED_LETTER.matcher(token).replaceAll("$1");
        if (!collapsed.equals(token)) {
            variants.add(collapsed);
        }
        if (token.contains("ch")) {
            variants.add(token.replace("ch", "k"));
        }
        variants.remove("");
        variants.remove(token);
        return variants;
    }

    /**
     * "sara.jones@email.com" becomes "Sara Jones". Returns null when there is no usable local part.
     */
    public static String nameFromEmail(String email) {
        if (email == null || email.isBlank()) {
            return null;
        }
        String localPart = email.split("@", 2)[0];
        List<String> words = new ArrayList<>();
        for (String segment : EMAIL_SEPARATORS.split(localPart)) {
            if (!segment.isEmpty()) {
                words.add(segment.substring(0, 1).toUpperCase(Locale.ROOT) + segment.substring(1).toLowerCase(Locale.ROOT));
            }
        }
        return words.isEmpty() ? null : String.join(" ", words);
    }

    public static String slugify(String value) {
        return normalizeText(value).replace(' ', '-');
    }
}
