package com.tsl.tripsearch.surface;

import com.tsl.tripsearch.trip.SourceTrip;
import com.tsl.tripsearch.trip.Traveler;
import com.tsl.tripsearch.trip.TripHeader;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.TreeSet;
import org.springframework.stereotype.Component;

@Component
public class SearchSurfaceBuilder {

    public SearchSurfaceRow build(SourceTrip trip, Instant syncedAt) {
        List<String> travelerNames = new ArrayList<>();
        List<String> travelerEmails = new ArrayList<>();
        for (Traveler traveler : trip.travelers()) {
            String name = traveler.fullName() != null && !traveler.fullName().isBlank()
                ? traveler.fullName()
                : TextNormalizer.nameFromEmail(traveler.email());
            if (name != null) {
                travelerNames.add(name);
            }
            if (traveler.email() != null && !traveler.email().isBlank()) {
                travelerEmails.add(traveler.email());
            }
        }
        return assemble(trip.header(), travelerNames, travelerEmails, syncedAt);
    }

    /**
     * Projects a bare trip row, without travelers, so rows from the plain trip tables can be scored like surface rows.
     */
    public SearchSurfaceRow fromHeader(TripHeader header) {
        return assemble(header, List.of(), List.of(), header.updatedAt());
    }

    private SearchSurfaceRow assemble(
        TripHeader header,
        List<String> travelerNames,
        List<String> travelerEmails,
        Instant syncedAt
    ) {
        String primaryName = header.primaryClientName() != null && !header.primaryClientName().isBlank()
            ? header.primaryClientName()
            : TextNormalizer.nameFromEmail(header.primaryClientEmail());
        String status = header.status() == null ? null : header.status().code();

        List<String> sources = new ArrayList<>();
        sources.add(header.name());
        sources.add(header.slug() == null ? null : header.slug().replace('-', ' '));
        sources.add(header.destinations());
        sources.add(status);
        sources.add(primaryName);
        sources.add(header.primaryClientEmail());
        sources.addAll(travelerNames);
        sources.addAll(travelerEmails);
        sources.add(String.valueOf(header.tripId()));

        Set<String> tokens = new TreeSet<>();
        for (String source : sources) {
            tokens.addAll(TextNormalizer.tokenize(source));
        }
        // slug parts and trip-name words are kept whole, single characters included
        if (header.slug() != null) {
            for (String part : header.slug().split("-")) {
                addWord(tokens, part.trim().toLowerCase(Locale.ROOT));
            }
        }
        for (String word : TextNormalizer.normalizeText(header.name()).split("\\s+")) {
            addWord(tokens, word);
        }
        if (tokens.isEmpty() && header.name() != null && !TextNormalizer.normalizeText(header.name()).isEmpty()) {
            tokens.add(TextNormalizer.normalizeText(header.name()));
        }

        List<String> emails = new ArrayList<>();
        emails.add(header.primaryClientEmail());
        emails.addAll(travelerEmails);

        return new SearchSurfaceRow(
            header.tripId(),
            header.name(),
            header.slug(),
            status,
            header.startDate(),
            header.endDate(),
            header.destinations(),
            primaryName,
            header.primaryClientEmail(),
            travelerNames,
            travelerEmails,
            TextNormalizer.normalizeText(header.name()),
            TextNormalizer.normalizeText(header.destinations()),
            TextNormalizer.normalizeText(String.join(" ", travelerNames)),
            TextNormalizer.normalizeText(joinNonNull(emails)),
            List.copyOf(tokens),
            phoneticTokens(tokens),
            travelerEmails.size(),
            syncedAt
        );
    }

    private static void addWord(Set<String> tokens, String word) {
        if (!word.isEmpty()) {
            tokens.add(word);
        }
    }

    private static List<String> phoneticTokens(Set<String> tokens) {
        Set<String> phonetic = new TreeSet<>();
        for (String token : tokens) {
            for (String variant : TextNormalizer.phoneticVariants(token)) {
                if (!tokens.contains(variant)) {
                    phonetic.add(variant);
                }
            }
        }
        return List.copyOf(phonetic);
    }

    private static String joinNonNull(Collection<String> values) {
        List<String> kept = new ArrayList<>();
        for (String value : values) {
            if (value != null && !value.isBlank()) {
                kept.add(value);
            }
        }
        return String.join(" ", kept);
    }
}
