package com.company.monitoring.service;

import com.company.monitoring.domain.HeaderSettingsRecord;
import lombok.Value;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Finds the monitored header of a previous stage that corresponds to a header of the new stage.
 * Strategies are tried in order: exact name, normalized, simplified, then shared keywords.
 */
public class HeaderNameMatcher {

    static final int MIN_SHARED_KEYWORDS = 2;

    private static final Pattern SEPARATORS = Pattern.compile("[\\s_-]+");
    private static final Pattern NON_WORD = Pattern.compile("[^\\w]");

    private final Map<String, HeaderSettingsRecord> exact = new HashMap<>();
    private final Map<String, HeaderSettingsRecord> normalized = new HashMap<>();
    private final Map<String, HeaderSettingsRecord> simplified = new HashMap<>();
    private final Map<String, List<HeaderSettingsRecord>> byKeyword = new LinkedHashMap<>();

    public HeaderNameMatcher(List<HeaderSettingsRecord> candidates) {
        for (HeaderSettingsRecord candidate : candidates) {
            String name = candidate.getHeaderName();
            if (name == null) {
                continue;
            }
            exact.put(name, candidate);
            normalized.put(normalize(name), candidate);
            simplified.put(simplify(name), candidate);
            for (String keyword : keywords(name)) {
                byKeyword.computeIfAbsent(keyword, k -> new ArrayList<>()).add(candidate);
            }
        }
    }

    public Optional<Match> match(String headerName) {
        if (headerName == null) {
            return Optional.empty();
        }
        if (exact.containsKey(headerName)) {
            return Optional.of(new Match(exact.get(headerName), "exact"));
        }
        HeaderSettingsRecord found = normalized.get(normalize(headerName));
        if (found != null) {
            return Optional.of(new Match(found, "normalized"));
        }
        found = simplified.get(simplify(headerName));
        if (found != null) {
            return Optional.of(new Match(found, "simplified"));
        }
        return matchByKeywords(headerName);
    }

    private Optional<Match> matchByKeywords(String headerName) {
        List<String> keywords = keywords(headerName);
        HeaderSettingsRecord best = null;
        int bestCount = 0;

        for (String keyword : keywords) {
            for (HeaderSettingsRecord candidate : byKeyword.getOrDefault(keyword, List.of())) {
                List<String> candidateKeywords = keywords(candidate.getHeaderName());
                int shared = (int) keywords.stream().filter(candidateKeywords::contains).count();
                if (shared > bestCount) {
                    bestCount = shared;
                    best = candidate;
                }
            }
        }

        if (best != null && bestCount >= MIN_SHARED_KEYWORDS) {
            return Optional.of(new Match(best, "keyword (" + bestCount + " keywords)"));
        }
        return Optional.empty();
    }

    static String normalize(String name) {
        return name.toLowerCase(Locale.ROOT).trim();
    }

    static String simplify(String name) {
        String collapsed = SEPARATORS.matcher(name.toLowerCase(Locale.ROOT)).replaceAll("");
        return NON_WORD.matcher(collapsed).replaceAll("");
    }

    // Tokens longer than 3 characters
    static List<String> keywords(String name) {
        List<String> keywords = new ArrayList<>();
        for (String part : SEPARATORS.split(name.toLowerCase(Locale.ROOT))) {
            if (part.length() > 3) {
                keywords.add(part);
            }
        }
        return keywords;
    }

    @Value
    public static class Match {
        HeaderSettingsRecord header;
        String strategy;
    }
}
