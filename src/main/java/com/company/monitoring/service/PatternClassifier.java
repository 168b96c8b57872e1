package com.company.monitoring.service;

import com.company.monitoring.domain.MonitoringConfig;
import com.company.monitoring.domain.MonitoringConfig.CategorySettings;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Maps a header name to a monitoring category by ordered, case-insensitive substring rules.
 *
 * <p>Categories are evaluated in priority order. If a category's negative patterns match,
 * classification stops and the header is left uncategorised, whatever later categories would say.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class PatternClassifier {

    private final MonitoringConfigManager configManager;

    @Value("${monitoring.classifier.priority:pressure,battery}")
    private List<String> priority = List.of("pressure", "battery");

    public Optional<String> classify(String headerName) {
        return classify(headerName, configManager.current());
    }

    public Optional<String> classify(String headerName, MonitoringConfig config) {
        return classify(headerName, config.getPatternCategories(), priority);
    }

    static Optional<String> classify(String headerName,
                                     Map<String, CategorySettings> categories,
                                     List<String> priority) {
        if (headerName == null || headerName.isBlank() || categories == null) {
            return Optional.empty();
        }

        String name = headerName.toLowerCase(Locale.ROOT);

        for (String category : orderedCategories(categories, priority)) {
            CategorySettings settings = categories.get(category);
            if (settings == null) {
                continue;
            }
            if (matchesAny(name, settings.getNegativePatterns())) {
                log.debug("Header '{}' rejected by negative pattern of category {}", headerName, category);
                return Optional.empty();
            }
            if (matchesAny(name, settings.getPatterns())) {
                return Optional.of(category);
            }
        }
        return Optional.empty();
    }

    private static List<String> orderedCategories(Map<String, CategorySettings> categories, List<String> priority) {
        List<String> ordered = new ArrayList<>();
        if (priority != null) {
            for (String category : priority) {
                if (categories.containsKey(category) && !ordered.contains(category)) {
                    ordered.add(category);
                }
            }
        }
        for (String category : categories.keySet()) {
            if (!ordered.contains(category)) {
                ordered.add(category);
            }
        }
        return ordered;
    }

    private static boolean matchesAny(String lowerCaseName, List<String> patterns) {
        if (patterns == null) {
            return false;
        }
        for (String pattern : patterns) {
            if (pattern != null && !pattern.isEmpty()
                    && lowerCaseName.contains(pattern.toLowerCase(Locale.ROOT))) {
                return true;
            }
        }
        return false;
    }
}
