package com.gpu.tracker.microcenter.service;

import java.util.Arrays;
import java.util.List;
import java.util.Optional;

/**
 * One row of the model-name rule table. A rule either claims the name and
 * returns the extracted model, or returns empty so the next rule is tried.
 */
@FunctionalInterface
public interface ModelNameRule {

    Optional<String> apply(String fullName, String brand, String manufacturer);

    /**
     * Matches a product family keyword and keeps the family plus model number,
     * extended by one token when the name carries a "Ti" or "XT" suffix.
     */
    static ModelNameRule family(String keyword) {
        return (fullName, brand, manufacturer) -> {
            int start = indexOfIgnoreCase(fullName, keyword);
            if (start < 0) {
                return Optional.empty();
            }
            List<String> tokens = tokens(fullName.substring(start));
            int keep = tokens.contains("Ti") || tokens.contains("XT") ? 4 : 3;
            return Optional.of(String.join(" ", tokens.subList(0, Math.min(keep, tokens.size()))));
        };
    }

    /**
     * Marketing-heavy names over {@code threshold} characters: drop the brand
     * and manufacturer and keep the first four remaining words.
     */
    static ModelNameRule longNameFallback(int threshold) {
        return (fullName, brand, manufacturer) -> {
            if (fullName.length() <= threshold) {
                return Optional.empty();
            }
            String stripped = fullName;
            if (brand != null && !brand.isEmpty()) {
                stripped = stripped.replace(brand, "").trim();
            }
            if (manufacturer != null && !manufacturer.isEmpty()) {
                stripped = stripped.replace(manufacturer, "").trim();
            }
            List<String> tokens = tokens(stripped);
            return Optional.of(String.join(" ", tokens.subList(0, Math.min(4, tokens.size()))));
        };
    }

    static ModelNameRule fullName() {
        return (fullName, brand, manufacturer) -> Optional.of(fullName);
    }

    static List<String> tokens(String value) {
        String trimmed = value == null ? "" : value.trim();
        if (trimmed.isEmpty()) {
            return List.of();
        }
        return Arrays.asList(trimmed.split("\\s+"));
    }

    static int indexOfIgnoreCase(String haystack, String needle) {
        if (haystack == null || needle == null || needle.isEmpty()) {
            return -1;
        }
        int last = haystack.length() - needle.length();
        for (int i = 0; i <= last; i++) {
            if (haystack.regionMatches(true, i, needle, 0, needle.length())) {
                return i;
            }
        }
        return -1;
    }
}
