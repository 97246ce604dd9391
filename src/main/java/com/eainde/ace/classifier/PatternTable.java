package com.eainde.ace.classifier;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Wildcard pattern table resolved by longest-pattern-wins.
 * <p>
 * Entries are kept sorted once at build time: more segments first, then fewer wildcard
 * segments, then declaration order. A lookup checks the exact key, walks the sorted
 * list for the first matching pattern and finally falls back to the {@code *} value.
 */
public final class PatternTable {

    private final Map<String, Double> exact;
    private final List<Map.Entry<String, Double>> bySpecificity;
    private final double fallback;

    private PatternTable(Map<String, Double> entries, double fallback) {
        this.exact = Collections.unmodifiableMap(new LinkedHashMap<>(entries));
        List<Map.Entry<String, Double>> sorted = new ArrayList<>(this.exact.entrySet());
        sorted.sort(Comparator
                .comparingInt((Map.Entry<String, Double> e) -> -segments(e.getKey()))
                .thenComparingInt(e -> wildcards(e.getKey())));
        this.bySpecificity = List.copyOf(sorted);
        this.fallback = fallback;
    }

    public static Builder builder() {
        return new Builder();
    }

    public double lookup(String actionClass) {
        return find(actionClass).orElse(fallback);
    }

    /**
     * The value of the most specific matching pattern, ignoring the {@code *} fallback.
     */
    public Optional<Double> find(String actionClass) {
        if (actionClass == null) {
            return Optional.empty();
        }
        Double direct = exact.get(actionClass);
        if (direct != null) {
            return Optional.of(direct);
        }
        for (Map.Entry<String, Double> entry : bySpecificity) {
            if (ActionClasses.matchesPattern(actionClass, entry.getKey())) {
                return Optional.of(entry.getValue());
            }
        }
        return Optional.empty();
    }

    public double fallback() {
        return fallback;
    }

    public List<String> patterns() {
        return List.copyOf(exact.keySet());
    }

    private static int segments(String pattern) {
        return pattern.split(ActionClasses.SEPARATOR, -1).length;
    }

    private static int wildcards(String pattern) {
        int count = 0;
        for (String part : pattern.split(ActionClasses.SEPARATOR, -1)) {
            if (ActionClasses.WILDCARD.equals(part)) {
                count++;
            }
        }
        return count;
    }

    public static final class Builder {
        private final Map<String, Double> entries = new LinkedHashMap<>();
        private double fallback = 0.5;

        private Builder() {
        }

        public Builder put(String pattern, double value) {
            if (ActionClasses.WILDCARD.equals(pattern)) {
                this.fallback = value;
            } else {
                entries.put(pattern, value);
            }
            return this;
        }

        public Builder fallback(double value) {
            this.fallback = value;
            return this;
        }

        public PatternTable build() {
            return new PatternTable(entries, fallback);
        }
    }
}
