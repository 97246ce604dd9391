package com.eainde.ace.classifier;

import java.io.Serializable;
import java.util.Arrays;
import java.util.List;

/**
 * Parsed form of a hierarchical action identifier such as {@code git:commit:local}.
 * <p>
 * Parsing is a plain split on {@code ':'}. Missing segments read as {@code *} and
 * unknown segments are kept as opaque strings, so {@link #parse(String)} never throws.
 */
public record ActionClass(String value,
                          String category,
                          String subcategory,
                          String specific,
                          List<String> parts) implements Serializable {

    public static ActionClass parse(String actionClass) {
        String raw = actionClass == null ? "" : actionClass;
        List<String> parts = raw.isEmpty()
                ? List.of()
                : List.copyOf(Arrays.asList(raw.split(ActionClasses.SEPARATOR, -1)));
        return new ActionClass(
                raw,
                segment(parts, 0),
                segment(parts, 1),
                segment(parts, 2),
                parts);
    }

    public int depth() {
        return parts.size();
    }

    private static String segment(List<String> parts, int index) {
        if (index >= parts.size() || parts.get(index).isEmpty()) {
            return ActionClasses.WILDCARD;
        }
        return parts.get(index);
    }

    @Override
    public String toString() {
        return value;
    }
}
