package com.eainde.ace.classifier;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.TreeSet;

/**
 * Action class hierarchy and the seed policy tables.
 * <p>
 * Classes are {@code category[:subcategory[:specific]]}. A {@code *} segment matches any
 * value at that position and a trailing {@code *} also matches any deeper segments.
 * The two safety lists are fixed at compile time: nothing at runtime can add to or
 * remove from them.
 */
public final class ActionClasses {

    public static final String WILDCARD = "*";
    public static final String SEPARATOR = ":";

    /** Never automatable, regardless of score, trust or bypass. */
    public static final List<String> HARD_CEILING_CLASSES = List.of(
            "code:execute:external",
            "self:modify:ace-thresholds",
            "self:modify:ace-config",
            "self:modify:security",
            "self:improve:core",
            "skill:load:external",
            "plugin:load:external",
            "*:credentials:*"
    );

    /** Never fully automatable: at best Deliberate. */
    public static final List<String> DELIBERATE_MINIMUM_CLASSES = List.of(
            "git:push:remote",
            "communication:moltbook:post",
            "communication:email:*",
            "filesystem:write:config",
            "observation:web:fetch",
            "skill:create:*",
            "plugin:create:*",
            "self:modify:reflection",
            "self:improve:skill",
            "self:improve:plugin",
            "self:improve:config"
    );

    public static final PatternTable DEFAULT_REVERSIBILITY = PatternTable.builder()
            // filesystem
            .put("filesystem:read:*", 1.0)
            .put("filesystem:write:local", 0.8)
            .put("filesystem:write:config", 0.6)
            .put("filesystem:delete:*", 0.2)
            .put("filesystem:delete:backup", 0.0)
            // git
            .put("git:commit:local", 0.9)
            .put("git:branch:create", 0.9)
            .put("git:branch:delete", 0.4)
            .put("git:push:remote", 0.3)
            .put("git:push:force", 0.1)
            .put("git:reset:*", 0.2)
            // communication
            .put("communication:telegram:user", 0.5)
            .put("communication:moltbook:post", 0.3)
            .put("communication:email:*", 0.1)
            // observation
            .put("observation:moltbook:read", 1.0)
            .put("observation:web:search", 1.0)
            .put("observation:web:fetch", 0.9)
            // extensions
            .put("plugin:load:approved", 0.7)
            .put("plugin:load:external", 0.3)
            .put("plugin:create:*", 0.8)
            .put("skill:load:approved", 0.7)
            .put("skill:load:external", 0.3)
            // code
            .put("code:execute:internal", 0.6)
            .put("code:execute:external", 0.0)
            // self modification
            .put("self:modify:reflection", 0.7)
            .put("self:modify:config", 0.4)
            .put("self:modify:ace-thresholds", 0.0)
            .put("self:modify:ace-config", 0.0)
            .put("self:modify:security", 0.0)
            .put("self:improve:reflection", 0.9)
            .put("self:improve:skill", 0.7)
            .put("self:improve:plugin", 0.7)
            .put("self:improve:config", 0.5)
            .put("self:improve:core", 0.1)
            .put(WILDCARD, 0.5)
            .build();

    public static final PatternTable DEFAULT_BLAST_RADIUS = PatternTable.builder()
            // contained
            .put("filesystem:read:*", 1.0)
            .put("filesystem:write:local", 0.9)
            .put("observation:*", 0.95)
            .put("self:modify:reflection", 0.8)
            .put("plugin:load:approved", 0.75)
            .put("git:commit:local", 0.8)
            .put("git:branch:create", 0.8)
            // moderate
            .put("communication:telegram:user", 0.5)
            .put("filesystem:write:config", 0.5)
            .put("git:push:remote", 0.4)
            // wide
            .put("communication:moltbook:post", 0.2)
            .put("communication:email:*", 0.2)
            .put("plugin:load:external", 0.2)
            .put("skill:load:external", 0.2)
            .put("self:improve:reflection", 0.9)
            .put("self:improve:skill", 0.7)
            .put("self:improve:plugin", 0.65)
            .put("self:improve:config", 0.5)
            .put("self:improve:core", 0.1)
            // unbounded
            .put("*:credentials:*", 0.0)
            .put("code:execute:external", 0.0)
            .put(WILDCARD, 0.5)
            .build();

    private ActionClasses() {
    }

    public static ActionClass parse(String actionClass) {
        return ActionClass.parse(actionClass);
    }

    /**
     * Strips the last segment and replaces it with {@code *}. A class that already ends in
     * {@code *} climbs one further level, so {@code git:commit:*} has parent {@code git:*}.
     *
     * @return the parent pattern, or {@code null} for a root category
     */
    public static String getParentClass(String actionClass) {
        if (actionClass == null || actionClass.isEmpty()) {
            return null;
        }
        List<String> parts = new ArrayList<>(List.of(actionClass.split(SEPARATOR, -1)));
        if (parts.size() <= 1) {
            return null;
        }
        if (WILDCARD.equals(parts.get(parts.size() - 1))) {
            parts.remove(parts.size() - 1);
            if (parts.size() <= 1) {
                return null;
            }
        }
        parts.remove(parts.size() - 1);
        return String.join(SEPARATOR, parts) + SEPARATOR + WILDCARD;
    }

    /**
     * Classes from {@code knownClasses} that share this class's parent and depth. The parent
     * pattern itself is not a sibling.
     */
    public static List<String> getSiblingClasses(String actionClass, Collection<String> knownClasses) {
        String parent = getParentClass(actionClass);
        if (parent == null || knownClasses == null) {
            return List.of();
        }
        String prefix = parent.substring(0, parent.length() - WILDCARD.length());
        int depth = actionClass.split(SEPARATOR, -1).length;
        List<String> siblings = new ArrayList<>();
        for (String candidate : knownClasses) {
            if (!candidate.equals(actionClass)
                    && !candidate.equals(parent)
                    && candidate.startsWith(prefix)
                    && candidate.split(SEPARATOR, -1).length == depth) {
                siblings.add(candidate);
            }
        }
        return siblings;
    }

    /**
     * Wildcard match. {@code *} matches everything; a shorter pattern only matches deeper
     * classes when it ends in {@code *}, so {@code git:commit} does not match
     * {@code git:commit:local} but {@code git:*} does.
     */
    public static boolean matchesPattern(String actionClass, String pattern) {
        if (pattern == null || actionClass == null) {
            return false;
        }
        if (WILDCARD.equals(pattern) || pattern.equals(actionClass)) {
            return true;
        }
        String[] classParts = actionClass.split(SEPARATOR, -1);
        String[] patternParts = pattern.split(SEPARATOR, -1);

        if (patternParts.length < classParts.length
                && !WILDCARD.equals(patternParts[patternParts.length - 1])) {
            return false;
        }
        for (int i = 0; i < patternParts.length; i++) {
            if (WILDCARD.equals(patternParts[i])) {
                continue;
            }
            if (i >= classParts.length || !patternParts[i].equals(classParts[i])) {
                return false;
            }
        }
        return true;
    }

    public static boolean hasHardCeiling(String actionClass) {
        return matchesAny(actionClass, HARD_CEILING_CLASSES);
    }

    public static boolean requiresDeliberation(String actionClass) {
        return matchesAny(actionClass, DELIBERATE_MINIMUM_CLASSES);
    }

    public static double getDefaultReversibility(String actionClass) {
        return DEFAULT_REVERSIBILITY.lookup(actionClass);
    }

    public static double getDefaultBlastRadius(String actionClass) {
        return DEFAULT_BLAST_RADIUS.lookup(actionClass);
    }

    /**
     * Every pattern named by the default tables, sorted, without the {@code *} fallback.
     */
    public static List<String> getAllActionClasses() {
        TreeSet<String> all = new TreeSet<>(DEFAULT_REVERSIBILITY.patterns());
        all.addAll(DEFAULT_BLAST_RADIUS.patterns());
        return List.copyOf(all);
    }

    public static ClassificationResult classify(String actionClass) {
        return new ClassificationResult(
                actionClass,
                hasHardCeiling(actionClass),
                requiresDeliberation(actionClass),
                getDefaultReversibility(actionClass),
                getDefaultBlastRadius(actionClass));
    }

    private static boolean matchesAny(String actionClass, List<String> patterns) {
        for (String pattern : patterns) {
            if (matchesPattern(actionClass, pattern)) {
                return true;
            }
        }
        return false;
    }
}
