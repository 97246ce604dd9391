package com.eainde.ace.trust;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Tags content with provenance and trust, and scans it for prompt-injection signatures.
 * <p>
 * The signature list is data: a {@link HostilePattern} per family, evaluated in order.
 * Trust also feeds scoring through {@link #applyTrustModifier(double, TrustSource)},
 * which narrows or widens the blast-radius score of an action driven by the content.
 */
@Slf4j
@Component
public class TrustSourceTagger {

    static final double HOSTILE_CAP = 0.1;
    static final double UNTRUSTED_REDUCTION = 0.3;
    static final double TRUSTED_BONUS = 0.1;

    private static final String MERGED_MARKER = "merged";

    private final Clock clock;
    private final List<HostilePattern> patterns;

    @Autowired
    public TrustSourceTagger(Clock clock) {
        this(clock, HostilePatterns.DEFAULT);
    }

    public TrustSourceTagger(Clock clock, List<HostilePattern> patterns) {
        this.clock = clock;
        this.patterns = List.copyOf(patterns);
    }

    // =========================================================================
    //  Tagging
    // =========================================================================

    public TrustSource tagContent(TagRequest request) {
        SourceType type = request.getType();
        TrustLevel level = request.getLevel() != null ? request.getLevel() : getDefaultTrustLevel(type);
        String origin = request.getOrigin() != null && !request.getOrigin().isBlank()
                ? request.getOrigin()
                : type.value() + ":unknown";
        return TrustSource.of(type, level, origin, TrustSource.appendLink(request.getChain(), origin), now());
    }

    public static TrustLevel getDefaultTrustLevel(SourceType type) {
        return type == null ? TrustLevel.UNTRUSTED : type.defaultLevel();
    }

    /** Level of a tag, treating a missing tag as untrusted. */
    public static TrustLevel getTrustLevel(TrustSource source) {
        return source == null ? TrustLevel.UNTRUSTED : source.level();
    }

    public static boolean isHostile(TrustSource source) {
        return getTrustLevel(source) == TrustLevel.HOSTILE;
    }

    public static boolean isTrusted(TrustSource source) {
        return source != null && source.isTrusted();
    }

    /**
     * Tags the content and downgrades the tag to hostile when a signature matches.
     */
    public TaggedContent tagAndScan(String content, TagRequest request) {
        HostileDetection detection = detectHostilePatterns(content);
        TrustSource source = tagContent(request);
        if (detection.hostile()) {
            source = source.withHostilePatterns(detection.matches());
            log.warn("Hostile content from {}: {}", source.origin(), detection.patternIds());
        }
        return new TaggedContent(content, source, detection.hostile());
    }

    // =========================================================================
    //  Detection
    // =========================================================================

    public HostileDetection detectHostilePatterns(String content) {
        if (content == null || content.isBlank()) {
            return HostileDetection.CLEAN;
        }
        List<String> matches = new ArrayList<>();
        List<String> ids = new ArrayList<>();
        for (HostilePattern pattern : patterns) {
            Optional<String> match = pattern.find(content);
            if (match.isPresent()) {
                matches.add(match.get());
                ids.add(pattern.id());
            }
        }
        if (matches.isEmpty()) {
            return HostileDetection.CLEAN;
        }
        return new HostileDetection(true, List.copyOf(matches), List.copyOf(ids));
    }

    /**
     * Returns a hostile copy of {@code source} when {@code content} matches a signature,
     * otherwise {@code source} itself.
     */
    public TrustSource escalateOnHostile(TrustSource source, String content) {
        HostileDetection detection = detectHostilePatterns(content);
        if (!detection.hostile()) {
            return source;
        }
        TrustSource base = source != null
                ? source
                : tagContent(TagRequest.of(SourceType.UNKNOWN).build());
        log.warn("Escalating {} from {} to hostile: {}", base.origin(), base.level().value(), detection.patternIds());
        return base.markHostile(detection.matches(), now());
    }

    // =========================================================================
    //  Chain of custody
    // =========================================================================

    public ChainValidation validateChain(TrustSource source) {
        return validateChain(source, Map.of());
    }

    /**
     * Walks the chain and reports its weakest link. Links not in {@code knownSources} are
     * classified by scheme prefix: {@code user:}, {@code telegram:} and {@code internal:}
     * are trusted, {@code plugin:}, {@code skill:} and {@code agent:} are verified, and
     * anything else is untrusted.
     */
    public ChainValidation validateChain(TrustSource source, Map<String, TrustLevel> knownSources) {
        if (source == null || source.chain().isEmpty()) {
            return new ChainValidation(false, TrustLevel.UNTRUSTED, List.of());
        }
        TrustLevel lowest = TrustLevel.TRUSTED;
        List<String> untrustedLinks = new ArrayList<>();
        for (String link : source.chain()) {
            TrustLevel linkLevel = knownSources == null ? null : knownSources.get(link);
            if (linkLevel == null) {
                linkLevel = levelFromPrefix(link);
            }
            if (linkLevel.isBelow(TrustLevel.VERIFIED)) {
                untrustedLinks.add(link);
            }
            lowest = TrustLevel.lower(lowest, linkLevel);
        }
        return new ChainValidation(true, lowest, List.copyOf(untrustedLinks));
    }

    private static TrustLevel levelFromPrefix(String link) {
        if (link.startsWith("user:") || link.startsWith("telegram:") || link.startsWith("internal:")) {
            return TrustLevel.TRUSTED;
        }
        if (link.startsWith("plugin:") || link.startsWith("skill:") || link.startsWith("agent:")) {
            return TrustLevel.VERIFIED;
        }
        return TrustLevel.UNTRUSTED;
    }

    // =========================================================================
    //  Scoring modifier
    // =========================================================================

    /**
     * Blast-radius adjustment by trust. Hostile caps at 0.1, untrusted subtracts 0.3,
     * trusted adds 0.1 and verified is unchanged. The result is always within [0, 1];
     * a NaN input counts as 0.
     */
    public double applyTrustModifier(double blastRadius, TrustSource source) {
        double value = Double.isNaN(blastRadius) ? 0.0 : blastRadius;
        double result = switch (getTrustLevel(source)) {
            case HOSTILE -> Math.min(value, HOSTILE_CAP);
            case UNTRUSTED -> value - UNTRUSTED_REDUCTION;
            case TRUSTED -> value + TRUSTED_BONUS;
            case VERIFIED -> value;
        };
        return Math.max(0.0, Math.min(1.0, result));
    }

    // =========================================================================
    //  Combination and factories
    // =========================================================================

    /**
     * Combines two tags for content assembled from both. The lower level wins and the
     * chains are concatenated with a {@code merged} marker.
     */
    public TrustSource mergeSources(TrustSource a, TrustSource b) {
        TrustLevel level = TrustLevel.lower(getTrustLevel(a), getTrustLevel(b));
        String origin = "merged:" + originOf(a) + "+" + originOf(b);
        List<String> chain = new ArrayList<>();
        if (a != null) {
            chain.addAll(a.chain());
        }
        if (b != null) {
            chain.addAll(b.chain());
        }
        chain.add(MERGED_MARKER);
        return TrustSource.of(SourceType.AGENT, level, origin, chain, now());
    }

    public TrustSource createTelegramUserSource(String userId, String username) {
        String suffix = username == null || username.isBlank() ? "" : "(@" + username + ")";
        return tagContent(TagRequest.of(SourceType.USER)
                .level(TrustLevel.TRUSTED)
                .origin("telegram:" + userId + suffix)
                .build());
    }

    public TrustSource createWebSource(String url) {
        return tagContent(TagRequest.of(SourceType.WEB)
                .level(TrustLevel.UNTRUSTED)
                .origin("web:" + url)
                .build());
    }

    public TrustSource createPluginSource(String pluginName, boolean approved) {
        return tagContent(TagRequest.of(SourceType.PLUGIN)
                .level(approved ? TrustLevel.VERIFIED : TrustLevel.UNTRUSTED)
                .origin("plugin:" + pluginName)
                .build());
    }

    public TrustSource createInternalSource(String component) {
        return tagContent(TagRequest.of(SourceType.INTERNAL)
                .level(TrustLevel.TRUSTED)
                .origin("internal:" + component)
                .build());
    }

    private static String originOf(TrustSource source) {
        return source == null || source.origin() == null ? "unknown" : source.origin();
    }

    private Instant now() {
        return clock.instant();
    }
}
