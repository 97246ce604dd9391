package com.eainde.ace.trust;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;

import java.io.Serializable;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Provenance tag attached to a unit of content. Immutable; hostile escalation returns a
 * copy that keeps the level it replaced in {@code originalLevel}.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record TrustSource(SourceType type,
                          TrustLevel level,
                          String origin,
                          List<String> chain,
                          Instant timestamp,
                          List<String> hostilePatterns,
                          Instant escalatedAt,
                          TrustLevel originalLevel) implements Serializable {

    public TrustSource {
        type = type == null ? SourceType.UNKNOWN : type;
        level = level == null ? type.defaultLevel() : level;
        chain = chain == null ? List.of() : List.copyOf(chain);
        hostilePatterns = hostilePatterns == null ? null : List.copyOf(hostilePatterns);
    }

    public static TrustSource of(SourceType type, TrustLevel level, String origin, List<String> chain, Instant timestamp) {
        return new TrustSource(type, level, origin, chain, timestamp, null, null, null);
    }

    @JsonIgnore
    public boolean isHostile() {
        return level == TrustLevel.HOSTILE;
    }

    @JsonIgnore
    public boolean isTrusted() {
        return level == TrustLevel.TRUSTED || level == TrustLevel.VERIFIED;
    }

    @JsonIgnore
    public boolean isEscalated() {
        return escalatedAt != null;
    }

    TrustSource markHostile(List<String> patterns, Instant at) {
        return new TrustSource(type, TrustLevel.HOSTILE, origin, chain, timestamp, patterns, at, level);
    }

    TrustSource withHostilePatterns(List<String> patterns) {
        return new TrustSource(type, TrustLevel.HOSTILE, origin, chain, timestamp, patterns, escalatedAt, originalLevel);
    }

    static List<String> appendLink(List<String> chain, String link) {
        List<String> copy = new ArrayList<>(chain == null ? List.of() : chain);
        copy.add(link);
        return copy;
    }
}
