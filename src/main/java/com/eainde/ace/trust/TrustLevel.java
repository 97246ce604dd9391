package com.eainde.ace.trust;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Trust levels, from most to least trusted.
 */
public enum TrustLevel {
    TRUSTED("trusted", 3),
    VERIFIED("verified", 2),
    UNTRUSTED("untrusted", 1),
    HOSTILE("hostile", 0);

    private final String value;
    private final int rank;

    TrustLevel(String value, int rank) {
        this.value = value;
        this.rank = rank;
    }

    @JsonValue
    public String value() {
        return value;
    }

    public int rank() {
        return rank;
    }

    public boolean isBelow(TrustLevel other) {
        return rank < other.rank;
    }

    public static TrustLevel lower(TrustLevel a, TrustLevel b) {
        return a.rank <= b.rank ? a : b;
    }

    @JsonCreator
    public static TrustLevel fromValue(String value) {
        for (TrustLevel level : values()) {
            if (level.value.equalsIgnoreCase(value)) {
                return level;
            }
        }
        throw new IllegalArgumentException("Unknown trust level: " + value);
    }
}
