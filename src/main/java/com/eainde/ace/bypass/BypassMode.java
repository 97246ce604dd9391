package com.eainde.ace.bypass;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Optional;

public enum BypassMode {
    /** Normal gating. */
    OFF("off"),
    /** Decisions are computed and logged but never block. */
    LOG_ONLY("log-only"),
    /** Gating is skipped entirely. */
    DISABLED("disabled");

    private final String value;

    BypassMode(String value) {
        this.value = value;
    }

    @JsonValue
    public String value() {
        return value;
    }

    public static Optional<BypassMode> parse(String value) {
        if (value == null) {
            return Optional.empty();
        }
        for (BypassMode mode : values()) {
            if (mode.value.equalsIgnoreCase(value.trim())) {
                return Optional.of(mode);
            }
        }
        return Optional.empty();
    }
}
