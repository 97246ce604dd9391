package com.eainde.ace.trust;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Where a unit of content came from, with the trust level it gets when none is declared.
 * Plugins and skills are assumed approved; callers tag unapproved ones explicitly.
 */
public enum SourceType {
    USER(TrustLevel.TRUSTED),
    SKILL(TrustLevel.VERIFIED),
    PLUGIN(TrustLevel.VERIFIED),
    WEB(TrustLevel.UNTRUSTED),
    AGENT(TrustLevel.VERIFIED),
    MOLTBOOK(TrustLevel.UNTRUSTED),
    INTERNAL(TrustLevel.TRUSTED),
    UNKNOWN(TrustLevel.UNTRUSTED);

    private final TrustLevel defaultLevel;

    SourceType(TrustLevel defaultLevel) {
        this.defaultLevel = defaultLevel;
    }

    public TrustLevel defaultLevel() {
        return defaultLevel;
    }

    @JsonValue
    public String value() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static SourceType fromValue(String value) {
        if (value == null) {
            return UNKNOWN;
        }
        for (SourceType type : values()) {
            if (type.value().equalsIgnoreCase(value)) {
                return type;
            }
        }
        return UNKNOWN;
    }
}
