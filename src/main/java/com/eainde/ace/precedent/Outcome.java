package com.eainde.ace.precedent;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum Outcome {
    PENDING,
    POSITIVE,
    NEGATIVE;

    @JsonValue
    public String value() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static Outcome fromValue(String value) {
        return valueOf(value.toUpperCase(Locale.ROOT));
    }
}
