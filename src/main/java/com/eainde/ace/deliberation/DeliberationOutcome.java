package com.eainde.ace.deliberation;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum DeliberationOutcome {
    /** Move up to Act. */
    PROMOTE,
    /** Stay at Deliberate and proceed with logging. */
    MAINTAIN,
    /** Move down to Escalate. */
    DEMOTE;

    @JsonValue
    public String value() {
        return name().toLowerCase(Locale.ROOT);
    }
}
