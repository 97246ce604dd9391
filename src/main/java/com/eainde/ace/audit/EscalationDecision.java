package com.eainde.ace.audit;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * What the operator did with an escalated action.
 */
public enum EscalationDecision {
    APPROVED,
    DENIED,
    MODIFIED;

    @JsonValue
    public String value() {
        return name().toLowerCase(Locale.ROOT);
    }
}
