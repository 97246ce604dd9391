package com.eainde.ace.scoring;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * What the agent may do with an action.
 */
public enum Tier {
    /** Proceed autonomously. */
    ACT,
    /** Self-review through the deliberation protocol first. */
    DELIBERATE,
    /** A human decides. */
    ESCALATE;

    @JsonValue
    public String value() {
        return name().toLowerCase(Locale.ROOT);
    }
}
