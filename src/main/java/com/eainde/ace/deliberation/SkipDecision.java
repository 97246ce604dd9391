package com.eainde.ace.deliberation;

import com.eainde.ace.scoring.Tier;

import java.io.Serializable;

/**
 * Whether an action's tier is already fixed, making the five-step review pointless.
 */
public record SkipDecision(boolean skip, Tier tier, String reason) implements Serializable {

    static SkipDecision proceed() {
        return new SkipDecision(false, null, null);
    }

    static SkipDecision escalate(String reason) {
        return new SkipDecision(true, Tier.ESCALATE, reason);
    }
}
