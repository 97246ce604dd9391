package com.eainde.ace.scoring;

import java.io.Serializable;

/**
 * Composite boundaries: at or above {@code act} is Act, at or above {@code escalate} is
 * Deliberate, anything lower escalates. {@code act} is raised to {@link #ACT_FLOOR} when
 * configured lower.
 */
public record TierThresholds(double act, double escalate) implements Serializable {

    /** Act can never be granted below this composite, whatever the configuration says. */
    public static final double ACT_FLOOR = 0.50;

    public static final TierThresholds DEFAULT = new TierThresholds(0.70, 0.40);

    public TierThresholds {
        act = Double.isNaN(act) ? 0.70 : Math.max(ACT_FLOOR, act);
        escalate = Double.isNaN(escalate) ? 0.40 : escalate;
        if (escalate < 0 || escalate >= act) {
            throw new IllegalArgumentException(
                    "Escalate threshold must be in [0, act), got escalate=" + escalate + " act=" + act);
        }
    }

    public Tier tierFor(double composite) {
        if (composite >= act) {
            return Tier.ACT;
        }
        if (composite >= escalate) {
            return Tier.DELIBERATE;
        }
        return Tier.ESCALATE;
    }
}
