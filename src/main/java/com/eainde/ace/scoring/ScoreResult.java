package com.eainde.ace.scoring;

import java.io.Serializable;

/**
 * One scoring pass. R, P and B are the values actually used, after defaults, the
 * precedent ceiling, clamping and the trust modifier.
 */
public record ScoreResult(String actionClass,
                          double reversibility,
                          double precedent,
                          double blastRadius,
                          double composite,
                          Tier tier,
                          String reason,
                          boolean firstInClass,
                          ScoringWeights weights,
                          TierThresholds thresholds) implements Serializable {
}
