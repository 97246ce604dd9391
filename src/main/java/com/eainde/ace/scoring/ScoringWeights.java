package com.eainde.ace.scoring;

import java.io.Serializable;

/**
 * Composite weights for reversibility, precedent and blast radius. Must sum to 1.
 */
public record ScoringWeights(double reversibility, double precedent, double blastRadius) implements Serializable {

    public static final ScoringWeights DEFAULT = new ScoringWeights(0.30, 0.35, 0.35);

    private static final double TOLERANCE = 1e-6;

    public ScoringWeights {
        if (reversibility < 0 || precedent < 0 || blastRadius < 0) {
            throw new IllegalArgumentException("Weights must be non-negative");
        }
        double sum = reversibility + precedent + blastRadius;
        if (Double.isNaN(sum) || Math.abs(sum - 1.0) > TOLERANCE) {
            throw new IllegalArgumentException("Weights must sum to 1, got " + sum);
        }
    }

    public double composite(double r, double p, double b) {
        return r * reversibility + p * precedent + b * blastRadius;
    }
}
