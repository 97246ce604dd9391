package com.eainde.ace.precedent;

import java.io.Serializable;
import java.time.Instant;
import java.util.List;

/**
 * Summary of a class's record.
 *
 * @param scoreHistory the last ten recorded scores, oldest first
 */
public record PrecedentHistory(int instances,
                               int approved,
                               int corrected,
                               Instant lastPositive,
                               Instant lastNegative,
                               List<Double> scoreHistory) implements Serializable {

    public PrecedentHistory {
        scoreHistory = List.copyOf(scoreHistory);
    }

    /** Share of resolved outcomes that were corrections. */
    public double correctionRate() {
        return instances == 0 ? 0.0 : (double) corrected / instances;
    }
}
