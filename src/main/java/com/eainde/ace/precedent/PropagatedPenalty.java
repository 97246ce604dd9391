package com.eainde.ace.precedent;

import java.util.Locale;

/**
 * A penalty applied to a related class because of a negative outcome elsewhere.
 *
 * @param actionClass class that was adjusted
 * @param relation    {@code parent} or {@code sibling}
 * @param penalty     amount subtracted before clamping
 * @param newScore    score after the adjustment
 */
public record PropagatedPenalty(String actionClass, String relation, double penalty, double newScore) {

    @Override
    public String toString() {
        return String.format(Locale.ROOT, "%s: -%.2f", actionClass, penalty);
    }
}
