package com.eainde.ace.precedent;

import com.eainde.ace.model.ErrorKind;

import java.util.List;

public record OutcomeResult(boolean success,
                            String error,
                            ErrorKind errorKind,
                            double oldScore,
                            double newScore,
                            List<PropagatedPenalty> propagated) {

    static OutcomeResult success(double oldScore, double newScore, List<PropagatedPenalty> propagated) {
        return new OutcomeResult(true, null, null, oldScore, newScore, List.copyOf(propagated));
    }

    static OutcomeResult failure(ErrorKind kind, String error) {
        return new OutcomeResult(false, error, kind, 0.0, 0.0, List.of());
    }
}
