package com.eainde.ace.precedent;

import java.util.List;

public record DecayReport(int updated, List<DecayedScore> decayed) {

    public record DecayedScore(String actionClass, double oldScore, double newScore) {
    }
}
