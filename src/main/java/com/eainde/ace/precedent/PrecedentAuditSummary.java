package com.eainde.ace.precedent;

import java.time.Instant;
import java.util.List;

/**
 * Windowed view of precedent activity used by the trust audit.
 */
public record PrecedentAuditSummary(Period period,
                                    Totals totals,
                                    RecentActivity recentActivity,
                                    List<ScoreChange> scoreChanges,
                                    List<ClassScore> topClasses,
                                    List<ClassScore> bottomClasses) {

    public record Period(int days, Instant from, Instant to) {
    }

    public record Totals(int classes, long totalActions, long totalPositive, long totalNegative) {
    }

    public record RecentActivity(int actions, int positive, int negative) {
    }

    public record ScoreChange(String actionClass, double from, double to, double change) {
    }

    public record ClassScore(String actionClass, double score) {
    }
}
