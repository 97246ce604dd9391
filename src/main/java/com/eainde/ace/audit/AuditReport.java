package com.eainde.ace.audit;

import com.eainde.ace.precedent.PrecedentAuditSummary;
import com.fasterxml.jackson.annotation.JsonValue;

import java.time.Instant;
import java.util.List;
import java.util.Locale;

/**
 * Periodic trust audit, built for an operator to read.
 */
public record AuditReport(String type,
                          Instant generatedAt,
                          PrecedentAuditSummary.Period period,
                          Activity activity,
                          PrecedentSection precedent,
                          DriftSection drift,
                          RubberStampSection rubberStamp,
                          BypassSection bypass,
                          List<Warning> warnings) {

    public static final String TYPE = "ace:trust-audit";

    public record Activity(int totalActions, int positive, int negative, int escalations,
                           EscalationBreakdown escalationBreakdown) {
    }

    public record EscalationBreakdown(int approved, int denied, int modified) {
    }

    public record PrecedentSection(int classesActive,
                                   List<PrecedentAuditSummary.ScoreChange> scoreChanges,
                                   List<PrecedentAuditSummary.ClassScore> topClasses,
                                   List<PrecedentAuditSummary.ClassScore> bottomClasses) {
    }

    public record DriftSection(double rate, String ratePercent, double warningRate, boolean warning,
                               List<String> expanding, List<String> contracting) {
    }

    public record RubberStampSection(int consecutiveApprovals, int threshold, boolean warning) {
    }

    public record BypassSection(int temporaryBypassCount, int actionsWhileBypassed, int hardCeilingBlocked,
                                Instant lastBypassAt) {
    }

    public record Warning(String type, Severity severity, String message) {
    }

    public enum Severity {
        HIGH,
        MEDIUM,
        LOW;

        @JsonValue
        public String value() {
            return name().toLowerCase(Locale.ROOT);
        }
    }
}
