package com.eainde.ace.audit;

import com.eainde.ace.model.ErrorKind;

import java.util.List;

/**
 * Small result types returned by {@link TrustAuditService}.
 */
public final class AuditChecks {

    private AuditChecks() {
    }

    public record EscalationAck(boolean success, String error, ErrorKind errorKind,
                                boolean rubberStampWarning, int consecutiveCount) {

        static EscalationAck recorded(boolean rubberStampWarning, int consecutiveCount) {
            return new EscalationAck(true, null, null, rubberStampWarning, consecutiveCount);
        }

        static EscalationAck failure(ErrorKind kind, String error, int consecutiveCount) {
            return new EscalationAck(false, error, kind, false, consecutiveCount);
        }
    }

    public record RubberStamp(boolean detected, int count, int threshold, String message) {
    }

    public record SelfModification(boolean blocked, String reason) {

        static final SelfModification ALLOWED = new SelfModification(false, null);
    }

    /**
     * @param rate        (promotes - demotes) / deliberations in the window
     * @param expanding   classes with more promotions than demotions, as {@code class: +n}
     * @param contracting classes with more demotions than promotions, as {@code class: -n}
     * @param samples     deliberations in the window
     */
    public record Drift(double rate, List<String> expanding, List<String> contracting,
                        boolean warning, String message, int samples) {
    }

    public record AuditDue(boolean due, Double daysSinceLast) {
    }
}
