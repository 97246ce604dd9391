package com.eainde.ace.audit;

/**
 * Operator answer to an escalation.
 *
 * @param modification what the operator changed, for {@link EscalationDecision#MODIFIED}
 */
public record EscalationResponse(String actionClass, EscalationDecision decision, String modification) {

    public static EscalationResponse approved(String actionClass) {
        return new EscalationResponse(actionClass, EscalationDecision.APPROVED, null);
    }

    public static EscalationResponse denied(String actionClass) {
        return new EscalationResponse(actionClass, EscalationDecision.DENIED, null);
    }

    public static EscalationResponse modified(String actionClass, String modification) {
        return new EscalationResponse(actionClass, EscalationDecision.MODIFIED, modification);
    }
}
