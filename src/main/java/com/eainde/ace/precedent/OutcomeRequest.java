package com.eainde.ace.precedent;

/**
 * What happened after an action ran.
 *
 * @param actionClass      class of the action
 * @param result           {@link Outcome#POSITIVE} or {@link Outcome#NEGATIVE}
 * @param severity         1 (minor correction) to 3 (serious problem); ignored for positive outcomes
 * @param operatorResponse what the operator said, if anything
 * @param note             free-form note stored on the instance
 * @param instanceIndex    instance to resolve, or {@code null} for the most recent one
 */
public record OutcomeRequest(String actionClass,
                             Outcome result,
                             int severity,
                             String operatorResponse,
                             String note,
                             Integer instanceIndex) {

    public static OutcomeRequest positive(String actionClass) {
        return new OutcomeRequest(actionClass, Outcome.POSITIVE, 1, null, null, null);
    }

    public static OutcomeRequest negative(String actionClass, int severity) {
        return new OutcomeRequest(actionClass, Outcome.NEGATIVE, severity, null, null, null);
    }

    public OutcomeRequest withOperatorResponse(String response) {
        return new OutcomeRequest(actionClass, result, severity, response, note, instanceIndex);
    }

    public OutcomeRequest withNote(String text) {
        return new OutcomeRequest(actionClass, result, severity, operatorResponse, text, instanceIndex);
    }

    public OutcomeRequest withInstanceIndex(Integer index) {
        return new OutcomeRequest(actionClass, result, severity, operatorResponse, note, index);
    }
}
