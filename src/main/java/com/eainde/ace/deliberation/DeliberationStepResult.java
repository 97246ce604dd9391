package com.eainde.ace.deliberation;

import java.io.Serializable;
import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Outcome of one deliberation check. {@code details} holds what the check looked at and
 * {@code concerns} what it objected to.
 */
public record DeliberationStepResult(String step,
                                     boolean passed,
                                     Map<String, Object> details,
                                     List<String> concerns,
                                     Instant timestamp) implements Serializable {

    public DeliberationStepResult {
        details = Collections.unmodifiableMap(new LinkedHashMap<>(details));
        concerns = List.copyOf(concerns);
    }

    public StepSummary summary() {
        return new StepSummary(step, passed, concerns.size());
    }

    public record StepSummary(String step, boolean passed, int concernCount) implements Serializable {
    }
}
