package com.eainde.ace.deliberation;

import com.eainde.ace.scoring.Tier;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.io.Serializable;
import java.time.Instant;
import java.util.List;

/**
 * Result of running the five checks on one action. {@code stepDetails} is only filled
 * for verbose runs.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record DeliberationReport(String event,
                                 Instant timestamp,
                                 long durationMs,
                                 String actionClass,
                                 InitialScores initialScores,
                                 double initialComposite,
                                 Tier initialTier,
                                 double confidenceAdjustment,
                                 double adjustedComposite,
                                 List<DeliberationStepResult.StepSummary> steps,
                                 List<DeliberationStepResult> stepDetails,
                                 List<String> concerns,
                                 int totalConcerns,
                                 int failedSteps,
                                 DeliberationOutcome outcome,
                                 Tier finalTier,
                                 String reason) implements Serializable {

    public static final String EVENT = "ace:deliberation";

    public record InitialScores(@JsonProperty("R") double reversibility,
                                @JsonProperty("P") double precedent,
                                @JsonProperty("B") double blastRadius) implements Serializable {
    }
}
