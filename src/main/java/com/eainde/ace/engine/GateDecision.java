package com.eainde.ace.engine;

import com.eainde.ace.bypass.BypassCheck;
import com.eainde.ace.deliberation.DeliberationReport;
import com.eainde.ace.scoring.ScoreResult;
import com.eainde.ace.scoring.Tier;
import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * What the agent should do with an action.
 *
 * @param proceed      whether the agent may go ahead without a human: tier Act, or an active bypass
 * @param score        absent when screening decided before scoring
 * @param deliberation present only when the deliberation protocol ran
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record GateDecision(String actionClass,
                           Tier tier,
                           String reason,
                           boolean proceed,
                           BypassCheck bypass,
                           ScoreResult score,
                           DeliberationReport deliberation) {

    public boolean needsOperator() {
        return !proceed;
    }
}
