package com.eainde.ace.engine;

import com.eainde.ace.bypass.BypassCheck;
import com.eainde.ace.deliberation.DeliberationReport;
import com.eainde.ace.model.ActionRequest;
import com.eainde.ace.scoring.ScoreResult;
import com.eainde.ace.scoring.Tier;
import org.bsc.langgraph4j.state.AgentState;

import java.util.HashMap;
import java.util.Map;

/**
 * Graph state for one pass through the action gate.
 */
public class GateState extends AgentState {

    public static final String REQUEST = "request";
    public static final String BYPASS = "bypass";
    public static final String BLOCKED = "blocked";
    public static final String SCORE = "score";
    public static final String DELIBERATION = "deliberation";
    public static final String TIER = "tier";
    public static final String REASON = "reason";

    public GateState(Map<String, Object> initData) {
        super(initData);
    }

    public ActionRequest getRequest() { return (ActionRequest) this.data().get(REQUEST); }
    public BypassCheck getBypass() {
        return this.data().containsKey(BYPASS) ? (BypassCheck) this.data().get(BYPASS) : BypassCheck.NONE;
    }
    public boolean isBlocked() {
        return this.data().containsKey(BLOCKED) && (boolean) this.data().get(BLOCKED);
    }
    public ScoreResult getScore() { return (ScoreResult) this.data().get(SCORE); }
    public DeliberationReport getDeliberation() { return (DeliberationReport) this.data().get(DELIBERATION); }
    public Tier getTier() { return (Tier) this.data().get(TIER); }
    public String getReason() { return (String) this.data().get(REASON); }

    public static Map<String, Object> initial(ActionRequest request) {
        return Map.of(REQUEST, request);
    }

    // Map.of rejects nulls and a skipped score or deliberation has none
    public static Map<String, Object> verdict(Tier tier, String reason) {
        Map<String, Object> update = new HashMap<>();
        update.put(TIER, tier);
        if (reason != null) {
            update.put(REASON, reason);
        }
        return update;
    }
}
