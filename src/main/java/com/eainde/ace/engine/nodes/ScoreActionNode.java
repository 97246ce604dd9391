package com.eainde.ace.engine.nodes;

import com.eainde.ace.engine.GateState;
import com.eainde.ace.scoring.ActionScorer;
import com.eainde.ace.scoring.ScoreResult;
import lombok.extern.slf4j.Slf4j;
import org.bsc.langgraph4j.action.AsyncNodeAction;
import org.springframework.stereotype.Component;

import java.util.Map;
import java.util.concurrent.CompletableFuture;

@Slf4j
@Component
public class ScoreActionNode implements AsyncNodeAction<GateState> {

    private final ActionScorer scorer;

    public ScoreActionNode(ActionScorer scorer) {
        this.scorer = scorer;
    }

    @Override
    public CompletableFuture<Map<String, Object>> apply(GateState state) {
        ScoreResult score = scorer.scoreAction(state.getRequest());
        Map<String, Object> update = GateState.verdict(score.tier(), score.reason());
        update.put(GateState.SCORE, score);
        return CompletableFuture.completedFuture(update);
    }
}
