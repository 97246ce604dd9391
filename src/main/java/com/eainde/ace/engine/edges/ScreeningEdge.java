package com.eainde.ace.engine.edges;

import com.eainde.ace.engine.GateState;
import org.bsc.langgraph4j.action.AsyncEdgeAction;
import org.springframework.stereotype.Component;

import java.util.concurrent.CompletableFuture;

/**
 * Ends the gate early when screening already produced a tier.
 */
@Component
public class ScreeningEdge implements AsyncEdgeAction<GateState> {

    public static final String DECIDED = "decided";
    public static final String SCORE = "score";

    @Override
    public CompletableFuture<String> apply(GateState state) {
        return CompletableFuture.completedFuture(state.getTier() != null ? DECIDED : SCORE);
    }
}
