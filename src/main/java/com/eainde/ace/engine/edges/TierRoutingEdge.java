package com.eainde.ace.engine.edges;

import com.eainde.ace.engine.GateState;
import com.eainde.ace.scoring.Tier;
import org.bsc.langgraph4j.action.AsyncEdgeAction;
import org.springframework.stereotype.Component;

import java.util.concurrent.CompletableFuture;

@Component
public class TierRoutingEdge implements AsyncEdgeAction<GateState> {

    public static final String DELIBERATE = "deliberate";
    public static final String DECIDED = "decided";

    @Override
    public CompletableFuture<String> apply(GateState state) {
        return CompletableFuture.completedFuture(state.getTier() == Tier.DELIBERATE ? DELIBERATE : DECIDED);
    }
}
