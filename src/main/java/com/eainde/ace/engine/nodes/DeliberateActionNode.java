package com.eainde.ace.engine.nodes;

import com.eainde.ace.deliberation.DeliberationProtocol;
import com.eainde.ace.deliberation.DeliberationReport;
import com.eainde.ace.deliberation.SkipDecision;
import com.eainde.ace.engine.GateState;
import lombok.extern.slf4j.Slf4j;
import org.bsc.langgraph4j.action.AsyncNodeAction;
import org.springframework.stereotype.Component;

import java.util.Map;
import java.util.concurrent.CompletableFuture;

/**
 * Runs the five-step self-review and replaces the scored tier with its verdict.
 */
@Slf4j
@Component
public class DeliberateActionNode implements AsyncNodeAction<GateState> {

    private final DeliberationProtocol protocol;

    public DeliberateActionNode(DeliberationProtocol protocol) {
        this.protocol = protocol;
    }

    @Override
    public CompletableFuture<Map<String, Object>> apply(GateState state) {
        SkipDecision skip = protocol.shouldSkipDeliberation(state.getRequest());
        if (skip.skip()) {
            return CompletableFuture.completedFuture(GateState.verdict(skip.tier(), skip.reason()));
        }

        DeliberationReport report = protocol.deliberate(state.getRequest());
        log.info("Deliberated {}: {} -> {}", report.actionClass(), report.outcome().value(), report.finalTier().value());
        Map<String, Object> update = GateState.verdict(report.finalTier(), report.reason());
        update.put(GateState.DELIBERATION, report);
        return CompletableFuture.completedFuture(update);
    }
}
