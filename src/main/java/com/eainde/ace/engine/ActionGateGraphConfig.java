package com.eainde.ace.engine;

import com.eainde.ace.engine.edges.ScreeningEdge;
import com.eainde.ace.engine.edges.TierRoutingEdge;
import com.eainde.ace.engine.nodes.DeliberateActionNode;
import com.eainde.ace.engine.nodes.ScoreActionNode;
import com.eainde.ace.engine.nodes.ScreenActionNode;
import org.bsc.langgraph4j.CompiledGraph;
import org.bsc.langgraph4j.GraphStateException;
import org.bsc.langgraph4j.StateGraph;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.Map;

import static org.bsc.langgraph4j.StateGraph.END;
import static org.bsc.langgraph4j.StateGraph.START;

/**
 * Wires the action gate:
 * <pre>
 * START -> screen --decided--> END
 *            \--score--> score --decided--> END
 *                          \--deliberate--> deliberate -> END
 * </pre>
 */
@Configuration
public class ActionGateGraphConfig {

    public static final String GATE_WORKFLOW = "actionGateWorkflow";

    static final String SCREEN = "screen";
    static final String SCORE = "score";
    static final String DELIBERATE = "deliberate";

    @Bean(GATE_WORKFLOW)
    public CompiledGraph<GateState> actionGateWorkflow(ScreenActionNode screenNode,
                                                       ScoreActionNode scoreNode,
                                                       DeliberateActionNode deliberateNode,
                                                       ScreeningEdge screeningEdge,
                                                       TierRoutingEdge tierRoutingEdge) throws GraphStateException {
        return build(screenNode, scoreNode, deliberateNode, screeningEdge, tierRoutingEdge);
    }

    public static CompiledGraph<GateState> build(ScreenActionNode screenNode,
                                                 ScoreActionNode scoreNode,
                                                 DeliberateActionNode deliberateNode,
                                                 ScreeningEdge screeningEdge,
                                                 TierRoutingEdge tierRoutingEdge) throws GraphStateException {

        StateGraph<GateState> workflow = new StateGraph<>(GateState::new);

        workflow.addNode(SCREEN, screenNode);
        workflow.addNode(SCORE, scoreNode);
        workflow.addNode(DELIBERATE, deliberateNode);

        workflow.addEdge(START, SCREEN);

        workflow.addConditionalEdges(
                SCREEN,
                screeningEdge,
                Map.of(
                        ScreeningEdge.DECIDED, END,
                        ScreeningEdge.SCORE, SCORE
                )
        );

        workflow.addConditionalEdges(
                SCORE,
                tierRoutingEdge,
                Map.of(
                        TierRoutingEdge.DECIDED, END,
                        TierRoutingEdge.DELIBERATE, DELIBERATE
                )
        );

        workflow.addEdge(DELIBERATE, END);

        return workflow.compile();
    }
}
