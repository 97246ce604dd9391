package com.eainde.ace.engine;

import com.eainde.ace.audit.AuditSettings;
import com.eainde.ace.audit.EscalationResponse;
import com.eainde.ace.audit.InMemoryAuditStore;
import com.eainde.ace.audit.TrustAuditService;
import com.eainde.ace.bypass.BypassManager;
import com.eainde.ace.bypass.BypassMode;
import com.eainde.ace.deliberation.DeliberationProtocol;
import com.eainde.ace.engine.edges.ScreeningEdge;
import com.eainde.ace.engine.edges.TierRoutingEdge;
import com.eainde.ace.engine.nodes.DeliberateActionNode;
import com.eainde.ace.engine.nodes.ScoreActionNode;
import com.eainde.ace.engine.nodes.ScreenActionNode;
import com.eainde.ace.model.ActionRequest;
import com.eainde.ace.precedent.InMemoryPrecedentStore;
import com.eainde.ace.precedent.OutcomeRequest;
import com.eainde.ace.precedent.OutcomeResult;
import com.eainde.ace.precedent.PrecedentMemory;
import com.eainde.ace.scoring.ActionScorer;
import com.eainde.ace.scoring.ScoringWeights;
import com.eainde.ace.scoring.Tier;
import com.eainde.ace.scoring.TierThresholds;
import com.eainde.ace.support.MutableClock;
import com.eainde.ace.trust.TrustSourceTagger;
import org.bsc.langgraph4j.GraphStateException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class AutonomyCalibrationEngineTest {

    private MutableClock clock;
    private PrecedentMemory memory;
    private TrustSourceTagger tagger;
    private BypassManager bypassManager;
    private TrustAuditService auditService;
    private AutonomyCalibrationEngine engine;

    @BeforeEach
    void setUp() throws GraphStateException {
        clock = new MutableClock();
        memory = new PrecedentMemory(new InMemoryPrecedentStore(), clock, 0.01);
        tagger = new TrustSourceTagger(clock);
        bypassManager = new BypassManager(clock, true, BypassMode.OFF);
        auditService = new TrustAuditService(new InMemoryAuditStore(), memory, bypassManager, clock, AuditSettings.DEFAULT);

        ActionScorer scorer = new ActionScorer(memory, tagger, ScoringWeights.DEFAULT, TierThresholds.DEFAULT, true);
        DeliberationProtocol protocol = new DeliberationProtocol(scorer, memory, tagger, clock);

        engine = new AutonomyCalibrationEngine(
                ActionGateGraphConfig.build(
                        new ScreenActionNode(auditService, bypassManager),
                        new ScoreActionNode(scorer),
                        new DeliberateActionNode(protocol),
                        new ScreeningEdge(),
                        new TierRoutingEdge()),
                memory,
                auditService);
    }

    private ActionRequest.Builder known(String actionClass) {
        return ActionRequest.of(actionClass)
                .scores(0.9, 0.9, 0.9)
                .firstInClass(false)
                .motivation("user asked for it")
                .trustSource(tagger.createTelegramUserSource("1", null));
    }

    // =========================================================================
    //  Normal gating
    // =========================================================================

    @Nested
    @DisplayName("decide()")
    class Decide {

        @Test
        @DisplayName("first action in a class escalates and is recorded")
        void firstActionEscalates() {
            GateDecision decision = engine.decide(ActionRequest.of("git:commit:local").details("initial commit").build());

            assertThat(decision.tier()).isEqualTo(Tier.ESCALATE);
            assertThat(decision.proceed()).isFalse();
            assertThat(decision.needsOperator()).isTrue();
            assertThat(decision.score()).isNotNull();
            assertThat(decision.deliberation()).isNull();
            assertThat(memory.getPrecedent("git:commit:local").isFirstAction()).isFalse();
        }

        @Test
        @DisplayName("a well-scored known action acts without deliberation")
        void acts() {
            GateDecision decision = engine.decide(known("filesystem:read:local").build());

            assertThat(decision.tier()).isEqualTo(Tier.ACT);
            assertThat(decision.proceed()).isTrue();
            assertThat(decision.reason()).startsWith("Score ").endsWith(">= act threshold 0.70");
            assertThat(decision.deliberation()).isNull();
        }

        @Test
        @DisplayName("a deliberate-minimum class is deliberated and the deliberation is audited")
        void deliberates() {
            GateDecision decision = engine.decide(known("git:push:remote").reversibility(0.9).build());

            assertThat(decision.score().tier()).isEqualTo(Tier.DELIBERATE);
            assertThat(decision.deliberation()).isNotNull();
            assertThat(decision.tier()).isNotEqualTo(Tier.ACT);
            assertThat(decision.proceed()).isFalse();
            assertThat(auditService.getAuditState().getDeliberationHistory())
                    .singleElement()
                    .satisfies(record -> assertThat(record.actionClass()).isEqualTo("git:push:remote"));
        }

        @Test
        @DisplayName("changes to ACE's own weights are blocked before scoring")
        void selfModificationBlocked() {
            GateDecision decision = engine.decide(known("self:modify:ace-weights").build());

            assertThat(decision.tier()).isEqualTo(Tier.ESCALATE);
            assertThat(decision.proceed()).isFalse();
            assertThat(decision.score()).isNull();
            assertThat(decision.reason()).contains("permanently blocked");
        }

        @Test
        @DisplayName("rejects a missing action class")
        void blankClass() {
            assertThatThrownBy(() -> engine.decide(ActionRequest.of("  ").build()))
                    .isInstanceOf(IllegalArgumentException.class)
                    .hasMessage("Action class is required");
            assertThatThrownBy(() -> engine.decide(null))
                    .isInstanceOf(IllegalArgumentException.class);
        }
    }

    // =========================================================================
    //  Bypass
    // =========================================================================

    @Nested
    @DisplayName("Bypass")
    class Bypass {

        @Test
        @DisplayName("disabled mode proceeds without scoring")
        void disabled() {
            bypassManager.setTemporaryBypass("1h", "disabled", "maintenance window", "operator");

            GateDecision decision = engine.decide(ActionRequest.of("git:push:force").build());

            assertThat(decision.tier()).isEqualTo(Tier.ACT);
            assertThat(decision.proceed()).isTrue();
            assertThat(decision.score()).isNull();
            assertThat(decision.bypass().mode()).isEqualTo(BypassMode.DISABLED);
        }

        @Test
        @DisplayName("log-only mode scores normally but lets the action through")
        void logOnly() {
            bypassManager.setTemporaryBypass("1h");

            GateDecision decision = engine.decide(ActionRequest.of("git:commit:local").build());

            assertThat(decision.tier()).isEqualTo(Tier.ESCALATE);
            assertThat(decision.score()).isNotNull();
            assertThat(decision.proceed()).isTrue();
            assertThat(decision.bypass().bypassed()).isTrue();
        }

        @Test
        @DisplayName("hard-ceiling classes are blocked even while disabled")
        void hardCeiling() {
            bypassManager.setTemporaryBypass("1h", "disabled", null, null);

            GateDecision decision = engine.decide(ActionRequest.of("code:execute:external").build());

            assertThat(decision.tier()).isEqualTo(Tier.ESCALATE);
            assertThat(decision.proceed()).isFalse();
            assertThat(decision.bypass().hardCeilingBlocked()).isTrue();
            assertThat(bypassManager.getBypassStats().hardCeilingBlockedDuringBypass()).isEqualTo(1);
        }
    }

    // =========================================================================
    //  Feedback
    // =========================================================================

    @Nested
    @DisplayName("Feedback")
    class Feedback {

        @Test
        @DisplayName("a positive outcome raises precedent for the class")
        void outcome() {
            engine.decide(ActionRequest.of("git:commit:local").build());

            OutcomeResult result = engine.reportOutcome(OutcomeRequest.positive("git:commit:local"));

            assertThat(result.success()).isTrue();
            assertThat(result.newScore()).isGreaterThan(result.oldScore());
        }

        @Test
        @DisplayName("escalation responses reach the audit trail")
        void escalationResponse() {
            engine.respondToEscalation(EscalationResponse.approved("git:commit:local"));

            assertThat(auditService.detectRubberStamp().count()).isEqualTo(1);
        }
    }
}
