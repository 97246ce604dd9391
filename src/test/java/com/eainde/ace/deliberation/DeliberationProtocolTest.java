package com.eainde.ace.deliberation;

import com.eainde.ace.model.ActionRequest;
import com.eainde.ace.model.Dependency;
import com.eainde.ace.precedent.InMemoryPrecedentStore;
import com.eainde.ace.precedent.OutcomeRequest;
import com.eainde.ace.precedent.PrecedentMemory;
import com.eainde.ace.scoring.ActionScorer;
import com.eainde.ace.scoring.ScoringWeights;
import com.eainde.ace.scoring.Tier;
import com.eainde.ace.scoring.TierThresholds;
import com.eainde.ace.support.MutableClock;
import com.eainde.ace.trust.SourceType;
import com.eainde.ace.trust.TrustLevel;
import com.eainde.ace.trust.TrustSource;
import com.eainde.ace.trust.TrustSourceTagger;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class DeliberationProtocolTest {

    private MutableClock clock;
    private PrecedentMemory memory;
    private TrustSourceTagger tagger;
    private DeliberationProtocol protocol;

    @BeforeEach
    void setUp() {
        clock = new MutableClock();
        memory = new PrecedentMemory(new InMemoryPrecedentStore(), clock, 0.01);
        tagger = new TrustSourceTagger(clock);
        ActionScorer scorer = new ActionScorer(memory, tagger, ScoringWeights.DEFAULT, TierThresholds.DEFAULT, true);
        protocol = new DeliberationProtocol(scorer, memory, tagger, clock);
    }

    /** Known class, strong scores, trusted user, clear motivation: nothing to object to. */
    private ActionRequest.Builder clean(String actionClass) {
        return ActionRequest.of(actionClass)
                .scores(0.9, 0.9, 0.9)
                .firstInClass(false)
                .motivation("user asked for it")
                .trustSource(tagger.createTelegramUserSource("1", null));
    }

    // =========================================================================
    //  Verdicts
    // =========================================================================

    @Nested
    @DisplayName("deliberate()")
    class Verdicts {

        @Test
        @DisplayName("clean review with a high score promotes to act")
        void promote() {
            DeliberationReport report = protocol.deliberate(clean("filesystem:write:local").build());

            assertThat(report.outcome()).isEqualTo(DeliberationOutcome.PROMOTE);
            assertThat(report.finalTier()).isEqualTo(Tier.ACT);
            assertThat(report.totalConcerns()).isZero();
            assertThat(report.confidenceAdjustment()).isCloseTo(0.0, within(1e-9));
            assertThat(report.steps()).hasSize(5);
            assertThat(report.stepDetails()).isNull();
            assertThat(report.event()).isEqualTo(DeliberationReport.EVENT);
        }

        @Test
        @DisplayName("a failed step keeps the action at deliberate")
        void maintain() {
            DeliberationReport report = protocol.deliberate(clean("filesystem:write:local").motivation(null).build());

            assertThat(report.outcome()).isEqualTo(DeliberationOutcome.MAINTAIN);
            assertThat(report.finalTier()).isEqualTo(Tier.DELIBERATE);
            assertThat(report.failedSteps()).isEqualTo(1);
            assertThat(report.confidenceAdjustment()).isCloseTo(-0.13, within(1e-9));
        }

        @Test
        @DisplayName("three or more concerns demote to escalate")
        void demoteOnConcerns() {
            DeliberationReport report = protocol.deliberate(clean("filesystem:write:local")
                    .trustSource(tagger.createWebSource("https://example.com"))
                    .affectsExternal(true)
                    .build());

            assertThat(report.totalConcerns()).isGreaterThanOrEqualTo(3);
            assertThat(report.outcome()).isEqualTo(DeliberationOutcome.DEMOTE);
            assertThat(report.finalTier()).isEqualTo(Tier.ESCALATE);
        }

        @Test
        @DisplayName("adjusted score below the escalate boundary demotes")
        void demoteOnScore() {
            DeliberationReport report = protocol.deliberate(clean("filesystem:write:local").scores(0.3, 0.3, 0.3).build());

            assertThat(report.outcome()).isEqualTo(DeliberationOutcome.DEMOTE);
            assertThat(report.reason()).startsWith("Adjusted score");
        }

        @Test
        @DisplayName("deliberate-minimum classes never promote")
        void deliberateMinimumNeverPromotes() {
            DeliberationReport report = protocol.deliberate(clean("git:push:remote").build());

            assertThat(report.outcome()).isEqualTo(DeliberationOutcome.MAINTAIN);
            assertThat(report.finalTier()).isEqualTo(Tier.DELIBERATE);
        }

        @Test
        @DisplayName("hard ceiling, hostile source and first action always demote")
        void alwaysDemote() {
            assertThat(protocol.deliberate(clean("code:execute:external").build()).outcome())
                    .isEqualTo(DeliberationOutcome.DEMOTE);
            assertThat(protocol.deliberate(clean("filesystem:write:local").firstInClass(true).build()).outcome())
                    .isEqualTo(DeliberationOutcome.DEMOTE);
            TrustSource hostile = TrustSource.of(SourceType.WEB, TrustLevel.HOSTILE, "web:x", List.of("web:x"), clock.instant());
            assertThat(protocol.deliberate(clean("filesystem:write:local").trustSource(hostile).build()).reason())
                    .isEqualTo("Source tagged as hostile");
        }

        @Test
        @DisplayName("verbose run carries full step details")
        void verbose() {
            DeliberationReport report = protocol.deliberate(clean("filesystem:write:local").build(), true);

            assertThat(report.stepDetails()).extracting(DeliberationStepResult::step).containsExactly(
                    DeliberationProtocol.STEP_CONTEXT,
                    DeliberationProtocol.STEP_PRECEDENT,
                    DeliberationProtocol.STEP_SOURCES,
                    DeliberationProtocol.STEP_COUNTERFACTUAL,
                    DeliberationProtocol.STEP_REVERSIBILITY);
        }
    }

    // =========================================================================
    //  Individual steps
    // =========================================================================

    @Nested
    @DisplayName("Steps")
    class Steps {

        @Test
        @DisplayName("context records goal and trigger, and flags external motivation")
        void context() {
            DeliberationStepResult result = protocol.checkContext(clean("filesystem:write:local")
                    .goalId("goal-7")
                    .triggerEvent("message:received")
                    .motivationSource("external")
                    .build());

            assertThat(result.passed()).isTrue();
            assertThat(result.details()).containsEntry("partOfGoal", true).containsEntry("isReactive", true);
            assertThat(result.concerns()).containsExactly("Action motivated by external content");
        }

        @Test
        @DisplayName("precedent flags a recent correction and a high correction rate")
        void precedent() {
            String cls = "filesystem:write:local";
            for (int i = 0; i < 4; i++) {
                memory.recordAction(cls);
                memory.recordOutcome(OutcomeRequest.positive(cls));
            }
            memory.recordOutcome(OutcomeRequest.negative(cls, 1).withInstanceIndex(0));
            memory.recordOutcome(OutcomeRequest.negative(cls, 1).withInstanceIndex(1));
            clock.advance(Duration.ofDays(2));

            DeliberationStepResult result = protocol.reviewPrecedent(ActionRequest.of(cls).build());

            assertThat(result.passed()).isFalse();
            assertThat(result.concerns()).anyMatch(c -> c.startsWith("Recent correction"));
            assertThat(result.concerns()).anyMatch(c -> c.startsWith("High correction rate"));
        }

        @Test
        @DisplayName("sources flags a missing tag and a degrading chain")
        void sources() {
            assertThat(protocol.auditSources(ActionRequest.of("x:y").build()).concerns())
                    .containsExactly("No trust source information provided");

            TrustSource degraded = TrustSource.of(SourceType.USER, TrustLevel.TRUSTED, "user:1",
                    List.of("plugin:summarizer", "user:1"), clock.instant());
            DeliberationStepResult result = protocol.auditSources(ActionRequest.of("x:y").trustSource(degraded).build());

            assertThat(result.passed()).isFalse();
            assertThat(result.concerns()).containsExactly("Chain degrades trust: trusted -> verified");
        }

        @Test
        @DisplayName("counterfactual fails when a deadline is near and the user could answer")
        void counterfactualUrgent() {
            DeliberationStepResult result = protocol.checkCounterfactual(ActionRequest.of("x:y")
                    .deadline(clock.instant().plus(Duration.ofMinutes(30)))
                    .build());

            assertThat(result.passed()).isFalse();
            assertThat(result.concerns()).containsExactly("Time-sensitive action");
        }

        @Test
        @DisplayName("counterfactual passes with a concern when the user is away and nothing is urgent")
        void counterfactualUserAway() {
            DeliberationStepResult result = protocol.checkCounterfactual(ActionRequest.of("x:y")
                    .opportunityLost(true)
                    .userAvailable(false)
                    .build());

            assertThat(result.passed()).isTrue();
            assertThat(result.concerns()).containsExactly("Opportunity may be lost if not acted upon");
        }

        @Test
        @DisplayName("reversibility wants a backup for destructive actions and met dependencies")
        void reversibility() {
            DeliberationStepResult noBackup = protocol.confirmReversibility(ActionRequest.of("filesystem:delete:tmp")
                    .dependencies(List.of(new Dependency("db", false), new Dependency("cache", true)))
                    .build(), 0.2);

            assertThat(noBackup.passed()).isFalse();
            assertThat(noBackup.concerns()).containsExactly(
                    "Destructive action but no backup confirmed", "1 unmet dependencies");

            DeliberationStepResult withBackup = protocol.confirmReversibility(ActionRequest.of("filesystem:delete:tmp")
                    .backupExists(true)
                    .build(), 0.2);
            assertThat(withBackup.passed()).isTrue();
        }
    }

    // =========================================================================
    //  Skipping
    // =========================================================================

    @Nested
    @DisplayName("shouldSkipDeliberation()")
    class Skip {

        @Test
        @DisplayName("skips straight to escalate for fixed cases")
        void skips() {
            assertThat(protocol.shouldSkipDeliberation(ActionRequest.of("self:modify:ace-config").build()).reason())
                    .isEqualTo("Hard ceiling class");
            TrustSource hostile = TrustSource.of(SourceType.WEB, TrustLevel.HOSTILE, "web:x", List.of("web:x"), clock.instant());
            assertThat(protocol.shouldSkipDeliberation(ActionRequest.of("x:y").trustSource(hostile).build()).reason())
                    .isEqualTo("Hostile source");
            assertThat(protocol.shouldSkipDeliberation(ActionRequest.of("never:seen").build()).reason())
                    .isEqualTo("First action in class");
        }

        @Test
        @DisplayName("proceeds for a known class")
        void proceeds() {
            memory.recordAction("filesystem:write:local");

            SkipDecision decision = protocol.shouldSkipDeliberation(ActionRequest.of("filesystem:write:local").build());

            assertThat(decision.skip()).isFalse();
            assertThat(decision.tier()).isNull();
        }
    }
}
