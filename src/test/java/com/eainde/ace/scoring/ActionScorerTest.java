package com.eainde.ace.scoring;

import com.eainde.ace.model.ActionRequest;
import com.eainde.ace.precedent.InMemoryPrecedentStore;
import com.eainde.ace.precedent.OutcomeRequest;
import com.eainde.ace.precedent.PrecedentMemory;
import com.eainde.ace.support.MutableClock;
import com.eainde.ace.trust.SourceType;
import com.eainde.ace.trust.TrustLevel;
import com.eainde.ace.trust.TrustSource;
import com.eainde.ace.trust.TrustSourceTagger;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;

class ActionScorerTest {

    private static final double EPS = 1e-9;

    private MutableClock clock;
    private PrecedentMemory memory;
    private TrustSourceTagger tagger;
    private ActionScorer scorer;

    @BeforeEach
    void setUp() {
        clock = new MutableClock();
        memory = new PrecedentMemory(new InMemoryPrecedentStore(), clock, 0.01);
        tagger = new TrustSourceTagger(clock);
        scorer = new ActionScorer(memory, tagger, ScoringWeights.DEFAULT, TierThresholds.DEFAULT, true);
    }

    private ActionRequest.Builder known(String actionClass) {
        return ActionRequest.of(actionClass).firstInClass(false);
    }

    private TrustSource source(TrustLevel level) {
        return TrustSource.of(SourceType.UNKNOWN, level, "x", List.of("x"), clock.instant());
    }

    // =========================================================================
    //  Composite and thresholds
    // =========================================================================

    @Nested
    @DisplayName("Composite thresholds")
    class Thresholds {

        @Test
        @DisplayName("high composite acts")
        void acts() {
            ScoreResult result = scorer.scoreAction(known("filesystem:read:file").scores(1.0, 0.8, 1.0).build());

            assertThat(result.composite()).isCloseTo(0.93, within(EPS));
            assertThat(result.tier()).isEqualTo(Tier.ACT);
            assertThat(result.reason()).isEqualTo("Score 0.93 >= act threshold 0.70");
        }

        @Test
        @DisplayName("middle composite deliberates")
        void deliberates() {
            ScoreResult result = scorer.scoreAction(known("filesystem:write:local").scores(0.5, 0.5, 0.5).build());

            assertThat(result.tier()).isEqualTo(Tier.DELIBERATE);
        }

        @Test
        @DisplayName("low composite escalates")
        void escalates() {
            ScoreResult result = scorer.scoreAction(known("filesystem:write:local").scores(0.2, 0.2, 0.2).build());

            assertThat(result.tier()).isEqualTo(Tier.ESCALATE);
        }

        @Test
        @DisplayName("precedent is capped at the ceiling and inputs are clamped")
        void clamping() {
            ScoreResult result = scorer.scoreAction(known("filesystem:read:file").scores(1.7, 1.0, -0.4).build());

            assertThat(result.precedent()).isEqualTo(PrecedentMemory.PRECEDENT_CEILING);
            assertThat(result.reversibility()).isEqualTo(1.0);
            assertThat(result.blastRadius()).isZero();
        }

        @Test
        @DisplayName("act is never granted below the 0.50 floor")
        void actFloor() {
            ActionScorer permissive = new ActionScorer(memory, tagger, ScoringWeights.DEFAULT, new TierThresholds(0.30, 0.20), true);

            ScoreResult result = permissive.scoreAction(known("filesystem:write:local").scores(0.45, 0.45, 0.45).build());

            assertThat(permissive.getThresholds().act()).isEqualTo(TierThresholds.ACT_FLOOR);
            assertThat(result.tier()).isEqualTo(Tier.DELIBERATE);
        }
    }

    // =========================================================================
    //  Overrides
    // =========================================================================

    @Nested
    @DisplayName("Overrides")
    class Overrides {

        @Test
        @DisplayName("hard ceiling escalates whatever the scores")
        void hardCeiling() {
            ScoreResult result = scorer.scoreAction(known("code:execute:external").scores(1.0, 0.95, 1.0).build());

            assertThat(result.tier()).isEqualTo(Tier.ESCALATE);
            assertThat(result.reason()).startsWith("Hard ceiling");
        }

        @Test
        @DisplayName("first action in class escalates")
        void firstAction() {
            ScoreResult result = scorer.scoreAction(ActionRequest.of("filesystem:read:file").build());

            assertThat(result.firstInClass()).isTrue();
            assertThat(result.tier()).isEqualTo(Tier.ESCALATE);
            assertThat(result.reason()).contains("First action in class");
        }

        @Test
        @DisplayName("hostile source escalates")
        void hostile() {
            ScoreResult result = scorer.scoreAction(known("filesystem:read:file")
                    .scores(1.0, 0.9, 1.0)
                    .trustSource(source(TrustLevel.HOSTILE))
                    .build());

            assertThat(result.tier()).isEqualTo(Tier.ESCALATE);
            assertThat(result.reason()).isEqualTo("Content source tagged as hostile");
        }

        @Test
        @DisplayName("deliberate-minimum class never acts")
        void deliberateMinimum() {
            ScoreResult high = scorer.scoreAction(known("git:push:remote").scores(1.0, 0.95, 1.0).build());
            ScoreResult low = scorer.scoreAction(known("git:push:remote").scores(0.0, 0.0, 0.0).build());

            assertThat(high.tier()).isEqualTo(Tier.DELIBERATE);
            assertThat(low.tier()).isEqualTo(Tier.ESCALATE);
        }

        @Test
        @DisplayName("trust modifier adjusts blast radius")
        void trustModifier() {
            ScoreResult untrusted = scorer.scoreAction(known("filesystem:read:file")
                    .scores(1.0, 0.9, 0.8)
                    .trustSource(source(TrustLevel.UNTRUSTED))
                    .build());

            assertThat(untrusted.blastRadius()).isCloseTo(0.5, within(EPS));
        }
    }

    // =========================================================================
    //  Precedent integration
    // =========================================================================

    @Nested
    @DisplayName("Precedent lookup")
    class FromMemory {

        @Test
        @DisplayName("omitted precedent and defaults come from memory and the class tables")
        void fromMemory() {
            memory.recordAction("filesystem:read:file");
            for (int i = 0; i < 6; i++) {
                memory.recordOutcome(OutcomeRequest.positive("filesystem:read:file"));
            }

            ScoreResult result = scorer.scoreAction(ActionRequest.of("filesystem:read:file").build());

            assertThat(result.firstInClass()).isFalse();
            assertThat(result.reversibility()).isEqualTo(1.0);
            assertThat(result.blastRadius()).isEqualTo(1.0);
            assertThat(result.precedent()).isCloseTo(0.90, within(EPS));
            assertThat(result.tier()).isEqualTo(Tier.ACT);
        }

        @Test
        @DisplayName("blank class scores as unknown")
        void blankClass() {
            ScoreResult result = scorer.scoreAction(ActionRequest.of(" ").firstInClass(false).build());

            assertThat(result.actionClass()).isEqualTo("unknown:unknown:unknown");
        }
    }

    @Nested
    @ExtendWith(MockitoExtension.class)
    @DisplayName("Explicit precedent")
    class ExplicitPrecedent {

        @Mock
        private PrecedentMemory mockMemory;

        @Test
        @DisplayName("does not consult precedent memory")
        void skipsMemory() {
            ActionScorer isolated = new ActionScorer(mockMemory, tagger, ScoringWeights.DEFAULT, TierThresholds.DEFAULT, true);

            ScoreResult result = isolated.scoreAction(ActionRequest.of("filesystem:read:file").scores(1.0, 0.9, 1.0).build());

            assertThat(result.firstInClass()).isFalse();
            verify(mockMemory, never()).getPrecedent(anyString());
        }
    }

    // =========================================================================
    //  Helpers and configuration
    // =========================================================================

    @Nested
    @DisplayName("Helpers")
    class Helpers {

        @Test
        @DisplayName("getTier honours the force flags")
        void forceFlags() {
            assertThat(scorer.getTier(0.9)).isEqualTo(Tier.ACT);
            assertThat(scorer.getTier(0.9, false, true)).isEqualTo(Tier.DELIBERATE);
            assertThat(scorer.getTier(0.1, false, true)).isEqualTo(Tier.DELIBERATE);
            assertThat(scorer.getTier(0.9, true, true)).isEqualTo(Tier.ESCALATE);
        }

        @Test
        @DisplayName("composite uses the configured weights")
        void composite() {
            assertThat(scorer.getCompositeScore(1.0, 0.0, 0.0)).isCloseTo(0.30, within(EPS));
            assertThat(ActionScorer.getCompositeScore(1.0, 1.0, 1.0, new ScoringWeights(0.2, 0.3, 0.5))).isCloseTo(1.0, within(EPS));
        }

        @Test
        @DisplayName("invalid weights and thresholds fail fast")
        void invalidConfiguration() {
            assertThatThrownBy(() -> new ScoringWeights(0.5, 0.5, 0.5)).isInstanceOf(IllegalArgumentException.class);
            assertThatThrownBy(() -> new ScoringWeights(-0.1, 0.6, 0.5)).isInstanceOf(IllegalArgumentException.class);
            assertThatThrownBy(() -> new TierThresholds(0.7, 0.8)).isInstanceOf(IllegalArgumentException.class);
        }

        @Test
        @DisplayName("exposes constants and configuration")
        void accessors() {
            assertThat(scorer.getActThresholdFloor()).isEqualTo(0.50);
            assertThat(scorer.getPrecedentCeiling()).isEqualTo(0.95);
            assertThat(scorer.isAceEnabled()).isTrue();
            assertThat(scorer.classifyAction("git:push:remote").requiresDeliberation()).isTrue();
        }
    }
}
