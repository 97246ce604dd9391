package com.eainde.ace.precedent;

import com.eainde.ace.model.ErrorKind;
import com.eainde.ace.store.AceStorageException;
import com.eainde.ace.support.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class PrecedentMemoryTest {

    private static final double EPS = 1e-9;

    private MutableClock clock;
    private PrecedentMemory memory;

    @BeforeEach
    void setUp() {
        clock = new MutableClock();
        memory = new PrecedentMemory(new InMemoryPrecedentStore(), clock, 0.01);
    }

    private void positives(String actionClass, int count) {
        memory.recordAction(actionClass);
        for (int i = 0; i < count; i++) {
            memory.recordOutcome(OutcomeRequest.positive(actionClass));
        }
    }

    // =========================================================================
    //  Recording actions
    // =========================================================================

    @Nested
    @DisplayName("recordAction()")
    class RecordAction {

        @Test
        @DisplayName("a new class starts at zero and is no longer a first action")
        void newClass() {
            assertThat(memory.getPrecedent("git:commit:local").isFirstAction()).isTrue();

            RecordedAction recorded = memory.recordAction("git:commit:local", "commit README", "act");

            assertThat(recorded.success()).isTrue();
            assertThat(recorded.precedent()).isZero();
            assertThat(recorded.instanceIndex()).isZero();
            PrecedentLookup lookup = memory.getPrecedent("git:commit:local");
            assertThat(lookup.isFirstAction()).isFalse();
            assertThat(lookup.history().instances()).isEqualTo(1);
        }

        @Test
        @DisplayName("recording alone does not change the score")
        void noScoreChange() {
            positives("git:commit:local", 2);
            memory.recordAction("git:commit:local");

            assertThat(memory.getPrecedent("git:commit:local").score()).isCloseTo(0.30, within(EPS));
        }

        @Test
        @DisplayName("blank class is invalid input")
        void blankClass() {
            RecordedAction recorded = memory.recordAction(" ");

            assertThat(recorded.success()).isFalse();
            assertThat(recorded.errorKind()).isEqualTo(ErrorKind.INVALID_INPUT);
        }
    }

    // =========================================================================
    //  Outcomes
    // =========================================================================

    @Nested
    @DisplayName("recordOutcome()")
    class RecordOutcome {

        @Test
        @DisplayName("positive outcome adds 0.15")
        void positive() {
            memory.recordAction("git:commit:local");

            OutcomeResult result = memory.recordOutcome(OutcomeRequest.positive("git:commit:local"));

            assertThat(result.success()).isTrue();
            assertThat(result.oldScore()).isZero();
            assertThat(result.newScore()).isCloseTo(0.15, within(EPS));
        }

        @Test
        @DisplayName("score never exceeds the 0.95 ceiling")
        void ceiling() {
            positives("git:commit:local", 10);

            assertThat(memory.getPrecedent("git:commit:local").score()).isEqualTo(PrecedentMemory.PRECEDENT_CEILING);
        }

        @Test
        @DisplayName("negative outcome subtracts 0.20 per severity and floors at zero")
        void negative() {
            positives("git:commit:local", 4);

            OutcomeResult result = memory.recordOutcome(OutcomeRequest.negative("git:commit:local", 2));
            assertThat(result.newScore()).isCloseTo(0.20, within(EPS));

            result = memory.recordOutcome(OutcomeRequest.negative("git:commit:local", 3));
            assertThat(result.newScore()).isZero();
        }

        @Test
        @DisplayName("negative outcome propagates to recorded parents and siblings")
        void propagation() {
            positives("git:commit:local", 4);
            positives("git:commit:amend", 2);
            positives("git:commit:*", 2);
            positives("git:push:remote", 2);

            OutcomeResult result = memory.recordOutcome(OutcomeRequest.negative("git:commit:local", 1));

            assertThat(result.newScore()).isCloseTo(0.40, within(EPS));
            assertThat(memory.getPrecedent("git:commit:*").score()).isCloseTo(0.20, within(EPS));
            assertThat(memory.getPrecedent("git:commit:amend").score()).isCloseTo(0.25, within(EPS));
            assertThat(memory.getPrecedent("git:push:remote").score()).isCloseTo(0.30, within(EPS));
            assertThat(result.propagated())
                    .extracting(PropagatedPenalty::actionClass)
                    .containsExactlyInAnyOrder("git:commit:*", "git:commit:amend");
        }

        @Test
        @DisplayName("each parent level receives half the penalty of the level below")
        void recursiveParents() {
            positives("git:commit:local", 4);
            positives("git:commit:*", 4);
            positives("git:*", 4);

            memory.recordOutcome(OutcomeRequest.negative("git:commit:local", 2));

            assertThat(memory.getPrecedent("git:commit:*").score()).isCloseTo(0.40, within(EPS));
            assertThat(memory.getPrecedent("git:*").score()).isCloseTo(0.50, within(EPS));
        }

        @Test
        @DisplayName("outcome for an unknown class creates it")
        void unknownClass() {
            OutcomeResult result = memory.recordOutcome(OutcomeRequest.positive("fs:write:tmp"));

            assertThat(result.success()).isTrue();
            PrecedentLookup lookup = memory.getPrecedent("fs:write:tmp");
            assertThat(lookup.isFirstAction()).isFalse();
            assertThat(lookup.history().instances()).isEqualTo(1);
            assertThat(lookup.history().approved()).isEqualTo(1);
        }

        @Test
        @DisplayName("invalid severity, pending result and bad index are rejected without side effects")
        void invalidInput() {
            memory.recordAction("git:commit:local");

            assertThat(memory.recordOutcome(OutcomeRequest.negative("git:commit:local", 4)).errorKind())
                    .isEqualTo(ErrorKind.INVALID_INPUT);
            assertThat(memory.recordOutcome(new OutcomeRequest("git:commit:local", Outcome.PENDING, 1, null, null, null)).success())
                    .isFalse();
            assertThat(memory.recordOutcome(OutcomeRequest.positive("git:commit:local").withInstanceIndex(5)).errorKind())
                    .isEqualTo(ErrorKind.INVALID_INPUT);
            assertThat(memory.recordOutcome(OutcomeRequest.positive("never:seen").withInstanceIndex(3)).success())
                    .isFalse();
            assertThat(memory.getPrecedent("never:seen").isFirstAction()).isTrue();
            assertThat(memory.getPrecedent("git:commit:local").score()).isZero();
        }

        @Test
        @DisplayName("updates counters, timestamps and the chosen instance")
        void counters() {
            memory.recordAction("git:commit:local");
            memory.recordAction("git:commit:local");
            clock.advanceDays(1);

            memory.recordOutcome(OutcomeRequest.negative("git:commit:local", 1)
                    .withInstanceIndex(0)
                    .withOperatorResponse("wrong branch"));

            PrecedentHistory history = memory.getPrecedent("git:commit:local").history();
            assertThat(history.corrected()).isEqualTo(1);
            assertThat(history.lastNegative()).isEqualTo(clock.instant());
            assertThat(history.correctionRate()).isCloseTo(0.5, within(EPS));
        }
    }

    // =========================================================================
    //  Decay
    // =========================================================================

    @Nested
    @DisplayName("Decay")
    class Decay {

        @Test
        @DisplayName("scores decay exponentially on read")
        void decaysOnRead() {
            positives("git:commit:local", 4);
            clock.advanceDays(100);

            assertThat(memory.getPrecedent("git:commit:local").score()).isCloseTo(0.60 * Math.exp(-1.0), within(1e-6));
            assertThat(memory.getPrecedent("git:commit:local", false).score()).isCloseTo(0.60, within(EPS));
        }

        @Test
        @DisplayName("decay is materialized before an outcome is applied")
        void materializedOnWrite() {
            positives("git:commit:local", 4);
            clock.advanceDays(100);

            OutcomeResult result = memory.recordOutcome(OutcomeRequest.positive("git:commit:local"));

            assertThat(result.oldScore()).isCloseTo(0.60 * Math.exp(-1.0), within(1e-6));
            assertThat(result.newScore()).isCloseTo(0.60 * Math.exp(-1.0) + 0.15, within(1e-6));
        }

        @Test
        @DisplayName("decayScores persists decayed values and skips negligible changes")
        void decayScores() {
            positives("git:commit:local", 4);
            positives("fs:read:any", 0);
            clock.advanceDays(30);

            DecayReport report = memory.decayScores();

            assertThat(report.updated()).isEqualTo(1);
            assertThat(report.decayed().get(0).actionClass()).isEqualTo("git:commit:local");
            assertThat(memory.getPrecedent("git:commit:local", false).score())
                    .isCloseTo(0.60 * Math.exp(-0.3), within(1e-6));
        }
    }

    // =========================================================================
    //  Reset and audit summary
    // =========================================================================

    @Nested
    @DisplayName("Reset and audit")
    class ResetAndAudit {

        @Test
        @DisplayName("reset zeroes the score but keeps history")
        void reset() {
            positives("git:commit:local", 3);

            ResetResult result = memory.resetPrecedent("git:commit:local");

            assertThat(result.success()).isTrue();
            assertThat(result.oldScore()).isCloseTo(0.45, within(EPS));
            PrecedentLookup lookup = memory.getPrecedent("git:commit:local");
            assertThat(lookup.score()).isZero();
            assertThat(lookup.history().approved()).isEqualTo(3);
        }

        @Test
        @DisplayName("reset of an unknown class is not found")
        void resetUnknown() {
            ResetResult result = memory.resetPrecedent("nope:nope");

            assertThat(result.success()).isFalse();
            assertThat(result.errorKind()).isEqualTo(ErrorKind.NOT_FOUND);
            assertThat(result.error()).isEqualTo("No recorded actions for class: nope:nope");
        }

        @Test
        @DisplayName("audit summary counts activity in the window and ranks classes")
        void auditSummary() {
            positives("old:class", 1);
            clock.advanceDays(10);
            positives("git:commit:local", 3);
            memory.recordAction("git:push:remote");
            memory.recordOutcome(OutcomeRequest.negative("git:push:remote", 1));

            PrecedentAuditSummary summary = memory.getAuditSummary(7);

            assertThat(summary.recentActivity().actions()).isEqualTo(2);
            assertThat(summary.recentActivity().positive()).isEqualTo(1);
            assertThat(summary.recentActivity().negative()).isEqualTo(1);
            assertThat(summary.totals().classes()).isEqualTo(3);
            assertThat(summary.topClasses().get(0).actionClass()).isEqualTo("git:commit:local");
            assertThat(summary.scoreChanges()).extracting(PrecedentAuditSummary.ScoreChange::actionClass)
                    .contains("git:commit:local");
        }
    }

    // =========================================================================
    //  Storage failures
    // =========================================================================

    @Nested
    @DisplayName("Storage failures")
    class StorageFailures {

        @Test
        @DisplayName("failed save surfaces and drops the cache")
        void failedSave() {
            PrecedentStore store = mock(PrecedentStore.class);
            when(store.load()).thenReturn(Optional.empty());
            when(store.location()).thenReturn("mock");
            doThrow(new AceStorageException("Failed to write mock", new IOException("disk full")))
                    .when(store).save(any());
            PrecedentMemory failing = new PrecedentMemory(store, clock, 0.01);

            assertThatThrownBy(() -> failing.recordAction("git:commit:local"))
                    .isInstanceOf(AceStorageException.class);

            assertThat(failing.getPrecedent("git:commit:local").isFirstAction()).isTrue();
            verify(store, times(2)).load();
        }
    }

    // =========================================================================
    //  Concurrent writers
    // =========================================================================

    @Nested
    @DisplayName("Concurrent writers")
    class ConcurrentWriters {

        @Test
        @DisplayName("parallel actions and outcomes on one class lose no update")
        void noLostUpdates() throws Exception {
            int writers = 40;
            ExecutorService executor = Executors.newFixedThreadPool(8);
            try {
                List<Future<OutcomeResult>> futures = new ArrayList<>();
                for (int i = 0; i < writers; i++) {
                    String details = "run " + i;
                    futures.add(executor.submit(() -> {
                        memory.recordAction("git:commit:local", details, "act");
                        return memory.recordOutcome(OutcomeRequest.positive("git:commit:local"));
                    }));
                }
                for (Future<OutcomeResult> future : futures) {
                    assertThat(future.get().success()).isTrue();
                }
            } finally {
                executor.shutdownNow();
            }

            PrecedentHistory history = memory.getPrecedent("git:commit:local").history();
            assertThat(history.instances()).isEqualTo(writers);
            assertThat(history.approved()).isEqualTo(writers);
            assertThat(memory.getPrecedent("git:commit:local").score())
                    .isCloseTo(PrecedentMemory.PRECEDENT_CEILING, within(EPS));
        }
    }
}
