package com.eainde.ace.precedent;

import com.eainde.ace.classifier.ActionClasses;
import com.eainde.ace.config.AceProperties;
import com.eainde.ace.model.ErrorKind;
import com.eainde.ace.store.AceStorageException;
import jakarta.annotation.PostConstruct;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.function.Function;

/**
 * Per-class outcome history and the decaying trust score derived from it.
 * <p>
 * Scores move by fixed steps: +0.15 for a positive outcome, -0.20 per severity level for
 * a negative one, always clamped to [{@value #PRECEDENT_FLOOR}, {@value #PRECEDENT_CEILING}].
 * A negative outcome also penalizes recorded relatives: each parent level gets half the
 * penalty of the level below it, siblings get a quarter of the child's penalty.
 * <p>
 * Unused scores decay exponentially toward 0: {@code score * e^(-lambda * days)} since the
 * entry's decay anchor, with lambda 0.01 per day by default (half-life about 69 days).
 * Decay is applied on read and materialized whenever a score is written.
 * <p>
 * All writes run under one write lock and are persisted before the lock is released.
 * A failed save drops the cache so the next call reloads the last durable state.
 */
@Slf4j
@Service
public class PrecedentMemory {

    public static final double PRECEDENT_CEILING = 0.95;
    public static final double PRECEDENT_FLOOR = 0.0;

    static final double POSITIVE_INCREMENT = 0.15;
    static final double NEGATIVE_INCREMENT_PER_SEVERITY = 0.20;
    static final double PARENT_SHARE = 0.5;
    static final double SIBLING_SHARE = 0.25;
    static final int MAX_SEVERITY = 3;

    private static final int HISTORY_PREVIEW = 10;
    private static final int SUMMARY_CHANGES = 10;
    private static final int SUMMARY_RANKED = 5;
    private static final double MILLIS_PER_DAY = 86_400_000.0;

    private final PrecedentStore store;
    private final Clock clock;
    private final double decayLambda;
    private final ReentrantReadWriteLock lock = new ReentrantReadWriteLock();

    private PrecedentSnapshot cache;

    @Autowired
    public PrecedentMemory(PrecedentStore store, Clock clock, AceProperties properties) {
        this(store, clock, properties.getDecay().getLambda());
    }

    public PrecedentMemory(PrecedentStore store, Clock clock, double decayLambda) {
        if (decayLambda < 0 || Double.isNaN(decayLambda)) {
            throw new IllegalArgumentException("Decay lambda must be >= 0, got " + decayLambda);
        }
        this.store = store;
        this.clock = clock;
        this.decayLambda = decayLambda;
    }

    @PostConstruct
    public void init() {
        reload();
        log.info("Precedent memory loaded from {}", store.location());
    }

    // =========================================================================
    //  Recording
    // =========================================================================

    public RecordedAction recordAction(String actionClass, String details, String tier) {
        if (actionClass == null || actionClass.isBlank()) {
            return RecordedAction.failure(ErrorKind.INVALID_INPUT, "Action class is required");
        }
        lock.writeLock().lock();
        try {
            PrecedentSnapshot memory = loaded();
            Instant now = clock.instant();
            PrecedentEntry entry = memory.getClasses().computeIfAbsent(actionClass, k -> PrecedentEntry.create(now));
            entry.addInstance(ActionInstance.pending(now, details, tier));
            memory.getMetadata().setTotalActions(memory.getMetadata().getTotalActions() + 1);
            persist(memory);
            return RecordedAction.success(decayed(entry, now), entry.getInstances().size() - 1);
        } finally {
            lock.writeLock().unlock();
        }
    }

    public RecordedAction recordAction(String actionClass) {
        return recordAction(actionClass, null, null);
    }

    /**
     * Applies an outcome to its class. A class that was never recorded gets an entry and a
     * synthesized instance, so outcomes reported without a prior {@code recordAction} still
     * count.
     */
    public OutcomeResult recordOutcome(OutcomeRequest request) {
        if (request == null || request.actionClass() == null || request.actionClass().isBlank()) {
            return OutcomeResult.failure(ErrorKind.INVALID_INPUT, "Action class is required");
        }
        if (request.result() == null || request.result() == Outcome.PENDING) {
            return OutcomeResult.failure(ErrorKind.INVALID_INPUT, "Outcome must be positive or negative");
        }
        int severity = request.severity();
        if (request.result() == Outcome.NEGATIVE && (severity < 1 || severity > MAX_SEVERITY)) {
            return OutcomeResult.failure(ErrorKind.INVALID_INPUT, "Severity must be 1, 2 or 3, got " + severity);
        }

        lock.writeLock().lock();
        try {
            PrecedentSnapshot memory = loaded();
            PrecedentMetadata metadata = memory.getMetadata();
            Instant now = clock.instant();
            String actionClass = request.actionClass();

            PrecedentEntry entry = memory.getClasses().get(actionClass);
            int instanceCount = entry == null ? 1 : entry.getInstances().size();
            int index = request.instanceIndex() != null ? request.instanceIndex() : instanceCount - 1;
            if (index < 0 || index >= instanceCount) {
                return OutcomeResult.failure(ErrorKind.INVALID_INPUT, "Invalid instance index: " + index);
            }
            if (entry == null) {
                entry = PrecedentEntry.create(now);
                entry.addInstance(ActionInstance.pending(now, null, null));
                memory.getClasses().put(actionClass, entry);
                metadata.setTotalActions(metadata.getTotalActions() + 1);
            }
            ActionInstance instance = entry.getInstances().get(index);
            instance.setOutcome(request.result());
            instance.setOperatorResponse(request.operatorResponse());
            instance.setNote(request.note());

            double oldScore = decayed(entry, now);
            double newScore;
            List<PropagatedPenalty> propagated = new ArrayList<>();
            if (request.result() == Outcome.POSITIVE) {
                newScore = clamp(oldScore + POSITIVE_INCREMENT);
                entry.setApproved(entry.getApproved() + 1);
                entry.setLastPositive(now);
                metadata.setTotalPositive(metadata.getTotalPositive() + 1);
            } else {
                double penalty = NEGATIVE_INCREMENT_PER_SEVERITY * severity;
                newScore = clamp(oldScore - penalty);
                entry.setCorrected(entry.getCorrected() + 1);
                entry.setLastNegative(now);
                metadata.setTotalNegative(metadata.getTotalNegative() + 1);
                propagated.addAll(propagate(memory, actionClass, penalty, now));
            }
            entry.moveScore(newScore, now);

            persist(memory);
            log.info("Precedent {} {}: {} -> {}{}", actionClass, request.result().value(),
                    format(oldScore), format(newScore), propagated.isEmpty() ? "" : " propagated " + propagated);
            return OutcomeResult.success(oldScore, newScore, propagated);
        } finally {
            lock.writeLock().unlock();
        }
    }

    private List<PropagatedPenalty> propagate(PrecedentSnapshot memory, String actionClass, double penalty, Instant now) {
        Map<String, PrecedentEntry> classes = memory.getClasses();
        List<PropagatedPenalty> propagated = new ArrayList<>();

        double parentPenalty = penalty * PARENT_SHARE;
        for (String parent = ActionClasses.getParentClass(actionClass);
             parent != null;
             parent = ActionClasses.getParentClass(parent)) {
            PrecedentEntry parentEntry = classes.get(parent);
            if (parentEntry != null) {
                propagated.add(penalize(parent, "parent", parentEntry, parentPenalty, now));
            }
            parentPenalty *= PARENT_SHARE;
        }

        double siblingPenalty = penalty * SIBLING_SHARE;
        for (String sibling : ActionClasses.getSiblingClasses(actionClass, List.copyOf(classes.keySet()))) {
            propagated.add(penalize(sibling, "sibling", classes.get(sibling), siblingPenalty, now));
        }
        return propagated;
    }

    private PropagatedPenalty penalize(String actionClass, String relation, PrecedentEntry entry, double penalty, Instant now) {
        double updated = clamp(decayed(entry, now) - penalty);
        entry.moveScore(updated, now);
        return new PropagatedPenalty(actionClass, relation, penalty, updated);
    }

    // =========================================================================
    //  Reading
    // =========================================================================

    public PrecedentLookup getPrecedent(String actionClass) {
        return getPrecedent(actionClass, true);
    }

    public PrecedentLookup getPrecedent(String actionClass, boolean applyDecay) {
        return read(memory -> {
            PrecedentEntry entry = actionClass == null ? null : memory.getClasses().get(actionClass);
            if (entry == null) {
                return PrecedentLookup.firstAction();
            }
            double score = applyDecay ? decayed(entry, clock.instant()) : entry.getScore();
            return new PrecedentLookup(score, false, historyOf(entry));
        });
    }

    private static PrecedentHistory historyOf(PrecedentEntry entry) {
        List<ScorePoint> points = entry.getScoreHistory();
        List<Double> recent = points.subList(Math.max(0, points.size() - HISTORY_PREVIEW), points.size())
                .stream()
                .map(ScorePoint::score)
                .toList();
        return new PrecedentHistory(
                entry.getInstances().size(),
                entry.getApproved(),
                entry.getCorrected(),
                entry.getLastPositive(),
                entry.getLastNegative(),
                recent);
    }

    // =========================================================================
    //  Maintenance
    // =========================================================================

    /**
     * Materializes decay for every class and persists the result. Classes whose score moved
     * by less than 0.001 keep their anchor so small decays still accumulate.
     */
    public DecayReport decayScores() {
        lock.writeLock().lock();
        try {
            PrecedentSnapshot memory = loaded();
            Instant now = clock.instant();
            List<DecayReport.DecayedScore> decayed = new ArrayList<>();
            for (Map.Entry<String, PrecedentEntry> e : memory.getClasses().entrySet()) {
                PrecedentEntry entry = e.getValue();
                double oldScore = entry.getScore();
                double newScore = decayed(entry, now);
                if (Math.abs(newScore - oldScore) > 0.001) {
                    entry.setScore(newScore);
                    entry.setDecayAnchor(now);
                    decayed.add(new DecayReport.DecayedScore(e.getKey(), oldScore, newScore));
                }
            }
            if (!decayed.isEmpty()) {
                persist(memory);
                log.info("Decayed {} precedent scores", decayed.size());
            }
            return new DecayReport(decayed.size(), List.copyOf(decayed));
        } finally {
            lock.writeLock().unlock();
        }
    }

    /**
     * Zeroes a class's score. Instance history and approval counters are kept so audits
     * still see what happened before the reset; the reset itself shows as a score change.
     */
    public ResetResult resetPrecedent(String actionClass) {
        lock.writeLock().lock();
        try {
            PrecedentSnapshot memory = loaded();
            PrecedentEntry entry = actionClass == null ? null : memory.getClasses().get(actionClass);
            if (entry == null) {
                return ResetResult.failure(ErrorKind.NOT_FOUND, "No recorded actions for class: " + actionClass);
            }
            Instant now = clock.instant();
            double oldScore = decayed(entry, now);
            entry.moveScore(PRECEDENT_FLOOR, now);
            persist(memory);
            log.info("Precedent reset for {} (was {})", actionClass, format(oldScore));
            return ResetResult.success(oldScore);
        } finally {
            lock.writeLock().unlock();
        }
    }

    /** Drops the in-memory copy; the next call reads durable storage again. */
    public void reload() {
        lock.writeLock().lock();
        try {
            cache = null;
            loaded();
        } finally {
            lock.writeLock().unlock();
        }
    }

    public String getMemoryPath() {
        return store.location();
    }

    // =========================================================================
    //  Audit view
    // =========================================================================

    public PrecedentAuditSummary getAuditSummary(int days) {
        int window = days > 0 ? days : 7;
        return read(memory -> {
            Instant now = clock.instant();
            Instant cutoff = now.minus(Duration.ofDays(window));
            PrecedentMetadata metadata = memory.getMetadata();

            int actions = 0;
            int positive = 0;
            int negative = 0;
            List<PrecedentAuditSummary.ScoreChange> changes = new ArrayList<>();
            List<PrecedentAuditSummary.ClassScore> ranked = new ArrayList<>();

            for (Map.Entry<String, PrecedentEntry> e : memory.getClasses().entrySet()) {
                PrecedentEntry entry = e.getValue();
                for (ActionInstance instance : entry.getInstances()) {
                    if (instance.getTs() != null && !instance.getTs().isBefore(cutoff)) {
                        actions++;
                        if (instance.getOutcome() == Outcome.POSITIVE) {
                            positive++;
                        } else if (instance.getOutcome() == Outcome.NEGATIVE) {
                            negative++;
                        }
                    }
                }
                List<ScorePoint> points = entry.getScoreHistory();
                if (points.size() >= 2) {
                    double from = baselineAt(points, cutoff);
                    double to = points.get(points.size() - 1).score();
                    if (Math.abs(to - from) > 0.01) {
                        changes.add(new PrecedentAuditSummary.ScoreChange(e.getKey(), from, to, to - from));
                    }
                }
                ranked.add(new PrecedentAuditSummary.ClassScore(e.getKey(), decayed(entry, now)));
            }

            changes.sort(Comparator.comparingDouble((PrecedentAuditSummary.ScoreChange c) -> Math.abs(c.change())).reversed());
            ranked.sort(Comparator.comparingDouble(PrecedentAuditSummary.ClassScore::score).reversed());
            List<PrecedentAuditSummary.ClassScore> bottom = new ArrayList<>(ranked.subList(Math.max(0, ranked.size() - SUMMARY_RANKED), ranked.size()));
            Collections.reverse(bottom);

            return new PrecedentAuditSummary(
                    new PrecedentAuditSummary.Period(window, cutoff, now),
                    new PrecedentAuditSummary.Totals(memory.getClasses().size(), metadata.getTotalActions(),
                            metadata.getTotalPositive(), metadata.getTotalNegative()),
                    new PrecedentAuditSummary.RecentActivity(actions, positive, negative),
                    List.copyOf(changes.subList(0, Math.min(SUMMARY_CHANGES, changes.size()))),
                    List.copyOf(ranked.subList(0, Math.min(SUMMARY_RANKED, ranked.size()))),
                    List.copyOf(bottom));
        });
    }

    /** Score in effect at {@code cutoff}: the last point before it, else the oldest point kept. */
    private static double baselineAt(List<ScorePoint> points, Instant cutoff) {
        double baseline = points.get(0).score();
        for (ScorePoint point : points) {
            if (point.ts() != null && point.ts().isBefore(cutoff)) {
                baseline = point.score();
            } else {
                break;
            }
        }
        return baseline;
    }

    // =========================================================================
    //  Internals
    // =========================================================================

    double decayed(PrecedentEntry entry, Instant now) {
        Instant anchor = entry.getDecayAnchor();
        double score = entry.getScore();
        if (anchor == null || decayLambda == 0.0) {
            return clamp(score);
        }
        double days = Duration.between(anchor, now).toMillis() / MILLIS_PER_DAY;
        if (days <= 0) {
            return clamp(score);
        }
        return clamp(score * Math.exp(-decayLambda * days));
    }

    static double clamp(double score) {
        if (Double.isNaN(score)) {
            return PRECEDENT_FLOOR;
        }
        return Math.max(PRECEDENT_FLOOR, Math.min(PRECEDENT_CEILING, score));
    }

    private <T> T read(Function<PrecedentSnapshot, T> reader) {
        lock.readLock().lock();
        try {
            if (cache != null) {
                return reader.apply(cache);
            }
        } finally {
            lock.readLock().unlock();
        }
        lock.writeLock().lock();
        try {
            return reader.apply(loaded());
        } finally {
            lock.writeLock().unlock();
        }
    }

    private PrecedentSnapshot loaded() {
        if (cache == null) {
            try {
                cache = store.load().orElseGet(() -> PrecedentSnapshot.empty(clock.instant()));
            } catch (AceStorageException e) {
                log.error("Cannot load precedent memory from {}", store.location(), e);
                throw e;
            }
        }
        return cache;
    }

    private void persist(PrecedentSnapshot memory) {
        memory.getMetadata().setLastUpdated(clock.instant());
        try {
            store.save(memory);
        } catch (AceStorageException e) {
            cache = null;
            log.error("Cannot save precedent memory to {}", store.location(), e);
            throw e;
        }
    }

    private static String format(double score) {
        return String.format(Locale.ROOT, "%.2f", score);
    }
}
