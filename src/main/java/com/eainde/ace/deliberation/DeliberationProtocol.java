package com.eainde.ace.deliberation;

import com.eainde.ace.classifier.ActionClasses;
import com.eainde.ace.model.ActionRequest;
import com.eainde.ace.model.Dependency;
import com.eainde.ace.precedent.PrecedentHistory;
import com.eainde.ace.precedent.PrecedentLookup;
import com.eainde.ace.precedent.PrecedentMemory;
import com.eainde.ace.scoring.ActionScorer;
import com.eainde.ace.scoring.ScoreResult;
import com.eainde.ace.scoring.Tier;
import com.eainde.ace.trust.ChainValidation;
import com.eainde.ace.trust.TrustLevel;
import com.eainde.ace.trust.TrustSource;
import com.eainde.ace.trust.TrustSourceTagger;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Structured self-review for actions that are neither fast-pathed to Act nor fixed at
 * Escalate.
 * <p>
 * Five checks run independently: context, precedent, sources, counterfactual and
 * reversibility. Their concerns lower the composite by 0.10 per failed check and 0.03 per
 * concern, and the adjusted composite decides the verdict:
 * <ol>
 *   <li>hostile source, hard-ceiling class or first action in class: demote</li>
 *   <li>{@value #DEMOTE_CONCERNS} or more concerns: demote</li>
 *   <li>no failed check and adjusted composite at the Act boundary: promote, unless the
 *       class is deliberate-minimum</li>
 *   <li>adjusted composite below the Escalate boundary: demote</li>
 *   <li>otherwise maintain at Deliberate</li>
 * </ol>
 */
@Slf4j
@Service
public class DeliberationProtocol {

    public static final String STEP_CONTEXT = "context";
    public static final String STEP_PRECEDENT = "precedent";
    public static final String STEP_SOURCES = "sources";
    public static final String STEP_COUNTERFACTUAL = "counterfactual";
    public static final String STEP_REVERSIBILITY = "reversibility";

    static final double FAILED_STEP_PENALTY = 0.10;
    static final double CONCERN_PENALTY = 0.03;
    static final int DEMOTE_CONCERNS = 3;
    static final double LOW_PRECEDENT = 0.3;
    static final double HIGH_CORRECTION_RATE = 0.2;
    static final int CORRECTION_RATE_MIN_INSTANCES = 3;
    static final double LOW_REVERSIBILITY = 0.3;
    static final Duration RECENT_CORRECTION = Duration.ofDays(7);
    static final Duration URGENT_HORIZON = Duration.ofHours(1);

    private final ActionScorer scorer;
    private final PrecedentMemory precedentMemory;
    private final TrustSourceTagger tagger;
    private final Clock clock;

    public DeliberationProtocol(ActionScorer scorer, PrecedentMemory precedentMemory,
                                TrustSourceTagger tagger, Clock clock) {
        this.scorer = scorer;
        this.precedentMemory = precedentMemory;
        this.tagger = tagger;
        this.clock = clock;
    }

    // =========================================================================
    //  Steps
    // =========================================================================

    /** Passes when a motivation is given. External motivation is a concern but not a failure. */
    public DeliberationStepResult checkContext(ActionRequest request) {
        Map<String, Object> details = new LinkedHashMap<>();
        List<String> concerns = new ArrayList<>();

        if (request.hasMotivation()) {
            details.put("motivation", request.getMotivation());
        } else {
            concerns.add("No motivation provided for action");
        }
        if (request.getMotivationSource() != null) {
            details.put("motivationSource", request.getMotivationSource());
            if (ActionRequest.MOTIVATION_EXTERNAL.equalsIgnoreCase(request.getMotivationSource())) {
                concerns.add("Action motivated by external content");
            }
        }
        if (request.getGoalId() != null) {
            details.put("goalId", request.getGoalId());
            details.put("partOfGoal", true);
        }
        details.put("isReactive", request.getTriggerEvent() != null);
        if (request.getTriggerEvent() != null) {
            details.put("triggerEvent", request.getTriggerEvent());
        }
        return step(STEP_CONTEXT, request.hasMotivation(), details, concerns);
    }

    public DeliberationStepResult reviewPrecedent(ActionRequest request) {
        Map<String, Object> details = new LinkedHashMap<>();
        List<String> concerns = new ArrayList<>();

        PrecedentLookup lookup = precedentMemory.getPrecedent(request.getActionClass());
        double score = request.getPrecedent() != null ? request.getPrecedent() : lookup.score();
        boolean firstAction = resolveFirstInClass(request, lookup);
        PrecedentHistory history = lookup.history();

        details.put("score", score);
        details.put("isFirstAction", firstAction);
        if (history != null) {
            details.put("instances", history.instances());
            details.put("approved", history.approved());
            details.put("corrected", history.corrected());
            putIfPresent(details, "lastPositive", history.lastPositive());
            putIfPresent(details, "lastNegative", history.lastNegative());
        }

        if (firstAction) {
            concerns.add("First action in this class - no precedent");
        }
        if (history != null && history.lastNegative() != null) {
            Duration since = Duration.between(history.lastNegative(), clock.instant());
            if (since.compareTo(RECENT_CORRECTION) < 0) {
                concerns.add(String.format(Locale.ROOT, "Recent correction %.1f days ago", since.toMillis() / 86_400_000.0));
            }
        }
        if (score < LOW_PRECEDENT) {
            concerns.add(String.format(Locale.ROOT, "Low precedent score: %.2f", score));
        }
        if (history != null && history.instances() > CORRECTION_RATE_MIN_INSTANCES
                && history.correctionRate() > HIGH_CORRECTION_RATE) {
            concerns.add(String.format(Locale.ROOT, "High correction rate: %.0f%%", history.correctionRate() * 100));
        }
        return step(STEP_PRECEDENT, concerns.isEmpty(), details, concerns);
    }

    /** Passes only for trusted or verified sources whose chain holds that level throughout. */
    public DeliberationStepResult auditSources(ActionRequest request) {
        Map<String, Object> details = new LinkedHashMap<>();
        List<String> concerns = new ArrayList<>();
        TrustSource source = request.getTrustSource();

        if (source == null) {
            details.put("trustLevel", "unknown");
            concerns.add("No trust source information provided");
            return step(STEP_SOURCES, false, details, concerns);
        }

        TrustLevel level = source.level();
        details.put("trustLevel", level.value());
        if (level == TrustLevel.HOSTILE) {
            concerns.add("Content source tagged as hostile");
        } else if (level == TrustLevel.UNTRUSTED) {
            concerns.add("Content source is untrusted");
        }

        if (!source.chain().isEmpty()) {
            ChainValidation chain = tagger.validateChain(source);
            details.put("chainValid", chain.valid());
            details.put("chainLowestLevel", chain.lowestLevel().value());
            details.put("untrustedLinks", chain.untrustedLinks());
            if (!chain.untrustedLinks().isEmpty()) {
                concerns.add("Chain includes " + chain.untrustedLinks().size() + " untrusted link(s)");
            }
            if (level != TrustLevel.HOSTILE && chain.lowestLevel().isBelow(level)) {
                concerns.add("Chain degrades trust: " + level.value() + " -> " + chain.lowestLevel().value());
            }
        }
        return step(STEP_SOURCES, concerns.isEmpty(), details, concerns);
    }

    /**
     * Asks whether waiting for a human costs anything. Pressure (a deadline within the hour
     * or a lost opportunity) is a concern, but the check still passes when the action can
     * wait.
     */
    public DeliberationStepResult checkCounterfactual(ActionRequest request) {
        Map<String, Object> details = new LinkedHashMap<>();
        List<String> concerns = new ArrayList<>();

        boolean urgent = false;
        details.put("hasDeadline", request.getDeadline() != null);
        if (request.getDeadline() != null) {
            Duration remaining = Duration.between(clock.instant(), request.getDeadline());
            urgent = remaining.compareTo(URGENT_HORIZON) < 0;
            details.put("timeRemainingMs", remaining.toMillis());
            if (urgent) {
                concerns.add("Time-sensitive action");
            }
        }
        details.put("isUrgent", urgent);

        details.put("opportunityLost", request.isOpportunityLost());
        if (request.isOpportunityLost()) {
            concerns.add("Opportunity may be lost if not acted upon");
        }

        boolean userAvailable = !Boolean.FALSE.equals(request.getUserAvailable());
        details.put("userAvailable", userAvailable);
        boolean canWait = (!userAvailable && !urgent) || (!urgent && !request.isOpportunityLost());
        details.put("canWait", canWait);

        return step(STEP_COUNTERFACTUAL, canWait || concerns.isEmpty(), details, concerns);
    }

    public DeliberationStepResult confirmReversibility(ActionRequest request, double reversibility) {
        Map<String, Object> details = new LinkedHashMap<>();
        List<String> concerns = new ArrayList<>();
        String actionClass = request.getActionClass() == null ? "" : request.getActionClass();

        details.put("expectedReversibility", reversibility);
        boolean destructive = actionClass.contains("delete") || actionClass.contains("overwrite");
        boolean lowReversibility = reversibility < LOW_REVERSIBILITY;
        if (destructive || lowReversibility) {
            details.put("requiresBackup", true);
            details.put("backupExists", request.isBackupExists());
            if (!request.isBackupExists()) {
                concerns.add(destructive
                        ? "Destructive action but no backup confirmed"
                        : "Low-reversibility action but no backup confirmed");
            }
        }

        if (!request.getDependencies().isEmpty()) {
            details.put("dependencies", request.getDependencies().stream().map(Dependency::name).toList());
            long unmet = request.getDependencies().stream().filter(d -> !d.met()).count();
            if (unmet > 0) {
                concerns.add(unmet + " unmet dependencies");
            }
        }

        if (request.isAffectsExternal()) {
            details.put("affectsExternal", true);
            concerns.add("Action affects external systems - harder to reverse");
        }
        return step(STEP_REVERSIBILITY, concerns.isEmpty(), details, concerns);
    }

    // =========================================================================
    //  Verdict
    // =========================================================================

    public DeliberationReport deliberate(ActionRequest request) {
        return deliberate(request, false);
    }

    public DeliberationReport deliberate(ActionRequest request, boolean verbose) {
        Instant started = clock.instant();
        long startNanos = System.nanoTime();

        ScoreResult initial = scorer.scoreAction(request);
        List<DeliberationStepResult> steps = List.of(
                checkContext(request),
                reviewPrecedent(request),
                auditSources(request),
                checkCounterfactual(request),
                confirmReversibility(request, initial.reversibility()));

        List<String> concerns = new ArrayList<>();
        int failedSteps = 0;
        for (DeliberationStepResult s : steps) {
            concerns.addAll(s.concerns());
            if (!s.passed()) {
                failedSteps++;
            }
        }
        int totalConcerns = concerns.size();
        double adjustment = -(failedSteps * FAILED_STEP_PENALTY) - (totalConcerns * CONCERN_PENALTY);
        double adjusted = Math.max(0.0, Math.min(1.0, initial.composite() + adjustment));

        double act = scorer.getThresholds().act();
        double escalate = scorer.getThresholds().escalate();
        String actionClass = initial.actionClass();

        DeliberationOutcome outcome;
        String reason;
        if (TrustSourceTagger.isHostile(request.getTrustSource())) {
            outcome = DeliberationOutcome.DEMOTE;
            reason = "Source tagged as hostile";
        } else if (ActionClasses.hasHardCeiling(actionClass)) {
            outcome = DeliberationOutcome.DEMOTE;
            reason = "Hard ceiling: " + actionClass + " always requires approval";
        } else if (initial.firstInClass()) {
            outcome = DeliberationOutcome.DEMOTE;
            reason = "First action in class " + actionClass + " - no precedent";
        } else if (totalConcerns >= DEMOTE_CONCERNS) {
            outcome = DeliberationOutcome.DEMOTE;
            reason = totalConcerns + " concerns raised during deliberation";
        } else if (failedSteps == 0 && adjusted >= act && !ActionClasses.requiresDeliberation(actionClass)) {
            outcome = DeliberationOutcome.PROMOTE;
            reason = String.format(Locale.ROOT, "Adjusted score %.2f >= %.2f with no failed steps", adjusted, act);
        } else if (adjusted < escalate) {
            outcome = DeliberationOutcome.DEMOTE;
            reason = String.format(Locale.ROOT, "Adjusted score %.2f < %.2f", adjusted, escalate);
        } else {
            outcome = DeliberationOutcome.MAINTAIN;
            reason = String.format(Locale.ROOT, "Adjusted score %.2f in deliberate range, %d concern(s)", adjusted, totalConcerns);
        }

        Tier finalTier = switch (outcome) {
            case PROMOTE -> Tier.ACT;
            case DEMOTE -> Tier.ESCALATE;
            case MAINTAIN -> scorer.getTier(adjusted, false, true);
        };

        DeliberationReport report = new DeliberationReport(
                DeliberationReport.EVENT,
                started,
                Duration.ofNanos(System.nanoTime() - startNanos).toMillis(),
                actionClass,
                new DeliberationReport.InitialScores(initial.reversibility(), initial.precedent(), initial.blastRadius()),
                initial.composite(),
                initial.tier(),
                adjustment,
                adjusted,
                steps.stream().map(DeliberationStepResult::summary).toList(),
                verbose ? steps : null,
                List.copyOf(concerns),
                totalConcerns,
                failedSteps,
                outcome,
                finalTier,
                reason);

        log.info("Deliberation {}: {} -> {} ({})", actionClass, outcome.value(), finalTier.value(), reason);
        if (log.isDebugEnabled()) {
            for (DeliberationStepResult s : steps) {
                log.debug("  {} passed={} concerns={}", s.step(), s.passed(), s.concerns());
            }
        }
        return report;
    }

    /**
     * Actions whose answer is already Escalate: hard-ceiling classes, hostile sources and
     * first actions in a class.
     */
    public SkipDecision shouldSkipDeliberation(ActionRequest request) {
        if (ActionClasses.hasHardCeiling(request.getActionClass())) {
            return SkipDecision.escalate("Hard ceiling class");
        }
        if (TrustSourceTagger.isHostile(request.getTrustSource())) {
            return SkipDecision.escalate("Hostile source");
        }
        boolean firstAction = request.getFirstInClass() != null
                ? request.getFirstInClass()
                : request.getPrecedent() == null && precedentMemory.getPrecedent(request.getActionClass()).isFirstAction();
        if (firstAction) {
            return SkipDecision.escalate("First action in class");
        }
        return SkipDecision.proceed();
    }

    // =========================================================================
    //  Helpers
    // =========================================================================

    private static boolean resolveFirstInClass(ActionRequest request, PrecedentLookup lookup) {
        if (request.getFirstInClass() != null) {
            return request.getFirstInClass();
        }
        return request.getPrecedent() == null && lookup.isFirstAction();
    }

    private DeliberationStepResult step(String name, boolean passed, Map<String, Object> details, List<String> concerns) {
        return new DeliberationStepResult(name, passed, details, concerns, clock.instant());
    }

    private static void putIfPresent(Map<String, Object> details, String key, Object value) {
        if (value != null) {
            details.put(key, value);
        }
    }
}
