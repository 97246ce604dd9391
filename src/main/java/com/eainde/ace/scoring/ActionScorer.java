package com.eainde.ace.scoring;

import com.eainde.ace.classifier.ActionClasses;
import com.eainde.ace.classifier.ClassificationResult;
import com.eainde.ace.config.AceProperties;
import com.eainde.ace.model.ActionRequest;
import com.eainde.ace.precedent.PrecedentLookup;
import com.eainde.ace.precedent.PrecedentMemory;
import com.eainde.ace.trust.TrustSource;
import com.eainde.ace.trust.TrustSourceTagger;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.util.Locale;

/**
 * Combines reversibility (R), precedent (P) and blast radius (B) into a composite and maps
 * it to a {@link Tier}.
 * <p>
 * Overrides are checked before the composite, in this order: hard-ceiling class, first
 * action in class, hostile source, deliberate-minimum class. A deliberate-minimum class
 * still escalates when its composite falls below the escalate threshold.
 */
@Slf4j
@Service
public class ActionScorer {

    static final String UNKNOWN_CLASS = "unknown:unknown:unknown";

    private final PrecedentMemory precedentMemory;
    private final TrustSourceTagger tagger;
    private final ScoringWeights weights;
    private final TierThresholds thresholds;
    private final boolean enabled;

    @Autowired
    public ActionScorer(PrecedentMemory precedentMemory, TrustSourceTagger tagger, AceProperties properties) {
        this(precedentMemory, tagger,
                new ScoringWeights(
                        properties.getWeights().getReversibility(),
                        properties.getWeights().getPrecedent(),
                        properties.getWeights().getBlastRadius()),
                new TierThresholds(
                        properties.getThresholds().getAct(),
                        properties.getThresholds().getEscalate()),
                properties.isEnabled());
    }

    public ActionScorer(PrecedentMemory precedentMemory,
                        TrustSourceTagger tagger,
                        ScoringWeights weights,
                        TierThresholds thresholds,
                        boolean enabled) {
        this.precedentMemory = precedentMemory;
        this.tagger = tagger;
        this.weights = weights;
        this.thresholds = thresholds;
        this.enabled = enabled;
    }

    public ScoreResult scoreAction(ActionRequest request) {
        String actionClass = request.getActionClass() == null || request.getActionClass().isBlank()
                ? UNKNOWN_CLASS
                : request.getActionClass();

        double r = request.getReversibility() != null
                ? request.getReversibility()
                : ActionClasses.getDefaultReversibility(actionClass);
        double b = request.getBlastRadius() != null
                ? request.getBlastRadius()
                : ActionClasses.getDefaultBlastRadius(actionClass);

        double p;
        boolean firstInClass;
        if (request.getPrecedent() != null) {
            p = request.getPrecedent();
            firstInClass = Boolean.TRUE.equals(request.getFirstInClass());
        } else {
            PrecedentLookup lookup = precedentMemory.getPrecedent(actionClass);
            p = lookup.score();
            firstInClass = request.getFirstInClass() != null ? request.getFirstInClass() : lookup.isFirstAction();
        }

        r = clamp(r);
        p = clamp(Math.min(p, PrecedentMemory.PRECEDENT_CEILING));
        b = clamp(b);

        TrustSource source = request.getTrustSource();
        if (source != null) {
            b = tagger.applyTrustModifier(b, source);
        }

        double composite = clamp(weights.composite(r, p, b));

        Tier tier;
        String reason;
        if (ActionClasses.hasHardCeiling(actionClass)) {
            tier = Tier.ESCALATE;
            reason = "Hard ceiling: " + actionClass + " always requires approval";
        } else if (firstInClass) {
            tier = Tier.ESCALATE;
            reason = "First action in class " + actionClass + " - no precedent";
        } else if (TrustSourceTagger.isHostile(source)) {
            tier = Tier.ESCALATE;
            reason = "Content source tagged as hostile";
        } else if (ActionClasses.requiresDeliberation(actionClass)) {
            if (composite < thresholds.escalate()) {
                tier = Tier.ESCALATE;
                reason = String.format(Locale.ROOT, "Score %.2f below escalate threshold", composite);
            } else {
                tier = Tier.DELIBERATE;
                reason = actionClass + " requires deliberation (minimum)";
            }
        } else if (composite >= thresholds.act()) {
            tier = Tier.ACT;
            reason = String.format(Locale.ROOT, "Score %.2f >= act threshold %.2f", composite, thresholds.act());
        } else if (composite >= thresholds.escalate()) {
            tier = Tier.DELIBERATE;
            reason = String.format(Locale.ROOT, "Score %.2f in deliberate range", composite);
        } else {
            tier = Tier.ESCALATE;
            reason = String.format(Locale.ROOT, "Score %.2f < escalate threshold %.2f", composite, thresholds.escalate());
        }

        log.debug("Scored {}: R={} P={} B={} composite={} tier={}", actionClass, r, p, b, composite, tier.value());
        return new ScoreResult(actionClass, r, p, b, composite, tier, reason, firstInClass, weights, thresholds);
    }

    public ClassificationResult classifyAction(String actionClass) {
        return ActionClasses.classify(actionClass);
    }

    public Tier getTier(double composite) {
        return getTier(composite, false, false);
    }

    /**
     * Tier for a bare composite. A force flag replaces the computed tier: escalate wins over
     * deliberate, and {@code forceDeliberate} yields Deliberate even for a composite that
     * would otherwise act or escalate.
     */
    public Tier getTier(double composite, boolean forceEscalate, boolean forceDeliberate) {
        if (forceEscalate) {
            return Tier.ESCALATE;
        }
        if (forceDeliberate) {
            return Tier.DELIBERATE;
        }
        return thresholds.tierFor(clamp(composite));
    }

    public double getCompositeScore(double r, double p, double b) {
        return getCompositeScore(r, p, b, weights);
    }

    public static double getCompositeScore(double r, double p, double b, ScoringWeights weights) {
        return clamp(weights.composite(clamp(r), clamp(p), clamp(b)));
    }

    public double getActThresholdFloor() {
        return TierThresholds.ACT_FLOOR;
    }

    public double getPrecedentCeiling() {
        return PrecedentMemory.PRECEDENT_CEILING;
    }

    public boolean isAceEnabled() {
        return enabled;
    }

    public ScoringWeights getWeights() {
        return weights;
    }

    public TierThresholds getThresholds() {
        return thresholds;
    }

    /** Clamps to [0, 1]; NaN reads as 0. */
    static double clamp(double value) {
        if (Double.isNaN(value)) {
            return 0.0;
        }
        return Math.max(0.0, Math.min(1.0, value));
    }
}
