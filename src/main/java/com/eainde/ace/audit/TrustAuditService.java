package com.eainde.ace.audit;

import com.eainde.ace.bypass.BypassManager;
import com.eainde.ace.bypass.BypassStats;
import com.eainde.ace.classifier.ActionClasses;
import com.eainde.ace.config.AceProperties;
import com.eainde.ace.deliberation.DeliberationOutcome;
import com.eainde.ace.deliberation.DeliberationReport;
import com.eainde.ace.model.ErrorKind;
import com.eainde.ace.precedent.PrecedentAuditSummary;
import com.eainde.ace.precedent.PrecedentMemory;
import com.eainde.ace.store.AceStorageException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.TreeMap;
import java.util.function.Consumer;

/**
 * Watches the operator and the policy over time.
 * <ul>
 *   <li>Rubber-stamp detection: a streak of unmodified approvals suggests escalations are no
 *       longer being read.</li>
 *   <li>Drift: the net rate at which deliberation promotes rather than demotes, over a
 *       trailing window.</li>
 *   <li>Self-modification lockout: ACE's own thresholds and configuration, and every
 *       hard-ceiling class, are never autonomous.</li>
 * </ul>
 * State is persisted after every change; every escalation response, deliberation and audit
 * is appended to the audit log.
 */
@Slf4j
@Service
public class TrustAuditService {

    static final List<String> SELF_MODIFICATION_PREFIXES = List.of(
            "self:modify:ace-thresholds",
            "self:modify:ace-config",
            "self:modify:ace-weights");

    static final int BYPASS_USAGE_WARNING = 10;

    private static final DateTimeFormatter REPORT_DATE = DateTimeFormatter.ofPattern("yyyy-MM-dd").withZone(ZoneOffset.UTC);

    private final AuditStore store;
    private final PrecedentMemory precedentMemory;
    private final BypassManager bypassManager;
    private final Clock clock;
    private final AuditSettings settings;

    private AuditState state;

    @Autowired
    public TrustAuditService(AuditStore store, PrecedentMemory precedentMemory, BypassManager bypassManager,
                             Clock clock, AceProperties properties) {
        this(store, precedentMemory, bypassManager, clock, new AuditSettings(
                properties.getAudit().getRubberStampThreshold(),
                properties.getAudit().getIntervalDays(),
                properties.getAudit().getDriftWarningRate(),
                properties.getAudit().getDriftMinimumSamples()));
    }

    public TrustAuditService(AuditStore store, PrecedentMemory precedentMemory, BypassManager bypassManager,
                             Clock clock, AuditSettings settings) {
        this.store = store;
        this.precedentMemory = precedentMemory;
        this.bypassManager = bypassManager;
        this.clock = clock;
        this.settings = settings;
    }

    // =========================================================================
    //  Escalations and rubber-stamping
    // =========================================================================

    /**
     * Records the operator's answer. A missing action class or decision is rejected without
     * touching state.
     */
    public synchronized AuditChecks.EscalationAck recordEscalationResponse(EscalationResponse response) {
        AuditState current = state();
        if (response == null || response.actionClass() == null || response.actionClass().isBlank()) {
            return AuditChecks.EscalationAck.failure(ErrorKind.INVALID_INPUT, "Action class is required",
                    current.getConsecutiveApprovals());
        }
        if (response.decision() == null) {
            return AuditChecks.EscalationAck.failure(ErrorKind.INVALID_INPUT,
                    "Decision is required: approved, denied or modified", current.getConsecutiveApprovals());
        }
        EscalationRecord record = new EscalationRecord(
                clock.instant(), response.actionClass(), response.decision(), response.modification());
        current.addEscalation(record);
        if (response.decision() == EscalationDecision.APPROVED) {
            current.setConsecutiveApprovals(current.getConsecutiveApprovals() + 1);
        } else {
            current.setConsecutiveApprovals(0);
        }
        persist(current);
        store.append(new AuditLogEntry(AuditLogEntry.ESCALATION_RESPONSE, record.timestamp(), record));

        boolean warning = current.getConsecutiveApprovals() >= settings.rubberStampThreshold();
        if (warning) {
            log.warn("Rubber-stamp pattern: {} consecutive approvals", current.getConsecutiveApprovals());
        }
        return AuditChecks.EscalationAck.recorded(warning, current.getConsecutiveApprovals());
    }

    public synchronized AuditChecks.RubberStamp detectRubberStamp() {
        int count = state().getConsecutiveApprovals();
        boolean detected = count >= settings.rubberStampThreshold();
        String message = detected
                ? "I've noticed you've approved my last " + count + " escalated actions without changes. "
                + "This might mean my escalation threshold is too conservative, or it might mean approvals "
                + "are becoming automatic. Would you like to review and adjust, or should I continue at "
                + "current sensitivity?"
                : null;
        return new AuditChecks.RubberStamp(detected, count, settings.rubberStampThreshold(), message);
    }

    public synchronized void resetRubberStampCounter() {
        AuditState current = state();
        current.setConsecutiveApprovals(0);
        persist(current);
    }

    // =========================================================================
    //  Self-modification lockout
    // =========================================================================

    /**
     * Blocks changes to ACE itself and every hard-ceiling class. Nothing downstream, neither
     * bypass nor deliberation, can turn a block into an allow.
     */
    public AuditChecks.SelfModification checkSelfModification(String actionClass) {
        if (actionClass == null) {
            return AuditChecks.SelfModification.ALLOWED;
        }
        for (String prefix : SELF_MODIFICATION_PREFIXES) {
            if (actionClass.startsWith(prefix)) {
                return new AuditChecks.SelfModification(true, "Action class \"" + actionClass
                        + "\" is permanently blocked. ACE cannot modify its own thresholds or configuration.");
            }
        }
        if (ActionClasses.hasHardCeiling(actionClass)) {
            return new AuditChecks.SelfModification(true,
                    "Action class \"" + actionClass + "\" has a hard ceiling and always requires escalation.");
        }
        return AuditChecks.SelfModification.ALLOWED;
    }

    // =========================================================================
    //  Drift
    // =========================================================================

    public synchronized void recordDeliberation(DeliberationReport report) {
        AuditState current = state();
        DeliberationRecord record = new DeliberationRecord(
                report.timestamp() != null ? report.timestamp() : clock.instant(),
                report.actionClass(), report.outcome(), report.finalTier());
        current.addDeliberation(record);
        persist(current);
        store.append(new AuditLogEntry(AuditLogEntry.DELIBERATION, record.timestamp(), report));
    }

    /**
     * Net autonomy expansion over the last {@code days}: (promotions - demotions) divided by
     * deliberations in the window. Warns above the configured rate once enough deliberations
     * have been seen. Each check is kept in the drift history.
     */
    public synchronized AuditChecks.Drift checkDriftRate(int days) {
        int window = days > 0 ? days : 7;
        AuditState current = state();
        Instant cutoff = clock.instant().minus(Duration.ofDays(window));

        Map<String, Integer> netByClass = new TreeMap<>();
        int promotes = 0;
        int demotes = 0;
        int samples = 0;
        for (DeliberationRecord record : current.getDeliberationHistory()) {
            if (record.timestamp() == null || record.timestamp().isBefore(cutoff)) {
                continue;
            }
            samples++;
            if (record.outcome() == DeliberationOutcome.PROMOTE) {
                promotes++;
                netByClass.merge(record.actionClass(), 1, Integer::sum);
            } else if (record.outcome() == DeliberationOutcome.DEMOTE) {
                demotes++;
                netByClass.merge(record.actionClass(), -1, Integer::sum);
            }
        }

        List<String> expanding = new ArrayList<>();
        List<String> contracting = new ArrayList<>();
        netByClass.forEach((actionClass, net) -> {
            if (net > 0) {
                expanding.add(actionClass + ": +" + net);
            } else if (net < 0) {
                contracting.add(actionClass + ": " + net);
            }
        });

        double rate = samples == 0 ? 0.0 : (double) (promotes - demotes) / samples;
        boolean warning = samples >= settings.driftMinimumSamples() && rate > settings.driftWarningRate();
        String message = warning
                ? String.format(Locale.ROOT, "Trust expansion rate is %.0f%% over the last %d days, above the %.0f%% "
                        + "threshold. Consider reviewing whether autonomous actions are being scrutinized.",
                rate * 100, window, settings.driftWarningRate() * 100)
                : null;

        current.addDriftSample(new DriftSample(clock.instant(), rate, samples, expanding.size(), contracting.size()));
        persist(current);
        if (warning) {
            log.warn("Trust drift {} over {} deliberations", String.format(Locale.ROOT, "%.2f", rate), samples);
        }
        return new AuditChecks.Drift(rate, List.copyOf(expanding), List.copyOf(contracting), warning, message, samples);
    }

    // =========================================================================
    //  Audit report
    // =========================================================================

    public synchronized AuditReport generateAudit(int days) {
        int window = days > 0 ? days : 7;
        Instant now = clock.instant();
        Instant cutoff = now.minus(Duration.ofDays(window));

        PrecedentAuditSummary summary = precedentMemory.getAuditSummary(window);
        BypassStats bypass = bypassManager.getBypassStats();
        AuditChecks.Drift drift = checkDriftRate(window);
        AuditChecks.RubberStamp rubberStamp = detectRubberStamp();

        int approved = 0;
        int denied = 0;
        int modified = 0;
        for (EscalationRecord record : state().getEscalationHistory()) {
            // older state files may hold responses recorded without a decision
            if (record.decision() == null || record.timestamp() == null || record.timestamp().isBefore(cutoff)) {
                continue;
            }
            switch (record.decision()) {
                case APPROVED -> approved++;
                case DENIED -> denied++;
                case MODIFIED -> modified++;
            }
        }

        List<AuditReport.Warning> warnings = new ArrayList<>();
        if (drift.warning()) {
            warnings.add(new AuditReport.Warning("drift", AuditReport.Severity.MEDIUM, drift.message()));
        }
        if (rubberStamp.detected()) {
            warnings.add(new AuditReport.Warning("rubber-stamp", AuditReport.Severity.HIGH, rubberStamp.message()));
        }
        PrecedentAuditSummary.RecentActivity activity = summary.recentActivity();
        if (activity.negative() > activity.positive()) {
            warnings.add(new AuditReport.Warning("negative-trend", AuditReport.Severity.MEDIUM,
                    "More negative outcomes (" + activity.negative() + ") than positive ("
                            + activity.positive() + ") this period."));
        }
        if (bypass.actionsWhileBypassed() > BYPASS_USAGE_WARNING) {
            warnings.add(new AuditReport.Warning("bypass-usage", AuditReport.Severity.LOW,
                    bypass.actionsWhileBypassed() + " actions taken while ACE was bypassed."));
        }

        return new AuditReport(
                AuditReport.TYPE,
                now,
                new PrecedentAuditSummary.Period(window, cutoff, now),
                new AuditReport.Activity(activity.actions(), activity.positive(), activity.negative(),
                        approved + denied + modified, new AuditReport.EscalationBreakdown(approved, denied, modified)),
                new AuditReport.PrecedentSection(summary.totals().classes(), summary.scoreChanges(),
                        summary.topClasses(), summary.bottomClasses()),
                new AuditReport.DriftSection(drift.rate(), String.format(Locale.ROOT, "%.1f", drift.rate() * 100),
                        settings.driftWarningRate(), drift.warning(), drift.expanding(), drift.contracting()),
                new AuditReport.RubberStampSection(rubberStamp.count(), rubberStamp.threshold(), rubberStamp.detected()),
                new AuditReport.BypassSection(bypass.temporaryBypassCount(), bypass.actionsWhileBypassed(),
                        bypass.hardCeilingBlockedDuringBypass(), bypass.lastBypassAt()),
                List.copyOf(warnings));
    }

    public String formatAuditReport(AuditReport report) {
        List<String> lines = new ArrayList<>();
        lines.add("**ACE Trust Audit - Week of " + REPORT_DATE.format(report.period().from()) + "**");
        lines.add("");

        AuditReport.Activity activity = report.activity();
        lines.add("**Activity Summary**");
        lines.add("- Total actions recorded: " + activity.totalActions());
        lines.add("- Positive outcomes: " + activity.positive());
        lines.add("- Negative outcomes: " + activity.negative());
        lines.add("- Escalations: " + activity.escalations());
        if (activity.escalations() > 0) {
            lines.add("  - Approved: " + activity.escalationBreakdown().approved());
            lines.add("  - Denied: " + activity.escalationBreakdown().denied());
            lines.add("  - Modified: " + activity.escalationBreakdown().modified());
        }
        lines.add("");

        List<PrecedentAuditSummary.ScoreChange> changes = report.precedent().scoreChanges();
        if (!changes.isEmpty()) {
            lines.add("**Precedent Changes**");
            for (PrecedentAuditSummary.ScoreChange change : changes.subList(0, Math.min(5, changes.size()))) {
                lines.add(String.format(Locale.ROOT, "- %s: %.2f -> %.2f %s",
                        change.actionClass(), change.from(), change.to(), change.change() > 0 ? "up" : "down"));
            }
            lines.add("");
        }

        lines.add("**Trust Drift**");
        lines.add("- Expansion rate: " + report.drift().ratePercent() + "%/period");
        if (report.drift().warning()) {
            lines.add(String.format(Locale.ROOT, "- Above %.0f%% threshold", report.drift().warningRate() * 100));
        }
        lines.add("");

        if (!report.warnings().isEmpty()) {
            lines.add("**Warnings**");
            for (AuditReport.Warning warning : report.warnings()) {
                lines.add("[" + warning.severity().name() + "] " + warning.message());
            }
            lines.add("");
        }

        AuditReport.BypassSection bypass = report.bypass();
        if (bypass.temporaryBypassCount() > 0 || bypass.actionsWhileBypassed() > 0) {
            lines.add("**Bypass Usage**");
            lines.add("- Temporary bypasses: " + bypass.temporaryBypassCount());
            lines.add("- Actions while bypassed: " + bypass.actionsWhileBypassed());
            lines.add("- Hard ceiling blocks: " + bypass.hardCeilingBlocked());
            lines.add("");
        }
        return String.join("\n", lines);
    }

    /**
     * Generates and formats the audit, hands it to {@code sender}, logs it and stamps the
     * audit time. A failing sender is logged and reported as {@code sent=false}; the audit
     * still counts as done.
     */
    public synchronized PresentedAudit presentAudit(Consumer<String> sender) {
        AuditReport report = generateAudit(settings.intervalDays());
        String formatted = formatAuditReport(report);

        boolean sent = false;
        if (sender != null) {
            try {
                sender.accept(formatted);
                sent = true;
            } catch (RuntimeException e) {
                log.error("Failed to deliver trust audit", e);
            }
        }

        store.append(new AuditLogEntry(AuditLogEntry.TRUST_AUDIT, report.generatedAt(), report));
        AuditState current = state();
        current.setLastAuditAt(report.generatedAt());
        persist(current);
        log.info("Trust audit presented ({} warnings, sent={})", report.warnings().size(), sent);
        return new PresentedAudit(report, formatted, sent);
    }

    public record PresentedAudit(AuditReport report, String formatted, boolean sent) {
    }

    public synchronized AuditChecks.AuditDue isAuditDue() {
        Instant last = state().getLastAuditAt();
        if (last == null) {
            return new AuditChecks.AuditDue(true, null);
        }
        double daysSince = Duration.between(last, clock.instant()).toMillis() / 86_400_000.0;
        return new AuditChecks.AuditDue(daysSince >= settings.intervalDays(), daysSince);
    }

    // =========================================================================
    //  State access
    // =========================================================================

    public synchronized AuditState getAuditState() {
        return state().copy();
    }

    public synchronized void resetAuditState() {
        AuditState fresh = new AuditState();
        persist(fresh);
        log.info("Audit state reset");
    }

    public String getAuditLogPath() {
        return store.logLocation();
    }

    private AuditState state() {
        if (state == null) {
            try {
                state = store.loadState().orElseGet(AuditState::new);
            } catch (AceStorageException e) {
                log.error("Cannot load audit state", e);
                throw e;
            }
        }
        return state;
    }

    private void persist(AuditState current) {
        try {
            store.saveState(current);
            state = current;
        } catch (AceStorageException e) {
            state = null;
            log.error("Cannot save audit state", e);
            throw e;
        }
    }
}
