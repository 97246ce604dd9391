package com.eainde.ace.audit;

import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Longitudinal audit state. Histories are bounded: oldest entries drop first.
 */
@Getter
@Setter
@NoArgsConstructor
public class AuditState {

    static final int MAX_ESCALATIONS = 100;
    static final int MAX_DRIFT_SAMPLES = 52;
    static final int MAX_DELIBERATIONS = 500;

    private List<EscalationRecord> escalationHistory = new ArrayList<>();
    private int consecutiveApprovals;
    private List<DriftSample> driftHistory = new ArrayList<>();
    private List<DeliberationRecord> deliberationHistory = new ArrayList<>();
    private Instant lastAuditAt;

    void addEscalation(EscalationRecord record) {
        escalationHistory = append(escalationHistory, record, MAX_ESCALATIONS);
    }

    void addDriftSample(DriftSample sample) {
        driftHistory = append(driftHistory, sample, MAX_DRIFT_SAMPLES);
    }

    void addDeliberation(DeliberationRecord record) {
        deliberationHistory = append(deliberationHistory, record, MAX_DELIBERATIONS);
    }

    /** Detached copy for callers outside the audit service. */
    public AuditState copy() {
        AuditState copy = new AuditState();
        copy.setEscalationHistory(new ArrayList<>(escalationHistory));
        copy.setConsecutiveApprovals(consecutiveApprovals);
        copy.setDriftHistory(new ArrayList<>(driftHistory));
        copy.setDeliberationHistory(new ArrayList<>(deliberationHistory));
        copy.setLastAuditAt(lastAuditAt);
        return copy;
    }

    private static <T> List<T> append(List<T> list, T item, int max) {
        List<T> result = list == null ? new ArrayList<>() : list;
        result.add(item);
        if (result.size() > max) {
            result = new ArrayList<>(result.subList(result.size() - max, result.size()));
        }
        return result;
    }
}
