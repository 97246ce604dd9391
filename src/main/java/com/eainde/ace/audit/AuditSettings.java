package com.eainde.ace.audit;

/**
 * Audit thresholds.
 *
 * @param rubberStampThreshold consecutive approvals that trigger a rubber-stamp warning
 * @param intervalDays         days between scheduled audits
 * @param driftWarningRate     net promote rate above which drift warns
 * @param driftMinimumSamples  deliberations needed in the window before drift can warn
 */
public record AuditSettings(int rubberStampThreshold, int intervalDays, double driftWarningRate, int driftMinimumSamples) {

    public static final AuditSettings DEFAULT = new AuditSettings(10, 7, 0.20, 5);

    public AuditSettings {
        if (rubberStampThreshold < 1) {
            throw new IllegalArgumentException("rubberStampThreshold must be >= 1");
        }
        if (intervalDays < 1) {
            throw new IllegalArgumentException("intervalDays must be >= 1");
        }
    }
}
