package com.eainde.ace.audit;

import java.time.Instant;

/**
 * One line of the append-only audit log.
 *
 * @param event {@code ace:escalation-response}, {@code ace:deliberation} or {@code ace:trust-audit}
 */
public record AuditLogEntry(String event, Instant timestamp, Object data) {

    public static final String ESCALATION_RESPONSE = "ace:escalation-response";
    public static final String DELIBERATION = "ace:deliberation";
    public static final String TRUST_AUDIT = "ace:trust-audit";
}
