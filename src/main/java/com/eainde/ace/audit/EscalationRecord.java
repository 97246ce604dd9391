package com.eainde.ace.audit;

import java.time.Instant;

public record EscalationRecord(Instant timestamp, String actionClass, EscalationDecision decision, String modification) {
}
