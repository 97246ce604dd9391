package com.eainde.ace.audit;

import com.eainde.ace.deliberation.DeliberationOutcome;
import com.eainde.ace.scoring.Tier;

import java.time.Instant;

public record DeliberationRecord(Instant timestamp, String actionClass, DeliberationOutcome outcome, Tier finalTier) {
}
