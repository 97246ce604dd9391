package com.eainde.ace.bypass;

import java.time.Instant;

/**
 * Bypass usage counters. {@code hardCeilingBlockedDuringBypass} counts hard-ceiling actions
 * refused while some bypass was in force, a key audit signal.
 */
public record BypassStats(int temporaryBypassCount,
                          int actionsWhileBypassed,
                          int hardCeilingBlockedDuringBypass,
                          Instant lastBypassAt,
                          String lastBypassDuration,
                          BypassState currentMode,
                          boolean temporaryBypassActive) {
}
