package com.eainde.ace.bypass;

import java.io.Serializable;
import java.time.Instant;

/**
 * Effective bypass mode and where it comes from.
 *
 * @param temporary whether an operator-set, expiring bypass is in force
 * @param expiresAt expiry of a temporary bypass, otherwise {@code null}
 */
public record BypassState(BypassMode mode, boolean temporary, Instant expiresAt, String reason, String setBy)
        implements Serializable {

    static BypassState standing(BypassMode mode, String reason) {
        return new BypassState(mode, false, null, reason, null);
    }
}
