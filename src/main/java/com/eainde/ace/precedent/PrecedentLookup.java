package com.eainde.ace.precedent;

import java.io.Serializable;

/**
 * Precedent for one class as read by scoring and deliberation. {@code history} is
 * {@code null} exactly when the class has never been recorded.
 */
public record PrecedentLookup(double score, boolean isFirstAction, PrecedentHistory history) implements Serializable {

    static PrecedentLookup firstAction() {
        return new PrecedentLookup(PrecedentMemory.PRECEDENT_FLOOR, true, null);
    }
}
