package com.eainde.ace.precedent;

import com.eainde.ace.model.ErrorKind;

/**
 * Result of {@link PrecedentMemory#recordAction}. {@code precedent} is the class score at
 * the time of recording, 0 for a new class.
 */
public record RecordedAction(boolean success, String error, ErrorKind errorKind, double precedent, int instanceIndex) {

    static RecordedAction success(double precedent, int instanceIndex) {
        return new RecordedAction(true, null, null, precedent, instanceIndex);
    }

    static RecordedAction failure(ErrorKind kind, String error) {
        return new RecordedAction(false, error, kind, 0.0, -1);
    }
}
