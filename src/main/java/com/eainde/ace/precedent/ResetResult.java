package com.eainde.ace.precedent;

import com.eainde.ace.model.ErrorKind;

public record ResetResult(boolean success, String error, ErrorKind errorKind, double oldScore) {

    static ResetResult success(double oldScore) {
        return new ResetResult(true, null, null, oldScore);
    }

    static ResetResult failure(ErrorKind kind, String error) {
        return new ResetResult(false, error, kind, 0.0);
    }
}
