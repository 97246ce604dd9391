package com.eainde.ace.bypass;

import com.eainde.ace.model.ErrorKind;

import java.time.Instant;

public record BypassResult(boolean success, Instant expiresAt, BypassMode mode, String error, ErrorKind errorKind) {

    static BypassResult success(Instant expiresAt, BypassMode mode) {
        return new BypassResult(true, expiresAt, mode, null, null);
    }

    static BypassResult invalid(String error) {
        return new BypassResult(false, null, null, error, ErrorKind.INVALID_INPUT);
    }
}
