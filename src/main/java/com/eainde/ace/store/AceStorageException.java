package com.eainde.ace.store;

/**
 * Durable state could not be read or written. Distinct from validation results and policy
 * decisions: callers must not read a missing score as "no history".
 */
public class AceStorageException extends RuntimeException {

    public AceStorageException(String message, Throwable cause) {
        super(message, cause);
    }
}
