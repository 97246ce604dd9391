package com.eainde.ace.model;

/**
 * Categories of a failed (non-exceptional) ACE call.
 */
public enum ErrorKind {
    /** Missing or malformed input; the caller may retry with corrected input. */
    INVALID_INPUT,
    /** The target of the call has never been recorded. */
    NOT_FOUND
}
