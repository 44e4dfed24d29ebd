package com.lmrunner.exception;

/**
 * Kinds of runner failure, distinguishable by callers without parsing messages.
 */
public enum ErrorKind {
    INVALID_FORMAT,
    UNKNOWN_PROVIDER,
    MISSING_CREDENTIAL,
    BACKEND_UNAVAILABLE,
    BACKEND_REJECTED,
    SINK_CLOSED
}
