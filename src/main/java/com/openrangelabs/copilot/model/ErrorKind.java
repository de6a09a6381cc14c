package com.openrangelabs.copilot.model;

/**
 * Classification of connector failures.
 *
 * <p>Callers branch on the kind instead of parsing messages:
 * <ul>
 *   <li>{@link #TRANSPORT} - the remote system could not be reached (connection refused, timeout)</li>
 *   <li>{@link #HTTP_STATUS} - reachable, but a non-2xx status or an unreadable body came back</li>
 *   <li>{@link #LOGICAL_API} - the body itself reports a failure, e.g. {@code success:false}</li>
 *   <li>{@link #VALIDATION} - the remote rejected the input with a structured validation error</li>
 *   <li>{@link #NOT_FOUND} - the lookup succeeded but matched no record</li>
 *   <li>{@link #INVALID_ARGUMENT} - rejected locally, no request was sent</li>
 * </ul>
 */
public enum ErrorKind {
    TRANSPORT,
    HTTP_STATUS,
    LOGICAL_API,
    VALIDATION,
    NOT_FOUND,
    INVALID_ARGUMENT;

    /**
     * Whether the failure was reported by the remote API inside a readable body.
     */
    public boolean isLogical() {
        return this == LOGICAL_API || this == VALIDATION;
    }
}
