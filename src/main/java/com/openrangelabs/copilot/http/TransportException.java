package com.openrangelabs.copilot.http;

/**
 * Signals that a request never produced an HTTP response: connection refused,
 * DNS failure, timeout, or an I/O error while reading the body.
 */
public class TransportException extends RuntimeException {

    public TransportException(String message) {
        super(message);
    }

    public TransportException(String message, Throwable cause) {
        super(message, cause);
    }
}
