package com.example.telemetry.shared.exception;

/**
 * Missing, invalid or expired bearer credential. Never retried.
 */
public class AuthException extends TelemetryException {

    public AuthException(String message) {
        super(message);
    }

    public AuthException(String message, Throwable cause) {
        super(message, cause);
    }
}
