package com.example.telemetry.shared.exception;

/**
 * The presence store or event broker is temporarily unreachable.
 */
public class TransientStoreException extends TelemetryException {

    public TransientStoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
