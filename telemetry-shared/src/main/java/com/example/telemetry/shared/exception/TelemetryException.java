package com.example.telemetry.shared.exception;

/**
 * Root of the telemetry core's failure taxonomy.
 */
public abstract class TelemetryException extends RuntimeException {

    protected TelemetryException(String message) {
        super(message);
    }

    protected TelemetryException(String message, Throwable cause) {
        super(message, cause);
    }
}
