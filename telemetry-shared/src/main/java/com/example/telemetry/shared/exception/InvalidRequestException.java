package com.example.telemetry.shared.exception;

public class InvalidRequestException extends TelemetryException {

    public InvalidRequestException(String message) {
        super(message);
    }
}
