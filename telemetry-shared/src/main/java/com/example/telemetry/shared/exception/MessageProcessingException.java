package com.example.telemetry.shared.exception;

import com.example.telemetry.shared.dto.PublishEventRequest;
import lombok.Getter;

/**
 * Carries the failed ingest request along with the cause so the DLT keeps the business context.
 */
@Getter
public class MessageProcessingException extends RuntimeException {

    private final transient PublishEventRequest failedRequest;

    public MessageProcessingException(String message, Throwable cause, PublishEventRequest failedRequest) {
        super(message, cause);
        this.failedRequest = failedRequest;
    }
}
