package com.example.telemetry.shared.dto;

import com.example.telemetry.shared.model.EventMetadata;
import jakarta.validation.constraints.NotBlank;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Map;

/**
 * Inbound analytics event, from the internal REST endpoint or the ingest topic.
 * {@code organizationId} is required on the topic; over REST it defaults to the caller's organization.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PublishEventRequest {
    private String organizationId;
    @NotBlank(message = "type is required")
    private String type;
    private Map<String, Object> data;
    private EventMetadata metadata;
}
