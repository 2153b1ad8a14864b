package com.example.telemetry.shared.dto;

import jakarta.validation.constraints.NotBlank;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TrackLocationRequest {
    @NotBlank(message = "sessionId is required")
    private String sessionId;
    @NotBlank(message = "userId is required")
    private String userId;
    private String organizationId;
    @NotBlank(message = "ip is required")
    private String ip;
}
