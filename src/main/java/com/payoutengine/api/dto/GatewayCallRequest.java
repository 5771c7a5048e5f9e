package com.payoutengine.api.dto;

import jakarta.validation.constraints.NotBlank;
import lombok.Data;

import java.util.Map;

/**
 * DTO for a raw platform call through the gateway.
 */
@Data
public class GatewayCallRequest {

    @NotBlank(message = "Layer is required")
    private String layer;

    @NotBlank(message = "Method is required")
    private String method;

    private Map<String, Object> params;

    /**
     * Bypass a live cache entry.
     */
    private boolean force;
}
