package com.campaignrl.rlengine.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Liveness summary of {@code GET /health}. {@code status} is {@code DEGRADED} while a failed
 * write is waiting for the next full save, {@code UP} otherwise.
 */
public record HealthResponse(
    @JsonProperty("status")           String  status,
    @JsonProperty("resyncRequired")   boolean resyncRequired,
    @JsonProperty("totalStrategies")  int     totalStrategies,
    @JsonProperty("activeBufferSize") int     activeBufferSize,
    @JsonProperty("queuedEvents")     int     queuedEvents
) {

    public static final String UP       = "UP";
    public static final String DEGRADED = "DEGRADED";
}
