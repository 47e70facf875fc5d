package com.campaignrl.common.event;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.util.Map;

/**
 * Completed-outcome event published by a collaborator (traffic manager, campaign
 * tracker, feedback source) and funneled into the learning core.
 *
 * <ul>
 *   <li>{@code success} – request succeeded / campaign improved (ignored for feedback)</li>
 *   <li>{@code reward}  – explicit reward, only read for {@link OutcomeEventType#STRATEGY_FEEDBACK}</li>
 *   <li>{@code metrics} – roas, ctr, conversions, …; missing keys read as 0</li>
 * </ul>
 */
public record OutcomeEvent(
    @JsonProperty("eventId")       String              eventId,
    @JsonProperty("eventType")     OutcomeEventType    eventType,
    @JsonProperty("correlationId") String              correlationId,
    @JsonProperty("context")       String              context,
    @JsonProperty("action")        String              action,
    @JsonProperty("success")       boolean             success,
    @JsonProperty("reward")        Double              reward,
    @JsonProperty("metrics")       Map<String, Double> metrics,
    @JsonProperty("source")        String              source,
    @JsonProperty("occurredAt")    Instant             occurredAt
) {

    public OutcomeEvent {
        metrics = metrics != null ? Map.copyOf(metrics) : Map.of();
    }

    public double metric(String name) {
        Double value = metrics.get(name);
        return value != null ? value : 0.0;
    }
}
