package com.campaignrl.common.event;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;

/**
 * Notification emitted after an experience entered the active buffer.
 */
public record ExperienceLearnedEvent(
    @JsonProperty("eventType")               String  eventType,
    @JsonProperty("experienceId")            String  experienceId,
    @JsonProperty("context")                 String  context,
    @JsonProperty("action")                  String  action,
    @JsonProperty("reward")                  double  reward,
    @JsonProperty("activeBufferSize")        int     activeBufferSize,
    @JsonProperty("autoProcessingTriggered") boolean autoProcessingTriggered,
    @JsonProperty("correlationId")           String  correlationId,
    @JsonProperty("timestamp")               Instant timestamp
) {
    public static final String TYPE = "rl.experience_learned";
}
