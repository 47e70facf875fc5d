package com.campaignrl.rlengine.dto;

import com.campaignrl.common.qlearning.BatchResult;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;

/**
 * Acknowledgement of one learned experience.
 *
 * <ul>
 *   <li>{@code droppedExperienceId} – oldest pending experience evicted on overflow, null when none</li>
 *   <li>{@code batch}               – auto-triggered batch result, null when none ran</li>
 * </ul>
 */
public record LearnAck(
    @JsonProperty("experienceId")        String      experienceId,
    @JsonProperty("context")             String      context,
    @JsonProperty("action")              String      action,
    @JsonProperty("reward")              double      reward,
    @JsonProperty("activeBufferSize")    int         activeBufferSize,
    @JsonProperty("historyBufferSize")   int         historyBufferSize,
    @JsonProperty("totalStrategies")     int         totalStrategies,
    @JsonProperty("autoProcessed")       boolean     autoProcessed,
    @JsonProperty("droppedExperienceId") String      droppedExperienceId,
    @JsonProperty("batch")               BatchResult batch,
    @JsonProperty("correlationId")       String      correlationId,
    @JsonProperty("timestamp")           Instant     timestamp
) {}
