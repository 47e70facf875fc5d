package com.campaignrl.rlengine.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Buffer and strategy snapshot attached to action responses.
 *
 * @param contextExperiences experiences learned for the requested context, 0 when unseen
 */
public record EngineStatus(
    @JsonProperty("activeBuffer")       BufferStatus activeBuffer,
    @JsonProperty("historyBuffer")      BufferStatus historyBuffer,
    @JsonProperty("totalStrategies")    int          totalStrategies,
    @JsonProperty("contextExperiences") long         contextExperiences
) {}
