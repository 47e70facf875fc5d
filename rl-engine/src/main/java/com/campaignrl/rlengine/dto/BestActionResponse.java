package com.campaignrl.rlengine.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

public record BestActionResponse(
    @JsonProperty("context")          String context,
    @JsonProperty("bestAction")       String bestAction,
    @JsonProperty("qValue")           double qValue,
    @JsonProperty("confidence")       double confidence,
    @JsonProperty("totalExperiences") long   totalExperiences
) {}
