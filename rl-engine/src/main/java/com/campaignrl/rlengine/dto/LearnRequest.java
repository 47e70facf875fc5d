package com.campaignrl.rlengine.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Map;

/**
 * @param reward required; a missing value is rejected like an out-of-range one
 */
public record LearnRequest(
    @JsonProperty("context")       String              context,
    @JsonProperty("action")        String              action,
    @JsonProperty("reward")        Double              reward,
    @JsonProperty("metadata")      Map<String, Object> metadata,
    @JsonProperty("correlationId") String              correlationId
) {}
