package com.campaignrl.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;

/**
 * Output of the epsilon-greedy policy for one action request.
 */
public record ActionDecision(
    @JsonProperty("action")            String       action,
    @JsonProperty("confidence")        double       confidence,
    @JsonProperty("reasoning")         String       reasoning,
    @JsonProperty("path")              DecisionPath path,
    @JsonProperty("normalizedContext") String       normalizedContext,
    @JsonProperty("timestamp")         Instant      timestamp
) {}
