package com.campaignrl.rlengine.dto;

import com.campaignrl.common.model.CampaignContext;
import com.campaignrl.common.model.CampaignMetrics;
import com.campaignrl.common.model.DecisionPath;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;

public record ActionResponse(
    @JsonProperty("action")            String          action,
    @JsonProperty("confidence")        double          confidence,
    @JsonProperty("reasoning")         String          reasoning,
    @JsonProperty("path")              DecisionPath    path,
    @JsonProperty("normalizedContext") String          normalizedContext,
    @JsonProperty("context")           CampaignContext context,
    @JsonProperty("metrics")           CampaignMetrics metrics,
    @JsonProperty("timestamp")         Instant         timestamp,
    @JsonProperty("correlationId")     String          correlationId,
    @JsonProperty("engineStatus")      EngineStatus    engineStatus
) {}
