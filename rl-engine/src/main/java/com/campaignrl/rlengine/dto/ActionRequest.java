package com.campaignrl.rlengine.dto;

import com.campaignrl.common.model.ActionType;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * @param availableActions candidate subset; all twelve actions when null or empty
 */
public record ActionRequest(
    @JsonProperty("currentState")     CurrentState     currentState,
    @JsonProperty("availableActions") List<ActionType> availableActions,
    @JsonProperty("correlationId")    String           correlationId,
    @JsonProperty("userId")           String           userId,
    @JsonProperty("sessionId")        String           sessionId
) {}
