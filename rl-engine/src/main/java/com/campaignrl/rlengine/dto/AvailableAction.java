package com.campaignrl.rlengine.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

public record AvailableAction(
    @JsonProperty("action")      String action,
    @JsonProperty("description") String description
) {}
