package com.campaignrl.rlengine.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

/** Response of {@code POST /events}: whether the event entered the ingest queue. */
public record EventAccepted(
    @JsonProperty("eventId")  String  eventId,
    @JsonProperty("accepted") boolean accepted,
    @JsonProperty("queued")   int     queued
) {}
