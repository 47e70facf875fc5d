package com.campaignrl.common.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum CampaignType {
    CONVERSION, AWARENESS, REACH, ENGAGEMENT, TRAFFIC;

    @JsonValue
    public String value() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static CampaignType fromValue(String raw) {
        return raw == null ? CONVERSION : valueOf(raw.trim().toUpperCase(Locale.ROOT));
    }
}
