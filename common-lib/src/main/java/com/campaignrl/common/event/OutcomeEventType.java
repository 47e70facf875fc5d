package com.campaignrl.common.event;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Inbound event kinds the learning core subscribes to.
 */
public enum OutcomeEventType {

    /** A traffic request finished; reward derived from success plus metrics. */
    TRAFFIC_REQUEST_COMPLETED("traffic.request_completed"),

    /** Campaign performance refreshed after an action; reward derived from improvement plus ROAS. */
    CAMPAIGN_PERFORMANCE_UPDATED("campaign.performance_updated"),

    /** Explicit reward supplied by another service. */
    STRATEGY_FEEDBACK("rl.strategy_feedback");

    private final String value;

    OutcomeEventType(String value) {
        this.value = value;
    }

    @JsonValue
    public String value() {
        return value;
    }

    @JsonCreator
    public static OutcomeEventType fromValue(String raw) {
        for (OutcomeEventType type : values()) {
            if (type.value.equalsIgnoreCase(raw) || type.name().equalsIgnoreCase(raw)) {
                return type;
            }
        }
        throw new IllegalArgumentException("Unknown outcome event type: " + raw);
    }
}
