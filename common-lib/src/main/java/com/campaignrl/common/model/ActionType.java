package com.campaignrl.common.model;

import com.campaignrl.common.exception.InvalidActionException;
import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Fixed vocabulary of campaign optimization moves the engine can recommend.
 *
 * <p>The wire form is snake_case ({@code focus_high_value_audiences}). {@link #fromValue(String)}
 * also accepts the kebab-case and upper-case spellings of the same member.
 */
public enum ActionType {

    OPTIMIZE_BIDDING_STRATEGY("optimize_bidding_strategy"),
    INCREASE_BID_CONVERSION_KEYWORDS("increase_bid_conversion_keywords"),
    REDUCE_BID_CONSERVATIVE("reduce_bid_conservative"),
    FOCUS_HIGH_VALUE_AUDIENCES("focus_high_value_audiences"),
    EXPAND_REACH_CAMPAIGNS("expand_reach_campaigns"),
    PAUSE_CAMPAIGN("pause_campaign"),
    INCREASE_BUDGET_MODERATE("increase_budget_moderate"),
    REDUCE_BUDGET_DRASTIC("reduce_budget_drastic"),
    OPTIMIZE_FOR_CTR("optimize_for_ctr"),
    OPTIMIZE_FOR_REACH("optimize_for_reach"),
    ADJUST_TARGETING_NARROW("adjust_targeting_narrow"),
    ADJUST_TARGETING_BROAD("adjust_targeting_broad");

    private final String value;

    ActionType(String value) {
        this.value = value;
    }

    @JsonValue
    public String value() {
        return value;
    }

    /** Human-readable label, e.g. "Focus High Value Audiences". */
    public String description() {
        StringBuilder sb = new StringBuilder();
        for (String word : value.split("_")) {
            if (sb.length() > 0) sb.append(' ');
            sb.append(Character.toUpperCase(word.charAt(0))).append(word.substring(1));
        }
        return sb.toString();
    }

    @JsonCreator
    public static ActionType fromValue(String raw) {
        if (raw == null || raw.isBlank()) {
            throw new InvalidActionException("Action cannot be empty");
        }
        String canonical = raw.trim().toLowerCase(Locale.ROOT).replace('-', '_');
        for (ActionType type : values()) {
            if (type.value.equals(canonical)) {
                return type;
            }
        }
        throw new InvalidActionException("Invalid action: " + raw);
    }

    public static boolean isValid(String raw) {
        try {
            fromValue(raw);
            return true;
        } catch (InvalidActionException e) {
            return false;
        }
    }
}
