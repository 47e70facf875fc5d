package com.campaignrl.common.model;

import com.campaignrl.common.context.ContextNormalizer;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Strategic situation of a campaign at the time an action is requested.
 *
 * <p>Only {@code strategicContext} feeds the Q-table key (see {@link #normalizedKey()});
 * the remaining fields are carried for the heuristic fallback and for observability.
 * Null enum/string fields fall back to the defaults used by the campaign API
 * (conversion / moderate / moderate, business hours on a weekday, stable market).
 */
public record CampaignContext(
    @JsonProperty("strategicContext")  String       strategicContext,
    @JsonProperty("campaignType")      CampaignType campaignType,
    @JsonProperty("riskAppetite")      RiskAppetite riskAppetite,
    @JsonProperty("competition")       Competition  competition,
    @JsonProperty("timeOfDay")         String       timeOfDay,
    @JsonProperty("dayOfWeek")         String       dayOfWeek,
    @JsonProperty("seasonality")       String       seasonality,
    @JsonProperty("marketConditions")  String       marketConditions,
    @JsonProperty("region")            String       region
) {

    public CampaignContext {
        campaignType     = campaignType     != null ? campaignType     : CampaignType.CONVERSION;
        riskAppetite     = riskAppetite     != null ? riskAppetite     : RiskAppetite.MODERATE;
        competition      = competition      != null ? competition      : Competition.MODERATE;
        timeOfDay        = timeOfDay        != null ? timeOfDay        : "business_hours";
        dayOfWeek        = dayOfWeek        != null ? dayOfWeek        : "weekday";
        seasonality      = seasonality      != null ? seasonality      : "normal";
        marketConditions = marketConditions != null ? marketConditions : "stable";
        region           = region           != null ? region           : "national";
    }

    public static CampaignContext of(String strategicContext) {
        return new CampaignContext(strategicContext, null, null, null, null, null, null, null, null);
    }

    /** Q-table key for this context. Throws {@code InvalidContextException} on a blank goal. */
    public String normalizedKey() {
        return ContextNormalizer.normalize(strategicContext);
    }
}
