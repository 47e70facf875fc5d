package com.campaignrl.rlengine.dto;

import com.campaignrl.common.model.CampaignContext;
import com.campaignrl.common.model.CampaignMetrics;
import com.campaignrl.common.model.CampaignType;
import com.campaignrl.common.model.Competition;
import com.campaignrl.common.model.RiskAppetite;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * External view of a campaign at action-request time. Missing metrics fall back to
 * {@link CampaignMetrics#defaults()}.
 */
public record CurrentState(
    @JsonProperty("strategicContext") String          strategicContext,
    @JsonProperty("campaignType")     CampaignType    campaignType,
    @JsonProperty("riskAppetite")     RiskAppetite    riskAppetite,
    @JsonProperty("competition")      Competition     competition,
    @JsonProperty("metrics")          CampaignMetrics metrics,
    @JsonProperty("timeOfDay")        String          timeOfDay,
    @JsonProperty("dayOfWeek")        String          dayOfWeek,
    @JsonProperty("seasonality")      String          seasonality,
    @JsonProperty("marketConditions") String          marketConditions,
    @JsonProperty("region")           String          region
) {

    public CampaignContext toContext() {
        return new CampaignContext(strategicContext, campaignType, riskAppetite, competition,
            timeOfDay, dayOfWeek, seasonality, marketConditions, region);
    }

    public CampaignMetrics toMetrics() {
        return metrics != null ? metrics : CampaignMetrics.defaults();
    }
}
