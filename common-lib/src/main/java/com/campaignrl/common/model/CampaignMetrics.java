package com.campaignrl.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Point-in-time performance numbers of a campaign.
 *
 * <ul>
 *   <li>{@code ctr}               – click-through rate in percent</li>
 *   <li>{@code roas}              – return on ad spend (revenue / spend)</li>
 *   <li>{@code budgetUtilization} – fraction of budget consumed ([0.0, 1.0])</li>
 * </ul>
 */
public record CampaignMetrics(
    @JsonProperty("ctr")               double ctr,
    @JsonProperty("cpm")               double cpm,
    @JsonProperty("cpc")               double cpc,
    @JsonProperty("impressions")       long   impressions,
    @JsonProperty("clicks")            long   clicks,
    @JsonProperty("conversions")       long   conversions,
    @JsonProperty("spend")             double spend,
    @JsonProperty("revenue")           double revenue,
    @JsonProperty("roas")              double roas,
    @JsonProperty("budgetUtilization") double budgetUtilization,
    @JsonProperty("reach")             long   reach,
    @JsonProperty("frequency")         double frequency
) {

    private static final CampaignMetrics DEFAULTS =
        new CampaignMetrics(2.0, 10.0, 0.5, 10_000, 200, 20, 100.0, 200.0, 2.0, 0.8, 8_000, 1.25);

    /** Baseline metrics used when a caller sends no performance data. */
    public static CampaignMetrics defaults() {
        return DEFAULTS;
    }

    public boolean isPerformingWell() {
        return roas >= 2.0 && ctr >= 1.5 && conversions >= 10;
    }

    public boolean needsOptimization() {
        return roas < 1.5 || ctr < 1.0 || budgetUtilization > 0.9;
    }
}
