package com.campaignrl.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;

/**
 * Running per-action statistics inside a {@link Strategy}.
 */
public record ActionStats(
    @JsonProperty("count")       long    count,
    @JsonProperty("totalReward") double  totalReward,
    @JsonProperty("avgReward")   double  avgReward,
    @JsonProperty("qValue")      double  qValue,
    @JsonProperty("lastUsed")    Instant lastUsed
) {

    public static ActionStats empty() {
        return new ActionStats(0, 0.0, 0.0, 0.0, null);
    }

    public ActionStats record(double reward, double newQValue, Instant at) {
        long   newCount = count + 1;
        double newTotal = totalReward + reward;
        return new ActionStats(newCount, newTotal, newTotal / newCount, newQValue, at);
    }

    public ActionStats withQValue(double value) {
        return new ActionStats(count, totalReward, avgReward, value, lastUsed);
    }
}
