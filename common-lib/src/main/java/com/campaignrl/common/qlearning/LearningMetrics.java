package com.campaignrl.common.qlearning;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Read-only snapshot of engine activity. Averages cover the most recent
 * {@value QLearningEngine#METRICS_WINDOW} samples of each series.
 */
public record LearningMetrics(
    @JsonProperty("totalActions")              long            totalActions,
    @JsonProperty("totalLearningSessions")     long            totalLearningSessions,
    @JsonProperty("totalExperiencesProcessed") long            totalExperiencesProcessed,
    @JsonProperty("totalExperiencesDropped")   long            totalExperiencesDropped,
    @JsonProperty("totalStrategies")           int             totalStrategies,
    @JsonProperty("avgConfidence")             double          avgConfidence,
    @JsonProperty("avgReward")                 double          avgReward,
    @JsonProperty("avgQValue")                 double          avgQValue,
    @JsonProperty("maxQValue")                 double          maxQValue,
    @JsonProperty("buffer")                    BufferMetrics   buffer,
    @JsonProperty("hyperparameters")           QLearningConfig hyperparameters
) {

    public record BufferMetrics(
        @JsonProperty("activeBufferSize")                 int    activeBufferSize,
        @JsonProperty("activeBufferMax")                  int    activeBufferMax,
        @JsonProperty("activeBufferUtilizationPercent")   double activeBufferUtilizationPercent,
        @JsonProperty("historyBufferSize")                int    historyBufferSize,
        @JsonProperty("historyBufferMax")                 int    historyBufferMax,
        @JsonProperty("historyBufferUtilizationPercent")  double historyBufferUtilizationPercent
    ) {}
}
