package com.campaignrl.common.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Learned summary for a single context: what currently works best and how sure we are.
 *
 * <p>{@code bestAction} is the argmax over the Q-table row at the time of the last
 * recompute. {@code confidence} is a saturating function of {@code totalExperiences}
 * ({@code n / (n + 10)}): 0 without evidence, approaching but never reaching 1.0,
 * and it only moves when new experience is counted.
 */
public record Strategy(
    @JsonProperty("context")          String                   context,
    @JsonProperty("bestAction")       String                   bestAction,
    @JsonProperty("bestQValue")       double                   bestQValue,
    @JsonProperty("totalExperiences") long                     totalExperiences,
    @JsonProperty("confidence")       double                   confidence,
    @JsonProperty("actionStats")      Map<String, ActionStats> actionStats,
    @JsonProperty("qValues")          Map<String, Double>      qValues,
    @JsonProperty("createdAt")        Instant                  createdAt,
    @JsonProperty("lastUpdated")      Instant                  lastUpdated,
    @JsonProperty("algorithmVersion") String                   algorithmVersion
) {

    public static final String ALGORITHM_VERSION = "q_learning_v1";

    private static final double CONFIDENCE_HALF_SATURATION = 10.0;

    public Strategy {
        actionStats      = actionStats == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(actionStats));
        qValues          = qValues     == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(qValues));
        algorithmVersion = algorithmVersion != null ? algorithmVersion : ALGORITHM_VERSION;
    }

    /** Empty strategy for a context seen for the first time. */
    public static Strategy initial(String context, Instant now) {
        return new Strategy(context, null, 0.0, 0, 0.0, Map.of(), Map.of(), now, now, ALGORITHM_VERSION);
    }

    public static double confidenceFor(long experiences) {
        if (experiences <= 0) return 0.0;
        return experiences / (experiences + CONFIDENCE_HALF_SATURATION);
    }

    /**
     * Returns the strategy re-derived from a fresh Q-table row.
     *
     * @param best            argmax of {@code row}
     * @param row             current Q-values of this context, insertion ordered
     * @param stats           per-action statistics including this batch
     * @param newExperiences  experiences of this context counted in the batch
     */
    public Strategy refresh(String best, double bestValue, Map<String, Double> row,
                            Map<String, ActionStats> stats, long newExperiences, Instant now) {
        long total = totalExperiences + newExperiences;
        return new Strategy(context, best, bestValue, total, confidenceFor(total),
            stats, row, createdAt, now, algorithmVersion);
    }

    @JsonProperty("actionsCount")
    public int actionsCount() {
        return actionStats.size();
    }

    @JsonIgnore
    public boolean hasBestAction() {
        return bestAction != null;
    }
}
