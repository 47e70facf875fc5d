package com.campaignrl.common.qlearning;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Duration;

/**
 * Immutable hyperparameters handed to {@link QLearningEngine} at construction.
 *
 * <ul>
 *   <li>{@code learningRate}         – α in the update rule ([0.0, 1.0])</li>
 *   <li>{@code discountFactor}       – γ in the update rule ([0.0, 1.0])</li>
 *   <li>{@code explorationRate}      – ε of the epsilon-greedy policy ([0.0, 1.0])</li>
 *   <li>{@code activeCapacity}       – max pending experiences held in the active buffer</li>
 *   <li>{@code historyCapacity}      – max archived experiences</li>
 *   <li>{@code autoProcessThreshold} – active size that triggers a batch; a value above
 *       {@code activeCapacity} disables auto-processing</li>
 *   <li>{@code historyRetention}     – age after which archived experiences are evicted</li>
 * </ul>
 */
public record QLearningConfig(
    @JsonProperty("learningRate")         double   learningRate,
    @JsonProperty("discountFactor")       double   discountFactor,
    @JsonProperty("explorationRate")      double   explorationRate,
    @JsonProperty("activeCapacity")       int      activeCapacity,
    @JsonProperty("historyCapacity")      int      historyCapacity,
    @JsonProperty("autoProcessThreshold") int      autoProcessThreshold,
    @JsonProperty("historyRetention")     Duration historyRetention
) {

    public static final double   DEFAULT_LEARNING_RATE          = 0.1;
    public static final double   DEFAULT_DISCOUNT_FACTOR        = 0.95;
    public static final double   DEFAULT_EXPLORATION_RATE       = 0.15;
    public static final int      DEFAULT_ACTIVE_CAPACITY        = 25;
    public static final int      DEFAULT_HISTORY_CAPACITY       = 1000;
    public static final int      DEFAULT_AUTO_PROCESS_THRESHOLD = 15;
    public static final Duration DEFAULT_HISTORY_RETENTION      = Duration.ofHours(72);

    public QLearningConfig {
        requireUnitInterval("learningRate", learningRate);
        requireUnitInterval("discountFactor", discountFactor);
        requireUnitInterval("explorationRate", explorationRate);
        if (activeCapacity < 1)       throw new IllegalArgumentException("activeCapacity must be >= 1, got " + activeCapacity);
        if (historyCapacity < 1)      throw new IllegalArgumentException("historyCapacity must be >= 1, got " + historyCapacity);
        if (autoProcessThreshold < 1) throw new IllegalArgumentException("autoProcessThreshold must be >= 1, got " + autoProcessThreshold);
        if (historyRetention == null || historyRetention.isNegative() || historyRetention.isZero()) {
            throw new IllegalArgumentException("historyRetention must be positive, got " + historyRetention);
        }
    }

    public static QLearningConfig defaults() {
        return new QLearningConfig(DEFAULT_LEARNING_RATE, DEFAULT_DISCOUNT_FACTOR, DEFAULT_EXPLORATION_RATE,
            DEFAULT_ACTIVE_CAPACITY, DEFAULT_HISTORY_CAPACITY, DEFAULT_AUTO_PROCESS_THRESHOLD,
            DEFAULT_HISTORY_RETENTION);
    }

    public QLearningConfig withExplorationRate(double rate) {
        return new QLearningConfig(learningRate, discountFactor, rate, activeCapacity,
            historyCapacity, autoProcessThreshold, historyRetention);
    }

    public QLearningConfig withBuffer(int active, int history, int threshold) {
        return new QLearningConfig(learningRate, discountFactor, explorationRate, active,
            history, threshold, historyRetention);
    }

    public boolean autoProcessEnabled() {
        return autoProcessThreshold <= activeCapacity;
    }

    private static void requireUnitInterval(String name, double value) {
        if (Double.isNaN(value) || value < 0.0 || value > 1.0) {
            throw new IllegalArgumentException(name + " must be within [0.0, 1.0], got " + value);
        }
    }
}
