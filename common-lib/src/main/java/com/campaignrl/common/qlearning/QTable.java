package com.campaignrl.common.qlearning;

import com.campaignrl.common.exception.NoActionsRecordedException;

import java.util.Collection;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Random;

/**
 * Two-level mapping context → action → Q-value.
 *
 * <p>Actions keep insertion order per context, which makes {@link #bestAction(String)}
 * deterministic on ties (first recorded wins). Pairs that were never updated read as 0.0.
 * Entries are overwritten, never removed.
 *
 * <p>Not thread-safe; {@link QLearningEngine} owns the instance and serializes access.
 */
public class QTable {

    private final Map<String, LinkedHashMap<String, Double>> table = new HashMap<>();
    private final double learningRate;
    private final double discountFactor;

    public QTable(double learningRate, double discountFactor) {
        this.learningRate   = learningRate;
        this.discountFactor = discountFactor;
    }

    public double getValue(String context, String action) {
        Map<String, Double> row = table.get(context);
        if (row == null) return 0.0;
        return row.getOrDefault(action, 0.0);
    }

    /**
     * Applies {@code Q(s,a) ← Q(s,a) + α·[R + γ·max_a' Q(s',a') − Q(s,a)]}.
     *
     * <p>{@code max_a' Q(s',a')} is taken over the actions recorded for {@code nextContext}
     * before this call inserts anything; 0.0 when none are recorded.
     *
     * @return the new Q-value of (context, action)
     */
    public double updateValue(String context, String action, double reward, String nextContext) {
        double maxNext = maxValue(nextContext);
        double oldQ    = getValue(context, action);
        double newQ    = oldQ + learningRate * (reward + discountFactor * maxNext - oldQ);
        table.computeIfAbsent(context, k -> new LinkedHashMap<>()).put(action, newQ);
        return newQ;
    }

    /**
     * @throws NoActionsRecordedException when the context has no recorded actions
     */
    public ActionValue bestAction(String context) {
        return bestOf(context, table.getOrDefault(context, new LinkedHashMap<>()).keySet());
    }

    /**
     * Argmax restricted to {@code candidates}; iteration still follows recorded order.
     *
     * @throws NoActionsRecordedException when no candidate has a recorded value
     */
    public ActionValue bestAction(String context, Collection<String> candidates) {
        return bestOf(context, candidates);
    }

    private ActionValue bestOf(String context, Collection<String> allowed) {
        Map<String, Double> row = table.get(context);
        if (row == null || row.isEmpty()) {
            throw new NoActionsRecordedException(context);
        }
        String best = null;
        double bestValue = Double.NEGATIVE_INFINITY;
        for (Map.Entry<String, Double> e : row.entrySet()) {
            if (!allowed.contains(e.getKey())) continue;
            if (best == null || e.getValue() > bestValue) {
                best      = e.getKey();
                bestValue = e.getValue();
            }
        }
        if (best == null) {
            throw new NoActionsRecordedException(context);
        }
        return new ActionValue(best, bestValue);
    }

    /** Uniform pick from the candidate universe; independent of recorded state. */
    public String randomAction(List<String> candidates, Random random) {
        if (candidates == null || candidates.isEmpty()) {
            throw new IllegalArgumentException("No candidate actions supplied");
        }
        return candidates.get(random.nextInt(candidates.size()));
    }

    /** Insertion-ordered, read-only view of one row. */
    public Map<String, Double> actionsFor(String context) {
        Map<String, Double> row = table.get(context);
        return row == null ? Map.of() : Collections.unmodifiableMap(row);
    }

    /** Deep copy suitable for persistence. */
    public Map<String, Map<String, Double>> snapshot() {
        Map<String, Map<String, Double>> copy = new LinkedHashMap<>();
        table.forEach((ctx, row) -> copy.put(ctx, new LinkedHashMap<>(row)));
        return copy;
    }

    /** Replaces the whole table with persisted content. */
    public void restore(Map<String, Map<String, Double>> persisted) {
        table.clear();
        if (persisted == null) return;
        persisted.forEach((ctx, row) -> table.put(ctx, new LinkedHashMap<>(row)));
    }

    private double maxValue(String context) {
        Map<String, Double> row = table.get(context);
        if (row == null || row.isEmpty()) return 0.0;
        double max = Double.NEGATIVE_INFINITY;
        for (double v : row.values()) {
            max = Math.max(max, v);
        }
        return max;
    }
}
