package com.campaignrl.common.qlearning;

import com.campaignrl.common.model.Experience;
import com.campaignrl.common.model.Strategy;

import java.util.List;
import java.util.Map;

/**
 * Everything needed to rebuild an engine after a restart.
 */
public record EngineState(
    List<Strategy>                   strategies,
    Map<String, Map<String, Double>> qTable,
    List<Experience>                 active,
    List<Experience>                 history
) {

    public EngineState {
        strategies = strategies != null ? List.copyOf(strategies) : List.of();
        qTable     = qTable     != null ? qTable                  : Map.of();
        active     = active     != null ? List.copyOf(active)     : List.of();
        history    = history    != null ? List.copyOf(history)    : List.of();
    }

    public static EngineState empty() {
        return new EngineState(List.of(), Map.of(), List.of(), List.of());
    }
}
