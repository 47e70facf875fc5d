package com.campaignrl.common.qlearning;

import com.campaignrl.common.model.Experience;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.util.List;

/**
 * Statistics of one {@link QLearningEngine#processExperiences()} pass.
 *
 * <p>{@code archived} holds every experience that left the active buffer in this pass
 * (processed and validation-dropped); it is what the persistence layer mirrors into history.
 */
public record BatchResult(
    @JsonProperty("strategiesCreated")    int              strategiesCreated,
    @JsonProperty("strategiesUpdated")    int              strategiesUpdated,
    @JsonProperty("experiencesProcessed") int              experiencesProcessed,
    @JsonProperty("experiencesDropped")   int              experiencesDropped,
    @JsonProperty("avgQValue")            double           avgQValue,
    @JsonProperty("touchedContexts")      List<String>     touchedContexts,
    @JsonIgnore                           List<Experience> archived,
    @JsonProperty("totalStrategies")      int              totalStrategies,
    @JsonProperty("completedAt")          Instant          completedAt
) {

    public BatchResult {
        touchedContexts = touchedContexts != null ? List.copyOf(touchedContexts) : List.of();
        archived        = archived        != null ? List.copyOf(archived)        : List.of();
    }

    public static BatchResult empty(int totalStrategies, Instant at) {
        return new BatchResult(0, 0, 0, 0, 0.0, List.of(), List.of(), totalStrategies, at);
    }

    @JsonIgnore
    public boolean isEmpty() {
        return experiencesProcessed == 0 && experiencesDropped == 0;
    }
}
