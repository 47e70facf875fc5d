package com.campaignrl.common.event;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.util.List;

/**
 * Notification emitted after a learning batch completed.
 */
public record BatchProcessedEvent(
    @JsonProperty("eventType")            String       eventType,
    @JsonProperty("experiencesProcessed") int          experiencesProcessed,
    @JsonProperty("experiencesDropped")   int          experiencesDropped,
    @JsonProperty("strategiesCreated")    int          strategiesCreated,
    @JsonProperty("strategiesUpdated")    int          strategiesUpdated,
    @JsonProperty("avgQValue")            double       avgQValue,
    @JsonProperty("totalStrategies")      int          totalStrategies,
    @JsonProperty("affectedContexts")     List<String> affectedContexts,
    @JsonProperty("timestamp")            Instant      timestamp
) {
    public static final String TYPE = "rl.batch_processed";
}
