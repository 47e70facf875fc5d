package com.campaignrl.common.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Duration;
import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * One observed (context, action, reward) tuple.
 *
 * <p>Immutable. Status transitions return a new instance and are only legal from
 * {@link ExperienceStatus#PENDING}; a terminal experience never changes again.
 *
 * <ul>
 *   <li>{@code context}     – normalized Q-table key</li>
 *   <li>{@code action}      – wire value of an {@link ActionType}</li>
 *   <li>{@code reward}      – feedback in [-1.0, 1.0]</li>
 *   <li>{@code processedAt} – null while pending</li>
 * </ul>
 */
public record Experience(
    @JsonProperty("id")          String              id,
    @JsonProperty("context")     String              context,
    @JsonProperty("action")      String              action,
    @JsonProperty("reward")      double              reward,
    @JsonProperty("timestamp")   Instant             timestamp,
    @JsonProperty("status")      ExperienceStatus    status,
    @JsonProperty("processedAt") Instant             processedAt,
    @JsonProperty("metadata")    Map<String, Object> metadata
) {

    public Experience {
        status   = status != null ? status : ExperienceStatus.PENDING;
        metadata = metadata == null || metadata.isEmpty()
            ? Map.of()
            : Collections.unmodifiableMap(new LinkedHashMap<>(metadata));
    }

    public static Experience pending(String id, String context, String action, double reward,
                                     Instant timestamp, Map<String, Object> metadata) {
        return new Experience(id, context, action, reward, timestamp,
            ExperienceStatus.PENDING, null, metadata);
    }

    public Experience markProcessed(Instant at) {
        return transition(ExperienceStatus.PROCESSED, at);
    }

    public Experience markDropped(ExperienceStatus dropStatus, Instant at) {
        if (!dropStatus.isDropped()) {
            throw new IllegalArgumentException("Not a drop status: " + dropStatus);
        }
        return transition(dropStatus, at);
    }

    private Experience transition(ExperienceStatus target, Instant at) {
        if (status.isTerminal()) {
            throw new IllegalStateException(
                "Experience " + id + " is already " + status + ", cannot move to " + target);
        }
        return new Experience(id, context, action, reward, timestamp, target, at, metadata);
    }

    @JsonIgnore
    public boolean isPending() {
        return status == ExperienceStatus.PENDING;
    }

    public double ageMinutes(Instant now) {
        return Duration.between(timestamp, now).toMillis() / 60_000.0;
    }
}
