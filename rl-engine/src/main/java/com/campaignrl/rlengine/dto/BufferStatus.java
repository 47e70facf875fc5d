package com.campaignrl.rlengine.dto;

import com.campaignrl.common.model.Experience;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.util.List;
import java.util.Objects;

/**
 * Occupancy of one buffer.
 *
 * <ul>
 *   <li>{@code oldestEntry} / {@code newestEntry} – creation time of the first/last entry, null when empty</li>
 *   <li>{@code lastProcessed} – latest {@code processedAt} in the buffer, null when none</li>
 * </ul>
 */
public record BufferStatus(
    @JsonProperty("bufferType")         String  bufferType,
    @JsonProperty("size")               int     size,
    @JsonProperty("maxSize")            int     maxSize,
    @JsonProperty("utilizationPercent") double  utilizationPercent,
    @JsonProperty("oldestEntry")        Instant oldestEntry,
    @JsonProperty("newestEntry")        Instant newestEntry,
    @JsonProperty("lastProcessed")      Instant lastProcessed
) {

    public static BufferStatus of(String bufferType, List<Experience> entries, int maxSize) {
        Instant oldest = entries.isEmpty() ? null : entries.get(0).timestamp();
        Instant newest = entries.isEmpty() ? null : entries.get(entries.size() - 1).timestamp();
        Instant lastProcessed = entries.stream()
            .map(Experience::processedAt)
            .filter(Objects::nonNull)
            .max(Instant::compareTo)
            .orElse(null);
        double utilization = maxSize == 0 ? 0.0 : Math.round(entries.size() * 10_000.0 / maxSize) / 100.0;
        return new BufferStatus(bufferType, entries.size(), maxSize, utilization, oldest, newest, lastProcessed);
    }
}
