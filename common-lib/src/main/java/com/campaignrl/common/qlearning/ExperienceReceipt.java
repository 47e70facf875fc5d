package com.campaignrl.common.qlearning;

import com.campaignrl.common.model.Experience;

import java.util.Optional;

/**
 * What happened to one {@code addExperience} call.
 *
 * @param experience        the enqueued experience (normalized context, canonical action)
 * @param droppedOnOverflow the oldest pending experience evicted to make room, or null
 * @param batch             result of the auto-triggered batch, or null when none ran
 */
public record ExperienceReceipt(
    Experience  experience,
    Experience  droppedOnOverflow,
    BatchResult batch,
    int         activeBufferSize,
    int         historyBufferSize,
    int         totalStrategies
) {

    public boolean autoProcessed() {
        return batch != null;
    }

    public Optional<Experience> dropped() {
        return Optional.ofNullable(droppedOnOverflow);
    }

    public Optional<BatchResult> batchResult() {
        return Optional.ofNullable(batch);
    }
}
