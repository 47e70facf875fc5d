package com.campaignrl.rlengine.publisher;

import com.campaignrl.common.event.BatchProcessedEvent;
import com.campaignrl.common.event.ExperienceLearnedEvent;

/**
 * Outbound learning notifications. Implementations must not block the caller
 * and must never fail it: delivery is best-effort.
 */
public interface LearningEventPublisher {

    void publishExperienceLearned(ExperienceLearnedEvent event);

    void publishBatchProcessed(BatchProcessedEvent event);
}
