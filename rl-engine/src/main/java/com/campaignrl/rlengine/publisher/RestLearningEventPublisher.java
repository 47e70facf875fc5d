package com.campaignrl.rlengine.publisher;

import com.campaignrl.common.event.BatchProcessedEvent;
import com.campaignrl.common.event.ExperienceLearnedEvent;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.web.reactive.function.client.WebClient;

/**
 * Sends learning notifications to the notification service via HTTP POST (fire-and-forget).
 * No reactor thread is ever blocked.
 */
public class RestLearningEventPublisher implements LearningEventPublisher {

    private static final Logger log = LoggerFactory.getLogger(RestLearningEventPublisher.class);

    private final WebClient notificationClient;

    public RestLearningEventPublisher(WebClient notificationClient) {
        this.notificationClient = notificationClient;
    }

    @Override
    public void publishExperienceLearned(ExperienceLearnedEvent event) {
        notificationClient.post()
            .uri("/api/v1/notify/rl/experience-learned")
            .header("X-Correlation-Id", event.correlationId())
            .bodyValue(event)
            .retrieve()
            .toBodilessEntity()
            .subscribe(
                r   -> log.info("Experience event published. experienceId={} context={} status={}",
                                event.experienceId(), event.context(), r.getStatusCode()),
                err -> log.warn("Experience event publish failed (non-critical). experienceId={}",
                                event.experienceId(), err)
            );
    }

    @Override
    public void publishBatchProcessed(BatchProcessedEvent event) {
        notificationClient.post()
            .uri("/api/v1/notify/rl/batch-processed")
            .bodyValue(event)
            .retrieve()
            .toBodilessEntity()
            .subscribe(
                r   -> log.info("Batch event published. processed={} contexts={} status={}",
                                event.experiencesProcessed(), event.affectedContexts(), r.getStatusCode()),
                err -> log.warn("Batch event publish failed (non-critical). processed={}",
                                event.experiencesProcessed(), err)
            );
    }
}
