package com.campaignrl.rlengine.publisher;

import com.campaignrl.common.event.BatchProcessedEvent;
import com.campaignrl.common.event.ExperienceLearnedEvent;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** Used when {@code rl.notifications.enabled=false}: events only reach the log. */
public class LoggingLearningEventPublisher implements LearningEventPublisher {

    private static final Logger log = LoggerFactory.getLogger(LoggingLearningEventPublisher.class);

    @Override
    public void publishExperienceLearned(ExperienceLearnedEvent event) {
        log.info("[Notify] {} experienceId={} context={} action={} reward={} autoProcessed={}",
                 event.eventType(), event.experienceId(), event.context(), event.action(),
                 event.reward(), event.autoProcessingTriggered());
    }

    @Override
    public void publishBatchProcessed(BatchProcessedEvent event) {
        log.info("[Notify] {} processed={} dropped={} created={} updated={} contexts={}",
                 event.eventType(), event.experiencesProcessed(), event.experiencesDropped(),
                 event.strategiesCreated(), event.strategiesUpdated(), event.affectedContexts());
    }
}
