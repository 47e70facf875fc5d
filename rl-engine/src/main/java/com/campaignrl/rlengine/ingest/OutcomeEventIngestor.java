package com.campaignrl.rlengine.ingest;

import com.campaignrl.common.event.OutcomeEvent;
import com.campaignrl.rlengine.dto.LearnAck;
import com.campaignrl.rlengine.service.LearningOrchestrator;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;
import reactor.core.Disposable;
import reactor.core.publisher.Mono;
import reactor.core.publisher.Sinks;
import reactor.core.scheduler.Scheduler;
import reactor.core.scheduler.Schedulers;

import java.util.concurrent.ArrayBlockingQueue;

/**
 * Bounded inbound queue of outcome events in front of the {@link LearningOrchestrator}.
 *
 * <pre>
 *   producers ──submit()──▶ [ queue (rl.events.queue-depth) ] ──publishOn(consumer, 1)──concatMap(1)──▶ handleExternalEvent
 * </pre>
 *
 * <p>{@link #submit} never blocks: when the queue is full the event is dropped with a warning.
 * A single consumer thread handles one event at a time and pulls the next only when done, so a
 * backlog stays in the bounded queue. A failing event is logged and skipped; the consumer keeps running.
 */
@Component
public class OutcomeEventIngestor {

    private static final Logger log = LoggerFactory.getLogger(OutcomeEventIngestor.class);

    private final LearningOrchestrator orchestrator;
    private final ArrayBlockingQueue<OutcomeEvent> queue;
    private final Sinks.Many<OutcomeEvent> sink;
    private final Scheduler consumerScheduler;
    private Disposable consumer;

    @Autowired
    public OutcomeEventIngestor(LearningOrchestrator orchestrator,
                                @Value("${rl.events.queue-depth:256}") int queueDepth) {
        this(orchestrator, queueDepth, Schedulers.newSingle("outcome-events"));
    }

    public OutcomeEventIngestor(LearningOrchestrator orchestrator, int queueDepth, Scheduler consumerScheduler) {
        this.orchestrator      = orchestrator;
        this.queue             = new ArrayBlockingQueue<>(queueDepth);
        this.sink              = Sinks.many().unicast().onBackpressureBuffer(queue);
        this.consumerScheduler = consumerScheduler;
    }

    @PostConstruct
    public void start() {
        if (consumer != null && !consumer.isDisposed()) {
            return;
        }
        consumer = sink.asFlux()
            .publishOn(consumerScheduler, 1)
            .concatMap(this::handle, 1)
            .subscribe(
                ack -> log.debug("Outcome event learned. experienceId={} correlationId={}",
                                 ack.experienceId(), ack.correlationId()),
                err -> log.error("Outcome event consumer terminated unexpectedly", err)
            );
        log.info("Outcome event ingestor started. queueDepth={}", queue.remainingCapacity() + queue.size());
    }

    @PreDestroy
    public void stop() {
        if (consumer != null) {
            consumer.dispose();
        }
        consumerScheduler.dispose();
    }

    /**
     * Offers an event to the queue. Multiple producers may call this concurrently.
     *
     * @return false when the event was dropped (queue full or ingestor stopped)
     */
    public synchronized boolean submit(OutcomeEvent event) {
        Sinks.EmitResult result = sink.tryEmitNext(event);
        if (result.isFailure()) {
            log.warn("Outcome event dropped. eventId={} type={} reason={} queued={}",
                     event.eventId(), event.eventType(), result, queue.size());
            return false;
        }
        return true;
    }

    /** Events accepted but not yet handed to the orchestrator. */
    public int queued() {
        return queue.size();
    }

    private Mono<LearnAck> handle(OutcomeEvent event) {
        return orchestrator.handleExternalEvent(event)
            .onErrorResume(e -> {
                log.warn("Outcome event failed (skipped). eventId={} type={} cause={}",
                         event.eventId(), event.eventType(), e.getMessage());
                return Mono.empty();
            });
    }
}
