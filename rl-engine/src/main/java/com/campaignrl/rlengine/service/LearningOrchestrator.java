package com.campaignrl.rlengine.service;

import com.campaignrl.common.context.ContextNormalizer;
import com.campaignrl.common.event.BatchProcessedEvent;
import com.campaignrl.common.event.ExperienceLearnedEvent;
import com.campaignrl.common.event.OutcomeEvent;
import com.campaignrl.common.exception.InvalidRewardException;
import com.campaignrl.common.exception.RlDomainException;
import com.campaignrl.common.model.ActionDecision;
import com.campaignrl.common.model.ActionType;
import com.campaignrl.common.model.CampaignContext;
import com.campaignrl.common.model.CampaignMetrics;
import com.campaignrl.common.model.Experience;
import com.campaignrl.common.model.Strategy;
import com.campaignrl.common.qlearning.BatchResult;
import com.campaignrl.common.qlearning.EngineState;
import com.campaignrl.common.qlearning.ExperienceReceipt;
import com.campaignrl.common.qlearning.LearningMetrics;
import com.campaignrl.common.qlearning.QLearningConfig;
import com.campaignrl.common.qlearning.QLearningEngine;
import com.campaignrl.common.reward.RewardCalculator;
import com.campaignrl.rlengine.dto.ActionRequest;
import com.campaignrl.rlengine.dto.ActionResponse;
import com.campaignrl.rlengine.dto.AvailableAction;
import com.campaignrl.rlengine.dto.BestActionResponse;
import com.campaignrl.rlengine.dto.BufferStatus;
import com.campaignrl.rlengine.dto.EngineStatus;
import com.campaignrl.rlengine.dto.LearnAck;
import com.campaignrl.rlengine.dto.LearnRequest;
import com.campaignrl.rlengine.persistence.PersistenceGateway;
import com.campaignrl.rlengine.publisher.LearningEventPublisher;
import com.campaignrl.rlengine.trace.CorrelationContext;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;
import reactor.core.publisher.Sinks;
import reactor.core.scheduler.Scheduler;
import reactor.core.scheduler.Schedulers;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Service boundary around the {@link QLearningEngine}.
 *
 * <p>Pipeline per learned experience:
 * <pre>
 *   validate + enqueue (engine, synchronous) → ack to caller
 *                                            ↘ write queue ──concatMap──▶ gateway (bounded-elastic)
 *                                            ↘ notify  (fire-and-forget)
 * </pre>
 *
 * <p>Writes are queued in the order the engine applied the changes and run one at a time, so an
 * experience's active-mirror insert always lands before the history move that deletes it.
 *
 * <p>The engine's in-memory state is authoritative. A failed write raises the resync flag and
 * the next batch boundary (or the maintenance loop) saves the full strategy set and Q-table
 * instead of just the touched contexts.
 */
@Service
public class LearningOrchestrator {

    private static final Logger log = LoggerFactory.getLogger(LearningOrchestrator.class);

    private static final Duration HYDRATE_TIMEOUT  = Duration.ofSeconds(30);
    private static final Duration SHUTDOWN_TIMEOUT = Duration.ofSeconds(10);

    private final QLearningEngine engine;
    private final PersistenceGateway gateway;
    private final LearningEventPublisher publisher;
    private final Clock clock;
    private final Scheduler persistenceScheduler;
    private final AtomicBoolean resyncRequired = new AtomicBoolean(false);

    /** Guards engine mutation plus write enqueue so queue order matches engine order. */
    private final Object writeOrder = new Object();
    private final Sinks.Many<PendingWrite> writeQueue = Sinks.many().unicast().onBackpressureBuffer();

    private record PendingWrite(Mono<Void> writes, String operation) {}

    @Autowired
    public LearningOrchestrator(QLearningEngine engine,
                                PersistenceGateway gateway,
                                LearningEventPublisher publisher) {
        this(engine, gateway, publisher, Clock.systemUTC(), Schedulers.boundedElastic());
    }

    public LearningOrchestrator(QLearningEngine engine,
                                PersistenceGateway gateway,
                                LearningEventPublisher publisher,
                                Clock clock,
                                Scheduler persistenceScheduler) {
        this.engine               = engine;
        this.gateway              = gateway;
        this.publisher            = publisher;
        this.clock                = clock;
        this.persistenceScheduler = persistenceScheduler;

        writeQueue.asFlux()
            .concatMap(this::runWrite, 1)
            .subscribe();
    }

    // ── Lifecycle ───────────────────────────────────────────────────────────

    /**
     * Rebuilds the engine from the durable store. An unreachable store is not fatal:
     * the engine starts empty and the first save writes the full state.
     */
    @PostConstruct
    public void start() {
        hydrate()
            .timeout(HYDRATE_TIMEOUT)
            .onErrorResume(e -> {
                log.warn("[Startup] Hydration failed, starting with empty learning state", e);
                resyncRequired.set(true);
                return Mono.empty();
            })
            .block();
    }

    public Mono<Void> hydrate() {
        int historyLimit = engine.config().historyCapacity();
        return Mono.zip(gateway.loadStrategies(), gateway.loadQTable(),
                        gateway.loadExperiences(), gateway.loadHistory(historyLimit))
            .map(t -> new EngineState(t.getT1(), t.getT2(), t.getT3(), t.getT4()))
            .doOnNext(state -> {
                engine.restore(state);
                log.info("[Startup] Learning state hydrated. strategies={} contexts={} pending={} history={}",
                         state.strategies().size(), state.qTable().size(),
                         state.active().size(), state.history().size());
            })
            .then();
    }

    @PreDestroy
    public void shutdown() {
        saveAll()
            .timeout(SHUTDOWN_TIMEOUT)
            .doOnSuccess(v -> log.info("[Shutdown] Final learning state saved"))
            .onErrorResume(e -> {
                log.warn("[Shutdown] Final save failed; state since the last successful save is lost", e);
                return Mono.empty();
            })
            .block();
    }

    // ── Learning ────────────────────────────────────────────────────────────

    /**
     * Enqueues one experience. Validation errors surface as the Mono's error signal;
     * persistence and notification never affect the result.
     */
    public Mono<LearnAck> learnFromExperience(LearnRequest request) {
        String correlationId = CorrelationContext.orNew(request.correlationId());
        return Mono.fromCallable(() -> {
                if (request.reward() == null) {
                    throw new InvalidRewardException(Double.NaN);
                }
                Map<String, Object> metadata = withCorrelation(request.metadata(), correlationId);
                ExperienceReceipt receipt;
                synchronized (writeOrder) {
                    receipt = engine.addExperience(request.context(), request.action(), request.reward(), metadata);
                    persistReceipt(receipt);
                }
                notifyLearned(receipt, correlationId);
                return toAck(receipt, correlationId);
            })
            .doOnError(RlDomainException.class, e -> CorrelationContext.withMdc(correlationId, () ->
                log.warn("Experience rejected. errorCode={} message={} correlationId={}",
                         e.getErrorCode(), e.getMessage(), correlationId)));
    }

    /** Runs a learning batch now. Returns zero counts when nothing is pending. */
    public Mono<BatchResult> forceProcess() {
        return Mono.fromCallable(() -> {
                synchronized (writeOrder) {
                    BatchResult batch = engine.processExperiences();
                    if (!batch.isEmpty()) {
                        enqueue(persistBatch(batch), "forceProcess");
                    }
                    return batch;
                }
            })
            .doOnNext(batch -> {
                log.info("[Batch] Forced processing completed. processed={} dropped={} created={} updated={}",
                         batch.experiencesProcessed(), batch.experiencesDropped(),
                         batch.strategiesCreated(), batch.strategiesUpdated());
                if (!batch.isEmpty()) {
                    publisher.publishBatchProcessed(toEvent(batch));
                }
            });
    }

    /**
     * Turns a completed-outcome event into a reward and learns from it.
     *
     * @throws IllegalArgumentException (as error signal) when the event carries no type
     */
    public Mono<LearnAck> handleExternalEvent(OutcomeEvent event) {
        return Mono.fromCallable(() -> RewardCalculator.compute(event))
            .flatMap(reward -> {
                Map<String, Object> metadata = new LinkedHashMap<>();
                metadata.put("eventType", event.eventType().value());
                if (event.eventId() != null) metadata.put("eventId", event.eventId());
                if (event.source() != null)  metadata.put("source", event.source());
                metadata.putAll(event.metrics());
                log.info("Outcome event received. type={} eventId={} context={} action={} reward={}",
                         event.eventType().value(), event.eventId(), event.context(), event.action(), reward);
                return learnFromExperience(
                    new LearnRequest(event.context(), event.action(), reward, metadata, event.correlationId()));
            });
    }

    // ── Acting ──────────────────────────────────────────────────────────────

    public Mono<ActionResponse> generateAction(ActionRequest request) {
        String correlationId = CorrelationContext.orNew(request.correlationId());
        return Mono.fromCallable(() -> {
                if (request.currentState() == null) {
                    throw new IllegalArgumentException("currentState is required");
                }
                CampaignContext context = request.currentState().toContext();
                CampaignMetrics metrics = request.currentState().toMetrics();
                ActionDecision decision = engine.generateAction(context, metrics, request.availableActions());

                CorrelationContext.withMdc(correlationId, () ->
                    log.info("Action generated. context={} action={} path={} confidence={} correlationId={}",
                             decision.normalizedContext(), decision.action(), decision.path(),
                             decision.confidence(), correlationId));

                return new ActionResponse(decision.action(), decision.confidence(), decision.reasoning(),
                    decision.path(), decision.normalizedContext(), context, metrics, decision.timestamp(),
                    correlationId, engineStatus(decision.normalizedContext()));
            });
    }

    // ── Read views ──────────────────────────────────────────────────────────

    public List<Strategy> strategies() {
        return engine.strategies();
    }

    /** Strategy of a raw (not yet normalized) context. */
    public Optional<Strategy> strategy(String context) {
        return engine.strategy(ContextNormalizer.normalize(context));
    }

    public Optional<BestActionResponse> bestAction(String context) {
        return strategy(context)
            .filter(Strategy::hasBestAction)
            .map(s -> new BestActionResponse(s.context(), s.bestAction(), s.bestQValue(),
                                             s.confidence(), s.totalExperiences()));
    }

    public List<AvailableAction> availableActions() {
        return Arrays.stream(ActionType.values())
            .map(a -> new AvailableAction(a.value(), a.description()))
            .toList();
    }

    public BufferStatus activeBufferStatus() {
        return BufferStatus.of("active", engine.activeSnapshot(), engine.config().activeCapacity());
    }

    public BufferStatus historyBufferStatus() {
        return BufferStatus.of("history", engine.historySnapshot(), engine.config().historyCapacity());
    }

    public LearningMetrics metrics() {
        return engine.getLearningMetrics();
    }

    public QLearningConfig config() {
        return engine.config();
    }

    public boolean isResyncRequired() {
        return resyncRequired.get();
    }

    // ── Maintenance ─────────────────────────────────────────────────────────

    /** Saves the full strategy set and Q-table. Clears the resync flag on success. */
    public Mono<Void> saveAll() {
        EngineState state = engine.snapshot();
        return gateway.saveStrategies(state.strategies())
            .then(gateway.saveQTable(state.qTable()))
            .doOnSuccess(v -> {
                resyncRequired.set(false);
                log.info("[Save] Full learning state saved. strategies={} contexts={}",
                         state.strategies().size(), state.qTable().size());
            })
            .doOnError(e -> resyncRequired.set(true));
    }

    /** Deletes archived experiences older than the configured retention. */
    public Mono<Long> cleanupHistory() {
        Instant cutoff = clock.instant().minus(engine.config().historyRetention());
        return gateway.cleanupOldHistory(cutoff);
    }

    // ── Persistence side path ───────────────────────────────────────────────

    private void persistReceipt(ExperienceReceipt receipt) {
        Mono<Void> writes = gateway.saveExperience(receipt.experience());
        if (receipt.droppedOnOverflow() != null) {
            writes = writes.then(gateway.saveToHistory(List.of(receipt.droppedOnOverflow())));
            log.warn("Active buffer full, oldest experience dropped. droppedId={} context={}",
                     receipt.droppedOnOverflow().id(), receipt.droppedOnOverflow().context());
        }
        if (receipt.batch() != null) {
            writes = writes.then(persistBatch(receipt.batch()));
        }
        enqueue(writes, "learnFromExperience");
    }

    private void notifyLearned(ExperienceReceipt receipt, String correlationId) {
        Experience experience = receipt.experience();
        publisher.publishExperienceLearned(new ExperienceLearnedEvent(
            ExperienceLearnedEvent.TYPE, experience.id(), experience.context(), experience.action(),
            experience.reward(), receipt.activeBufferSize(), receipt.autoProcessed(), correlationId,
            clock.instant()));

        if (receipt.batch() != null) {
            BatchResult batch = receipt.batch();
            log.info("[Batch] Auto processing completed. processed={} dropped={} created={} updated={} contexts={}",
                     batch.experiencesProcessed(), batch.experiencesDropped(), batch.strategiesCreated(),
                     batch.strategiesUpdated(), batch.touchedContexts());
            publisher.publishBatchProcessed(toEvent(batch));
        }
    }

    /** Touched strategies and Q-rows, or everything when a previous write failed; then the archive. */
    private Mono<Void> persistBatch(BatchResult batch) {
        Mono<Void> state;
        if (resyncRequired.get()) {
            state = Mono.defer(this::saveAll);
        } else {
            List<Strategy> touched = engine.strategies(batch.touchedContexts());
            Map<String, Map<String, Double>> rows = engine.qTableSnapshot(batch.touchedContexts());
            state = gateway.saveStrategies(touched).then(gateway.saveQTable(rows));
        }
        return state.then(gateway.saveToHistory(new ArrayList<>(batch.archived())));
    }

    /** Called while holding {@link #writeOrder}. */
    private void enqueue(Mono<Void> writes, String operation) {
        Sinks.EmitResult result = writeQueue.tryEmitNext(new PendingWrite(writes, operation));
        if (result.isFailure()) {
            resyncRequired.set(true);
            log.warn("Persistence write not queued, full resync scheduled. operation={} reason={}",
                     operation, result);
        }
    }

    private Mono<Void> runWrite(PendingWrite pending) {
        return pending.writes()
            .subscribeOn(persistenceScheduler)
            .onErrorResume(err -> {
                resyncRequired.set(true);
                log.warn("Persistence write failed (non-fatal), full resync scheduled. operation={}",
                         pending.operation(), err);
                return Mono.empty();
            });
    }

    // ── Mapping ─────────────────────────────────────────────────────────────

    private EngineStatus engineStatus(String normalizedContext) {
        long experiences = engine.strategy(normalizedContext).map(Strategy::totalExperiences).orElse(0L);
        return new EngineStatus(activeBufferStatus(), historyBufferStatus(),
            engine.strategies().size(), experiences);
    }

    private LearnAck toAck(ExperienceReceipt receipt, String correlationId) {
        Experience e = receipt.experience();
        return new LearnAck(e.id(), e.context(), e.action(), e.reward(),
            receipt.activeBufferSize(), receipt.historyBufferSize(), receipt.totalStrategies(),
            receipt.autoProcessed(),
            receipt.droppedOnOverflow() != null ? receipt.droppedOnOverflow().id() : null,
            receipt.batch(), correlationId, clock.instant());
    }

    private static BatchProcessedEvent toEvent(BatchResult batch) {
        return new BatchProcessedEvent(BatchProcessedEvent.TYPE, batch.experiencesProcessed(),
            batch.experiencesDropped(), batch.strategiesCreated(), batch.strategiesUpdated(),
            batch.avgQValue(), batch.totalStrategies(), batch.touchedContexts(), batch.completedAt());
    }

    private static Map<String, Object> withCorrelation(Map<String, Object> metadata, String correlationId) {
        Map<String, Object> merged = new LinkedHashMap<>();
        if (metadata != null) merged.putAll(metadata);
        merged.put("correlationId", correlationId);
        return merged;
    }
}
