package com.campaignrl.rlengine.controller;

import com.campaignrl.common.event.OutcomeEvent;
import com.campaignrl.common.exception.RlDomainException;
import com.campaignrl.common.model.Strategy;
import com.campaignrl.common.qlearning.BatchResult;
import com.campaignrl.common.qlearning.LearningMetrics;
import com.campaignrl.common.qlearning.QLearningConfig;
import com.campaignrl.rlengine.dto.ActionRequest;
import com.campaignrl.rlengine.dto.ActionResponse;
import com.campaignrl.rlengine.dto.AvailableAction;
import com.campaignrl.rlengine.dto.BestActionResponse;
import com.campaignrl.rlengine.dto.BufferStatus;
import com.campaignrl.rlengine.dto.ErrorResponse;
import com.campaignrl.rlengine.dto.HealthResponse;
import com.campaignrl.rlengine.dto.EventAccepted;
import com.campaignrl.rlengine.dto.LearnAck;
import com.campaignrl.rlengine.dto.LearnRequest;
import com.campaignrl.rlengine.ingest.OutcomeEventIngestor;
import com.campaignrl.rlengine.service.LearningOrchestrator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import reactor.core.publisher.Mono;

import java.util.List;

@RestController
@RequestMapping("/api/v1")
public class RlEngineController {

    private static final Logger log = LoggerFactory.getLogger(RlEngineController.class);

    private final LearningOrchestrator orchestrator;
    private final OutcomeEventIngestor ingestor;

    public RlEngineController(LearningOrchestrator orchestrator, OutcomeEventIngestor ingestor) {
        this.orchestrator = orchestrator;
        this.ingestor     = ingestor;
    }

    // ── Actions ─────────────────────────────────────────────────────────────

    @PostMapping("/actions/generate")
    public Mono<ResponseEntity<ActionResponse>> generate(@RequestBody ActionRequest request) {
        return orchestrator.generateAction(request).map(ResponseEntity::ok);
    }

    @GetMapping("/actions/available")
    public ResponseEntity<List<AvailableAction>> available() {
        return ResponseEntity.ok(orchestrator.availableActions());
    }

    @GetMapping("/actions/best")
    public ResponseEntity<BestActionResponse> best(@RequestParam String context) {
        return orchestrator.bestAction(context)
            .map(ResponseEntity::ok)
            .orElseGet(() -> ResponseEntity.notFound().build());
    }

    // ── Learning ────────────────────────────────────────────────────────────

    @PostMapping("/learn")
    public Mono<ResponseEntity<LearnAck>> learn(@RequestBody LearnRequest request) {
        log.info("Learn request received. context={} action={} reward={} correlationId={}",
                 request.context(), request.action(), request.reward(), request.correlationId());
        return orchestrator.learnFromExperience(request).map(ResponseEntity::ok);
    }

    @PostMapping("/force_process")
    public Mono<ResponseEntity<BatchResult>> forceProcess() {
        log.info("Force process requested");
        return orchestrator.forceProcess().map(ResponseEntity::ok);
    }

    /** Queues the event; 202 when accepted, 503 when the ingest queue is full. */
    @PostMapping("/events")
    public ResponseEntity<EventAccepted> events(@RequestBody OutcomeEvent event) {
        if (event.eventType() == null) {
            throw new IllegalArgumentException("eventType is required");
        }
        boolean accepted = ingestor.submit(event);
        EventAccepted body = new EventAccepted(event.eventId(), accepted, ingestor.queued());
        return ResponseEntity.status(accepted ? HttpStatus.ACCEPTED : HttpStatus.SERVICE_UNAVAILABLE).body(body);
    }

    // ── Read views ──────────────────────────────────────────────────────────

    @GetMapping("/strategies")
    public ResponseEntity<List<Strategy>> strategies() {
        return ResponseEntity.ok(orchestrator.strategies());
    }

    @GetMapping("/strategies/{context}")
    public ResponseEntity<Strategy> strategy(@PathVariable String context) {
        return orchestrator.strategy(context)
            .map(ResponseEntity::ok)
            .orElseGet(() -> ResponseEntity.notFound().build());
    }

    @GetMapping("/buffer/active")
    public ResponseEntity<BufferStatus> activeBuffer() {
        return ResponseEntity.ok(orchestrator.activeBufferStatus());
    }

    @GetMapping("/buffer/history")
    public ResponseEntity<BufferStatus> historyBuffer() {
        return ResponseEntity.ok(orchestrator.historyBufferStatus());
    }

    @GetMapping("/metrics")
    public ResponseEntity<LearningMetrics> metrics() {
        return ResponseEntity.ok(orchestrator.metrics());
    }

    @GetMapping("/config")
    public ResponseEntity<QLearningConfig> config() {
        return ResponseEntity.ok(orchestrator.config());
    }

    @GetMapping("/health")
    public ResponseEntity<HealthResponse> health() {
        boolean resync = orchestrator.isResyncRequired();
        return ResponseEntity.ok(new HealthResponse(
            resync ? HealthResponse.DEGRADED : HealthResponse.UP, resync,
            orchestrator.strategies().size(), orchestrator.activeBufferStatus().size(), ingestor.queued()));
    }

    // ── Error mapping ───────────────────────────────────────────────────────

    @ExceptionHandler(RlDomainException.class)
    public ResponseEntity<ErrorResponse> onDomainError(RlDomainException e) {
        return ResponseEntity.badRequest().body(new ErrorResponse(e.getErrorCode(), e.getMessage()));
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<ErrorResponse> onBadRequest(IllegalArgumentException e) {
        return ResponseEntity.badRequest().body(new ErrorResponse("BAD_REQUEST", e.getMessage()));
    }
}
