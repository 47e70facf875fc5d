package com.campaignrl.rlengine.persistence;

import com.campaignrl.common.exception.PersistenceUnavailableException;
import com.campaignrl.common.model.ActionStats;
import com.campaignrl.common.model.Experience;
import com.campaignrl.common.model.ExperienceStatus;
import com.campaignrl.common.model.Strategy;
import com.campaignrl.rlengine.persistence.model.ExperienceRecord;
import com.campaignrl.rlengine.persistence.model.HistoryRecord;
import com.campaignrl.rlengine.persistence.model.QValueRecord;
import com.campaignrl.rlengine.persistence.model.StrategyRecord;
import com.campaignrl.rlengine.persistence.repository.ExperienceRepository;
import com.campaignrl.rlengine.persistence.repository.HistoryRepository;
import com.campaignrl.rlengine.persistence.repository.QValueRepository;
import com.campaignrl.rlengine.persistence.repository.StrategyRepository;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * PostgreSQL-backed {@link PersistenceGateway} on Spring Data R2DBC.
 *
 * <p>Tables: {@code rl_strategies}, {@code rl_q_values}, {@code rl_experiences} (active mirror),
 * {@code rl_experience_history}. Map-valued fields are stored as JSON text. Timestamps are
 * stored as UTC {@link LocalDateTime}.
 */
@Component
public class R2dbcPersistenceGateway implements PersistenceGateway {

    private static final Logger log = LoggerFactory.getLogger(R2dbcPersistenceGateway.class);

    private static final TypeReference<Map<String, ActionStats>> STATS_TYPE   = new TypeReference<>() {};
    private static final TypeReference<Map<String, Double>>      QVALUES_TYPE = new TypeReference<>() {};
    private static final TypeReference<Map<String, Object>>      META_TYPE    = new TypeReference<>() {};

    private final StrategyRepository strategyRepository;
    private final QValueRepository qValueRepository;
    private final ExperienceRepository experienceRepository;
    private final HistoryRepository historyRepository;
    private final ObjectMapper objectMapper;

    public R2dbcPersistenceGateway(StrategyRepository strategyRepository,
                                   QValueRepository qValueRepository,
                                   ExperienceRepository experienceRepository,
                                   HistoryRepository historyRepository,
                                   ObjectMapper objectMapper) {
        this.strategyRepository   = strategyRepository;
        this.qValueRepository     = qValueRepository;
        this.experienceRepository = experienceRepository;
        this.historyRepository    = historyRepository;
        this.objectMapper         = objectMapper;
    }

    // ── Strategies ──────────────────────────────────────────────────────────

    @Override
    public Mono<Void> saveStrategies(Collection<Strategy> strategies) {
        return Flux.fromIterable(strategies)
            .concatMap(s -> strategyRepository.upsert(
                s.context(), s.bestAction(), s.bestQValue(), s.totalExperiences(), s.confidence(),
                toJson(s.actionStats()), toJson(s.qValues()), s.algorithmVersion(),
                toUtc(s.createdAt()), toUtc(s.lastUpdated())))
            .then()
            .doOnSuccess(v -> log.debug("Strategies saved. count={}", strategies.size()))
            .onErrorMap(e -> unavailable("saveStrategies", e));
    }

    @Override
    public Mono<List<Strategy>> loadStrategies() {
        return strategyRepository.findAll()
            .map(this::toStrategy)
            .collectList()
            .onErrorMap(e -> unavailable("loadStrategies", e));
    }

    // ── Q-table ─────────────────────────────────────────────────────────────

    @Override
    public Mono<Void> saveQTable(Map<String, Map<String, Double>> rows) {
        return Flux.fromIterable(rows.entrySet())
            .concatMap(row -> Flux.fromIterable(row.getValue().entrySet())
                .concatMap(cell -> qValueRepository.upsert(row.getKey(), cell.getKey(), cell.getValue())))
            .then()
            .onErrorMap(e -> unavailable("saveQTable", e));
    }

    @Override
    public Mono<Map<String, Map<String, Double>>> loadQTable() {
        return qValueRepository.findAllInInsertionOrder()
            .collectList()
            .map(records -> {
                Map<String, Map<String, Double>> table = new LinkedHashMap<>();
                for (QValueRecord r : records) {
                    table.computeIfAbsent(r.getContext(), k -> new LinkedHashMap<>()).put(r.getAction(), r.getQValue());
                }
                return table;
            })
            .onErrorMap(e -> unavailable("loadQTable", e));
    }

    // ── Active mirror ───────────────────────────────────────────────────────

    @Override
    public Mono<Void> saveExperience(Experience e) {
        return Mono.fromCallable(() -> toJson(e.metadata()))
            .flatMap(meta -> experienceRepository.insertIfAbsent(
                e.id(), e.context(), e.action(), e.reward(), e.status().name(), meta, toUtc(e.timestamp())))
            .onErrorMap(err -> unavailable("saveExperience", err));
    }

    @Override
    public Mono<List<Experience>> loadExperiences() {
        return experienceRepository.findAllOldestFirst()
            .map(this::toExperience)
            .collectList()
            .onErrorMap(e -> unavailable("loadExperiences", e));
    }

    // ── History ─────────────────────────────────────────────────────────────

    @Override
    public Mono<Void> saveToHistory(Collection<Experience> experiences) {
        if (experiences.isEmpty()) {
            return Mono.empty();
        }
        List<String> ids = experiences.stream().map(Experience::id).toList();
        return Flux.fromIterable(experiences)
            .concatMap(e -> historyRepository.upsert(
                e.id(), e.context(), e.action(), e.reward(), e.status().name(), toJson(e.metadata()),
                toUtc(e.timestamp()), toUtc(e.processedAt())))
            .then(experienceRepository.deleteByExperienceIds(ids))
            .then()
            .onErrorMap(e -> unavailable("saveToHistory", e));
    }

    @Override
    public Mono<List<Experience>> loadHistory(int limit) {
        return historyRepository.findRecent(limit)
            .map(this::toExperience)
            .collectList()
            .onErrorMap(e -> unavailable("loadHistory", e));
    }

    @Override
    public Mono<Long> cleanupOldHistory(Instant cutoff) {
        return historyRepository.deleteOlderThan(toUtc(cutoff))
            .map(Integer::longValue)
            .doOnSuccess(n -> log.info("History cleanup completed. removed={} cutoff={}", n, cutoff))
            .onErrorMap(e -> unavailable("cleanupOldHistory", e));
    }

    // ── Entity Mapping ──────────────────────────────────────────────────────

    private Strategy toStrategy(StrategyRecord r) {
        try {
            Map<String, ActionStats> stats = r.getActionStats() != null
                ? objectMapper.readValue(r.getActionStats(), STATS_TYPE) : Map.of();
            Map<String, Double> qValues = r.getQValues() != null
                ? objectMapper.readValue(r.getQValues(), QVALUES_TYPE) : Map.of();
            return new Strategy(r.getContext(), r.getBestAction(), r.getBestQValue(), r.getTotalExperiences(),
                r.getConfidence(), stats, qValues, toInstant(r.getCreatedAt()), toInstant(r.getLastUpdated()),
                r.getAlgorithmVersion());
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Corrupt strategy row. context=" + r.getContext(), e);
        }
    }

    private Experience toExperience(ExperienceRecord r) {
        return new Experience(r.getExperienceId(), r.getContext(), r.getAction(), r.getReward(),
            toInstant(r.getCreatedAt()), ExperienceStatus.valueOf(r.getStatus()), null, fromJson(r.getMetadata()));
    }

    private Experience toExperience(HistoryRecord r) {
        return new Experience(r.getExperienceId(), r.getContext(), r.getAction(), r.getReward(),
            toInstant(r.getCreatedAt()), ExperienceStatus.valueOf(r.getStatus()), toInstant(r.getProcessedAt()),
            fromJson(r.getMetadata()));
    }

    private String toJson(Object value) {
        try {
            return objectMapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize value for persistence", e);
        }
    }

    private Map<String, Object> fromJson(String json) {
        if (json == null || json.isBlank()) return Map.of();
        try {
            return objectMapper.readValue(json, META_TYPE);
        } catch (JsonProcessingException e) {
            log.warn("Unreadable experience metadata ignored. cause={}", e.getMessage());
            return Map.of();
        }
    }

    private static LocalDateTime toUtc(Instant instant) {
        return instant != null ? LocalDateTime.ofInstant(instant, ZoneOffset.UTC) : null;
    }

    private static Instant toInstant(LocalDateTime time) {
        return time != null ? time.toInstant(ZoneOffset.UTC) : null;
    }

    private static PersistenceUnavailableException unavailable(String operation, Throwable cause) {
        if (cause instanceof PersistenceUnavailableException pue) {
            return pue;
        }
        return new PersistenceUnavailableException(operation, cause);
    }
}
