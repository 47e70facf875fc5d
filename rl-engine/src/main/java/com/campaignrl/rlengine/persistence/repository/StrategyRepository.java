package com.campaignrl.rlengine.persistence.repository;

import com.campaignrl.rlengine.persistence.model.StrategyRecord;
import org.springframework.data.r2dbc.repository.Modifying;
import org.springframework.data.r2dbc.repository.Query;
import org.springframework.data.repository.reactive.ReactiveCrudRepository;
import org.springframework.stereotype.Repository;
import reactor.core.publisher.Mono;

import java.time.LocalDateTime;

@Repository
public interface StrategyRepository extends ReactiveCrudRepository<StrategyRecord, String> {

    /**
     * Atomic UPSERT keyed on the normalized context. {@code created_at} is only
     * written on first insert.
     */
    @Modifying
    @Query("""
        INSERT INTO rl_strategies
            (context, best_action, best_q_value, total_experiences, confidence,
             action_stats, q_values, algorithm_version, created_at, last_updated)
        VALUES
            (:context, :bestAction, :bestQValue, :totalExperiences, :confidence,
             :actionStats, :qValues, :algorithmVersion, :createdAt, :lastUpdated)
        ON CONFLICT (context) DO UPDATE SET
            best_action       = :bestAction,
            best_q_value      = :bestQValue,
            total_experiences = :totalExperiences,
            confidence        = :confidence,
            action_stats      = :actionStats,
            q_values          = :qValues,
            algorithm_version = :algorithmVersion,
            last_updated      = :lastUpdated
        """)
    Mono<Void> upsert(String context, String bestAction, double bestQValue, long totalExperiences,
                      double confidence, String actionStats, String qValues, String algorithmVersion,
                      LocalDateTime createdAt, LocalDateTime lastUpdated);
}
