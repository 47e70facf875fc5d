package com.campaignrl.rlengine.persistence.repository;

import com.campaignrl.rlengine.persistence.model.HistoryRecord;
import org.springframework.data.r2dbc.repository.Modifying;
import org.springframework.data.r2dbc.repository.Query;
import org.springframework.data.repository.reactive.ReactiveCrudRepository;
import org.springframework.stereotype.Repository;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.LocalDateTime;

@Repository
public interface HistoryRepository extends ReactiveCrudRepository<HistoryRecord, String> {

    /** Newest {@code limit} archived experiences, returned oldest first. */
    @Query("""
        SELECT * FROM (
            SELECT * FROM rl_experience_history
            ORDER BY created_at DESC
            LIMIT :limit
        ) recent
        ORDER BY created_at ASC
        """)
    Flux<HistoryRecord> findRecent(int limit);

    @Modifying
    @Query("""
        INSERT INTO rl_experience_history
            (experience_id, context, action, reward, status, metadata, created_at, processed_at)
        VALUES
            (:experienceId, :context, :action, :reward, :status, :metadata, :createdAt, :processedAt)
        ON CONFLICT (experience_id) DO UPDATE SET
            status       = :status,
            processed_at = :processedAt
        """)
    Mono<Void> upsert(String experienceId, String context, String action, double reward,
                      String status, String metadata, LocalDateTime createdAt, LocalDateTime processedAt);

    @Modifying
    @Query("DELETE FROM rl_experience_history WHERE created_at < :cutoff")
    Mono<Integer> deleteOlderThan(LocalDateTime cutoff);
}
