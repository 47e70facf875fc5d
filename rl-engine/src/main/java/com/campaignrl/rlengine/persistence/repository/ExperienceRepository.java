package com.campaignrl.rlengine.persistence.repository;

import com.campaignrl.rlengine.persistence.model.ExperienceRecord;
import org.springframework.data.r2dbc.repository.Modifying;
import org.springframework.data.r2dbc.repository.Query;
import org.springframework.data.repository.reactive.ReactiveCrudRepository;
import org.springframework.stereotype.Repository;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.LocalDateTime;
import java.util.Collection;

@Repository
public interface ExperienceRepository extends ReactiveCrudRepository<ExperienceRecord, String> {

    @Query("SELECT * FROM rl_experiences ORDER BY created_at ASC")
    Flux<ExperienceRecord> findAllOldestFirst();

    /** Idempotent insert; a replayed save of the same experience is a no-op. */
    @Modifying
    @Query("""
        INSERT INTO rl_experiences (experience_id, context, action, reward, status, metadata, created_at)
        VALUES (:experienceId, :context, :action, :reward, :status, :metadata, :createdAt)
        ON CONFLICT (experience_id) DO NOTHING
        """)
    Mono<Void> insertIfAbsent(String experienceId, String context, String action, double reward,
                              String status, String metadata, LocalDateTime createdAt);

    @Modifying
    @Query("DELETE FROM rl_experiences WHERE experience_id IN (:ids)")
    Mono<Integer> deleteByExperienceIds(Collection<String> ids);
}
