package com.campaignrl.rlengine.persistence.repository;

import com.campaignrl.rlengine.persistence.model.QValueRecord;
import org.springframework.data.r2dbc.repository.Modifying;
import org.springframework.data.r2dbc.repository.Query;
import org.springframework.data.repository.reactive.ReactiveCrudRepository;
import org.springframework.stereotype.Repository;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

@Repository
public interface QValueRepository extends ReactiveCrudRepository<QValueRecord, Long> {

    /** Rows ordered by insertion so per-context action order survives a restart. */
    @Query("SELECT * FROM rl_q_values ORDER BY id ASC")
    Flux<QValueRecord> findAllInInsertionOrder();

    @Modifying
    @Query("""
        INSERT INTO rl_q_values (context, action, q_value, updated_at)
        VALUES (:context, :action, :qValue, NOW())
        ON CONFLICT (context, action) DO UPDATE SET
            q_value    = :qValue,
            updated_at = NOW()
        """)
    Mono<Void> upsert(String context, String action, double qValue);
}
