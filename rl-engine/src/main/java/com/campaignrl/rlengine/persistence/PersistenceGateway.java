package com.campaignrl.rlengine.persistence;

import com.campaignrl.common.model.Experience;
import com.campaignrl.common.model.Strategy;
import reactor.core.publisher.Mono;

import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.Map;

/**
 * Durable store of the learning state.
 *
 * <p>Every operation signals {@link com.campaignrl.common.exception.PersistenceUnavailableException}
 * when the store cannot be reached. Saves are idempotent upserts; replaying a save after a
 * partial failure is safe.
 */
public interface PersistenceGateway {

    Mono<Void> saveStrategies(Collection<Strategy> strategies);

    Mono<List<Strategy>> loadStrategies();

    Mono<Void> saveQTable(Map<String, Map<String, Double>> rows);

    /** Rows keyed by context; action order per row follows first insertion. */
    Mono<Map<String, Map<String, Double>>> loadQTable();

    /** Mirrors one pending experience of the active buffer. */
    Mono<Void> saveExperience(Experience experience);

    /** Pending experiences, oldest first. */
    Mono<List<Experience>> loadExperiences();

    /** Archives terminal experiences and removes the same ids from the active mirror. */
    Mono<Void> saveToHistory(Collection<Experience> experiences);

    /** At most {@code limit} newest archived experiences, oldest first. */
    Mono<List<Experience>> loadHistory(int limit);

    /** @return number of archived experiences removed */
    Mono<Long> cleanupOldHistory(Instant cutoff);
}
