package com.campaignrl.common.qlearning;

import com.campaignrl.common.buffer.DualBuffer;
import com.campaignrl.common.context.ContextNormalizer;
import com.campaignrl.common.exception.InvalidRewardException;
import com.campaignrl.common.exception.NoActionsRecordedException;
import com.campaignrl.common.exception.RlDomainException;
import com.campaignrl.common.heuristic.HeuristicActionSelector;
import com.campaignrl.common.model.ActionDecision;
import com.campaignrl.common.model.ActionStats;
import com.campaignrl.common.model.ActionType;
import com.campaignrl.common.model.CampaignContext;
import com.campaignrl.common.model.CampaignMetrics;
import com.campaignrl.common.model.DecisionPath;
import com.campaignrl.common.model.Experience;
import com.campaignrl.common.model.ExperienceStatus;
import com.campaignrl.common.model.Strategy;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Random;
import java.util.UUID;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.stream.Collectors;

/**
 * Tabular Q-Learning engine: single owner of the Q-table, the dual buffer and the
 * per-context strategy set.
 *
 * <h3>Learning</h3>
 * Experiences are validated, normalized and queued. A batch drains the queue and applies
 * {@code Q(s,a) ← Q(s,a) + α·[R + γ·max_a' Q(s',a') − Q(s,a)]} per experience. No successor
 * state is observed for a campaign action, so the experience's own context is used as the
 * lookahead state {@code s'}. Every context touched by a batch gets its {@link Strategy}
 * re-derived from the updated Q-table row.
 *
 * <h3>Acting</h3>
 * Epsilon-greedy: with probability ε a uniformly random candidate, otherwise the argmax of
 * the context's row; unseen contexts fall back to {@link HeuristicActionSelector}.
 *
 * <h3>Concurrency</h3>
 * Mutations ({@link #addExperience}, {@link #processExperiences}, {@link #restore}) hold the
 * write lock. {@link #generateAction} and the read accessors share the read lock, so action
 * requests run in parallel with each other but never alongside a batch.
 * No I/O happens under either lock.
 */
public class QLearningEngine {

    public static final int METRICS_WINDOW = 1000;

    /** Exploration reports half of the learned confidence: the action was not chosen on merit. */
    private static final double EXPLORATION_CONFIDENCE_FACTOR = 0.5;

    private static final List<String> VOCABULARY = Arrays.stream(ActionType.values())
        .map(ActionType::value)
        .toList();

    private final QLearningConfig config;
    private final QTable qTable;
    private final DualBuffer buffer;
    private final Map<String, Strategy> strategies = new LinkedHashMap<>();
    private final Clock clock;
    private final Random random;
    private final ReentrantReadWriteLock lock = new ReentrantReadWriteLock();

    private final AtomicLong totalActions              = new AtomicLong();
    private final AtomicLong totalLearningSessions     = new AtomicLong();
    private final AtomicLong totalExperiencesProcessed = new AtomicLong();
    private final AtomicLong totalExperiencesDropped   = new AtomicLong();

    private final RollingWindow confidenceWindow = new RollingWindow(METRICS_WINDOW);
    private final RollingWindow rewardWindow     = new RollingWindow(METRICS_WINDOW);
    private final RollingWindow qValueWindow     = new RollingWindow(METRICS_WINDOW);

    public QLearningEngine(QLearningConfig config) {
        this(config, Clock.systemUTC(), new Random());
    }

    public QLearningEngine(QLearningConfig config, Clock clock, Random random) {
        this.config = config;
        this.clock  = clock;
        this.random = random;
        this.qTable = new QTable(config.learningRate(), config.discountFactor());
        this.buffer = new DualBuffer(config.activeCapacity(), config.historyCapacity(),
            config.autoProcessThreshold(), config.historyRetention(), clock);
    }

    // ── Learning ────────────────────────────────────────────────────────────

    public ExperienceReceipt addExperience(String context, String action, double reward) {
        return addExperience(context, action, reward, Map.of());
    }

    /**
     * Validates and enqueues one experience; runs a batch when the auto-process threshold
     * is reached. Nothing is mutated when validation fails.
     *
     * @throws InvalidRewardException  reward NaN or outside [-1.0, 1.0]
     * @throws com.campaignrl.common.exception.InvalidContextException blank context
     * @throws com.campaignrl.common.exception.InvalidActionException  action outside the vocabulary
     */
    public ExperienceReceipt addExperience(String context, String action, double reward,
                                           Map<String, Object> metadata) {
        requireValidReward(reward);
        String key       = ContextNormalizer.normalize(context);
        String canonical = ActionType.fromValue(action).value();

        Experience experience = Experience.pending(UUID.randomUUID().toString(), key, canonical,
            reward, clock.instant(), metadata);

        lock.writeLock().lock();
        try {
            Optional<Experience> dropped = buffer.add(experience);
            dropped.ifPresent(d -> totalExperiencesDropped.incrementAndGet());
            rewardWindow.add(reward);

            BatchResult batch = buffer.shouldAutoProcess() ? processLocked() : null;
            return new ExperienceReceipt(experience, dropped.orElse(null), batch,
                buffer.activeSize(), buffer.historySize(), strategies.size());
        } finally {
            lock.writeLock().unlock();
        }
    }

    /**
     * Drains and learns from every pending experience. A no-op returning zero counts when
     * the active buffer is empty.
     */
    public BatchResult processExperiences() {
        lock.writeLock().lock();
        try {
            return processLocked();
        } finally {
            lock.writeLock().unlock();
        }
    }

    private BatchResult processLocked() {
        List<Experience> drained = buffer.drainUnprocessed();
        Instant now = clock.instant();
        if (drained.isEmpty()) {
            return BatchResult.empty(strategies.size(), now);
        }

        List<Experience> learned  = new ArrayList<>(drained.size());
        List<Experience> archived = new ArrayList<>(drained.size());
        Map<String, Long> countsByContext = new LinkedHashMap<>();
        Map<String, Map<String, ActionStats>> statsByContext = new HashMap<>();
        double qSum = 0.0;
        int dropped = 0;

        for (Experience e : drained) {
            String context;
            String action;
            try {
                requireValidReward(e.reward());
                context = ContextNormalizer.normalize(e.context());
                action  = ActionType.fromValue(e.action()).value();
            } catch (RlDomainException invalid) {
                archived.add(buffer.dropToHistory(e, ExperienceStatus.DROPPED_VALIDATION));
                dropped++;
                continue;
            }

            // self-context lookahead: no successor state is observed
            double newQ = qTable.updateValue(context, action, e.reward(), context);
            qSum += newQ;
            qValueWindow.add(newQ);

            countsByContext.merge(context, 1L, Long::sum);
            statsByContext
                .computeIfAbsent(context, this::existingStats)
                .compute(action, (a, current) ->
                    (current != null ? current : ActionStats.empty()).record(e.reward(), newQ, now));
            learned.add(e);
        }

        archived.addAll(buffer.moveToHistory(learned));

        int created = 0;
        int updated = 0;
        for (Map.Entry<String, Long> entry : countsByContext.entrySet()) {
            String context = entry.getKey();
            ActionValue best = qTable.bestAction(context);
            Map<String, Double> row = qTable.actionsFor(context);
            Map<String, ActionStats> stats = syncQValues(statsByContext.get(context), row);

            Strategy previous = strategies.get(context);
            if (previous == null) {
                previous = Strategy.initial(context, now);
                created++;
            } else {
                updated++;
            }
            strategies.put(context,
                previous.refresh(best.action(), best.value(), row, stats, entry.getValue(), now));
        }

        totalLearningSessions.incrementAndGet();
        totalExperiencesProcessed.addAndGet(learned.size());
        totalExperiencesDropped.addAndGet(dropped);

        double avgQ = learned.isEmpty() ? 0.0 : qSum / learned.size();
        return new BatchResult(created, updated, learned.size(), dropped, avgQ,
            new ArrayList<>(countsByContext.keySet()), archived, strategies.size(), now);
    }

    private Map<String, ActionStats> existingStats(String context) {
        Strategy strategy = strategies.get(context);
        return strategy != null ? new LinkedHashMap<>(strategy.actionStats()) : new LinkedHashMap<>();
    }

    private static Map<String, ActionStats> syncQValues(Map<String, ActionStats> stats, Map<String, Double> row) {
        Map<String, ActionStats> synced = new LinkedHashMap<>();
        stats.forEach((action, s) -> synced.put(action, s.withQValue(row.getOrDefault(action, s.qValue()))));
        return synced;
    }

    private static void requireValidReward(double reward) {
        if (Double.isNaN(reward) || reward < -1.0 || reward > 1.0) {
            throw new InvalidRewardException(reward);
        }
    }

    // ── Acting ──────────────────────────────────────────────────────────────

    /**
     * Picks an action for {@code context} among {@code candidates} (all twelve when null or empty).
     * Never fails for an unknown context; only a blank strategic goal is rejected.
     */
    public ActionDecision generateAction(CampaignContext context, CampaignMetrics metrics,
                                         Collection<ActionType> candidates) {
        String key = context.normalizedKey();
        List<String> pool = candidatePool(candidates);
        totalActions.incrementAndGet();

        lock.readLock().lock();
        try {
            Instant now = clock.instant();
            Strategy strategy = strategies.get(key);
            ActionDecision decision;

            if (random.nextDouble() < config.explorationRate()) {
                String action = qTable.randomAction(pool, random);
                double confidence = strategy != null ? strategy.confidence() * EXPLORATION_CONFIDENCE_FACTOR : 0.0;
                decision = new ActionDecision(action, confidence,
                    "exploration: random action from " + pool.size() + " candidates",
                    DecisionPath.EXPLORATION, key, now);
            } else {
                decision = exploit(key, strategy, metrics, pool, now);
            }

            confidenceWindow.add(decision.confidence());
            return decision;
        } finally {
            lock.readLock().unlock();
        }
    }

    private ActionDecision exploit(String key, Strategy strategy, CampaignMetrics metrics,
                                   List<String> pool, Instant now) {
        try {
            ActionValue best = qTable.bestAction(key, pool);
            long experiences = strategy != null ? strategy.totalExperiences() : 0;
            return new ActionDecision(best.action(), Strategy.confidenceFor(experiences),
                String.format(Locale.ROOT, "exploitation: best action (q=%.3f) from %d experiences",
                    best.value(), experiences),
                DecisionPath.EXPLOITATION, key, now);
        } catch (NoActionsRecordedException unseen) {
            HeuristicActionSelector.Suggestion suggestion = HeuristicActionSelector.suggest(key, metrics);
            String action = pool.contains(suggestion.action().value())
                ? suggestion.action().value()
                : pool.get(0);
            return new ActionDecision(action, 0.0,
                "heuristic: unknown context (" + suggestion.rationale() + ")",
                DecisionPath.HEURISTIC, key, now);
        }
    }

    private static List<String> candidatePool(Collection<ActionType> candidates) {
        if (candidates == null || candidates.isEmpty()) {
            return VOCABULARY;
        }
        return candidates.stream()
            .distinct()
            .sorted(Comparator.comparingInt(Enum::ordinal))
            .map(ActionType::value)
            .collect(Collectors.toList());
    }

    // ── Read side ───────────────────────────────────────────────────────────

    public LearningMetrics getLearningMetrics() {
        lock.readLock().lock();
        try {
            LearningMetrics.BufferMetrics bufferMetrics = new LearningMetrics.BufferMetrics(
                buffer.activeSize(), buffer.activeCapacity(), round(buffer.activeUtilization(), 2),
                buffer.historySize(), buffer.historyCapacity(), round(buffer.historyUtilization(), 2));
            return new LearningMetrics(
                totalActions.get(),
                totalLearningSessions.get(),
                totalExperiencesProcessed.get(),
                totalExperiencesDropped.get(),
                strategies.size(),
                round(confidenceWindow.mean(), 3),
                round(rewardWindow.mean(), 3),
                round(qValueWindow.mean(), 3),
                round(qValueWindow.max(), 3),
                bufferMetrics,
                config);
        } finally {
            lock.readLock().unlock();
        }
    }

    public Optional<Strategy> strategy(String normalizedContext) {
        lock.readLock().lock();
        try {
            return Optional.ofNullable(strategies.get(normalizedContext));
        } finally {
            lock.readLock().unlock();
        }
    }

    public List<Strategy> strategies() {
        lock.readLock().lock();
        try {
            return List.copyOf(strategies.values());
        } finally {
            lock.readLock().unlock();
        }
    }

    /** Strategies for the given contexts, in the given order; unknown contexts are skipped. */
    public List<Strategy> strategies(Collection<String> contexts) {
        lock.readLock().lock();
        try {
            return contexts.stream()
                .map(strategies::get)
                .filter(Objects::nonNull)
                .toList();
        } finally {
            lock.readLock().unlock();
        }
    }

    public double qValue(String normalizedContext, String action) {
        lock.readLock().lock();
        try {
            return qTable.getValue(normalizedContext, action);
        } finally {
            lock.readLock().unlock();
        }
    }

    public Map<String, Map<String, Double>> qTableSnapshot() {
        lock.readLock().lock();
        try {
            return qTable.snapshot();
        } finally {
            lock.readLock().unlock();
        }
    }

    /** Snapshot of the Q-table rows of the given contexts. */
    public Map<String, Map<String, Double>> qTableSnapshot(Collection<String> contexts) {
        lock.readLock().lock();
        try {
            Map<String, Map<String, Double>> rows = new LinkedHashMap<>();
            for (String context : contexts) {
                rows.put(context, new LinkedHashMap<>(qTable.actionsFor(context)));
            }
            return rows;
        } finally {
            lock.readLock().unlock();
        }
    }

    public List<Experience> activeSnapshot() {
        lock.readLock().lock();
        try {
            return buffer.activeSnapshot();
        } finally {
            lock.readLock().unlock();
        }
    }

    public List<Experience> historySnapshot() {
        lock.readLock().lock();
        try {
            return buffer.historySnapshot();
        } finally {
            lock.readLock().unlock();
        }
    }

    public EngineState snapshot() {
        lock.readLock().lock();
        try {
            return new EngineState(List.copyOf(strategies.values()), qTable.snapshot(),
                buffer.activeSnapshot(), buffer.historySnapshot());
        } finally {
            lock.readLock().unlock();
        }
    }

    public QLearningConfig config() {
        return config;
    }

    public static List<String> vocabulary() {
        return VOCABULARY;
    }

    // ── Lifecycle ───────────────────────────────────────────────────────────

    /** Replaces all learning state with persisted content. Counters and windows are kept. */
    public void restore(EngineState state) {
        lock.writeLock().lock();
        try {
            strategies.clear();
            state.strategies().forEach(s -> strategies.put(s.context(), s));
            qTable.restore(state.qTable());
            buffer.restore(state.active(), state.history());
        } finally {
            lock.writeLock().unlock();
        }
    }

    private static double round(double value, int places) {
        double scale = Math.pow(10, places);
        return Math.round(value * scale) / scale;
    }
}
