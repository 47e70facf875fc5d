package com.campaignrl.common.qlearning;

import com.campaignrl.common.MutableClock;
import com.campaignrl.common.exception.InvalidActionException;
import com.campaignrl.common.exception.InvalidContextException;
import com.campaignrl.common.exception.InvalidRewardException;
import com.campaignrl.common.model.ActionDecision;
import com.campaignrl.common.model.ActionType;
import com.campaignrl.common.model.CampaignContext;
import com.campaignrl.common.model.CampaignMetrics;
import com.campaignrl.common.model.DecisionPath;
import com.campaignrl.common.model.Experience;
import com.campaignrl.common.model.ExperienceStatus;
import com.campaignrl.common.model.Strategy;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Random;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Behavioural tests of {@link QLearningEngine}: learning, batching, buffer policy and
 * the epsilon-greedy policy. Randomness is seeded and time is fixed.
 */
class QLearningEngineTest {

    private static final double EPS = 1e-9;
    private static final String FOCUS = ActionType.FOCUS_HIGH_VALUE_AUDIENCES.value();
    private static final String PAUSE = ActionType.PAUSE_CAMPAIGN.value();

    private MutableClock clock;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(Instant.parse("2026-03-01T10:00:00Z"));
    }

    private QLearningEngine engine(QLearningConfig config) {
        return new QLearningEngine(config, clock, new Random(42));
    }

    private QLearningEngine greedyEngine() {
        return engine(QLearningConfig.defaults().withExplorationRate(0.0));
    }

    // ── addExperience() ─────────────────────────────────────────────────────

    @Nested
    @DisplayName("addExperience()")
    class AddExperience {

        @Test
        @DisplayName("stores the normalized context and canonical action")
        void normalizesInput() {
            QLearningEngine engine = greedyEngine();
            ExperienceReceipt receipt = engine.addExperience("maximize roas", "FOCUS-HIGH-VALUE-AUDIENCES", 0.5);

            Experience stored = receipt.experience();
            assertEquals("MAXIMIZE_ROAS", stored.context());
            assertEquals(FOCUS, stored.action());
            assertEquals(ExperienceStatus.PENDING, stored.status());
            assertEquals(1, receipt.activeBufferSize());
            assertFalse(receipt.autoProcessed());
        }

        @Test
        @DisplayName("reward 1.5 is rejected and the buffer is unchanged")
        void rewardOutOfRange() {
            QLearningEngine engine = greedyEngine();
            engine.addExperience("maximize_roas", FOCUS, 0.4);

            assertThrows(InvalidRewardException.class, () -> engine.addExperience("maximize_roas", FOCUS, 1.5));
            assertThrows(InvalidRewardException.class, () -> engine.addExperience("maximize_roas", FOCUS, Double.NaN));
            assertEquals(1, engine.activeSnapshot().size());
        }

        @Test
        @DisplayName("boundary rewards -1.0 and 1.0 are accepted")
        void boundaryRewards() {
            QLearningEngine engine = greedyEngine();
            engine.addExperience("c", FOCUS, -1.0);
            engine.addExperience("c", FOCUS, 1.0);
            assertEquals(2, engine.activeSnapshot().size());
        }

        @Test
        @DisplayName("unknown action and blank context are rejected")
        void invalidActionAndContext() {
            QLearningEngine engine = greedyEngine();
            assertThrows(InvalidActionException.class, () -> engine.addExperience("c", "launch_rocket", 0.1));
            assertThrows(InvalidContextException.class, () -> engine.addExperience("  ", FOCUS, 0.1));
            assertTrue(engine.activeSnapshot().isEmpty());
        }

        @Test
        @DisplayName("reaching the threshold runs a batch automatically")
        void autoProcess() {
            QLearningEngine engine = greedyEngine();
            ExperienceReceipt last = null;
            for (int i = 0; i < QLearningConfig.DEFAULT_AUTO_PROCESS_THRESHOLD; i++) {
                last = engine.addExperience("maximize_roas", FOCUS, 0.5);
                if (i < QLearningConfig.DEFAULT_AUTO_PROCESS_THRESHOLD - 1) {
                    assertFalse(last.autoProcessed());
                }
            }
            assertTrue(last.autoProcessed());
            assertEquals(15, last.batch().experiencesProcessed());
            assertEquals(0, last.activeBufferSize());
            assertEquals(15, last.historyBufferSize());
            assertTrue(engine.strategy("MAXIMIZE_ROAS").isPresent());
        }

        @Test
        @DisplayName("26th experience on a full buffer drops the first one")
        void overflowDrop() {
            QLearningEngine engine = engine(QLearningConfig.defaults()
                .withExplorationRate(0.0)
                .withBuffer(25, 1000, 26));
            ExperienceReceipt first = engine.addExperience("maximize_roas", FOCUS, 0.1);
            for (int i = 1; i < 25; i++) {
                assertTrue(engine.addExperience("maximize_roas", FOCUS, 0.1).dropped().isEmpty());
            }

            ExperienceReceipt receipt = engine.addExperience("maximize_roas", FOCUS, 0.2);

            assertEquals(first.experience().id(), receipt.droppedOnOverflow().id());
            assertEquals(ExperienceStatus.DROPPED_OVERFLOW, receipt.droppedOnOverflow().status());
            assertEquals(25, engine.activeSnapshot().size());
            assertEquals(1, engine.getLearningMetrics().totalExperiencesDropped());

            BatchResult batch = engine.processExperiences();
            assertEquals(25, batch.experiencesProcessed());
            assertEquals(25, engine.strategy("MAXIMIZE_ROAS").orElseThrow().totalExperiences());
        }
    }

    // ── processExperiences() ────────────────────────────────────────────────

    @Nested
    @DisplayName("processExperiences()")
    class ProcessExperiences {

        @Test
        @DisplayName("three positive rewards build a MAXIMIZE_ROAS strategy")
        void endToEnd() {
            QLearningEngine engine = greedyEngine();
            engine.addExperience("maximize roas", FOCUS, 0.8);
            engine.addExperience("maximize roas", FOCUS, 0.6);
            engine.addExperience("maximize roas", FOCUS, 0.9);

            BatchResult batch = engine.processExperiences();

            assertEquals(1, batch.strategiesCreated());
            assertEquals(0, batch.strategiesUpdated());
            assertEquals(3, batch.experiencesProcessed());
            assertEquals(List.of("MAXIMIZE_ROAS"), batch.touchedContexts());
            assertEquals(3, batch.archived().size());

            Strategy strategy = engine.strategy("MAXIMIZE_ROAS").orElseThrow();
            assertEquals(FOCUS, strategy.bestAction());
            assertEquals(3, strategy.totalExperiences());
            assertEquals(3.0 / 13.0, strategy.confidence(), EPS);
            double q = engine.qValue("MAXIMIZE_ROAS", FOCUS);
            assertTrue(q > 0.0 && q < 1.0);
            assertEquals(0.228902, q, 1e-6);
            assertEquals(q, strategy.bestQValue(), EPS);
            assertEquals(3, strategy.actionStats().get(FOCUS).count());
            assertEquals(0.766667, strategy.actionStats().get(FOCUS).avgReward(), 1e-6);

            ActionDecision decision = engine.generateAction(CampaignContext.of("maximize roas"), null, null);
            assertEquals(FOCUS, decision.action());
            assertEquals(DecisionPath.EXPLOITATION, decision.path());
        }

        @Test
        @DisplayName("processing an empty buffer is a no-op")
        void idempotent() {
            QLearningEngine engine = greedyEngine();
            engine.addExperience("c", FOCUS, 0.5);
            engine.processExperiences();
            Map<String, Map<String, Double>> before = engine.qTableSnapshot();

            BatchResult second = engine.processExperiences();

            assertTrue(second.isEmpty());
            assertEquals(0, second.strategiesCreated());
            assertEquals(0, second.strategiesUpdated());
            assertEquals(before, engine.qTableSnapshot());
            assertEquals(1, engine.getLearningMetrics().totalLearningSessions());
        }

        @Test
        @DisplayName("positive reward raises Q, negative reward lowers it")
        void direction() {
            QLearningEngine engine = greedyEngine();
            engine.addExperience("c", FOCUS, 0.5);
            engine.addExperience("c", PAUSE, -0.5);
            engine.processExperiences();
            assertTrue(engine.qValue("C", FOCUS) > 0.0);
            assertTrue(engine.qValue("C", PAUSE) < 0.0);
            assertEquals(FOCUS, engine.strategy("C").orElseThrow().bestAction());
        }

        @Test
        @DisplayName("a second batch updates the existing strategy and accumulates experience")
        void updatesExisting() {
            QLearningEngine engine = greedyEngine();
            engine.addExperience("c", FOCUS, 0.5);
            engine.processExperiences();
            Strategy first = engine.strategy("C").orElseThrow();

            clock.advance(Duration.ofMinutes(10));
            engine.addExperience("c", FOCUS, 0.5);
            engine.addExperience("c", PAUSE, 0.1);
            BatchResult batch = engine.processExperiences();

            Strategy second = engine.strategy("C").orElseThrow();
            assertEquals(0, batch.strategiesCreated());
            assertEquals(1, batch.strategiesUpdated());
            assertEquals(3, second.totalExperiences());
            assertTrue(second.confidence() > first.confidence());
            assertEquals(first.createdAt(), second.createdAt());
            assertTrue(second.lastUpdated().isAfter(first.lastUpdated()));
            assertEquals(2, second.actionsCount());
        }

        @Test
        @DisplayName("several contexts in one batch each get a strategy")
        void multipleContexts() {
            QLearningEngine engine = greedyEngine();
            engine.addExperience("maximize roas", FOCUS, 0.5);
            engine.addExperience("minimize cpa", PAUSE, 0.3);
            BatchResult batch = engine.processExperiences();
            assertEquals(2, batch.strategiesCreated());
            assertEquals(2, batch.totalStrategies());
            assertEquals(List.of("MAXIMIZE_ROAS", "MINIMIZE_CPA"), batch.touchedContexts());
        }
        @Test
        @DisplayName("malformed pending entries are archived as DROPPED_VALIDATION and the batch continues")
        void validationDrops() {
            QLearningEngine engine = greedyEngine();
            Instant t = clock.instant();
            engine.restore(new EngineState(List.of(), Map.of(), List.of(
                Experience.pending("bad", "MAXIMIZE_ROAS", FOCUS, 5.0, t, null),
                Experience.pending("bad2", "MAXIMIZE_ROAS", "launch_rockets", 0.4, t, null),
                Experience.pending("ok", "MAXIMIZE_ROAS", FOCUS, 0.6, t, null)), List.of()));

            BatchResult batch = engine.processExperiences();

            assertEquals(1, batch.experiencesProcessed());
            assertEquals(2, batch.experiencesDropped());
            assertEquals(3, batch.archived().size());
            assertEquals(List.of("MAXIMIZE_ROAS"), batch.touchedContexts());
            Map<String, ExperienceStatus> statuses = new LinkedHashMap<>();
            engine.historySnapshot().forEach(e -> statuses.put(e.id(), e.status()));
            assertEquals(ExperienceStatus.DROPPED_VALIDATION, statuses.get("bad"));
            assertEquals(ExperienceStatus.DROPPED_VALIDATION, statuses.get("bad2"));
            assertEquals(ExperienceStatus.PROCESSED, statuses.get("ok"));
            assertTrue(engine.activeSnapshot().isEmpty());
            assertEquals(1, engine.strategy("MAXIMIZE_ROAS").orElseThrow().totalExperiences());

            BatchResult second = engine.processExperiences();
            assertTrue(second.isEmpty());
            assertEquals(3, engine.historySnapshot().size());
        }

        @Test
        @DisplayName("a pending entry already in history is not restored, so it is never learned twice")
        void restoreSkipsArchivedPending() {
            QLearningEngine engine = greedyEngine();
            Instant t = clock.instant();
            Experience pending = Experience.pending("dup", "MAXIMIZE_ROAS", FOCUS, 0.6, t, null);
            engine.restore(new EngineState(List.of(), Map.of(),
                List.of(pending), List.of(pending.markProcessed(t))));

            assertTrue(engine.activeSnapshot().isEmpty());
            assertTrue(engine.processExperiences().isEmpty());
        }
    }

    // ── generateAction() ────────────────────────────────────────────────────

    @Nested
    @DisplayName("generateAction()")
    class GenerateAction {

        @Test
        @DisplayName("unknown context falls back to the heuristic with zero confidence")
        void heuristicFallback() {
            QLearningEngine engine = greedyEngine();
            ActionDecision decision = engine.generateAction(
                CampaignContext.of("minimize cpa"), CampaignMetrics.defaults(), null);

            assertEquals(ActionType.REDUCE_BID_CONSERVATIVE.value(), decision.action());
            assertEquals(DecisionPath.HEURISTIC, decision.path());
            assertEquals(0.0, decision.confidence());
            assertTrue(decision.reasoning().startsWith("heuristic"));
            assertEquals("MINIMIZE_CPA", decision.normalizedContext());
        }

        @Test
        @DisplayName("heuristic choice is deterministic")
        void heuristicDeterministic() {
            QLearningEngine engine = greedyEngine();
            CampaignContext context = CampaignContext.of("brand awareness");
            String first = engine.generateAction(context, null, null).action();
            for (int i = 0; i < 20; i++) {
                assertEquals(first, engine.generateAction(context, null, null).action());
            }
            assertEquals(ActionType.EXPAND_REACH_CAMPAIGNS.value(), first);
        }

        @Test
        @DisplayName("heuristic suggestion outside the candidates yields the first candidate")
        void heuristicOutsideCandidates() {
            QLearningEngine engine = greedyEngine();
            ActionDecision decision = engine.generateAction(CampaignContext.of("maximize roas"), null,
                List.of(ActionType.PAUSE_CAMPAIGN, ActionType.REDUCE_BID_CONSERVATIVE));
            assertEquals(ActionType.REDUCE_BID_CONSERVATIVE.value(), decision.action());
        }

        @Test
        @DisplayName("exploitation respects the candidate subset")
        void exploitationRestricted() {
            QLearningEngine engine = greedyEngine();
            engine.addExperience("c", FOCUS, 0.9);
            engine.addExperience("c", PAUSE, 0.1);
            engine.processExperiences();

            ActionDecision decision = engine.generateAction(CampaignContext.of("c"), null,
                List.of(ActionType.PAUSE_CAMPAIGN));
            assertEquals(PAUSE, decision.action());
            assertEquals(DecisionPath.EXPLOITATION, decision.path());
        }

        @Test
        @DisplayName("blank strategic goal is rejected")
        void blankGoal() {
            assertThrows(InvalidContextException.class,
                () -> greedyEngine().generateAction(CampaignContext.of(" "), null, null));
        }

        @Test
        @DisplayName("exploration reports half the strategy confidence")
        void explorationConfidence() {
            QLearningEngine engine = engine(QLearningConfig.defaults().withExplorationRate(1.0));
            for (int i = 0; i < 10; i++) engine.addExperience("c", FOCUS, 0.5);
            engine.processExperiences();

            ActionDecision decision = engine.generateAction(CampaignContext.of("c"), null, null);
            assertEquals(DecisionPath.EXPLORATION, decision.path());
            assertEquals(0.25, decision.confidence(), EPS);
        }

        @Test
        @DisplayName("with ε = 0.15 about 15% of decisions explore")
        void epsilonDistribution() {
            QLearningEngine engine = engine(QLearningConfig.defaults());
            for (int i = 0; i < 5; i++) engine.addExperience("maximize roas", FOCUS, 0.8);
            engine.processExperiences();

            int explored = 0;
            int runs = 10_000;
            for (int i = 0; i < runs; i++) {
                ActionDecision d = engine.generateAction(CampaignContext.of("maximize roas"), null, null);
                if (d.path() == DecisionPath.EXPLORATION) {
                    explored++;
                } else {
                    assertEquals(FOCUS, d.action());
                }
            }
            double share = explored / (double) runs;
            assertTrue(share > 0.13 && share < 0.17, "exploration share " + share);
        }
    }

    // ── metrics / restore ───────────────────────────────────────────────────

    @Nested
    @DisplayName("getLearningMetrics() and restore()")
    class MetricsAndRestore {

        @Test
        @DisplayName("counters track actions, sessions and buffer usage")
        void metrics() {
            QLearningEngine engine = greedyEngine();
            engine.addExperience("c", FOCUS, 0.5);
            engine.addExperience("c", FOCUS, -0.1);
            engine.processExperiences();
            engine.addExperience("c", FOCUS, 0.3);
            engine.generateAction(CampaignContext.of("c"), null, null);
            engine.generateAction(CampaignContext.of("c"), null, null);

            LearningMetrics metrics = engine.getLearningMetrics();
            assertEquals(2, metrics.totalActions());
            assertEquals(1, metrics.totalLearningSessions());
            assertEquals(2, metrics.totalExperiencesProcessed());
            assertEquals(1, metrics.totalStrategies());
            assertEquals(0.233, metrics.avgReward(), 1e-3);
            assertEquals(1, metrics.buffer().activeBufferSize());
            assertEquals(4.0, metrics.buffer().activeBufferUtilizationPercent(), 1e-9);
            assertEquals(2, metrics.buffer().historyBufferSize());
            assertEquals(QLearningConfig.defaults().withExplorationRate(0.0), metrics.hyperparameters());
        }

        @Test
        @DisplayName("restore() rebuilds a fresh engine from a snapshot")
        void restore() {
            QLearningEngine source = greedyEngine();
            source.addExperience("c", FOCUS, 0.7);
            source.processExperiences();
            source.addExperience("c", PAUSE, 0.2);

            QLearningEngine target = greedyEngine();
            target.restore(source.snapshot());

            assertEquals(source.qTableSnapshot(), target.qTableSnapshot());
            assertEquals(source.strategies(), target.strategies());
            assertEquals(1, target.activeSnapshot().size());
            assertEquals(1, target.historySnapshot().size());
            assertEquals(FOCUS, target.generateAction(CampaignContext.of("c"), null, null).action());
        }
    }
}
