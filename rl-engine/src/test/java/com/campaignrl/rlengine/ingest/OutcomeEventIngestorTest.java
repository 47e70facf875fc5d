package com.campaignrl.rlengine.ingest;

import com.campaignrl.common.event.ExperienceLearnedEvent;
import com.campaignrl.common.event.OutcomeEvent;
import com.campaignrl.common.event.OutcomeEventType;
import com.campaignrl.common.qlearning.QLearningConfig;
import com.campaignrl.common.qlearning.QLearningEngine;
import com.campaignrl.rlengine.service.LearningOrchestrator;
import com.campaignrl.rlengine.support.InMemoryPersistenceGateway;
import com.campaignrl.rlengine.support.RecordingEventPublisher;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import reactor.core.scheduler.Schedulers;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Random;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

class OutcomeEventIngestorTest {

    private static final Instant T0 = Instant.parse("2026-03-01T10:00:00Z");

    private QLearningEngine engine;
    private OutcomeEventIngestor ingestor;

    @BeforeEach
    void setUp() {
        Clock clock = Clock.fixed(T0, ZoneOffset.UTC);
        // threshold above capacity: events stay in the active buffer where they can be counted
        engine = new QLearningEngine(QLearningConfig.defaults().withBuffer(25, 1000, 26), clock, new Random(5));
        LearningOrchestrator orchestrator = new LearningOrchestrator(engine, new InMemoryPersistenceGateway(),
            new RecordingEventPublisher(), clock, Schedulers.immediate());
        ingestor = new OutcomeEventIngestor(orchestrator, 3, Schedulers.immediate());
    }

    @AfterEach
    void tearDown() {
        ingestor.stop();
    }

    private static OutcomeEvent feedback(String id, String action) {
        return new OutcomeEvent(id, OutcomeEventType.STRATEGY_FEEDBACK, null, "maximize roas", action,
            true, 0.5, null, "test", T0);
    }

    @Test
    @DisplayName("events beyond the queue depth are dropped while the consumer is not running")
    void overflowDrops() {
        assertTrue(ingestor.submit(feedback("e1", "pause_campaign")));
        assertTrue(ingestor.submit(feedback("e2", "pause_campaign")));
        assertTrue(ingestor.submit(feedback("e3", "pause_campaign")));
        assertFalse(ingestor.submit(feedback("e4", "pause_campaign")));
        assertEquals(3, ingestor.queued());
        assertTrue(engine.activeSnapshot().isEmpty());
    }

    @Test
    @DisplayName("queued events are learned once the consumer starts")
    void drainsOnStart() {
        ingestor.submit(feedback("e1", "pause_campaign"));
        ingestor.submit(feedback("e2", "optimize_for_ctr"));

        ingestor.start();

        assertEquals(0, ingestor.queued());
        assertEquals(2, engine.activeSnapshot().size());
    }

    @Test
    @DisplayName("a failing event is skipped and the consumer keeps going")
    void failingEventSkipped() {
        ingestor.start();

        assertTrue(ingestor.submit(feedback("bad", "launch_rockets")));
        assertTrue(ingestor.submit(feedback("good", "pause_campaign")));

        assertEquals(1, engine.activeSnapshot().size());
        assertEquals("pause_campaign", engine.activeSnapshot().get(0).action());
    }

    @Test
    @DisplayName("a busy consumer does not block producers; the backlog fills the queue and overflows")
    void busyConsumerBacklog() throws InterruptedException {
        Clock clock = Clock.fixed(T0, ZoneOffset.UTC);
        QLearningEngine busyEngine =
            new QLearningEngine(QLearningConfig.defaults().withBuffer(25, 1000, 26), clock, new Random(5));
        CountDownLatch handling = new CountDownLatch(1);
        CountDownLatch release  = new CountDownLatch(1);
        RecordingEventPublisher blocking = new RecordingEventPublisher() {
            @Override
            public void publishExperienceLearned(ExperienceLearnedEvent event) {
                super.publishExperienceLearned(event);
                handling.countDown();
                try {
                    release.await(5, TimeUnit.SECONDS);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                }
            }
        };
        LearningOrchestrator orchestrator = new LearningOrchestrator(busyEngine, new InMemoryPersistenceGateway(),
            blocking, clock, Schedulers.immediate());
        OutcomeEventIngestor busy = new OutcomeEventIngestor(orchestrator, 3, Schedulers.newSingle("test-consumer"));
        busy.start();
        try {
            assertTrue(busy.submit(feedback("e0", "pause_campaign")));
            assertTrue(handling.await(5, TimeUnit.SECONDS));

            int accepted = 1;
            boolean overflowed = false;
            for (int i = 1; i < 10 && !overflowed; i++) {
                if (busy.submit(feedback("e" + i, "pause_campaign"))) {
                    accepted++;
                } else {
                    overflowed = true;
                }
            }
            assertTrue(overflowed);
            assertEquals(4, accepted);
            assertEquals(3, busy.queued());

            release.countDown();
            long deadline = System.nanoTime() + TimeUnit.SECONDS.toNanos(5);
            while (busyEngine.activeSnapshot().size() < accepted && System.nanoTime() < deadline) {
                Thread.sleep(20);
            }
            assertEquals(accepted, busyEngine.activeSnapshot().size());
            assertEquals(0, busy.queued());
        } finally {
            release.countDown();
            busy.stop();
        }
    }
}
