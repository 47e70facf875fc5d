package com.campaignrl.common.qlearning;

import com.campaignrl.common.exception.NoActionsRecordedException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Random;

import static org.junit.jupiter.api.Assertions.*;

class QTableTest {

    private static final double EPS = 1e-9;

    private QTable table;

    @BeforeEach
    void setUp() {
        table = new QTable(0.1, 0.95);
    }

    // ── updateValue() ───────────────────────────────────────────────────────

    @Nested
    @DisplayName("updateValue()")
    class UpdateValue {

        @Test
        @DisplayName("first update on an empty table: Q = α·R")
        void firstUpdate() {
            double q = table.updateValue("MAXIMIZE_ROAS", "pause_campaign", 0.8, "MAXIMIZE_ROAS");
            assertEquals(0.08, q, EPS);
            assertEquals(0.08, table.getValue("MAXIMIZE_ROAS", "pause_campaign"), EPS);
        }

        @Test
        @DisplayName("lookahead uses the row as it was before the insert")
        void lookaheadBeforeInsert() {
            table.updateValue("C", "a", 0.8, "C");                  // 0.08
            double q = table.updateValue("C", "a", 0.6, "C");       // 0.08 + 0.1·(0.6 + 0.95·0.08 − 0.08)
            assertEquals(0.08 + 0.1 * (0.6 + 0.95 * 0.08 - 0.08), q, EPS);
        }

        @Test
        @DisplayName("positive reward from zero raises Q, negative lowers it")
        void direction() {
            assertTrue(table.updateValue("UP", "a", 0.5, "UP") > 0.0);
            assertTrue(table.updateValue("DOWN", "a", -0.5, "DOWN") < 0.0);
        }

        @Test
        @DisplayName("zero reward on an empty row leaves Q at 0")
        void zeroReward() {
            assertEquals(0.0, table.updateValue("C", "a", 0.0, "C"), EPS);
        }

        @Test
        @DisplayName("unrecorded pairs read as 0.0")
        void unrecordedReadsZero() {
            assertEquals(0.0, table.getValue("NOPE", "a"));
            table.updateValue("C", "a", 0.3, "C");
            assertEquals(0.0, table.getValue("C", "b"));
        }
    }

    // ── bestAction() ────────────────────────────────────────────────────────

    @Nested
    @DisplayName("bestAction()")
    class BestAction {

        @Test
        @DisplayName("unknown context → NoActionsRecordedException")
        void unknownContext() {
            NoActionsRecordedException e = assertThrows(NoActionsRecordedException.class,
                () -> table.bestAction("UNKNOWN"));
            assertEquals("UNKNOWN", e.getContext());
        }

        @Test
        @DisplayName("returns the argmax of the row")
        void argmax() {
            table.updateValue("C", "a", 0.2, "C");
            table.updateValue("C", "b", 0.9, "C");
            table.updateValue("C", "c", -0.4, "C");
            assertEquals("b", table.bestAction("C").action());
        }

        @Test
        @DisplayName("ties go to the first recorded action")
        void tieBreak() {
            Map<String, Map<String, Double>> persisted = new HashMap<>();
            Map<String, Double> row = new LinkedHashMap<>();
            row.put("second", 0.5);
            row.put("first", 0.5);
            persisted.put("C", row);
            table.restore(persisted);
            assertEquals("second", table.bestAction("C").action());
        }

        @Test
        @DisplayName("candidate restriction skips better actions outside the set")
        void restricted() {
            table.updateValue("C", "a", 0.2, "C");
            table.updateValue("C", "b", 0.9, "C");
            assertEquals("a", table.bestAction("C", List.of("a", "z")).action());
        }

        @Test
        @DisplayName("no recorded candidate → NoActionsRecordedException")
        void noRecordedCandidate() {
            table.updateValue("C", "a", 0.2, "C");
            assertThrows(NoActionsRecordedException.class, () -> table.bestAction("C", List.of("z")));
        }
    }

    // ── randomAction() / snapshot() ─────────────────────────────────────────

    @Nested
    @DisplayName("randomAction() and snapshots")
    class RandomAndSnapshot {

        @Test
        @DisplayName("random pick always comes from the candidate list")
        void randomFromCandidates() {
            Random random = new Random(7);
            List<String> candidates = List.of("a", "b", "c");
            for (int i = 0; i < 100; i++) {
                assertTrue(candidates.contains(table.randomAction(candidates, random)));
            }
        }

        @Test
        @DisplayName("empty candidate list is rejected")
        void emptyCandidates() {
            assertThrows(IllegalArgumentException.class, () -> table.randomAction(List.of(), new Random()));
        }

        @Test
        @DisplayName("snapshot is a deep copy")
        void snapshotDeepCopy() {
            table.updateValue("C", "a", 0.5, "C");
            Map<String, Map<String, Double>> snapshot = table.snapshot();
            snapshot.get("C").put("a", 99.0);
            assertEquals(0.05, table.getValue("C", "a"), EPS);
        }

        @Test
        @DisplayName("restore replaces all rows")
        void restoreReplaces() {
            table.updateValue("OLD", "a", 0.5, "OLD");
            table.restore(Map.of("NEW", Map.of("b", 0.4)));
            assertTrue(table.actionsFor("OLD").isEmpty());
            assertEquals(0.4, table.getValue("NEW", "b"), EPS);
            assertEquals(Map.of("NEW", Map.of("b", 0.4)), table.snapshot());
        }
    }
}
