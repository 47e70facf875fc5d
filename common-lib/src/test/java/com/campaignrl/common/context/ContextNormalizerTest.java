package com.campaignrl.common.context;

import com.campaignrl.common.exception.InvalidContextException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ContextNormalizerTest {

    @Nested
    @DisplayName("normalize(): canonical keys")
    class CanonicalKeys {

        @Test
        @DisplayName("spaces and case collapse to an upper-case underscore key")
        void spacesAndCase() {
            assertEquals("MAXIMIZE_ROAS", ContextNormalizer.normalize("  maximize   roas "));
        }

        @Test
        @DisplayName("hyphens become underscores")
        void hyphens() {
            assertEquals("MINIMIZE_CPA", ContextNormalizer.normalize("minimize-cpa"));
        }

        @Test
        @DisplayName("repeated separators collapse")
        void repeatedSeparators() {
            assertEquals("BRAND_AWARENESS", ContextNormalizer.normalize("brand - _ awareness"));
        }

        @Test
        @DisplayName("generic goals map to their canonical form")
        void genericAliases() {
            assertEquals("MAXIMIZE_CONVERSIONS", ContextNormalizer.normalize("conversions"));
            assertEquals("MAXIMIZE_REACH", ContextNormalizer.normalize("Reach"));
            assertEquals("MAXIMIZE_CTR", ContextNormalizer.normalize("ctr"));
        }

        @Test
        @DisplayName("normalizing twice gives the same key")
        void idempotent() {
            for (String raw : List.of("maximize roas", "minimize-cpa", "reach", "Holiday  Sale-2024", "x")) {
                String once = ContextNormalizer.normalize(raw);
                assertEquals(once, ContextNormalizer.normalize(once), raw);
            }
        }
    }

    @Nested
    @DisplayName("normalize(): rejected input")
    class Rejected {

        @Test
        @DisplayName("null → InvalidContextException")
        void nullContext() {
            assertThrows(InvalidContextException.class, () -> ContextNormalizer.normalize(null));
        }

        @Test
        @DisplayName("blank → InvalidContextException")
        void blankContext() {
            assertThrows(InvalidContextException.class, () -> ContextNormalizer.normalize("   "));
        }

        @Test
        @DisplayName("separators only → InvalidContextException")
        void separatorsOnly() {
            InvalidContextException e = assertThrows(InvalidContextException.class,
                () -> ContextNormalizer.normalize(" - - "));
            assertEquals("INVALID_CONTEXT", e.getErrorCode());
        }
    }
}
