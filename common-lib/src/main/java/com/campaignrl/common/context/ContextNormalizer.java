package com.campaignrl.common.context;

import com.campaignrl.common.exception.InvalidContextException;

import java.util.Locale;
import java.util.Map;

/**
 * Canonicalizes a strategic context into its Q-table key.
 *
 * <h3>Rules</h3>
 * <ol>
 *   <li>Trim, collapse inner whitespace runs, upper-case.</li>
 *   <li>Spaces and hyphens become underscores; repeated underscores collapse.</li>
 *   <li>Short generic goals map to their canonical form
 *       ({@code "conversions"} → {@code MAXIMIZE_CONVERSIONS}).</li>
 * </ol>
 *
 * <pre>
 *   "  maximize roas " → MAXIMIZE_ROAS
 *   "minimize-cpa"     → MINIMIZE_CPA
 *   "Reach"            → MAXIMIZE_REACH
 * </pre>
 *
 * <p>Pure and idempotent: {@code normalize(normalize(x)) == normalize(x)}.
 */
public final class ContextNormalizer {

    private static final Map<String, String> GENERIC_ALIASES = Map.of(
        "CONVERSIONS", "MAXIMIZE_CONVERSIONS",
        "REACH",       "MAXIMIZE_REACH",
        "CTR",         "MAXIMIZE_CTR"
    );

    private ContextNormalizer() {}

    public static String normalize(String raw) {
        if (raw == null || raw.isBlank()) {
            throw new InvalidContextException("Context cannot be empty");
        }
        String canonical = raw.trim()
            .toUpperCase(Locale.ROOT)
            .replaceAll("[\\s\\-]+", "_")
            .replaceAll("_+", "_");
        if (canonical.equals("_")) {
            throw new InvalidContextException("Context has no identifier characters: '" + raw + "'");
        }
        return GENERIC_ALIASES.getOrDefault(canonical, canonical);
    }
}
