package com.campaignrl.common.heuristic;

import com.campaignrl.common.model.ActionType;
import com.campaignrl.common.model.CampaignMetrics;

import java.util.Locale;

/**
 * Deterministic domain-knowledge fallback for contexts the Q-table has never seen.
 *
 * <h3>Rules (first match wins, on the normalized strategic goal)</h3>
 * <pre>
 *   contains CPA          → REDUCE_BID_CONSERVATIVE
 *                           (FOCUS_HIGH_VALUE_AUDIENCES when ROAS &lt; 2.0)
 *   contains ROAS         → FOCUS_HIGH_VALUE_AUDIENCES
 *   contains AWARENESS    → EXPAND_REACH_CAMPAIGNS
 *   contains CONVERSION   → INCREASE_BID_CONVERSION_KEYWORDS
 *   contains REACH        → EXPAND_REACH_CAMPAIGNS
 *   contains CTR          → OPTIMIZE_FOR_CTR
 *   otherwise             → OPTIMIZE_BIDDING_STRATEGY
 * </pre>
 *
 * <p>The fallback rule's rationale notes whether the metrics call for optimization
 * or are already on target.
 *
 * <p>Stateless and thread-safe.
 */
public final class HeuristicActionSelector {

    public static final double LOW_ROAS_THRESHOLD = 2.0;

    /**
     * @param action    suggested move
     * @param rationale short human-readable reason, e.g. "CPA optimization"
     */
    public record Suggestion(ActionType action, String rationale) {}

    private HeuristicActionSelector() {}

    public static Suggestion suggest(String normalizedContext, CampaignMetrics metrics) {
        String goal = normalizedContext.toLowerCase(Locale.ROOT);

        if (goal.contains("cpa")) {
            if (metrics != null && metrics.roas() < LOW_ROAS_THRESHOLD) {
                return new Suggestion(ActionType.FOCUS_HIGH_VALUE_AUDIENCES, "low ROAS, focus on high-value audiences");
            }
            return new Suggestion(ActionType.REDUCE_BID_CONSERVATIVE, "CPA optimization");
        }
        if (goal.contains("roas")) {
            return new Suggestion(ActionType.FOCUS_HIGH_VALUE_AUDIENCES, "ROAS maximization");
        }
        if (goal.contains("awareness")) {
            return new Suggestion(ActionType.EXPAND_REACH_CAMPAIGNS, "brand awareness campaign");
        }
        if (goal.contains("conversion")) {
            return new Suggestion(ActionType.INCREASE_BID_CONVERSION_KEYWORDS, "conversion optimization");
        }
        if (goal.contains("reach")) {
            return new Suggestion(ActionType.EXPAND_REACH_CAMPAIGNS, "reach maximization");
        }
        if (goal.contains("ctr")) {
            return new Suggestion(ActionType.OPTIMIZE_FOR_CTR, "CTR optimization");
        }
        if (metrics != null && metrics.needsOptimization()) {
            return new Suggestion(ActionType.OPTIMIZE_BIDDING_STRATEGY, "default optimization, metrics below target");
        }
        if (metrics != null && metrics.isPerformingWell()) {
            return new Suggestion(ActionType.OPTIMIZE_BIDDING_STRATEGY, "default optimization, metrics on target");
        }
        return new Suggestion(ActionType.OPTIMIZE_BIDDING_STRATEGY, "default optimization");
    }
}
