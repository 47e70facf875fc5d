package com.campaignrl.common.reward;

import com.campaignrl.common.event.OutcomeEvent;
import com.campaignrl.common.exception.InvalidRewardException;

/**
 * Deterministic metrics → reward policy for outcome events.
 *
 * <h3>traffic.request_completed</h3>
 * <pre>
 *   base         +0.5 success / −0.5 failure
 *   ROAS         &gt; 3.0 → +0.3   &lt; 1.0 → −0.3
 *   CTR          &gt; 2.5 → +0.2   &lt; 0.8 → −0.2
 *   conversions  &gt; 30  → +0.1   (no penalty)
 * </pre>
 *
 * <h3>campaign.performance_updated</h3>
 * <pre>
 *   base         +0.5 improved / −0.3 otherwise
 *   ROAS         &gt; 3.0 → +0.3   &lt; 1.0 → −0.3
 * </pre>
 *
 * <h3>rl.strategy_feedback</h3>
 * The supplied reward as-is.
 *
 * <p>Every result is clamped to [−1.0, 1.0]. NaN metrics count as absent.
 */
public final class RewardCalculator {

    public static final double MIN_REWARD = -1.0;
    public static final double MAX_REWARD =  1.0;

    private RewardCalculator() {}

    public static double compute(OutcomeEvent event) {
        if (event.eventType() == null) {
            throw new IllegalArgumentException("Outcome event has no type. eventId=" + event.eventId());
        }
        return switch (event.eventType()) {
            case TRAFFIC_REQUEST_COMPLETED    -> forTrafficOutcome(event.success(),
                event.metric("roas"), event.metric("ctr"), event.metric("conversions"));
            case CAMPAIGN_PERFORMANCE_UPDATED -> forPerformanceUpdate(event.success(), event.metric("roas"));
            case STRATEGY_FEEDBACK            -> forExplicitFeedback(event.reward() != null ? event.reward() : 0.0);
        };
    }

    public static double forTrafficOutcome(boolean success, double roas, double ctr, double conversions) {
        double reward = success ? 0.5 : -0.5;
        reward += roasAdjustment(roas);

        double safeCtr = nanToZero(ctr);
        if (safeCtr > 2.5)      reward += 0.2;
        else if (safeCtr < 0.8) reward -= 0.2;

        if (nanToZero(conversions) > 30) reward += 0.1;

        return clamp(reward);
    }

    public static double forPerformanceUpdate(boolean improved, double roas) {
        double reward = improved ? 0.5 : -0.3;
        reward += roasAdjustment(roas);
        return clamp(reward);
    }

    /**
     * @throws InvalidRewardException when the supplied reward is NaN
     */
    public static double forExplicitFeedback(double reward) {
        if (Double.isNaN(reward)) {
            throw new InvalidRewardException(reward);
        }
        return clamp(reward);
    }

    public static double clamp(double reward) {
        return Math.max(MIN_REWARD, Math.min(MAX_REWARD, reward));
    }

    private static double roasAdjustment(double roas) {
        double safeRoas = nanToZero(roas);
        if (safeRoas > 3.0) return  0.3;
        if (safeRoas < 1.0) return -0.3;
        return 0.0;
    }

    private static double nanToZero(double value) {
        return Double.isNaN(value) ? 0.0 : value;
    }
}
