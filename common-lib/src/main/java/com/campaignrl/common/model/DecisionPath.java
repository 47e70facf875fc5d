package com.campaignrl.common.model;

/** Which branch of the epsilon-greedy policy produced an {@link ActionDecision}. */
public enum DecisionPath {
    EXPLORATION,
    EXPLOITATION,
    HEURISTIC
}
