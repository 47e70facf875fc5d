package com.campaignrl.common.model;

/**
 * Buffer lifecycle of a single {@link Experience}.
 *
 * <pre>
 *   PENDING ──► PROCESSED            (contributed a Q-update)
 *      │
 *      ├──► DROPPED_OVERFLOW         (evicted from a full active buffer, never learned from)
 *      └──► DROPPED_VALIDATION       (rejected during batch processing)
 * </pre>
 */
public enum ExperienceStatus {
    PENDING,
    PROCESSED,
    DROPPED_OVERFLOW,
    DROPPED_VALIDATION;

    public boolean isTerminal() {
        return this != PENDING;
    }

    public boolean isDropped() {
        return this == DROPPED_OVERFLOW || this == DROPPED_VALIDATION;
    }
}
