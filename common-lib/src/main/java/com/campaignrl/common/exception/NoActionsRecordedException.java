package com.campaignrl.common.exception;

/**
 * Best-action query on a context with no recorded actions.
 * Recovered inside the engine by the heuristic fallback; never reaches action callers.
 */
public class NoActionsRecordedException extends RlDomainException {

    private final String context;

    public NoActionsRecordedException(String context) {
        super("NO_ACTIONS_RECORDED", "No actions recorded for context " + context);
        this.context = context;
    }

    public String getContext() {
        return context;
    }
}
