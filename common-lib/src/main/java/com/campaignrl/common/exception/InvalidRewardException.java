package com.campaignrl.common.exception;

/** Reward outside [-1.0, 1.0] or not a number. */
public class InvalidRewardException extends RlDomainException {

    public InvalidRewardException(double reward) {
        super("INVALID_REWARD", "Reward must be between -1.0 and 1.0, got " + reward);
    }
}
