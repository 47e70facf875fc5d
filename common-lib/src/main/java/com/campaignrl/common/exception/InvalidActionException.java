package com.campaignrl.common.exception;

public class InvalidActionException extends RlDomainException {

    public InvalidActionException(String message) {
        super("INVALID_ACTION", message);
    }
}
