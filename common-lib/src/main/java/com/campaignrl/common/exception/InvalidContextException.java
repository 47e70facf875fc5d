package com.campaignrl.common.exception;

public class InvalidContextException extends RlDomainException {

    public InvalidContextException(String message) {
        super("INVALID_CONTEXT", message);
    }
}
