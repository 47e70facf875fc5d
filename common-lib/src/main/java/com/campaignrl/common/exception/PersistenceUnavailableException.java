package com.campaignrl.common.exception;

/**
 * Durable store unreachable. In-memory learning state stays authoritative;
 * the failed write is retried at the next batch boundary.
 */
public class PersistenceUnavailableException extends RlDomainException {

    private final String operation;

    public PersistenceUnavailableException(String operation, Throwable cause) {
        super("PERSISTENCE_UNAVAILABLE", "[" + operation + "] persistence unavailable: " + cause.getMessage(), cause);
        this.operation = operation;
    }

    public String getOperation() {
        return operation;
    }
}
