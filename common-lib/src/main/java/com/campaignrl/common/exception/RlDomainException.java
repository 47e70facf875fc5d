package com.campaignrl.common.exception;

/**
 * Root of every error raised by the learning core.
 *
 * <p>Unchecked: validation failures surface to the caller of
 * {@code addExperience}/{@code learnFromExperience} synchronously, the rest are
 * recovered or logged at the service boundary.
 */
public class RlDomainException extends RuntimeException {

    private final String errorCode;

    public RlDomainException(String errorCode, String message) {
        super(message);
        this.errorCode = errorCode;
    }

    public RlDomainException(String errorCode, String message, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
    }

    public String getErrorCode() {
        return errorCode;
    }
}
