package com.ai.salescaller.exception;

/**
 * Authentication, validation or malformed-payload error. Retrying will not help.
 */
public class PermanentProviderException extends ProviderException {

    private final int status;

    public PermanentProviderException(String provider, String message) {
        this(provider, message, 0, null);
    }

    public PermanentProviderException(String provider, String message, int status, Throwable cause) {
        super(provider, message, cause);
        this.status = status;
    }

    /** HTTP status that caused the failure, or 0 when it was not an HTTP response. */
    public int getStatus() {
        return status;
    }

    @Override
    public boolean isRetryable() {
        return false;
    }
}
