package com.ai.salescaller.exception;

/**
 * Network error, timeout, 5xx, throttling. Safe to retry with backoff.
 */
public class TransientProviderException extends ProviderException {

    public TransientProviderException(String provider, String message) {
        super(provider, message, null);
    }

    public TransientProviderException(String provider, String message, Throwable cause) {
        super(provider, message, cause);
    }

    @Override
    public boolean isRetryable() {
        return true;
    }
}
