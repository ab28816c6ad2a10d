package com.ai.salescaller.exception;

/**
 * Failure of an external provider (speech, language model, record store, workflow endpoint),
 * already classified at the adapter boundary. Callers never see raw transport exceptions.
 */
public abstract class ProviderException extends SalesCallerException {

    private final String provider;

    protected ProviderException(String provider, String message, Throwable cause) {
        super(message + " (provider: " + provider + ")", cause);
        this.provider = provider;
    }

    public String getProvider() {
        return provider;
    }

    /** True when the same request may succeed if repeated later. */
    public abstract boolean isRetryable();
}
