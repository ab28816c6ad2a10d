package com.ai.salescaller.exception;

import org.springframework.http.HttpStatusCode;
import org.springframework.web.client.HttpStatusCodeException;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClientException;

import java.io.IOException;
import java.util.concurrent.TimeoutException;

/**
 * Translates transport exceptions into {@link TransientProviderException} or
 * {@link PermanentProviderException}.
 */
public final class ProviderErrors {

    private ProviderErrors() {
    }

    public static ProviderException translate(String provider, Throwable error) {
        if (error instanceof ProviderException) {
            return (ProviderException) error;
        }
        if (error instanceof HttpStatusCodeException) {
            HttpStatusCodeException http = (HttpStatusCodeException) error;
            return fromStatus(provider, http.getStatusCode(), http);
        }
        if (error instanceof ResourceAccessException
                || error instanceof TimeoutException
                || error instanceof IOException) {
            return new TransientProviderException(provider, "I/O failure: " + error.getMessage(), error);
        }
        if (error instanceof RestClientException) {
            // body could not be read or converted
            return new PermanentProviderException(provider, "Unreadable response: " + error.getMessage(), 0, error);
        }
        return new TransientProviderException(provider, "Unexpected failure: " + error, error);
    }

    public static ProviderException fromStatus(String provider, HttpStatusCode status, Throwable cause) {
        int code = status.value();
        if (status.is5xxServerError() || code == 408 || code == 429) {
            return new TransientProviderException(provider, "HTTP " + code, cause);
        }
        return new PermanentProviderException(provider, "HTTP " + code, code, cause);
    }
}
