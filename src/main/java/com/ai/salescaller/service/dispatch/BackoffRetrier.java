package com.ai.salescaller.service.dispatch;

import com.ai.salescaller.config.DispatchProperties;
import com.ai.salescaller.exception.ProviderException;
import com.ai.salescaller.exception.TransientProviderException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.Duration;

/**
 * Retries an operation on {@link ProviderException#isRetryable() retryable} failures with exponential
 * backoff: retry n waits {@code base * factor^(n-1)}, capped at {@code max-backoff}. Permanent failures are
 * rethrown at once; the last transient failure is rethrown once attempts run out.
 */
@Component
public class BackoffRetrier {

    private static final Logger log = LoggerFactory.getLogger(BackoffRetrier.class);

    private final DispatchProperties properties;
    private final Sleeper sleeper;

    public BackoffRetrier(DispatchProperties properties, Sleeper sleeper) {
        this.properties = properties;
        this.sleeper = sleeper;
    }

    @FunctionalInterface
    public interface RetryableOperation {
        void execute();
    }

    public void run(String what, RetryableOperation operation) {
        int maxAttempts = Math.max(1, properties.getMaxAttempts());
        int attempt = 0;
        while (true) {
            attempt++;
            try {
                operation.execute();
                if (attempt > 1) {
                    log.info("{} succeeded on attempt {}", what, attempt);
                }
                return;
            } catch (ProviderException e) {
                if (!e.isRetryable() || attempt >= maxAttempts) {
                    throw e;
                }
                Duration delay = delayBefore(attempt + 1);
                log.warn("{} attempt {}/{} failed ({}), retrying in {}ms", what, attempt, maxAttempts, e.getMessage(), delay.toMillis());
                try {
                    sleeper.sleep(delay);
                } catch (InterruptedException ie) {
                    Thread.currentThread().interrupt();
                    throw new TransientProviderException(e.getProvider(), "Retry interrupted", ie);
                }
            }
        }
    }

    /** Delay before the given attempt (attempt 2 waits the base backoff). */
    Duration delayBefore(int attempt) {
        double millis = properties.getBaseBackoff().toMillis() * Math.pow(properties.getBackoffFactor(), attempt - 2);
        long capped = (long) Math.min(millis, properties.getMaxBackoff().toMillis());
        return Duration.ofMillis(Math.max(0, capped));
    }
}
