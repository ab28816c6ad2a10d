package com.ai.salescaller.service.dispatch;

import com.ai.salescaller.config.DispatchProperties;
import com.ai.salescaller.exception.PermanentProviderException;
import com.ai.salescaller.exception.TransientProviderException;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class BackoffRetrierTest {

    private final List<Duration> sleeps = new ArrayList<>();
    private final DispatchProperties properties = new DispatchProperties();
    private final BackoffRetrier retrier = new BackoffRetrier(properties, sleeps::add);

    @Test
    void shouldRetryTransientFailuresWithExponentialBackoff() {
        AtomicInteger attempts = new AtomicInteger();

        retrier.run("update", () -> {
            if (attempts.incrementAndGet() < 3) {
                throw new TransientProviderException("database", "busy");
            }
        });

        assertThat(attempts.get()).isEqualTo(3);
        assertThat(sleeps).containsExactly(Duration.ofSeconds(1), Duration.ofSeconds(2));
    }

    @Test
    void shouldNotRetryPermanentFailure() {
        AtomicInteger attempts = new AtomicInteger();

        assertThatThrownBy(() -> retrier.run("update", () -> {
            attempts.incrementAndGet();
            throw new PermanentProviderException("workflow", "400 Bad Request");
        })).isInstanceOf(PermanentProviderException.class);

        assertThat(attempts.get()).isEqualTo(1);
        assertThat(sleeps).isEmpty();
    }

    @Test
    void shouldGiveUpAfterMaxAttempts() {
        AtomicInteger attempts = new AtomicInteger();

        assertThatThrownBy(() -> retrier.run("update", () -> {
            attempts.incrementAndGet();
            throw new TransientProviderException("workflow", "503");
        })).isInstanceOf(TransientProviderException.class);

        assertThat(attempts.get()).isEqualTo(5);
        assertThat(sleeps).containsExactly(
                Duration.ofSeconds(1), Duration.ofSeconds(2), Duration.ofSeconds(4), Duration.ofSeconds(8));
    }

    @Test
    void shouldCapBackoff() {
        properties.setBaseBackoff(Duration.ofSeconds(10));
        properties.setMaxBackoff(Duration.ofSeconds(30));

        assertThat(retrier.delayBefore(2)).isEqualTo(Duration.ofSeconds(10));
        assertThat(retrier.delayBefore(3)).isEqualTo(Duration.ofSeconds(20));
        assertThat(retrier.delayBefore(4)).isEqualTo(Duration.ofSeconds(30));
        assertThat(retrier.delayBefore(6)).isEqualTo(Duration.ofSeconds(30));
    }

    @Test
    void shouldTurnInterruptIntoTransientFailure() {
        BackoffRetrier interrupted = new BackoffRetrier(properties, d -> {
            throw new InterruptedException();
        });

        assertThatThrownBy(() -> interrupted.run("update", () -> {
            throw new TransientProviderException("workflow", "503");
        })).isInstanceOf(TransientProviderException.class).hasMessageContaining("interrupted");
        assertThat(Thread.interrupted()).isTrue();
    }
}
