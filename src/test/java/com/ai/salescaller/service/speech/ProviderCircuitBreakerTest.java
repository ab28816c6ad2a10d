package com.ai.salescaller.service.speech;

import com.ai.salescaller.testutil.MutableClock;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;

class ProviderCircuitBreakerTest {

    private final MutableClock clock = new MutableClock(Instant.parse("2024-03-13T09:00:00Z"));
    private final ProviderCircuitBreaker breaker =
            new ProviderCircuitBreaker("elevenlabs", 3, Duration.ofSeconds(30), Duration.ofSeconds(60), clock);

    @Test
    void shouldOpenAfterThresholdFailuresInsideWindow() {
        breaker.recordFailure();
        breaker.recordFailure();
        assertThat(breaker.getState()).isEqualTo(ProviderCircuitBreaker.State.CLOSED);

        breaker.recordFailure();

        assertThat(breaker.getState()).isEqualTo(ProviderCircuitBreaker.State.OPEN);
        assertThat(breaker.tryAcquire()).isFalse();
    }

    @Test
    void shouldForgetFailuresOutsideWindow() {
        breaker.recordFailure();
        breaker.recordFailure();
        clock.advance(Duration.ofSeconds(31));

        breaker.recordFailure();

        assertThat(breaker.getState()).isEqualTo(ProviderCircuitBreaker.State.CLOSED);
    }

    @Test
    void shouldAllowSingleTrialAfterCoolDownAndCloseOnSuccess() {
        openBreaker();
        clock.advance(Duration.ofSeconds(60));

        assertThat(breaker.tryAcquire()).isTrue();
        assertThat(breaker.getState()).isEqualTo(ProviderCircuitBreaker.State.HALF_OPEN);
        assertThat(breaker.tryAcquire()).as("second caller during trial").isFalse();

        breaker.recordSuccess();

        assertThat(breaker.getState()).isEqualTo(ProviderCircuitBreaker.State.CLOSED);
        assertThat(breaker.tryAcquire()).isTrue();
    }

    @Test
    void shouldReopenWhenTrialFails() {
        openBreaker();
        clock.advance(Duration.ofSeconds(61));
        assertThat(breaker.tryAcquire()).isTrue();

        breaker.recordFailure();

        assertThat(breaker.getState()).isEqualTo(ProviderCircuitBreaker.State.OPEN);
        clock.advance(Duration.ofSeconds(30));
        assertThat(breaker.tryAcquire()).isFalse();
    }

    @Test
    void shouldStayOpenBeforeCoolDownEnds() {
        openBreaker();
        clock.advance(Duration.ofSeconds(59));

        assertThat(breaker.tryAcquire()).isFalse();
    }

    private void openBreaker() {
        for (int i = 0; i < 3; i++) {
            breaker.recordFailure();
        }
    }
}
