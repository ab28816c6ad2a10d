package com.ai.salescaller.service.dispatch;

import java.time.Duration;

/**
 * Pause between retry attempts. Replaced in tests so backoff does not wait in real time.
 */
@FunctionalInterface
public interface Sleeper {

    Sleeper THREAD = d -> Thread.sleep(d.toMillis());

    void sleep(Duration duration) throws InterruptedException;
}
