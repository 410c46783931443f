package com.clapgrow.bridge.api.delivery;

import java.time.Duration;

/**
 * Waits between delivery attempts. Replaced in tests to record delays instead of sleeping.
 */
@FunctionalInterface
public interface BackoffSleeper {

    BackoffSleeper THREAD_SLEEP = delay -> Thread.sleep(delay.toMillis());

    void sleep(Duration delay) throws InterruptedException;
}
