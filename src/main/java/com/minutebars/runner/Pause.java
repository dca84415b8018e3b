package com.minutebars.runner;

import java.time.Duration;

/**
 * Blocking wait between provider requests.
 */
@FunctionalInterface
public interface Pause {
    Pause SLEEP = duration -> {
        if (!duration.isZero() && !duration.isNegative()) {
            Thread.sleep(duration.toMillis());
        }
    };

    void await(Duration duration) throws InterruptedException;
}
