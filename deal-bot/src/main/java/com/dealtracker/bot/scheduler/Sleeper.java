package com.dealtracker.bot.scheduler;

import java.time.Duration;

/**
 * Blocking pause used by the polling loop for tick slices and dispatch pacing.
 */
@FunctionalInterface
public interface Sleeper {

    void sleep(Duration duration) throws InterruptedException;

    static Sleeper threadSleep() {
        return duration -> Thread.sleep(duration.toMillis());
    }
}
