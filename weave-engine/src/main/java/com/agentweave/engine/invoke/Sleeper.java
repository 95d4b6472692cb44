package com.agentweave.engine.invoke;

import java.time.Duration;

/** Waits between retry attempts. Tests substitute a recording implementation. */
@FunctionalInterface
public interface Sleeper {

    Sleeper SYSTEM = delay -> {
        long ms = delay.toMillis();
        if (ms > 0) Thread.sleep(ms);
    };

    void sleep(Duration delay) throws InterruptedException;
}
