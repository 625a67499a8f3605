package com.autopilot.exchange.feed;

import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

@FunctionalInterface
public interface ReconnectScheduler {

    void schedule(Runnable task, long delayMs);

    /**
     * Daemon single-thread scheduler; the returned instance owns its thread for the JVM lifetime.
     */
    static ReconnectScheduler daemon(String threadName) {
        ScheduledExecutorService executor = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, threadName);
            t.setDaemon(true);
            return t;
        });
        return (task, delayMs) -> executor.schedule(task, delayMs, TimeUnit.MILLISECONDS);
    }
}
