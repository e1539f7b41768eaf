package at.sv.lock;

import java.util.concurrent.TimeUnit;

public interface TickScheduler {
    void scheduleWithFixedDelay(Runnable runnable, long initialDelay, long delay, TimeUnit unit);

    /**
     * Cancels all pending runs. A run already in progress is allowed to complete.
     */
    void shutdown();
}
