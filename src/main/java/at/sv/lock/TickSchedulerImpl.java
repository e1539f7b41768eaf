package at.sv.lock;

import lombok.extern.slf4j.Slf4j;

import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

@Slf4j
public final class TickSchedulerImpl implements TickScheduler {

    private final ScheduledExecutorService scheduler;
    private final long terminationTimeoutInSeconds;

    public TickSchedulerImpl(ScheduledExecutorService scheduler, long terminationTimeoutInSeconds) {
        this.scheduler = scheduler;
        this.terminationTimeoutInSeconds = terminationTimeoutInSeconds;
    }

    @Override
    public void scheduleWithFixedDelay(Runnable runnable, long initialDelay, long delay, TimeUnit unit) {
        scheduler.scheduleWithFixedDelay(logUncaughtException(runnable), initialDelay, delay, unit);
    }

    @Override
    public void shutdown() {
        scheduler.shutdown();
        try {
            if (!scheduler.awaitTermination(terminationTimeoutInSeconds, TimeUnit.SECONDS)) {
                log.warn("Running tick did not complete within {} seconds.", terminationTimeoutInSeconds);
                scheduler.shutdownNow();
            }
        } catch (InterruptedException e) {
            scheduler.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    /**
     * An exception escaping a periodic task would suppress all subsequent runs.
     */
    private Runnable logUncaughtException(Runnable runnable) {
        return () -> {
            try {
                runnable.run();
            } catch (Exception e) {
                log.error("Uncaught exception: {}", e.getLocalizedMessage(), e);
            }
        };
    }
}
