package beacon.scheduler.scheduler;

import beacon.scheduler.config.SchedulerConfig;
import beacon.scheduler.service.TriggerService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * Runs the lease watchdog and the completion reaper on one daemon thread,
 * each on its own interval. Every node runs one; the store statements behind
 * both loops tolerate other nodes running them at the same time.
 */
public class Scheduler implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(Scheduler.class);

    private static final long SHUTDOWN_GRACE_SECONDS = 5;

    private final ScheduledExecutorService loop;
    private final TimeoutWatchdog watchdog;
    private final CompletionReaper reaper;
    private final Duration watchInterval;
    private final Duration cleanInterval;

    private volatile boolean running;

    public Scheduler(TriggerService triggerService, SchedulerConfig config) {
        this.watchdog = new TimeoutWatchdog(triggerService);
        this.reaper = new CompletionReaper(triggerService);
        this.watchInterval = config.watchInterval();
        this.cleanInterval = config.cleanInterval();
        this.loop = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread thread = new Thread(r, "beacon-scheduler");
            thread.setDaemon(true);
            return thread;
        });
    }

    public synchronized void start() {
        if (running) {
            log.warn("Maintenance loops already started");
            return;
        }
        running = true;

        every(watchInterval, watchdog);
        every(cleanInterval, reaper);
        log.info("Maintenance loops started: watch every {}, clean every {}", watchInterval, cleanInterval);
    }

    private void every(Duration interval, Runnable task) {
        long ms = interval.toMillis();
        loop.scheduleWithFixedDelay(task, ms, ms, TimeUnit.MILLISECONDS);
    }

    public synchronized void stop() {
        if (!running) {
            return;
        }
        running = false;
        loop.shutdown();

        try {
            if (loop.awaitTermination(SHUTDOWN_GRACE_SECONDS, TimeUnit.SECONDS)) {
                log.info("Maintenance loops stopped");
            } else {
                loop.shutdownNow();
                log.warn("Maintenance tick still running after {}s, interrupted", SHUTDOWN_GRACE_SECONDS);
            }
        } catch (InterruptedException e) {
            loop.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    @Override
    public void close() {
        stop();
    }

    public boolean isRunning() {
        return running;
    }

    /** Tick source for callers that reclaim on demand rather than waiting for the loop. */
    public TimeoutWatchdog watchdog() {
        return watchdog;
    }

    public CompletionReaper reaper() {
        return reaper;
    }
}
