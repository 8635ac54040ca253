package beacon.scheduler.worker;

import beacon.scheduler.config.SchedulerConfig;
import beacon.scheduler.model.StatusUpdate;
import beacon.scheduler.model.Trigger;
import beacon.scheduler.model.TriggerModule;
import beacon.scheduler.model.TriggerStatus;
import beacon.scheduler.service.TriggerService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Job executor loop run on every node.
 * Pulls due triggers every poll interval, hands each to the handler of its
 * module on a worker pool and heartbeats the lease while the handler runs.
 * Never holds more than {@code concurrency} leases at once.
 */
public class TriggerPoller implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(TriggerPoller.class);

    private final TriggerService triggerService;
    private final SchedulerConfig config;
    private final Map<TriggerModule, TriggerHandler> handlers;
    private final Clock clock;

    private final ScheduledExecutorService pollExecutor;
    private final ScheduledExecutorService heartbeatExecutor;
    private final ExecutorService workers;
    private final AtomicInteger inFlight = new AtomicInteger();

    private volatile boolean running = false;

    public TriggerPoller(TriggerService triggerService, SchedulerConfig config,
            Map<TriggerModule, TriggerHandler> handlers, Clock clock) {
        this.triggerService = triggerService;
        this.config = config;
        this.handlers = handlers.isEmpty() ? new EnumMap<>(TriggerModule.class) : new EnumMap<>(handlers);
        this.clock = clock;
        this.pollExecutor = Executors.newSingleThreadScheduledExecutor(daemon("beacon-poller"));
        this.heartbeatExecutor = Executors.newSingleThreadScheduledExecutor(daemon("beacon-heartbeat"));
        AtomicInteger workerIds = new AtomicInteger();
        this.workers = Executors.newFixedThreadPool(config.concurrency(),
                r -> {
                    Thread t = new Thread(r, "beacon-worker-" + workerIds.incrementAndGet());
                    t.setDaemon(true);
                    return t;
                });
    }

    /**
     * Start polling.
     */
    public void start() {
        if (running) {
            log.warn("Trigger poller already running");
            return;
        }

        running = true;

        long pollIntervalMs = config.pollInterval().toMillis();
        pollExecutor.scheduleWithFixedDelay(() -> {
            try {
                pollOnce();
            } catch (Exception e) {
                log.error("Trigger poll error", e);
            }
        }, 0, pollIntervalMs, TimeUnit.MILLISECONDS);

        log.info("Trigger poller started: every {}ms, concurrency {}, handlers {}",
                pollIntervalMs, config.concurrency(), handlers.keySet());
    }

    /**
     * Lease as many triggers as there are free workers and dispatch them.
     *
     * @return one future per dispatched trigger
     */
    public List<Future<?>> pollOnce() {
        int capacity = config.concurrency() - inFlight.get();
        if (capacity <= 0) {
            log.debug("All {} workers busy, skipping poll", config.concurrency());
            return List.of();
        }

        List<Trigger> leased = triggerService.pull(capacity, config.alertTimeout(), config.reportTimeout());

        List<Future<?>> dispatched = new ArrayList<>(leased.size());
        for (Trigger trigger : leased) {
            inFlight.incrementAndGet();
            try {
                dispatched.add(workers.submit(() -> {
                    try {
                        process(trigger);
                    } finally {
                        inFlight.decrementAndGet();
                    }
                }));
            } catch (RuntimeException e) {
                inFlight.decrementAndGet();
                throw e;
            }
        }
        return dispatched;
    }

    /**
     * Run one leased trigger to completion on the calling thread.
     */
    void process(Trigger trigger) {
        if (trigger.needsWakeup()) {
            wakeUp(trigger);
            return;
        }

        TriggerHandler handler = handlers.get(trigger.module());
        if (handler == null) {
            log.warn("No handler for module {}, returning trigger {}", trigger.module(), trigger.identity());
            requeue(trigger);
            return;
        }

        Duration timeout = trigger.leaseTimeout(config.alertTimeout(), config.reportTimeout());
        long heartbeatMs = Math.max(1, timeout.toMillis() / 4);
        ScheduledFuture<?> heartbeat = heartbeatExecutor.scheduleAtFixedRate(
                () -> heartbeat(trigger),
                heartbeatMs,
                heartbeatMs,
                TimeUnit.MILLISECONDS);

        try {
            handler.handle(trigger, triggerService);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Handler interrupted for trigger {}", trigger.identity());
        } catch (Exception e) {
            log.error("Handler failed for trigger {}", trigger.identity(), e);
            requeue(trigger);
        } finally {
            heartbeat.cancel(false);
        }
    }

    /**
     * A realtime alert leaves its cool-down: it goes back to the ingest path.
     */
    private void wakeUp(Trigger trigger) {
        triggerService.updateTrigger(trigger.toBuilder()
                .status(TriggerStatus.WAITING)
                .silenced(false)
                .nextRunAt(clock.instant())
                .build());
        log.info("Woke up realtime trigger {}", trigger.identity());
    }

    private void requeue(Trigger trigger) {
        try {
            triggerService.updateStatus(new StatusUpdate(
                    trigger.identity(), TriggerStatus.WAITING, trigger.retries() + 1, null));
        } catch (Exception e) {
            // the watchdog reclaims it once the lease expires
            log.error("Failed to requeue trigger {}", trigger.identity(), e);
        }
    }

    private void heartbeat(Trigger trigger) {
        try {
            triggerService.keepAlive(List.of(trigger.id()), config.alertTimeout(), config.reportTimeout());
        } catch (Exception e) {
            log.warn("Heartbeat failed for trigger {}: {}", trigger.identity(), e.getMessage());
        }
    }

    public int inFlight() {
        return inFlight.get();
    }

    public boolean isRunning() {
        return running;
    }

    /**
     * Stop polling and wait for running handlers.
     */
    public void stop() {
        running = false;
        pollExecutor.shutdown();
        workers.shutdown();

        try {
            if (!workers.awaitTermination(10, TimeUnit.SECONDS)) {
                workers.shutdownNow();
                log.warn("Trigger poller forcefully stopped with {} handlers running", inFlight.get());
            } else {
                log.info("Trigger poller stopped");
            }
        } catch (InterruptedException e) {
            workers.shutdownNow();
            Thread.currentThread().interrupt();
        } finally {
            heartbeatExecutor.shutdownNow();
        }
    }

    @Override
    public void close() {
        stop();
    }

    private static ThreadFactory daemon(String name) {
        return r -> {
            Thread t = new Thread(r, name);
            t.setDaemon(true);
            return t;
        };
    }
}
