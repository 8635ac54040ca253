package beacon.scheduler.scheduler;

import beacon.scheduler.model.ReclaimResult;
import beacon.scheduler.service.TriggerService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Background task that reclaims expired leases.
 *
 * A lease expires when its holder stops heartbeating:
 * - the consumer process died or was killed
 * - the handler hangs past the module timeout
 * - the node lost its database connection
 *
 * Each expired trigger goes back to WAITING with retries + 1 and its
 * next_run_at unchanged, so it is due again immediately. Triggers whose retry
 * budget is now spent are left for the {@link CompletionReaper}.
 */
public class TimeoutWatchdog implements Runnable {

    private static final Logger log = LoggerFactory.getLogger(TimeoutWatchdog.class);

    private final TriggerService triggerService;

    public TimeoutWatchdog(TriggerService triggerService) {
        this.triggerService = triggerService;
    }

    @Override
    public void run() {
        try {
            tick();
        } catch (Exception e) {
            log.error("Timeout watchdog error", e);
        }
    }

    /**
     * One watchdog pass.
     */
    public ReclaimResult tick() {
        ReclaimResult result = triggerService.watchTimeout();
        if (result.exhausted() > 0) {
            log.warn("{} triggers ran out of retries after lease timeout", result.exhausted());
        }
        return result;
    }
}
