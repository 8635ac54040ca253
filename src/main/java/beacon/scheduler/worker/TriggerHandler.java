package beacon.scheduler.worker;

import beacon.scheduler.model.Trigger;
import beacon.scheduler.service.TriggerService;

/**
 * Evaluates one leased trigger (an alert check or a report run).
 *
 * The handler reports the outcome itself through
 * {@link TriggerService#updateStatus} or {@link TriggerService#updateTrigger},
 * for example COMPLETED for a one-shot report or WAITING with the next
 * next_run_at and retries reset to 0 for a recurring alert. A handler that
 * returns without reporting leaves the trigger PROCESSING until its lease
 * expires. Throwing puts the trigger back to WAITING with one more retry.
 */
@FunctionalInterface
public interface TriggerHandler {

    void handle(Trigger trigger, TriggerService triggerService) throws Exception;
}
