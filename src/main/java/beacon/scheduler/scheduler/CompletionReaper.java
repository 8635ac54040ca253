package beacon.scheduler.scheduler;

import beacon.scheduler.service.TriggerService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Background task that deletes COMPLETED and dead-lettered triggers.
 */
public class CompletionReaper implements Runnable {

    private static final Logger log = LoggerFactory.getLogger(CompletionReaper.class);

    private final TriggerService triggerService;

    public CompletionReaper(TriggerService triggerService) {
        this.triggerService = triggerService;
    }

    @Override
    public void run() {
        try {
            tick();
        } catch (Exception e) {
            log.error("Completion reaper error", e);
        }
    }

    /**
     * One reaper pass.
     *
     * @return number of triggers deleted
     */
    public int tick() {
        return triggerService.cleanComplete();
    }
}
