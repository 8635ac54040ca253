package beacon.scheduler.service;

import beacon.scheduler.config.RetryPolicy;
import beacon.scheduler.config.SchedulerConfig;
import beacon.scheduler.exception.TriggerNotFoundException;
import beacon.scheduler.model.ReclaimResult;
import beacon.scheduler.model.StatusUpdate;
import beacon.scheduler.model.Trigger;
import beacon.scheduler.model.TriggerKey;
import beacon.scheduler.model.TriggerModule;
import beacon.scheduler.model.TriggerStatus;
import beacon.scheduler.repository.TriggerRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Collection;
import java.util.List;
import java.util.Optional;

/**
 * Service layer for trigger operations.
 * Owns the lease protocol (pull, keep-alive), the consumer status reports and
 * the two maintenance passes run by the background loops.
 */
public class TriggerService {

    private static final Logger log = LoggerFactory.getLogger(TriggerService.class);

    private final TriggerRepository triggerRepository;
    private final RetryPolicy retryPolicy;

    public TriggerService(TriggerRepository triggerRepository, SchedulerConfig config) {
        this(triggerRepository, config.retryPolicy());
    }

    public TriggerService(TriggerRepository triggerRepository, RetryPolicy retryPolicy) {
        this.triggerRepository = triggerRepository;
        this.retryPolicy = retryPolicy;
    }

    public RetryPolicy retryPolicy() {
        return retryPolicy;
    }

    // ---- Store operations ----

    /**
     * Insert a trigger unless one with the same (org, module, key) exists.
     * Pushing an existing trigger is a no-op. Lease timestamps on the given
     * trigger are not stored.
     *
     * @return true if a new row was created
     */
    public boolean push(Trigger trigger) {
        if (trigger == null) {
            throw new IllegalArgumentException("trigger is required");
        }
        requireReportable(trigger.status());

        boolean created = triggerRepository.push(trigger);
        if (created) {
            log.debug("Pushed trigger {} due at {}", trigger.identity(), trigger.nextRunAt());
        }
        return created;
    }

    /**
     * Delete a trigger.
     *
     * @throws TriggerNotFoundException if the trigger does not exist
     */
    public void delete(TriggerKey key) {
        if (!triggerRepository.delete(key)) {
            throw new TriggerNotFoundException(key);
        }
        log.info("Deleted trigger {}", key);
    }

    /**
     * Delete a trigger if present.
     *
     * @return true if a row was deleted
     */
    public boolean deleteIfExists(TriggerKey key) {
        return triggerRepository.delete(key);
    }

    /**
     * Point read.
     *
     * @throws TriggerNotFoundException if the trigger does not exist
     */
    public Trigger get(TriggerKey key) {
        return triggerRepository.findByKey(key)
                .orElseThrow(() -> new TriggerNotFoundException(key));
    }

    public Optional<Trigger> find(TriggerKey key) {
        return triggerRepository.findByKey(key);
    }

    public List<Trigger> list(Optional<TriggerModule> module) {
        return triggerRepository.list(module);
    }

    public List<Trigger> listByOrg(String org, Optional<TriggerModule> module) {
        if (org == null || org.isBlank()) {
            throw new IllegalArgumentException("org is required");
        }
        return triggerRepository.listByOrg(org, module);
    }

    public long len() {
        return triggerRepository.count();
    }

    public long lenModule(TriggerModule module) {
        return triggerRepository.countByModule(module);
    }

    public boolean isEmpty() {
        return len() == 0;
    }

    public long countByStatus(TriggerStatus status) {
        return triggerRepository.countByStatus(status);
    }

    /**
     * Delete every trigger.
     *
     * @return number of rows deleted
     */
    public int clear() {
        int deleted = triggerRepository.clear();
        log.warn("Cleared {} triggers", deleted);
        return deleted;
    }

    // ---- Lease protocol ----

    /**
     * Lease up to {@code concurrency} due triggers.
     * A trigger returned here is returned to no other caller until its lease
     * is released or expires.
     */
    public List<Trigger> pull(int concurrency, Duration alertTimeout, Duration reportTimeout) {
        if (concurrency <= 0) {
            throw new IllegalArgumentException("concurrency must be positive");
        }
        requirePositive("alertTimeout", alertTimeout);
        requirePositive("reportTimeout", reportTimeout);

        List<Trigger> leased = triggerRepository.lease(concurrency, alertTimeout, reportTimeout, retryPolicy);
        if (!leased.isEmpty()) {
            log.info("Leased {} triggers (requested {})", leased.size(), concurrency);
        } else {
            log.debug("No due triggers to lease");
        }
        return leased;
    }

    /**
     * Heartbeat for triggers still being processed. Leases that were already
     * released or reclaimed are ignored.
     *
     * @return number of leases extended
     */
    public int keepAlive(Collection<Long> ids, Duration alertTimeout, Duration reportTimeout) {
        if (ids == null || ids.isEmpty()) {
            return 0;
        }
        for (Long id : ids) {
            if (id == null) {
                throw new IllegalArgumentException("keep-alive ids must not be null");
            }
        }
        requirePositive("alertTimeout", alertTimeout);
        requirePositive("reportTimeout", reportTimeout);

        int extended = triggerRepository.extendLeases(ids, alertTimeout, reportTimeout);
        if (extended < ids.size()) {
            log.debug("Keep-alive extended {} of {} leases", extended, ids.size());
        }
        return extended;
    }

    // ---- Consumer reports ----

    /**
     * Report the outcome of one trigger. A null {@code data} keeps the stored
     * payload.
     *
     * @return true if the trigger exists
     */
    public boolean updateStatus(StatusUpdate update) {
        requireReportable(update.status());

        boolean updated = triggerRepository.updateStatus(update);
        if (!updated) {
            log.warn("Status update for missing trigger {}", update.key());
        }
        return updated;
    }

    public boolean updateStatus(String org, TriggerModule module, String key, TriggerStatus status, int retries,
            String data) {
        return updateStatus(StatusUpdate.of(org, module, key, status, retries, data));
    }

    /**
     * Write back a trigger, including its schedule and realtime flags. The
     * trigger is addressed by its (org, module, key), which are never changed.
     *
     * @return true if the trigger exists
     */
    public boolean updateTrigger(Trigger trigger) {
        requireReportable(trigger.status());

        boolean updated = triggerRepository.update(trigger);
        if (!updated) {
            log.warn("Update for missing trigger {}", trigger.identity());
        }
        return updated;
    }

    /**
     * Batched {@link #updateStatus(StatusUpdate)} executed as one store batch.
     *
     * @return number of triggers updated
     */
    public int bulkUpdateStatus(List<StatusUpdate> updates) {
        if (updates == null || updates.isEmpty()) {
            return 0;
        }
        for (StatusUpdate update : updates) {
            requireReportable(update.status());
        }

        int updated = triggerRepository.updateStatuses(updates);
        log.debug("Bulk status update: {} of {} triggers", updated, updates.size());
        return updated;
    }

    /**
     * Batched {@link #updateTrigger(Trigger)} executed as one store batch.
     *
     * @return number of triggers updated
     */
    public int bulkUpdateTriggers(List<Trigger> triggers) {
        if (triggers == null || triggers.isEmpty()) {
            return 0;
        }
        for (Trigger trigger : triggers) {
            requireReportable(trigger.status());
        }

        int updated = triggerRepository.updateAll(triggers);
        log.debug("Bulk trigger update: {} of {} triggers", updated, triggers.size());
        return updated;
    }

    // ---- Maintenance ----

    /**
     * Return expired leases to WAITING with one more retry.
     */
    public ReclaimResult watchTimeout() {
        ReclaimResult result = triggerRepository.reclaimExpired(retryPolicy);
        if (result.total() > 0) {
            log.info("Reclaimed {} expired leases ({} requeued, {} out of retries)",
                    result.total(), result.requeued(), result.exhausted());
        } else {
            log.debug("No expired leases");
        }
        return result;
    }

    /**
     * Delete completed and dead-lettered triggers.
     *
     * @return number of rows deleted
     */
    public int cleanComplete() {
        int deleted = triggerRepository.deleteFinished(retryPolicy);
        if (deleted > 0) {
            log.info("Cleaned {} finished triggers", deleted);
        } else {
            log.debug("No finished triggers to clean");
        }
        return deleted;
    }

    private static void requireReportable(TriggerStatus status) {
        if (status == TriggerStatus.PROCESSING) {
            throw new IllegalArgumentException("PROCESSING is set only by pull");
        }
    }

    private static void requirePositive(String name, Duration value) {
        if (value == null || value.isZero() || value.isNegative()) {
            throw new IllegalArgumentException(name + " must be positive");
        }
    }
}
