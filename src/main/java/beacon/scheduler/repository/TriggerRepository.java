package beacon.scheduler.repository;

import beacon.scheduler.config.RetryPolicy;
import beacon.scheduler.model.ReclaimResult;
import beacon.scheduler.model.StatusUpdate;
import beacon.scheduler.model.Trigger;
import beacon.scheduler.model.TriggerKey;
import beacon.scheduler.model.TriggerModule;
import beacon.scheduler.model.TriggerStatus;

import java.time.Duration;
import java.util.Collection;
import java.util.List;
import java.util.Optional;

/**
 * Repository interface for trigger persistence.
 * One implementation per backing store; the leasing statement is backend
 * specific and must skip rows locked by concurrent transactions.
 */
public interface TriggerRepository {

    /**
     * Insert a trigger unless (org, module, key) already exists.
     *
     * @param trigger the trigger to insert
     * @return true if inserted, false if it already existed
     */
    boolean push(Trigger trigger);

    /**
     * Delete a trigger.
     *
     * @param key trigger identity
     * @return true if a row was deleted
     */
    boolean delete(TriggerKey key);

    /**
     * Point read.
     *
     * @param key trigger identity
     * @return the trigger if found
     */
    Optional<Trigger> findByKey(TriggerKey key);

    /**
     * Full scan, optionally filtered by module.
     */
    List<Trigger> list(Optional<TriggerModule> module);

    /**
     * Scan one tenant, optionally filtered by module.
     */
    List<Trigger> listByOrg(String org, Optional<TriggerModule> module);

    /** Count all triggers */
    long count();

    /** Count triggers of one module */
    long countByModule(TriggerModule module);

    /** Count triggers in one status */
    long countByStatus(TriggerStatus status);

    /**
     * Delete every trigger.
     *
     * @return number of rows deleted
     */
    int clear();

    /**
     * Lease up to {@code limit} eligible WAITING triggers, oldest next_run_at
     * first, moving them to PROCESSING. Rows locked by a concurrent lease are
     * skipped, never waited on.
     *
     * @param limit         maximum triggers to lease
     * @param alertTimeout  lease length for alert triggers
     * @param reportTimeout lease length for report triggers
     * @param retryPolicy   triggers with spent retries are not leased
     * @return leased triggers, ordered by next_run_at
     */
    List<Trigger> lease(int limit, Duration alertTimeout, Duration reportTimeout, RetryPolicy retryPolicy);

    /**
     * Push the lease deadline of PROCESSING triggers forward.
     *
     * @param ids           trigger ids
     * @param alertTimeout  lease length for alert triggers
     * @param reportTimeout lease length for report triggers
     * @return number of leases extended
     */
    int extendLeases(Collection<Long> ids, Duration alertTimeout, Duration reportTimeout);

    /**
     * Report one outcome.
     *
     * @return true if the trigger exists
     */
    boolean updateStatus(StatusUpdate update);

    /**
     * Report many outcomes in one batch.
     *
     * @return number of triggers updated
     */
    int updateStatuses(List<StatusUpdate> updates);

    /**
     * Write status, retries, next_run_at, realtime/silenced flags and data of
     * an existing trigger, addressed by its (org, module, key).
     *
     * @return true if the trigger exists
     */
    boolean update(Trigger trigger);

    /**
     * Batched {@link #update(Trigger)}.
     *
     * @return number of triggers updated
     */
    int updateAll(List<Trigger> triggers);

    /**
     * Return PROCESSING triggers whose lease deadline has passed to WAITING,
     * incrementing their retries and keeping next_run_at.
     */
    ReclaimResult reclaimExpired(RetryPolicy retryPolicy);

    /**
     * Delete COMPLETED triggers and triggers whose retries are spent.
     *
     * @return number of rows deleted
     */
    int deleteFinished(RetryPolicy retryPolicy);
}
