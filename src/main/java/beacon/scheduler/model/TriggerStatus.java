package beacon.scheduler.model;

/**
 * Trigger lifecycle status.
 */
public enum TriggerStatus {
    /** Eligible for leasing once next_run_at has passed */
    WAITING,
    /** Leased by a node, deadline tracked in end_time */
    PROCESSING,
    /** Terminal, removed by the completion reaper */
    COMPLETED
}
