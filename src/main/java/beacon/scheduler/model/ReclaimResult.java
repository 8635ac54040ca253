package beacon.scheduler.model;

/**
 * Result of one timeout watchdog pass.
 *
 * @param requeued  leases returned to WAITING that can be leased again
 * @param exhausted leases returned to WAITING whose retry budget is now spent
 */
public record ReclaimResult(int requeued, int exhausted) {

    public static final ReclaimResult NONE = new ReclaimResult(0, 0);

    public int total() {
        return requeued + exhausted;
    }
}
