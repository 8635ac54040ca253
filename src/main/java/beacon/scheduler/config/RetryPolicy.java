package beacon.scheduler.config;

/**
 * Retry budget derived from the signed {@code scheduler_max_retries} setting.
 * A positive value enables the budget; zero or negative means unlimited.
 *
 * @param enabled whether the budget is enforced
 * @param max     retries allowed before a trigger is dead-lettered (0 when disabled)
 */
public record RetryPolicy(boolean enabled, int max) {

    public static final RetryPolicy UNLIMITED = new RetryPolicy(false, 0);

    public RetryPolicy {
        if (enabled && max <= 0) {
            throw new IllegalArgumentException("max must be positive when retries are enabled");
        }
    }

    public static RetryPolicy from(int schedulerMaxRetries) {
        return schedulerMaxRetries > 0 ? new RetryPolicy(true, schedulerMaxRetries) : UNLIMITED;
    }

    /** Check if a trigger with this retry count may still be leased */
    public boolean canRetry(int retries) {
        return !enabled || retries < max;
    }

    /** Check if a trigger with this retry count is dead-lettered */
    public boolean isExhausted(int retries) {
        return enabled && retries >= max;
    }
}
