package beacon.scheduler.model;

import java.util.Objects;

/**
 * Outcome reported by a consumer for one trigger.
 *
 * @param key     trigger identity
 * @param status  new status, never PROCESSING
 * @param retries retry counter to store
 * @param data    new opaque payload, or null to keep the stored one
 */
public record StatusUpdate(TriggerKey key, TriggerStatus status, int retries, String data) {

    public StatusUpdate {
        Objects.requireNonNull(key, "key is required");
        Objects.requireNonNull(status, "status is required");
        if (retries < 0) {
            throw new IllegalArgumentException("retries must be non-negative");
        }
    }

    public static StatusUpdate of(String org, TriggerModule module, String key, TriggerStatus status, int retries,
            String data) {
        return new StatusUpdate(TriggerKey.of(org, module, key), status, retries, data);
    }
}
