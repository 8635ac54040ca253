package beacon.scheduler.model;

import java.util.Objects;

/**
 * Unique identity of a trigger: (org, module, key).
 */
public record TriggerKey(String org, TriggerModule module, String key) {

    public TriggerKey {
        if (org == null || org.isBlank()) {
            throw new IllegalArgumentException("org is required");
        }
        Objects.requireNonNull(module, "module is required");
        if (key == null || key.isBlank()) {
            throw new IllegalArgumentException("key is required");
        }
    }

    public static TriggerKey of(String org, TriggerModule module, String key) {
        return new TriggerKey(org, module, key);
    }

    @Override
    public String toString() {
        return org + "/" + module + "/" + key;
    }
}
