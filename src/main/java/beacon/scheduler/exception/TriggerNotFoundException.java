package beacon.scheduler.exception;

import beacon.scheduler.model.TriggerKey;

/**
 * Exception thrown when a trigger addressed by (org, module, key) does not exist
 */
public class TriggerNotFoundException extends RuntimeException {

    private final TriggerKey key;

    public TriggerNotFoundException(TriggerKey key) {
        super("trigger not found: " + key);
        this.key = key;
    }

    public TriggerKey key() {
        return key;
    }
}
