package beacon.scheduler.model;

/**
 * Kind of work a trigger schedules. Each module has its own lease timeout.
 */
public enum TriggerModule {
    /** Alert evaluation */
    ALERT,
    /** Report generation */
    REPORT;

    /**
     * Parse a module name, case-insensitive ("alert", "Alert", "ALERT").
     */
    public static TriggerModule parse(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("module is required");
        }
        try {
            return valueOf(value.trim().toUpperCase());
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("unknown module: " + value);
        }
    }
}
