package beacon.scheduler.store;

import beacon.scheduler.repository.TriggerRepository;

import java.time.Clock;

/**
 * Supported backing stores. Each must provide a non-blocking row lock
 * (FOR UPDATE SKIP LOCKED) for leasing.
 */
public enum StoreBackend {
    H2("jdbc:h2:"),
    POSTGRES("jdbc:postgresql:");

    private final String urlPrefix;

    StoreBackend(String urlPrefix) {
        this.urlPrefix = urlPrefix;
    }

    /**
     * Pick the backend from a JDBC URL.
     *
     * @throws IllegalArgumentException for stores without skip-locked leasing
     */
    public static StoreBackend fromJdbcUrl(String jdbcUrl) {
        if (jdbcUrl != null) {
            for (StoreBackend backend : values()) {
                if (jdbcUrl.startsWith(backend.urlPrefix)) {
                    return backend;
                }
            }
        }
        throw new IllegalArgumentException("Unsupported database (need H2 or PostgreSQL): " + jdbcUrl);
    }

    /**
     * Create the trigger repository for this backend.
     */
    public TriggerRepository createRepository(Database db, Clock clock) {
        return switch (this) {
            case H2 -> new H2TriggerRepository(db, clock);
            case POSTGRES -> new PostgresTriggerRepository(db, clock);
        };
    }
}
