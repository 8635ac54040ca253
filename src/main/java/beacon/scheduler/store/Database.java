package beacon.scheduler.store;

import beacon.scheduler.config.SchedulerConfig;
import beacon.scheduler.exception.TriggerStoreException;
import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.Connection;
import java.sql.SQLException;
import java.sql.Statement;

/**
 * Hikari pool over the trigger store, plus the {@code scheduled_jobs} DDL
 * applied on startup. Repositories own their transactions and must commit
 * or roll back every connection they take.
 */
public final class Database implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(Database.class);

    private final HikariDataSource dataSource;
    private final StoreBackend backend;

    public Database(SchedulerConfig config) {
        this(config.databaseUrl(), config.databasePoolSize());
    }

    public Database(String jdbcUrl, int poolSize) {
        this.backend = StoreBackend.fromJdbcUrl(jdbcUrl);

        HikariConfig hikariConfig = new HikariConfig();
        hikariConfig.setJdbcUrl(jdbcUrl);
        hikariConfig.setMaximumPoolSize(poolSize);
        hikariConfig.setMinimumIdle(Math.min(2, poolSize));
        hikariConfig.setConnectionTimeout(5000);
        hikariConfig.setIdleTimeout(300000);
        hikariConfig.setPoolName("beacon-db-pool");
        hikariConfig.setAutoCommit(false);
        hikariConfig.setTransactionIsolation("TRANSACTION_READ_COMMITTED");

        this.dataSource = new HikariDataSource(hikariConfig);

        log.info("Database pool initialized: {} ({})", jdbcUrl, backend);

        initSchema();
    }

    /** Pooled connection with auto-commit off. Close it to hand it back. */
    public Connection getConnection() throws SQLException {
        return dataSource.getConnection();
    }

    public StoreBackend backend() {
        return backend;
    }

    /** True if a pooled connection validates within two seconds. */
    public boolean isHealthy() {
        try (Connection conn = getConnection()) {
            return conn.isValid(2);
        } catch (SQLException e) {
            log.warn("Database health check failed: {}", e.getMessage());
            return false;
        }
    }

    /**
     * Initialize database schema. The DDL is shared by H2 and PostgreSQL.
     */
    private void initSchema() {
        try (Connection conn = getConnection();
                Statement st = conn.createStatement()) {

            st.addBatch("""
                        CREATE TABLE IF NOT EXISTS scheduled_jobs (
                            id                 BIGINT GENERATED BY DEFAULT AS IDENTITY PRIMARY KEY,
                            org                VARCHAR(256) NOT NULL,
                            module             VARCHAR(16) NOT NULL,
                            module_key         VARCHAR(512) NOT NULL,
                            status             VARCHAR(16) NOT NULL DEFAULT 'WAITING',
                            next_run_at        BIGINT NOT NULL,
                            start_time         BIGINT,
                            end_time           BIGINT,
                            last_heartbeat_at  BIGINT,
                            retries            INT NOT NULL DEFAULT 0,
                            is_realtime        BOOLEAN NOT NULL DEFAULT FALSE,
                            is_silenced        BOOLEAN NOT NULL DEFAULT FALSE,
                            data               TEXT NOT NULL DEFAULT ''
                        )
                    """);

            // Indexes
            st.addBatch("CREATE UNIQUE INDEX IF NOT EXISTS scheduled_jobs_org_module_key_idx "
                    + "ON scheduled_jobs(org, module, module_key)");
            st.addBatch("CREATE INDEX IF NOT EXISTS scheduled_jobs_status_next_run_idx "
                    + "ON scheduled_jobs(status, next_run_at)");
            st.addBatch("CREATE INDEX IF NOT EXISTS scheduled_jobs_status_end_time_idx "
                    + "ON scheduled_jobs(status, end_time)");

            st.executeBatch();
            conn.commit();

            log.info("Database schema initialized");
        } catch (SQLException e) {
            throw new TriggerStoreException("Failed to initialize database schema", e);
        }
    }

    @Override
    public void close() {
        if (dataSource != null && !dataSource.isClosed()) {
            dataSource.close();
            log.info("Database pool closed");
        }
    }
}
