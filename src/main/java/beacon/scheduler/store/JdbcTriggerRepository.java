package beacon.scheduler.store;

import beacon.scheduler.config.RetryPolicy;
import beacon.scheduler.exception.TriggerStoreException;
import beacon.scheduler.model.ReclaimResult;
import beacon.scheduler.model.StatusUpdate;
import beacon.scheduler.model.Trigger;
import beacon.scheduler.model.TriggerKey;
import beacon.scheduler.model.TriggerModule;
import beacon.scheduler.model.TriggerStatus;
import beacon.scheduler.repository.TriggerRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.*;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Optional;

/**
 * JDBC implementation of TriggerRepository.
 * Statements shared by every backend live here; subclasses supply the
 * insert and the skip-locked lease, which differ per SQL dialect.
 *
 * Timestamps are stored as BIGINT microseconds since the epoch.
 */
public abstract class JdbcTriggerRepository implements TriggerRepository {

    private static final Logger log = LoggerFactory.getLogger(JdbcTriggerRepository.class);

    private static final String UNIQUE_VIOLATION = "23505";

    /**
     * WAITING, due, retries left, and not a realtime alert that ingest drives.
     * Parameters: now (micros), retry bound.
     */
    protected static final String ELIGIBLE = """
                status = 'WAITING'
                AND next_run_at <= ?
                AND retries < ?
                AND NOT (is_realtime = TRUE AND is_silenced = FALSE)
            """;

    protected final Database db;
    protected final Clock clock;

    protected JdbcTriggerRepository(Database db, Clock clock) {
        this.db = db;
        this.clock = clock;
    }

    /**
     * INSERT statement for all columns except id, in {@link #bindInsert} order.
     */
    protected abstract String insertSql();

    @Override
    public boolean push(Trigger trigger) {
        try (Connection conn = db.getConnection()) {
            try (PreparedStatement ps = conn.prepareStatement(insertSql())) {
                bindInsert(ps, trigger);
                int inserted = ps.executeUpdate();
                conn.commit();
                return inserted > 0;
            } catch (SQLException e) {
                conn.rollback();
                if (UNIQUE_VIOLATION.equals(e.getSQLState())) {
                    log.debug("Trigger {} already exists, push ignored", trigger.identity());
                    return false;
                }
                throw e;
            }
        } catch (SQLException e) {
            throw new TriggerStoreException("Failed to push trigger: " + trigger.identity(), e);
        }
    }

    protected void bindInsert(PreparedStatement ps, Trigger trigger) throws SQLException {
        ps.setString(1, trigger.org());
        ps.setString(2, trigger.module().name());
        ps.setString(3, trigger.key());
        ps.setString(4, trigger.status().name());
        setMicros(ps, 5, trigger.nextRunAt());
        // lease columns start empty; only lease() fills them
        setMicros(ps, 6, null);
        setMicros(ps, 7, null);
        setMicros(ps, 8, null);
        ps.setInt(9, trigger.retries());
        ps.setBoolean(10, trigger.isRealtime());
        ps.setBoolean(11, trigger.isSilenced());
        ps.setString(12, trigger.data());
    }

    @Override
    public boolean delete(TriggerKey key) {
        String sql = "DELETE FROM scheduled_jobs WHERE org = ? AND module = ? AND module_key = ?";

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            bindKey(ps, 1, key);
            int deleted = ps.executeUpdate();
            conn.commit();
            return deleted > 0;
        } catch (SQLException e) {
            throw new TriggerStoreException("Failed to delete trigger: " + key, e);
        }
    }

    @Override
    public Optional<Trigger> findByKey(TriggerKey key) {
        String sql = "SELECT * FROM scheduled_jobs WHERE org = ? AND module = ? AND module_key = ?";

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            bindKey(ps, 1, key);
            try (ResultSet rs = ps.executeQuery()) {
                if (rs.next()) {
                    return Optional.of(mapRow(rs));
                }
            }
            return Optional.empty();
        } catch (SQLException e) {
            throw new TriggerStoreException("Failed to find trigger: " + key, e);
        }
    }

    @Override
    public List<Trigger> list(Optional<TriggerModule> module) {
        String sql = module.isPresent()
                ? "SELECT * FROM scheduled_jobs WHERE module = ? ORDER BY org, module, module_key"
                : "SELECT * FROM scheduled_jobs ORDER BY org, module, module_key";

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            if (module.isPresent()) {
                ps.setString(1, module.get().name());
            }
            return executeQuery(ps);
        } catch (SQLException e) {
            throw new TriggerStoreException("Failed to list triggers", e);
        }
    }

    @Override
    public List<Trigger> listByOrg(String org, Optional<TriggerModule> module) {
        String sql = module.isPresent()
                ? "SELECT * FROM scheduled_jobs WHERE org = ? AND module = ? ORDER BY module, module_key"
                : "SELECT * FROM scheduled_jobs WHERE org = ? ORDER BY module, module_key";

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setString(1, org);
            if (module.isPresent()) {
                ps.setString(2, module.get().name());
            }
            return executeQuery(ps);
        } catch (SQLException e) {
            throw new TriggerStoreException("Failed to list triggers for org: " + org, e);
        }
    }

    @Override
    public long count() {
        return countWhere("SELECT COUNT(*) FROM scheduled_jobs", null);
    }

    @Override
    public long countByModule(TriggerModule module) {
        return countWhere("SELECT COUNT(*) FROM scheduled_jobs WHERE module = ?", module.name());
    }

    @Override
    public long countByStatus(TriggerStatus status) {
        return countWhere("SELECT COUNT(*) FROM scheduled_jobs WHERE status = ?", status.name());
    }

    private long countWhere(String sql, String param) {
        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            if (param != null) {
                ps.setString(1, param);
            }
            try (ResultSet rs = ps.executeQuery()) {
                return rs.next() ? rs.getLong(1) : 0;
            }
        } catch (SQLException e) {
            throw new TriggerStoreException("Failed to count triggers", e);
        }
    }

    @Override
    public int clear() {
        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement("DELETE FROM scheduled_jobs")) {

            int deleted = ps.executeUpdate();
            conn.commit();
            return deleted;
        } catch (SQLException e) {
            throw new TriggerStoreException("Failed to clear triggers", e);
        }
    }

    @Override
    public int extendLeases(Collection<Long> ids, Duration alertTimeout, Duration reportTimeout) {
        if (ids.isEmpty())
            return 0;

        String sql = """
                    UPDATE scheduled_jobs
                    SET last_heartbeat_at = ?,
                        end_time = CASE WHEN module = 'ALERT' THEN ? ELSE ? END
                    WHERE id = ? AND status = 'PROCESSING'
                """;

        Instant now = now();
        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            for (Long id : ids) {
                setMicros(ps, 1, now);
                setMicros(ps, 2, now.plus(alertTimeout));
                setMicros(ps, 3, now.plus(reportTimeout));
                ps.setLong(4, id);
                ps.addBatch();
            }

            int extended = sumUpdated(ps.executeBatch());
            conn.commit();
            return extended;
        } catch (SQLException e) {
            throw new TriggerStoreException("Failed to extend leases", e);
        }
    }

    // The lease is released: end_time and last_heartbeat_at only mean
    // something while PROCESSING.
    private static final String UPDATE_STATUS_SQL = """
                UPDATE scheduled_jobs
                SET status = ?, retries = ?, data = COALESCE(?, data),
                    end_time = NULL, last_heartbeat_at = NULL
                WHERE org = ? AND module = ? AND module_key = ?
            """;

    @Override
    public boolean updateStatus(StatusUpdate update) {
        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(UPDATE_STATUS_SQL)) {

            bindStatusUpdate(ps, update);
            int updated = ps.executeUpdate();
            conn.commit();
            return updated > 0;
        } catch (SQLException e) {
            throw new TriggerStoreException("Failed to update status: " + update.key(), e);
        }
    }

    @Override
    public int updateStatuses(List<StatusUpdate> updates) {
        if (updates.isEmpty())
            return 0;

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(UPDATE_STATUS_SQL)) {

            for (StatusUpdate update : updates) {
                bindStatusUpdate(ps, update);
                ps.addBatch();
            }

            int updated = sumUpdated(ps.executeBatch());
            conn.commit();

            log.debug("Updated {} trigger statuses in batch", updated);
            return updated;
        } catch (SQLException e) {
            throw new TriggerStoreException("Failed to update statuses batch", e);
        }
    }

    private static void bindStatusUpdate(PreparedStatement ps, StatusUpdate update) throws SQLException {
        ps.setString(1, update.status().name());
        ps.setInt(2, update.retries());
        if (update.data() != null) {
            ps.setString(3, update.data());
        } else {
            ps.setNull(3, Types.VARCHAR);
        }
        bindKey(ps, 4, update.key());
    }

    private static final String UPDATE_TRIGGER_SQL = """
                UPDATE scheduled_jobs
                SET status = ?, retries = ?, next_run_at = ?, is_realtime = ?, is_silenced = ?, data = ?,
                    end_time = NULL, last_heartbeat_at = NULL
                WHERE org = ? AND module = ? AND module_key = ?
            """;

    @Override
    public boolean update(Trigger trigger) {
        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(UPDATE_TRIGGER_SQL)) {

            bindTriggerUpdate(ps, trigger);
            int updated = ps.executeUpdate();
            conn.commit();
            return updated > 0;
        } catch (SQLException e) {
            throw new TriggerStoreException("Failed to update trigger: " + trigger.identity(), e);
        }
    }

    @Override
    public int updateAll(List<Trigger> triggers) {
        if (triggers.isEmpty())
            return 0;

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(UPDATE_TRIGGER_SQL)) {

            for (Trigger trigger : triggers) {
                bindTriggerUpdate(ps, trigger);
                ps.addBatch();
            }

            int updated = sumUpdated(ps.executeBatch());
            conn.commit();

            log.debug("Updated {} triggers in batch", updated);
            return updated;
        } catch (SQLException e) {
            throw new TriggerStoreException("Failed to update triggers batch", e);
        }
    }

    private static void bindTriggerUpdate(PreparedStatement ps, Trigger trigger) throws SQLException {
        ps.setString(1, trigger.status().name());
        ps.setInt(2, trigger.retries());
        setMicros(ps, 3, trigger.nextRunAt());
        ps.setBoolean(4, trigger.isRealtime());
        ps.setBoolean(5, trigger.isSilenced());
        ps.setString(6, trigger.data());
        bindKey(ps, 7, trigger.identity());
    }

    @Override
    public ReclaimResult reclaimExpired(RetryPolicy retryPolicy) {
        String requeueSql = """
                    UPDATE scheduled_jobs
                    SET status = 'WAITING', retries = retries + 1, end_time = NULL, last_heartbeat_at = NULL
                    WHERE status = 'PROCESSING' AND end_time <= ? AND retries + 1 < ?
                """;
        String exhaustSql = """
                    UPDATE scheduled_jobs
                    SET status = 'WAITING', retries = retries + 1, end_time = NULL, last_heartbeat_at = NULL
                    WHERE status = 'PROCESSING' AND end_time <= ? AND retries + 1 >= ?
                """;

        long now = toMicros(now());
        try (Connection conn = db.getConnection()) {
            try {
                int exhausted = 0;
                if (retryPolicy.enabled()) {
                    try (PreparedStatement ps = conn.prepareStatement(exhaustSql)) {
                        ps.setLong(1, now);
                        ps.setInt(2, retryPolicy.max());
                        exhausted = ps.executeUpdate();
                    }
                }

                int requeued;
                try (PreparedStatement ps = conn.prepareStatement(requeueSql)) {
                    ps.setLong(1, now);
                    ps.setInt(2, retryBound(retryPolicy));
                    requeued = ps.executeUpdate();
                }

                conn.commit();
                return new ReclaimResult(requeued, exhausted);
            } catch (SQLException e) {
                conn.rollback();
                throw e;
            }
        } catch (SQLException e) {
            throw new TriggerStoreException("Failed to reclaim expired leases", e);
        }
    }

    @Override
    public int deleteFinished(RetryPolicy retryPolicy) {
        String sql = "DELETE FROM scheduled_jobs WHERE status = 'COMPLETED' OR retries >= ?";

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setInt(1, retryBound(retryPolicy));
            int deleted = ps.executeUpdate();
            conn.commit();
            return deleted;
        } catch (SQLException e) {
            throw new TriggerStoreException("Failed to delete finished triggers", e);
        }
    }

    // Helper methods

    protected Instant now() {
        return clock.instant().truncatedTo(ChronoUnit.MICROS);
    }

    /**
     * Exclusive upper bound on retries for a trigger to stay live.
     */
    protected static int retryBound(RetryPolicy retryPolicy) {
        return retryPolicy.enabled() ? retryPolicy.max() : Integer.MAX_VALUE;
    }

    protected static void bindKey(PreparedStatement ps, int index, TriggerKey key) throws SQLException {
        ps.setString(index, key.org());
        ps.setString(index + 1, key.module().name());
        ps.setString(index + 2, key.key());
    }

    protected List<Trigger> executeQuery(PreparedStatement ps) throws SQLException {
        List<Trigger> triggers = new ArrayList<>();
        try (ResultSet rs = ps.executeQuery()) {
            while (rs.next()) {
                triggers.add(mapRow(rs));
            }
        }
        return triggers;
    }

    protected Trigger mapRow(ResultSet rs) throws SQLException {
        return Trigger.builder()
                .id(rs.getLong("id"))
                .org(rs.getString("org"))
                .module(TriggerModule.valueOf(rs.getString("module")))
                .key(rs.getString("module_key"))
                .status(TriggerStatus.valueOf(rs.getString("status")))
                .nextRunAt(getMicros(rs, "next_run_at"))
                .startTime(getMicros(rs, "start_time"))
                .endTime(getMicros(rs, "end_time"))
                .lastHeartbeatAt(getMicros(rs, "last_heartbeat_at"))
                .retries(rs.getInt("retries"))
                .realtime(rs.getBoolean("is_realtime"))
                .silenced(rs.getBoolean("is_silenced"))
                .data(rs.getString("data"))
                .build();
    }

    protected static int sumUpdated(int[] counts) {
        int total = 0;
        for (int count : counts) {
            if (count > 0) {
                total += count;
            } else if (count == Statement.SUCCESS_NO_INFO) {
                total++;
            }
        }
        return total;
    }

    protected static long toMicros(Instant instant) {
        return ChronoUnit.MICROS.between(Instant.EPOCH, instant);
    }

    protected static Instant fromMicros(long micros) {
        return Instant.EPOCH.plus(micros, ChronoUnit.MICROS);
    }

    protected static void setMicros(PreparedStatement ps, int index, Instant instant) throws SQLException {
        if (instant != null) {
            ps.setLong(index, toMicros(instant));
        } else {
            ps.setNull(index, Types.BIGINT);
        }
    }

    protected static Instant getMicros(ResultSet rs, String column) throws SQLException {
        long value = rs.getLong(column);
        return rs.wasNull() ? null : fromMicros(value);
    }
}
