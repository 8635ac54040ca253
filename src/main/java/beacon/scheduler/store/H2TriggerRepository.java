package beacon.scheduler.store;

import beacon.scheduler.config.RetryPolicy;
import beacon.scheduler.exception.TriggerStoreException;
import beacon.scheduler.model.Trigger;
import beacon.scheduler.model.TriggerStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * H2 trigger repository.
 * H2 has no UPDATE ... RETURNING over a locked subquery, and it applies
 * LIMIT before skipping locked rows, so leasing locks due rows one at a time
 * and flips them in the same transaction.
 */
public class H2TriggerRepository extends JdbcTriggerRepository {

    private static final Logger log = LoggerFactory.getLogger(H2TriggerRepository.class);

    private static final int MIN_CANDIDATE_PAGE = 32;

    public H2TriggerRepository(Database db, Clock clock) {
        super(db, clock);
    }

    @Override
    protected String insertSql() {
        return """
                    INSERT INTO scheduled_jobs (org, module, module_key, status, next_run_at, start_time, end_time,
                                                last_heartbeat_at, retries, is_realtime, is_silenced, data)
                    VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?)
                """;
    }

    /**
     * Lease due triggers (pessimistic locking).
     * Candidates are read in next_run_at order without locks, a page at a
     * time, and each one is then locked on its own with SKIP LOCKED. A row
     * is passed over only when another transaction holds it or it stopped
     * being eligible, so a short batch means the eligible set is exhausted.
     */
    @Override
    public List<Trigger> lease(int limit, Duration alertTimeout, Duration reportTimeout, RetryPolicy retryPolicy) {
        if (limit <= 0)
            return List.of();

        int bound = retryBound(retryPolicy);
        int pageSize = Math.max(limit * 2, MIN_CANDIDATE_PAGE);
        Instant now = now();

        try (Connection conn = db.getConnection()) {
            try {
                List<Trigger> locked = new ArrayList<>(limit);
                int skipped = 0;
                Cursor cursor = null;

                while (locked.size() < limit) {
                    List<Cursor> page = candidates(conn, now, bound, cursor, pageSize);
                    for (Cursor candidate : page) {
                        if (locked.size() == limit)
                            break;
                        Trigger trigger = lockIfEligible(conn, candidate.id(), now, bound);
                        if (trigger != null) {
                            locked.add(trigger);
                        } else {
                            skipped++;
                        }
                    }
                    if (page.size() < pageSize)
                        break;
                    cursor = page.get(page.size() - 1);
                }

                List<Trigger> leased = markProcessing(conn, locked, now, alertTimeout, reportTimeout);
                conn.commit();

                if (skipped > 0) {
                    log.debug("Lease skipped {} rows held or taken by other pollers", skipped);
                }
                return leased;
            } catch (SQLException e) {
                conn.rollback();
                throw e;
            }
        } catch (SQLException e) {
            throw new TriggerStoreException("Failed to lease triggers", e);
        }
    }

    private List<Cursor> candidates(Connection conn, Instant now, int bound, Cursor after, int pageSize)
            throws SQLException {
        String sql = "SELECT id, next_run_at FROM scheduled_jobs WHERE " + ELIGIBLE
                + (after == null ? "" : " AND (next_run_at > ? OR (next_run_at = ? AND id > ?))")
                + " ORDER BY next_run_at, id LIMIT ?";

        try (PreparedStatement ps = conn.prepareStatement(sql)) {
            int i = 1;
            ps.setLong(i++, toMicros(now));
            ps.setInt(i++, bound);
            if (after != null) {
                ps.setLong(i++, after.nextRunAt());
                ps.setLong(i++, after.nextRunAt());
                ps.setLong(i++, after.id());
            }
            ps.setInt(i, pageSize);

            List<Cursor> page = new ArrayList<>();
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    page.add(new Cursor(rs.getLong("id"), rs.getLong("next_run_at")));
                }
            }
            return page;
        }
    }

    /**
     * Lock one row if it is still eligible and nobody else holds it.
     *
     * @return the locked row, or null if it was skipped
     */
    private Trigger lockIfEligible(Connection conn, long id, Instant now, int bound) throws SQLException {
        String sql = "SELECT * FROM scheduled_jobs WHERE id = ? AND " + ELIGIBLE + " FOR UPDATE SKIP LOCKED";

        try (PreparedStatement ps = conn.prepareStatement(sql)) {
            ps.setLong(1, id);
            ps.setLong(2, toMicros(now));
            ps.setInt(3, bound);
            List<Trigger> rows = executeQuery(ps);
            return rows.isEmpty() ? null : rows.get(0);
        }
    }

    private List<Trigger> markProcessing(Connection conn, List<Trigger> locked, Instant now,
            Duration alertTimeout, Duration reportTimeout) throws SQLException {
        if (locked.isEmpty())
            return List.of();

        String sql = """
                    UPDATE scheduled_jobs
                    SET status = 'PROCESSING', start_time = ?, last_heartbeat_at = ?, end_time = ?
                    WHERE id = ?
                """;

        List<Trigger> leased = new ArrayList<>(locked.size());
        try (PreparedStatement ps = conn.prepareStatement(sql)) {
            for (Trigger trigger : locked) {
                Instant deadline = now.plus(trigger.leaseTimeout(alertTimeout, reportTimeout));
                setMicros(ps, 1, now);
                setMicros(ps, 2, now);
                setMicros(ps, 3, deadline);
                ps.setLong(4, trigger.id());
                ps.addBatch();

                leased.add(trigger.toBuilder()
                        .status(TriggerStatus.PROCESSING)
                        .startTime(now)
                        .lastHeartbeatAt(now)
                        .endTime(deadline)
                        .build());
            }
            ps.executeBatch();
        }
        return leased;
    }

    /** Keyset position in the (next_run_at, id) candidate order. */
    private record Cursor(long id, long nextRunAt) {
    }
}
