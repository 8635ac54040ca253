package beacon.scheduler.store;

import beacon.scheduler.config.RetryPolicy;
import beacon.scheduler.exception.TriggerStoreException;
import beacon.scheduler.model.Trigger;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.SQLException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * PostgreSQL trigger repository.
 * Leasing is a single UPDATE over a FOR UPDATE SKIP LOCKED subquery, so
 * concurrent pollers never wait on each other and never see the same row.
 */
public class PostgresTriggerRepository extends JdbcTriggerRepository {

    public PostgresTriggerRepository(Database db, Clock clock) {
        super(db, clock);
    }

    @Override
    protected String insertSql() {
        return """
                    INSERT INTO scheduled_jobs (org, module, module_key, status, next_run_at, start_time, end_time,
                                                last_heartbeat_at, retries, is_realtime, is_silenced, data)
                    VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?)
                    ON CONFLICT (org, module, module_key) DO NOTHING
                """;
    }

    @Override
    public List<Trigger> lease(int limit, Duration alertTimeout, Duration reportTimeout, RetryPolicy retryPolicy) {
        if (limit <= 0)
            return List.of();

        String sql = "WITH due AS (SELECT id FROM scheduled_jobs WHERE " + ELIGIBLE + """
                    ORDER BY next_run_at
                    LIMIT ?
                    FOR UPDATE SKIP LOCKED
                )
                UPDATE scheduled_jobs t
                SET status = 'PROCESSING', start_time = ?, last_heartbeat_at = ?,
                    end_time = CASE WHEN t.module = 'ALERT' THEN ? ELSE ? END
                FROM due
                WHERE t.id = due.id
                RETURNING t.*
                """;

        Instant now = now();
        try (Connection conn = db.getConnection()) {
            try (PreparedStatement ps = conn.prepareStatement(sql)) {
                ps.setLong(1, toMicros(now));
                ps.setInt(2, retryBound(retryPolicy));
                ps.setInt(3, limit);
                setMicros(ps, 4, now);
                setMicros(ps, 5, now);
                setMicros(ps, 6, now.plus(alertTimeout));
                setMicros(ps, 7, now.plus(reportTimeout));

                List<Trigger> leased = new ArrayList<>(executeQuery(ps));
                conn.commit();

                // RETURNING does not keep the subquery order
                leased.sort(Comparator.comparing(Trigger::nextRunAt));
                return leased;
            } catch (SQLException e) {
                conn.rollback();
                throw e;
            }
        } catch (SQLException e) {
            throw new TriggerStoreException("Failed to lease triggers", e);
        }
    }
}
