package beacon.scheduler.scheduler;

import beacon.scheduler.config.RetryPolicy;
import beacon.scheduler.model.ReclaimResult;
import beacon.scheduler.model.StatusUpdate;
import beacon.scheduler.model.Trigger;
import beacon.scheduler.model.TriggerKey;
import beacon.scheduler.model.TriggerModule;
import beacon.scheduler.model.TriggerStatus;
import beacon.scheduler.repository.TriggerRepository;
import beacon.scheduler.service.TriggerService;
import beacon.scheduler.store.Database;
import beacon.scheduler.support.MutableClock;
import beacon.scheduler.support.TestDatabases;
import org.junit.jupiter.api.*;

import java.time.Duration;
import java.time.Instant;

import static org.junit.jupiter.api.Assertions.*;

class TimeoutWatchdogTest {

    private static final Duration ALERT_TIMEOUT = Duration.ofSeconds(1);
    private static final Duration REPORT_TIMEOUT = Duration.ofSeconds(5);

    private static Database db;
    private static MutableClock clock;
    private static TriggerService service;
    private static TimeoutWatchdog watchdog;

    @BeforeAll
    static void setup() {
        db = TestDatabases.h2("test-watchdog");
        clock = MutableClock.startingAt("2024-05-01T12:00:00Z");
        TriggerRepository repo = db.backend().createRepository(db, clock);
        service = new TriggerService(repo, RetryPolicy.from(3));
        watchdog = new TimeoutWatchdog(service);
    }

    @AfterAll
    static void teardown() {
        if (db != null)
            db.close();
    }

    @BeforeEach
    void cleanTriggers() throws Exception {
        TestDatabases.truncate(db);
        clock.set(Instant.parse("2024-05-01T12:00:00Z"));
    }

    private static void push(TriggerModule module, String key) {
        service.push(Trigger.builder().org("acme").module(module).key(key).nextRunAt(clock.instant()).build());
    }

    @Test
    void noExpiredLeases() {
        push(TriggerModule.ALERT, "idle");

        assertEquals(ReclaimResult.NONE, watchdog.tick());
    }

    @Test
    void requeuesExpiredLeaseKeepingSchedule() {
        push(TriggerModule.ALERT, "cpu-high");
        Instant dueAt = clock.instant();
        service.pull(1, ALERT_TIMEOUT, REPORT_TIMEOUT);

        clock.advance(Duration.ofMillis(999));
        assertEquals(0, watchdog.tick().total());

        clock.advance(Duration.ofMillis(1));
        assertEquals(1, watchdog.tick().requeued());

        Trigger stored = service.get(TriggerKey.of("acme", TriggerModule.ALERT, "cpu-high"));
        assertEquals(TriggerStatus.WAITING, stored.status());
        assertEquals(1, stored.retries());
        assertEquals(dueAt, stored.nextRunAt());
        assertNull(stored.endTime());
        assertNull(stored.lastHeartbeatAt());
    }

    @Test
    void timeoutDependsOnModule() {
        push(TriggerModule.ALERT, "alert");
        push(TriggerModule.REPORT, "report");
        service.pull(2, ALERT_TIMEOUT, REPORT_TIMEOUT);

        clock.advance(Duration.ofSeconds(2));
        assertEquals(1, watchdog.tick().total());
        assertEquals(TriggerStatus.PROCESSING,
                service.get(TriggerKey.of("acme", TriggerModule.REPORT, "report")).status());

        clock.advance(Duration.ofSeconds(3));
        assertEquals(1, watchdog.tick().total());
    }

    @Test
    void reportedLeaseIsNotReclaimed() {
        push(TriggerModule.ALERT, "done");
        Trigger leased = service.pull(1, ALERT_TIMEOUT, REPORT_TIMEOUT).get(0);
        service.updateStatus(new StatusUpdate(leased.identity(), TriggerStatus.COMPLETED, 0, null));

        clock.advance(Duration.ofMinutes(5));

        assertEquals(ReclaimResult.NONE, watchdog.tick());
        assertEquals(TriggerStatus.COMPLETED, service.get(leased.identity()).status());
    }

    @Test
    void countsExhaustedLeases() {
        service.push(Trigger.builder().org("acme").module(TriggerModule.ALERT).key("flaky")
                .nextRunAt(clock.instant()).retries(2).build());
        service.pull(1, ALERT_TIMEOUT, REPORT_TIMEOUT);
        clock.advance(ALERT_TIMEOUT);

        ReclaimResult result = watchdog.tick();

        assertEquals(0, result.requeued());
        assertEquals(1, result.exhausted());
        assertTrue(service.pull(1, ALERT_TIMEOUT, REPORT_TIMEOUT).isEmpty());
    }

    @Test
    void runSwallowsStoreErrors() {
        Database closed = TestDatabases.h2("test-watchdog-closed");
        TriggerService broken = new TriggerService(closed.backend().createRepository(closed, clock),
                RetryPolicy.from(3));
        closed.close();

        assertDoesNotThrow(() -> new TimeoutWatchdog(broken).run());
    }
}
