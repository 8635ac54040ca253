package beacon.scheduler.worker;

import beacon.scheduler.config.SchedulerConfig;
import beacon.scheduler.model.Trigger;
import beacon.scheduler.model.TriggerKey;
import beacon.scheduler.model.TriggerModule;
import beacon.scheduler.model.TriggerStatus;
import beacon.scheduler.service.TriggerService;
import beacon.scheduler.store.Database;
import beacon.scheduler.support.MutableClock;
import beacon.scheduler.support.TestDatabases;
import org.junit.jupiter.api.*;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

import static org.junit.jupiter.api.Assertions.*;

class TriggerPollerTest {

    private static Database db;
    private static MutableClock clock;
    private static TriggerService service;

    private SchedulerConfig config;

    @BeforeAll
    static void setup() {
        db = TestDatabases.h2("test-poller");
        clock = MutableClock.startingAt("2024-05-01T12:00:00Z");
        service = new TriggerService(db.backend().createRepository(db, clock), SchedulerConfig.defaults());
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
        config = SchedulerConfig.defaults()
                .withDatabaseUrl(TestDatabases.h2Url("test-poller"))
                .withConcurrency(2);
    }

    private static void push(TriggerModule module, String key) {
        service.push(Trigger.builder().org("acme").module(module).key(key).nextRunAt(clock.instant()).build());
    }

    private static void awaitAll(List<Future<?>> futures) throws Exception {
        for (Future<?> future : futures) {
            future.get(5, TimeUnit.SECONDS);
        }
    }

    @Test
    void handlerReportsOutcome() throws Exception {
        push(TriggerModule.ALERT, "cpu-high");
        TriggerHandler handler = (trigger, triggers) -> triggers.updateStatus(
                trigger.org(), trigger.module(), trigger.key(), TriggerStatus.COMPLETED, 0, "{\"fired\":false}");

        try (TriggerPoller poller = new TriggerPoller(service, config, Map.of(TriggerModule.ALERT, handler), clock)) {
            List<Future<?>> dispatched = poller.pollOnce();
            assertEquals(1, dispatched.size());
            awaitAll(dispatched);
            assertEquals(0, poller.inFlight());
        }

        Trigger stored = service.get(TriggerKey.of("acme", TriggerModule.ALERT, "cpu-high"));
        assertEquals(TriggerStatus.COMPLETED, stored.status());
        assertEquals("{\"fired\":false}", stored.data());
    }

    @Test
    void handlerFailureRequeuesWithRetry() throws Exception {
        push(TriggerModule.REPORT, "weekly");
        TriggerHandler failing = (trigger, triggers) -> {
            throw new IllegalStateException("renderer unavailable");
        };

        try (TriggerPoller poller = new TriggerPoller(service, config, Map.of(TriggerModule.REPORT, failing), clock)) {
            awaitAll(poller.pollOnce());
        }

        Trigger stored = service.get(TriggerKey.of("acme", TriggerModule.REPORT, "weekly"));
        assertEquals(TriggerStatus.WAITING, stored.status());
        assertEquals(1, stored.retries());
        assertEquals(clock.instant(), stored.nextRunAt());
    }

    @Test
    void missingHandlerRequeuesWithRetry() throws Exception {
        push(TriggerModule.REPORT, "monthly");
        AtomicInteger alertCalls = new AtomicInteger();

        try (TriggerPoller poller = new TriggerPoller(service, config,
                Map.of(TriggerModule.ALERT, (t, s) -> alertCalls.incrementAndGet()), clock)) {
            awaitAll(poller.pollOnce());
        }

        assertEquals(0, alertCalls.get());
        Trigger stored = service.get(TriggerKey.of("acme", TriggerModule.REPORT, "monthly"));
        assertEquals(TriggerStatus.WAITING, stored.status());
        assertEquals(1, stored.retries());
    }

    @Test
    void silencedRealtimeAlertIsWokenUp() throws Exception {
        service.push(Trigger.builder().org("acme").module(TriggerModule.ALERT).key("ingest")
                .nextRunAt(clock.instant()).realtime(true).silenced(true).build());
        AtomicInteger calls = new AtomicInteger();
        clock.advance(Duration.ofSeconds(5));

        try (TriggerPoller poller = new TriggerPoller(service, config,
                Map.of(TriggerModule.ALERT, (t, s) -> calls.incrementAndGet()), clock)) {
            awaitAll(poller.pollOnce());
        }

        assertEquals(0, calls.get());
        Trigger stored = service.get(TriggerKey.of("acme", TriggerModule.ALERT, "ingest"));
        assertEquals(TriggerStatus.WAITING, stored.status());
        assertTrue(stored.isRealtime());
        assertFalse(stored.isSilenced());
        assertEquals(clock.instant(), stored.nextRunAt());

        // back on the ingest path: no longer polled
        assertTrue(service.pull(5, config.alertTimeout(), config.reportTimeout()).isEmpty());
    }

    @Test
    void heartbeatsWhileHandlerRuns() throws Exception {
        config.withAlertTimeout(Duration.ofMillis(400));
        push(TriggerModule.ALERT, "slow");
        AtomicReference<Trigger> seen = new AtomicReference<>();
        Instant later = clock.instant().plusSeconds(30);

        TriggerHandler slow = (trigger, triggers) -> {
            clock.set(later);
            Thread.sleep(500);
            seen.set(triggers.get(trigger.identity()));
            triggers.updateStatus(trigger.org(), trigger.module(), trigger.key(), TriggerStatus.COMPLETED, 0, null);
        };

        try (TriggerPoller poller = new TriggerPoller(service, config, Map.of(TriggerModule.ALERT, slow), clock)) {
            awaitAll(poller.pollOnce());
        }

        assertEquals(TriggerStatus.PROCESSING, seen.get().status());
        assertEquals(later, seen.get().lastHeartbeatAt());
        assertEquals(later.plusMillis(400), seen.get().endTime());
    }

    @Test
    void neverHoldsMoreLeasesThanWorkers() throws Exception {
        for (int i = 0; i < 5; i++) {
            push(TriggerModule.ALERT, "a" + i);
        }
        CountDownLatch release = new CountDownLatch(1);
        TriggerHandler blocking = (trigger, triggers) -> {
            release.await(5, TimeUnit.SECONDS);
            triggers.updateStatus(trigger.org(), trigger.module(), trigger.key(), TriggerStatus.COMPLETED, 0, null);
        };

        try (TriggerPoller poller = new TriggerPoller(service, config, Map.of(TriggerModule.ALERT, blocking), clock)) {
            List<Future<?>> first = poller.pollOnce();
            assertEquals(2, first.size());
            assertTrue(poller.pollOnce().isEmpty());
            assertEquals(2, service.countByStatus(TriggerStatus.PROCESSING));

            release.countDown();
            awaitAll(first);

            List<Future<?>> second = poller.pollOnce();
            assertEquals(2, second.size());
            awaitAll(second);
        }

        assertEquals(4, service.countByStatus(TriggerStatus.COMPLETED));
        assertEquals(1, service.countByStatus(TriggerStatus.WAITING));
    }
}
