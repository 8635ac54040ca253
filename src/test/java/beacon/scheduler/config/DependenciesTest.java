package beacon.scheduler.config;

import beacon.scheduler.model.Trigger;
import beacon.scheduler.model.TriggerModule;
import beacon.scheduler.model.TriggerStatus;
import beacon.scheduler.store.H2TriggerRepository;
import beacon.scheduler.support.TestDatabases;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;

import static org.junit.jupiter.api.Assertions.*;

class DependenciesTest {

    private static SchedulerConfig config(String name) {
        return SchedulerConfig.defaults()
                .withDatabaseUrl(TestDatabases.h2Url(name))
                .withHttpPort(0)
                .withPollInterval(Duration.ofMillis(50));
    }

    @Test
    void wiresH2Backend() {
        try (Dependencies deps = Dependencies.create(config("test-deps-wiring"))) {
            assertInstanceOf(H2TriggerRepository.class, deps.triggerRepository());
            assertTrue(deps.database().isHealthy());
            assertSame(deps.scheduler(), deps.scheduler());
            assertEquals(-1, deps.startHttpServer());
        }
    }

    @Test
    void instancesAreIsolated() {
        try (Dependencies a = Dependencies.create(config("test-deps-a"));
                Dependencies b = Dependencies.create(config("test-deps-b"))) {
            a.triggerService().push(Trigger.builder().org("acme").module(TriggerModule.ALERT).key("x")
                    .nextRunAt(Instant.now()).build());

            assertEquals(1, a.triggerService().len());
            assertTrue(b.triggerService().isEmpty());
        }
    }

    @Test
    void pollerRunsRegisteredHandlers() throws Exception {
        try (Dependencies deps = Dependencies.create(config("test-deps-poller"))) {
            deps.triggerService().push(Trigger.builder().org("acme").module(TriggerModule.REPORT).key("weekly")
                    .nextRunAt(Instant.now()).build());

            deps.registerHandler(TriggerModule.REPORT, (trigger, service) -> service.updateStatus(
                    trigger.org(), trigger.module(), trigger.key(), TriggerStatus.COMPLETED, 0, null));
            deps.startPoller();

            long deadline = System.currentTimeMillis() + 5000;
            while (deps.triggerService().countByStatus(TriggerStatus.COMPLETED) == 0) {
                assertTrue(System.currentTimeMillis() < deadline, "handler did not run");
                Thread.sleep(20);
            }

            assertThrows(IllegalStateException.class,
                    () -> deps.registerHandler(TriggerModule.ALERT, (t, s) -> { }));
        }
    }

    @Test
    void rejectsUnsupportedDatabase() {
        SchedulerConfig config = SchedulerConfig.defaults().withDatabaseUrl("jdbc:sqlite:beacon.db");

        assertThrows(IllegalArgumentException.class, () -> Dependencies.create(config));
    }
}
