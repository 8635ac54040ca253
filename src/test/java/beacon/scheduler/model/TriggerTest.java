package beacon.scheduler.model;

import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;

import static org.junit.jupiter.api.Assertions.*;

class TriggerTest {

    private static final Instant NOW = Instant.parse("2024-05-01T12:00:00Z");

    private static Trigger.Builder alert() {
        return Trigger.builder()
                .org("acme")
                .module(TriggerModule.ALERT)
                .key("cpu-high")
                .nextRunAt(NOW);
    }

    @Test
    void builderDefaults() {
        Trigger trigger = alert().build();

        assertNull(trigger.id());
        assertEquals(TriggerStatus.WAITING, trigger.status());
        assertEquals(0, trigger.retries());
        assertFalse(trigger.isRealtime());
        assertFalse(trigger.isSilenced());
        assertEquals("", trigger.data());
        assertEquals(TriggerKey.of("acme", TriggerModule.ALERT, "cpu-high"), trigger.identity());
    }

    @Test
    void requiresIdentityAndSchedule() {
        assertThrows(IllegalArgumentException.class, () -> alert().org(" ").build());
        assertThrows(IllegalArgumentException.class, () -> alert().key(null).build());
        assertThrows(NullPointerException.class, () -> alert().module(null).build());
        assertThrows(NullPointerException.class, () -> alert().nextRunAt(null).build());
        assertThrows(IllegalArgumentException.class, () -> alert().retries(-1).build());
    }

    @Test
    void timestampsTruncatedToMicros() {
        Instant precise = Instant.parse("2024-05-01T12:00:00.123456789Z");

        Trigger trigger = alert().nextRunAt(precise).startTime(precise).build();

        assertEquals(Instant.parse("2024-05-01T12:00:00.123456Z"), trigger.nextRunAt());
        assertEquals(Instant.parse("2024-05-01T12:00:00.123456Z"), trigger.startTime());
    }

    @Test
    void realtimeTriggersArePollableOnlyWhileSilenced() {
        assertTrue(alert().build().isPollable());
        assertFalse(alert().realtime(true).build().isPollable());
        assertTrue(alert().realtime(true).silenced(true).build().isPollable());

        assertTrue(alert().realtime(true).silenced(true).build().needsWakeup());
        assertFalse(alert().silenced(true).build().needsWakeup());
    }

    @Test
    void leaseTimeoutFollowsModule() {
        Duration alertTimeout = Duration.ofSeconds(90);
        Duration reportTimeout = Duration.ofSeconds(300);

        assertEquals(alertTimeout, alert().build().leaseTimeout(alertTimeout, reportTimeout));
        assertEquals(reportTimeout,
                alert().module(TriggerModule.REPORT).build().leaseTimeout(alertTimeout, reportTimeout));
    }

    @Test
    void leaseExpiresAtDeadline() {
        Trigger leased = alert()
                .status(TriggerStatus.PROCESSING)
                .startTime(NOW)
                .endTime(NOW.plusSeconds(60))
                .build();

        assertFalse(leased.isLeaseExpired(NOW.plusSeconds(59)));
        assertTrue(leased.isLeaseExpired(NOW.plusSeconds(60)));
        assertFalse(leased.toBuilder().status(TriggerStatus.WAITING).build().isLeaseExpired(NOW.plusSeconds(61)));
    }

    @Test
    void toBuilderKeepsAllFields() {
        Trigger original = alert()
                .id(7L)
                .retries(2)
                .realtime(true)
                .silenced(true)
                .data("{\"threshold\":90}")
                .build();

        Trigger copy = original.toBuilder().build();

        assertEquals(7L, copy.id());
        assertEquals(2, copy.retries());
        assertTrue(copy.isRealtime());
        assertTrue(copy.isSilenced());
        assertEquals("{\"threshold\":90}", copy.data());
        assertEquals(original, copy);
    }

    @Test
    void equalityIsByIdentity() {
        Trigger a = alert().retries(0).build();
        Trigger b = alert().retries(3).status(TriggerStatus.COMPLETED).build();
        Trigger c = alert().module(TriggerModule.REPORT).build();

        assertEquals(a, b);
        assertEquals(a.hashCode(), b.hashCode());
        assertNotEquals(a, c);
    }

    @Test
    void parseModule() {
        assertEquals(TriggerModule.ALERT, TriggerModule.parse("alert"));
        assertEquals(TriggerModule.REPORT, TriggerModule.parse(" Report "));
        assertThrows(IllegalArgumentException.class, () -> TriggerModule.parse("dashboard"));
        assertThrows(IllegalArgumentException.class, () -> TriggerModule.parse(""));
    }

    @Test
    void statusUpdateValidation() {
        StatusUpdate update = StatusUpdate.of("acme", TriggerModule.ALERT, "cpu-high", TriggerStatus.COMPLETED, 0, null);

        assertNull(update.data());
        assertEquals("acme/ALERT/cpu-high", update.key().toString());
        assertThrows(IllegalArgumentException.class,
                () -> StatusUpdate.of("acme", TriggerModule.ALERT, "cpu-high", TriggerStatus.WAITING, -1, null));
        assertThrows(IllegalArgumentException.class,
                () -> StatusUpdate.of("", TriggerModule.ALERT, "cpu-high", TriggerStatus.WAITING, 0, null));
    }
}
