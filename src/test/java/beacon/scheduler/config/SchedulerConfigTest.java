package beacon.scheduler.config;

import org.junit.jupiter.api.Test;

import java.net.URISyntaxException;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class SchedulerConfigTest {

    @Test
    void defaults() {
        SchedulerConfig config = SchedulerConfig.defaults();

        assertTrue(config.databaseUrl().startsWith("jdbc:h2:"));
        assertEquals(3, config.maxRetries());
        assertEquals(Duration.ofSeconds(90), config.alertTimeout());
        assertEquals(Duration.ofSeconds(300), config.reportTimeout());
        assertEquals(5, config.concurrency());
        assertEquals(Duration.ofSeconds(60), config.pollInterval());
        assertEquals(Duration.ofSeconds(30), config.watchInterval());
        assertEquals(Duration.ofSeconds(30), config.cleanInterval());
        assertEquals(8080, config.httpPort());
        assertTrue(config.isHttpEnabled());
        assertEquals(RetryPolicy.from(3), config.retryPolicy());
    }

    @Test
    void environmentOverridesDefaults() {
        SchedulerConfig config = SchedulerConfig.fromEnv(Map.of(
                "BEACON_DB_URL", "jdbc:postgresql://db:5432/beacon",
                "BEACON_SCHEDULER_MAX_RETRIES", "-1",
                "BEACON_ALERT_TIMEOUT", "30",
                "BEACON_SCHEDULE_CONCURRENCY", "20",
                "BEACON_SCHEDULER_WATCH_INTERVAL", "5",
                "BEACON_HTTP_PORT", "0"));

        assertEquals("jdbc:postgresql://db:5432/beacon", config.databaseUrl());
        assertEquals(RetryPolicy.UNLIMITED, config.retryPolicy());
        assertEquals(Duration.ofSeconds(30), config.alertTimeout());
        assertEquals(Duration.ofSeconds(300), config.reportTimeout());
        assertEquals(20, config.concurrency());
        assertEquals(Duration.ofSeconds(5), config.watchInterval());
        assertFalse(config.isHttpEnabled());
    }

    @Test
    void iniFileSections() throws URISyntaxException {
        SchedulerConfig config = SchedulerConfig.fromIni(iniPath());

        assertTrue(config.databaseUrl().contains("ini_config"));
        assertEquals(4, config.databasePoolSize());
        assertEquals(5, config.maxRetries());
        assertEquals(Duration.ofSeconds(45), config.alertTimeout());
        assertEquals(Duration.ofSeconds(600), config.reportTimeout());
        assertEquals(8, config.concurrency());
        assertEquals(Duration.ofSeconds(10), config.pollInterval());
        assertEquals(Duration.ofSeconds(15), config.watchInterval());
        assertEquals(Duration.ofSeconds(20), config.cleanInterval());
        assertEquals("127.0.0.1", config.httpHost());
        assertEquals(0, config.httpPort());
    }

    @Test
    void environmentWinsOverIniFile() throws URISyntaxException {
        SchedulerConfig config = SchedulerConfig.fromEnv(Map.of(
                "BEACON_CONFIG", iniPath().toString(),
                "BEACON_SCHEDULE_CONCURRENCY", "2"));

        assertEquals(2, config.concurrency());
        assertEquals(5, config.maxRetries());
    }

    @Test
    void rejectsInvalidValues() {
        assertThrows(IllegalArgumentException.class,
                () -> SchedulerConfig.fromEnv(Map.of("BEACON_SCHEDULE_CONCURRENCY", "0")));
        assertThrows(IllegalArgumentException.class,
                () -> SchedulerConfig.fromEnv(Map.of("BEACON_ALERT_TIMEOUT", "-5")));
        assertThrows(IllegalArgumentException.class,
                () -> SchedulerConfig.fromEnv(Map.of("BEACON_HTTP_PORT", "abc")));
        assertThrows(IllegalArgumentException.class,
                () -> SchedulerConfig.fromEnv(Map.of("BEACON_CONFIG", "/nonexistent/beacon.ini")));
    }

    private static Path iniPath() throws URISyntaxException {
        return Path.of(SchedulerConfigTest.class.getResource("/beacon-test.ini").toURI());
    }
}
