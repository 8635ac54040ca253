package beacon.scheduler.config;

import org.ini4j.Ini;
import org.ini4j.Profile;

import java.io.File;
import java.io.IOException;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Map;

/**
 * Configuration holder for scheduler settings.
 * All settings have sensible defaults; an INI file and environment variables
 * can override them, in that order.
 */
public final class SchedulerConfig {

    // Database settings
    private String databaseUrl = "jdbc:h2:file:./data/beacon;AUTO_SERVER=TRUE;MODE=PostgreSQL;DATABASE_TO_UPPER=FALSE";
    private int databasePoolSize = 10;

    // Scheduler settings
    private int maxRetries = 3;
    private Duration alertTimeout = Duration.ofSeconds(90);
    private Duration reportTimeout = Duration.ofSeconds(300);
    private int concurrency = 5;
    private Duration pollInterval = Duration.ofSeconds(60);
    private Duration watchInterval = Duration.ofSeconds(30);
    private Duration cleanInterval = Duration.ofSeconds(30);

    // Server settings
    private int httpPort = 8080;
    private String httpHost = "0.0.0.0";

    private SchedulerConfig() {
    }

    public static SchedulerConfig defaults() {
        return new SchedulerConfig();
    }

    public static SchedulerConfig fromEnv() {
        return fromEnv(System.getenv());
    }

    /**
     * Build config from the given environment. {@code BEACON_CONFIG} names an
     * INI file that is applied before the other variables.
     */
    public static SchedulerConfig fromEnv(Map<String, String> env) {
        SchedulerConfig config = new SchedulerConfig();

        String iniPath = env.get("BEACON_CONFIG");
        if (iniPath != null && !iniPath.isBlank()) {
            config.applyIni(Path.of(iniPath));
        }

        String dbUrl = env.get("BEACON_DB_URL");
        if (dbUrl != null && !dbUrl.isBlank()) {
            config.databaseUrl = dbUrl;
        }

        String poolSize = env.get("BEACON_DB_POOL_SIZE");
        if (poolSize != null && !poolSize.isBlank()) {
            config.databasePoolSize = parseInt("BEACON_DB_POOL_SIZE", poolSize);
        }

        String maxRetries = env.get("BEACON_SCHEDULER_MAX_RETRIES");
        if (maxRetries != null && !maxRetries.isBlank()) {
            config.maxRetries = parseInt("BEACON_SCHEDULER_MAX_RETRIES", maxRetries);
        }

        String alertTimeout = env.get("BEACON_ALERT_TIMEOUT");
        if (alertTimeout != null && !alertTimeout.isBlank()) {
            config.alertTimeout = parseSeconds("BEACON_ALERT_TIMEOUT", alertTimeout);
        }

        String reportTimeout = env.get("BEACON_REPORT_TIMEOUT");
        if (reportTimeout != null && !reportTimeout.isBlank()) {
            config.reportTimeout = parseSeconds("BEACON_REPORT_TIMEOUT", reportTimeout);
        }

        String concurrency = env.get("BEACON_SCHEDULE_CONCURRENCY");
        if (concurrency != null && !concurrency.isBlank()) {
            config.concurrency = parseInt("BEACON_SCHEDULE_CONCURRENCY", concurrency);
        }

        String pollInterval = env.get("BEACON_SCHEDULE_INTERVAL");
        if (pollInterval != null && !pollInterval.isBlank()) {
            config.pollInterval = parseSeconds("BEACON_SCHEDULE_INTERVAL", pollInterval);
        }

        String watchInterval = env.get("BEACON_SCHEDULER_WATCH_INTERVAL");
        if (watchInterval != null && !watchInterval.isBlank()) {
            config.watchInterval = parseSeconds("BEACON_SCHEDULER_WATCH_INTERVAL", watchInterval);
        }

        String cleanInterval = env.get("BEACON_SCHEDULER_CLEAN_INTERVAL");
        if (cleanInterval != null && !cleanInterval.isBlank()) {
            config.cleanInterval = parseSeconds("BEACON_SCHEDULER_CLEAN_INTERVAL", cleanInterval);
        }

        String port = env.get("BEACON_HTTP_PORT");
        if (port != null && !port.isBlank()) {
            config.httpPort = parseInt("BEACON_HTTP_PORT", port);
        }

        config.validate();
        return config;
    }

    /**
     * Load config from an INI file with [database], [scheduler] and [server]
     * sections. Missing keys keep their defaults.
     */
    public static SchedulerConfig fromIni(Path path) {
        SchedulerConfig config = new SchedulerConfig();
        config.applyIni(path);
        config.validate();
        return config;
    }

    private void applyIni(Path path) {
        Ini ini;
        try {
            ini = new Ini(new File(path.toString()));
        } catch (IOException e) {
            throw new IllegalArgumentException("Cannot read config file: " + path, e);
        }

        Profile.Section database = ini.get("database");
        if (database != null) {
            databaseUrl = database.getOrDefault("url", databaseUrl);
            databasePoolSize = intOption(database, "pool_size", databasePoolSize);
        }

        Profile.Section scheduler = ini.get("scheduler");
        if (scheduler != null) {
            maxRetries = intOption(scheduler, "max_retries", maxRetries);
            alertTimeout = secondsOption(scheduler, "alert_timeout", alertTimeout);
            reportTimeout = secondsOption(scheduler, "report_timeout", reportTimeout);
            concurrency = intOption(scheduler, "concurrency", concurrency);
            pollInterval = secondsOption(scheduler, "poll_interval", pollInterval);
            watchInterval = secondsOption(scheduler, "watch_interval", watchInterval);
            cleanInterval = secondsOption(scheduler, "clean_interval", cleanInterval);
        }

        Profile.Section server = ini.get("server");
        if (server != null) {
            httpHost = server.getOrDefault("host", httpHost);
            httpPort = intOption(server, "port", httpPort);
        }
    }

    /**
     * Reject settings the scheduler cannot run with.
     */
    public SchedulerConfig validate() {
        if (databaseUrl == null || databaseUrl.isBlank()) {
            throw new IllegalArgumentException("database url is required");
        }
        if (databasePoolSize <= 0) {
            throw new IllegalArgumentException("database pool size must be positive");
        }
        if (concurrency <= 0) {
            throw new IllegalArgumentException("concurrency must be positive");
        }
        requirePositive("alert timeout", alertTimeout);
        requirePositive("report timeout", reportTimeout);
        requirePositive("poll interval", pollInterval);
        requirePositive("watch interval", watchInterval);
        requirePositive("clean interval", cleanInterval);
        if (httpPort < 0 || httpPort > 65535) {
            throw new IllegalArgumentException("http port out of range: " + httpPort);
        }
        return this;
    }

    // Getters
    public String databaseUrl() {
        return databaseUrl;
    }

    public int databasePoolSize() {
        return databasePoolSize;
    }

    public int maxRetries() {
        return maxRetries;
    }

    public RetryPolicy retryPolicy() {
        return RetryPolicy.from(maxRetries);
    }

    public Duration alertTimeout() {
        return alertTimeout;
    }

    public Duration reportTimeout() {
        return reportTimeout;
    }

    public int concurrency() {
        return concurrency;
    }

    public Duration pollInterval() {
        return pollInterval;
    }

    public Duration watchInterval() {
        return watchInterval;
    }

    public Duration cleanInterval() {
        return cleanInterval;
    }

    public int httpPort() {
        return httpPort;
    }

    public String httpHost() {
        return httpHost;
    }

    public boolean isHttpEnabled() {
        return httpPort > 0;
    }

    // Fluent setters for testing/customization
    public SchedulerConfig withDatabaseUrl(String url) {
        this.databaseUrl = url;
        return this;
    }

    public SchedulerConfig withDatabasePoolSize(int poolSize) {
        this.databasePoolSize = poolSize;
        return this;
    }

    public SchedulerConfig withMaxRetries(int maxRetries) {
        this.maxRetries = maxRetries;
        return this;
    }

    public SchedulerConfig withAlertTimeout(Duration timeout) {
        this.alertTimeout = timeout;
        return this;
    }

    public SchedulerConfig withReportTimeout(Duration timeout) {
        this.reportTimeout = timeout;
        return this;
    }

    public SchedulerConfig withConcurrency(int concurrency) {
        this.concurrency = concurrency;
        return this;
    }

    public SchedulerConfig withPollInterval(Duration interval) {
        this.pollInterval = interval;
        return this;
    }

    public SchedulerConfig withWatchInterval(Duration interval) {
        this.watchInterval = interval;
        return this;
    }

    public SchedulerConfig withCleanInterval(Duration interval) {
        this.cleanInterval = interval;
        return this;
    }

    public SchedulerConfig withHttpPort(int port) {
        this.httpPort = port;
        return this;
    }

    private static int intOption(Profile.Section section, String name, int def) {
        String value = section.get(name);
        return value == null || value.isBlank() ? def : parseInt(name, value);
    }

    private static Duration secondsOption(Profile.Section section, String name, Duration def) {
        String value = section.get(name);
        return value == null || value.isBlank() ? def : parseSeconds(name, value);
    }

    private static int parseInt(String name, String value) {
        try {
            return Integer.parseInt(value.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException(name + " must be an integer: " + value, e);
        }
    }

    private static Duration parseSeconds(String name, String value) {
        return Duration.ofSeconds(parseInt(name, value));
    }

    private static void requirePositive(String name, Duration value) {
        if (value == null || value.isZero() || value.isNegative()) {
            throw new IllegalArgumentException(name + " must be positive");
        }
    }

    @Override
    public String toString() {
        return "SchedulerConfig{" +
                "databaseUrl='" + databaseUrl + '\'' +
                ", maxRetries=" + maxRetries +
                ", alertTimeout=" + alertTimeout +
                ", reportTimeout=" + reportTimeout +
                ", concurrency=" + concurrency +
                ", httpPort=" + httpPort +
                '}';
    }
}
