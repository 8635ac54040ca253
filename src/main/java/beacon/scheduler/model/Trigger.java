package beacon.scheduler.model;

import java.time.Duration;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.Objects;

/**
 * Immutable domain model of one schedulable job (an alert evaluation or a
 * report generation) for one tenant.
 *
 * Timestamps are held at microsecond precision, which is what the store
 * persists.
 */
public final class Trigger {
    private final Long id; // null until persisted
    private final String org;
    private final TriggerModule module;
    private final String key;
    private final TriggerStatus status;
    private final Instant nextRunAt;
    private final Instant startTime;
    private final Instant endTime; // lease deadline
    private final Instant lastHeartbeatAt;
    private final int retries;
    private final boolean realtime;
    private final boolean silenced;
    private final String data; // opaque JSON owned by the consumer

    private Trigger(Builder builder) {
        this.id = builder.id;
        this.org = requireText(builder.org, "org");
        this.module = Objects.requireNonNull(builder.module, "module is required");
        this.key = requireText(builder.key, "key");
        this.status = Objects.requireNonNull(builder.status, "status is required");
        this.nextRunAt = micros(Objects.requireNonNull(builder.nextRunAt, "nextRunAt is required"));
        this.startTime = micros(builder.startTime);
        this.endTime = micros(builder.endTime);
        this.lastHeartbeatAt = micros(builder.lastHeartbeatAt);
        if (builder.retries < 0) {
            throw new IllegalArgumentException("retries must be non-negative");
        }
        this.retries = builder.retries;
        this.realtime = builder.realtime;
        this.silenced = builder.silenced;
        this.data = builder.data != null ? builder.data : "";
    }

    // Getters
    public Long id() {
        return id;
    }

    public String org() {
        return org;
    }

    public TriggerModule module() {
        return module;
    }

    public String key() {
        return key;
    }

    public TriggerStatus status() {
        return status;
    }

    public Instant nextRunAt() {
        return nextRunAt;
    }

    public Instant startTime() {
        return startTime;
    }

    public Instant endTime() {
        return endTime;
    }

    public Instant lastHeartbeatAt() {
        return lastHeartbeatAt;
    }

    public int retries() {
        return retries;
    }

    public boolean isRealtime() {
        return realtime;
    }

    public boolean isSilenced() {
        return silenced;
    }

    public String data() {
        return data;
    }

    /** Identity triple */
    public TriggerKey identity() {
        return new TriggerKey(org, module, key);
    }

    /**
     * Realtime alerts are driven by ingest and only come through polling
     * while silenced.
     */
    public boolean isPollable() {
        return !(realtime && !silenced);
    }

    /** Realtime alert in cool-down that needs waking up */
    public boolean needsWakeup() {
        return realtime && silenced;
    }

    /** Pick the lease timeout matching this trigger's module */
    public Duration leaseTimeout(Duration alertTimeout, Duration reportTimeout) {
        return module == TriggerModule.ALERT ? alertTimeout : reportTimeout;
    }

    /** Check if the lease deadline has passed */
    public boolean isLeaseExpired(Instant now) {
        return status == TriggerStatus.PROCESSING && endTime != null && !endTime.isAfter(now);
    }

    /** Create a builder from this trigger (for updates) */
    public Builder toBuilder() {
        return new Builder()
                .id(id)
                .org(org)
                .module(module)
                .key(key)
                .status(status)
                .nextRunAt(nextRunAt)
                .startTime(startTime)
                .endTime(endTime)
                .lastHeartbeatAt(lastHeartbeatAt)
                .retries(retries)
                .realtime(realtime)
                .silenced(silenced)
                .data(data);
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private Long id;
        private String org;
        private TriggerModule module;
        private String key;
        private TriggerStatus status = TriggerStatus.WAITING;
        private Instant nextRunAt;
        private Instant startTime;
        private Instant endTime;
        private Instant lastHeartbeatAt;
        private int retries = 0;
        private boolean realtime = false;
        private boolean silenced = false;
        private String data = "";

        public Builder id(Long id) {
            this.id = id;
            return this;
        }

        public Builder org(String org) {
            this.org = org;
            return this;
        }

        public Builder module(TriggerModule module) {
            this.module = module;
            return this;
        }

        public Builder key(String key) {
            this.key = key;
            return this;
        }

        public Builder identity(TriggerKey identity) {
            this.org = identity.org();
            this.module = identity.module();
            this.key = identity.key();
            return this;
        }

        public Builder status(TriggerStatus status) {
            this.status = status;
            return this;
        }

        public Builder nextRunAt(Instant nextRunAt) {
            this.nextRunAt = nextRunAt;
            return this;
        }

        public Builder startTime(Instant startTime) {
            this.startTime = startTime;
            return this;
        }

        public Builder endTime(Instant endTime) {
            this.endTime = endTime;
            return this;
        }

        public Builder lastHeartbeatAt(Instant lastHeartbeatAt) {
            this.lastHeartbeatAt = lastHeartbeatAt;
            return this;
        }

        public Builder retries(int retries) {
            this.retries = retries;
            return this;
        }

        public Builder realtime(boolean realtime) {
            this.realtime = realtime;
            return this;
        }

        public Builder silenced(boolean silenced) {
            this.silenced = silenced;
            return this;
        }

        public Builder data(String data) {
            this.data = data;
            return this;
        }

        public Trigger build() {
            return new Trigger(this);
        }
    }

    private static String requireText(String value, String name) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException(name + " is required");
        }
        return value;
    }

    private static Instant micros(Instant instant) {
        return instant != null ? instant.truncatedTo(ChronoUnit.MICROS) : null;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof Trigger trigger))
            return false;
        return Objects.equals(org, trigger.org)
                && module == trigger.module
                && Objects.equals(key, trigger.key);
    }

    @Override
    public int hashCode() {
        return Objects.hash(org, module, key);
    }

    @Override
    public String toString() {
        return "Trigger{" + org + "/" + module + "/" + key + ", status=" + status + ", retries=" + retries + '}';
    }
}
