package beacon.scheduler.api.v1.dto;

import beacon.scheduler.model.Trigger;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;

/**
 * Response DTO for trigger details.
 * GET /api/v1/triggers/{org}/{module}/{key}
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record TriggerResponse(
        @JsonProperty("id") Long id,
        @JsonProperty("org") String org,
        @JsonProperty("module") String module,
        @JsonProperty("key") String key,
        @JsonProperty("status") String status,
        @JsonProperty("nextRunAt") Instant nextRunAt,
        @JsonProperty("startTime") Instant startTime,
        @JsonProperty("endTime") Instant endTime,
        @JsonProperty("lastHeartbeatAt") Instant lastHeartbeatAt,
        @JsonProperty("retries") int retries,
        @JsonProperty("realtime") boolean realtime,
        @JsonProperty("silenced") boolean silenced,
        @JsonProperty("data") String data) {
    /** Create response from domain model */
    public static TriggerResponse from(Trigger trigger) {
        return new TriggerResponse(
                trigger.id(),
                trigger.org(),
                trigger.module().name(),
                trigger.key(),
                trigger.status().name(),
                trigger.nextRunAt(),
                trigger.startTime(),
                trigger.endTime(),
                trigger.lastHeartbeatAt(),
                trigger.retries(),
                trigger.isRealtime(),
                trigger.isSilenced(),
                trigger.data());
    }
}
