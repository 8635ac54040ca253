package beacon.scheduler.api.v1.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Response DTO for health check.
 * GET /api/v1/health
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record HealthResponse(
        @JsonProperty("status") String status,
        @JsonProperty("database") String database,
        @JsonProperty("backend") String backend,
        @JsonProperty("uptime") String uptime,
        @JsonProperty("version") String version,
        @JsonProperty("waiting") Long waiting,
        @JsonProperty("processing") Long processing,
        @JsonProperty("total") Long total) {
    public static HealthResponse healthy(String backend, String uptime, String version, long waiting,
            long processing, long total) {
        return new HealthResponse("healthy", "ok", backend, uptime, version, waiting, processing, total);
    }

    public static HealthResponse unhealthy(String database) {
        return new HealthResponse("unhealthy", database, null, null, null, null, null, null);
    }
}
