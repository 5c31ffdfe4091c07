package nexa.taskapi.api.v1.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Response DTO for health check.
 * GET /api/v1/health
 */
public record HealthResponse(
        @JsonProperty("status") String status,
        @JsonProperty("service") String service,
        @JsonProperty("version") String version) {

    public static HealthResponse healthy(String service, String version) {
        return new HealthResponse("healthy", service, version);
    }
}
