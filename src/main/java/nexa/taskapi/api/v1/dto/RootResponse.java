package nexa.taskapi.api.v1.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Welcome payload for GET /.
 */
public record RootResponse(
        @JsonProperty("message") String message,
        @JsonProperty("health") String health) {
}
