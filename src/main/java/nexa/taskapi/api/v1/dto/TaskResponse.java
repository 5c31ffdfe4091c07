package nexa.taskapi.api.v1.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.JsonNode;
import nexa.taskapi.model.Task;

import java.time.Instant;

/**
 * Serialized view of a task.
 * GET /api/v1/tasks/{id}
 *
 * {@code result} is only present for route optimization tasks.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record TaskResponse(
        @JsonProperty("id") String id,
        @JsonProperty("type") String type,
        @JsonProperty("payload") JsonNode payload,
        @JsonProperty("status") String status,
        @JsonProperty("created_at") Instant createdAt,
        @JsonProperty("updated_at") Instant updatedAt,
        @JsonProperty("result") RouteOptimizationResult result) {

    /** Create response from domain model */
    public static TaskResponse from(Task task) {
        return new TaskResponse(
                task.id(),
                task.type(),
                task.payload(),
                task.status(),
                task.createdAt(),
                task.updatedAt(),
                null);
    }

    /** Copy of this view with a result block attached */
    public TaskResponse withResult(RouteOptimizationResult result) {
        return new TaskResponse(id, type, payload, status, createdAt, updatedAt, result);
    }
}
