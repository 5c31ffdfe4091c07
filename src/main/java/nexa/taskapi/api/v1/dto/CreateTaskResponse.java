package nexa.taskapi.api.v1.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Response DTO for task creation.
 * POST /api/v1/tasks
 */
public record CreateTaskResponse(
        @JsonProperty("message") String message,
        @JsonProperty("task") TaskResponse task) {

    public static CreateTaskResponse created(TaskResponse task) {
        return new CreateTaskResponse("Task created successfully", task);
    }
}
