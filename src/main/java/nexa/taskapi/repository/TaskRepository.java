package nexa.taskapi.repository;

import com.fasterxml.jackson.databind.JsonNode;
import nexa.taskapi.model.Task;

import java.util.Optional;

/**
 * Repository interface for Task persistence.
 * Tasks are append-only: there is no update or delete.
 */
public interface TaskRepository {

    /**
     * Insert a new task with a freshly generated id, pending status and
     * both timestamps set to the current time.
     *
     * @param type    the task type
     * @param payload the task payload (JSON object)
     * @return the stored task, fully populated
     */
    Task insert(String type, JsonNode payload);

    /**
     * Find a task by ID.
     *
     * @param taskId the task ID
     * @return the task if found
     */
    Optional<Task> findById(String taskId);
}
