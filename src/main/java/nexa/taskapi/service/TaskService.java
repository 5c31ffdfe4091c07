package nexa.taskapi.service;

import com.fasterxml.jackson.databind.JsonNode;
import nexa.taskapi.api.v1.dto.TaskResponse;
import nexa.taskapi.model.Task;
import nexa.taskapi.repository.TaskRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Optional;

/**
 * Service layer for task operations.
 * Creation and lookup go straight to the repository; the only domain logic is
 * attaching a mock optimization result when displaying route optimization tasks.
 */
public class TaskService {

    private static final Logger log = LoggerFactory.getLogger(TaskService.class);

    private final TaskRepository taskRepository;
    private final RouteOptimizationSimulator simulator;

    public TaskService(TaskRepository taskRepository, RouteOptimizationSimulator simulator) {
        this.taskRepository = taskRepository;
        this.simulator = simulator;
    }

    /**
     * Create and persist a new pending task.
     * Input is expected to be validated at the API boundary.
     */
    public Task createTask(String type, JsonNode payload) {
        Task task = taskRepository.insert(type, payload);
        log.info("Created task {} of type '{}'", task.id(), task.type());
        return task;
    }

    /**
     * Find a task by ID.
     */
    public Optional<Task> getTask(String taskId) {
        Optional<Task> task = taskRepository.findById(taskId);
        if (task.isEmpty()) {
            log.debug("Task {} not found", taskId);
        }
        return task;
    }

    /**
     * Build the view returned to clients. Route optimization tasks get a freshly
     * simulated result block; every other task is returned as stored.
     */
    public TaskResponse buildDisplayView(Task task) {
        TaskResponse view = TaskResponse.from(task);
        if (!task.isRouteOptimization()) {
            return view;
        }
        return view.withResult(simulator.simulate(task));
    }
}
