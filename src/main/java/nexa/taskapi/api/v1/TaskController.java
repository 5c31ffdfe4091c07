package nexa.taskapi.api.v1;

import io.netty.channel.ChannelHandlerContext;
import io.netty.handler.codec.http.FullHttpRequest;
import io.netty.handler.codec.http.HttpMethod;
import io.netty.handler.codec.http.HttpResponseStatus;
import io.netty.handler.codec.http.QueryStringDecoder;
import nexa.taskapi.api.Controller;
import nexa.taskapi.api.v1.dto.CreateTaskRequest;
import nexa.taskapi.api.v1.dto.CreateTaskResponse;
import nexa.taskapi.api.v1.dto.TaskResponse;
import nexa.taskapi.model.Task;
import nexa.taskapi.service.TaskService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.charset.StandardCharsets;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Controller for task management (public API).
 *
 * POST /api/v1/tasks - Create a new task
 * GET /api/v1/tasks/{taskId} - Get a task, with a mock result for optimize_route
 */
public class TaskController implements Controller {

    private static final Logger log = LoggerFactory.getLogger(TaskController.class);

    private static final Pattern TASKS_PATTERN = Pattern.compile("^/api/v1/tasks$");
    private static final Pattern TASK_BY_ID_PATTERN = Pattern.compile("^/api/v1/tasks/([^/]+)$");

    private final TaskService taskService;

    public TaskController(TaskService taskService) {
        this.taskService = taskService;
    }

    @Override
    public boolean matches(HttpMethod method, String path) {
        if (method.equals(HttpMethod.POST)) {
            return TASKS_PATTERN.matcher(path).matches();
        }
        if (method.equals(HttpMethod.GET)) {
            return TASK_BY_ID_PATTERN.matcher(path).matches();
        }
        return false;
    }

    @Override
    public ControllerResponse handle(ChannelHandlerContext ctx, FullHttpRequest req, String path) {
        if (req.method().equals(HttpMethod.POST)) {
            return handleCreateTask(req);
        }

        Matcher taskMatcher = TASK_BY_ID_PATTERN.matcher(path);
        if (taskMatcher.matches()) {
            return handleGetTask(QueryStringDecoder.decodeComponent(taskMatcher.group(1)));
        }

        return ControllerResponse.notFound("Not Found");
    }

    /**
     * POST /api/v1/tasks - Create a new task
     */
    private ControllerResponse handleCreateTask(FullHttpRequest req) {
        String body = req.content().toString(StandardCharsets.UTF_8);
        CreateTaskRequest request = CreateTaskRequest.parse(body);

        Task task = taskService.createTask(request.type(), request.payload());

        return ControllerResponse.json(
                HttpResponseStatus.CREATED,
                CreateTaskResponse.created(TaskResponse.from(task)));
    }

    /**
     * GET /api/v1/tasks/{taskId} - Get a task
     */
    private ControllerResponse handleGetTask(String taskId) {
        Optional<Task> taskOpt = taskService.getTask(taskId);

        if (taskOpt.isEmpty()) {
            log.debug("GET task {}: not found", taskId);
            return ControllerResponse.notFound("Task with id '" + taskId + "' not found");
        }

        return ControllerResponse.json(taskService.buildDisplayView(taskOpt.get()));
    }
}
