package nexa.taskapi.config;

import nexa.taskapi.api.v1.HealthController;
import nexa.taskapi.api.v1.RootController;
import nexa.taskapi.api.v1.TaskController;
import nexa.taskapi.repository.TaskRepository;
import nexa.taskapi.server.RouterHandler;
import nexa.taskapi.server.TaskApiServer;
import nexa.taskapi.service.RouteOptimizationSimulator;
import nexa.taskapi.service.TaskService;
import nexa.taskapi.store.Database;
import nexa.taskapi.store.JdbcTaskRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Manual dependency injection container.
 * Creates and wires all service dependencies.
 *
 * Usage:
 *
 * <pre>
 * try (Dependencies deps = Dependencies.create(TaskApiConfig.fromEnv())) {
 *     TaskApiServer server = deps.server();
 *     server.start();
 *     server.awaitTermination();
 * }
 * </pre>
 */
public final class Dependencies implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(Dependencies.class);

    private final TaskApiConfig config;
    private final Database database;
    private final TaskRepository taskRepository;
    private final TaskService taskService;

    // Controllers
    private final RootController rootController;
    private final HealthController healthController;
    private final TaskController taskController;

    // Lazy-initialized
    private RouterHandler routerHandler;
    private TaskApiServer server;

    private Dependencies(TaskApiConfig config, RouteOptimizationSimulator simulator) {
        this.config = config;

        log.info("Initializing dependencies with config: {}", config);

        // Infrastructure
        this.database = new Database(config);

        // Repositories
        this.taskRepository = new JdbcTaskRepository(database);

        // Services
        this.taskService = new TaskService(taskRepository, simulator);

        // Controllers
        this.rootController = new RootController();
        this.healthController = new HealthController();
        this.taskController = new TaskController(taskService);

        log.info("Dependencies initialized successfully");
    }

    /**
     * Create dependencies with the given config.
     */
    public static Dependencies create(TaskApiConfig config) {
        return new Dependencies(config, new RouteOptimizationSimulator());
    }

    /**
     * Create dependencies with environment-based config.
     */
    public static Dependencies create() {
        return create(TaskApiConfig.fromEnv());
    }

    // Getters
    public TaskApiConfig config() {
        return config;
    }

    public Database database() {
        return database;
    }

    public TaskRepository taskRepository() {
        return taskRepository;
    }

    public TaskService taskService() {
        return taskService;
    }

    /**
     * Get a fully configured RouterHandler with all controllers registered.
     */
    public synchronized RouterHandler routerHandler() {
        if (routerHandler == null) {
            routerHandler = new RouterHandler()
                    .registerController(rootController)
                    .registerController(healthController)
                    .registerController(taskController);
            log.info("RouterHandler created with {} controllers", routerHandler.controllerCount());
        }
        return routerHandler;
    }

    /**
     * Get the HTTP server (not started).
     */
    public synchronized TaskApiServer server() {
        if (server == null) {
            server = new TaskApiServer(config, routerHandler());
        }
        return server;
    }

    @Override
    public void close() {
        log.info("Closing dependencies...");

        if (server != null) {
            try {
                server.stop();
            } catch (Exception e) {
                log.warn("Error stopping server: {}", e.getMessage());
            }
        }

        try {
            database.close();
        } catch (Exception e) {
            log.warn("Error closing database: {}", e.getMessage());
        }

        log.info("Dependencies closed");
    }
}
