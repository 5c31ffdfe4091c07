package nexa.taskapi;

import nexa.taskapi.config.Dependencies;
import nexa.taskapi.config.TaskApiConfig;
import nexa.taskapi.server.TaskApiServer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Application entry point.
 *
 * Reads configuration from the environment, opens the database, starts the
 * HTTP server and blocks until the process is asked to stop.
 */
public final class App {

    private static final Logger log = LoggerFactory.getLogger(App.class);

    private App() {
    }

    public static void main(String[] args) throws InterruptedException {
        Dependencies deps = Dependencies.create();
        Runtime.getRuntime().addShutdownHook(new Thread(deps::close, "nexa-shutdown"));

        TaskApiServer server = deps.server();
        try {
            server.start();
        } catch (Exception e) {
            log.error("Failed to start Task API", e);
            deps.close();
            System.exit(1);
        }

        log.info("{} {} started", TaskApiConfig.SERVICE_NAME, TaskApiConfig.SERVICE_VERSION);
        server.awaitTermination();
    }
}
