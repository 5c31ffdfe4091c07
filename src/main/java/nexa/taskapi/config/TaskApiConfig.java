package nexa.taskapi.config;

import java.util.Arrays;
import java.util.List;

/**
 * Configuration holder for the task API.
 * All settings have sensible defaults and can be overridden from the environment.
 */
public final class TaskApiConfig {

    public static final String SERVICE_NAME = "nexa-task-api";
    public static final String SERVICE_VERSION = "1.0.0";

    // Database settings
    private String databaseUrl = "jdbc:h2:file:./data/nexa-tasks;AUTO_SERVER=TRUE;MODE=PostgreSQL;DATABASE_TO_UPPER=FALSE";
    private int databasePoolSize = 10;

    // Server settings
    private int serverPort = 8000;
    private String serverHost = "0.0.0.0";

    // CORS settings
    private List<String> corsOrigins = List.of("http://localhost:3002", "http://frontend:3000");

    private TaskApiConfig() {
    }

    public static TaskApiConfig defaults() {
        return new TaskApiConfig();
    }

    public static TaskApiConfig fromEnv() {
        TaskApiConfig config = new TaskApiConfig();

        String dbUrl = System.getenv("NEXA_DB_URL");
        if (dbUrl != null && !dbUrl.isBlank()) {
            config.databaseUrl = dbUrl;
        }

        String poolSize = System.getenv("NEXA_DB_POOL_SIZE");
        if (poolSize != null && !poolSize.isBlank()) {
            config.databasePoolSize = parseInt("NEXA_DB_POOL_SIZE", poolSize);
        }

        String host = System.getenv("NEXA_HOST");
        if (host != null && !host.isBlank()) {
            config.serverHost = host;
        }

        String port = System.getenv("NEXA_PORT");
        if (port != null && !port.isBlank()) {
            config.serverPort = parseInt("NEXA_PORT", port);
        }

        String origins = System.getenv("NEXA_CORS_ORIGINS");
        if (origins != null && !origins.isBlank()) {
            config.corsOrigins = parseList(origins);
        }

        return config;
    }

    static int parseInt(String name, String value) {
        try {
            return Integer.parseInt(value.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException(name + " must be an integer, got '" + value + "'", e);
        }
    }

    static List<String> parseList(String value) {
        return Arrays.stream(value.split(","))
                .map(String::trim)
                .filter(s -> !s.isEmpty())
                .toList();
    }

    // Getters
    public String databaseUrl() {
        return databaseUrl;
    }

    public int databasePoolSize() {
        return databasePoolSize;
    }

    public int serverPort() {
        return serverPort;
    }

    public String serverHost() {
        return serverHost;
    }

    public List<String> corsOrigins() {
        return corsOrigins;
    }

    // Fluent setters for testing/customization
    public TaskApiConfig withDatabaseUrl(String url) {
        this.databaseUrl = url;
        return this;
    }

    public TaskApiConfig withDatabasePoolSize(int poolSize) {
        this.databasePoolSize = poolSize;
        return this;
    }

    public TaskApiConfig withServerHost(String host) {
        this.serverHost = host;
        return this;
    }

    public TaskApiConfig withServerPort(int port) {
        this.serverPort = port;
        return this;
    }

    public TaskApiConfig withCorsOrigins(List<String> origins) {
        this.corsOrigins = List.copyOf(origins);
        return this;
    }

    @Override
    public String toString() {
        return "TaskApiConfig{" +
                "databaseUrl='" + databaseUrl + '\'' +
                ", poolSize=" + databasePoolSize +
                ", serverHost='" + serverHost + '\'' +
                ", serverPort=" + serverPort +
                ", corsOrigins=" + corsOrigins +
                '}';
    }
}
