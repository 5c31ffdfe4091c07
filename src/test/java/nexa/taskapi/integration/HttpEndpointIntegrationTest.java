package nexa.taskapi.integration;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import nexa.taskapi.config.Dependencies;
import nexa.taskapi.config.TaskApiConfig;
import nexa.taskapi.server.TaskApiServer;
import org.junit.jupiter.api.*;

import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Integration test that hits actual HTTP endpoints.
 * Tests the full flow through the Netty server down to an in-memory database.
 */
class HttpEndpointIntegrationTest {

        private static final ObjectMapper MAPPER = new ObjectMapper();

        private Dependencies deps;
        private HttpClient httpClient;
        private String baseUrl;

        @BeforeEach
        void setUp() throws Exception {
                TaskApiConfig config = TaskApiConfig.defaults()
                                .withDatabaseUrl("jdbc:h2:mem:test-http-" + System.nanoTime()
                                                + ";DB_CLOSE_DELAY=-1;MODE=PostgreSQL;DATABASE_TO_UPPER=FALSE")
                                .withServerHost("127.0.0.1")
                                .withServerPort(0)
                                .withCorsOrigins(List.of("http://localhost:3002"));

                deps = Dependencies.create(config);
                TaskApiServer server = deps.server();
                server.start();
                baseUrl = "http://127.0.0.1:" + server.port();

                httpClient = HttpClient.newBuilder()
                                .connectTimeout(Duration.ofSeconds(5))
                                .build();
        }

        @AfterEach
        void tearDown() {
                deps.close();
        }

        private HttpResponse<String> post(String path, String body) throws Exception {
                return httpClient.send(
                                HttpRequest.newBuilder()
                                                .uri(URI.create(baseUrl + path))
                                                .header("Content-Type", "application/json")
                                                .POST(HttpRequest.BodyPublishers.ofString(body))
                                                .build(),
                                HttpResponse.BodyHandlers.ofString());
        }

        private HttpResponse<String> get(String path) throws Exception {
                return httpClient.send(
                                HttpRequest.newBuilder()
                                                .uri(URI.create(baseUrl + path))
                                                .GET()
                                                .build(),
                                HttpResponse.BodyHandlers.ofString());
        }

        private String createTask(String body) throws Exception {
                HttpResponse<String> response = post("/api/v1/tasks", body);
                assertEquals(201, response.statusCode(), "Create should return 201. Body: " + response.body());
                return MAPPER.readTree(response.body()).get("task").get("id").asText();
        }

        @Test
        @DisplayName("Create a report task, then fetch it without a result block")
        void createAndFetchReportTask() throws Exception {
                HttpResponse<String> createResponse = post("/api/v1/tasks",
                                "{\"type\":\"generate_report\",\"payload\":{\"report_type\":\"monthly\"}}");

                assertEquals(201, createResponse.statusCode(), "Body: " + createResponse.body());
                JsonNode created = MAPPER.readTree(createResponse.body());
                assertEquals("Task created successfully", created.get("message").asText());
                JsonNode task = created.get("task");
                assertEquals("generate_report", task.get("type").asText());
                assertEquals("pending", task.get("status").asText());
                assertEquals("monthly", task.get("payload").get("report_type").asText());
                assertEquals(task.get("created_at").asText(), task.get("updated_at").asText());
                String taskId = task.get("id").asText();

                HttpResponse<String> getResponse = get("/api/v1/tasks/" + taskId);

                assertEquals(200, getResponse.statusCode());
                JsonNode fetched = MAPPER.readTree(getResponse.body());
                assertEquals(taskId, fetched.get("id").asText());
                assertEquals("generate_report", fetched.get("type").asText());
                assertEquals(task.get("payload"), fetched.get("payload"));
                assertEquals("pending", fetched.get("status").asText());
                assertEquals(task.get("created_at").asText(), fetched.get("created_at").asText());
                assertFalse(fetched.has("result"), "Non-optimize_route tasks must not have a result");
        }

        @Test
        @DisplayName("optimize_route with locations gets a suggested order of matching length")
        void optimizeRouteWithLocations() throws Exception {
                String taskId = createTask(
                                "{\"type\":\"optimize_route\",\"payload\":{\"locations\":[\"A\",\"B\",\"C\",\"D\"],\"vehicle_type\":\"truck\"}}");

                HttpResponse<String> response = get("/api/v1/tasks/" + taskId);

                assertEquals(200, response.statusCode());
                JsonNode fetched = MAPPER.readTree(response.body());
                assertEquals("optimize_route", fetched.get("type").asText());
                JsonNode result = fetched.get("result");
                assertNotNull(result, "optimize_route tasks should have a result. Body: " + response.body());
                assertTrue(result.get("total_distance").isNumber());
                assertEquals(4, result.get("suggested_order").size());
                assertTrue(result.get("timestamp").isTextual());
                assertEquals("greedy_nearest_neighbor",
                                result.get("optimization_details").get("algorithm").asText());
                assertTrue(result.get("optimization_details").get("time_saved").asText().endsWith(" minutes"));
                assertTrue(result.get("optimization_details").get("fuel_saved").asText().endsWith(" liters"));
        }

        @Test
        @DisplayName("optimize_route without locations gets 3 to 8 stops")
        void optimizeRouteWithoutLocations() throws Exception {
                String taskId = createTask("{\"type\":\"optimize_route\",\"payload\":{\"vehicle_type\":\"van\"}}");

                for (int i = 0; i < 10; i++) {
                        JsonNode fetched = MAPPER.readTree(get("/api/v1/tasks/" + taskId).body());
                        int n = fetched.get("result").get("suggested_order").size();
                        assertTrue(n >= 3 && n <= 8, "suggested_order length out of range: " + n);
                }
        }

        @Test
        void unknownTaskIsNotFound() throws Exception {
                HttpResponse<String> response = get("/api/v1/tasks/nonexistent-id");

                assertEquals(404, response.statusCode());
                String detail = MAPPER.readTree(response.body()).get("detail").asText();
                assertTrue(detail.toLowerCase().contains("not found"));
                assertTrue(detail.contains("nonexistent-id"));
        }

        @Test
        void percentEncodedTaskIdIsDecoded() throws Exception {
                HttpResponse<String> response = get("/api/v1/tasks/a%20b");

                assertEquals(404, response.statusCode());
                String detail = MAPPER.readTree(response.body()).get("detail").asText();
                assertEquals("Task with id 'a b' not found", detail);
        }

        @Test
        void identicalCreatesGetDistinctIds() throws Exception {
                Set<String> ids = new HashSet<>();
                for (int i = 0; i < 5; i++) {
                        ids.add(createTask("{\"type\":\"generate_report\",\"payload\":{\"report_type\":\"monthly\"}}"));
                }
                assertEquals(5, ids.size());
        }

        @Test
        void invalidBodyIs422WithFieldDetail() throws Exception {
                HttpResponse<String> response = post("/api/v1/tasks", "{\"payload\":\"not-an-object\"}");

                assertEquals(422, response.statusCode());
                JsonNode detail = MAPPER.readTree(response.body()).get("detail");
                assertEquals(2, detail.size());
                assertEquals("type", detail.get(0).get("loc").get(1).asText());
                assertEquals("missing", detail.get(0).get("type").asText());
                assertEquals("payload", detail.get(1).get("loc").get(1).asText());
                assertEquals("dict_type", detail.get(1).get("type").asText());

                HttpResponse<String> garbage = post("/api/v1/tasks", "not json");
                assertEquals(422, garbage.statusCode());
        }

        @Test
        void healthCheck() throws Exception {
                HttpResponse<String> response = get("/api/v1/health");

                assertEquals(200, response.statusCode());
                JsonNode json = MAPPER.readTree(response.body());
                assertEquals("healthy", json.get("status").asText());
                assertEquals("nexa-task-api", json.get("service").asText());
                assertEquals("1.0.0", json.get("version").asText());
        }

        @Test
        void rootAndUnknownPaths() throws Exception {
                HttpResponse<String> root = get("/");
                assertEquals(200, root.statusCode());
                assertEquals("Welcome to Nexa Task API", MAPPER.readTree(root.body()).get("message").asText());

                HttpResponse<String> unknown = get("/api/v1/jobs");
                assertEquals(404, unknown.statusCode());
        }

        @Test
        void corsPreflightFromAllowedOrigin() throws Exception {
                HttpResponse<String> response = httpClient.send(
                                HttpRequest.newBuilder()
                                                .uri(URI.create(baseUrl + "/api/v1/tasks"))
                                                .header("Origin", "http://localhost:3002")
                                                .header("Access-Control-Request-Method", "POST")
                                                .method("OPTIONS", HttpRequest.BodyPublishers.noBody())
                                                .build(),
                                HttpResponse.BodyHandlers.ofString());

                assertEquals(200, response.statusCode());
                assertEquals("http://localhost:3002",
                                response.headers().firstValue("Access-Control-Allow-Origin").orElse(null));
        }

        @Test
        void corsHeadersOnlyForAllowedOrigins() throws Exception {
                HttpResponse<String> allowed = httpClient.send(
                                HttpRequest.newBuilder()
                                                .uri(URI.create(baseUrl + "/api/v1/health"))
                                                .header("Origin", "http://localhost:3002")
                                                .GET()
                                                .build(),
                                HttpResponse.BodyHandlers.ofString());
                assertEquals(200, allowed.statusCode());
                assertEquals("http://localhost:3002",
                                allowed.headers().firstValue("Access-Control-Allow-Origin").orElse(null));

                HttpResponse<String> other = httpClient.send(
                                HttpRequest.newBuilder()
                                                .uri(URI.create(baseUrl + "/api/v1/health"))
                                                .header("Origin", "http://evil.example")
                                                .GET()
                                                .build(),
                                HttpResponse.BodyHandlers.ofString());
                assertEquals(200, other.statusCode());
                assertTrue(other.headers().firstValue("Access-Control-Allow-Origin").isEmpty());
        }
}
