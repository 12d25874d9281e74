package taskmesh.node.integration;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import taskmesh.node.MarketplaceNode;
import taskmesh.node.config.NodeConfig;
import taskmesh.node.support.FakeSessionOpener;
import taskmesh.node.support.FakeTaskManager;
import taskmesh.node.support.RecordingPaymentService;
import taskmesh.node.support.RecordingTaskComputer;
import org.junit.jupiter.api.*;

import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Integration test that hits the status endpoints over real HTTP.
 */
class HttpEndpointIntegrationTest {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private MarketplaceNode node;
    private HttpClient httpClient;
    private String baseUrl;

    @BeforeEach
    void setUp() {
        NodeConfig config = NodeConfig.defaults()
                .withNodeId("node-http")
                .withHttpHost("127.0.0.1")
                .withHttpPort(0)
                .withTickInterval(Duration.ofHours(1));

        node = MarketplaceNode.builder(config)
                .sessionOpener(new FakeSessionOpener())
                .paymentService(new RecordingPaymentService())
                .taskManager(new FakeTaskManager())
                .taskComputer(new RecordingTaskComputer())
                .build();
        node.start();

        baseUrl = "http://127.0.0.1:" + node.httpPort().orElseThrow();
        httpClient = HttpClient.newBuilder()
                .connectTimeout(Duration.ofSeconds(5))
                .build();
    }

    @AfterEach
    void tearDown() {
        node.close();
    }

    @Test
    void healthReportsNodeCounters() throws Exception {
        HttpResponse<String> response = get("/api/v1/health");

        assertEquals(200, response.statusCode(), response.body());
        JsonNode body = MAPPER.readTree(response.body());
        assertEquals("healthy", body.get("status").asText());
        assertEquals("node-http", body.get("nodeId").asText());
        assertEquals(0, body.get("knownTasks").asInt());
    }

    @Test
    @DisplayName("Posted advertisement shows up in the task listing")
    void postedHeaderIsListed() throws Exception {
        String header = """
                {
                    "id": "t1",
                    "clientId": "owner-1",
                    "address": "10.0.0.7",
                    "port": 40102,
                    "environment": "docker",
                    "ttl": 60.0,
                    "subtaskTimeout": 120.0
                }
                """;

        HttpResponse<String> posted = post("/internal/v1/task-headers", header);
        assertEquals(200, posted.statusCode(), posted.body());
        assertTrue(MAPPER.readTree(posted.body()).get("ok").asBoolean());

        HttpResponse<String> again = post("/internal/v1/task-headers", header);
        assertFalse(MAPPER.readTree(again.body()).get("ok").asBoolean());

        JsonNode tasks = MAPPER.readTree(get("/api/v1/tasks").body()).get("tasks");
        assertEquals(1, tasks.size());
        assertEquals("t1", tasks.get(0).get("id").asText());
        assertEquals(120.0, tasks.get(0).get("subtaskTimeout").asDouble());
        assertFalse(tasks.get(0).get("local").asBoolean());
    }

    @Test
    void invalidAdvertisementIsBadRequest() throws Exception {
        HttpResponse<String> missingTtl = post("/internal/v1/task-headers",
                "{\"id\":\"t1\",\"clientId\":\"o\",\"address\":\"h\",\"port\":1,\"environment\":\"docker\"}");
        HttpResponse<String> notJson = post("/internal/v1/task-headers", "{oops");

        assertEquals(400, missingTtl.statusCode());
        assertEquals(400, notJson.statusCode());
    }

    @Test
    void messagesStartEmpty() throws Exception {
        HttpResponse<String> response = get("/api/v1/messages");

        assertEquals(200, response.statusCode());
        assertEquals(0, MAPPER.readTree(response.body()).get("messages").size());
    }

    @Test
    void unknownPathIsNotFound() throws Exception {
        assertEquals(404, get("/api/v2/nothing").statusCode());
    }

    private HttpResponse<String> get(String path) throws Exception {
        return httpClient.send(
                HttpRequest.newBuilder().uri(URI.create(baseUrl + path)).GET().build(),
                HttpResponse.BodyHandlers.ofString());
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
}
