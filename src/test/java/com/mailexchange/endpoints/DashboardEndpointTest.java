package com.mailexchange.endpoints;

import com.google.gson.Gson;
import com.google.gson.JsonArray;
import com.google.gson.JsonObject;
import com.mailexchange.history.ForwardStatus;
import com.mailexchange.history.ForwardTask;
import com.mailexchange.history.TaskHistory;
import com.mailexchange.metrics.ForwardMetrics;
import com.mailexchange.metrics.MetricsRegistry;
import com.mailexchange.rules.ForwardRule;
import io.micrometer.prometheusmetrics.PrometheusConfig;
import io.micrometer.prometheusmetrics.PrometheusMeterRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

class DashboardEndpointTest {

    private final HttpClient client = HttpClient.newHttpClient();
    private final TaskHistory history = new TaskHistory();
    private DashboardEndpoint endpoint;

    @BeforeEach
    void setUp() throws IOException {
        endpoint = new DashboardEndpoint(history, List.of(
                new ForwardRule("[PHOTO]", List.of("a@x.com", "b@x.com")),
                new ForwardRule("[DOC]", List.of("docs@x.com"))
        ));
        endpoint.start("127.0.0.1", 0);
    }

    @AfterEach
    void tearDown() {
        endpoint.stop();
        MetricsRegistry.register(null);
    }

    private HttpResponse<String> get(String path) throws IOException, InterruptedException {
        HttpRequest request = HttpRequest.newBuilder(URI.create("http://127.0.0.1:" + endpoint.getPort() + path)).GET().build();
        return client.send(request, HttpResponse.BodyHandlers.ofString());
    }

    @Test
    void tasksNewestFirst() throws IOException, InterruptedException {
        history.append(new ForwardTask(1L, "2026-01-02T03:04:05Z", "First [PHOTO]", "alice@example.com", "[PHOTO]",
                List.of("a@x.com", "b@x.com"), ForwardStatus.SUCCESS, null));
        history.append(new ForwardTask(2L, "2026-01-02T03:05:05Z", "Second [PHOTO]", "alice@example.com", "[PHOTO]",
                List.of("a@x.com", "b@x.com"), ForwardStatus.FAILED, "1/2 failed"));

        HttpResponse<String> response = get("/api/tasks");

        assertEquals(200, response.statusCode());
        assertTrue(response.headers().firstValue("Content-Type").orElse("").startsWith("application/json"));

        JsonArray tasks = new Gson().fromJson(response.body(), JsonArray.class);
        assertEquals(2, tasks.size());
        JsonObject newest = tasks.get(0).getAsJsonObject();
        assertEquals(2L, newest.get("id").getAsLong());
        assertEquals("failed", newest.get("status").getAsString());
        assertEquals("1/2 failed", newest.get("error").getAsString());
        assertEquals(2, newest.getAsJsonArray("recipients").size());

        JsonObject oldest = tasks.get(1).getAsJsonObject();
        assertEquals("success", oldest.get("status").getAsString());
        assertFalse(oldest.has("error"));
    }

    @Test
    void emptyTasks() throws IOException, InterruptedException {
        assertEquals("[]", get("/api/tasks").body());
    }

    @Test
    void rules() throws IOException, InterruptedException {
        JsonArray rules = new Gson().fromJson(get("/api/rules").body(), JsonArray.class);

        assertEquals(2, rules.size());
        assertEquals("[PHOTO]", rules.get(0).getAsJsonObject().get("tag").getAsString());
        assertEquals("docs@x.com", rules.get(1).getAsJsonObject().getAsJsonArray("recipients").get(0).getAsString());
    }

    @Test
    void health() throws IOException, InterruptedException {
        HttpResponse<String> response = get("/health");

        assertEquals(200, response.statusCode());
        assertEquals("{\"status\":\"UP\"}", response.body());
    }

    @Test
    void dashboardPage() throws IOException, InterruptedException {
        HttpResponse<String> response = get("/");

        assertEquals(200, response.statusCode());
        assertTrue(response.body().contains("Mail Exchange - Forward Tasks"));
        assertTrue(response.body().contains("/api/tasks"));
    }

    @Test
    void unknownPath() throws IOException, InterruptedException {
        assertEquals(404, get("/nothing").statusCode());
    }

    @Test
    void onlyGetIsAllowed() throws IOException, InterruptedException {
        HttpRequest request = HttpRequest.newBuilder(URI.create("http://127.0.0.1:" + endpoint.getPort() + "/api/tasks"))
                .POST(HttpRequest.BodyPublishers.ofString("{}"))
                .build();

        assertEquals(405, client.send(request, HttpResponse.BodyHandlers.ofString()).statusCode());
    }

    @Test
    void metrics() throws IOException, InterruptedException {
        assertEquals(503, get("/metrics").statusCode());

        MetricsRegistry.register(new PrometheusMeterRegistry(PrometheusConfig.DEFAULT));
        ForwardMetrics.incrementMessage("forwarded");

        HttpResponse<String> response = get("/metrics");
        assertEquals(200, response.statusCode());
        assertTrue(response.body().contains("forward_messages_total"));
    }

    @Test
    void stopShutsDownRequestThreads() throws IOException, InterruptedException {
        assertEquals(200, get("/health").statusCode());
        assertTrue(Thread.getAllStackTraces().keySet().stream()
                .anyMatch(thread -> thread.getName().startsWith("dashboard-")));

        ExecutorService executor = endpoint.getExecutor();
        endpoint.stop();

        assertTrue(executor.isShutdown());
        assertTrue(executor.awaitTermination(5, TimeUnit.SECONDS));
        assertNull(endpoint.getExecutor());
        assertEquals(-1, endpoint.getPort());
    }
}
