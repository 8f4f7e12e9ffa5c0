package io.sichter.gateway;

import com.fasterxml.jackson.databind.JsonNode;
import io.sichter.config.SichterConfig;
import io.sichter.config.SichterSettings;
import io.sichter.model.WorkerStatus;
import io.sichter.runtime.SichterRuntime;
import io.sichter.util.Jsons;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.UnaryOperator;
import java.util.stream.Stream;

final class GatewayServerTest {
    private Path root;
    private GatewayServer gateway;
    private SichterRuntime runtime;
    private final AtomicInteger submits = new AtomicInteger();
    private final HttpClient http = HttpClient.newBuilder().connectTimeout(Duration.ofSeconds(5)).build();

    @BeforeEach
    void setUp() throws Exception {
        root = Files.createTempDirectory("sichter-gateway-");
    }

    @AfterEach
    void tearDown() throws Exception {
        if (gateway != null) {
            gateway.stop();
        }
        deleteRecursively(root);
    }

    @Test
    void submitAcceptsJobAndRecordsIt() throws Exception {
        start(settings -> settings.withRepos(List.of("wgx")));

        HttpResponse<String> response = post("/api/jobs/submit", "{\"type\":\"ScanChanged\",\"repo\":\"wgx\"}");

        Assertions.assertEquals(202, response.statusCode());
        JsonNode body = Jsons.mapper().readTree(response.body());
        String id = body.path("enqueued").asText();
        Assertions.assertTrue(id.matches("[0-9]{13}-[0-9a-f]{32}"), id);
        Assertions.assertEquals("/api/jobs/" + id, body.path("status_url").asText());
        Assertions.assertEquals("changed", body.path("queued").path("mode").asText());
        Assertions.assertTrue(body.path("queued").path("auto_pr").asBoolean());
        Assertions.assertEquals(1, submits.get());
        Assertions.assertEquals(1, runtime.queue().size());

        HttpResponse<String> job = get("/api/jobs/" + id);
        Assertions.assertEquals(200, job.statusCode());
        Assertions.assertEquals("QUEUED", Jsons.mapper().readTree(job.body()).path("status").asText());

        HttpResponse<String> queue = get("/api/queue");
        Assertions.assertEquals(1, Jsons.mapper().readTree(queue.body()).path("size").asInt());
    }

    @Test
    void invalidSubmissionsAreRejectedWithoutSideEffects() throws Exception {
        start(UnaryOperator.identity());

        HttpResponse<String> unknownType = post("/api/jobs/submit", "{\"type\":\"Deploy\"}");
        Assertions.assertEquals(400, unknownType.statusCode());
        Assertions.assertEquals("invalid_request", Jsons.mapper().readTree(unknownType.body()).path("error").asText());

        Assertions.assertEquals(400, post("/api/jobs/submit", "{\"type\":\"ScanAll\",\"mode\":\"changed\"}").statusCode());
        Assertions.assertEquals(400, post("/api/jobs/submit", "{\"type\":\"ScanChanged\",\"repo\":\"../etc\"}").statusCode());
        Assertions.assertEquals(400, post("/api/jobs/submit", "not json").statusCode());
        Assertions.assertEquals(400, post("/api/jobs/submit", "").statusCode());

        Assertions.assertEquals(0, runtime.queue().size());
        Assertions.assertEquals(0, submits.get());
    }

    @Test
    void sweepEnqueuesPrSweep() throws Exception {
        start(UnaryOperator.identity());

        HttpResponse<String> response = post("/api/sweep", "{\"mode\":\"all\"}");

        Assertions.assertEquals(202, response.statusCode());
        JsonNode queued = Jsons.mapper().readTree(response.body()).path("queued");
        Assertions.assertEquals("PRSweep", queued.path("type").asText());
        Assertions.assertEquals("all", queued.path("mode").asText());
    }

    @Test
    void methodsAndPathsAreChecked() throws Exception {
        start(UnaryOperator.identity());

        HttpResponse<String> wrongMethod = get("/api/jobs/submit");
        Assertions.assertEquals(405, wrongMethod.statusCode());
        Assertions.assertEquals("POST", wrongMethod.headers().firstValue("Allow").orElse(""));

        Assertions.assertEquals(404, get("/api/queue/extra").statusCode());
        Assertions.assertEquals(404, get("/nowhere").statusCode());
        Assertions.assertEquals(400, get("/api/jobs/not-a-job").statusCode());
        Assertions.assertEquals(404, get("/api/jobs/0000000000001-0123456789abcdef0123456789abcdef").statusCode());
    }

    @Test
    void probesAnswerWithoutApiKey() throws Exception {
        start(settings -> settings.withApiKey("s3cret"));

        HttpResponse<String> health = get("/healthz");
        Assertions.assertEquals(200, health.statusCode());
        Assertions.assertEquals("ok", health.body());

        HttpResponse<String> ready = get("/readyz");
        Assertions.assertEquals(200, ready.statusCode());
        Assertions.assertEquals("ready", Jsons.mapper().readTree(ready.body()).path("status").asText());
    }

    @Test
    void apiKeyGuardsEverythingElse() throws Exception {
        start(settings -> settings.withApiKey("s3cret"));

        Assertions.assertEquals(401, get("/api/queue").statusCode());
        Assertions.assertEquals(401, get("/api/events/recent").statusCode());
        Assertions.assertEquals(401, send(HttpRequest.newBuilder(uri("/api/queue"))
                .header("X-API-Key", "wrong").GET().build()).statusCode());
        Assertions.assertEquals(200, send(HttpRequest.newBuilder(uri("/api/queue"))
                .header("X-API-Key", "s3cret").GET().build()).statusCode());
        Assertions.assertEquals(200, send(HttpRequest.newBuilder(uri("/api/queue"))
                .header("Authorization", "Bearer s3cret").GET().build()).statusCode());
    }

    @Test
    void writesAreRateLimited() throws Exception {
        start(settings -> settings.withRateLimitPerMin(2));
        String body = "{\"type\":\"ScanChanged\",\"repo\":\"wgx\"}";

        Assertions.assertEquals(202, post("/api/jobs/submit", body).statusCode());
        Assertions.assertEquals(202, post("/api/jobs/submit", body).statusCode());
        HttpResponse<String> limited = post("/api/jobs/submit", body);

        Assertions.assertEquals(429, limited.statusCode());
        long retryAfter = Long.parseLong(limited.headers().firstValue("Retry-After").orElse("0"));
        Assertions.assertTrue(retryAfter >= 1L && retryAfter <= 60L, "Retry-After=" + retryAfter);
        Assertions.assertEquals(429, post("/api/sweep", "{}").statusCode());
        Assertions.assertEquals(2, runtime.queue().size());
        Assertions.assertTrue(get("/metrics").body().contains("sichter_write_rate_limited_total 2"));
        Assertions.assertEquals(200, get("/api/queue").statusCode());
    }

    @Test
    void recentEventsHonourLimitAndCursor() throws Exception {
        start(UnaryOperator.identity());
        for (int i = 1; i <= 5; i++) {
            runtime.events().append("job.progress", "step " + i, Map.of("repo", "wgx"));
        }

        JsonNode tail = Jsons.mapper().readTree(get("/api/events/recent?n=2").body()).path("events");
        Assertions.assertEquals(2, tail.size());
        Assertions.assertEquals(4L, tail.get(0).path("seq").asLong());
        Assertions.assertEquals(5L, tail.get(1).path("seq").asLong());

        JsonNode after = Jsons.mapper().readTree(get("/events/tail?after=3&n=10").body()).path("events");
        Assertions.assertEquals(2, after.size());
        Assertions.assertEquals(4L, after.get(0).path("seq").asLong());

        Assertions.assertEquals(400, get("/api/events/recent?after=abc").statusCode());

        JsonNode repos = Jsons.mapper().readTree(get("/api/repos/status").body()).path("repos");
        Assertions.assertEquals("job.progress", repos.path("wgx").path("kind").asText());
        Assertions.assertEquals(5L, repos.path("wgx").path("seq").asLong());
    }

    @Test
    void overviewAndMetricsReflectState() throws Exception {
        start(UnaryOperator.identity());
        post("/api/jobs/submit", "{\"type\":\"ScanChanged\",\"repo\":\"wgx\"}");
        runtime.events().append("worker.started", "worker started", null);

        JsonNode overview = Jsons.mapper().readTree(get("/api/overview?events=5").body());
        Assertions.assertEquals("active", overview.path("worker").path("activeState").asText());
        Assertions.assertEquals(1, overview.path("queue").path("size").asInt());
        Assertions.assertEquals(1, overview.path("events").size());

        String metrics = get("/metrics").body();
        Assertions.assertTrue(metrics.contains("sichter_queue_depth 1"), metrics);
        Assertions.assertTrue(metrics.contains("sichter_events_last_seq 1"), metrics);
        Assertions.assertTrue(metrics.contains("sichter_jobs{status=\"QUEUED\"} 1"), metrics);
    }

    @Test
    void streamReplaysThenDeliversLiveEvents() throws Exception {
        start(UnaryOperator.identity());
        for (int i = 1; i <= 3; i++) {
            runtime.events().append("job.progress", "before " + i, null);
        }

        HttpResponse<InputStream> response = http.send(
                HttpRequest.newBuilder(uri("/events/stream?replay=2&heartbeat=1")).GET().build(),
                HttpResponse.BodyHandlers.ofInputStream());
        Assertions.assertEquals(200, response.statusCode());
        Assertions.assertTrue(response.headers().firstValue("Content-Type").orElse("").startsWith("text/event-stream"));

        try (BufferedReader reader = new BufferedReader(new InputStreamReader(response.body(), StandardCharsets.UTF_8))) {
            Assertions.assertEquals("retry: 3000", reader.readLine());
            Assertions.assertEquals(2L, nextDataSeq(reader));
            Assertions.assertEquals(3L, nextDataSeq(reader));

            Assertions.assertEquals(1, gateway.streamClients());
            runtime.events().append("job.succeeded", "live", null);
            Assertions.assertEquals(4L, nextDataSeq(reader));
            Assertions.assertTrue(waitForHeartbeat(reader), "no heartbeat within the interval");
        }
    }

    @Test
    void streamResumesAfterLastEventId() throws Exception {
        start(UnaryOperator.identity());
        for (int i = 1; i <= 4; i++) {
            runtime.events().append("job.progress", "event " + i, null);
        }

        HttpResponse<InputStream> response = http.send(
                HttpRequest.newBuilder(uri("/api/events/stream?replay=0&heartbeat=1"))
                        .header("Last-Event-ID", "2")
                        .GET()
                        .build(),
                HttpResponse.BodyHandlers.ofInputStream());

        try (BufferedReader reader = new BufferedReader(new InputStreamReader(response.body(), StandardCharsets.UTF_8))) {
            Assertions.assertEquals(3L, nextDataSeq(reader));
            Assertions.assertEquals(4L, nextDataSeq(reader));
        }
    }

    @Test
    void optionsPreflightAllowsConfiguredOrigin() throws Exception {
        SichterConfig config = SichterConfig.fromRoot(root.toString());
        config = config.withSettings(new SichterSettings(
                null, null, null, null, 0L, null, null, 0, List.of("http://localhost:5173")));
        startWith(config);

        HttpResponse<String> response = send(HttpRequest.newBuilder(uri("/api/jobs/submit"))
                .header("Origin", "http://localhost:5173")
                .method("OPTIONS", HttpRequest.BodyPublishers.noBody())
                .build());

        Assertions.assertEquals(204, response.statusCode());
        Assertions.assertEquals("http://localhost:5173",
                response.headers().firstValue("Access-Control-Allow-Origin").orElse(""));
    }

    private void start(UnaryOperator<SichterSettings> settings) throws IOException {
        SichterConfig config = SichterConfig.fromRoot(root.toString());
        startWith(config.withSettings(settings.apply(config.settings())));
    }

    private void startWith(SichterConfig config) throws IOException {
        SichterConfig tuned = config.withTuning(config.tuning().withFollowInterval(Duration.ofMillis(50)));
        runtime = new SichterRuntime(tuned);
        runtime.init();
        WorkerStatus active = new WorkerStatus("active", "running", "1", null, null);
        gateway = runtime.gateway(() -> active, submits::incrementAndGet);
        gateway.start("127.0.0.1", 0);
    }

    private URI uri(String pathAndQuery) {
        return URI.create("http://127.0.0.1:" + gateway.port() + pathAndQuery);
    }

    private HttpResponse<String> get(String pathAndQuery) throws Exception {
        return send(HttpRequest.newBuilder(uri(pathAndQuery)).timeout(Duration.ofSeconds(5)).GET().build());
    }

    private HttpResponse<String> post(String path, String json) throws Exception {
        return send(HttpRequest.newBuilder(uri(path))
                .timeout(Duration.ofSeconds(5))
                .header("Content-Type", "application/json")
                .POST(HttpRequest.BodyPublishers.ofString(json))
                .build());
    }

    private HttpResponse<String> send(HttpRequest request) throws Exception {
        return http.send(request, HttpResponse.BodyHandlers.ofString());
    }

    /**
     * Reads frames until the next unnamed data frame and returns its id.
     */
    private static long nextDataSeq(BufferedReader reader) throws IOException {
        String id = null;
        String name = null;
        for (int i = 0; i < 200; i++) {
            String line = reader.readLine();
            if (line == null) {
                break;
            }
            if (line.isEmpty()) {
                if (id != null && name == null) {
                    return Long.parseLong(id);
                }
                id = null;
                name = null;
            } else if (line.startsWith("id: ")) {
                id = line.substring(4);
            } else if (line.startsWith("event: ")) {
                name = line.substring(7);
            }
        }
        throw new AssertionError("no data frame received");
    }

    private static boolean waitForHeartbeat(BufferedReader reader) throws IOException {
        for (int i = 0; i < 20; i++) {
            String line = reader.readLine();
            if (line == null) {
                return false;
            }
            if (line.equals("event: heartbeat")) {
                return true;
            }
        }
        return false;
    }

    private static void deleteRecursively(Path root) throws IOException {
        if (root == null || !Files.exists(root)) {
            return;
        }
        try (Stream<Path> walk = Files.walk(root)) {
            for (Path path : walk.sorted((a, b) -> Integer.compare(b.getNameCount(), a.getNameCount())).toList()) {
                Files.deleteIfExists(path);
            }
        }
    }
}
