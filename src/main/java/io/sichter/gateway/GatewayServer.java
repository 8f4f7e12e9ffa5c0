package io.sichter.gateway;

import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpServer;
import io.sichter.config.SichterConfig;
import io.sichter.error.StorageException;
import io.sichter.error.ValidationException;
import io.sichter.events.EventLog;
import io.sichter.events.EventSubscription;
import io.sichter.model.Event;
import io.sichter.model.Job;
import io.sichter.model.JobSpec;
import io.sichter.model.JobType;
import io.sichter.model.QueueSnapshot;
import io.sichter.overview.OverviewAggregator;
import io.sichter.queue.JobQueue;
import io.sichter.storage.JobStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.InetSocketAddress;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.security.MessageDigest;
import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.SynchronousQueue;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;

public final class GatewayServer {
    private static final Logger log = LoggerFactory.getLogger(GatewayServer.class);
    private static final String JOBS_PREFIX = "/api/jobs/";
    private static final int MAX_REPLAY = 1_000;
    private static final int MAX_RECENT = 1_000;
    private static final int DEFAULT_RECENT = 200;

    private final SichterConfig config;
    private final JobQueue queue;
    private final EventLog events;
    private final JobStore store;
    private final OverviewAggregator overview;
    private final Runnable onSubmit;
    private final RateLimiter rateLimiter;

    private final Set<EventSubscription> streams = ConcurrentHashMap.newKeySet();
    private final AtomicInteger streamSlots = new AtomicInteger();
    private final AtomicLong droppedEvents = new AtomicLong();

    private HttpServer server;
    private ThreadPoolExecutor executor;
    private ScheduledExecutorService follower;

    public GatewayServer(
            SichterConfig config,
            JobQueue queue,
            EventLog events,
            JobStore store,
            OverviewAggregator overview,
            Runnable onSubmit
    ) {
        this.config = config;
        this.queue = queue;
        this.events = events;
        this.store = store;
        this.overview = overview;
        this.onSubmit = onSubmit;
        this.rateLimiter = new RateLimiter(config.settings().rateLimitPerMin());
    }

    public synchronized InetSocketAddress start(String bind, int port) throws IOException {
        if (server != null) {
            throw new IllegalStateException("gateway already started");
        }
        HttpServer created = HttpServer.create(new InetSocketAddress(bind, port), 0);
        route(created, "/healthz", true, false, this::handleHealth);
        route(created, "/readyz", true, false, this::handleReady);
        route(created, "/events/stream", true, true, this::handleStream);
        route(created, "/api/events/stream", true, true, this::handleStream);
        route(created, "/events/tail", true, true, this::handleRecent);
        route(created, "/api/events/recent", true, true, this::handleRecent);
        route(created, "/api/jobs/submit", true, true, this::handleSubmit);
        route(created, "/api/sweep", true, true, this::handleSweep);
        route(created, JOBS_PREFIX, false, true, this::handleJob);
        route(created, "/api/queue", true, true, this::handleQueue);
        route(created, "/api/overview", true, true, this::handleOverview);
        route(created, "/api/repos/status", true, true, this::handleRepoStatus);
        route(created, "/metrics", true, true, this::handleMetrics);
        route(created, "/", false, false, exchange ->
                HttpSupport.writeError(exchange, 404, "not_found", exchange.getRequestURI().getPath()));

        int maxThreads = config.tuning().maxStreamClients() + 32;
        AtomicInteger threadIds = new AtomicInteger();
        executor = new ThreadPoolExecutor(4, maxThreads, 60L, TimeUnit.SECONDS, new SynchronousQueue<>(), r -> {
            Thread t = new Thread(r, "sichter-http-" + threadIds.incrementAndGet());
            t.setDaemon(true);
            return t;
        }, new ThreadPoolExecutor.CallerRunsPolicy());
        created.setExecutor(executor);

        follower = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "sichter-event-follower");
            t.setDaemon(true);
            return t;
        });
        long followMs = config.tuning().followInterval().toMillis();
        follower.scheduleWithFixedDelay(this::follow, followMs, followMs, TimeUnit.MILLISECONDS);

        created.start();
        server = created;
        InetSocketAddress address = created.getAddress();
        log.info("Gateway listening on http://{}:{}/ (apiKey={}, rateLimitPerMin={})",
                address.getHostString(), address.getPort(),
                config.settings().apiKey() == null ? "disabled" : "enabled",
                config.settings().rateLimitPerMin());
        return address;
    }

    public synchronized void stop() {
        if (server == null) {
            return;
        }
        follower.shutdownNow();
        for (EventSubscription subscription : streams) {
            subscription.close();
        }
        server.stop(0);
        executor.shutdownNow();
        server = null;
        log.info("Gateway stopped");
    }

    public synchronized int port() {
        if (server == null) {
            throw new IllegalStateException("gateway not started");
        }
        return server.getAddress().getPort();
    }

    public int streamClients() {
        return streams.size();
    }

    private void follow() {
        try {
            events.sync();
        } catch (StorageException e) {
            log.warn("Event follower could not read the log: {}", e.getMessage());
        } catch (RuntimeException e) {
            log.error("Event follower failed", e);
        }
    }

    private void handleHealth(HttpExchange exchange) throws IOException {
        if (!HttpSupport.allowMethods(exchange, "GET")) return;
        HttpSupport.writeText(exchange, "ok", "text/plain; charset=utf-8", 200);
    }

    private void handleReady(HttpExchange exchange) throws IOException {
        if (!HttpSupport.allowMethods(exchange, "GET")) return;
        Map<String, Object> status = new LinkedHashMap<>();
        status.put("queue", Files.isDirectory(config.queueDir()));
        status.put("processing", Files.isDirectory(config.processingDir()));
        status.put("events", Files.isDirectory(config.eventsDir()));
        boolean ready = status.values().stream().allMatch(Boolean.TRUE::equals);
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("status", ready ? "ready" : "not_ready");
        body.putAll(status);
        HttpSupport.writeJson(exchange, body, ready ? 200 : 503);
    }

    private void handleStream(HttpExchange exchange) throws IOException {
        if (!HttpSupport.allowMethods(exchange, "GET")) return;
        Map<String, String> q = HttpSupport.parseQuery(exchange.getRequestURI());
        int replay = HttpSupport.clamp(
                HttpSupport.parseIntOrDefault(q.get("replay"), config.tuning().replayDefault()), 0, MAX_REPLAY);
        int heartbeat = HttpSupport.clamp(
                HttpSupport.parseIntOrDefault(q.get("heartbeat"), config.tuning().heartbeatSeconds()), 1, 300);
        if (streamSlots.incrementAndGet() > config.tuning().maxStreamClients()) {
            streamSlots.decrementAndGet();
            exchange.getResponseHeaders().set("Retry-After", "5");
            HttpSupport.writeError(exchange, 503, "too_many_streams", null);
            return;
        }
        EventSubscription subscription = null;
        try {
            Long lastEventId = parseLastEventId(exchange.getRequestHeaders().getFirst("Last-Event-ID"));
            int buffer = config.tuning().subscriberBuffer();
            subscription = lastEventId == null
                    ? events.subscribe(replay, buffer)
                    : events.resumeAfter(lastEventId, MAX_REPLAY, buffer);
            streams.add(subscription);
            log.debug("Stream client {} connected (replay={}, resumeAfter={})",
                    exchange.getRemoteAddress(), subscription.replay().size(), lastEventId);
            SseConnection connection = new SseConnection(exchange, subscription, Duration.ofSeconds(heartbeat), droppedEvents);
            connection.serve();
            log.debug("Stream client {} {}", exchange.getRemoteAddress(), connection.state());
        } finally {
            if (subscription != null) {
                streams.remove(subscription);
                subscription.close();
            }
            streamSlots.decrementAndGet();
        }
    }

    private void handleRecent(HttpExchange exchange) throws IOException {
        if (!HttpSupport.allowMethods(exchange, "GET")) return;
        Map<String, String> q = HttpSupport.parseQuery(exchange.getRequestURI());
        int n = HttpSupport.clamp(HttpSupport.parseIntOrDefault(q.get("n"), DEFAULT_RECENT), 1, MAX_RECENT);
        List<Event> recent;
        String after = q.get("after");
        if (after != null && !after.isBlank()) {
            Long afterSeq = parseLastEventId(after);
            if (afterSeq == null) {
                throw new ValidationException("Invalid after: " + after);
            }
            recent = events.readAfter(afterSeq, n);
        } else {
            recent = events.tail(n);
        }
        HttpSupport.writeJson(exchange, Map.of("events", recent), 200);
    }

    private void handleSubmit(HttpExchange exchange) throws IOException {
        if (!HttpSupport.allowMethods(exchange, "POST")) return;
        if (!allowWriteRate(exchange)) return;
        JobSpec spec = HttpSupport.readJsonBody(exchange, JobSpec.class);
        accept(exchange, queue.submit(spec));
    }

    private void handleSweep(HttpExchange exchange) throws IOException {
        if (!HttpSupport.allowMethods(exchange, "POST")) return;
        if (!allowWriteRate(exchange)) return;
        SweepRequest request = HttpSupport.readJsonBody(exchange, SweepRequest.class);
        JobSpec spec = new JobSpec(JobType.PR_SWEEP.wireName(), request.mode(), request.repo(), null);
        accept(exchange, queue.submit(spec));
    }

    private void accept(HttpExchange exchange, Job job) throws IOException {
        try {
            store.recordQueued(job);
        } catch (StorageException e) {
            log.warn("Job {} enqueued but not recorded in the ledger: {}", job.id(), e.getMessage());
        }
        if (onSubmit != null) {
            onSubmit.run();
        }
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("enqueued", job.id());
        body.put("status_url", JOBS_PREFIX + job.id());
        body.put("queued", job);
        HttpSupport.writeJson(exchange, body, 202);
    }

    private void handleJob(HttpExchange exchange) throws IOException {
        if (!HttpSupport.allowMethods(exchange, "GET")) return;
        String id = exchange.getRequestURI().getPath().substring(JOBS_PREFIX.length());
        if (!JobQueue.isValidJobId(id)) {
            HttpSupport.writeError(exchange, 400, "invalid_job_id", id);
            return;
        }
        var record = store.find(id);
        if (record.isEmpty()) {
            HttpSupport.writeError(exchange, 404, "job_not_found", id);
            return;
        }
        HttpSupport.writeJson(exchange, record.get(), 200);
    }

    private void handleQueue(HttpExchange exchange) throws IOException {
        if (!HttpSupport.allowMethods(exchange, "GET")) return;
        List<Job> items = queue.peekAll();
        HttpSupport.writeJson(exchange, new QueueSnapshot(items.size(), items), 200);
    }

    private void handleOverview(HttpExchange exchange) throws IOException {
        if (!HttpSupport.allowMethods(exchange, "GET")) return;
        Map<String, String> q = HttpSupport.parseQuery(exchange.getRequestURI());
        int n = HttpSupport.clamp(HttpSupport.parseIntOrDefault(q.get("events"), 50), 0, MAX_RECENT);
        HttpSupport.writeJson(exchange, overview.snapshot(n), 200);
    }

    private void handleRepoStatus(HttpExchange exchange) throws IOException {
        if (!HttpSupport.allowMethods(exchange, "GET")) return;
        Map<String, Object> repos = new TreeMap<>();
        for (Event event : events.tail(config.tuning().eventWindow())) {
            String repo = event.repo();
            if (repo == null || !event.kind().startsWith("job.")) {
                continue;
            }
            Map<String, Object> entry = new LinkedHashMap<>();
            entry.put("seq", event.seq());
            entry.put("ts", event.ts());
            entry.put("kind", event.kind());
            entry.put("job_id", event.jobId());
            entry.put("line", event.line());
            repos.put(repo, entry);
        }
        for (String configured : config.settings().repos()) {
            repos.putIfAbsent(configured, Map.of("kind", "none"));
        }
        HttpSupport.writeJson(exchange, Map.of("repos", repos, "timestamp", Instant.now()), 200);
    }

    private void handleMetrics(HttpExchange exchange) throws IOException {
        if (!HttpSupport.allowMethods(exchange, "GET")) return;
        MetricsFormatter.Stats stats = new MetricsFormatter.Stats(
                queue.size(),
                queue.inFlight().size(),
                events.lastSeq(),
                streams.size(),
                droppedEvents.get(),
                rateLimiter.rejectedTotal(),
                store.countByStatus()
        );
        HttpSupport.writeText(exchange, MetricsFormatter.format(stats), "text/plain; version=0.0.4; charset=utf-8", 200);
    }

    private boolean allowWriteRate(HttpExchange exchange) throws IOException {
        long now = System.currentTimeMillis();
        String client = HttpSupport.remoteKey(exchange);
        if (rateLimiter.tryAcquire(client, now)) {
            return true;
        }
        exchange.getResponseHeaders().set("Retry-After", Long.toString(rateLimiter.retryAfterSeconds(client, now)));
        HttpSupport.writeError(exchange, 429, "rate_limited", null);
        return false;
    }

    private boolean authorized(HttpExchange exchange) {
        String expected = config.settings().apiKey();
        if (expected == null) {
            return true;
        }
        String presented = exchange.getRequestHeaders().getFirst("X-API-Key");
        if (presented == null) {
            String authz = exchange.getRequestHeaders().getFirst("Authorization");
            if (authz != null && authz.regionMatches(true, 0, "Bearer ", 0, 7)) {
                presented = authz.substring(7).trim();
            }
        }
        return presented != null && MessageDigest.isEqual(
                expected.getBytes(StandardCharsets.UTF_8), presented.getBytes(StandardCharsets.UTF_8));
    }

    private boolean applyCors(HttpExchange exchange) throws IOException {
        String origin = exchange.getRequestHeaders().getFirst("Origin");
        List<String> allowed = config.settings().allowedOrigins();
        if (origin != null && (allowed.contains("*") || allowed.contains(origin))) {
            exchange.getResponseHeaders().set("Access-Control-Allow-Origin", origin);
            exchange.getResponseHeaders().add("Vary", "Origin");
        }
        if ("OPTIONS".equalsIgnoreCase(exchange.getRequestMethod())) {
            exchange.getResponseHeaders().set("Access-Control-Allow-Methods", "GET, POST, OPTIONS");
            exchange.getResponseHeaders().set("Access-Control-Allow-Headers",
                    "Content-Type, X-API-Key, Authorization, Last-Event-ID");
            exchange.sendResponseHeaders(204, -1);
            exchange.close();
            return true;
        }
        return false;
    }

    private void route(HttpServer target, String path, boolean exact, boolean protectedRoute, Route handler) {
        target.createContext(path, exchange -> {
            try {
                if (applyCors(exchange)) {
                    return;
                }
                if (exact && !path.equals(exchange.getRequestURI().getPath())) {
                    HttpSupport.writeError(exchange, 404, "not_found", exchange.getRequestURI().getPath());
                    return;
                }
                if (protectedRoute && !authorized(exchange)) {
                    HttpSupport.writeError(exchange, 401, "unauthorized", null);
                    return;
                }
                handler.handle(exchange);
            } catch (ValidationException e) {
                HttpSupport.writeError(exchange, 400, "invalid_request", e.getMessage());
            } catch (StorageException e) {
                log.error("Storage failure on {}", path, e);
                HttpSupport.writeError(exchange, 503, "storage_unavailable", e.getMessage());
            } catch (IOException e) {
                log.debug("I/O error on {}: {}", path, e.getMessage());
                throw e;
            } catch (RuntimeException e) {
                log.error("Unhandled error on {}", path, e);
                HttpSupport.writeError(exchange, 500, "internal_error", e.getMessage());
            } finally {
                exchange.close();
            }
        });
    }

    private static Long parseLastEventId(String raw) {
        if (raw == null || raw.isBlank()) {
            return null;
        }
        try {
            long value = Long.parseLong(raw.trim());
            return value < 0L ? null : value;
        } catch (NumberFormatException e) {
            return null;
        }
    }

    @FunctionalInterface
    private interface Route {
        void handle(HttpExchange exchange) throws IOException;
    }

    private record SweepRequest(String mode, String repo) {
    }
}
