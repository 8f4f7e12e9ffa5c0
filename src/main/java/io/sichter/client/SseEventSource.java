package io.sichter.client;

import io.sichter.error.TransportException;
import io.sichter.model.Event;
import io.sichter.util.Jsons;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Consumer;

public final class SseEventSource implements EventSource {
    private static final Logger log = LoggerFactory.getLogger(SseEventSource.class);

    private final HttpClient client;
    private final URI baseUri;
    private final int replay;
    private final String apiKey;
    private final AtomicLong lastSeq = new AtomicLong(-1L);

    public SseEventSource(HttpClient client, URI baseUri, int replay, String apiKey) {
        this.client = client;
        this.baseUri = baseUri;
        this.replay = Math.max(0, replay);
        this.apiKey = apiKey;
    }

    @Override
    public Handle start(Listener listener) {
        AtomicBoolean cancelled = new AtomicBoolean();
        AtomicReference<InputStream> body = new AtomicReference<>();
        ExecutorService reader = Executors.newSingleThreadExecutor(r -> {
            Thread t = new Thread(r, "sichter-sse-client");
            t.setDaemon(true);
            return t;
        });
        reader.execute(() -> read(listener, cancelled, body));
        return () -> {
            if (!cancelled.compareAndSet(false, true)) {
                return;
            }
            InputStream in = body.getAndSet(null);
            if (in != null) {
                try {
                    in.close();
                } catch (IOException e) {
                    log.debug("Closing event stream: {}", e.getMessage());
                }
            }
            reader.shutdownNow();
        };
    }

    private void read(Listener listener, AtomicBoolean cancelled, AtomicReference<InputStream> body) {
        HttpRequest.Builder request = GatewayRequests.get(baseUri, "/events/stream?replay=" + replay, apiKey, null)
                .header("Accept", "text/event-stream");
        long resumeAfter = lastSeq.get();
        if (resumeAfter >= 0L) {
            request.header("Last-Event-ID", Long.toString(resumeAfter));
        }
        try {
            HttpResponse<InputStream> response = client.send(request.build(), HttpResponse.BodyHandlers.ofInputStream());
            body.set(response.body());
            if (cancelled.get()) {
                response.body().close();
                return;
            }
            if (response.statusCode() != 200) {
                response.body().close();
                listener.onError(new TransportException("event stream refused: HTTP " + response.statusCode()));
                return;
            }
            listener.onOpen();
            try (BufferedReader lines = new BufferedReader(new InputStreamReader(response.body(), StandardCharsets.UTF_8))) {
                readFrames(lines, frame -> {
                    if (frame.name() == null || "message".equals(frame.name())) {
                        Event event = parseEvent(frame.data());
                        if (event != null) {
                            lastSeq.accumulateAndGet(event.seq(), Math::max);
                            listener.onEvent(event);
                        }
                    } else if ("gap".equals(frame.name())) {
                        log.debug("Gateway dropped events for this client: {}", frame.data());
                    }
                });
            }
            if (!cancelled.get()) {
                listener.onError(new TransportException("event stream closed by server"));
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        } catch (IOException | RuntimeException e) {
            if (!cancelled.get()) {
                listener.onError(new TransportException("event stream failed: " + e.getMessage(), e));
            }
        }
    }

    static void readFrames(BufferedReader lines, Consumer<Frame> sink) throws IOException {
        String name = null;
        String id = null;
        StringBuilder data = null;
        String line;
        while ((line = lines.readLine()) != null) {
            if (line.isEmpty()) {
                if (data != null) {
                    sink.accept(new Frame(id, name, data.toString()));
                }
                name = null;
                id = null;
                data = null;
                continue;
            }
            if (line.startsWith(":")) {
                continue;
            }
            int colon = line.indexOf(':');
            String field = colon < 0 ? line : line.substring(0, colon);
            String value = colon < 0 ? "" : line.substring(colon + 1);
            if (value.startsWith(" ")) {
                value = value.substring(1);
            }
            switch (field) {
                case "event" -> name = value;
                case "id" -> id = value;
                case "data" -> {
                    if (data == null) {
                        data = new StringBuilder(value);
                    } else {
                        data.append('\n').append(value);
                    }
                }
                default -> {
                }
            }
        }
    }

    private static Event parseEvent(String data) {
        try {
            return Jsons.mapper().readValue(data, Event.class);
        } catch (IOException e) {
            log.warn("Ignoring malformed event frame: {}", e.getMessage());
            return null;
        }
    }

    record Frame(String id, String name, String data) {
    }
}
