package io.sichter.gateway;

import com.sun.net.httpserver.HttpExchange;
import io.sichter.events.EventSubscription;
import io.sichter.model.Event;
import io.sichter.util.Jsons;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;

/**
 * One server-sent-events client. Replays the subscription snapshot, then forwards live events
 * until the client goes away or the subscription is closed by the server.
 *
 * <p>Data frames carry {@code id: <seq>} and no event name, so browsers deliver them to
 * {@code onmessage}. Control frames are named {@code heartbeat} and {@code gap}.
 */
final class SseConnection {
    private static final Logger log = LoggerFactory.getLogger(SseConnection.class);

    enum State {
        CONNECTING,
        REPLAYING,
        LIVE,
        CLOSED
    }

    private final HttpExchange exchange;
    private final EventSubscription subscription;
    private final Duration heartbeat;
    private final AtomicLong droppedTotal;
    private volatile State state = State.CONNECTING;

    SseConnection(HttpExchange exchange, EventSubscription subscription, Duration heartbeat, AtomicLong droppedTotal) {
        this.exchange = exchange;
        this.subscription = subscription;
        this.heartbeat = heartbeat;
        this.droppedTotal = droppedTotal;
    }

    State state() {
        return state;
    }

    void serve() {
        try {
            exchange.getResponseHeaders().set("Content-Type", "text/event-stream; charset=utf-8");
            exchange.getResponseHeaders().set("Cache-Control", "no-cache");
            exchange.getResponseHeaders().set("Connection", "keep-alive");
            exchange.getResponseHeaders().set("X-Accel-Buffering", "no");
            exchange.sendResponseHeaders(200, 0);
            OutputStream os = exchange.getResponseBody();
            state = State.REPLAYING;
            os.write(("retry: 3000\n\n").getBytes(StandardCharsets.UTF_8));
            for (Event event : subscription.replay()) {
                writeEvent(os, event);
            }
            os.flush();
            state = State.LIVE;
            long heartbeatMs = heartbeat.toMillis();
            while (!subscription.isClosed()) {
                Event event = subscription.poll(heartbeatMs, TimeUnit.MILLISECONDS);
                long lost = subscription.drainDropped();
                if (lost > 0L) {
                    droppedTotal.addAndGet(lost);
                    writeControl(os, "gap", Map.of("dropped", lost));
                }
                if (event != null) {
                    writeEvent(os, event);
                } else if (subscription.isClosed()) {
                    break;
                } else {
                    writeControl(os, "heartbeat", Map.of("ts", Instant.now().toString()));
                }
                os.flush();
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        } catch (IOException e) {
            log.debug("Event stream client {} disconnected: {}", exchange.getRemoteAddress(), e.getMessage());
        } finally {
            state = State.CLOSED;
            subscription.close();
            exchange.close();
        }
    }

    static String frame(Event event) {
        return "id: " + event.seq() + "\n" + "data: " + Jsons.toCompactJson(event) + "\n\n";
    }

    private static void writeEvent(OutputStream os, Event event) throws IOException {
        os.write(frame(event).getBytes(StandardCharsets.UTF_8));
    }

    private static void writeControl(OutputStream os, String name, Map<String, Object> data) throws IOException {
        String frame = "event: " + name + "\n" + "data: " + Jsons.toCompactJson(data) + "\n\n";
        os.write(frame.getBytes(StandardCharsets.UTF_8));
    }
}
