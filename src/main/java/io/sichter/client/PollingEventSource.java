package io.sichter.client;

import com.fasterxml.jackson.databind.JsonNode;
import io.sichter.error.TransportException;
import io.sichter.model.Event;
import io.sichter.util.Jsons;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

public final class PollingEventSource implements EventSource {
    private final HttpClient client;
    private final URI baseUri;
    private final Duration pollInterval;
    private final int limit;
    private final String apiKey;

    public PollingEventSource(HttpClient client, URI baseUri, Duration pollInterval, int limit, String apiKey) {
        this.client = client;
        this.baseUri = baseUri;
        this.pollInterval = pollInterval;
        this.limit = Math.max(1, limit);
        this.apiKey = apiKey;
    }

    public List<Event> fetch() throws InterruptedException {
        HttpResponse<String> response;
        try {
            response = client.send(
                    GatewayRequests.get(baseUri, "/api/events/recent?n=" + limit, apiKey, pollInterval.multipliedBy(2)).build(),
                    HttpResponse.BodyHandlers.ofString());
        } catch (IOException e) {
            throw new TransportException("poll failed: " + e.getMessage(), e);
        }
        if (response.statusCode() != 200) {
            throw new TransportException("poll failed: HTTP " + response.statusCode());
        }
        try {
            JsonNode events = Jsons.mapper().readTree(response.body()).path("events");
            List<Event> out = new ArrayList<>();
            for (JsonNode node : events) {
                out.add(Jsons.mapper().treeToValue(node, Event.class));
            }
            return out;
        } catch (IOException e) {
            throw new TransportException("poll returned malformed body: " + e.getMessage(), e);
        }
    }

    @Override
    public Handle start(Listener listener) {
        ScheduledExecutorService timer = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "sichter-poll-client");
            t.setDaemon(true);
            return t;
        });
        timer.scheduleWithFixedDelay(() -> {
            try {
                listener.onSnapshot(fetch());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            } catch (RuntimeException e) {
                listener.onError(e);
            }
        }, 0L, pollInterval.toMillis(), TimeUnit.MILLISECONDS);
        return timer::shutdownNow;
    }
}
