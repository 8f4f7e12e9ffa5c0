package io.sichter.client;

import io.sichter.model.Event;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;

/**
 * Keeps a bounded, ordered view of recent events for a UI, preferring the push stream and
 * falling back to polling while push is down.
 *
 * <p>While push is connected, polling is stopped. When push fails or closes the adapter marks
 * itself disconnected, starts polling (the first poll runs immediately) and retries push every
 * {@code pushRetryInterval}. Poll snapshots replace the buffer; pushed events are appended and
 * deduplicated by {@code seq}.
 */
public final class EventStreamAdapter implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(EventStreamAdapter.class);
    public static final int DEFAULT_MAX_EVENTS = 200;

    private final EventSource push;
    private final EventSource poll;
    private final Duration pushRetryInterval;
    private final int maxEvents;
    private final ScheduledExecutorService scheduler;

    private final ArrayDeque<Event> events = new ArrayDeque<>();
    private boolean connected;
    private String error;
    private boolean started;
    private boolean closed;
    private long pushGeneration;
    private EventSource.Handle pushHandle;
    private EventSource.Handle pollHandle;
    private ScheduledFuture<?> retry;

    public EventStreamAdapter(EventSource push, EventSource poll, Duration pushRetryInterval, int maxEvents) {
        this.push = push;
        this.poll = poll;
        this.pushRetryInterval = pushRetryInterval;
        this.maxEvents = maxEvents <= 0 ? DEFAULT_MAX_EVENTS : maxEvents;
        this.scheduler = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "sichter-stream-retry");
            t.setDaemon(true);
            return t;
        });
    }

    public synchronized void start() {
        if (started || closed) {
            return;
        }
        started = true;
        connectPush();
    }

    public synchronized StreamState observe() {
        return new StreamState(connected, new ArrayList<>(events), error);
    }

    @Override
    public synchronized void close() {
        if (closed) {
            return;
        }
        closed = true;
        connected = false;
        pushGeneration++;
        if (retry != null) {
            retry.cancel(true);
            retry = null;
        }
        closeQuietly(pushHandle);
        pushHandle = null;
        closeQuietly(pollHandle);
        pollHandle = null;
        scheduler.shutdownNow();
    }

    private void connectPush() {
        closeQuietly(pushHandle);
        pushHandle = null;
        long generation = ++pushGeneration;
        EventSource.Handle handle = push.start(new EventSource.Listener() {
            @Override
            public void onOpen() {
                pushOpened(generation);
            }

            @Override
            public void onEvent(Event event) {
                pushEvent(generation, event);
            }

            @Override
            public void onError(Exception e) {
                pushFailed(generation, e);
            }
        });
        // a source may fail synchronously inside start()
        if (generation == pushGeneration) {
            pushHandle = handle;
        } else {
            closeQuietly(handle);
        }
    }

    private synchronized void pushOpened(long generation) {
        if (closed || generation != pushGeneration) {
            return;
        }
        connected = true;
        error = null;
        if (retry != null) {
            retry.cancel(false);
            retry = null;
        }
        closeQuietly(pollHandle);
        pollHandle = null;
        log.debug("Push stream connected");
    }

    private synchronized void pushEvent(long generation, Event event) {
        if (closed || generation != pushGeneration || event == null) {
            return;
        }
        Event newest = events.peekLast();
        if (newest != null && event.seq() <= newest.seq()) {
            return;
        }
        events.addLast(event);
        while (events.size() > maxEvents) {
            events.pollFirst();
        }
    }

    private synchronized void pushFailed(long generation, Exception e) {
        if (closed || generation != pushGeneration) {
            return;
        }
        connected = false;
        error = e.getMessage();
        pushGeneration++;
        closeQuietly(pushHandle);
        pushHandle = null;
        log.debug("Push stream unavailable, polling: {}", e.getMessage());
        if (pollHandle == null) {
            pollHandle = poll.start(new EventSource.Listener() {
                @Override
                public void onSnapshot(List<Event> snapshot) {
                    pollSnapshot(snapshot);
                }

                @Override
                public void onError(Exception failure) {
                    pollFailed(failure);
                }
            });
        }
        if (retry == null) {
            retry = scheduler.schedule(this::retryPush, pushRetryInterval.toMillis(), TimeUnit.MILLISECONDS);
        }
    }

    private synchronized void retryPush() {
        retry = null;
        if (closed || connected) {
            return;
        }
        connectPush();
    }

    private synchronized void pollSnapshot(List<Event> snapshot) {
        if (closed || connected || snapshot == null) {
            return;
        }
        events.clear();
        int skip = Math.max(0, snapshot.size() - maxEvents);
        for (int i = skip; i < snapshot.size(); i++) {
            events.addLast(snapshot.get(i));
        }
    }

    private synchronized void pollFailed(Exception e) {
        if (closed || connected) {
            return;
        }
        error = e.getMessage();
    }

    private static void closeQuietly(EventSource.Handle handle) {
        if (handle != null) {
            handle.close();
        }
    }
}
