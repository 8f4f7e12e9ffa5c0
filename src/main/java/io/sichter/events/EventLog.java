package io.sichter.events;

import io.sichter.error.StorageException;
import io.sichter.model.Event;
import io.sichter.util.Jsons;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.channels.SeekableByteChannel;
import java.nio.charset.StandardCharsets;
import java.nio.file.FileAlreadyExistsException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Append-only JSONL event log with an in-memory window of the newest records.
 *
 * <p>One writer appends; any number of readers call {@link #tail(int)}, {@link #readAfter(long, int)}
 * or {@link #subscribe(int, int)}. All of them go through one lock, so a reader sees either the
 * full prior record or the full new one. Records written by another process are picked up by
 * {@link #sync()}, which only consumes complete lines.
 */
public final class EventLog {
    private static final Logger log = LoggerFactory.getLogger(EventLog.class);
    private static final int READ_CHUNK = 64 * 1024;

    private final Path file;
    private final int window;
    private final Object lock = new Object();
    private final ArrayDeque<Event> recent;
    private final List<EventSubscription> subscribers = new CopyOnWriteArrayList<>();
    private long lastSeq;
    private long readOffset;
    private byte[] pending = new byte[0];

    public EventLog(Path file, int window) {
        this.file = file;
        this.window = Math.max(1, window);
        this.recent = new ArrayDeque<>(Math.min(this.window, 1024));
        try {
            Files.createDirectories(file.getParent());
            if (!Files.exists(file)) {
                try {
                    Files.createFile(file);
                } catch (FileAlreadyExistsException ignored) {
                    // Another process created it between exists() and createFile().
                }
            }
        } catch (IOException e) {
            throw new StorageException("Failed to initialize event log: " + file, e);
        }
        synchronized (lock) {
            readNewLines(false);
        }
    }

    public Path file() {
        return file;
    }

    public Event append(String kind, String line, Map<String, Object> payload) {
        if (kind == null || kind.isBlank()) {
            throw new IllegalArgumentException("event kind is required");
        }
        synchronized (lock) {
            readNewLines(true);
            Event event = new Event(lastSeq + 1L, Instant.now(), kind, line, payload);
            byte[] bytes = (Jsons.toCompactJson(event) + "\n").getBytes(StandardCharsets.UTF_8);
            try {
                Files.write(file, bytes, StandardOpenOption.CREATE, StandardOpenOption.APPEND, StandardOpenOption.WRITE);
            } catch (IOException e) {
                throw new StorageException("Failed to append event to " + file, e);
            }
            readOffset += bytes.length;
            accept(event, true);
            return event;
        }
    }

    public List<Event> tail(int n) {
        synchronized (lock) {
            return tailLocked(n);
        }
    }

    public List<Event> readAfter(long afterSeq, int limit) {
        int max = Math.max(0, limit);
        List<Event> out = new ArrayList<>();
        if (max == 0) {
            return out;
        }
        synchronized (lock) {
            for (Event event : recent) {
                if (event.seq() > afterSeq) {
                    out.add(event);
                    if (out.size() >= max) {
                        break;
                    }
                }
            }
        }
        return out;
    }

    /**
     * Registers a live reader. The replay snapshot and the registration happen under the append
     * lock, so the first live event delivered is exactly the next one appended.
     */
    public EventSubscription subscribe(int replay, int capacity) {
        synchronized (lock) {
            EventSubscription subscription = new EventSubscription(this, tailLocked(replay), lastSeq, capacity);
            subscribers.add(subscription);
            return subscription;
        }
    }

    public EventSubscription resumeAfter(long afterSeq, int maxReplay, int capacity) {
        synchronized (lock) {
            List<Event> missed = new ArrayList<>();
            for (Event event : recent) {
                if (event.seq() > afterSeq) {
                    missed.add(event);
                }
            }
            if (missed.size() > maxReplay) {
                missed = missed.subList(missed.size() - Math.max(0, maxReplay), missed.size());
            }
            EventSubscription subscription = new EventSubscription(this, missed, lastSeq, capacity);
            subscribers.add(subscription);
            return subscription;
        }
    }

    public int sync() {
        synchronized (lock) {
            return readNewLines(true);
        }
    }

    public long lastSeq() {
        synchronized (lock) {
            return lastSeq;
        }
    }

    public int subscriberCount() {
        return subscribers.size();
    }

    void unsubscribe(EventSubscription subscription) {
        subscribers.remove(subscription);
    }

    private List<Event> tailLocked(int n) {
        int count = Math.min(Math.max(0, n), recent.size());
        List<Event> out = new ArrayList<>(count);
        if (count == 0) {
            return out;
        }
        Iterator<Event> it = recent.descendingIterator();
        for (int i = 0; i < count && it.hasNext(); i++) {
            out.add(it.next());
        }
        Collections.reverse(out);
        return out;
    }

    private void accept(Event event, boolean publish) {
        if (recent.size() >= window) {
            recent.pollFirst();
        }
        recent.addLast(event);
        lastSeq = event.seq();
        if (publish) {
            for (EventSubscription subscription : subscribers) {
                subscription.offer(event);
            }
        }
    }

    private int readNewLines(boolean publish) {
        long size;
        try {
            size = Files.size(file);
        } catch (IOException e) {
            throw new StorageException("Failed to stat event log: " + file, e);
        }
        if (size < readOffset) {
            log.warn("Event log {} shrank from {} to {} bytes; rereading from start", file, readOffset, size);
            readOffset = 0L;
            pending = new byte[0];
        }
        if (size == readOffset) {
            return 0;
        }
        int found = 0;
        try (SeekableByteChannel channel = Files.newByteChannel(file, StandardOpenOption.READ)) {
            channel.position(readOffset);
            ByteBuffer buffer = ByteBuffer.allocate(READ_CHUNK);
            int read;
            while ((read = channel.read(buffer)) > 0) {
                buffer.flip();
                byte[] chunk = new byte[pending.length + read];
                System.arraycopy(pending, 0, chunk, 0, pending.length);
                buffer.get(chunk, pending.length, read);
                buffer.clear();
                readOffset += read;
                int start = 0;
                for (int i = 0; i < chunk.length; i++) {
                    if (chunk[i] == '\n') {
                        if (parseLine(new String(chunk, start, i - start, StandardCharsets.UTF_8), publish)) {
                            found++;
                        }
                        start = i + 1;
                    }
                }
                pending = Arrays.copyOfRange(chunk, start, chunk.length);
            }
        } catch (IOException e) {
            throw new StorageException("Failed to read event log: " + file, e);
        }
        return found;
    }

    private boolean parseLine(String raw, boolean publish) {
        String line = raw.strip();
        if (line.isEmpty()) {
            return false;
        }
        try {
            Event event = Jsons.mapper().readValue(line, Event.class);
            if (event == null || event.kind() == null || event.seq() <= lastSeq) {
                return false;
            }
            accept(event, publish);
            return true;
        } catch (IOException e) {
            log.warn("Skipping malformed event line in {}: {}", file, e.getMessage());
            return false;
        }
    }
}
