package io.sichter.config;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Duration;

public final class SichterConfig {
    public static final Duration DEFAULT_IDLE_INTERVAL = Duration.ofSeconds(2);
    public static final Duration DEFAULT_MAX_IDLE_INTERVAL = Duration.ofSeconds(10);
    public static final Duration DEFAULT_FOLLOW_INTERVAL = Duration.ofMillis(500);
    public static final int DEFAULT_REPLAY = 50;
    public static final int DEFAULT_HEARTBEAT_SECONDS = 15;
    public static final int DEFAULT_SUBSCRIBER_BUFFER = 200;
    public static final int DEFAULT_EVENT_WINDOW = 10_000;
    public static final int DEFAULT_MAX_STREAM_CLIENTS = 64;

    private final Path rootDir;
    private final SichterSettings settings;
    private final Tuning tuning;

    public SichterConfig(Path rootDir, SichterSettings settings, Tuning tuning) {
        this.rootDir = rootDir;
        this.settings = settings == null ? SichterSettings.defaults() : settings;
        this.tuning = tuning == null ? Tuning.defaults() : tuning;
    }

    public static SichterConfig fromRoot(String root) {
        Path resolved = root == null || root.isBlank()
                ? Paths.get("data")
                : Paths.get(root);
        Path base = resolved.toAbsolutePath().normalize();
        return new SichterConfig(base, SichterSettings.load(base.resolve(SichterSettings.FILE_NAME)), Tuning.defaults());
    }

    public SichterConfig withSettings(SichterSettings value) {
        return new SichterConfig(rootDir, value, tuning);
    }

    public SichterConfig withTuning(Tuning value) {
        return new SichterConfig(rootDir, settings, value);
    }

    public Path rootDir() {
        return rootDir;
    }

    public SichterSettings settings() {
        return settings;
    }

    public Tuning tuning() {
        return tuning;
    }

    public Path queueDir() {
        return rootDir.resolve("queue");
    }

    public Path processingDir() {
        return queueDir().resolve("processing");
    }

    public Path rejectedDir() {
        return queueDir().resolve("rejected");
    }

    public Path eventsDir() {
        return rootDir.resolve("events");
    }

    public Path eventsFile() {
        return eventsDir().resolve("events.jsonl");
    }

    public Path dbFile() {
        return rootDir.resolve("sichter.db");
    }

    public record Tuning(
            Duration idleInterval,
            Duration maxIdleInterval,
            Duration followInterval,
            int replayDefault,
            int heartbeatSeconds,
            int subscriberBuffer,
            int eventWindow,
            int maxStreamClients
    ) {
        public Tuning {
            idleInterval = positiveOr(idleInterval, DEFAULT_IDLE_INTERVAL);
            maxIdleInterval = positiveOr(maxIdleInterval, DEFAULT_MAX_IDLE_INTERVAL);
            if (maxIdleInterval.compareTo(idleInterval) < 0) {
                maxIdleInterval = idleInterval;
            }
            followInterval = positiveOr(followInterval, DEFAULT_FOLLOW_INTERVAL);
            replayDefault = Math.max(0, replayDefault);
            heartbeatSeconds = heartbeatSeconds <= 0 ? DEFAULT_HEARTBEAT_SECONDS : heartbeatSeconds;
            subscriberBuffer = subscriberBuffer <= 0 ? DEFAULT_SUBSCRIBER_BUFFER : subscriberBuffer;
            eventWindow = eventWindow <= 0 ? DEFAULT_EVENT_WINDOW : eventWindow;
            maxStreamClients = maxStreamClients <= 0 ? DEFAULT_MAX_STREAM_CLIENTS : maxStreamClients;
        }

        public static Tuning defaults() {
            return new Tuning(
                    DEFAULT_IDLE_INTERVAL,
                    DEFAULT_MAX_IDLE_INTERVAL,
                    DEFAULT_FOLLOW_INTERVAL,
                    DEFAULT_REPLAY,
                    DEFAULT_HEARTBEAT_SECONDS,
                    DEFAULT_SUBSCRIBER_BUFFER,
                    DEFAULT_EVENT_WINDOW,
                    DEFAULT_MAX_STREAM_CLIENTS
            );
        }

        public Tuning withIdle(Duration idle, Duration maxIdle) {
            return new Tuning(idle, maxIdle, followInterval, replayDefault, heartbeatSeconds,
                    subscriberBuffer, eventWindow, maxStreamClients);
        }

        public Tuning withFollowInterval(Duration value) {
            return new Tuning(idleInterval, maxIdleInterval, value, replayDefault, heartbeatSeconds,
                    subscriberBuffer, eventWindow, maxStreamClients);
        }

        public Tuning withStreamDefaults(int replay, int heartbeat) {
            return new Tuning(idleInterval, maxIdleInterval, followInterval, replay, heartbeat,
                    subscriberBuffer, eventWindow, maxStreamClients);
        }

        public Tuning withMaxStreamClients(int value) {
            return new Tuning(idleInterval, maxIdleInterval, followInterval, replayDefault, heartbeatSeconds,
                    subscriberBuffer, eventWindow, value);
        }

        private static Duration positiveOr(Duration value, Duration fallback) {
            return value == null || value.isZero() || value.isNegative() ? fallback : value;
        }
    }
}
