package io.sichter.config;

import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.stream.Stream;

final class SichterSettingsTest {

    @Test
    void missingFileUsesDefaults() throws Exception {
        Path root = Files.createTempDirectory("sichter-settings-default-");
        try {
            SichterConfig config = SichterConfig.fromRoot(root.toString());
            SichterSettings settings = config.settings();
            Assertions.assertEquals("heimgewebe", settings.org());
            Assertions.assertEquals(120, settings.rateLimitPerMin());
            Assertions.assertEquals("sichter-worker.service", settings.workerUnit());
            Assertions.assertNull(settings.apiKey());
            Assertions.assertTrue(settings.repos().isEmpty());
            Assertions.assertEquals(Duration.ofSeconds(2), config.tuning().idleInterval());
            Assertions.assertEquals(root.toAbsolutePath().normalize().resolve("queue"), config.queueDir());
            Assertions.assertEquals(config.eventsDir().resolve("events.jsonl"), config.eventsFile());
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void readsSettingsFileAndKeepsDefaultsForMissingFields() throws Exception {
        Path root = Files.createTempDirectory("sichter-settings-file-");
        try {
            Files.writeString(root.resolve(SichterSettings.FILE_NAME), """
                    {
                      "org": "acme",
                      "repos": ["wgx", "hausKI"],
                      "checkCommand": ["/usr/local/bin/sichter-check"],
                      "apiKey": "  secret  ",
                      "unknownField": true
                    }
                    """);
            SichterSettings settings = SichterConfig.fromRoot(root.toString()).settings();
            Assertions.assertEquals("acme", settings.org());
            Assertions.assertEquals(List.of("wgx", "hausKI"), settings.repos());
            Assertions.assertEquals(List.of("/usr/local/bin/sichter-check"), settings.checkCommand());
            Assertions.assertTrue(settings.prCommand().isEmpty());
            Assertions.assertEquals("secret", settings.apiKey());
            Assertions.assertEquals(SichterSettings.DEFAULT_RATE_LIMIT_PER_MIN, settings.rateLimitPerMin());
            Assertions.assertEquals(SichterSettings.DEFAULT_COMMAND_TIMEOUT_MS, settings.commandTimeoutMs());
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void malformedSettingsFileFailsLoudly() throws Exception {
        Path root = Files.createTempDirectory("sichter-settings-bad-");
        try {
            Files.writeString(root.resolve(SichterSettings.FILE_NAME), "{ not json");
            Assertions.assertThrows(IllegalStateException.class, () -> SichterConfig.fromRoot(root.toString()));
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void tuningClampsNonPositiveValues() {
        SichterConfig.Tuning tuning = new SichterConfig.Tuning(Duration.ZERO, Duration.ofMillis(1), null, -5, 0, 0, 0, 0);
        Assertions.assertEquals(SichterConfig.DEFAULT_IDLE_INTERVAL, tuning.idleInterval());
        Assertions.assertEquals(tuning.idleInterval(), tuning.maxIdleInterval());
        Assertions.assertEquals(0, tuning.replayDefault());
        Assertions.assertEquals(SichterConfig.DEFAULT_HEARTBEAT_SECONDS, tuning.heartbeatSeconds());
        Assertions.assertEquals(SichterConfig.DEFAULT_SUBSCRIBER_BUFFER, tuning.subscriberBuffer());
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
