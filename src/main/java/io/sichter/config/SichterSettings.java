package io.sichter.config;

import io.sichter.util.Jsons;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

public record SichterSettings(
        String org,
        List<String> repos,
        List<String> checkCommand,
        List<String> prCommand,
        long commandTimeoutMs,
        String workerUnit,
        String apiKey,
        int rateLimitPerMin,
        List<String> allowedOrigins
) {
    public static final String FILE_NAME = "sichter-settings.json";
    public static final String DEFAULT_ORG = "heimgewebe";
    public static final String DEFAULT_WORKER_UNIT = "sichter-worker.service";
    public static final long DEFAULT_COMMAND_TIMEOUT_MS = 15L * 60L * 1000L;
    public static final int DEFAULT_RATE_LIMIT_PER_MIN = 120;

    public SichterSettings {
        org = org == null || org.isBlank() ? DEFAULT_ORG : org.trim();
        repos = repos == null ? List.of() : List.copyOf(repos);
        checkCommand = checkCommand == null ? List.of() : List.copyOf(checkCommand);
        prCommand = prCommand == null ? List.of() : List.copyOf(prCommand);
        commandTimeoutMs = commandTimeoutMs <= 0 ? DEFAULT_COMMAND_TIMEOUT_MS : commandTimeoutMs;
        workerUnit = workerUnit == null || workerUnit.isBlank() ? DEFAULT_WORKER_UNIT : workerUnit.trim();
        apiKey = apiKey == null || apiKey.isBlank() ? null : apiKey.trim();
        rateLimitPerMin = Math.max(0, rateLimitPerMin);
        allowedOrigins = allowedOrigins == null ? List.of() : List.copyOf(allowedOrigins);
    }

    public static SichterSettings defaults() {
        return new SichterSettings(
                DEFAULT_ORG,
                List.of(),
                List.of(),
                List.of(),
                DEFAULT_COMMAND_TIMEOUT_MS,
                DEFAULT_WORKER_UNIT,
                null,
                DEFAULT_RATE_LIMIT_PER_MIN,
                List.of()
        );
    }

    public static SichterSettings load(Path file) {
        if (file == null || !Files.exists(file)) {
            return defaults();
        }
        try {
            SettingsFile raw = Jsons.mapper().readValue(file.toFile(), SettingsFile.class);
            return fromFile(raw);
        } catch (IOException e) {
            throw new IllegalStateException("Failed to read settings file: " + file, e);
        }
    }

    public SichterSettings withRepos(List<String> value) {
        return new SichterSettings(org, value, checkCommand, prCommand, commandTimeoutMs, workerUnit,
                apiKey, rateLimitPerMin, allowedOrigins);
    }

    public SichterSettings withCommands(List<String> check, List<String> pr) {
        return new SichterSettings(org, repos, check, pr, commandTimeoutMs, workerUnit,
                apiKey, rateLimitPerMin, allowedOrigins);
    }

    public SichterSettings withApiKey(String value) {
        return new SichterSettings(org, repos, checkCommand, prCommand, commandTimeoutMs, workerUnit,
                value, rateLimitPerMin, allowedOrigins);
    }

    public SichterSettings withRateLimitPerMin(int value) {
        return new SichterSettings(org, repos, checkCommand, prCommand, commandTimeoutMs, workerUnit,
                apiKey, value, allowedOrigins);
    }

    private static SichterSettings fromFile(SettingsFile raw) {
        SichterSettings defaults = defaults();
        if (raw == null) {
            return defaults;
        }
        return new SichterSettings(
                raw.org(),
                raw.repos(),
                raw.checkCommand(),
                raw.prCommand(),
                raw.commandTimeoutMs() == null ? defaults.commandTimeoutMs() : raw.commandTimeoutMs(),
                raw.workerUnit(),
                raw.apiKey(),
                raw.rateLimitPerMin() == null ? defaults.rateLimitPerMin() : raw.rateLimitPerMin(),
                raw.allowedOrigins()
        );
    }

    private record SettingsFile(
            String org,
            List<String> repos,
            List<String> checkCommand,
            List<String> prCommand,
            Long commandTimeoutMs,
            String workerUnit,
            String apiKey,
            Integer rateLimitPerMin,
            List<String> allowedOrigins
    ) {
    }
}
