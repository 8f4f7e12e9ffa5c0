package io.sichter.collaborator;

import io.sichter.error.CollaboratorException;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

final class ScriptInvoker {
    static final int MAX_OUTPUT_CHARS = 4_096;

    private final String name;
    private final String setting;
    private final List<String> command;
    private final long timeoutMs;

    ScriptInvoker(String name, String setting, List<String> command, long timeoutMs) {
        this.name = name;
        this.setting = setting;
        this.command = command == null ? List.of() : List.copyOf(command);
        this.timeoutMs = Math.max(1_000L, timeoutMs);
    }

    CollaboratorResult invoke(Map<String, String> env) throws InterruptedException {
        if (command.isEmpty()) {
            return CollaboratorResult.fail(name + " is not configured: set " + setting + " in settings");
        }
        ProcessBuilder pb = new ProcessBuilder(new ArrayList<>(command));
        pb.redirectErrorStream(true);
        pb.environment().putAll(env);
        Process process;
        try {
            process = pb.start();
        } catch (IOException e) {
            throw new CollaboratorException(name + " spawn failed: " + e.getMessage(), e);
        }
        CompletableFuture<String> output = CompletableFuture.supplyAsync(() -> readAll(process.getInputStream()));
        try {
            process.getOutputStream().close();
            boolean finished = process.waitFor(timeoutMs, TimeUnit.MILLISECONDS);
            if (!finished) {
                process.destroyForcibly();
                process.waitFor(1, TimeUnit.SECONDS);
                return CollaboratorResult.fail(name + " timeout after " + Duration.ofMillis(timeoutMs));
            }
            String combined = output.get(5, TimeUnit.SECONDS);
            if (process.exitValue() == 0) {
                return CollaboratorResult.ok(truncate(combined.strip()));
            }
            return CollaboratorResult.fail(name + " exit=" + process.exitValue(), truncate(combined.strip()));
        } catch (InterruptedException e) {
            process.destroyForcibly();
            throw e;
        } catch (IOException | ExecutionException | TimeoutException e) {
            process.destroyForcibly();
            throw new CollaboratorException(name + " execution failed: " + e.getMessage(), e);
        }
    }

    static String truncate(String raw) {
        if (raw == null) {
            return "";
        }
        if (raw.length() <= MAX_OUTPUT_CHARS) {
            return raw;
        }
        return raw.substring(raw.length() - MAX_OUTPUT_CHARS);
    }

    private static String readAll(InputStream in) {
        try (in) {
            return new String(in.readAllBytes(), StandardCharsets.UTF_8);
        } catch (IOException e) {
            return "";
        }
    }
}
