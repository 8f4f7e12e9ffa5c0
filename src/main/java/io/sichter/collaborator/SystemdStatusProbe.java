package io.sichter.collaborator;

import io.sichter.model.WorkerStatus;

import java.nio.charset.StandardCharsets;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.TimeUnit;

public final class SystemdStatusProbe implements WorkerStatusProbe {
    private static final long TIMEOUT_MS = 3_000L;

    private final String unit;

    public SystemdStatusProbe(String unit) {
        this.unit = unit;
    }

    @Override
    public WorkerStatus probe() throws Exception {
        Process process = new ProcessBuilder(List.of(
                "systemctl", "--user", "show", unit,
                "--property=ActiveState,SubState,MainPID,ActiveEnterTimestamp,ExecMainExitTimestamp"
        )).redirectErrorStream(true).start();
        if (!process.waitFor(TIMEOUT_MS, TimeUnit.MILLISECONDS)) {
            process.destroyForcibly();
            throw new IllegalStateException("systemctl show timed out for " + unit);
        }
        String output = new String(process.getInputStream().readAllBytes(), StandardCharsets.UTF_8);
        if (process.exitValue() != 0) {
            throw new IllegalStateException("systemctl show exit=" + process.exitValue() + ": " + output.strip());
        }
        return parse(output);
    }

    static WorkerStatus parse(String output) {
        Map<String, String> values = new HashMap<>();
        for (String line : output.split("\\R")) {
            int eq = line.indexOf('=');
            if (eq > 0) {
                values.put(line.substring(0, eq).trim(), line.substring(eq + 1).trim());
            }
        }
        String pid = blankToNull(values.get("MainPID"));
        if ("0".equals(pid)) {
            pid = null;
        }
        return new WorkerStatus(
                values.getOrDefault("ActiveState", WorkerStatus.UNKNOWN),
                values.getOrDefault("SubState", WorkerStatus.UNKNOWN),
                pid,
                blankToNull(values.get("ActiveEnterTimestamp")),
                blankToNull(values.get("ExecMainExitTimestamp"))
        );
    }

    private static String blankToNull(String raw) {
        return raw == null || raw.isBlank() ? null : raw;
    }
}
