package io.sichter.worker;

import java.time.Instant;

public record WorkerState(
        boolean running,
        Instant since,
        String lastExit,
        long pid,
        String currentJobId
) {
}
