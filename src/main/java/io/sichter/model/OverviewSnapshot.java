package io.sichter.model;

import java.time.Instant;
import java.util.List;
import java.util.Map;

public record OverviewSnapshot(
        Instant timestamp,
        WorkerStatus worker,
        QueueSnapshot queue,
        List<Event> events,
        Map<String, String> errors
) {
}
