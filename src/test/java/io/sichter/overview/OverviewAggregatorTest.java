package io.sichter.overview;

import io.sichter.config.SichterConfig;
import io.sichter.events.EventLog;
import io.sichter.model.JobMode;
import io.sichter.model.JobSpec;
import io.sichter.model.JobType;
import io.sichter.model.OverviewSnapshot;
import io.sichter.model.WorkerStatus;
import io.sichter.queue.JobQueue;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.stream.Stream;

final class OverviewAggregatorTest {

    @Test
    void combinesWorkerQueueAndEvents() throws Exception {
        Path root = Files.createTempDirectory("sichter-overview-");
        try {
            SichterConfig config = SichterConfig.fromRoot(root.toString());
            JobQueue queue = new JobQueue(config);
            queue.init();
            EventLog events = new EventLog(config.eventsFile(), 100);
            queue.submit(JobSpec.of(JobType.SCAN_CHANGED, JobMode.CHANGED, "wgx", true));
            for (int i = 0; i < 4; i++) {
                events.append("job.progress", "n" + i, null);
            }
            WorkerStatus active = new WorkerStatus("active", "running", "4242", "Thu 2026-01-01 10:00:00 UTC", null);
            OverviewAggregator aggregator = new OverviewAggregator(queue, events, () -> active);

            OverviewSnapshot snapshot = aggregator.snapshot(2);

            Assertions.assertEquals(active, snapshot.worker());
            Assertions.assertEquals(1, snapshot.queue().size());
            Assertions.assertEquals("wgx", snapshot.queue().items().get(0).repo());
            Assertions.assertEquals(2, snapshot.events().size());
            Assertions.assertEquals(4L, snapshot.events().get(1).seq());
            Assertions.assertTrue(snapshot.errors().isEmpty());
            Assertions.assertNotNull(snapshot.timestamp());
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void probeFailureYieldsUnknownWorkerAndKeepsOtherParts() throws Exception {
        Path root = Files.createTempDirectory("sichter-overview-probe-");
        try {
            SichterConfig config = SichterConfig.fromRoot(root.toString());
            JobQueue queue = new JobQueue(config);
            queue.init();
            EventLog events = new EventLog(config.eventsFile(), 100);
            events.append("worker.started", "worker started", null);
            OverviewAggregator aggregator = new OverviewAggregator(queue, events, () -> {
                throw new IllegalStateException("systemctl missing");
            });

            OverviewSnapshot snapshot = aggregator.snapshot(10);

            Assertions.assertEquals(WorkerStatus.UNKNOWN, snapshot.worker().activeState());
            Assertions.assertEquals(WorkerStatus.UNKNOWN, snapshot.worker().subState());
            Assertions.assertEquals("systemctl missing", snapshot.errors().get("worker"));
            Assertions.assertEquals(1, snapshot.events().size());
            Assertions.assertEquals(0, snapshot.queue().size());
        } finally {
            deleteRecursively(root);
        }
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
