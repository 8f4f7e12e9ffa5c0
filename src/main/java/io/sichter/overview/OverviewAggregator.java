package io.sichter.overview;

import io.sichter.collaborator.WorkerStatusProbe;
import io.sichter.events.EventLog;
import io.sichter.model.Event;
import io.sichter.model.Job;
import io.sichter.model.OverviewSnapshot;
import io.sichter.model.QueueSnapshot;
import io.sichter.model.WorkerStatus;
import io.sichter.queue.JobQueue;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

public final class OverviewAggregator {
    private static final Logger log = LoggerFactory.getLogger(OverviewAggregator.class);

    private final JobQueue queue;
    private final EventLog events;
    private final WorkerStatusProbe probe;

    public OverviewAggregator(JobQueue queue, EventLog events, WorkerStatusProbe probe) {
        this.queue = queue;
        this.events = events;
        this.probe = probe;
    }

    public OverviewSnapshot snapshot(int eventLimit) {
        Map<String, String> errors = new LinkedHashMap<>();

        WorkerStatus worker;
        try {
            worker = probe == null ? WorkerStatus.unknown() : probe.probe();
            if (worker == null) {
                worker = WorkerStatus.unknown();
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            worker = WorkerStatus.unknown();
            errors.put("worker", "interrupted");
        } catch (Exception e) {
            log.debug("Worker status probe failed: {}", e.getMessage());
            worker = WorkerStatus.unknown();
            errors.put("worker", message(e));
        }

        QueueSnapshot queueSnapshot;
        try {
            List<Job> items = queue.peekAll();
            queueSnapshot = new QueueSnapshot(items.size(), items);
        } catch (RuntimeException e) {
            log.warn("Queue unreadable for overview: {}", e.getMessage());
            queueSnapshot = QueueSnapshot.empty();
            errors.put("queue", message(e));
        }

        List<Event> recent;
        try {
            recent = events.tail(Math.max(0, eventLimit));
        } catch (RuntimeException e) {
            log.warn("Event log unreadable for overview: {}", e.getMessage());
            recent = List.of();
            errors.put("events", message(e));
        }

        return new OverviewSnapshot(Instant.now(), worker, queueSnapshot, recent, errors);
    }

    private static String message(Exception e) {
        return e.getMessage() == null ? e.getClass().getSimpleName() : e.getMessage();
    }
}
