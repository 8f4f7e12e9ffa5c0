package io.sichter.model;

import java.util.List;

public record QueueSnapshot(int size, List<Job> items) {
    public QueueSnapshot {
        items = items == null ? List.of() : List.copyOf(items);
    }

    public static QueueSnapshot empty() {
        return new QueueSnapshot(0, List.of());
    }
}
