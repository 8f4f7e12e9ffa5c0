package io.sichter.worker;

import io.sichter.model.JobStatus;

public record WorkerOutcome(
        boolean processed,
        String jobId,
        JobStatus status,
        String message
) {
    public static WorkerOutcome idle() {
        return new WorkerOutcome(false, null, null, "queue empty");
    }
}
