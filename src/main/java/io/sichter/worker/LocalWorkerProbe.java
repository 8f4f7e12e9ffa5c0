package io.sichter.worker;

import io.sichter.collaborator.WorkerStatusProbe;
import io.sichter.model.WorkerStatus;

public final class LocalWorkerProbe implements WorkerStatusProbe {
    private final WorkerLoop worker;

    public LocalWorkerProbe(WorkerLoop worker) {
        this.worker = worker;
    }

    @Override
    public WorkerStatus probe() {
        WorkerState state = worker.state();
        String active = state.running() ? "active" : "inactive";
        String sub;
        if (!state.running()) {
            sub = "dead";
        } else if (state.currentJobId() != null) {
            sub = "running";
        } else {
            sub = "waiting";
        }
        return new WorkerStatus(
                active,
                sub,
                state.running() ? Long.toString(state.pid()) : null,
                state.since() == null ? null : state.since().toString(),
                state.lastExit()
        );
    }
}
