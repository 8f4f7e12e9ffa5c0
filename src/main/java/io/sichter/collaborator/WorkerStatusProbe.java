package io.sichter.collaborator;

import io.sichter.model.WorkerStatus;

public interface WorkerStatusProbe {
    WorkerStatus probe() throws Exception;
}
