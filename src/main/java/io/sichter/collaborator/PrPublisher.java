package io.sichter.collaborator;

import io.sichter.model.JobMode;

import java.util.List;

public interface PrPublisher {
    CollaboratorResult publish(List<String> repos, JobMode mode) throws Exception;
}
