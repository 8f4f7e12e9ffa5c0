package io.sichter.collaborator;

import io.sichter.model.JobMode;

public interface CheckRunner {
    CollaboratorResult run(String repo, JobMode mode, boolean autoPr) throws Exception;
}
