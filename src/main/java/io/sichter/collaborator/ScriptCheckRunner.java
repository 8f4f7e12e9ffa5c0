package io.sichter.collaborator;

import io.sichter.model.JobMode;

import java.util.List;
import java.util.Map;

public final class ScriptCheckRunner implements CheckRunner {
    private final ScriptInvoker invoker;
    private final String org;

    public ScriptCheckRunner(List<String> command, String org, long timeoutMs) {
        this.invoker = new ScriptInvoker("check runner", "checkCommand", command, timeoutMs);
        this.org = org;
    }

    @Override
    public CollaboratorResult run(String repo, JobMode mode, boolean autoPr) throws InterruptedException {
        return invoker.invoke(Map.of(
                "SICHTER_REPO", repo,
                "SICHTER_ORG", org,
                "SICHTER_MODE", mode.wireName(),
                "SICHTER_AUTO_PR", Boolean.toString(autoPr)
        ));
    }
}
