package io.sichter.collaborator;

import io.sichter.model.JobMode;

import java.util.List;
import java.util.Map;

public final class ScriptPrPublisher implements PrPublisher {
    private final ScriptInvoker invoker;
    private final String org;

    public ScriptPrPublisher(List<String> command, String org, long timeoutMs) {
        this.invoker = new ScriptInvoker("pr publisher", "prCommand", command, timeoutMs);
        this.org = org;
    }

    @Override
    public CollaboratorResult publish(List<String> repos, JobMode mode) throws InterruptedException {
        return invoker.invoke(Map.of(
                "SICHTER_REPOS", String.join(",", repos),
                "SICHTER_ORG", org,
                "SICHTER_MODE", mode.wireName()
        ));
    }
}
