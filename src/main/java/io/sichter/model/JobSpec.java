package io.sichter.model;

import com.fasterxml.jackson.annotation.JsonProperty;

public record JobSpec(
        String type,
        String mode,
        String repo,
        @JsonProperty("auto_pr") Boolean autoPr
) {
    public static JobSpec of(JobType type, JobMode mode, String repo, boolean autoPr) {
        return new JobSpec(
                type == null ? null : type.wireName(),
                mode == null ? null : mode.wireName(),
                repo,
                autoPr
        );
    }
}
