package io.sichter.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record Job(
        String id,
        JobType type,
        JobMode mode,
        String repo,
        @JsonProperty("auto_pr") boolean autoPr,
        @JsonProperty("enqueued_at") Instant enqueuedAt
) {
}
