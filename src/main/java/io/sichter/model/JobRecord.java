package io.sichter.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record JobRecord(
        String id,
        String type,
        String mode,
        String repo,
        @JsonProperty("auto_pr") boolean autoPr,
        String status,
        @JsonProperty("last_error") String lastError,
        String output,
        @JsonProperty("enqueued_at_ms") long enqueuedAtMs,
        @JsonProperty("started_at_ms") Long startedAtMs,
        @JsonProperty("finished_at_ms") Long finishedAtMs,
        @JsonProperty("updated_at_ms") long updatedAtMs
) {
}
