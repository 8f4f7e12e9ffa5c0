package io.sichter.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record WorkerStatus(
        String activeState,
        String subState,
        @JsonProperty("mainPID") String mainPid,
        String since,
        String lastExit
) {
    public static final String UNKNOWN = "unknown";

    public static WorkerStatus unknown() {
        return new WorkerStatus(UNKNOWN, UNKNOWN, null, null, null);
    }
}
