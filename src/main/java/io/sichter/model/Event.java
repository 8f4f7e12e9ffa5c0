package io.sichter.model;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record Event(
        long seq,
        Instant ts,
        String kind,
        String line,
        Map<String, Object> payload
) {
    public Event {
        payload = payload == null ? null : Collections.unmodifiableMap(new LinkedHashMap<>(payload));
    }

    public String jobId() {
        Object value = payload == null ? null : payload.get("job_id");
        return value == null ? null : value.toString();
    }

    public String repo() {
        Object value = payload == null ? null : payload.get("repo");
        return value == null ? null : value.toString();
    }
}
