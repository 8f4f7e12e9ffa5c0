package io.sichter.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

public enum JobType {
    SCAN_CHANGED("ScanChanged"),
    SCAN_ALL("ScanAll"),
    PR_SWEEP("PRSweep");

    private final String wireName;

    JobType(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String wireName() {
        return wireName;
    }

    @JsonCreator
    public static JobType fromString(String raw) {
        if (raw == null || raw.isBlank()) {
            throw new IllegalArgumentException("Job type is required");
        }
        String trimmed = raw.trim();
        for (JobType value : values()) {
            if (value.wireName.equalsIgnoreCase(trimmed) || value.name().equalsIgnoreCase(trimmed)) {
                return value;
            }
        }
        throw new IllegalArgumentException("Unknown job type: " + raw);
    }
}
