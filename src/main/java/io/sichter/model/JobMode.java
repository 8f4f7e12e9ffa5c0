package io.sichter.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

public enum JobMode {
    CHANGED("changed"),
    ALL("all");

    private final String wireName;

    JobMode(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String wireName() {
        return wireName;
    }

    @JsonCreator
    public static JobMode fromString(String raw) {
        if (raw == null || raw.isBlank()) {
            throw new IllegalArgumentException("Job mode is required");
        }
        String trimmed = raw.trim();
        for (JobMode value : values()) {
            if (value.wireName.equalsIgnoreCase(trimmed)) {
                return value;
            }
        }
        throw new IllegalArgumentException("Unknown job mode: " + raw);
    }
}
