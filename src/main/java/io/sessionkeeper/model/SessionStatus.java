package io.sessionkeeper.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

public enum SessionStatus {
    RUNNING("running"),
    COMPLETED("completed"),
    FAILED("failed"),
    ARCHIVED("archived");

    private final String wireName;

    SessionStatus(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String wireName() {
        return wireName;
    }

    public boolean isFinished() {
        return this == COMPLETED || this == FAILED;
    }

    @JsonCreator
    public static SessionStatus fromString(String raw) {
        if (raw == null || raw.isBlank()) {
            throw new IllegalArgumentException("Session status is required");
        }
        for (SessionStatus value : values()) {
            if (value.name().equalsIgnoreCase(raw.trim()) || value.wireName.equalsIgnoreCase(raw.trim())) {
                return value;
            }
        }
        throw new IllegalArgumentException("Unknown session status: " + raw);
    }
}
