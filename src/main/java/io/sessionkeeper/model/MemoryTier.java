package io.sessionkeeper.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Memory scopes, from narrowest to widest.
 */
public enum MemoryTier {
    /** Session-local, private to one agent. */
    EPHEMERAL("ephemeral"),
    /** Task-local scratch space, private to one agent. */
    WORKING("working"),
    /** Session-wide, last writer wins, readable by every agent. */
    SHARED("shared"),
    /** Durable across sessions, keyed by agent and key. */
    LONG_TERM("long_term");

    private final String wireName;

    MemoryTier(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String wireName() {
        return wireName;
    }

    @JsonCreator
    public static MemoryTier fromString(String raw) {
        if (raw == null || raw.isBlank()) {
            return EPHEMERAL;
        }
        for (MemoryTier value : values()) {
            if (value.name().equalsIgnoreCase(raw.trim()) || value.wireName.equalsIgnoreCase(raw.trim())) {
                return value;
            }
        }
        throw new IllegalArgumentException("Unknown memory tier: " + raw);
    }
}
