package io.sessionkeeper.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.JsonNode;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * A stored memory value with its ownership and access bookkeeping.
 *
 * <p>The value is a JSON tree so that every tier, including the durable one, shares one
 * serialization contract. Access counters are the only mutable state.
 */
public final class MemoryEntry {
    private final String key;
    private final JsonNode value;
    private final MemoryTier tier;
    private final String agentId;
    private final String sessionId;
    private final Instant createdAt;
    private final Set<String> tags;
    private Instant accessedAt;
    private long accessCount;

    @JsonCreator
    public MemoryEntry(
            @JsonProperty("key") String key,
            @JsonProperty("value") JsonNode value,
            @JsonProperty("tier") MemoryTier tier,
            @JsonProperty("agentId") String agentId,
            @JsonProperty("sessionId") String sessionId,
            @JsonProperty("createdAt") Instant createdAt,
            @JsonProperty("accessedAt") Instant accessedAt,
            @JsonProperty("accessCount") long accessCount,
            @JsonProperty("tags") Set<String> tags
    ) {
        this.key = key;
        this.value = value;
        this.tier = tier;
        this.agentId = agentId;
        this.sessionId = sessionId;
        this.createdAt = createdAt == null ? Instant.now() : createdAt;
        this.accessedAt = accessedAt == null ? this.createdAt : accessedAt;
        this.accessCount = Math.max(0L, accessCount);
        this.tags = tags == null ? Set.of() : Collections.unmodifiableSet(new LinkedHashSet<>(tags));
    }

    public static MemoryEntry create(String key, JsonNode value, MemoryTier tier, String agentId, String sessionId, Set<String> tags) {
        Instant now = Instant.now();
        return new MemoryEntry(key, value, tier, agentId, sessionId, now, now, 0L, tags);
    }

    /**
     * Records one read.
     */
    public synchronized void touch() {
        accessedAt = Instant.now();
        accessCount++;
    }

    @JsonProperty("key")
    public String key() {
        return key;
    }

    @JsonProperty("value")
    public JsonNode value() {
        return value;
    }

    @JsonProperty("tier")
    public MemoryTier tier() {
        return tier;
    }

    @JsonProperty("agentId")
    public String agentId() {
        return agentId;
    }

    @JsonProperty("sessionId")
    public String sessionId() {
        return sessionId;
    }

    @JsonProperty("createdAt")
    public Instant createdAt() {
        return createdAt;
    }

    @JsonProperty("accessedAt")
    public synchronized Instant accessedAt() {
        return accessedAt;
    }

    @JsonProperty("accessCount")
    public synchronized long accessCount() {
        return accessCount;
    }

    @JsonProperty("tags")
    public Set<String> tags() {
        return tags;
    }
}
