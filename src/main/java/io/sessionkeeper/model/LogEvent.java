package io.sessionkeeper.model;

import com.fasterxml.jackson.databind.JsonNode;

import java.time.Instant;

/**
 * One line of a session event log. Event type and level are kept as their wire strings so that
 * lines written by other producers still read back.
 */
public record LogEvent(
        String id,
        String sessionId,
        Instant timestamp,
        String eventType,
        String level,
        String agentId,
        String agentName,
        String message,
        JsonNode data,
        Double durationMs,
        String parentEventId
) {
}
