package io.sessionkeeper.model;

import java.time.Instant;

/**
 * Index and manifest record of one session. Immutable; updates produce a new instance.
 */
public record SessionMetadata(
        String sessionId,
        Instant createdAt,
        SessionStatus status,
        String productLabel,
        String workflowType,
        double durationSeconds,
        int agentCount,
        int errorCount,
        Double qualityScore,
        Instant completedAt,
        Instant archivedAt
) {
    public static SessionMetadata started(String sessionId, Instant createdAt, String productLabel, String workflowType) {
        return new SessionMetadata(
                sessionId,
                createdAt,
                SessionStatus.RUNNING,
                productLabel,
                workflowType,
                0.0,
                0,
                0,
                null,
                null,
                null
        );
    }

    public SessionMetadata apply(SessionUpdate update, Instant now) {
        SessionStatus nextStatus = update.status() == null ? status : update.status();
        Instant nextCompletedAt = completedAt;
        if (update.status() != null && update.status().isFinished()) {
            nextCompletedAt = now;
        }
        return new SessionMetadata(
                sessionId,
                createdAt,
                nextStatus,
                productLabel,
                workflowType,
                update.durationSeconds() == null ? durationSeconds : update.durationSeconds(),
                update.agentCount() == null ? agentCount : update.agentCount(),
                update.errorCount() == null ? errorCount : update.errorCount(),
                update.qualityScore() == null ? qualityScore : update.qualityScore(),
                nextCompletedAt,
                archivedAt
        );
    }

    public SessionMetadata archived(Instant now) {
        return new SessionMetadata(
                sessionId,
                createdAt,
                SessionStatus.ARCHIVED,
                productLabel,
                workflowType,
                durationSeconds,
                agentCount,
                errorCount,
                qualityScore,
                completedAt,
                now
        );
    }
}
