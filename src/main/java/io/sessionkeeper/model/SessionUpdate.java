package io.sessionkeeper.model;

/**
 * Partial session update; null fields are left unchanged.
 */
public record SessionUpdate(
        SessionStatus status,
        Double durationSeconds,
        Integer agentCount,
        Integer errorCount,
        Double qualityScore
) {
    public static SessionUpdate none() {
        return new SessionUpdate(null, null, null, null, null);
    }

    public static SessionUpdate ofStatus(SessionStatus status) {
        return none().withStatus(status);
    }

    public SessionUpdate withStatus(SessionStatus value) {
        return new SessionUpdate(value, durationSeconds, agentCount, errorCount, qualityScore);
    }

    public SessionUpdate withDurationSeconds(double value) {
        return new SessionUpdate(status, value, agentCount, errorCount, qualityScore);
    }

    public SessionUpdate withAgentCount(int value) {
        return new SessionUpdate(status, durationSeconds, value, errorCount, qualityScore);
    }

    public SessionUpdate withErrorCount(int value) {
        return new SessionUpdate(status, durationSeconds, agentCount, value, qualityScore);
    }

    public SessionUpdate withQualityScore(double value) {
        return new SessionUpdate(status, durationSeconds, agentCount, errorCount, value);
    }
}
