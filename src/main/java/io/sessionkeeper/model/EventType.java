package io.sessionkeeper.model;

import com.fasterxml.jackson.annotation.JsonValue;

public enum EventType {
    SESSION_STARTED("session_started"),
    SESSION_COMPLETED("session_completed"),
    AGENT_STARTED("agent_started"),
    AGENT_COMPLETED("agent_completed"),
    AGENT_ERROR("agent_error"),
    TOOL_CALLED("tool_called"),
    TOOL_COMPLETED("tool_completed"),
    MEMORY_STORED("memory_stored"),
    MEMORY_RETRIEVED("memory_retrieved"),
    WORKFLOW_STAGE("workflow_stage"),
    VALIDATION_RESULT("validation_result"),
    METRIC_RECORDED("metric_recorded");

    private final String wireName;

    EventType(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String wireName() {
        return wireName;
    }
}
