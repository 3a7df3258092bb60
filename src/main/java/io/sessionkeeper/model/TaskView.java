package io.sessionkeeper.model;

import java.time.Instant;
import java.util.List;

public record TaskView(
        String taskId,
        String name,
        TaskStatus status,
        List<String> dependsOn,
        Instant startedAt,
        Instant endedAt,
        Object result,
        String error,
        int retryCount
) {
}
