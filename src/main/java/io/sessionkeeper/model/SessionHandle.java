package io.sessionkeeper.model;

import java.nio.file.Path;

/**
 * Identity of a live session plus the namespace directory it exclusively owns.
 */
public record SessionHandle(String sessionId, Path namespace) {
    public static final String MANIFEST_FILE = "session_manifest.json";

    public Path logsDir() {
        return namespace.resolve("logs");
    }

    public Path memoryDir() {
        return namespace.resolve("memory");
    }

    public Path resultsDir() {
        return namespace.resolve("results");
    }

    public Path agentOutputsDir() {
        return namespace.resolve("agent_outputs");
    }

    public Path manifestFile() {
        return namespace.resolve(MANIFEST_FILE);
    }
}
