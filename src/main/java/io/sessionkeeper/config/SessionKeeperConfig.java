package io.sessionkeeper.config;

import com.fasterxml.jackson.databind.JsonNode;
import io.sessionkeeper.util.Jsons;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;

/**
 * Storage layout and tunables for one storage root.
 *
 * <p>Values come from compiled defaults, optionally overridden by
 * {@code sessionkeeper-settings.json} at the root. Instances are immutable; the
 * {@code with*} methods return adjusted copies.
 */
public final class SessionKeeperConfig {
    private static final Logger log = LoggerFactory.getLogger(SessionKeeperConfig.class);

    public static final String SETTINGS_FILE = "sessionkeeper-settings.json";
    public static final int DEFAULT_RETENTION_DAYS = 7;
    public static final int DEFAULT_CACHE_CAPACITY = 100;
    public static final int DEFAULT_LOG_QUEUE_CAPACITY = 1_000;
    public static final long DEFAULT_FLUSH_INTERVAL_MS = 1_000L;
    public static final long DEFAULT_STREAM_POLL_INTERVAL_MS = 100L;
    public static final double DEFAULT_APPROVAL_THRESHOLD = 85.0;
    public static final int CRITICAL_RETRY_THRESHOLD = 3;

    private final Path rootDir;
    private final int retentionDays;
    private final int cacheCapacity;
    private final int logQueueCapacity;
    private final long flushIntervalMs;
    private final long streamPollIntervalMs;
    private final double approvalThreshold;
    private final boolean autoCleanup;

    public SessionKeeperConfig(
            Path rootDir,
            int retentionDays,
            int cacheCapacity,
            int logQueueCapacity,
            long flushIntervalMs,
            long streamPollIntervalMs,
            double approvalThreshold,
            boolean autoCleanup
    ) {
        this.rootDir = rootDir;
        this.retentionDays = Math.max(0, retentionDays);
        this.cacheCapacity = Math.max(1, cacheCapacity);
        this.logQueueCapacity = Math.max(1, logQueueCapacity);
        this.flushIntervalMs = Math.max(10L, flushIntervalMs);
        this.streamPollIntervalMs = Math.max(1L, streamPollIntervalMs);
        this.approvalThreshold = approvalThreshold;
        this.autoCleanup = autoCleanup;
    }

    public static SessionKeeperConfig fromRoot(String root) {
        Path resolved = root == null || root.isBlank()
                ? Paths.get("storage")
                : Paths.get(root);
        return fromRoot(resolved);
    }

    public static SessionKeeperConfig fromRoot(Path root) {
        Path base = root.toAbsolutePath().normalize();
        SessionKeeperConfig defaults = new SessionKeeperConfig(
                base,
                DEFAULT_RETENTION_DAYS,
                DEFAULT_CACHE_CAPACITY,
                DEFAULT_LOG_QUEUE_CAPACITY,
                DEFAULT_FLUSH_INTERVAL_MS,
                DEFAULT_STREAM_POLL_INTERVAL_MS,
                DEFAULT_APPROVAL_THRESHOLD,
                true
        );
        return defaults.withSettingsFile(base.resolve(SETTINGS_FILE));
    }

    private SessionKeeperConfig withSettingsFile(Path settingsFile) {
        if (!Files.isRegularFile(settingsFile)) {
            return this;
        }
        try {
            JsonNode node = Jsons.mapper().readTree(settingsFile.toFile());
            if (node == null || !node.isObject()) {
                log.warn("Ignoring settings file {}: expected a JSON object", settingsFile);
                return this;
            }
            return new SessionKeeperConfig(
                    rootDir,
                    node.path("retentionDays").asInt(retentionDays),
                    node.path("cacheCapacity").asInt(cacheCapacity),
                    node.path("logQueueCapacity").asInt(logQueueCapacity),
                    node.path("flushIntervalMs").asLong(flushIntervalMs),
                    node.path("streamPollIntervalMs").asLong(streamPollIntervalMs),
                    node.path("approvalThreshold").asDouble(approvalThreshold),
                    node.path("autoCleanup").asBoolean(autoCleanup)
            );
        } catch (IOException e) {
            log.warn("Ignoring unreadable settings file {}: {}", settingsFile, e.getMessage());
            return this;
        }
    }

    /**
     * Maps an arbitrary id onto a single safe path segment.
     */
    public static String safeSegment(String raw) {
        String normalized = raw == null || raw.isBlank() ? "_" : raw.trim();
        StringBuilder sb = new StringBuilder(normalized.length());
        for (int i = 0; i < normalized.length(); i++) {
            char ch = normalized.charAt(i);
            boolean ok = (ch >= 'a' && ch <= 'z')
                    || (ch >= 'A' && ch <= 'Z')
                    || (ch >= '0' && ch <= '9')
                    || ch == '_' || ch == '-' || ch == '.';
            sb.append(ok ? ch : '-');
        }
        String value = sb.toString();
        if (value.startsWith(".")) {
            value = "_" + value;
        }
        return value;
    }

    public SessionKeeperConfig withRetentionDays(int days) {
        return new SessionKeeperConfig(rootDir, days, cacheCapacity, logQueueCapacity,
                flushIntervalMs, streamPollIntervalMs, approvalThreshold, autoCleanup);
    }

    public SessionKeeperConfig withCacheCapacity(int capacity) {
        return new SessionKeeperConfig(rootDir, retentionDays, capacity, logQueueCapacity,
                flushIntervalMs, streamPollIntervalMs, approvalThreshold, autoCleanup);
    }

    public SessionKeeperConfig withLogQueueCapacity(int capacity) {
        return new SessionKeeperConfig(rootDir, retentionDays, cacheCapacity, capacity,
                flushIntervalMs, streamPollIntervalMs, approvalThreshold, autoCleanup);
    }

    public SessionKeeperConfig withAutoCleanup(boolean enabled) {
        return new SessionKeeperConfig(rootDir, retentionDays, cacheCapacity, logQueueCapacity,
                flushIntervalMs, streamPollIntervalMs, approvalThreshold, enabled);
    }

    public Path rootDir() {
        return rootDir;
    }

    public int retentionDays() {
        return retentionDays;
    }

    public int cacheCapacity() {
        return cacheCapacity;
    }

    public int logQueueCapacity() {
        return logQueueCapacity;
    }

    public long flushIntervalMs() {
        return flushIntervalMs;
    }

    public long streamPollIntervalMs() {
        return streamPollIntervalMs;
    }

    public double approvalThreshold() {
        return approvalThreshold;
    }

    public boolean autoCleanup() {
        return autoCleanup;
    }

    public Path sessionsRoot() {
        return rootDir.resolve("sessions");
    }

    public Path sessionIndexFile() {
        return rootDir.resolve("session_index.json");
    }

    public Path archiveRoot() {
        return rootDir.resolve("archive");
    }

    public Path memoryRoot() {
        return rootDir.resolve("memory");
    }

    public Path longTermDir() {
        return memoryRoot().resolve("longterm");
    }

    public Path templatesDir() {
        return memoryRoot().resolve("templates");
    }

    public Path sessionDir(String sessionId) {
        return sessionsRoot().resolve(safeSegment(sessionId));
    }

    public Path archiveFile(String sessionId) {
        return archiveRoot().resolve(safeSegment(sessionId) + ".zip");
    }
}
