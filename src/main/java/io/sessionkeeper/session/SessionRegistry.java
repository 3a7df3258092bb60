package io.sessionkeeper.session;

import com.fasterxml.jackson.core.type.TypeReference;
import io.sessionkeeper.config.SessionKeeperConfig;
import io.sessionkeeper.model.SessionHandle;
import io.sessionkeeper.model.SessionMetadata;
import io.sessionkeeper.model.SessionStatus;
import io.sessionkeeper.model.SessionUpdate;
import io.sessionkeeper.storage.KeyValueStore;
import io.sessionkeeper.util.Jsons;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;

/**
 * Allocates session identities and namespaces, tracks their metadata and retires them.
 *
 * <p>The index is one JSON document ({@code session_index.json}) rewritten on every mutation,
 * and each live session also carries a {@code session_manifest.json} copy of its own record. All
 * index mutations share one lock; zipping and deleting namespaces happens outside it.
 */
public final class SessionRegistry {
    private static final Logger log = LoggerFactory.getLogger(SessionRegistry.class);
    private static final TypeReference<LinkedHashMap<String, SessionMetadata>> INDEX_TYPE = new TypeReference<>() {
    };

    private final SessionKeeperConfig config;
    private final Clock clock;
    private final Object lock = new Object();
    private final LinkedHashMap<String, SessionMetadata> index;
    private final Set<String> archiving = new HashSet<>();

    public SessionRegistry(SessionKeeperConfig config) {
        this(config, Clock.systemUTC());
    }

    public SessionRegistry(SessionKeeperConfig config, Clock clock) {
        this.config = config;
        this.clock = clock;
        try {
            Files.createDirectories(config.sessionsRoot());
        } catch (IOException e) {
            throw new RuntimeException("Failed to initialize sessions root: " + config.sessionsRoot(), e);
        }
        this.index = loadIndex();
        if (config.autoCleanup()) {
            int archived = cleanupOldSessions();
            if (archived > 0) {
                log.info("Archived {} sessions older than {} days", archived, config.retentionDays());
            }
        }
    }

    public SessionKeeperConfig config() {
        return config;
    }

    /**
     * Creates the namespace ({@code logs/}, {@code memory/}, {@code results/},
     * {@code agent_outputs/}) and records the session as running.
     */
    public SessionHandle createSession(String productLabel, String workflowType) {
        String sessionId = UUID.randomUUID().toString();
        SessionHandle handle = new SessionHandle(sessionId, config.sessionDir(sessionId));
        try {
            Files.createDirectories(handle.logsDir());
            Files.createDirectories(handle.memoryDir());
            Files.createDirectories(handle.resultsDir());
            Files.createDirectories(handle.agentOutputsDir());
        } catch (IOException e) {
            throw new RuntimeException("Failed to create session namespace: " + handle.namespace(), e);
        }
        SessionMetadata metadata = SessionMetadata.started(sessionId, clock.instant(), productLabel, workflowType);
        synchronized (lock) {
            index.put(sessionId, metadata);
            writeManifest(handle, metadata);
            saveIndex();
        }
        log.debug("Created session {} for '{}'", sessionId, productLabel);
        return handle;
    }

    /**
     * Applies a partial update. Unknown and archived sessions are ignored, and the archived status
     * can only be reached through {@link #cleanupOldSessions()} or {@link #archiveSession(String)}.
     *
     * @return false when the update was not applied
     */
    public boolean updateSession(String sessionId, SessionUpdate update) {
        if (sessionId == null || update == null) {
            return false;
        }
        if (update.status() == SessionStatus.ARCHIVED) {
            log.debug("Refusing status update to archived for session {}", sessionId);
            return false;
        }
        synchronized (lock) {
            SessionMetadata current = index.get(sessionId);
            if (current == null) {
                log.debug("Ignoring update for unknown session {}", sessionId);
                return false;
            }
            if (current.status() == SessionStatus.ARCHIVED) {
                log.debug("Ignoring update for archived session {}", sessionId);
                return false;
            }
            SessionMetadata next = current.apply(update, clock.instant());
            index.put(sessionId, next);
            writeManifest(new SessionHandle(sessionId, config.sessionDir(sessionId)), next);
            saveIndex();
            return true;
        }
    }

    public Optional<SessionMetadata> getSessionMetadata(String sessionId) {
        synchronized (lock) {
            return Optional.ofNullable(index.get(sessionId));
        }
    }

    public Path getSessionDir(String sessionId) {
        return config.sessionDir(sessionId);
    }

    /**
     * Handle of a known, not yet archived session.
     */
    public Optional<SessionHandle> getSessionHandle(String sessionId) {
        synchronized (lock) {
            SessionMetadata metadata = index.get(sessionId);
            if (metadata == null || metadata.status() == SessionStatus.ARCHIVED) {
                return Optional.empty();
            }
        }
        return Optional.of(new SessionHandle(sessionId, config.sessionDir(sessionId)));
    }

    public List<SessionMetadata> listSessions() {
        return listSessions(null, null);
    }

    /**
     * Newest first.
     */
    public List<SessionMetadata> listSessions(SessionStatus statusFilter, Integer limit) {
        List<SessionMetadata> out = new ArrayList<>();
        synchronized (lock) {
            for (SessionMetadata metadata : index.values()) {
                if (statusFilter == null || metadata.status() == statusFilter) {
                    out.add(metadata);
                }
            }
        }
        out.sort(Comparator.comparing(SessionMetadata::createdAt, Comparator.nullsLast(Comparator.naturalOrder())).reversed());
        if (limit != null && limit > 0 && out.size() > limit) {
            return List.copyOf(out.subList(0, limit));
        }
        return out;
    }

    /**
     * Archives every completed or failed session created more than the retention window ago.
     * A session whose archive step fails is logged and left for the next sweep.
     *
     * @return number of sessions archived by this call
     */
    public int cleanupOldSessions() {
        Instant cutoff = clock.instant().minus(Duration.ofDays(config.retentionDays()));
        List<String> candidates = new ArrayList<>();
        synchronized (lock) {
            for (SessionMetadata metadata : index.values()) {
                if (metadata.status().isFinished()
                        && metadata.createdAt() != null
                        && metadata.createdAt().isBefore(cutoff)
                        && archiving.add(metadata.sessionId())) {
                    candidates.add(metadata.sessionId());
                }
            }
        }
        int archived = 0;
        for (String sessionId : candidates) {
            if (archiveClaimed(sessionId)) {
                archived++;
            }
        }
        return archived;
    }

    /**
     * Archives one finished session regardless of its age.
     *
     * @return false for unknown, running or already archived sessions, or when archiving fails
     */
    public boolean archiveSession(String sessionId) {
        synchronized (lock) {
            SessionMetadata metadata = index.get(sessionId);
            if (metadata == null || !metadata.status().isFinished() || !archiving.add(sessionId)) {
                return false;
            }
        }
        return archiveClaimed(sessionId);
    }

    public SessionStats getSessionStats() {
        Map<SessionStatus, Integer> counts = new EnumMap<>(SessionStatus.class);
        for (SessionStatus status : SessionStatus.values()) {
            counts.put(status, 0);
        }
        double durationSum = 0.0;
        int durationCount = 0;
        double qualitySum = 0.0;
        int qualityCount = 0;
        long totalErrors = 0;
        int total;
        synchronized (lock) {
            total = index.size();
            for (SessionMetadata metadata : index.values()) {
                counts.merge(metadata.status(), 1, Integer::sum);
                totalErrors += metadata.errorCount();
                if (metadata.durationSeconds() > 0) {
                    durationSum += metadata.durationSeconds();
                    durationCount++;
                }
                if (metadata.qualityScore() != null) {
                    qualitySum += metadata.qualityScore();
                    qualityCount++;
                }
            }
        }
        return new SessionStats(
                total,
                counts,
                durationCount == 0 ? 0.0 : durationSum / durationCount,
                qualityCount == 0 ? 0.0 : qualitySum / qualityCount,
                totalErrors
        );
    }

    private boolean archiveClaimed(String sessionId) {
        try {
            Path namespace = config.sessionDir(sessionId);
            Path target = config.archiveFile(sessionId);
            if (Files.exists(namespace) && Files.exists(target)) {
                // a previous attempt wrote the archive but could not remove every live file
                SessionArchiver.deleteRecursively(namespace);
            } else if (Files.exists(namespace)) {
                SessionArchiver.archive(namespace, target);
            } else if (!Files.exists(target)) {
                log.warn("Session {} has neither a namespace nor an archive; leaving it for the next sweep", sessionId);
                return false;
            }
            synchronized (lock) {
                SessionMetadata current = index.get(sessionId);
                if (current != null) {
                    index.put(sessionId, current.archived(clock.instant()));
                    saveIndex();
                }
            }
            log.debug("Archived session {} to {}", sessionId, target);
            return true;
        } catch (IOException | RuntimeException e) {
            log.warn("Failed to archive session {}", sessionId, e);
            return false;
        } finally {
            synchronized (lock) {
                archiving.remove(sessionId);
            }
        }
    }

    private LinkedHashMap<String, SessionMetadata> loadIndex() {
        Path file = config.sessionIndexFile();
        if (!Files.exists(file)) {
            return new LinkedHashMap<>();
        }
        try {
            LinkedHashMap<String, SessionMetadata> loaded = Jsons.mapper().readValue(file.toFile(), INDEX_TYPE);
            return loaded == null ? new LinkedHashMap<>() : loaded;
        } catch (IOException e) {
            log.warn("Could not load session index {}; starting empty", file, e);
            return new LinkedHashMap<>();
        }
    }

    private void saveIndex() {
        try {
            KeyValueStore.writeAtomically(config.sessionIndexFile(), Jsons.toJson(index));
        } catch (IOException | RuntimeException e) {
            log.warn("Failed to save session index {}", config.sessionIndexFile(), e);
        }
    }

    private void writeManifest(SessionHandle handle, SessionMetadata metadata) {
        try {
            if (Files.isDirectory(handle.namespace())) {
                Files.writeString(handle.manifestFile(), Jsons.toJson(metadata));
            }
        } catch (IOException | RuntimeException e) {
            log.warn("Failed to write manifest for session {}", handle.sessionId(), e);
        }
    }

    public record SessionStats(
            int totalSessions,
            Map<SessionStatus, Integer> countsByStatus,
            double avgDurationSeconds,
            double avgQualityScore,
            long totalErrors
    ) {
    }
}
