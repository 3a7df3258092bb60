package io.sessionkeeper.memory;

import com.fasterxml.jackson.databind.JsonNode;
import io.sessionkeeper.config.SessionKeeperConfig;
import io.sessionkeeper.model.MemoryEntry;
import io.sessionkeeper.model.MemoryTier;
import io.sessionkeeper.storage.KeyValueStore;
import io.sessionkeeper.storage.LruCache;
import io.sessionkeeper.util.Hashing;
import io.sessionkeeper.util.Jsons;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.time.ZoneId;
import java.time.format.DateTimeFormatter;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Four memory tiers for the agents of one session, fronted by an LRU cache.
 *
 * <p>Ephemeral, working and shared entries live in process and die with the session. Long-term
 * entries are written through to a {@link KeyValueStore} shared by every session of the storage
 * root, keyed by {@code agentId:key}. Values must be representable as JSON.
 *
 * <p>Store and retrieve never throw: a failure is logged and reported as {@code false} or an
 * empty result so that a missing memory only costs the agent a recomputation.
 */
public final class MemoryTierManager {
    private static final Logger log = LoggerFactory.getLogger(MemoryTierManager.class);
    public static final String LONG_TERM_INDEX_NAME = "memory_index";
    private static final String SHARED_SCOPE = "*";
    private static final DateTimeFormatter CHECKPOINT_STAMP =
            DateTimeFormatter.ofPattern("yyyyMMdd_HHmmss_SSS").withZone(ZoneId.systemDefault());

    private final String sessionId;
    private final Path sessionMemoryDir;
    private final KeyValueStore longTermStore;
    private final CampaignCatalog catalog;
    private final LruCache<String, MemoryEntry> cache;
    private final ScopedTier ephemeral;
    private final ScopedTier working;
    private final ScopedTier shared;

    public MemoryTierManager(
            String sessionId,
            Path sessionMemoryDir,
            KeyValueStore longTermStore,
            CampaignCatalog catalog,
            int cacheCapacity
    ) {
        this.sessionId = sessionId;
        this.sessionMemoryDir = sessionMemoryDir;
        this.longTermStore = longTermStore;
        this.catalog = catalog;
        this.cache = new LruCache<>(cacheCapacity);
        this.ephemeral = new ScopedTier();
        this.working = new ScopedTier();
        this.shared = new ScopedTier();
    }

    public static KeyValueStore openLongTermStore(SessionKeeperConfig config) {
        return new KeyValueStore(config.longTermDir(), LONG_TERM_INDEX_NAME, MemoryTierManager::longTermFileName);
    }

    static String longTermFileName(String memoryKey) {
        return Hashing.md5Hex(memoryKey);
    }

    public String sessionId() {
        return sessionId;
    }

    public boolean store(String agentId, String key, Object value, MemoryTier tier) {
        return store(agentId, key, value, tier, List.of());
    }

    public boolean store(String agentId, String key, Object value, MemoryTier tier, Collection<String> tags) {
        if (isBlank(agentId) || isBlank(key) || tier == null || value == null) {
            log.debug("Rejected memory store agent={} key={} tier={}: missing argument", agentId, key, tier);
            return false;
        }
        try {
            JsonNode tree = Jsons.mapper().valueToTree(value);
            MemoryEntry entry = MemoryEntry.create(key, tree, tier, agentId, sessionId, tags == null ? Set.of() : Set.copyOf(tags));
            switch (tier) {
                case EPHEMERAL -> {
                    mirrorToSession(entry);
                    ephemeral.put(agentId, key, entry);
                }
                case WORKING -> working.put(agentId, key, entry);
                case SHARED -> shared.put(SHARED_SCOPE, key, entry);
                case LONG_TERM -> longTermStore.put(longTermKey(agentId, key), Jsons.mapper().valueToTree(entry));
            }
            cache.put(cacheKey(agentId, key, tier), entry);
            return true;
        } catch (IOException | RuntimeException e) {
            log.warn("Failed to store memory {}/{} in tier {} for session {}", agentId, key, tier.wireName(), sessionId, e);
            return false;
        }
    }

    public Optional<JsonNode> retrieve(String agentId, String key, MemoryTier tier) {
        return retrieveEntry(agentId, key, tier).map(entry -> entry.value().deepCopy());
    }

    public <T> Optional<T> retrieve(String agentId, String key, MemoryTier tier, Class<T> type) {
        Optional<JsonNode> value = retrieve(agentId, key, tier);
        if (value.isEmpty()) {
            return Optional.empty();
        }
        try {
            return Optional.ofNullable(Jsons.mapper().treeToValue(value.get(), type));
        } catch (IOException | RuntimeException e) {
            log.warn("Memory {}/{} in tier {} is not a {}", agentId, key, tier.wireName(), type.getSimpleName(), e);
            return Optional.empty();
        }
    }

    /**
     * Entry lookup including access bookkeeping; exposed for inspection tools.
     */
    public Optional<MemoryEntry> retrieveEntry(String agentId, String key, MemoryTier tier) {
        if (isBlank(agentId) || isBlank(key) || tier == null) {
            return Optional.empty();
        }
        String cacheKey = cacheKey(agentId, key, tier);
        try {
            Optional<MemoryEntry> cached = cache.get(cacheKey);
            if (cached.isPresent()) {
                cached.get().touch();
                return cached;
            }
            MemoryEntry entry = switch (tier) {
                case EPHEMERAL -> ephemeral.get(agentId, key);
                case WORKING -> working.get(agentId, key);
                case SHARED -> shared.get(SHARED_SCOPE, key);
                case LONG_TERM -> loadLongTerm(agentId, key);
            };
            if (entry == null) {
                return Optional.empty();
            }
            entry.touch();
            cache.put(cacheKey, entry);
            return Optional.of(entry);
        } catch (IOException | RuntimeException e) {
            log.warn("Failed to retrieve memory {}/{} from tier {} for session {}", agentId, key, tier.wireName(), sessionId, e);
            return Optional.empty();
        }
    }

    /**
     * Copies an ephemeral entry of one agent into the ephemeral tier of another.
     */
    public boolean shareToAgent(String fromAgent, String toAgent, String key) {
        return shareToAgent(fromAgent, toAgent, key, key);
    }

    public boolean shareToAgent(String fromAgent, String toAgent, String key, String targetKey) {
        Optional<MemoryEntry> source = retrieveEntry(fromAgent, key, MemoryTier.EPHEMERAL);
        if (source.isEmpty()) {
            return false;
        }
        return store(toAgent, targetKey, source.get().value().deepCopy(), MemoryTier.EPHEMERAL, source.get().tags());
    }

    public boolean shareToAll(String fromAgent, String key, Object value) {
        return store(fromAgent, key, value, MemoryTier.SHARED);
    }

    /**
     * Drops ephemeral and working memory and empties the cache. Called once at session teardown.
     */
    public void clearSessionMemory() {
        ephemeral.clear();
        working.clear();
        cache.clear();
    }

    public void clearWorkingMemory(String agentId) {
        working.clearScope(agentId);
        String prefix = agentId + ":" + MemoryTier.WORKING.wireName() + ":";
        cache.removeIf(k -> k.startsWith(prefix));
    }

    public AgentMemoryView getAgentContext(String agentId) {
        Map<String, JsonNode> longTerm = new LinkedHashMap<>();
        String prefix = agentId + ":";
        for (String memoryKey : longTermStore.keys()) {
            if (!memoryKey.startsWith(prefix)) {
                continue;
            }
            String key = memoryKey.substring(prefix.length());
            try {
                MemoryEntry entry = loadLongTerm(agentId, key);
                if (entry != null) {
                    longTerm.put(key, entry.value().deepCopy());
                }
            } catch (IOException | RuntimeException e) {
                log.warn("Skipping unreadable long-term memory {}", memoryKey, e);
            }
        }
        return new AgentMemoryView(
                values(ephemeral.scope(agentId)),
                values(working.scope(agentId)),
                values(shared.scope(SHARED_SCOPE)),
                longTerm
        );
    }

    public Optional<String> createCheckpoint(String name) {
        String checkpointId = SessionKeeperConfig.safeSegment(name) + "_" + CHECKPOINT_STAMP.format(Instant.now());
        MemoryCheckpoint checkpoint = new MemoryCheckpoint(
                checkpointId,
                Instant.now(),
                sessionId,
                ephemeral.snapshot(),
                working.snapshot(),
                shared.scope(SHARED_SCOPE)
        );
        try {
            Files.createDirectories(sessionMemoryDir);
            Files.writeString(checkpointFile(checkpointId), Jsons.toJson(checkpoint));
            return Optional.of(checkpointId);
        } catch (IOException | RuntimeException e) {
            log.warn("Failed to write memory checkpoint {} for session {}", checkpointId, sessionId, e);
            return Optional.empty();
        }
    }

    public boolean restoreCheckpoint(String checkpointId) {
        Path file = checkpointFile(checkpointId);
        if (!Files.exists(file)) {
            return false;
        }
        try {
            MemoryCheckpoint checkpoint = Jsons.mapper().readValue(file.toFile(), MemoryCheckpoint.class);
            ephemeral.replace(checkpoint.ephemeral());
            working.replace(checkpoint.working());
            Map<String, Map<String, MemoryEntry>> sharedScopes = new LinkedHashMap<>();
            sharedScopes.put(SHARED_SCOPE, checkpoint.shared() == null ? Map.of() : checkpoint.shared());
            shared.replace(sharedScopes);
            cache.clear();
            return true;
        } catch (IOException | RuntimeException e) {
            log.warn("Failed to restore memory checkpoint {} for session {}", checkpointId, sessionId, e);
            return false;
        }
    }

    public Optional<String> saveCampaignTemplate(CampaignCatalog.Draft draft) {
        return catalog.save(sessionId, draft);
    }

    public List<CampaignCatalog.Match> findSimilarCampaigns(CampaignCatalog.Query query) {
        return catalog.findSimilar(query);
    }

    public Optional<CampaignCatalog.Suggestion> getLearningSuggestions(CampaignCatalog.ProductDescriptor product) {
        return catalog.suggest(product);
    }

    public MemoryStats getMemoryStats() {
        return new MemoryStats(
                sessionId,
                ephemeral.size(),
                working.size(),
                shared.size(),
                longTermStore.size(),
                catalog.size(),
                cache.size()
        );
    }

    private MemoryEntry loadLongTerm(String agentId, String key) throws IOException {
        Optional<JsonNode> node = longTermStore.get(longTermKey(agentId, key));
        if (node.isEmpty()) {
            return null;
        }
        return Jsons.mapper().treeToValue(node.get(), MemoryEntry.class);
    }

    private void mirrorToSession(MemoryEntry entry) throws IOException {
        Path agentDir = sessionMemoryDir.resolve(SessionKeeperConfig.safeSegment(entry.agentId()));
        Files.createDirectories(agentDir);
        Files.writeString(agentDir.resolve(SessionKeeperConfig.safeSegment(entry.key()) + ".json"), Jsons.toJson(entry));
    }

    private Path checkpointFile(String checkpointId) {
        return sessionMemoryDir.resolve("checkpoint_" + SessionKeeperConfig.safeSegment(checkpointId) + ".json");
    }

    private static String longTermKey(String agentId, String key) {
        return agentId + ":" + key;
    }

    private static String cacheKey(String agentId, String key, MemoryTier tier) {
        if (tier == MemoryTier.SHARED) {
            return SHARED_SCOPE + ":" + tier.wireName() + ":" + key;
        }
        return agentId + ":" + tier.wireName() + ":" + key;
    }

    private static Map<String, JsonNode> values(Map<String, MemoryEntry> entries) {
        Map<String, JsonNode> out = new LinkedHashMap<>();
        entries.forEach((key, entry) -> out.put(key, entry.value().deepCopy()));
        return out;
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }

    /**
     * Entries grouped by owning scope (agent id, or one pseudo-scope for the shared tier), guarded
     * by the tier's own monitor.
     */
    private static final class ScopedTier {
        private final Map<String, Map<String, MemoryEntry>> scopes = new LinkedHashMap<>();

        synchronized void put(String scope, String key, MemoryEntry entry) {
            scopes.computeIfAbsent(scope, ignored -> new LinkedHashMap<>()).put(key, entry);
        }

        synchronized MemoryEntry get(String scope, String key) {
            Map<String, MemoryEntry> entries = scopes.get(scope);
            return entries == null ? null : entries.get(key);
        }

        synchronized Map<String, MemoryEntry> scope(String scope) {
            Map<String, MemoryEntry> entries = scopes.get(scope);
            return entries == null ? Map.of() : new LinkedHashMap<>(entries);
        }

        synchronized void clearScope(String scope) {
            scopes.remove(scope);
        }

        synchronized void clear() {
            scopes.clear();
        }

        synchronized Map<String, Map<String, MemoryEntry>> snapshot() {
            Map<String, Map<String, MemoryEntry>> out = new LinkedHashMap<>();
            scopes.forEach((scope, entries) -> out.put(scope, new LinkedHashMap<>(entries)));
            return out;
        }

        synchronized void replace(Map<String, Map<String, MemoryEntry>> restored) {
            scopes.clear();
            if (restored != null) {
                restored.forEach((scope, entries) -> scopes.put(scope, new LinkedHashMap<>(entries)));
            }
        }

        synchronized int size() {
            int total = 0;
            for (Map<String, MemoryEntry> entries : scopes.values()) {
                total += entries.size();
            }
            return total;
        }
    }

    public record AgentMemoryView(
            Map<String, JsonNode> ephemeral,
            Map<String, JsonNode> working,
            Map<String, JsonNode> shared,
            Map<String, JsonNode> longTerm
    ) {
    }

    public record MemoryStats(
            String sessionId,
            int ephemeralEntries,
            int workingEntries,
            int sharedEntries,
            int longTermEntries,
            int campaignTemplates,
            int cacheSize
    ) {
    }

    public record MemoryCheckpoint(
            String checkpointId,
            Instant timestamp,
            String sessionId,
            Map<String, Map<String, MemoryEntry>> ephemeral,
            Map<String, Map<String, MemoryEntry>> working,
            Map<String, MemoryEntry> shared
    ) {
    }
}
