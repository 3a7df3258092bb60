package io.sessionkeeper.memory;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.sessionkeeper.config.SessionKeeperConfig;
import io.sessionkeeper.model.MemoryEntry;
import io.sessionkeeper.model.MemoryTier;
import io.sessionkeeper.storage.KeyValueStore;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Stream;

final class MemoryTierManagerTest {

    @Test
    void sessionScopedTiersAreIsolatedBetweenSessions() throws Exception {
        Path root = Files.createTempDirectory("sessionkeeper-test-memory-");
        try {
            SessionKeeperConfig config = SessionKeeperConfig.fromRoot(root);
            KeyValueStore longTerm = MemoryTierManager.openLongTermStore(config);
            CampaignCatalog catalog = CampaignCatalog.open(config);
            MemoryTierManager first = manager(config, "s-1", longTerm, catalog);
            MemoryTierManager second = manager(config, "s-2", longTerm, catalog);

            for (MemoryTier tier : List.of(MemoryTier.EPHEMERAL, MemoryTier.WORKING, MemoryTier.SHARED)) {
                Assertions.assertTrue(first.store("writer", "draft", Map.of("v", 1), tier));
                Assertions.assertTrue(first.retrieve("writer", "draft", tier).isPresent());
                Assertions.assertTrue(second.retrieve("writer", "draft", tier).isEmpty(), tier.wireName());
            }

            Assertions.assertTrue(first.store("writer", "style", "concise", MemoryTier.LONG_TERM));
            Assertions.assertEquals("concise", second.retrieve("writer", "style", MemoryTier.LONG_TERM).orElseThrow().asText());
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void privateTiersAreScopedByAgentAndSharedIsVisibleToAll() throws Exception {
        Path root = Files.createTempDirectory("sessionkeeper-test-memory-");
        try {
            SessionKeeperConfig config = SessionKeeperConfig.fromRoot(root);
            MemoryTierManager memory = manager(config, "s-1");

            memory.store("researcher", "notes", List.of("a", "b"), MemoryTier.EPHEMERAL);
            Assertions.assertTrue(memory.retrieve("copywriter", "notes", MemoryTier.EPHEMERAL).isEmpty());

            Assertions.assertTrue(memory.shareToAll("researcher", "brief", Map.of("audience", "parents")));
            Assertions.assertEquals("parents",
                    memory.retrieve("copywriter", "brief", MemoryTier.SHARED).orElseThrow().path("audience").asText());

            Assertions.assertTrue(memory.shareToAgent("researcher", "copywriter", "notes"));
            Assertions.assertEquals(2, memory.retrieve("copywriter", "notes", MemoryTier.EPHEMERAL).orElseThrow().size());
            Assertions.assertTrue(memory.shareToAgent("researcher", "seo", "notes", "research_notes"));
            Assertions.assertTrue(memory.retrieve("seo", "research_notes", MemoryTier.EPHEMERAL).isPresent());
            Assertions.assertFalse(memory.shareToAgent("researcher", "seo", "missing"));
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void retrieveReturnsCopiesAndCountsAccesses() throws Exception {
        Path root = Files.createTempDirectory("sessionkeeper-test-memory-");
        try {
            MemoryTierManager memory = manager(SessionKeeperConfig.fromRoot(root), "s-1");
            memory.store("agent", "k", Map.of("n", 1), MemoryTier.WORKING, List.of("draft"));

            JsonNode copy = memory.retrieve("agent", "k", MemoryTier.WORKING).orElseThrow();
            ((ObjectNode) copy).put("n", 99);
            Assertions.assertEquals(1, memory.retrieve("agent", "k", MemoryTier.WORKING).orElseThrow().path("n").asInt());

            MemoryEntry entry = memory.retrieveEntry("agent", "k", MemoryTier.WORKING).orElseThrow();
            Assertions.assertEquals(3L, entry.accessCount());
            Assertions.assertEquals(Set.of("draft"), entry.tags());
            Assertions.assertEquals(1, memory.retrieve("agent", "k", MemoryTier.WORKING, Map.class).orElseThrow().get("n"));
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void clearSessionMemoryKeepsSharedAndLongTerm() throws Exception {
        Path root = Files.createTempDirectory("sessionkeeper-test-memory-");
        try {
            MemoryTierManager memory = manager(SessionKeeperConfig.fromRoot(root), "s-1");
            memory.store("a", "e", 1, MemoryTier.EPHEMERAL);
            memory.store("a", "w", 2, MemoryTier.WORKING);
            memory.store("a", "s", 3, MemoryTier.SHARED);
            memory.store("a", "l", 4, MemoryTier.LONG_TERM);

            memory.clearSessionMemory();

            Assertions.assertTrue(memory.retrieve("a", "e", MemoryTier.EPHEMERAL).isEmpty());
            Assertions.assertTrue(memory.retrieve("a", "w", MemoryTier.WORKING).isEmpty());
            Assertions.assertEquals(3, memory.retrieve("a", "s", MemoryTier.SHARED).orElseThrow().asInt());
            Assertions.assertEquals(4, memory.retrieve("a", "l", MemoryTier.LONG_TERM).orElseThrow().asInt());
            Assertions.assertEquals(0, memory.getMemoryStats().ephemeralEntries());
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void clearWorkingMemoryOnlyTouchesOneAgent() throws Exception {
        Path root = Files.createTempDirectory("sessionkeeper-test-memory-");
        try {
            MemoryTierManager memory = manager(SessionKeeperConfig.fromRoot(root), "s-1");
            memory.store("a", "scratch", 1, MemoryTier.WORKING);
            memory.store("b", "scratch", 2, MemoryTier.WORKING);

            memory.clearWorkingMemory("a");

            Assertions.assertTrue(memory.retrieve("a", "scratch", MemoryTier.WORKING).isEmpty());
            Assertions.assertEquals(2, memory.retrieve("b", "scratch", MemoryTier.WORKING).orElseThrow().asInt());
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void invalidInputsAndStorageFailuresReturnFalse() throws Exception {
        Path root = Files.createTempDirectory("sessionkeeper-test-memory-");
        try {
            SessionKeeperConfig config = SessionKeeperConfig.fromRoot(root);
            MemoryTierManager memory = manager(config, "s-1");

            Assertions.assertFalse(memory.store("a", "k", null, MemoryTier.SHARED));
            Assertions.assertFalse(memory.store("a", " ", 1, MemoryTier.SHARED));
            Assertions.assertFalse(memory.store("a", "k", new Object(), MemoryTier.WORKING));

            deleteRecursively(config.longTermDir());
            Files.writeString(config.longTermDir(), "not a directory");
            Assertions.assertFalse(memory.store("a", "k", 1, MemoryTier.LONG_TERM));
            Assertions.assertTrue(memory.retrieve("a", "k", MemoryTier.LONG_TERM).isEmpty());
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void ephemeralEntriesAreMirroredIntoTheSessionNamespace() throws Exception {
        Path root = Files.createTempDirectory("sessionkeeper-test-memory-");
        try {
            SessionKeeperConfig config = SessionKeeperConfig.fromRoot(root);
            MemoryTierManager memory = manager(config, "s-1");
            memory.store("quality_validator", "score", Map.of("quality", 92), MemoryTier.EPHEMERAL);

            Path mirror = config.sessionDir("s-1").resolve("memory").resolve("quality_validator").resolve("score.json");
            Assertions.assertTrue(Files.exists(mirror));
            Assertions.assertTrue(Files.readString(mirror).contains("\"quality\""));
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void checkpointRestoresTierContents() throws Exception {
        Path root = Files.createTempDirectory("sessionkeeper-test-memory-");
        try {
            MemoryTierManager memory = manager(SessionKeeperConfig.fromRoot(root), "s-1");
            memory.store("a", "e", "before", MemoryTier.EPHEMERAL);
            memory.store("a", "s", "shared-before", MemoryTier.SHARED);
            String checkpointId = memory.createCheckpoint("stage 2").orElseThrow();
            Assertions.assertTrue(checkpointId.startsWith("stage-2_"));

            memory.store("a", "e", "after", MemoryTier.EPHEMERAL);
            memory.store("a", "w", "new", MemoryTier.WORKING);
            memory.store("a", "s", "shared-after", MemoryTier.SHARED);

            Assertions.assertTrue(memory.restoreCheckpoint(checkpointId));
            Assertions.assertEquals("before", memory.retrieve("a", "e", MemoryTier.EPHEMERAL).orElseThrow().asText());
            Assertions.assertEquals("shared-before", memory.retrieve("a", "s", MemoryTier.SHARED).orElseThrow().asText());
            Assertions.assertTrue(memory.retrieve("a", "w", MemoryTier.WORKING).isEmpty());
            Assertions.assertFalse(memory.restoreCheckpoint("nope"));
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void agentContextAndStatsReflectAllTiers() throws Exception {
        Path root = Files.createTempDirectory("sessionkeeper-test-memory-");
        try {
            MemoryTierManager memory = manager(SessionKeeperConfig.fromRoot(root), "s-1");
            memory.store("a", "e", 1, MemoryTier.EPHEMERAL);
            memory.store("a", "w", 2, MemoryTier.WORKING);
            memory.store("b", "s", 3, MemoryTier.SHARED);
            memory.store("a", "l", 4, MemoryTier.LONG_TERM);
            memory.store("b", "l", 5, MemoryTier.LONG_TERM);

            MemoryTierManager.AgentMemoryView view = memory.getAgentContext("a");
            Assertions.assertEquals(1, view.ephemeral().get("e").asInt());
            Assertions.assertEquals(2, view.working().get("w").asInt());
            Assertions.assertEquals(3, view.shared().get("s").asInt());
            Assertions.assertEquals(1, view.longTerm().size());
            Assertions.assertEquals(4, view.longTerm().get("l").asInt());

            MemoryTierManager.MemoryStats stats = memory.getMemoryStats();
            Assertions.assertEquals("s-1", stats.sessionId());
            Assertions.assertEquals(1, stats.ephemeralEntries());
            Assertions.assertEquals(1, stats.workingEntries());
            Assertions.assertEquals(1, stats.sharedEntries());
            Assertions.assertEquals(2, stats.longTermEntries());
        } finally {
            deleteRecursively(root);
        }
    }

    private static MemoryTierManager manager(SessionKeeperConfig config, String sessionId) {
        return manager(config, sessionId, MemoryTierManager.openLongTermStore(config), CampaignCatalog.open(config));
    }

    private static MemoryTierManager manager(
            SessionKeeperConfig config,
            String sessionId,
            KeyValueStore longTerm,
            CampaignCatalog catalog
    ) {
        return new MemoryTierManager(sessionId, config.sessionDir(sessionId).resolve("memory"), longTerm, catalog, 16);
    }

    private static void deleteRecursively(Path root) throws IOException {
        if (root == null || !Files.exists(root)) {
            return;
        }
        try (Stream<Path> walk = Files.walk(root)) {
            for (Path path : walk.sorted((a, b) -> Integer.compare(b.getNameCount(), a.getNameCount())).toList()) {
                Files.deleteIfExists(path);
            }
        }
    }
}
