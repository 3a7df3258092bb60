package io.sessionkeeper.observability;

import io.sessionkeeper.model.EventType;
import io.sessionkeeper.model.LogEvent;
import io.sessionkeeper.model.LogLevel;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.stream.Stream;

final class EventLogTest {

    @Test
    void everyEventAcceptedBeforeStopIsReadableAfterStop() throws Exception {
        Path root = Files.createTempDirectory("sessionkeeper-test-eventlog-");
        try {
            EventLog events = new EventLog("s-1", root.resolve("logs"), 1_000, 1_000L);
            List<String> ids = new ArrayList<>();
            for (int i = 0; i < 200; i++) {
                ids.add(events.info("step " + i, i % 2 == 0 ? "writer" : null, Map.of("i", i)));
            }
            events.stop();

            List<LogEvent> all = events.readLogs();
            Assertions.assertEquals(200, all.size());
            for (int i = 0; i < all.size(); i++) {
                Assertions.assertEquals(ids.get(i), all.get(i).id());
                Assertions.assertEquals("s-1", all.get(i).sessionId());
            }
            Assertions.assertEquals(100, events.readLogs(EventLog.LogQuery.forAgent("writer")).size());
            Assertions.assertEquals(200L, events.getStats().eventsLogged());
            Assertions.assertFalse(events.getStats().running());
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void fullQueueDropsInsteadOfBlocking() throws Exception {
        Path root = Files.createTempDirectory("sessionkeeper-test-eventlog-");
        try {
            EventLog events = new EventLog("s-1", root.resolve("logs"), 1, 1_000L);
            int total = 50_000;
            for (int i = 0; i < total; i++) {
                events.log(EventType.METRIC_RECORDED, LogLevel.METRIC, "tick");
            }
            events.stop();

            EventLog.LogStats stats = events.getStats();
            Assertions.assertTrue(stats.eventsDropped() > 0);
            Assertions.assertTrue(stats.eventsDropped() + stats.eventsLogged() <= total);
            Assertions.assertEquals(stats.eventsLogged(), events.readLogs().size());
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void eventsAfterStopAreCountedAsDropped() throws Exception {
        Path root = Files.createTempDirectory("sessionkeeper-test-eventlog-");
        try {
            EventLog events = new EventLog("s-1", root.resolve("logs"), 10, 1_000L);
            events.info("before", null, Map.of());
            events.stop();
            events.stop();
            String id = events.info("after", null, Map.of());

            Assertions.assertTrue(id.startsWith("evt_"));
            Assertions.assertEquals(1L, events.getStats().eventsDropped());
            Assertions.assertEquals(1, events.readLogs().size());
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void readLogsFlushesWithoutStoppingAndAppliesFilters() throws Exception {
        Path root = Files.createTempDirectory("sessionkeeper-test-eventlog-");
        EventLog events = new EventLog("s-1", root.resolve("logs"), 100, 5_000L);
        try {
            String started = events.agentStarted("writer", "Copywriter", "draft listing");
            events.toolCalled("writer", "search", Map.of("q", "smart hub"));
            events.agentCompleted("writer", "Copywriter", 12.5, started);
            events.error("boom", "seo", Map.of());
            events.metric("quality", 92.0, null);

            List<LogEvent> completed = events.readLogs(EventLog.LogQuery.all().withEventType("agent_completed"));
            Assertions.assertEquals(1, completed.size());
            Assertions.assertEquals(started, completed.get(0).parentEventId());
            Assertions.assertEquals(12.5, completed.get(0).durationMs().doubleValue());
            Assertions.assertEquals("Copywriter", completed.get(0).agentName());

            Assertions.assertEquals(1, events.readLogs(EventLog.LogQuery.all().withLevel("ERROR")).size());
            Assertions.assertEquals(2, events.readLogs(EventLog.LogQuery.forAgent("writer").withLimit(2)).size());
            Assertions.assertTrue(events.readLogs(EventLog.LogQuery.forAgent("nobody")).isEmpty());
            Assertions.assertTrue(events.isRunning());
        } finally {
            events.close();
            deleteRecursively(root);
        }
    }

    @Test
    void timestampsIncreaseStrictly() throws Exception {
        Path root = Files.createTempDirectory("sessionkeeper-test-eventlog-");
        try {
            EventLog events = new EventLog("s-1", root.resolve("logs"), 1_000, 1_000L);
            for (int i = 0; i < 500; i++) {
                events.debug("fast", null, null);
            }
            events.stop();
            List<LogEvent> all = events.readLogs();
            for (int i = 1; i < all.size(); i++) {
                Assertions.assertTrue(all.get(i).timestamp().isAfter(all.get(i - 1).timestamp()));
            }
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void malformedLinesAreSkipped() throws Exception {
        Path root = Files.createTempDirectory("sessionkeeper-test-eventlog-");
        try {
            Path logs = root.resolve("logs");
            EventLog events = new EventLog("s-1", logs, 10, 1_000L);
            events.info("first", null, Map.of());
            events.stop();
            Files.writeString(events.masterFile(), "{broken\n\n", StandardOpenOption.APPEND);
            EventLog more = new EventLog("s-1", logs, 10, 1_000L);
            more.info("second", null, Map.of());
            more.stop();

            List<LogEvent> all = EventLog.readLogs(logs, EventLog.LogQuery.all());
            Assertions.assertEquals(List.of("first", "second"), all.stream().map(LogEvent::message).toList());
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void invalidUtf8LineDoesNotHideTheRestOfTheFile() throws Exception {
        Path root = Files.createTempDirectory("sessionkeeper-test-eventlog-");
        try {
            Path logs = root.resolve("logs");
            EventLog events = new EventLog("s-1", logs, 10, 1_000L);
            events.info("first", null, Map.of());
            events.stop();
            Files.write(events.masterFile(), new byte[]{(byte) 0xC3, (byte) 0x28, '\n'}, StandardOpenOption.APPEND);
            EventLog more = new EventLog("s-1", logs, 10, 1_000L);
            more.info("second", null, Map.of());
            more.stop();

            List<LogEvent> all = EventLog.readLogs(logs, EventLog.LogQuery.all());
            Assertions.assertEquals(List.of("first", "second"), all.stream().map(LogEvent::message).toList());
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void sensitiveDataIsMaskedOnDisk() throws Exception {
        Path root = Files.createTempDirectory("sessionkeeper-test-eventlog-");
        try {
            EventLog events = new EventLog("s-1", root.resolve("logs"), 10, 1_000L);
            events.toolCalled("writer", "search", Map.of("api_key", "abc123", "query", "hub"));
            events.stop();

            String raw = Files.readString(events.masterFile());
            Assertions.assertFalse(raw.contains("abc123"));
            Assertions.assertTrue(raw.contains("\"query\":\"hub\""));
            Assertions.assertTrue(Files.exists(events.agentFile("writer")));
        } finally {
            deleteRecursively(root);
        }
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
