package io.sessionkeeper.cli;

import com.fasterxml.jackson.databind.JsonNode;
import io.sessionkeeper.config.SessionKeeperConfig;
import io.sessionkeeper.memory.CampaignCatalog;
import io.sessionkeeper.model.SessionStatus;
import io.sessionkeeper.model.SessionUpdate;
import io.sessionkeeper.runtime.SessionKeeper;
import io.sessionkeeper.runtime.SessionWorkspace;
import io.sessionkeeper.util.Jsons;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;
import picocli.CommandLine;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.stream.Stream;

final class SessionKeeperCommandTest {

    @Test
    void sessionsAndSessionPrintIndexRecords() throws Exception {
        Path root = Files.createTempDirectory("sessionkeeper-test-cli-");
        try {
            SessionKeeper keeper = new SessionKeeper(config(root));
            SessionWorkspace workspace = keeper.startSession("Air Fryer", "amazon_campaign");
            workspace.finish(SessionUpdate.ofStatus(SessionStatus.COMPLETED).withQualityScore(88.0));

            Result list = run(root, "sessions", "--status", "completed");
            Assertions.assertEquals(0, list.exitCode());
            JsonNode rows = Jsons.mapper().readTree(list.out());
            Assertions.assertEquals(1, rows.size());
            Assertions.assertEquals(workspace.sessionId(), rows.get(0).path("sessionId").asText());

            Result one = run(root, "session", workspace.sessionId());
            Assertions.assertEquals(0, one.exitCode());
            Assertions.assertEquals("completed", Jsons.mapper().readTree(one.out()).path("status").asText());

            Result missing = run(root, "session", "nope");
            Assertions.assertEquals(1, missing.exitCode());
            Assertions.assertEquals("session not found", Jsons.mapper().readTree(missing.out()).path("error").asText());
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void archiveRefusesRunningSessions() throws Exception {
        Path root = Files.createTempDirectory("sessionkeeper-test-cli-");
        try {
            SessionKeeper keeper = new SessionKeeper(config(root));
            SessionWorkspace running = keeper.startSession("Blender", "amazon_campaign");
            SessionWorkspace done = keeper.startSession("Toaster", "amazon_campaign");
            done.finish(SessionUpdate.ofStatus(SessionStatus.FAILED));
            try {
                Assertions.assertEquals(1, run(root, "archive", running.sessionId()).exitCode());
                Result archived = run(root, "archive", done.sessionId());
                Assertions.assertEquals(0, archived.exitCode());
                Assertions.assertTrue(Jsons.mapper().readTree(archived.out()).path("archived").asBoolean());
                Assertions.assertTrue(Files.exists(config(root).archiveFile(done.sessionId())));

                Result stats = run(root, "stats");
                JsonNode body = Jsons.mapper().readTree(stats.out());
                Assertions.assertEquals(2, body.path("totalSessions").asInt());
                Assertions.assertEquals(0, body.path("totalErrors").asLong());
            } finally {
                running.close();
            }
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void tailAndLogsReadTheEventLog() throws Exception {
        Path root = Files.createTempDirectory("sessionkeeper-test-cli-");
        try {
            SessionKeeper keeper = new SessionKeeper(config(root));
            SessionWorkspace workspace = keeper.startSession("Headphones", "amazon_campaign");
            workspace.events().agentStarted("research", "Researcher", "scan competitors");
            workspace.events().agentCompleted("research", "Researcher", 1250.0, null);
            workspace.close();

            Result tail = run(root, "tail", workspace.sessionId());
            Assertions.assertEquals(0, tail.exitCode());
            Assertions.assertEquals(3, tail.out().split("event: log_event", -1).length - 1);

            Result agentTail = run(root, "tail", workspace.sessionId(), "--agent", "research", "--type", "agent_completed");
            Assertions.assertEquals(1, agentTail.out().split("event: log_event", -1).length - 1);

            Result logs = run(root, "logs", workspace.sessionId(), "--level", "INFO", "--limit", "2");
            Assertions.assertEquals(2, Jsons.mapper().readTree(logs.out()).size());

            Result summary = run(root, "log-summary", workspace.sessionId());
            Assertions.assertEquals(3, Jsons.mapper().readTree(summary.out()).path("totalEvents").asInt());

            Assertions.assertEquals(1, run(root, "tail", "nope").exitCode());
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void campaignsSearchesSavedTemplates() throws Exception {
        Path root = Files.createTempDirectory("sessionkeeper-test-cli-");
        try {
            CampaignCatalog catalog = CampaignCatalog.open(config(root));
            catalog.save("s-1", new CampaignCatalog.Draft(
                    "Robot Vacuum", "Home Appliances", 90.0, "busy parents",
                    List.of("robot", "vacuum", "app"), null, null, List.of()));

            Result hit = run(root, "campaigns", "--category", "home appliances", "--keyword", "robot", "--min-quality", "85");
            JsonNode matches = Jsons.mapper().readTree(hit.out());
            Assertions.assertEquals(1, matches.size());
            Assertions.assertEquals("Robot Vacuum", matches.get(0).path("template").path("label").asText());

            Result miss = run(root, "campaigns", "--category", "Garden", "--min-quality", "85");
            Assertions.assertEquals(0, Jsons.mapper().readTree(miss.out()).size());
        } finally {
            deleteRecursively(root);
        }
    }

    private static SessionKeeperConfig config(Path root) {
        return SessionKeeperConfig.fromRoot(root).withAutoCleanup(false);
    }

    private static Result run(Path root, String... args) {
        String[] full = new String[args.length + 2];
        full[0] = "--root";
        full[1] = root.toString();
        System.arraycopy(args, 0, full, 2, args.length);

        PrintStream original = System.out;
        ByteArrayOutputStream buffer = new ByteArrayOutputStream();
        try (PrintStream capture = new PrintStream(buffer, true, StandardCharsets.UTF_8)) {
            System.setOut(capture);
            int exitCode = new CommandLine(new SessionKeeperCommand()).execute(full);
            return new Result(exitCode, buffer.toString(StandardCharsets.UTF_8));
        } finally {
            System.setOut(original);
        }
    }

    private record Result(int exitCode, String out) {
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
