package io.sessionkeeper.cli;

import io.sessionkeeper.config.SessionKeeperConfig;
import io.sessionkeeper.memory.CampaignCatalog;
import io.sessionkeeper.model.SessionMetadata;
import io.sessionkeeper.model.SessionStatus;
import io.sessionkeeper.observability.EventLog;
import io.sessionkeeper.observability.LogStreamer;
import io.sessionkeeper.runtime.SessionKeeper;
import io.sessionkeeper.session.SessionRegistry;
import io.sessionkeeper.util.Jsons;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.ParentCommand;

import java.nio.file.Path;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.Callable;

@Command(
        name = "sessionkeeper",
        mixinStandardHelpOptions = true,
        description = "Inspect and maintain a session storage root",
        subcommands = {
                SessionKeeperCommand.SessionsCommand.class,
                SessionKeeperCommand.SessionCommand.class,
                SessionKeeperCommand.StatsCommand.class,
                SessionKeeperCommand.CleanupCommand.class,
                SessionKeeperCommand.ArchiveCommand.class,
                SessionKeeperCommand.LogsCommand.class,
                SessionKeeperCommand.TailCommand.class,
                SessionKeeperCommand.LogSummaryCommand.class,
                SessionKeeperCommand.CampaignsCommand.class
        }
)
public final class SessionKeeperCommand implements Runnable {
    @Option(names = {"--root"}, description = "Storage root directory", defaultValue = "storage")
    String root;

    @Override
    public void run() {
        System.out.println("Use subcommands: sessions | session | stats | cleanup | archive | logs | tail | log-summary | campaigns");
    }

    SessionKeeperConfig config() {
        return SessionKeeperConfig.fromRoot(root).withAutoCleanup(false);
    }

    SessionKeeper keeper() {
        return new SessionKeeper(config());
    }

    SessionRegistry registry() {
        return new SessionRegistry(config());
    }

    private static int notFound(String what) {
        System.out.println(Jsons.toCompactJson(Map.of("error", what + " not found")));
        return 1;
    }

    private static SessionStatus parseStatus(String raw) {
        return raw == null || raw.isBlank() ? null : SessionStatus.fromString(raw);
    }

    @Command(name = "sessions", description = "List sessions, newest first")
    static final class SessionsCommand implements Callable<Integer> {
        @ParentCommand
        SessionKeeperCommand parent;

        @Option(names = {"--status"}, description = "Filter: running|completed|failed|archived")
        String status;

        @Option(names = {"--limit"}, defaultValue = "20", description = "Max number of rows")
        int limit;

        @Override
        public Integer call() {
            List<SessionMetadata> sessions = parent.registry().listSessions(parseStatus(status), limit);
            System.out.println(Jsons.toJson(sessions));
            return 0;
        }
    }

    @Command(name = "session", description = "Show one session's metadata")
    static final class SessionCommand implements Callable<Integer> {
        @ParentCommand
        SessionKeeperCommand parent;

        @Parameters(index = "0", description = "Session id")
        String sessionId;

        @Override
        public Integer call() {
            Optional<SessionMetadata> metadata = parent.registry().getSessionMetadata(sessionId);
            if (metadata.isEmpty()) {
                return notFound("session");
            }
            System.out.println(Jsons.toJson(metadata.get()));
            return 0;
        }
    }

    @Command(name = "stats", description = "Aggregate session statistics")
    static final class StatsCommand implements Callable<Integer> {
        @ParentCommand
        SessionKeeperCommand parent;

        @Override
        public Integer call() {
            System.out.println(Jsons.toJson(parent.registry().getSessionStats()));
            return 0;
        }
    }

    @Command(name = "cleanup", description = "Archive finished sessions older than the retention window")
    static final class CleanupCommand implements Callable<Integer> {
        @ParentCommand
        SessionKeeperCommand parent;

        @Option(names = {"--retention-days"}, description = "Override the configured retention")
        Integer retentionDays;

        @Override
        public Integer call() {
            SessionKeeperConfig config = parent.config();
            if (retentionDays != null) {
                config = config.withRetentionDays(retentionDays);
            }
            int archived = new SessionRegistry(config).cleanupOldSessions();
            System.out.println(Jsons.toCompactJson(Map.of("archived", archived)));
            return 0;
        }
    }

    @Command(name = "archive", description = "Archive one finished session now")
    static final class ArchiveCommand implements Callable<Integer> {
        @ParentCommand
        SessionKeeperCommand parent;

        @Parameters(index = "0", description = "Session id")
        String sessionId;

        @Override
        public Integer call() {
            boolean archived = parent.registry().archiveSession(sessionId);
            System.out.println(Jsons.toCompactJson(Map.of("sessionId", sessionId, "archived", archived)));
            return archived ? 0 : 1;
        }
    }

    @Command(name = "logs", description = "Read a session's event log")
    static final class LogsCommand implements Callable<Integer> {
        @ParentCommand
        SessionKeeperCommand parent;

        @Parameters(index = "0", description = "Session id")
        String sessionId;

        @Option(names = {"--agent"}, description = "Read one agent's log")
        String agentId;

        @Option(names = {"--type"}, description = "Event type filter")
        String eventType;

        @Option(names = {"--level"}, description = "Level filter")
        String level;

        @Option(names = {"--limit"}, description = "Max number of events")
        Integer limit;

        @Override
        public Integer call() {
            SessionRegistry registry = parent.registry();
            if (registry.getSessionHandle(sessionId).isEmpty()) {
                return notFound("session");
            }
            Path logsDir = registry.getSessionDir(sessionId).resolve("logs");
            EventLog.LogQuery query = new EventLog.LogQuery(agentId, eventType, level, limit);
            System.out.println(Jsons.toJson(EventLog.readLogs(logsDir, query)));
            return 0;
        }
    }

    @Command(name = "tail", description = "Print a session's events as SSE frames")
    static final class TailCommand implements Callable<Integer> {
        @ParentCommand
        SessionKeeperCommand parent;

        @Parameters(index = "0", description = "Session id")
        String sessionId;

        @Option(names = {"--agent"}, description = "Tail one agent's log")
        String agentId;

        @Option(names = {"--type"}, description = "Event type filter")
        String eventType;

        @Option(names = {"--level"}, description = "Level filter")
        String level;

        @Option(names = {"--follow", "-f"}, description = "Keep polling for new events")
        boolean follow;

        @Override
        public Integer call() {
            Optional<LogStreamer> streamer = parent.keeper().streamer(sessionId);
            if (streamer.isEmpty()) {
                return notFound("session");
            }
            Iterator<String> frames = streamer.get().streamLogs(agentId, eventType, level, follow);
            int exit = 0;
            while (frames.hasNext()) {
                String frame = frames.next();
                if (frame.startsWith("event: " + LogStreamer.ERROR_FRAME)) {
                    exit = 1;
                }
                System.out.print(frame);
                System.out.flush();
            }
            return exit;
        }
    }

    @Command(name = "log-summary", description = "Summarize a session's event log")
    static final class LogSummaryCommand implements Callable<Integer> {
        @ParentCommand
        SessionKeeperCommand parent;

        @Parameters(index = "0", description = "Session id")
        String sessionId;

        @Override
        public Integer call() {
            Optional<LogStreamer> streamer = parent.keeper().streamer(sessionId);
            if (streamer.isEmpty()) {
                return notFound("session");
            }
            System.out.println(Jsons.toJson(streamer.get().summary()));
            return 0;
        }
    }

    @Command(name = "campaigns", description = "Search saved campaign templates by similarity")
    static final class CampaignsCommand implements Callable<Integer> {
        @ParentCommand
        SessionKeeperCommand parent;

        @Option(names = {"--category"}, description = "Product category")
        String category;

        @Option(names = {"--keyword"}, description = "Keyword, repeatable")
        List<String> keywords;

        @Option(names = {"--audience"}, description = "Audience description")
        String audience;

        @Option(names = {"--min-quality"}, defaultValue = "0", description = "Minimum quality score")
        double minQuality;

        @Option(names = {"--limit"}, defaultValue = "5", description = "Max number of matches")
        int limit;

        @Override
        public Integer call() {
            CampaignCatalog catalog = CampaignCatalog.open(parent.config());
            CampaignCatalog.Query query = new CampaignCatalog.Query(
                    category,
                    keywords == null ? List.of() : keywords,
                    audience,
                    minQuality,
                    limit
            );
            System.out.println(Jsons.toJson(catalog.findSimilar(query)));
            return 0;
        }
    }
}
