package io.sessionkeeper.observability;

import com.fasterxml.jackson.databind.JsonNode;
import io.sessionkeeper.config.SessionKeeperConfig;
import io.sessionkeeper.model.LogEvent;
import io.sessionkeeper.model.LogLevel;
import io.sessionkeeper.util.Jsons;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.channels.SeekableByteChannel;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.Iterator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.NoSuchElementException;
import java.util.Set;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Live tail over a session's event log files, framed as Server-Sent Events.
 *
 * <p>Read offsets are remembered per file for the lifetime of the streamer, so a second
 * {@link #streamLogs} call picks up where the previous one stopped. Only complete lines are
 * consumed; a line still being written is read on a later poll.
 */
public final class LogStreamer {
    private static final Logger log = LoggerFactory.getLogger(LogStreamer.class);
    public static final String EVENT_FRAME = "log_event";
    public static final String ERROR_FRAME = "error";
    public static final int DEFAULT_RECENT_COUNT = 50;
    public static final int DEFAULT_MAX_LINE_BYTES = 4 * 1024 * 1024;
    private static final int SCAN_BYTES = 64 * 1024;

    private final Path logsDir;
    private final long pollIntervalMs;
    private final int maxLineBytes;
    private final Map<Path, Long> positions = new ConcurrentHashMap<>();

    public LogStreamer(Path logsDir, long pollIntervalMs) {
        this(logsDir, pollIntervalMs, DEFAULT_MAX_LINE_BYTES);
    }

    /**
     * @param maxLineBytes lines longer than this are skipped with a warning instead of streamed
     */
    public LogStreamer(Path logsDir, long pollIntervalMs, int maxLineBytes) {
        this.logsDir = logsDir;
        this.pollIntervalMs = Math.max(1L, pollIntervalMs);
        this.maxLineBytes = Math.max(2, maxLineBytes);
    }

    public static LogStreamer open(SessionKeeperConfig config, Path logsDir) {
        return new LogStreamer(logsDir, config.streamPollIntervalMs());
    }

    public static String formatFrame(String eventName, String json) {
        return "event: " + eventName + "\ndata: " + json + "\n\n";
    }

    public Iterator<String> streamLogs(boolean follow) {
        return streamLogs(null, null, null, follow);
    }

    /**
     * Lazily yields one SSE frame per matching event. With {@code follow} the iterator polls for
     * new lines and only ends when the file disappears or the reading thread is interrupted.
     */
    public Iterator<String> streamLogs(String agentId, String eventType, String level, boolean follow) {
        Path file = agentId == null || agentId.isBlank()
                ? logsDir.resolve(EventLog.MASTER_FILE)
                : logsDir.resolve(EventLog.agentFileName(agentId));
        return new Tail(file, new EventLog.LogQuery(agentId, eventType, level, null), follow);
    }

    public List<LogEvent> recentLogs(int count) {
        return recentLogs(count, null);
    }

    public List<LogEvent> recentLogs(int count, String agentId) {
        if (count <= 0) {
            return List.of();
        }
        List<LogEvent> all = EventLog.readLogs(logsDir, EventLog.LogQuery.forAgent(agentId));
        return List.copyOf(all.subList(Math.max(0, all.size() - count), all.size()));
    }

    public LogSummary summary() {
        List<LogEvent> events = EventLog.readLogs(logsDir, EventLog.LogQuery.all());
        Set<String> agents = new LinkedHashSet<>();
        Map<String, Long> eventTypes = new TreeMap<>();
        Map<String, Long> levels = new TreeMap<>();
        long errors = 0;
        Instant start = null;
        Instant end = null;
        for (LogEvent event : events) {
            if (event.agentId() != null && !event.agentId().isBlank()) {
                agents.add(event.agentId());
            }
            String type = event.eventType() == null ? "unknown" : event.eventType();
            eventTypes.merge(type, 1L, Long::sum);
            String level = event.level() == null ? LogLevel.INFO.name() : event.level();
            levels.merge(level, 1L, Long::sum);
            if (LogLevel.ERROR.name().equals(level)) {
                errors++;
            }
            if (event.timestamp() != null) {
                if (start == null) {
                    start = event.timestamp();
                }
                end = event.timestamp();
            }
        }
        return new LogSummary(events.size(), List.copyOf(agents), eventTypes, levels, errors, start, end);
    }

    private List<String> readNewLines(Path file) throws IOException {
        try (SeekableByteChannel channel = Files.newByteChannel(file, StandardOpenOption.READ)) {
            while (true) {
                long offset = positions.getOrDefault(file, 0L);
                long size = channel.size();
                if (size < offset) {
                    // truncated or replaced; start over
                    offset = 0L;
                    positions.put(file, 0L);
                }
                if (size == offset) {
                    return List.of();
                }
                channel.position(offset);
                ByteBuffer buffer = ByteBuffer.allocate((int) Math.min(size - offset, maxLineBytes));
                while (buffer.hasRemaining() && channel.read(buffer) > 0) {
                    // fill
                }
                byte[] bytes = buffer.array();
                int lastNewline = -1;
                for (int i = buffer.position() - 1; i >= 0; i--) {
                    if (bytes[i] == '\n') {
                        lastNewline = i;
                        break;
                    }
                }
                if (lastNewline >= 0) {
                    positions.put(file, offset + lastNewline + 1);
                    return splitLines(new String(bytes, 0, lastNewline + 1, StandardCharsets.UTF_8));
                }
                if (buffer.position() < maxLineBytes) {
                    return List.of();
                }
                long nextLine = nextLineStart(channel, offset + buffer.position());
                if (nextLine < 0) {
                    return List.of();
                }
                log.warn("Skipping event log line of more than {} bytes at offset {} in {}", maxLineBytes, offset, file);
                positions.put(file, nextLine);
            }
        }
    }

    private static long nextLineStart(SeekableByteChannel channel, long from) throws IOException {
        ByteBuffer buffer = ByteBuffer.allocate(SCAN_BYTES);
        long position = from;
        channel.position(from);
        while (true) {
            buffer.clear();
            int read = channel.read(buffer);
            if (read <= 0) {
                return -1L;
            }
            for (int i = 0; i < read; i++) {
                if (buffer.get(i) == '\n') {
                    return position + i + 1;
                }
            }
            position += read;
        }
    }

    private static List<String> splitLines(String text) {
        List<String> lines = new ArrayList<>();
        for (String line : text.split("\n")) {
            if (!line.isBlank()) {
                lines.add(line.strip());
            }
        }
        return lines;
    }

    private final class Tail implements Iterator<String> {
        private final Path file;
        private final EventLog.LogQuery filter;
        private final boolean follow;
        private final Deque<String> pending = new ArrayDeque<>();
        private boolean started;
        private boolean finished;

        private Tail(Path file, EventLog.LogQuery filter, boolean follow) {
            this.file = file;
            this.filter = filter;
            this.follow = follow;
        }

        @Override
        public boolean hasNext() {
            while (pending.isEmpty() && !finished) {
                advance();
            }
            return !pending.isEmpty();
        }

        @Override
        public String next() {
            if (!hasNext()) {
                throw new NoSuchElementException();
            }
            return pending.poll();
        }

        private void advance() {
            if (!started) {
                started = true;
                if (!Files.exists(file)) {
                    finishWithError("Log file not found");
                    return;
                }
            }
            List<String> lines;
            try {
                lines = readNewLines(file);
            } catch (IOException e) {
                if (!Files.exists(file)) {
                    finishWithError("Log file removed");
                } else {
                    log.warn("Failed to tail event log {}", file, e);
                    finishWithError("Failed to read log file");
                }
                return;
            }
            for (String line : lines) {
                JsonNode node = parse(line);
                if (node != null && matches(node)) {
                    pending.add(formatFrame(EVENT_FRAME, line));
                }
            }
            if (!lines.isEmpty()) {
                return;
            }
            if (!follow) {
                finished = true;
                return;
            }
            try {
                Thread.sleep(pollIntervalMs);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                finished = true;
                return;
            }
            if (!Files.exists(file)) {
                finishWithError("Log file removed");
            }
        }

        private boolean matches(JsonNode node) {
            String eventType = filter.eventType();
            if (eventType != null && !eventType.isBlank() && !eventType.equals(node.path("eventType").asText(null))) {
                return false;
            }
            String level = filter.level();
            return level == null || level.isBlank() || level.equalsIgnoreCase(node.path("level").asText(""));
        }

        private JsonNode parse(String line) {
            try {
                JsonNode node = Jsons.mapper().readTree(line);
                return node != null && node.isObject() ? node : null;
            } catch (IOException e) {
                return null;
            }
        }

        private void finishWithError(String message) {
            pending.add(formatFrame(ERROR_FRAME, Jsons.toCompactJson(Map.of("message", message))));
            finished = true;
        }
    }

    public record LogSummary(
            int totalEvents,
            List<String> agents,
            Map<String, Long> eventTypes,
            Map<String, Long> levels,
            long errorCount,
            Instant startTime,
            Instant endTime
    ) {
    }
}
