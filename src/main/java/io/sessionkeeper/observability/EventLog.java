package io.sessionkeeper.observability;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import io.sessionkeeper.config.SessionKeeperConfig;
import io.sessionkeeper.model.EventType;
import io.sessionkeeper.model.LogEvent;
import io.sessionkeeper.model.LogLevel;
import io.sessionkeeper.security.SensitiveDataMasker;
import io.sessionkeeper.util.Jsons;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.BufferedWriter;
import java.io.IOException;
import java.io.InputStreamReader;
import java.nio.charset.CharsetDecoder;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Per-session structured event log.
 *
 * <p>Producers never block: {@link #log(LogRecord)} offers the event to a bounded queue and
 * counts it as dropped when the queue is full. One daemon writer thread drains the queue into
 * {@code logs/session_timeseries.jsonl} and, for agent events, {@code logs/agent_<id>.jsonl}.
 */
public final class EventLog implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(EventLog.class);
    public static final String MASTER_FILE = "session_timeseries.jsonl";
    private static final int FLUSH_EVERY_EVENTS = 64;
    private static final long POLL_MS = 50L;
    private static final long MAX_WAIT_MS = 10_000L;

    private final String sessionId;
    private final Path logsDir;
    private final long flushIntervalMs;
    private final BlockingQueue<LogEvent> queue;
    private final AtomicLong eventsLogged = new AtomicLong();
    private final AtomicLong eventsDropped = new AtomicLong();
    private final Object progress = new Object();
    private final Thread writer;
    private volatile boolean running;
    private long accepted;
    private long processed;
    private Instant lastTimestamp = Instant.EPOCH;

    public EventLog(String sessionId, Path logsDir, int queueCapacity, long flushIntervalMs) {
        this.sessionId = sessionId;
        this.logsDir = logsDir;
        this.flushIntervalMs = Math.max(10L, flushIntervalMs);
        this.queue = new ArrayBlockingQueue<>(Math.max(1, queueCapacity));
        try {
            Files.createDirectories(logsDir);
        } catch (IOException e) {
            throw new RuntimeException("Failed to initialize log directory: " + logsDir, e);
        }
        this.running = true;
        this.writer = new Thread(this::drainLoop, "sessionkeeper-eventlog-" + shortId(sessionId));
        this.writer.setDaemon(true);
        this.writer.start();
    }

    public static EventLog open(SessionKeeperConfig config, String sessionId, Path logsDir) {
        return new EventLog(sessionId, logsDir, config.logQueueCapacity(), config.flushIntervalMs());
    }

    public static String agentFileName(String agentId) {
        return "agent_" + SessionKeeperConfig.safeSegment(agentId) + ".jsonl";
    }

    public String sessionId() {
        return sessionId;
    }

    public Path logsDir() {
        return logsDir;
    }

    public Path masterFile() {
        return logsDir.resolve(MASTER_FILE);
    }

    public Path agentFile(String agentId) {
        return logsDir.resolve(agentFileName(agentId));
    }

    public String log(EventType eventType, LogLevel level, String message) {
        return log(LogRecord.of(eventType, level, message));
    }

    /**
     * Enqueues one event without blocking.
     *
     * @return the event id, assigned even when the event is dropped
     */
    public String log(LogRecord record) {
        String eventId = "evt_" + UUID.randomUUID();
        JsonNode data = maskedData(record);
        synchronized (this) {
            if (!running) {
                eventsDropped.incrementAndGet();
                return eventId;
            }
            LogEvent event = new LogEvent(
                    eventId,
                    sessionId,
                    nextTimestamp(),
                    record.eventType(),
                    record.level() == null ? LogLevel.INFO.name() : record.level().name(),
                    record.agentId(),
                    record.agentName(),
                    record.message(),
                    data,
                    record.durationMs(),
                    record.parentEventId()
            );
            if (!queue.offer(event)) {
                eventsDropped.incrementAndGet();
                return eventId;
            }
            synchronized (progress) {
                accepted++;
            }
        }
        return eventId;
    }

    public String debug(String message, String agentId, Map<String, ?> data) {
        return log(LogRecord.of(EventType.WORKFLOW_STAGE, LogLevel.DEBUG, message).withAgent(agentId, null).withData(data));
    }

    public String info(String message, String agentId, Map<String, ?> data) {
        return log(LogRecord.of(EventType.WORKFLOW_STAGE, LogLevel.INFO, message).withAgent(agentId, null).withData(data));
    }

    public String warning(String message, String agentId, Map<String, ?> data) {
        return log(LogRecord.of(EventType.WORKFLOW_STAGE, LogLevel.WARNING, message).withAgent(agentId, null).withData(data));
    }

    public String error(String message, String agentId, Map<String, ?> data) {
        return log(LogRecord.of(EventType.AGENT_ERROR, LogLevel.ERROR, message).withAgent(agentId, null).withData(data));
    }

    public String success(String message, String agentId, Map<String, ?> data) {
        return log(LogRecord.of(EventType.WORKFLOW_STAGE, LogLevel.SUCCESS, message).withAgent(agentId, null).withData(data));
    }

    public String agentStarted(String agentId, String agentName, String task) {
        Map<String, Object> data = new LinkedHashMap<>();
        data.put("task", task);
        return log(LogRecord.of(EventType.AGENT_STARTED, LogLevel.INFO, "Agent started: " + task)
                .withAgent(agentId, agentName)
                .withData(data));
    }

    public String agentCompleted(String agentId, String agentName, double durationMs, String parentEventId) {
        return log(LogRecord.of(EventType.AGENT_COMPLETED, LogLevel.SUCCESS, String.format("Agent completed in %.2fms", durationMs))
                .withAgent(agentId, agentName)
                .withDuration(durationMs)
                .withParent(parentEventId));
    }

    public String toolCalled(String agentId, String toolName, Map<String, ?> parameters) {
        Map<String, Object> data = new LinkedHashMap<>();
        data.put("toolName", toolName);
        data.put("parameters", parameters == null ? Map.of() : parameters);
        return log(LogRecord.of(EventType.TOOL_CALLED, LogLevel.INFO, "Tool called: " + toolName)
                .withAgent(agentId, null)
                .withData(data));
    }

    public String memoryOperation(String agentId, String operation, String memoryType, String key) {
        EventType type = "store".equalsIgnoreCase(operation) ? EventType.MEMORY_STORED : EventType.MEMORY_RETRIEVED;
        Map<String, Object> data = new LinkedHashMap<>();
        data.put("operation", operation);
        data.put("memoryType", memoryType);
        data.put("key", key);
        return log(LogRecord.of(type, LogLevel.DEBUG, "Memory " + operation + ": " + memoryType + "." + key)
                .withAgent(agentId, null)
                .withData(data));
    }

    public String workflowStage(String stage, String status) {
        Map<String, Object> data = new LinkedHashMap<>();
        data.put("stage", stage);
        data.put("status", status);
        return log(LogRecord.of(EventType.WORKFLOW_STAGE, LogLevel.INFO, "Stage " + stage + ": " + status).withData(data));
    }

    public String metric(String name, double value, String agentId) {
        Map<String, Object> data = new LinkedHashMap<>();
        data.put("metric", name);
        data.put("value", value);
        return log(LogRecord.of(EventType.METRIC_RECORDED, LogLevel.METRIC, "Metric " + name + "=" + value)
                .withAgent(agentId, null)
                .withData(data));
    }

    /**
     * Blocks until every event accepted so far has been written and flushed, or the bounded wait
     * expires.
     *
     * @return true when the writer caught up
     */
    public boolean flush() {
        long deadline = System.currentTimeMillis() + Math.max(MAX_WAIT_MS, flushIntervalMs * 5);
        synchronized (progress) {
            long target = accepted;
            while (processed < target) {
                long remaining = deadline - System.currentTimeMillis();
                if (remaining <= 0 || !writer.isAlive()) {
                    return processed >= target;
                }
                try {
                    progress.wait(Math.min(remaining, POLL_MS));
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    return false;
                }
            }
            return true;
        }
    }

    /**
     * Stops accepting events, drains what is queued and waits for the writer to exit. Safe to call
     * more than once.
     */
    public void stop() {
        synchronized (this) {
            running = false;
        }
        try {
            writer.join(Math.max(MAX_WAIT_MS, flushIntervalMs * 5));
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
        if (writer.isAlive()) {
            log.warn("Event log writer for session {} did not stop in time; {} events still queued", sessionId, queue.size());
        }
    }

    @Override
    public void close() {
        stop();
    }

    public boolean isRunning() {
        return running;
    }

    public LogStats getStats() {
        return new LogStats(sessionId, eventsLogged.get(), eventsDropped.get(), queue.size(), running);
    }

    public List<LogEvent> readLogs() {
        return readLogs(LogQuery.all());
    }

    /**
     * Flushes pending events and reads them back in file order.
     */
    public List<LogEvent> readLogs(LogQuery query) {
        flush();
        return readLogs(logsDir, query);
    }

    /**
     * Reads a session's log files without a live writer, e.g. from an operator tool. Lines that
     * are not valid UTF-8 or not a JSON event are skipped.
     */
    public static List<LogEvent> readLogs(Path logsDir, LogQuery query) {
        LogQuery q = query == null ? LogQuery.all() : query;
        Path file = q.agentId() == null || q.agentId().isBlank()
                ? logsDir.resolve(MASTER_FILE)
                : logsDir.resolve(agentFileName(q.agentId()));
        if (!Files.exists(file)) {
            return List.of();
        }
        List<LogEvent> out = new ArrayList<>();
        CharsetDecoder decoder = StandardCharsets.UTF_8.newDecoder()
                .onMalformedInput(CodingErrorAction.REPLACE)
                .onUnmappableCharacter(CodingErrorAction.REPLACE);
        try (BufferedReader reader = new BufferedReader(new InputStreamReader(Files.newInputStream(file), decoder))) {
            String line;
            while ((line = reader.readLine()) != null) {
                if (q.limit() != null && out.size() >= q.limit()) {
                    break;
                }
                LogEvent event = parseLine(line);
                if (event != null && q.matches(event)) {
                    out.add(event);
                }
            }
        } catch (IOException e) {
            log.warn("Failed to read event log {}", file, e);
        }
        return out;
    }

    static LogEvent parseLine(String line) {
        if (line == null || line.isBlank()) {
            return null;
        }
        try {
            return Jsons.mapper().readValue(line, LogEvent.class);
        } catch (JsonProcessingException e) {
            log.debug("Skipping malformed event log line: {}", e.getOriginalMessage());
            return null;
        }
    }

    private JsonNode maskedData(LogRecord record) {
        try {
            return SensitiveDataMasker.masked(record.data());
        } catch (IllegalArgumentException e) {
            log.debug("Event data of session {} is not representable as JSON; storing its text form", sessionId);
            return Jsons.mapper().getNodeFactory().textNode(String.valueOf(record.data()));
        }
    }

    private Instant nextTimestamp() {
        Instant now = Instant.now();
        if (!now.isAfter(lastTimestamp)) {
            now = lastTimestamp.plusNanos(1_000L);
        }
        lastTimestamp = now;
        return now;
    }

    private void drainLoop() {
        Map<Path, BufferedWriter> writers = new HashMap<>();
        int unflushed = 0;
        long lastFlush = System.currentTimeMillis();
        try {
            while (running || !queue.isEmpty()) {
                LogEvent event;
                try {
                    event = queue.poll(POLL_MS, TimeUnit.MILLISECONDS);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    break;
                }
                if (event != null) {
                    write(writers, event);
                    unflushed++;
                }
                long now = System.currentTimeMillis();
                if (unflushed > 0 && (queue.isEmpty() || unflushed >= FLUSH_EVERY_EVENTS || now - lastFlush >= flushIntervalMs)) {
                    flushWriters(writers);
                    markProcessed(unflushed);
                    unflushed = 0;
                    lastFlush = now;
                }
            }
            LogEvent rest;
            while ((rest = queue.poll()) != null) {
                write(writers, rest);
                unflushed++;
            }
        } finally {
            flushWriters(writers);
            markProcessed(unflushed);
            for (Map.Entry<Path, BufferedWriter> entry : writers.entrySet()) {
                try {
                    entry.getValue().close();
                } catch (IOException e) {
                    log.warn("Failed to close event log {}", entry.getKey(), e);
                }
            }
        }
    }

    private void write(Map<Path, BufferedWriter> writers, LogEvent event) {
        String line;
        try {
            line = Jsons.toCompactJson(event);
        } catch (RuntimeException e) {
            eventsDropped.incrementAndGet();
            log.warn("Dropping unserializable event {} of session {}", event.id(), sessionId, e);
            return;
        }
        try {
            append(writers, masterFile(), line);
            if (event.agentId() != null && !event.agentId().isBlank()) {
                append(writers, agentFile(event.agentId()), line);
            }
            eventsLogged.incrementAndGet();
        } catch (IOException e) {
            eventsDropped.incrementAndGet();
            log.warn("Failed to write event {} of session {}", event.id(), sessionId, e);
        }
    }

    private static void append(Map<Path, BufferedWriter> writers, Path file, String line) throws IOException {
        BufferedWriter out = writers.get(file);
        if (out == null) {
            out = Files.newBufferedWriter(file, StandardCharsets.UTF_8,
                    StandardOpenOption.CREATE, StandardOpenOption.APPEND, StandardOpenOption.WRITE);
            writers.put(file, out);
        }
        out.write(line);
        out.newLine();
    }

    private void flushWriters(Map<Path, BufferedWriter> writers) {
        for (Map.Entry<Path, BufferedWriter> entry : writers.entrySet()) {
            try {
                entry.getValue().flush();
            } catch (IOException e) {
                log.warn("Failed to flush event log {}", entry.getKey(), e);
            }
        }
    }

    private void markProcessed(int count) {
        if (count <= 0) {
            return;
        }
        synchronized (progress) {
            processed += count;
            progress.notifyAll();
        }
    }

    private static String shortId(String sessionId) {
        if (sessionId == null) {
            return "unknown";
        }
        return sessionId.length() > 8 ? sessionId.substring(0, 8) : sessionId;
    }

    /**
     * Caller-side description of one event; the log assigns id, session and timestamp.
     */
    public record LogRecord(
            String eventType,
            LogLevel level,
            String message,
            String agentId,
            String agentName,
            Map<String, ?> data,
            Double durationMs,
            String parentEventId
    ) {
        public static LogRecord of(EventType eventType, LogLevel level, String message) {
            return of(eventType.wireName(), level, message);
        }

        public static LogRecord of(String eventType, LogLevel level, String message) {
            return new LogRecord(eventType, level, message, null, null, Map.of(), null, null);
        }

        public LogRecord withAgent(String agentId, String agentName) {
            return new LogRecord(eventType, level, message, agentId, agentName, data, durationMs, parentEventId);
        }

        public LogRecord withData(Map<String, ?> data) {
            return new LogRecord(eventType, level, message, agentId, agentName, data == null ? Map.of() : data, durationMs, parentEventId);
        }

        public LogRecord withDuration(Double durationMs) {
            return new LogRecord(eventType, level, message, agentId, agentName, data, durationMs, parentEventId);
        }

        public LogRecord withParent(String parentEventId) {
            return new LogRecord(eventType, level, message, agentId, agentName, data, durationMs, parentEventId);
        }
    }

    /**
     * Read filters, applied agent file first, then event type, then level.
     */
    public record LogQuery(String agentId, String eventType, String level, Integer limit) {
        public static LogQuery all() {
            return new LogQuery(null, null, null, null);
        }

        public static LogQuery forAgent(String agentId) {
            return new LogQuery(agentId, null, null, null);
        }

        public LogQuery withEventType(String eventType) {
            return new LogQuery(agentId, eventType, level, limit);
        }

        public LogQuery withLevel(String level) {
            return new LogQuery(agentId, eventType, level, limit);
        }

        public LogQuery withLimit(Integer limit) {
            return new LogQuery(agentId, eventType, level, limit);
        }

        public boolean matches(LogEvent event) {
            if (eventType != null && !eventType.isBlank() && !eventType.equals(event.eventType())) {
                return false;
            }
            return level == null || level.isBlank() || level.equalsIgnoreCase(event.level());
        }
    }

    public record LogStats(String sessionId, long eventsLogged, long eventsDropped, int queueSize, boolean running) {
    }
}
