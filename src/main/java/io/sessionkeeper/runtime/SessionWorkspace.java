package io.sessionkeeper.runtime;

import io.sessionkeeper.memory.MemoryTierManager;
import io.sessionkeeper.model.EventType;
import io.sessionkeeper.model.LogLevel;
import io.sessionkeeper.model.SessionHandle;
import io.sessionkeeper.model.SessionUpdate;
import io.sessionkeeper.observability.EventLog;
import io.sessionkeeper.observability.LogStreamer;
import io.sessionkeeper.observability.WorkflowMonitor;
import io.sessionkeeper.session.SessionRegistry;
import io.sessionkeeper.workflow.StateTracker;
import io.sessionkeeper.workflow.WorkflowContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * The per-session objects handed to an orchestrator: memory, event log, task tracker, agent
 * outputs and run monitor, all scoped to one namespace. Closing the workspace stops the log and drops session memory; it
 * must happen before the session can be archived.
 */
public final class SessionWorkspace implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(SessionWorkspace.class);

    private final SessionHandle handle;
    private final SessionRegistry registry;
    private final MemoryTierManager memory;
    private final EventLog events;
    private final StateTracker tasks;
    private final WorkflowContext context;
    private final WorkflowMonitor monitor;
    private final LogStreamer streamer;
    private final Instant openedAt;
    private final AtomicBoolean closed = new AtomicBoolean(false);

    SessionWorkspace(
            SessionHandle handle,
            SessionRegistry registry,
            MemoryTierManager memory,
            EventLog events,
            StateTracker tasks,
            WorkflowContext context,
            WorkflowMonitor monitor,
            LogStreamer streamer
    ) {
        this.handle = handle;
        this.registry = registry;
        this.memory = memory;
        this.events = events;
        this.tasks = tasks;
        this.context = context;
        this.monitor = monitor;
        this.streamer = streamer;
        this.openedAt = Instant.now();
    }

    public String sessionId() {
        return handle.sessionId();
    }

    public SessionHandle handle() {
        return handle;
    }

    public MemoryTierManager memory() {
        return memory;
    }

    public EventLog events() {
        return events;
    }

    public StateTracker tasks() {
        return tasks;
    }

    public WorkflowContext context() {
        return context;
    }

    public WorkflowMonitor monitor() {
        return monitor;
    }

    public LogStreamer streamer() {
        return streamer;
    }

    /**
     * Records the outcome in the registry, writes the workflow context and monitoring report to
     * {@code results/}, then closes the workspace. A missing duration is filled with the time
     * since the workspace was opened.
     */
    public boolean finish(SessionUpdate outcome) {
        SessionUpdate update = outcome == null ? SessionUpdate.none() : outcome;
        if (update.durationSeconds() == null) {
            update = update.withDurationSeconds(Duration.between(openedAt, Instant.now()).toMillis() / 1000.0);
        }
        Map<String, Object> data = new LinkedHashMap<>();
        data.put("status", update.status() == null ? null : update.status().wireName());
        data.put("qualityScore", update.qualityScore());
        data.put("durationSeconds", update.durationSeconds());
        events.log(EventLog.LogRecord.of(EventType.SESSION_COMPLETED, LogLevel.INFO, "Session finished").withData(data));
        monitor.end();
        exportResults();
        boolean updated = registry.updateSession(handle.sessionId(), update);
        close();
        return updated;
    }

    private void exportResults() {
        try {
            context.exportContext();
            monitor.exportReport(handle.resultsDir().resolve(WorkflowMonitor.REPORT_FILE));
        } catch (RuntimeException e) {
            log.warn("Failed to export results of session {}", handle.sessionId(), e);
        }
    }

    public boolean isClosed() {
        return closed.get();
    }

    @Override
    public void close() {
        if (closed.compareAndSet(false, true)) {
            events.stop();
            memory.clearSessionMemory();
        }
    }
}
