package io.sessionkeeper.runtime;

import io.sessionkeeper.config.SessionKeeperConfig;
import io.sessionkeeper.memory.CampaignCatalog;
import io.sessionkeeper.memory.MemoryTierManager;
import io.sessionkeeper.model.EventType;
import io.sessionkeeper.model.LogLevel;
import io.sessionkeeper.model.SessionHandle;
import io.sessionkeeper.observability.EventLog;
import io.sessionkeeper.observability.LogStreamer;
import io.sessionkeeper.observability.WorkflowMonitor;
import io.sessionkeeper.session.SessionRegistry;
import io.sessionkeeper.storage.KeyValueStore;
import io.sessionkeeper.workflow.StateTracker;
import io.sessionkeeper.workflow.WorkflowContext;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Composition root for one storage root. Owns the registry and the stores shared by every
 * session (long-term memory, campaign templates) and builds a fresh {@link SessionWorkspace}
 * per session.
 */
public final class SessionKeeper {
    private final SessionKeeperConfig config;
    private final SessionRegistry registry;
    private final KeyValueStore longTermStore;
    private final CampaignCatalog catalog;

    public SessionKeeper(SessionKeeperConfig config) {
        this(config, new SessionRegistry(config));
    }

    public SessionKeeper(SessionKeeperConfig config, SessionRegistry registry) {
        this.config = config;
        this.registry = registry;
        this.longTermStore = MemoryTierManager.openLongTermStore(config);
        this.catalog = CampaignCatalog.open(config);
    }

    public SessionKeeperConfig config() {
        return config;
    }

    public SessionRegistry registry() {
        return registry;
    }

    public CampaignCatalog catalog() {
        return catalog;
    }

    public SessionWorkspace startSession(String productLabel, String workflowType) {
        SessionHandle handle = registry.createSession(productLabel, workflowType);
        SessionWorkspace workspace = workspace(handle);
        Map<String, Object> data = new LinkedHashMap<>();
        data.put("productLabel", productLabel);
        data.put("workflowType", workflowType);
        workspace.events().log(EventLog.LogRecord.of(EventType.SESSION_STARTED, LogLevel.INFO, "Session started").withData(data));
        return workspace;
    }

    /**
     * Reattaches to a live session, e.g. after a restart. Events append to the existing files.
     */
    public Optional<SessionWorkspace> openSession(String sessionId) {
        return registry.getSessionHandle(sessionId).map(this::workspace);
    }

    /**
     * Read-only tail over a session's logs; works for sessions with no live workspace.
     */
    public Optional<LogStreamer> streamer(String sessionId) {
        return registry.getSessionHandle(sessionId).map(handle -> LogStreamer.open(config, handle.logsDir()));
    }

    public int cleanup() {
        return registry.cleanupOldSessions();
    }

    private SessionWorkspace workspace(SessionHandle handle) {
        MemoryTierManager memory = new MemoryTierManager(
                handle.sessionId(),
                handle.memoryDir(),
                longTermStore,
                catalog,
                config.cacheCapacity()
        );
        EventLog events = EventLog.open(config, handle.sessionId(), handle.logsDir());
        StateTracker tasks = new StateTracker(handle.sessionId());
        WorkflowContext context = new WorkflowContext(handle.sessionId(), handle.agentOutputsDir(), handle.resultsDir(), tasks);
        WorkflowMonitor monitor = new WorkflowMonitor(handle.sessionId(), events);
        monitor.start();
        LogStreamer streamer = LogStreamer.open(config, handle.logsDir());
        return new SessionWorkspace(handle, registry, memory, events, tasks, context, monitor, streamer);
    }
}
