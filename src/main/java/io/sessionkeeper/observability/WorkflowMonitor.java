package io.sessionkeeper.observability;

import io.sessionkeeper.model.EventType;
import io.sessionkeeper.model.LogLevel;
import io.sessionkeeper.util.Jsons;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Timing and error accounting for one workflow run: per-agent execution time, tool calls and
 * counters, per-stage durations and parallel batches. Stage and parallel-batch events are
 * mirrored to the session {@link EventLog} when one is attached.
 */
public final class WorkflowMonitor {
    public static final String REPORT_FILE = "monitoring_report.json";
    static final double SLOW_WORKFLOW_SECONDS = 120.0;
    static final double PARALLELIZE_HINT_SECONDS = 180.0;
    static final long TOKEN_HINT_THRESHOLD = 50_000L;

    private final String workflowId;
    private final EventLog events;
    private final Clock clock;
    private final LinkedHashMap<String, AgentMonitor> agents = new LinkedHashMap<>();
    private final LinkedHashMap<String, StageTiming> stages = new LinkedHashMap<>();
    private final List<MonitorEvent> history = new ArrayList<>();
    private final List<ParallelBatch> parallelBatches = new ArrayList<>();
    private Instant startedAt;
    private Instant endedAt;

    public WorkflowMonitor(String workflowId) {
        this(workflowId, null, Clock.systemUTC());
    }

    public WorkflowMonitor(String workflowId, EventLog events) {
        this(workflowId, events, Clock.systemUTC());
    }

    public WorkflowMonitor(String workflowId, EventLog events, Clock clock) {
        this.workflowId = workflowId;
        this.events = events;
        this.clock = clock;
    }

    public String workflowId() {
        return workflowId;
    }

    public synchronized void start() {
        startedAt = clock.instant();
        remember("workflow_started", Map.of("workflowId", workflowId));
    }

    public synchronized void end() {
        endedAt = clock.instant();
        remember("workflow_completed", Map.of("workflowId", workflowId));
    }

    /**
     * Registers an agent, replacing an earlier monitor with the same id.
     */
    public synchronized AgentMonitor registerAgent(String agentId, String agentName) {
        AgentMonitor monitor = new AgentMonitor(agentId, agentName == null ? agentId : agentName, clock);
        agents.put(agentId, monitor);
        return monitor;
    }

    public synchronized void startStage(String stageId, String stageName) {
        stages.put(stageId, new StageTiming(stageName, clock.instant(), null));
        Map<String, Object> data = new LinkedHashMap<>();
        data.put("stageId", stageId);
        data.put("stageName", stageName);
        remember("stage_started", data);
        if (events != null) {
            events.workflowStage(stageName, "started");
        }
    }

    public synchronized void endStage(String stageId) {
        StageTiming timing = stages.get(stageId);
        if (timing == null) {
            return;
        }
        stages.put(stageId, new StageTiming(timing.name(), timing.startedAt(), clock.instant()));
        remember("stage_completed", Map.of("stageId", stageId));
        if (events != null) {
            events.workflowStage(timing.name(), "completed");
        }
    }

    public synchronized void logParallelExecution(List<String> agentIds, double durationSeconds) {
        parallelBatches.add(new ParallelBatch(List.copyOf(agentIds), durationSeconds, clock.instant()));
        Map<String, Object> data = new LinkedHashMap<>();
        data.put("agentCount", agentIds.size());
        data.put("duration", durationSeconds);
        remember("parallel_execution", data);
        if (events != null) {
            events.log(EventLog.LogRecord.of(EventType.WORKFLOW_STAGE, LogLevel.INFO,
                    "Parallel execution of " + agentIds.size() + " agents").withData(data));
        }
    }

    public synchronized double totalExecutionSeconds() {
        return seconds(startedAt, endedAt);
    }

    public synchronized MetricsSummary getMetricsSummary() {
        long tokens = 0;
        long apiCalls = 0;
        long toolCalls = 0;
        int errors = 0;
        for (AgentMonitor monitor : agents.values()) {
            AgentSummary summary = monitor.summary();
            tokens += summary.metrics().getOrDefault(AgentMonitor.TOKEN_USAGE, 0L);
            apiCalls += summary.metrics().getOrDefault(AgentMonitor.API_CALLS, 0L);
            toolCalls += summary.metrics().getOrDefault(AgentMonitor.TOOL_INVOCATIONS, 0L);
            errors += summary.errorCount();
        }
        Map<String, StageDuration> durations = new LinkedHashMap<>();
        int completedStages = 0;
        for (Map.Entry<String, StageTiming> entry : stages.entrySet()) {
            StageTiming timing = entry.getValue();
            if (timing.endedAt() != null) {
                completedStages++;
                durations.put(entry.getKey(), new StageDuration(timing.name(), seconds(timing.startedAt(), timing.endedAt())));
            }
        }
        return new MetricsSummary(
                workflowId,
                totalExecutionSeconds(),
                startedAt,
                endedAt,
                agents.size(),
                completedStages,
                parallelBatches.size(),
                tokens,
                apiCalls,
                toolCalls,
                errors,
                durations,
                errors == 0
        );
    }

    public synchronized List<AgentSummary> getAgentPerformance() {
        List<AgentSummary> out = new ArrayList<>();
        for (AgentMonitor monitor : agents.values()) {
            out.add(monitor.summary());
        }
        return out;
    }

    public synchronized Insights getPerformanceInsights() {
        MetricsSummary metrics = getMetricsSummary();
        List<AgentSummary> performance = getAgentPerformance();
        String slowest = performance.stream()
                .max(Comparator.comparingDouble(AgentSummary::executionSeconds))
                .map(AgentSummary::agentName)
                .orElse(null);
        String mostErrors = performance.stream()
                .max(Comparator.comparingInt(AgentSummary::errorCount))
                .filter(s -> s.errorCount() > 0)
                .map(AgentSummary::agentName)
                .orElse(null);
        double parallelSeconds = parallelBatches.stream().mapToDouble(ParallelBatch::durationSeconds).sum();
        List<String> recommendations = new ArrayList<>();
        if (metrics.totalExecutionSeconds() > PARALLELIZE_HINT_SECONDS) {
            recommendations.add("Consider increasing parallel execution");
        }
        if (metrics.totalErrors() > 0) {
            recommendations.add("Review error logs and implement retry logic");
        }
        if (metrics.totalTokensUsed() > TOKEN_HINT_THRESHOLD) {
            recommendations.add("Optimize prompts to reduce token usage");
        }
        return new Insights(
                metrics.success() ? "success" : "failed",
                metrics.totalExecutionSeconds() < SLOW_WORKFLOW_SECONDS ? "good" : "needs_optimization",
                slowest,
                mostErrors,
                parallelSeconds,
                recommendations
        );
    }

    /**
     * Writes summary, per-agent performance, monitor events and parallel batches as one JSON
     * document.
     */
    public void exportReport(Path file) {
        Map<String, Object> report = new LinkedHashMap<>();
        synchronized (this) {
            report.put("workflowSummary", getMetricsSummary());
            report.put("agentPerformance", getAgentPerformance());
            report.put("events", List.copyOf(history));
            report.put("parallelExecutions", List.copyOf(parallelBatches));
        }
        try {
            if (file.getParent() != null) {
                Files.createDirectories(file.getParent());
            }
            Files.writeString(file, Jsons.toJson(report));
        } catch (IOException e) {
            throw new RuntimeException("Failed to export monitoring report: " + file, e);
        }
    }

    private void remember(String type, Map<String, ?> data) {
        history.add(new MonitorEvent(type, clock.instant(), new LinkedHashMap<>(data)));
    }

    static double seconds(Instant start, Instant end) {
        if (start == null || end == null) {
            return 0.0;
        }
        return Duration.between(start, end).toNanos() / 1_000_000_000.0;
    }

    /**
     * Counters and timing for one agent. Thread-safe; an agent may report from its own worker.
     */
    public static final class AgentMonitor {
        public static final String TOKEN_USAGE = "tokenUsage";
        public static final String API_CALLS = "apiCalls";
        public static final String TOOL_INVOCATIONS = "toolInvocations";
        public static final String RETRY_COUNT = "retryCount";

        private final String agentId;
        private final String agentName;
        private final Clock clock;
        private final LinkedHashMap<String, Long> metrics = new LinkedHashMap<>();
        private final List<ToolCall> toolCalls = new ArrayList<>();
        private final List<AgentError> errors = new ArrayList<>();
        private Instant startedAt;
        private Instant endedAt;

        AgentMonitor(String agentId, String agentName, Clock clock) {
            this.agentId = agentId;
            this.agentName = agentName;
            this.clock = clock;
            metrics.put(TOKEN_USAGE, 0L);
            metrics.put(API_CALLS, 0L);
            metrics.put(TOOL_INVOCATIONS, 0L);
            metrics.put(RETRY_COUNT, 0L);
        }

        public String agentId() {
            return agentId;
        }

        public synchronized void start() {
            startedAt = clock.instant();
        }

        public synchronized void end() {
            endedAt = clock.instant();
        }

        public synchronized void logToolCall(String toolName, double durationSeconds, boolean success) {
            toolCalls.add(new ToolCall(toolName, clock.instant(), durationSeconds, success));
            metrics.merge(TOOL_INVOCATIONS, 1L, Long::sum);
        }

        public void logError(Throwable error, String context) {
            logError(error.getClass().getSimpleName(), error.getMessage(), context);
        }

        public synchronized void logError(String type, String message, String context) {
            errors.add(new AgentError(type, message, context, clock.instant()));
        }

        public synchronized void incrementMetric(String name, long value) {
            metrics.merge(name, value, Long::sum);
        }

        public synchronized double executionSeconds() {
            return seconds(startedAt, endedAt);
        }

        public synchronized List<ToolCall> toolCalls() {
            return List.copyOf(toolCalls);
        }

        public synchronized List<AgentError> errors() {
            return List.copyOf(errors);
        }

        public synchronized AgentSummary summary() {
            return new AgentSummary(
                    agentId,
                    agentName,
                    executionSeconds(),
                    startedAt,
                    endedAt,
                    new LinkedHashMap<>(metrics),
                    toolCalls.size(),
                    errors.size(),
                    errors.isEmpty()
            );
        }
    }

    public record ToolCall(String tool, Instant timestamp, double durationSeconds, boolean success) {
    }

    public record AgentError(String type, String message, String context, Instant timestamp) {
    }

    public record AgentSummary(
            String agentId,
            String agentName,
            double executionSeconds,
            Instant startedAt,
            Instant endedAt,
            Map<String, Long> metrics,
            int toolCallsCount,
            int errorCount,
            boolean success
    ) {
    }

    public record StageTiming(String name, Instant startedAt, Instant endedAt) {
    }

    public record StageDuration(String name, double durationSeconds) {
    }

    public record ParallelBatch(List<String> agents, double durationSeconds, Instant timestamp) {
    }

    public record MonitorEvent(String type, Instant timestamp, Map<String, Object> data) {
    }

    public record MetricsSummary(
            String workflowId,
            double totalExecutionSeconds,
            Instant startedAt,
            Instant endedAt,
            int agentsExecuted,
            int stagesCompleted,
            int parallelExecutions,
            long totalTokensUsed,
            long totalApiCalls,
            long totalToolCalls,
            int totalErrors,
            Map<String, StageDuration> stageDurations,
            boolean success
    ) {
    }

    public record Insights(
            String overallStatus,
            String executionEfficiency,
            String slowestAgent,
            String agentWithMostErrors,
            double parallelSecondsSaved,
            List<String> recommendations
    ) {
    }
}
