package io.sessionkeeper.workflow;

import io.sessionkeeper.config.SessionKeeperConfig;
import io.sessionkeeper.model.TaskStatus;
import io.sessionkeeper.model.TaskView;
import io.sessionkeeper.util.Jsons;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Deque;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Task dependency graph and state machine for one workflow run.
 *
 * <p>Transitions: {@code pending -> running -> completed | failed}, {@code failed -> pending} on
 * retry, {@code pending -> skipped}. A task may start only when every dependency is registered
 * and completed. Every call serializes on the tracker's monitor, so readiness queries see a
 * consistent graph while parallel workers report results.
 *
 * <p>Calls that name an unregistered task, or that request a transition the current state does
 * not allow, are programming errors and throw.
 */
public final class StateTracker {
    public static final int DEFAULT_MAX_PARALLEL = 3;

    private final String workflowId;
    private final LinkedHashMap<String, Task> tasks = new LinkedHashMap<>();
    private final List<String> executionOrder = new ArrayList<>();
    private Stage currentStage;

    public StateTracker(String workflowId) {
        this.workflowId = workflowId;
    }

    public String workflowId() {
        return workflowId;
    }

    /**
     * Registers or replaces a task. A registration whose dependencies would reach back to the
     * task itself is rejected and leaves the graph unchanged.
     */
    public synchronized void registerTask(String taskId, String name, Collection<String> dependsOn) {
        if (taskId == null || taskId.isBlank()) {
            throw new IllegalArgumentException("taskId must not be blank");
        }
        List<String> deps = dependsOn == null ? List.of() : List.copyOf(new LinkedHashSet<>(dependsOn));
        if (closesCycle(taskId, deps)) {
            throw new IllegalArgumentException("Dependency cycle through task: " + taskId);
        }
        tasks.put(taskId, new Task(taskId, name == null ? taskId : name, deps));
    }

    public synchronized boolean canExecute(String taskId) {
        Task task = tasks.get(taskId);
        if (task == null) {
            return false;
        }
        for (String dep : task.dependsOn) {
            Task upstream = tasks.get(dep);
            if (upstream == null || upstream.status != TaskStatus.COMPLETED) {
                return false;
            }
        }
        return true;
    }

    public synchronized List<String> getReadyTasks() {
        List<String> ready = new ArrayList<>();
        for (Task task : tasks.values()) {
            if (task.status == TaskStatus.PENDING && canExecute(task.id)) {
                ready.add(task.id);
            }
        }
        return ready;
    }

    public synchronized List<String> getNextExecutableTasks(int maxParallel) {
        List<String> ready = getReadyTasks();
        return List.copyOf(ready.subList(0, Math.min(Math.max(0, maxParallel), ready.size())));
    }

    /**
     * @return false when a dependency is not completed yet; the task stays pending
     */
    public synchronized boolean startTask(String taskId) {
        Task task = require(taskId);
        expect(task, TaskStatus.PENDING, "start");
        if (!canExecute(taskId)) {
            return false;
        }
        task.status = TaskStatus.RUNNING;
        task.startedAt = Instant.now();
        task.endedAt = null;
        executionOrder.add(taskId);
        return true;
    }

    public synchronized void completeTask(String taskId, Object result) {
        Task task = require(taskId);
        expect(task, TaskStatus.RUNNING, "complete");
        task.status = TaskStatus.COMPLETED;
        task.endedAt = Instant.now();
        task.result = result;
        task.error = null;
    }

    public synchronized void failTask(String taskId, String error) {
        Task task = require(taskId);
        expect(task, TaskStatus.RUNNING, "fail");
        task.status = TaskStatus.FAILED;
        task.endedAt = Instant.now();
        task.error = error;
    }

    public synchronized void retryTask(String taskId) {
        Task task = require(taskId);
        expect(task, TaskStatus.FAILED, "retry");
        task.retryCount++;
        task.status = TaskStatus.PENDING;
    }

    public synchronized void skipTask(String taskId) {
        Task task = require(taskId);
        expect(task, TaskStatus.PENDING, "skip");
        task.status = TaskStatus.SKIPPED;
        task.endedAt = Instant.now();
    }

    public synchronized Optional<TaskStatus> getTaskStatus(String taskId) {
        Task task = tasks.get(taskId);
        return task == null ? Optional.empty() : Optional.of(task.status);
    }

    /**
     * Result of a completed task; empty for any other state.
     */
    public synchronized Optional<Object> getTaskResult(String taskId) {
        Task task = tasks.get(taskId);
        if (task == null || task.status != TaskStatus.COMPLETED) {
            return Optional.empty();
        }
        return Optional.ofNullable(task.result);
    }

    public synchronized Optional<TaskView> getTask(String taskId) {
        Task task = tasks.get(taskId);
        return task == null ? Optional.empty() : Optional.of(task.view());
    }

    public synchronized List<TaskView> listTasks() {
        List<TaskView> out = new ArrayList<>();
        for (Task task : tasks.values()) {
            out.add(task.view());
        }
        return out;
    }

    public synchronized void setCurrentStage(String stageId, String stageName) {
        currentStage = new Stage(stageId, stageName, Instant.now());
    }

    public synchronized Optional<Stage> currentStage() {
        return Optional.ofNullable(currentStage);
    }

    public synchronized Progress getWorkflowProgress() {
        int completed = 0;
        int failed = 0;
        int running = 0;
        int pending = 0;
        int skipped = 0;
        for (Task task : tasks.values()) {
            switch (task.status) {
                case COMPLETED -> completed++;
                case FAILED -> failed++;
                case RUNNING -> running++;
                case PENDING -> pending++;
                case SKIPPED -> skipped++;
            }
        }
        int total = tasks.size();
        double percent = total == 0 ? 0.0 : completed * 100.0 / total;
        return new Progress(total, completed, failed, running, pending, skipped, percent, currentStage);
    }

    public synchronized boolean hasCriticalFailure() {
        for (Task task : tasks.values()) {
            if (task.status == TaskStatus.FAILED && task.retryCount >= SessionKeeperConfig.CRITICAL_RETRY_THRESHOLD) {
                return true;
            }
        }
        return false;
    }

    public synchronized List<FailedTask> getFailedTasks() {
        List<FailedTask> out = new ArrayList<>();
        for (Task task : tasks.values()) {
            if (task.status == TaskStatus.FAILED) {
                out.add(new FailedTask(task.id, task.name, task.error, task.retryCount));
            }
        }
        return out;
    }

    /**
     * Overall state derived from the tasks: pending until something starts, failed on a critical
     * failure, completed once every task is completed or skipped.
     */
    public synchronized TaskStatus workflowStatus() {
        if (hasCriticalFailure()) {
            return TaskStatus.FAILED;
        }
        if (tasks.isEmpty() || executionOrder.isEmpty()) {
            return TaskStatus.PENDING;
        }
        for (Task task : tasks.values()) {
            if (task.status != TaskStatus.COMPLETED && task.status != TaskStatus.SKIPPED) {
                return TaskStatus.RUNNING;
            }
        }
        return TaskStatus.COMPLETED;
    }

    public synchronized ExecutionSummary getExecutionSummary() {
        Map<String, TaskSummary> summaries = new LinkedHashMap<>();
        for (Task task : tasks.values()) {
            Double duration = null;
            if (task.startedAt != null && task.endedAt != null) {
                duration = Duration.between(task.startedAt, task.endedAt).toNanos() / 1_000_000_000.0;
            }
            summaries.put(task.id, new TaskSummary(task.name, task.status, duration, task.retryCount));
        }
        return new ExecutionSummary(workflowId, workflowStatus(), getWorkflowProgress(), List.copyOf(executionOrder), summaries);
    }

    public synchronized Checkpoint createCheckpoint() {
        return new Checkpoint(workflowId, Instant.now(), listTasks(), List.copyOf(executionOrder), currentStage);
    }

    /**
     * Replaces the whole graph with the checkpointed one.
     */
    public synchronized void restoreCheckpoint(Checkpoint checkpoint) {
        if (checkpoint == null) {
            throw new IllegalArgumentException("checkpoint must not be null");
        }
        tasks.clear();
        for (TaskView view : checkpoint.tasks()) {
            Task task = new Task(view.taskId(), view.name(), view.dependsOn() == null ? List.of() : List.copyOf(view.dependsOn()));
            task.status = view.status() == null ? TaskStatus.PENDING : view.status();
            task.startedAt = view.startedAt();
            task.endedAt = view.endedAt();
            task.result = view.result();
            task.error = view.error();
            task.retryCount = view.retryCount();
            tasks.put(task.id, task);
        }
        executionOrder.clear();
        executionOrder.addAll(checkpoint.executionOrder());
        currentStage = checkpoint.currentStage();
    }

    /**
     * Writes the execution summary as JSON.
     */
    public void exportState(Path file) {
        ExecutionSummary summary = getExecutionSummary();
        try {
            if (file.getParent() != null) {
                Files.createDirectories(file.getParent());
            }
            Files.writeString(file, Jsons.toJson(summary));
        } catch (IOException e) {
            throw new RuntimeException("Failed to export workflow state: " + file, e);
        }
    }

    private Task require(String taskId) {
        Task task = tasks.get(taskId);
        if (task == null) {
            throw new IllegalArgumentException("Unknown task: " + taskId);
        }
        return task;
    }

    private static void expect(Task task, TaskStatus required, String action) {
        if (task.status != required) {
            throw new IllegalStateException(
                    "Cannot " + action + " task " + task.id + " in state " + task.status.wireName()
            );
        }
    }

    private boolean closesCycle(String taskId, List<String> deps) {
        Deque<String> frontier = new ArrayDeque<>(deps);
        Set<String> seen = new HashSet<>();
        while (!frontier.isEmpty()) {
            String current = frontier.pop();
            if (current.equals(taskId)) {
                return true;
            }
            if (!seen.add(current)) {
                continue;
            }
            Task upstream = tasks.get(current);
            if (upstream != null) {
                frontier.addAll(upstream.dependsOn);
            }
        }
        return false;
    }

    private static final class Task {
        private final String id;
        private final String name;
        private final List<String> dependsOn;
        private TaskStatus status = TaskStatus.PENDING;
        private Instant startedAt;
        private Instant endedAt;
        private Object result;
        private String error;
        private int retryCount;

        private Task(String id, String name, List<String> dependsOn) {
            this.id = id;
            this.name = name;
            this.dependsOn = dependsOn;
        }

        private TaskView view() {
            return new TaskView(id, name, status, dependsOn, startedAt, endedAt, result, error, retryCount);
        }
    }

    public record Stage(String id, String name, Instant startedAt) {
    }

    public record Progress(
            int total,
            int completed,
            int failed,
            int running,
            int pending,
            int skipped,
            double percentComplete,
            Stage currentStage
    ) {
    }

    public record TaskSummary(String name, TaskStatus status, Double durationSeconds, int retryCount) {
    }

    public record ExecutionSummary(
            String workflowId,
            TaskStatus workflowStatus,
            Progress progress,
            List<String> executionOrder,
            Map<String, TaskSummary> tasks
    ) {
    }

    public record FailedTask(String id, String name, String error, int retryCount) {
    }

    public record Checkpoint(
            String workflowId,
            Instant timestamp,
            List<TaskView> tasks,
            List<String> executionOrder,
            Stage currentStage
    ) {
        public Checkpoint {
            tasks = tasks == null ? List.of() : List.copyOf(tasks);
            executionOrder = executionOrder == null ? List.of() : List.copyOf(executionOrder);
        }
    }
}
