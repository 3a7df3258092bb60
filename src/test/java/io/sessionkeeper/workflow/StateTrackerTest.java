package io.sessionkeeper.workflow;

import com.fasterxml.jackson.databind.JsonNode;
import io.sessionkeeper.model.TaskStatus;
import io.sessionkeeper.util.Jsons;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.stream.Stream;

final class StateTrackerTest {

    @Test
    void dependentTaskBecomesReadyOnlyAfterUpstreamCompletes() {
        StateTracker tracker = new StateTracker("wf-1");
        tracker.registerTask("A", "research", List.of());
        tracker.registerTask("B", "copy", List.of("A"));

        Assertions.assertEquals(List.of("A"), tracker.getReadyTasks());
        Assertions.assertFalse(tracker.canExecute("B"));
        Assertions.assertFalse(tracker.startTask("B"));
        Assertions.assertEquals(TaskStatus.PENDING, tracker.getTaskStatus("B").orElseThrow());

        Assertions.assertTrue(tracker.startTask("A"));
        Assertions.assertTrue(tracker.getReadyTasks().isEmpty());
        tracker.completeTask("A", "findings");

        Assertions.assertEquals(List.of("B"), tracker.getReadyTasks());
        Assertions.assertEquals("findings", tracker.getTaskResult("A").orElseThrow());
        Assertions.assertTrue(tracker.getTaskResult("B").isEmpty());
    }

    @Test
    void unregisteredDependencyFailsClosed() {
        StateTracker tracker = new StateTracker("wf-1");
        tracker.registerTask("B", "copy", List.of("ghost"));

        Assertions.assertFalse(tracker.canExecute("B"));
        Assertions.assertTrue(tracker.getReadyTasks().isEmpty());
        Assertions.assertFalse(tracker.canExecute("unknown"));
    }

    @Test
    void readyTasksKeepRegistrationOrderAndRespectParallelLimit() {
        StateTracker tracker = new StateTracker("wf-1");
        tracker.registerTask("c", "c", null);
        tracker.registerTask("a", "a", null);
        tracker.registerTask("b", "b", null);

        Assertions.assertEquals(List.of("c", "a", "b"), tracker.getReadyTasks());
        Assertions.assertEquals(List.of("c", "a"), tracker.getNextExecutableTasks(2));
        Assertions.assertTrue(tracker.getNextExecutableTasks(0).isEmpty());
    }

    @Test
    void cyclesAreRejectedAndLeaveGraphUnchanged() {
        StateTracker tracker = new StateTracker("wf-1");
        tracker.registerTask("A", "a", List.of());
        tracker.registerTask("B", "b", List.of("A"));
        tracker.registerTask("C", "c", List.of("B"));

        Assertions.assertThrows(IllegalArgumentException.class, () -> tracker.registerTask("A", "a", List.of("C")));
        Assertions.assertThrows(IllegalArgumentException.class, () -> tracker.registerTask("D", "d", List.of("D")));
        Assertions.assertEquals(List.of("A"), tracker.getReadyTasks());
        Assertions.assertTrue(tracker.getTask("D").isEmpty());
    }

    @Test
    void retriesCountTowardCriticalFailure() {
        StateTracker tracker = new StateTracker("wf-1");
        tracker.registerTask("A", "validate", List.of());

        for (int attempt = 0; attempt < 3; attempt++) {
            Assertions.assertTrue(tracker.startTask("A"));
            tracker.failTask("A", "low score");
            Assertions.assertFalse(tracker.hasCriticalFailure());
            tracker.retryTask("A");
        }
        Assertions.assertTrue(tracker.startTask("A"));
        tracker.failTask("A", "low score");

        Assertions.assertTrue(tracker.hasCriticalFailure());
        StateTracker.FailedTask failed = tracker.getFailedTasks().get(0);
        Assertions.assertEquals("A", failed.id());
        Assertions.assertEquals(3, failed.retryCount());
        Assertions.assertEquals("low score", failed.error());
        Assertions.assertEquals(TaskStatus.FAILED, tracker.workflowStatus());
    }

    @Test
    void misuseFailsLoud() {
        StateTracker tracker = new StateTracker("wf-1");
        tracker.registerTask("A", "a", List.of());

        Assertions.assertThrows(IllegalArgumentException.class, () -> tracker.startTask("missing"));
        Assertions.assertThrows(IllegalStateException.class, () -> tracker.completeTask("A", null));
        Assertions.assertThrows(IllegalStateException.class, () -> tracker.retryTask("A"));
        tracker.skipTask("A");
        Assertions.assertEquals(TaskStatus.SKIPPED, tracker.getTaskStatus("A").orElseThrow());
        Assertions.assertThrows(IllegalStateException.class, () -> tracker.startTask("A"));
    }

    @Test
    void skippedDependencyDoesNotUnblockDependants() {
        StateTracker tracker = new StateTracker("wf-1");
        tracker.registerTask("A", "a", List.of());
        tracker.registerTask("B", "b", List.of("A"));
        tracker.skipTask("A");

        Assertions.assertFalse(tracker.canExecute("B"));
        Assertions.assertFalse(tracker.startTask("B"));
        Assertions.assertTrue(tracker.getReadyTasks().isEmpty());
    }

    @Test
    void progressCountsEveryState() {
        StateTracker tracker = new StateTracker("wf-1");
        Assertions.assertEquals(0.0, tracker.getWorkflowProgress().percentComplete());

        tracker.registerTask("A", "a", List.of());
        tracker.registerTask("B", "b", List.of());
        tracker.registerTask("C", "c", List.of());
        tracker.registerTask("D", "d", List.of());
        tracker.startTask("A");
        tracker.completeTask("A", 1);
        tracker.startTask("B");
        tracker.startTask("C");
        tracker.failTask("C", "x");
        tracker.setCurrentStage("stage-2", "Copywriting");

        StateTracker.Progress progress = tracker.getWorkflowProgress();
        Assertions.assertEquals(4, progress.total());
        Assertions.assertEquals(1, progress.completed());
        Assertions.assertEquals(1, progress.running());
        Assertions.assertEquals(1, progress.failed());
        Assertions.assertEquals(1, progress.pending());
        Assertions.assertEquals(25.0, progress.percentComplete());
        Assertions.assertEquals("Copywriting", progress.currentStage().name());
        Assertions.assertEquals(TaskStatus.RUNNING, tracker.workflowStatus());
    }

    @Test
    void checkpointRestoreAndExport() throws Exception {
        Path root = Files.createTempDirectory("sessionkeeper-test-tracker-");
        try {
            StateTracker tracker = new StateTracker("wf-1");
            tracker.registerTask("A", "a", List.of());
            tracker.registerTask("B", "b", List.of("A"));
            tracker.startTask("A");
            tracker.completeTask("A", "ok");
            StateTracker.Checkpoint checkpoint = tracker.createCheckpoint();

            tracker.startTask("B");
            tracker.failTask("B", "boom");
            tracker.restoreCheckpoint(checkpoint);

            Assertions.assertEquals(TaskStatus.PENDING, tracker.getTaskStatus("B").orElseThrow());
            Assertions.assertEquals(List.of("B"), tracker.getReadyTasks());
            Assertions.assertEquals(List.of("A"), tracker.getExecutionSummary().executionOrder());

            Path out = root.resolve("state").resolve("workflow.json");
            tracker.exportState(out);
            JsonNode exported = Jsons.mapper().readTree(out.toFile());
            Assertions.assertEquals("wf-1", exported.path("workflowId").asText());
            Assertions.assertEquals("completed", exported.path("tasks").path("A").path("status").asText());
            Assertions.assertEquals(2, exported.path("progress").path("total").asInt());
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void concurrentWorkersNeverStartTheSameTaskTwice() throws Exception {
        StateTracker tracker = new StateTracker("wf-1");
        for (int i = 0; i < 50; i++) {
            tracker.registerTask("t" + i, "task " + i, List.of());
        }
        List<String> started = Collections.synchronizedList(new ArrayList<>());
        ExecutorService pool = Executors.newFixedThreadPool(4);
        CountDownLatch done = new CountDownLatch(4);
        try {
            for (int w = 0; w < 4; w++) {
                pool.submit(() -> {
                    try {
                        for (int i = 0; i < 50; i++) {
                            String id = "t" + i;
                            try {
                                if (tracker.startTask(id)) {
                                    started.add(id);
                                    tracker.completeTask(id, id);
                                }
                            } catch (IllegalStateException alreadyTaken) {
                                // another worker won the race
                            }
                        }
                    } finally {
                        done.countDown();
                    }
                });
            }
            Assertions.assertTrue(done.await(10, TimeUnit.SECONDS));
        } finally {
            pool.shutdownNow();
        }
        Assertions.assertEquals(50, started.size());
        Assertions.assertEquals(100.0, tracker.getWorkflowProgress().percentComplete());
        Assertions.assertEquals(TaskStatus.COMPLETED, tracker.workflowStatus());
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
