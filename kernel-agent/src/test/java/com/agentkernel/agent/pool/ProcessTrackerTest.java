package com.agentkernel.agent.pool;

import com.agentkernel.agent.process.Liveness;
import com.agentkernel.agent.result.ResultReader;
import com.agentkernel.agent.result.ResultSource;
import com.agentkernel.agent.result.WorkerOutcome;
import com.agentkernel.agent.result.WorkerResult;
import com.agentkernel.agent.runtime.TaskDirectories;
import com.agentkernel.agent.runtime.TaskDirectory;
import com.agentkernel.core.exception.SideEffectException;
import com.agentkernel.core.model.ClaimMode;
import com.agentkernel.core.model.Task;
import com.agentkernel.engine.metrics.KernelMetrics;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class ProcessTrackerTest {

    @TempDir
    Path runtimeDir;

    private InMemoryKernel kernel;
    private TaskDirectories directories;
    private InstanceRegistry registry;
    private final Map<Long, Liveness> processes = new HashMap<>();
    private ProcessTracker tracker;

    @BeforeEach
    void setUp() {
        kernel = new InMemoryKernel();
        directories = new TaskDirectories(runtimeDir, new ObjectMapper(), kernel.time);
        registry = new InstanceRegistry();
        ResultHandler handler = new ResultHandler(kernel.tasks, kernel.claims);
        tracker = trackerWith(handler);
    }

    private ProcessTracker trackerWith(ResultHandler handler) {
        return new ProcessTracker(registry, pid -> processes.getOrDefault(pid, Liveness.DEAD),
            new ResultReader(directories, new ObjectMapper()), handler, kernel.tasks, kernel.metrics,
            ProcessTracker.DEFAULT_MAX_STEP_FAILURES);
    }

    private InstanceRecord track(Task task, long pid) throws IOException {
        TaskDirectory dir = directories.forTask(task.id());
        Files.createDirectories(dir.path());
        InstanceRecord record = InstanceRecord.running("implementer", task.id(), pid, ClaimMode.WORK,
            task.claimSource(), null, task.claimedAt(), dir, null, kernel.time.now());
        registry.register(record);
        return record;
    }

    @Test
    @DisplayName("Only confirmed-dead processes are reported as finished")
    void testPollSkipsLiveAndUnknown() throws IOException {
        track(kernel.claimedForWork("T-1"), 10);
        track(kernel.claimedForWork("T-2"), 11);
        track(kernel.claimedForWork("T-3"), 12);
        processes.put(10L, Liveness.ALIVE);
        processes.put(11L, Liveness.UNKNOWN);

        List<FinishedInstance> finished = tracker.poll();

        assertThat(finished).extracting(f -> f.record().taskId()).containsExactly("T-3");
        assertThat(finished.get(0).result().source()).isEqualTo(ResultSource.DEGRADED_DEFAULT);
        assertThat(registry.countRunning("implementer")).isEqualTo(2);
    }

    @Test
    @DisplayName("Reaping applies the result and forgets the instance")
    void testReapAppliesResult() throws IOException {
        Task task = kernel.claimedForWork("T-1");
        InstanceRecord record = track(task, 20);
        Files.writeString(record.directory().resultFile(), "{\"outcome\": \"done\"}");
        directories.writeExitCode(record.directory(), 0);

        assertThat(tracker.hasPendingResult("T-1")).isTrue();
        assertThat(tracker.reap()).isEqualTo(1);

        assertThat(registry.size()).isZero();
        assertThat(tracker.hasPendingResult("T-1")).isFalse();
        assertThat(kernel.tasks.get("T-1").queue()).isEqualTo("provisional");
        assertThat(kernel.metrics.count(KernelMetrics.REAPS, "agent", "implementer", "outcome", "success",
            "source", "result")).isEqualTo(1.0);
    }

    @Test
    @DisplayName("A worker seen dead before its exit hook ran is judged by the exit code once it lands")
    void testPollWaitsForExitCode() throws IOException {
        Task task = kernel.claimedForWork("T-1");
        InstanceRecord record = track(task, 40);
        registry.remove(record.instanceId());
        TaskDirectory dir = record.directory();
        Files.writeString(dir.notesFile(), "halfway through the parser");
        CompletableFuture<Void> exitRecorded = CompletableFuture.runAsync(() -> directories.writeExitCode(dir, 0),
            CompletableFuture.delayedExecutor(200, TimeUnit.MILLISECONDS));
        registry.register(record, exitRecorded);

        List<FinishedInstance> finished = tracker.poll();

        assertThat(exitRecorded).isDone();
        assertThat(finished).singleElement().satisfies(instance -> {
            assertThat(instance.result().source()).isEqualTo(ResultSource.EXIT_CODE);
            assertThat(instance.result().outcome()).isEqualTo(WorkerOutcome.NEEDS_CONTINUATION);
        });
    }

    @Test
    @DisplayName("A crashed worker is requeued with one more attempt")
    void testCrashRequeues() throws IOException {
        track(kernel.claimedForWork("T-1"), 30);

        tracker.reap();

        Task after = kernel.tasks.get("T-1");
        assertThat(after.queue()).isEqualTo("incoming");
        assertThat(after.attemptCount()).isEqualTo(1);
        assertThat(kernel.metrics.count(KernelMetrics.REAPS, "source", "degraded")).isEqualTo(1.0);
    }

    @Test
    @DisplayName("A result that keeps failing to apply moves the task to failed after three tries")
    void testStepFailuresExhausted() throws IOException {
        ResultHandler failing = mock(ResultHandler.class);
        when(failing.apply(any(InstanceRecord.class), any(WorkerResult.class)))
            .thenThrow(new SideEffectException("push_branch", "T-1", "remote rejected"));
        tracker = trackerWith(failing);
        track(kernel.claimedForWork("T-1"), 40);

        assertThat(tracker.reap()).isZero();
        assertThat(tracker.reap()).isZero();
        assertThat(registry.findByTask("T-1")).get().extracting(InstanceRecord::stepFailures).isEqualTo(2);
        assertThat(kernel.tasks.get("T-1").queue()).isEqualTo("claimed");

        assertThat(tracker.reap()).isEqualTo(1);
        assertThat(registry.size()).isZero();
        Task after = kernel.tasks.get("T-1");
        assertThat(after.queue()).isEqualTo("failed");
        assertThat(after.lastError()).contains("remote rejected");
    }
}
