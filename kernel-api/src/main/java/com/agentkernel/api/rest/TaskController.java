package com.agentkernel.api.rest;

import com.agentkernel.core.model.CheckResult;
import com.agentkernel.core.model.CheckStatus;
import com.agentkernel.core.model.Task;
import com.agentkernel.core.model.TaskFilter;
import com.agentkernel.core.model.TaskPriority;
import com.agentkernel.engine.flow.StepFailure;
import com.agentkernel.engine.flow.TransitionResult;
import com.agentkernel.engine.service.TaskService;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * REST API for task management. Workers never call this; it is the
 * operator and task-source surface.
 */
@RestController
@RequestMapping("/api/v1/tasks")
public class TaskController {

    private final TaskService taskService;
    private final Clock clock;

    public TaskController(TaskService taskService, Clock clock) {
        this.taskService = taskService;
        this.clock = clock;
    }

    /**
     * Create a task in the incoming queue.
     */
    @PostMapping
    public ResponseEntity<TaskResponse> createTask(@RequestBody CreateTaskRequest request) {
        Instant now = clock.instant();
        Task task = Task.create(request.id(), request.title(), request.role(), now).toBuilder()
            .cluster(request.cluster())
            .flow(request.flow())
            .branch(request.branch())
            .blockedBy(request.blockedBy())
            .priority(TaskPriority.parse(request.priority()))
            .checks(request.checks() != null ? request.checks() : List.of())
            .build();

        Task created = taskService.create(task);
        return ResponseEntity.status(HttpStatus.CREATED).body(TaskResponse.from(created));
    }

    @GetMapping("/{taskId}")
    public ResponseEntity<TaskResponse> getTask(@PathVariable String taskId) {
        return ResponseEntity.ok(TaskResponse.from(taskService.get(taskId)));
    }

    /**
     * List tasks, optionally narrowed to one queue or owner.
     */
    @GetMapping
    public ResponseEntity<List<TaskResponse>> listTasks(
            @RequestParam(required = false) String queue,
            @RequestParam(required = false) String role,
            @RequestParam(required = false) String orchestratorId,
            @RequestParam(defaultValue = "100") int limit) {

        TaskFilter filter = new TaskFilter(queue, role, null, null, orchestratorId, limit);
        List<TaskResponse> responses = taskService.list(filter).stream()
            .map(TaskResponse::from)
            .toList();
        return ResponseEntity.ok(responses);
    }

    /**
     * Send a task back to incoming. Does not consume an attempt.
     */
    @PostMapping("/{taskId}/requeue")
    public ResponseEntity<TaskResponse> requeueTask(
            @PathVariable String taskId,
            @RequestBody(required = false) ReasonRequest request) {

        String reason = request != null ? request.reason() : null;
        return ResponseEntity.ok(TaskResponse.from(taskService.requeue(taskId, reason, false)));
    }

    @PostMapping("/{taskId}/reject")
    public ResponseEntity<TaskResponse> rejectTask(
            @PathVariable String taskId,
            @RequestBody ReasonRequest request) {

        return ResponseEntity.ok(TaskResponse.from(taskService.reject(taskId, request.reason())));
    }

    @PostMapping("/{taskId}/accept")
    public ResponseEntity<TransitionResponse> acceptTask(@PathVariable String taskId) {
        return ResponseEntity.ok(TransitionResponse.from(taskService.accept(taskId)));
    }

    /**
     * Record the outcome of a named check, typically a manual review.
     */
    @PostMapping("/{taskId}/checks/{check}")
    public ResponseEntity<TaskResponse> recordCheck(
            @PathVariable String taskId,
            @PathVariable String check,
            @RequestBody CheckRequest request) {

        Task task = taskService.recordCheckResult(
            taskId, check, CheckStatus.parse(request.status()), request.summary());
        return ResponseEntity.ok(TaskResponse.from(task));
    }

    @PostMapping("/{taskId}/fail")
    public ResponseEntity<TaskResponse> failTask(
            @PathVariable String taskId,
            @RequestBody ReasonRequest request) {

        return ResponseEntity.ok(TaskResponse.from(taskService.fail(taskId, request.reason())));
    }

    // ========== DTOs ==========

    public record CreateTaskRequest(
        String id,
        String title,
        String role,
        String cluster,
        String flow,
        String branch,
        String priority,
        String blockedBy,
        List<String> checks
    ) {}

    public record ReasonRequest(String reason) {}

    public record CheckRequest(String status, String summary) {}

    public record TaskResponse(
        String id,
        String title,
        String role,
        String cluster,
        String flow,
        String queue,
        String priority,
        long version,
        String claimedBy,
        Instant claimedAt,
        Instant leaseExpiresAt,
        String orchestratorId,
        int attemptCount,
        int rejectionCount,
        List<String> checks,
        Map<String, CheckResult> checkResults,
        String blockedBy,
        String branch,
        String prReference,
        boolean needsRebase,
        String lastError,
        Instant createdAt,
        Instant updatedAt
    ) {
        public static TaskResponse from(Task task) {
            return new TaskResponse(
                task.id(),
                task.title(),
                task.role(),
                task.cluster(),
                task.flow(),
                task.queue(),
                task.priority().name(),
                task.version(),
                task.claimedBy(),
                task.claimedAt(),
                task.leaseExpiresAt(),
                task.orchestratorId(),
                task.attemptCount(),
                task.rejectionCount(),
                task.checks(),
                task.checkResults(),
                task.blockedBy(),
                task.branch(),
                task.prReference(),
                task.needsRebase(),
                task.lastError(),
                task.createdAt(),
                task.updatedAt()
            );
        }
    }

    public record TransitionResponse(
        TaskResponse task,
        String fromQueue,
        List<String> failedSteps
    ) {
        public static TransitionResponse from(TransitionResult result) {
            return new TransitionResponse(
                TaskResponse.from(result.task()),
                result.fromQueue(),
                result.failures().stream().map(StepFailure::describe).toList()
            );
        }
    }
}
