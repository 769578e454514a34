package com.agentkernel.engine.service;

import com.agentkernel.core.model.CheckStatus;
import com.agentkernel.core.model.Task;
import com.agentkernel.core.model.TaskFilter;
import com.agentkernel.engine.flow.TransitionResult;

import java.util.List;

/**
 * Service interface for task lifecycle operations.
 */
public interface TaskService {

    /**
     * Create a task. When the task declares no checks, the review gates of
     * its flow become its checks.
     *
     * @param task The task, in a state its flow declares
     * @return The stored task
     */
    Task create(Task task);

    /**
     * Get a task by ID.
     *
     * @param taskId The task ID
     * @return The task
     * @throws com.agentkernel.core.exception.NotFoundException if unknown
     */
    Task get(String taskId);

    List<Task> list(TaskFilter filter);

    /**
     * Move a task along the success edge of its flow from its current queue.
     *
     * @param taskId The task ID
     * @return The committed transition and any side-effect failures
     */
    TransitionResult submit(String taskId);

    /**
     * Move a task to an explicit queue its flow allows.
     */
    TransitionResult transition(String taskId, String toQueue);

    /**
     * Final acceptance. Allowed only when every declared check has passed.
     *
     * @param taskId The task ID
     * @return The committed transition to done
     */
    TransitionResult accept(String taskId);

    /**
     * Return a task to incoming with one more rejection. The claim is cleared
     * and the branch is left in place.
     *
     * @param taskId The task ID
     * @param reason Why it was rejected, kept as the last error
     * @return The rejected task
     */
    Task reject(String taskId, String reason);

    /**
     * Administrative requeue to incoming, bypassing the flow table.
     *
     * @param taskId       The task ID
     * @param reason       Recorded as the last error when not null
     * @param countAttempt Whether this requeue consumes an attempt
     * @return The requeued task
     */
    Task requeue(String taskId, String reason, boolean countAttempt);

    /**
     * Record a failed attempt: requeue while the retry budget lasts, else
     * move the task to its flow's failure target keeping the reason.
     *
     * @param taskId The task ID
     * @param reason Failure reason
     * @return The task after requeue or failure
     */
    Task failAttempt(String taskId, String reason);

    /**
     * Record a check result. FAIL rejects the task; PASS keeps it in its
     * queue and releases any review claim.
     *
     * @param taskId  The task ID
     * @param check   Declared check name
     * @param status  PASS or FAIL
     * @param summary Free-text summary
     * @return The task after recording
     */
    Task recordCheckResult(String taskId, String check, CheckStatus status, String summary);

    Task markNeedsRebase(String taskId, boolean needsRebase, String reason);

    Task recordError(String taskId, String error);

    /**
     * Move a task straight to failed, bypassing the flow table.
     */
    Task fail(String taskId, String reason);
}
