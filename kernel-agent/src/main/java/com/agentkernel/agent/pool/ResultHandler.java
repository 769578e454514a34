package com.agentkernel.agent.pool;

import com.agentkernel.agent.result.ReviewDecision;
import com.agentkernel.agent.result.WorkerResult;
import com.agentkernel.core.exception.InvalidTransitionException;
import com.agentkernel.core.exception.NotFoundException;
import com.agentkernel.core.model.CheckStatus;
import com.agentkernel.core.model.ClaimMode;
import com.agentkernel.core.model.Task;
import com.agentkernel.core.model.TaskQueue;
import com.agentkernel.engine.flow.TransitionResult;
import com.agentkernel.engine.service.ClaimService;
import com.agentkernel.engine.service.TaskService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;

/**
 * Turns a finished worker's result into task state changes.
 *
 * A result is applied only while the task still carries the claim the
 * worker was started under; anything else is stale and dropped.
 */
public class ResultHandler {

    private static final Logger log = LoggerFactory.getLogger(ResultHandler.class);

    private final TaskService taskService;
    private final ClaimService claimService;

    public ResultHandler(TaskService taskService, ClaimService claimService) {
        this.taskService = taskService;
        this.claimService = claimService;
    }

    public ReapOutcome apply(InstanceRecord record, WorkerResult result) {
        Task task;
        try {
            task = taskService.get(record.taskId());
        } catch (NotFoundException e) {
            log.warn("Task {} disappeared before its result could be applied", record.taskId());
            return ReapOutcome.DISCARDED;
        }

        if (!holdsClaim(task, record)) {
            log.info("Discarding stale result of {} for task {}: task is in {} claimed by {}",
                record.agentName(), task.id(), task.queue(), task.claimedBy());
            return ReapOutcome.DISCARDED;
        }

        if (record.claimMode() == ClaimMode.REVIEW) {
            applyReview(task, record, result);
        } else {
            applyWork(task, result);
        }
        return ReapOutcome.APPLIED;
    }

    private static boolean holdsClaim(Task task, InstanceRecord record) {
        String expectedQueue = record.claimMode() == ClaimMode.REVIEW
            ? record.sourceQueue()
            : TaskQueue.CLAIMED.wireName();
        return expectedQueue.equals(task.queue())
            && record.agentName().equals(task.claimedBy())
            && Objects.equals(record.claimedAt(), task.claimedAt());
    }

    private void applyWork(Task task, WorkerResult result) {
        switch (result.outcome()) {
            case SUCCESS -> {
                TransitionResult transition = taskService.submit(task.id());
                if (!transition.sideEffectsSucceeded()) {
                    log.warn("Task {} submitted to {} with failed steps: {}", task.id(),
                        transition.task().queue(), transition.failures());
                }
            }
            case NEEDS_CONTINUATION -> continueLater(task, result);
            case FAILURE -> {
                Task after = taskService.failAttempt(task.id(), result.summary());
                log.info("Task {} failed an attempt ({}), now in {}", task.id(), result.summary(), after.queue());
            }
        }
    }

    private void continueLater(Task task, WorkerResult result) {
        try {
            taskService.transition(task.id(), TaskQueue.NEEDS_CONTINUATION.wireName());
        } catch (InvalidTransitionException e) {
            log.info("Flow of task {} has no continuation state, requeueing instead", task.id());
            taskService.requeue(task.id(), result.summary(), false);
        }
    }

    private void applyReview(Task task, InstanceRecord record, WorkerResult result) {
        String check = record.check();
        if (!result.isSuccess() || result.decision() == ReviewDecision.REJECT) {
            String reason = result.summary() != null ? result.summary() : "rejected by " + record.agentName();
            if (check != null) {
                taskService.recordCheckResult(task.id(), check, CheckStatus.FAIL, reason);
            } else {
                taskService.reject(task.id(), reason);
            }
            return;
        }

        if (check != null) {
            taskService.recordCheckResult(task.id(), check, CheckStatus.PASS, result.summary());
        } else {
            claimService.releaseReviewClaim(task.id());
        }
    }
}
