package com.agentkernel.workspace;

import com.agentkernel.core.exception.MergeConflictException;
import com.agentkernel.core.exception.SideEffectException;
import com.agentkernel.core.exception.WorkspaceException;
import com.agentkernel.core.model.SideEffect;
import com.agentkernel.core.model.Task;
import com.agentkernel.engine.flow.SideEffectExecutor;
import com.agentkernel.workspace.git.RebaseResult;
import com.agentkernel.workspace.git.RebaseStatus;
import com.agentkernel.workspace.git.WorkspaceManager;
import com.agentkernel.workspace.pr.PullRequest;
import com.agentkernel.workspace.pr.PullRequestClient;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.time.Clock;

/**
 * Flow side effects backed by the task's worktree and the code host.
 */
public class GitSideEffectExecutor implements SideEffectExecutor {

    private static final Logger log = LoggerFactory.getLogger(GitSideEffectExecutor.class);

    private final WorkspaceManager workspaces;
    private final PullRequestClient pullRequests;
    private final Clock clock;

    public GitSideEffectExecutor(WorkspaceManager workspaces, PullRequestClient pullRequests, Clock clock) {
        this.workspaces = workspaces;
        this.pullRequests = pullRequests;
        this.clock = clock;
    }

    @Override
    public Task execute(SideEffect step, Task task) {
        try {
            return switch (step) {
                case PUSH_BRANCH -> pushBranch(task);
                case CREATE_PR -> createPr(task);
                case MERGE_PR -> mergePr(task);
                case REBASE_ON_BASE -> rebase(task);
                case CHECK_MERGEABLE -> checkMergeable(task);
            };
        } catch (WorkspaceException e) {
            throw new SideEffectException(step.wireName(), task.id(), e.getMessage(), e);
        }
    }

    private Task pushBranch(Task task) {
        Path worktree = requireWorktree(SideEffect.PUSH_BRANCH, task);
        workspaces.ensureNamedBranch(worktree, workspaces.branchNameFor(task));
        workspaces.push(worktree, false);
        return task;
    }

    private Task createPr(Task task) {
        Path worktree = requireWorktree(SideEffect.CREATE_PR, task);
        PullRequest pr = pullRequests.createOrFind(worktree, workspaces.branchNameFor(task), task.branch(),
            task.title() != null ? task.title() : task.id(), "Task " + task.id());
        return task.withPrReference(pr.url(), clock.instant());
    }

    private Task mergePr(Task task) {
        if (task.prReference() == null) {
            throw new SideEffectException(SideEffect.MERGE_PR.wireName(), task.id(), "task has no pull request");
        }
        Path worktree = requireWorktree(SideEffect.MERGE_PR, task);
        if (pullRequests.merge(worktree, task.prReference()) == PullRequestClient.MergeOutcome.CONFLICT) {
            throw new MergeConflictException(SideEffect.MERGE_PR.wireName(), task.id(),
                task.prReference() + " conflicts with " + task.branch());
        }
        return task;
    }

    private Task rebase(Task task) {
        Path worktree = requireWorktree(SideEffect.REBASE_ON_BASE, task);
        RebaseResult result = workspaces.rebaseOnBase(worktree, task.branch());
        if (result.status() == RebaseStatus.CONFLICT) {
            throw new MergeConflictException(SideEffect.REBASE_ON_BASE.wireName(), task.id(), result.message());
        }
        if (result.status() == RebaseStatus.ERROR) {
            throw new SideEffectException(SideEffect.REBASE_ON_BASE.wireName(), task.id(), result.message());
        }
        if (result.status() == RebaseStatus.SUCCESS) {
            workspaces.push(worktree, true);
        }
        return task.withNeedsRebase(false, clock.instant());
    }

    private Task checkMergeable(Task task) {
        Path worktree = requireWorktree(SideEffect.CHECK_MERGEABLE, task);
        if (workspaces.hasConflictsWithBase(worktree, task.branch())) {
            throw new MergeConflictException(SideEffect.CHECK_MERGEABLE.wireName(), task.id(),
                "branch conflicts with " + task.branch());
        }
        log.debug("Task {} merges cleanly into {}", task.id(), task.branch());
        return task.needsRebase() ? task.withNeedsRebase(false, clock.instant()) : task;
    }

    private Path requireWorktree(SideEffect step, Task task) {
        if (!workspaces.exists(task.id())) {
            throw new SideEffectException(step.wireName(), task.id(), "no worktree for task");
        }
        return workspaces.worktreePath(task.id());
    }
}
