package com.agentkernel.core.model;

import java.util.List;

/**
 * Declarative capabilities of a blueprint that decide how its workers are
 * claimed for and started. The scheduler has one spawn path; this record,
 * not branching code, selects its behaviour.
 *
 * @param needsWorkspace whether the worker gets an isolated git worktree
 * @param claimMode      work or review claim
 * @param sourceQueue    queue the blueprint claims from
 * @param check          for review blueprints, the named check it fulfils
 */
public record SpawnDescriptor(
    boolean needsWorkspace,
    ClaimMode claimMode,
    String sourceQueue,
    String check
) {
    public static SpawnDescriptor work(boolean needsWorkspace) {
        return new SpawnDescriptor(needsWorkspace, ClaimMode.WORK, TaskQueue.INCOMING.wireName(), null);
    }

    public static SpawnDescriptor review(String check, boolean needsWorkspace) {
        return new SpawnDescriptor(needsWorkspace, ClaimMode.REVIEW, TaskQueue.PROVISIONAL.wireName(), check);
    }

    /**
     * Queues a claim for this blueprint looks in, resumable work first.
     */
    public List<String> claimQueues() {
        return ClaimIntent.sourceQueues(claimMode, sourceQueue);
    }

    public boolean isReview() {
        return claimMode == ClaimMode.REVIEW;
    }
}
