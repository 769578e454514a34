package com.agentkernel.scheduler.guard;

import com.agentkernel.core.model.AgentBlueprint;
import com.agentkernel.core.model.TaskQueue;

import java.util.List;

/**
 * Keeps work from piling up downstream.
 *
 * Work claims need something in their source queue or in
 * {@code needs_continuation}, fewer than
 * {@code maxClaimed} tasks in progress and fewer than
 * {@code maxOpenReviews} awaiting review. Review claims only need
 * something in their source queue.
 */
public class BackpressureGuard implements Guard {

    private final int maxClaimed;
    private final int maxOpenReviews;

    public BackpressureGuard(int maxClaimed, int maxOpenReviews) {
        this.maxClaimed = maxClaimed;
        this.maxOpenReviews = maxOpenReviews;
    }

    @Override
    public String name() {
        return "backpressure";
    }

    @Override
    public GuardResult evaluate(AgentBlueprint blueprint, int slot, TickState state) {
        List<String> sources = blueprint.spawn().claimQueues();
        if (sources.stream().allMatch(q -> state.queueDepth(q) == 0)) {
            return block("nothing to claim in " + String.join(", ", sources));
        }
        if (blueprint.spawn().isReview()) {
            return GuardResult.pass();
        }
        long claimed = state.queueDepth(TaskQueue.CLAIMED.wireName());
        if (claimed >= maxClaimed) {
            return block(claimed + " tasks claimed, limit " + maxClaimed);
        }
        long provisional = state.queueDepth(TaskQueue.PROVISIONAL.wireName());
        if (provisional >= maxOpenReviews) {
            return block(provisional + " tasks awaiting review, limit " + maxOpenReviews);
        }
        return GuardResult.pass();
    }
}
