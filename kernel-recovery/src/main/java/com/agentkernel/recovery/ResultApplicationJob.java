package com.agentkernel.recovery;

import com.agentkernel.agent.pool.ProcessTracker;

/**
 * Applies the results of finished workers. Runs first so that a finished
 * worker's outcome wins over the expiry of its lease.
 */
public class ResultApplicationJob implements HousekeepingJob {

    private final ProcessTracker tracker;

    public ResultApplicationJob(ProcessTracker tracker) {
        this.tracker = tracker;
    }

    @Override
    public String name() {
        return "result-application";
    }

    @Override
    public int run() {
        return tracker.reap();
    }
}
