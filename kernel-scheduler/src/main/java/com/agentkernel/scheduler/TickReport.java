package com.agentkernel.scheduler;

import java.util.List;
import java.util.Map;

/**
 * What one tick did.
 *
 * @param housekeeping items handled per housekeeping job that completed
 * @param spawned      task ids a worker was started for
 * @param spawnFailed  task ids whose worker could not be started
 */
public record TickReport(
    long tick,
    boolean paused,
    Map<String, Integer> housekeeping,
    List<String> spawned,
    List<String> spawnFailed
) {
}
