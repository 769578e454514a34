package com.agentkernel.scheduler;

import java.time.Duration;
import java.util.Objects;

/**
 * @param orchestratorId identity written into every claim this process makes
 * @param tickInterval   delay between the end of one tick and the start of the next
 * @param maxClaimed     work claims stop while this many tasks are claimed
 * @param maxOpenReviews work claims stop while this many tasks await review
 */
public record SchedulerSettings(
    String orchestratorId,
    Duration tickInterval,
    int maxClaimed,
    int maxOpenReviews
) {
    public SchedulerSettings {
        Objects.requireNonNull(orchestratorId, "orchestratorId");
        tickInterval = tickInterval != null ? tickInterval : Duration.ofSeconds(30);
        if (maxClaimed < 1 || maxOpenReviews < 1) {
            throw new IllegalArgumentException("maxClaimed and maxOpenReviews must be >= 1");
        }
    }
}
