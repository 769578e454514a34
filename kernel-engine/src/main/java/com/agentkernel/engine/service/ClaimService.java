package com.agentkernel.engine.service;

import com.agentkernel.core.model.ClaimIntent;
import com.agentkernel.core.model.Task;

import java.time.Duration;
import java.util.Optional;
import java.util.function.Predicate;

/**
 * Claim and lease protocol over the task store.
 */
public interface ClaimService {

    /**
     * Claim the next eligible task for the caller's intent.
     *
     * Selection order is priority, then creation time, then id. A lost
     * race on one candidate moves on to the next; running out of
     * candidates is reported as empty, never as an error.
     *
     * @param intent Who is claiming, from which queue, with which lease
     * @return The claimed task, or empty when none is available
     */
    default Optional<Task> claim(ClaimIntent intent) {
        return claim(intent, task -> true);
    }

    /**
     * Claim the next eligible task that the caller also admits.
     *
     * @param intent     Who is claiming, from which queue, with which lease
     * @param admissible Candidates failing this test are skipped without being touched
     * @return The claimed task, or empty when none is available
     */
    Optional<Task> claim(ClaimIntent intent, Predicate<Task> admissible);

    /**
     * Extend a lease still held by {@code agentName}.
     *
     * @param taskId    The task ID
     * @param agentName The current claimant
     * @param extension New lease length measured from now
     * @return The task with the extended lease, or empty if the caller no longer holds it
     */
    Optional<Task> renew(String taskId, String agentName, Duration extension);

    /**
     * Drop a review claim, leaving the task in its queue.
     *
     * @param taskId The task ID
     * @return The released task, or empty if it was not review-claimed
     */
    Optional<Task> releaseReviewClaim(String taskId);
}
