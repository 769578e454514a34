package com.agentkernel.core.repository;

import com.agentkernel.core.model.Task;
import com.agentkernel.core.model.TaskFilter;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Repository for the authoritative task records.
 *
 * Every mutation after creation goes through {@link #compareAndSet}, the
 * single conditional update that also implements the claim.
 */
public interface TaskRepository {

    /**
     * Save a new task.
     *
     * @param task The task to save
     * @throws com.agentkernel.core.exception.DuplicateTaskException if the id already exists
     */
    void save(Task task);

    /**
     * Find a task by ID.
     *
     * @param taskId The task ID
     * @return The task if found
     */
    Optional<Task> findById(String taskId);

    /**
     * Find tasks matching a filter, oldest first.
     *
     * @param filter The filter
     * @return Matching tasks, at most {@code filter.limit()}
     */
    List<Task> find(TaskFilter filter);

    /**
     * Find unclaimed tasks in a queue in claim order: priority, then
     * creation time, then id. Dependency resolution is left to the caller.
     *
     * @param queue   Source queue
     * @param role    Role filter, or null for any
     * @param cluster Cluster filter, or null for any
     * @param limit   Maximum number of results
     * @return Candidates in claim order
     */
    List<Task> findClaimCandidates(String queue, String role, String cluster, int limit);

    /**
     * Atomically replace a task if it is still in {@code expectedQueue} at
     * {@code expectedVersion}. The stored version becomes expectedVersion + 1.
     *
     * @param updated         The new task state
     * @param expectedQueue   Queue the task must currently be in
     * @param expectedVersion Version the task must currently have
     * @return The stored task, or empty when the condition did not hold
     */
    Optional<Task> compareAndSet(Task updated, String expectedQueue, long expectedVersion);

    /**
     * Find claimed tasks whose lease expired before {@code now}, including
     * review claims held outside the claimed queue.
     *
     * @param now   Current time
     * @param limit Maximum number of results
     * @return Tasks with expired leases
     */
    List<Task> findExpiredClaims(Instant now, int limit);

    /**
     * Count tasks in a queue.
     *
     * @param queue The queue
     * @return Number of tasks in it
     */
    long countByQueue(String queue);
}
