package com.agentkernel.engine.persistence;

import com.agentkernel.core.exception.DuplicateTaskException;
import com.agentkernel.core.model.Task;
import com.agentkernel.core.model.TaskFilter;
import com.agentkernel.core.repository.TaskRepository;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.*;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Collectors;

/**
 * In-memory implementation of TaskRepository.
 * Used for single-process deployments and tests; the conditional update is
 * serialized on the task map so it is linearizable within the process.
 */
@Repository
@ConditionalOnProperty(name = "kernel.store.type", havingValue = "memory")
public class InMemoryTaskRepository implements TaskRepository {

    static final Comparator<Task> CLAIM_ORDER = Comparator
        .comparing(Task::priority)
        .thenComparing(Task::createdAt, Comparator.nullsLast(Comparator.naturalOrder()))
        .thenComparing(Task::id);

    private final Map<String, Task> tasks = new ConcurrentHashMap<>();

    @Override
    public void save(Task task) {
        synchronized (tasks) {
            if (tasks.containsKey(task.id())) {
                throw new DuplicateTaskException(task.id());
            }
            tasks.put(task.id(), task);
        }
    }

    @Override
    public Optional<Task> findById(String taskId) {
        return Optional.ofNullable(tasks.get(taskId));
    }

    @Override
    public List<Task> find(TaskFilter filter) {
        return tasks.values().stream()
            .filter(filter::matches)
            .sorted(Comparator.comparing(Task::createdAt, Comparator.nullsLast(Comparator.naturalOrder()))
                .thenComparing(Task::id))
            .limit(filter.limit())
            .collect(Collectors.toList());
    }

    @Override
    public List<Task> findClaimCandidates(String queue, String role, String cluster, int limit) {
        return tasks.values().stream()
            .filter(t -> t.queue().equals(queue))
            .filter(t -> !t.isClaimed())
            .filter(t -> role == null || role.equals(t.role()))
            .filter(t -> cluster == null || cluster.equals(t.cluster()))
            .sorted(CLAIM_ORDER)
            .limit(limit)
            .collect(Collectors.toList());
    }

    @Override
    public Optional<Task> compareAndSet(Task updated, String expectedQueue, long expectedVersion) {
        synchronized (tasks) {
            Task current = tasks.get(updated.id());
            if (current == null
                    || !current.queue().equals(expectedQueue)
                    || current.version() != expectedVersion) {
                return Optional.empty();
            }
            Task stored = updated.withVersion(expectedVersion + 1);
            tasks.put(stored.id(), stored);
            return Optional.of(stored);
        }
    }

    @Override
    public List<Task> findExpiredClaims(Instant now, int limit) {
        return tasks.values().stream()
            .filter(Task::isClaimed)
            .filter(t -> t.isLeaseExpired(now))
            .sorted(Comparator.comparing(Task::leaseExpiresAt))
            .limit(limit)
            .collect(Collectors.toList());
    }

    @Override
    public long countByQueue(String queue) {
        return tasks.values().stream()
            .filter(t -> t.queue().equals(queue))
            .count();
    }
}
