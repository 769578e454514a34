package com.agentkernel.engine.coordinator;

import com.agentkernel.core.exception.NotFoundException;
import com.agentkernel.core.exception.OptimisticLockException;
import com.agentkernel.core.model.Task;
import com.agentkernel.core.repository.TaskRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Optional;
import java.util.function.Predicate;
import java.util.function.UnaryOperator;

/**
 * Read-modify-write on a single task through the repository's conditional
 * update, re-reading and re-applying the change when another writer got
 * there first.
 */
public class TaskMutator {

    private static final Logger log = LoggerFactory.getLogger(TaskMutator.class);

    static final int MAX_ATTEMPTS = 3;

    private final TaskRepository taskRepository;

    public TaskMutator(TaskRepository taskRepository) {
        this.taskRepository = taskRepository;
    }

    /**
     * Apply {@code change} to the current state of the task.
     *
     * @throws NotFoundException       if the task does not exist
     * @throws OptimisticLockException if every attempt lost a race
     */
    public Task mutate(String taskId, UnaryOperator<Task> change) {
        return mutateIf(taskId, t -> true, change)
            .orElseThrow(() -> new IllegalStateException("unconditional mutation skipped for " + taskId));
    }

    /**
     * Apply {@code change} only while {@code precondition} holds for the
     * freshly read task.
     *
     * @return the stored task, or empty when the precondition failed
     */
    public Optional<Task> mutateIf(String taskId, Predicate<Task> precondition, UnaryOperator<Task> change) {
        long lastVersion = -1;
        for (int attempt = 1; attempt <= MAX_ATTEMPTS; attempt++) {
            Task current = taskRepository.findById(taskId)
                .orElseThrow(() -> NotFoundException.task(taskId));
            if (!precondition.test(current)) {
                return Optional.empty();
            }
            lastVersion = current.version();
            Optional<Task> stored = taskRepository.compareAndSet(
                change.apply(current), current.queue(), current.version());
            if (stored.isPresent()) {
                return stored;
            }
            log.debug("Task {} changed concurrently (attempt {}/{})", taskId, attempt, MAX_ATTEMPTS);
        }
        throw new OptimisticLockException("Task", taskId, lastVersion);
    }
}
