package com.agentkernel.scheduler.guard;

import com.agentkernel.core.repository.TaskRepository;

import java.time.Instant;

/**
 * What guards may look at during one tick. Queue depths are read live so
 * claims made earlier in the tick are visible.
 */
public class TickState {

    private final long tick;
    private final Instant now;
    private final boolean systemPaused;
    private final TaskRepository taskRepository;

    public TickState(long tick, Instant now, boolean systemPaused, TaskRepository taskRepository) {
        this.tick = tick;
        this.now = now;
        this.systemPaused = systemPaused;
        this.taskRepository = taskRepository;
    }

    public long tick() {
        return tick;
    }

    public Instant now() {
        return now;
    }

    public boolean systemPaused() {
        return systemPaused;
    }

    public long queueDepth(String queue) {
        return taskRepository.countByQueue(queue);
    }
}
