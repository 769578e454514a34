package com.agentkernel.engine.health;

import com.agentkernel.core.model.TaskQueue;
import com.agentkernel.core.repository.TaskRepository;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Health of the kernel as seen through the task store.
 * Reports:
 * - queue depths for the built-in queues
 * - claims whose lease has expired and not yet been swept
 */
@Component
public class KernelHealthIndicator implements HealthIndicator {

    static final int EXPIRED_CLAIM_WARNING = 10;

    private final TaskRepository taskRepository;
    private final Clock clock;

    public KernelHealthIndicator(TaskRepository taskRepository, Clock clock) {
        this.taskRepository = taskRepository;
        this.clock = clock;
    }

    @Override
    public Health health() {
        Map<String, Object> details = new LinkedHashMap<>();
        try {
            Map<String, Long> depths = new LinkedHashMap<>();
            for (TaskQueue queue : TaskQueue.values()) {
                depths.put(queue.wireName(), taskRepository.countByQueue(queue.wireName()));
            }
            details.put("queues", depths);

            int expired = taskRepository.findExpiredClaims(clock.instant(), EXPIRED_CLAIM_WARNING + 1).size();
            details.put("expiredClaims", expired);
            if (expired > EXPIRED_CLAIM_WARNING) {
                details.put("leaseWarning", "High number of expired claims - housekeeping may be stalled");
            }

            return Health.up().withDetails(details).build();
        } catch (Exception e) {
            details.put("store", "unreachable");
            return Health.down().withException(e).withDetails(details).build();
        }
    }
}
