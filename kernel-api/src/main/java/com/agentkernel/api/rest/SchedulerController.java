package com.agentkernel.api.rest;

import com.agentkernel.agent.pool.InstanceRecord;
import com.agentkernel.agent.pool.InstanceRegistry;
import com.agentkernel.core.model.AgentBlueprint;
import com.agentkernel.scheduler.SchedulerLoop;
import com.agentkernel.scheduler.TickReport;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.time.Instant;
import java.util.List;

/**
 * Admin API for the scheduler loop and the agent pool.
 */
@RestController
@RequestMapping("/api/v1/scheduler")
public class SchedulerController {

    private final SchedulerLoop schedulerLoop;
    private final InstanceRegistry registry;

    public SchedulerController(SchedulerLoop schedulerLoop, InstanceRegistry registry) {
        this.schedulerLoop = schedulerLoop;
        this.registry = registry;
    }

    @GetMapping
    public ResponseEntity<StatusResponse> status() {
        List<BlueprintStatus> blueprints = schedulerLoop.blueprints().stream()
            .map(b -> BlueprintStatus.from(b, registry.countRunning(b.name())))
            .toList();
        List<InstanceResponse> instances = registry.all().stream()
            .map(InstanceResponse::from)
            .toList();
        return ResponseEntity.ok(new StatusResponse(
            schedulerLoop.isRunning(),
            schedulerLoop.isPaused(),
            schedulerLoop.tickCount(),
            blueprints,
            instances
        ));
    }

    /**
     * Run one tick now, outside the timer.
     */
    @PostMapping("/tick")
    public ResponseEntity<TickReport> tick() {
        return ResponseEntity.ok(schedulerLoop.tick());
    }

    /**
     * Stop spawning. Housekeeping keeps running so finished workers
     * still have their results applied.
     */
    @PostMapping("/pause")
    public ResponseEntity<StatusResponse> pause() {
        schedulerLoop.pause();
        return status();
    }

    @PostMapping("/resume")
    public ResponseEntity<StatusResponse> resume() {
        schedulerLoop.resume();
        return status();
    }

    // ========== DTOs ==========

    public record StatusResponse(
        boolean running,
        boolean paused,
        long ticks,
        List<BlueprintStatus> blueprints,
        List<InstanceResponse> instances
    ) {}

    public record BlueprintStatus(
        String name,
        String role,
        String claimMode,
        int maxInstances,
        long runningInstances,
        boolean paused
    ) {
        static BlueprintStatus from(AgentBlueprint blueprint, long running) {
            return new BlueprintStatus(
                blueprint.name(),
                blueprint.role(),
                blueprint.spawn().claimMode().name(),
                blueprint.maxInstances(),
                running,
                blueprint.paused()
            );
        }
    }

    public record InstanceResponse(
        String instanceId,
        String agent,
        String taskId,
        long pid,
        String claimMode,
        String check,
        String status,
        int stepFailures,
        Instant startedAt
    ) {
        static InstanceResponse from(InstanceRecord record) {
            return new InstanceResponse(
                record.instanceId(),
                record.agentName(),
                record.taskId(),
                record.pid(),
                record.claimMode().name(),
                record.check(),
                record.status().name(),
                record.stepFailures(),
                record.startedAt()
            );
        }
    }
}
