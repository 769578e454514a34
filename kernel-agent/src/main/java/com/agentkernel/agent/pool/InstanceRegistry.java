package com.agentkernel.agent.pool;

import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;

/**
 * In-process registry of worker instances, keyed by instance id.
 *
 * It is not persisted. Each worker leaves a stamp in its task directory
 * instead, from which the orphan scan re-adopts workers that outlived a
 * restart; claims without one are released.
 */
public class InstanceRegistry {

    private final Map<String, InstanceRecord> records = new ConcurrentHashMap<>();
    private final Map<String, CompletableFuture<Void>> exitsRecorded = new ConcurrentHashMap<>();

    public void register(InstanceRecord record) {
        records.put(record.instanceId(), record);
    }

    /**
     * Track a worker started by this process.
     *
     * @param exitRecorded completes once the worker's exit code is on disk
     */
    public void register(InstanceRecord record, CompletableFuture<Void> exitRecorded) {
        exitsRecorded.put(record.instanceId(), exitRecorded);
        records.put(record.instanceId(), record);
    }

    /**
     * Empty for workers adopted from an earlier run, whose exit is not observed.
     */
    public Optional<CompletableFuture<Void>> exitRecorded(String instanceId) {
        return Optional.ofNullable(exitsRecorded.get(instanceId));
    }

    public Optional<InstanceRecord> get(String instanceId) {
        return Optional.ofNullable(records.get(instanceId));
    }

    public void markFinished(String instanceId) {
        records.computeIfPresent(instanceId, (id, record) -> record.finished());
    }

    public InstanceRecord recordStepFailure(String instanceId) {
        return records.computeIfPresent(instanceId, (id, record) -> record.withStepFailure());
    }

    public void remove(String instanceId) {
        records.remove(instanceId);
        exitsRecorded.remove(instanceId);
    }

    public List<InstanceRecord> all() {
        return records.values().stream()
            .sorted(Comparator.comparing(InstanceRecord::startedAt).thenComparing(InstanceRecord::instanceId))
            .toList();
    }

    public List<InstanceRecord> forAgent(String agentName) {
        return all().stream().filter(r -> r.agentName().equals(agentName)).toList();
    }

    public long countRunning(String agentName) {
        return records.values().stream()
            .filter(r -> r.agentName().equals(agentName) && r.isRunning())
            .count();
    }

    public Optional<InstanceRecord> findByTask(String taskId) {
        return records.values().stream().filter(r -> r.taskId().equals(taskId)).findFirst();
    }

    public boolean hasTask(String taskId) {
        return findByTask(taskId).isPresent();
    }

    public int size() {
        return records.size();
    }
}
