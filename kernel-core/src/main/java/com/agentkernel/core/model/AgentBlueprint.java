package com.agentkernel.core.model;

import java.time.Duration;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Static configuration for one agent role: what it claims, how many may
 * run at once and how its worker process is started.
 */
public record AgentBlueprint(
    String name,
    String role,
    Set<String> capabilities,
    int maxInstances,
    Duration interval,
    Duration leaseDuration,
    boolean paused,
    List<String> command,
    String cluster,
    SpawnDescriptor spawn
) {
    public static final Duration DEFAULT_LEASE = Duration.ofMinutes(30);

    public AgentBlueprint {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(spawn, "spawn");
        if (maxInstances < 1) {
            throw new IllegalArgumentException("maxInstances must be >= 1 for blueprint " + name);
        }
        capabilities = capabilities != null ? Set.copyOf(capabilities) : Set.of();
        command = command != null ? List.copyOf(command) : List.of();
        interval = interval != null ? interval : Duration.ZERO;
        leaseDuration = leaseDuration != null ? leaseDuration : DEFAULT_LEASE;
    }

    public static Builder builder(String name) {
        return new Builder(name);
    }

    /**
     * Build the claim intent this blueprint uses for one slot.
     */
    public ClaimIntent claimIntent(String orchestratorId) {
        ClaimIntent intent = spawn.isReview()
            ? new ClaimIntent(name, orchestratorId, ClaimMode.REVIEW, spawn.sourceQueue(),
                null, null, spawn.check(), leaseDuration)
            : new ClaimIntent(name, orchestratorId, ClaimMode.WORK, spawn.sourceQueue(),
                role, null, null, leaseDuration);
        return cluster != null ? intent.inCluster(cluster) : intent;
    }

    public static final class Builder {
        private final String name;
        private String role;
        private Set<String> capabilities = Set.of();
        private int maxInstances = 1;
        private Duration interval = Duration.ZERO;
        private Duration leaseDuration = DEFAULT_LEASE;
        private boolean paused;
        private List<String> command = List.of();
        private String cluster;
        private SpawnDescriptor spawn = SpawnDescriptor.work(true);

        private Builder(String name) {
            this.name = name;
        }

        public Builder role(String role) { this.role = role; return this; }
        public Builder capabilities(Set<String> capabilities) { this.capabilities = capabilities; return this; }
        public Builder maxInstances(int maxInstances) { this.maxInstances = maxInstances; return this; }
        public Builder interval(Duration interval) { this.interval = interval; return this; }
        public Builder leaseDuration(Duration leaseDuration) { this.leaseDuration = leaseDuration; return this; }
        public Builder paused(boolean paused) { this.paused = paused; return this; }
        public Builder command(List<String> command) { this.command = command; return this; }
        public Builder cluster(String cluster) { this.cluster = cluster; return this; }
        public Builder spawn(SpawnDescriptor spawn) { this.spawn = spawn; return this; }

        public AgentBlueprint build() {
            return new AgentBlueprint(name, role, capabilities, maxInstances, interval,
                leaseDuration, paused, command, cluster, spawn);
        }
    }
}
