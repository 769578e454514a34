package com.agentkernel.api.config;

import com.agentkernel.core.exception.FlowValidationException;
import com.agentkernel.core.model.AgentBlueprint;
import com.agentkernel.core.model.ClaimMode;
import com.agentkernel.core.model.ConditionType;
import com.agentkernel.core.model.FlowCondition;
import com.agentkernel.core.model.FlowDefinition;
import com.agentkernel.core.model.FlowTransition;
import com.agentkernel.core.model.SideEffect;
import com.agentkernel.core.model.SpawnDescriptor;
import com.agentkernel.core.model.Task;
import com.agentkernel.core.model.TaskQueue;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.UUID;

/**
 * Everything under {@code kernel.*} in application.yml.
 */
@ConfigurationProperties(prefix = "kernel")
public class KernelProperties {

    private String orchestratorId;
    private Path runtimeDir = Path.of(".kernel");
    private final Store store = new Store();
    private final Scheduler scheduler = new Scheduler();
    private final Lease lease = new Lease();
    private final Retry retry = new Retry();
    private final Backpressure backpressure = new Backpressure();
    private final Workspace workspace = new Workspace();
    private List<Blueprint> blueprints = new ArrayList<>();
    private List<Flow> flows = new ArrayList<>();

    /**
     * The configured id, or a random one per process when none is set.
     */
    public String resolvedOrchestratorId() {
        if (orchestratorId == null || orchestratorId.isBlank()) {
            orchestratorId = "kernel-" + UUID.randomUUID().toString().substring(0, 8);
        }
        return orchestratorId;
    }

    public List<AgentBlueprint> agentBlueprints() {
        return blueprints.stream().map(b -> b.toBlueprint(lease.getDefaultDuration())).toList();
    }

    public List<FlowDefinition> flowDefinitions() {
        return flows.stream().map(Flow::toDefinition).toList();
    }

    public String getOrchestratorId() { return orchestratorId; }
    public void setOrchestratorId(String orchestratorId) { this.orchestratorId = orchestratorId; }
    public Path getRuntimeDir() { return runtimeDir; }
    public void setRuntimeDir(Path runtimeDir) { this.runtimeDir = runtimeDir; }
    public Store getStore() { return store; }
    public Scheduler getScheduler() { return scheduler; }
    public Lease getLease() { return lease; }
    public Retry getRetry() { return retry; }
    public Backpressure getBackpressure() { return backpressure; }
    public Workspace getWorkspace() { return workspace; }
    public List<Blueprint> getBlueprints() { return blueprints; }
    public void setBlueprints(List<Blueprint> blueprints) { this.blueprints = blueprints; }
    public List<Flow> getFlows() { return flows; }
    public void setFlows(List<Flow> flows) { this.flows = flows; }

    public static class Store {
        /** jdbc or memory */
        private String type = "jdbc";

        public String getType() { return type; }
        public void setType(String type) { this.type = type; }
    }

    public static class Scheduler {
        private boolean enabled = true;
        private boolean paused;
        private Duration tickInterval = Duration.ofSeconds(30);
        private Duration orphanGrace = Duration.ofMinutes(2);

        public boolean isEnabled() { return enabled; }
        public void setEnabled(boolean enabled) { this.enabled = enabled; }
        public boolean isPaused() { return paused; }
        public void setPaused(boolean paused) { this.paused = paused; }
        public Duration getTickInterval() { return tickInterval; }
        public void setTickInterval(Duration tickInterval) { this.tickInterval = tickInterval; }
        public Duration getOrphanGrace() { return orphanGrace; }
        public void setOrphanGrace(Duration orphanGrace) { this.orphanGrace = orphanGrace; }
    }

    public static class Lease {
        private Duration defaultDuration = AgentBlueprint.DEFAULT_LEASE;

        public Duration getDefaultDuration() { return defaultDuration; }
        public void setDefaultDuration(Duration defaultDuration) { this.defaultDuration = defaultDuration; }
    }

    public static class Retry {
        private int maxAttempts = 3;
        private int maxStepFailures = 3;

        public int getMaxAttempts() { return maxAttempts; }
        public void setMaxAttempts(int maxAttempts) { this.maxAttempts = maxAttempts; }
        public int getMaxStepFailures() { return maxStepFailures; }
        public void setMaxStepFailures(int maxStepFailures) { this.maxStepFailures = maxStepFailures; }
    }

    public static class Backpressure {
        private int maxClaimed = 5;
        private int maxOpenReviews = 10;

        public int getMaxClaimed() { return maxClaimed; }
        public void setMaxClaimed(int maxClaimed) { this.maxClaimed = maxClaimed; }
        public int getMaxOpenReviews() { return maxOpenReviews; }
        public void setMaxOpenReviews(int maxOpenReviews) { this.maxOpenReviews = maxOpenReviews; }
    }

    public static class Workspace {
        /** Main checkout worktrees are added to. Unset disables git integration. */
        private Path repoRoot;
        private Path root;
        private String remote = "origin";
        private String branchPrefix = "agent/";
        private String mergeMethod = "merge";
        private Duration gracePeriod = Duration.ofHours(24);

        public Path getRepoRoot() { return repoRoot; }
        public void setRepoRoot(Path repoRoot) { this.repoRoot = repoRoot; }
        public Path getRoot() { return root; }
        public void setRoot(Path root) { this.root = root; }
        public String getRemote() { return remote; }
        public void setRemote(String remote) { this.remote = remote; }
        public String getBranchPrefix() { return branchPrefix; }
        public void setBranchPrefix(String branchPrefix) { this.branchPrefix = branchPrefix; }
        public String getMergeMethod() { return mergeMethod; }
        public void setMergeMethod(String mergeMethod) { this.mergeMethod = mergeMethod; }
        public Duration getGracePeriod() { return gracePeriod; }
        public void setGracePeriod(Duration gracePeriod) { this.gracePeriod = gracePeriod; }
    }

    public static class Blueprint {
        private String name;
        private String role;
        private List<String> capabilities = new ArrayList<>();
        private int maxInstances = 1;
        private Duration interval = Duration.ZERO;
        private Duration leaseDuration;
        private boolean paused;
        private List<String> command = new ArrayList<>();
        private String cluster;
        private boolean needsWorkspace = true;
        private ClaimMode claimMode = ClaimMode.WORK;
        private String sourceQueue;
        private String check;

        AgentBlueprint toBlueprint(Duration defaultLease) {
            String source = sourceQueue != null ? sourceQueue
                : claimMode == ClaimMode.REVIEW ? TaskQueue.PROVISIONAL.wireName() : TaskQueue.INCOMING.wireName();
            return AgentBlueprint.builder(name)
                .role(role)
                .capabilities(new HashSet<>(capabilities))
                .maxInstances(maxInstances)
                .interval(interval)
                .leaseDuration(leaseDuration != null ? leaseDuration : defaultLease)
                .paused(paused)
                .command(command)
                .cluster(cluster)
                .spawn(new SpawnDescriptor(needsWorkspace, claimMode, source, check))
                .build();
        }

        public String getName() { return name; }
        public void setName(String name) { this.name = name; }
        public String getRole() { return role; }
        public void setRole(String role) { this.role = role; }
        public List<String> getCapabilities() { return capabilities; }
        public void setCapabilities(List<String> capabilities) { this.capabilities = capabilities; }
        public int getMaxInstances() { return maxInstances; }
        public void setMaxInstances(int maxInstances) { this.maxInstances = maxInstances; }
        public Duration getInterval() { return interval; }
        public void setInterval(Duration interval) { this.interval = interval; }
        public Duration getLeaseDuration() { return leaseDuration; }
        public void setLeaseDuration(Duration leaseDuration) { this.leaseDuration = leaseDuration; }
        public boolean isPaused() { return paused; }
        public void setPaused(boolean paused) { this.paused = paused; }
        public List<String> getCommand() { return command; }
        public void setCommand(List<String> command) { this.command = command; }
        public String getCluster() { return cluster; }
        public void setCluster(String cluster) { this.cluster = cluster; }
        public boolean isNeedsWorkspace() { return needsWorkspace; }
        public void setNeedsWorkspace(boolean needsWorkspace) { this.needsWorkspace = needsWorkspace; }
        public ClaimMode getClaimMode() { return claimMode; }
        public void setClaimMode(ClaimMode claimMode) { this.claimMode = claimMode; }
        public String getSourceQueue() { return sourceQueue; }
        public void setSourceQueue(String sourceQueue) { this.sourceQueue = sourceQueue; }
        public String getCheck() { return check; }
        public void setCheck(String check) { this.check = check; }
    }

    public static class Flow {
        private String name = Task.DEFAULT_FLOW;
        private String cluster = Task.DEFAULT_CLUSTER;
        private List<String> states = new ArrayList<>();
        private List<Transition> transitions = new ArrayList<>();

        FlowDefinition toDefinition() {
            List<String> errors = new ArrayList<>();
            List<FlowTransition> table = new ArrayList<>();
            for (Transition t : transitions) {
                List<SideEffect> runs = new ArrayList<>();
                for (String step : t.getRuns()) {
                    SideEffect.fromWireName(step.trim().toLowerCase(Locale.ROOT)).ifPresentOrElse(runs::add,
                        () -> errors.add("transition '" + t.getFrom() + " -> " + t.getTo() + "': unknown step '" + step + "'"));
                }
                List<FlowCondition> conditions = t.getConditions().stream()
                    .map(c -> new FlowCondition(c.getName(), c.getType(), c.getScript(), c.getAgent(), c.getOnFail()))
                    .toList();
                table.add(new FlowTransition(t.getFrom(), t.getTo(), t.getAgent(), runs, conditions));
            }
            String key = FlowDefinition.key(name, cluster);
            if (!errors.isEmpty()) {
                throw new FlowValidationException(key, errors);
            }
            return new FlowDefinition(name, cluster, states, table);
        }

        public String getName() { return name; }
        public void setName(String name) { this.name = name; }
        public String getCluster() { return cluster; }
        public void setCluster(String cluster) { this.cluster = cluster; }
        public List<String> getStates() { return states; }
        public void setStates(List<String> states) { this.states = states; }
        public List<Transition> getTransitions() { return transitions; }
        public void setTransitions(List<Transition> transitions) { this.transitions = transitions; }
    }

    public static class Transition {
        private String from;
        private String to;
        private String agent;
        private List<String> runs = new ArrayList<>();
        private List<Condition> conditions = new ArrayList<>();

        public String getFrom() { return from; }
        public void setFrom(String from) { this.from = from; }
        public String getTo() { return to; }
        public void setTo(String to) { this.to = to; }
        public String getAgent() { return agent; }
        public void setAgent(String agent) { this.agent = agent; }
        public List<String> getRuns() { return runs; }
        public void setRuns(List<String> runs) { this.runs = runs; }
        public List<Condition> getConditions() { return conditions; }
        public void setConditions(List<Condition> conditions) { this.conditions = conditions; }
    }

    public static class Condition {
        private String name;
        private ConditionType type = ConditionType.AGENT;
        private String script;
        private String agent;
        private String onFail;

        public String getName() { return name; }
        public void setName(String name) { this.name = name; }
        public ConditionType getType() { return type; }
        public void setType(ConditionType type) { this.type = type; }
        public String getScript() { return script; }
        public void setScript(String script) { this.script = script; }
        public String getAgent() { return agent; }
        public void setAgent(String agent) { this.agent = agent; }
        public String getOnFail() { return onFail; }
        public void setOnFail(String onFail) { this.onFail = onFail; }
    }
}
