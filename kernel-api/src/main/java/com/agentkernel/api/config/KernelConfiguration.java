package com.agentkernel.api.config;

import com.agentkernel.agent.pool.AgentPool;
import com.agentkernel.agent.pool.InstanceRegistry;
import com.agentkernel.agent.pool.ProcessTracker;
import com.agentkernel.agent.pool.ResultHandler;
import com.agentkernel.agent.process.AgentLauncher;
import com.agentkernel.agent.process.ProcessAgentLauncher;
import com.agentkernel.agent.process.ProcessHandleProbe;
import com.agentkernel.agent.process.ProcessProbe;
import com.agentkernel.agent.result.ResultReader;
import com.agentkernel.agent.runtime.TaskDirectories;
import com.agentkernel.core.model.AgentBlueprint;
import com.agentkernel.core.model.FlowDefinition;
import com.agentkernel.core.model.Task;
import com.agentkernel.core.repository.FlowDefinitionRepository;
import com.agentkernel.core.repository.TaskRepository;
import com.agentkernel.engine.coordinator.ClaimCoordinator;
import com.agentkernel.engine.coordinator.TaskCoordinator;
import com.agentkernel.engine.flow.FlowStateMachine;
import com.agentkernel.engine.flow.SideEffectExecutor;
import com.agentkernel.engine.metrics.KernelMetrics;
import com.agentkernel.recovery.HousekeepingRunner;
import com.agentkernel.recovery.LeaseExpirySweep;
import com.agentkernel.recovery.OrphanScan;
import com.agentkernel.recovery.ResultApplicationJob;
import com.agentkernel.recovery.StaleWorkspaceSweep;
import com.agentkernel.scheduler.GracefulShutdownHandler;
import com.agentkernel.scheduler.SchedulerLoop;
import com.agentkernel.scheduler.SchedulerSettings;
import com.agentkernel.scheduler.guard.BackpressureGuard;
import com.agentkernel.scheduler.guard.GuardChain;
import com.agentkernel.scheduler.guard.IntervalGuard;
import com.agentkernel.scheduler.guard.LivenessGuard;
import com.agentkernel.scheduler.guard.PauseGuard;
import com.agentkernel.scheduler.guard.PoolCapacityGuard;
import com.agentkernel.workspace.GitSideEffectExecutor;
import com.agentkernel.workspace.git.CommandRunner;
import com.agentkernel.workspace.git.WorkspaceManager;
import com.agentkernel.workspace.git.WorkspaceSettings;
import com.agentkernel.workspace.pr.GhCliPullRequestClient;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.nio.file.Path;
import java.time.Clock;
import java.util.List;

/**
 * Wires the kernel modules together. Everything below the api module is
 * plain Java; this is the only place that knows how the pieces connect.
 */
@Configuration
public class KernelConfiguration {

    private static final Logger log = LoggerFactory.getLogger(KernelConfiguration.class);

    @Bean
    @ConditionalOnMissingBean
    public Clock clock() {
        return Clock.systemUTC();
    }

    // Engine

    @Bean
    public ClaimCoordinator claimCoordinator(TaskRepository taskRepository, KernelMetrics metrics, Clock clock) {
        return new ClaimCoordinator(taskRepository, metrics, clock);
    }

    @Bean
    public FlowStateMachine flowStateMachine(KernelProperties properties, FlowDefinitionRepository flowRepository,
                                             TaskRepository taskRepository,
                                             ObjectProvider<GitSideEffectExecutor> gitSideEffects,
                                             KernelMetrics metrics, Clock clock) {
        List<FlowDefinition> flows = properties.flowDefinitions();
        if (flows.isEmpty()) {
            flows = List.of(FlowDefinition.standard(Task.DEFAULT_CLUSTER));
        }
        flows.forEach(flowRepository::save);
        log.info("Registered {} flow(s): {}", flows.size(), flows.stream().map(FlowDefinition::key).toList());

        SideEffectExecutor sideEffects = gitSideEffects.getIfAvailable();
        if (sideEffects == null) {
            log.info("No workspace repo-root configured, git integration disabled");
            sideEffects = SideEffectExecutor.noop();
        }
        return new FlowStateMachine(flowRepository, taskRepository, sideEffects, metrics, clock);
    }

    @Bean
    public TaskCoordinator taskCoordinator(TaskRepository taskRepository, FlowStateMachine stateMachine,
                                           Clock clock, KernelProperties properties) {
        return new TaskCoordinator(taskRepository, stateMachine, clock, properties.getRetry().getMaxAttempts());
    }

    // Workspace

    @Bean
    public CommandRunner commandRunner() {
        return new CommandRunner();
    }

    /**
     * Absent unless {@code kernel.workspace.repo-root} is set; without it
     * no worktrees are created and flow steps are no-ops.
     */
    @Bean
    @ConditionalOnProperty(name = "kernel.workspace.repo-root")
    public WorkspaceManager workspaceManager(KernelProperties properties, CommandRunner commandRunner,
                                             ObjectMapper objectMapper) {
        KernelProperties.Workspace workspace = properties.getWorkspace();
        Path root = workspace.getRoot() != null ? workspace.getRoot()
            : properties.getRuntimeDir().resolve("worktrees");
        WorkspaceSettings settings = new WorkspaceSettings(
            workspace.getRepoRoot(), root, workspace.getRemote(), workspace.getBranchPrefix());
        return new WorkspaceManager(settings, commandRunner, objectMapper);
    }

    @Bean
    @ConditionalOnProperty(name = "kernel.workspace.repo-root")
    public GitSideEffectExecutor gitSideEffectExecutor(WorkspaceManager manager, CommandRunner commandRunner,
                                                       KernelProperties properties, Clock clock) {
        GhCliPullRequestClient pullRequests =
            new GhCliPullRequestClient(commandRunner, properties.getWorkspace().getMergeMethod());
        return new GitSideEffectExecutor(manager, pullRequests, clock);
    }

    // Agents

    @Bean
    public TaskDirectories taskDirectories(KernelProperties properties, ObjectMapper objectMapper, Clock clock) {
        return new TaskDirectories(properties.getRuntimeDir(), objectMapper, clock);
    }

    @Bean
    public InstanceRegistry instanceRegistry() {
        return new InstanceRegistry();
    }

    @Bean
    public ProcessProbe processProbe() {
        return new ProcessHandleProbe();
    }

    @Bean
    public AgentLauncher agentLauncher() {
        return new ProcessAgentLauncher();
    }

    @Bean
    public AgentPool agentPool(ObjectProvider<WorkspaceManager> workspaces, TaskDirectories directories,
                               AgentLauncher launcher, InstanceRegistry registry, KernelMetrics metrics,
                               Clock clock, KernelProperties properties) {
        return new AgentPool(workspaces.getIfAvailable(), directories, launcher, registry, metrics, clock,
            properties.resolvedOrchestratorId());
    }

    @Bean
    public ResultReader resultReader(TaskDirectories directories, ObjectMapper objectMapper) {
        return new ResultReader(directories, objectMapper);
    }

    @Bean
    public ResultHandler resultHandler(TaskCoordinator taskCoordinator, ClaimCoordinator claimCoordinator) {
        return new ResultHandler(taskCoordinator, claimCoordinator);
    }

    @Bean
    public ProcessTracker processTracker(InstanceRegistry registry, ProcessProbe probe, ResultReader reader,
                                         ResultHandler handler, TaskCoordinator taskCoordinator,
                                         KernelMetrics metrics, KernelProperties properties) {
        return new ProcessTracker(registry, probe, reader, handler, taskCoordinator, metrics,
            properties.getRetry().getMaxStepFailures());
    }

    // Housekeeping

    @Bean
    public HousekeepingRunner housekeepingRunner(TaskRepository taskRepository, ProcessTracker tracker,
                                                 InstanceRegistry registry, TaskDirectories directories,
                                                 ProcessProbe probe, ObjectProvider<WorkspaceManager> workspaces,
                                                 KernelMetrics metrics, Clock clock, KernelProperties properties) {
        return new HousekeepingRunner(List.of(
            new ResultApplicationJob(tracker),
            new LeaseExpirySweep(taskRepository, tracker, metrics, clock),
            new OrphanScan(taskRepository, registry, directories, probe, metrics, clock,
                properties.resolvedOrchestratorId(),
                properties.getScheduler().getOrphanGrace()),
            new StaleWorkspaceSweep(taskRepository, workspaces.getIfAvailable(), directories, clock,
                properties.getWorkspace().getGracePeriod())
        ), metrics);
    }

    // Scheduler

    @Bean
    public GuardChain guardChain(InstanceRegistry registry, ProcessProbe probe, KernelMetrics metrics,
                                 KernelProperties properties) {
        KernelProperties.Backpressure backpressure = properties.getBackpressure();
        return new GuardChain(List.of(
            new PauseGuard(),
            new IntervalGuard(),
            new LivenessGuard(registry, probe),
            new PoolCapacityGuard(registry),
            new BackpressureGuard(backpressure.getMaxClaimed(), backpressure.getMaxOpenReviews())
        ), metrics);
    }

    @Bean
    public SchedulerLoop schedulerLoop(KernelProperties properties, GuardChain guards,
                                       HousekeepingRunner housekeeping, ClaimCoordinator claimCoordinator,
                                       TaskCoordinator taskCoordinator, TaskRepository taskRepository,
                                       AgentPool pool, KernelMetrics metrics, Clock clock) {
        SchedulerSettings settings = new SchedulerSettings(
            properties.resolvedOrchestratorId(),
            properties.getScheduler().getTickInterval(),
            properties.getBackpressure().getMaxClaimed(),
            properties.getBackpressure().getMaxOpenReviews());
        List<AgentBlueprint> blueprints = properties.agentBlueprints();
        SchedulerLoop loop = new SchedulerLoop(settings, blueprints, guards, housekeeping,
            claimCoordinator, taskCoordinator, taskRepository, pool, metrics, clock);

        if (properties.getScheduler().isPaused()) {
            loop.pause();
        }
        if (properties.getScheduler().isEnabled()) {
            loop.start();
        } else {
            log.info("Scheduler loop disabled, ticks run only on request");
        }
        return loop;
    }

    @Bean
    public GracefulShutdownHandler gracefulShutdownHandler(SchedulerLoop loop, InstanceRegistry registry) {
        return new GracefulShutdownHandler(loop, registry);
    }
}
