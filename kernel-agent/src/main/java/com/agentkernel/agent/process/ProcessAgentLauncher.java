package com.agentkernel.agent.process;

import com.agentkernel.agent.runtime.TaskDirectory;
import com.agentkernel.core.exception.SpawnFailureException;
import com.agentkernel.core.model.AgentBlueprint;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.util.Map;

/**
 * Launches the blueprint's command as a detached child process with its
 * output redirected into the task directory.
 */
public class ProcessAgentLauncher implements AgentLauncher {

    private static final Logger log = LoggerFactory.getLogger(ProcessAgentLauncher.class);

    @Override
    public LaunchedWorker launch(AgentBlueprint blueprint, TaskDirectory directory, Path workingDir,
                                 Map<String, String> environment) {
        if (blueprint.command().isEmpty()) {
            throw new SpawnFailureException(blueprint.name(), directory.taskId(),
                new IllegalStateException("blueprint declares no command"));
        }

        ProcessBuilder builder = new ProcessBuilder(blueprint.command())
            .directory(workingDir.toFile())
            .redirectOutput(ProcessBuilder.Redirect.appendTo(directory.stdoutLog().toFile()))
            .redirectError(ProcessBuilder.Redirect.appendTo(directory.stderrLog().toFile()));
        builder.environment().putAll(environment);

        try {
            Process process = builder.start();
            log.info("Started {} for task {} as pid {}", blueprint.name(), directory.taskId(), process.pid());
            return new LaunchedWorker(process.pid(), process.onExit().thenApply(Process::exitValue));
        } catch (IOException e) {
            throw new SpawnFailureException(blueprint.name(), directory.taskId(), e);
        }
    }
}
