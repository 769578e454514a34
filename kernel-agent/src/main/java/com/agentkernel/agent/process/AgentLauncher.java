package com.agentkernel.agent.process;

import com.agentkernel.agent.runtime.TaskDirectory;
import com.agentkernel.core.model.AgentBlueprint;

import java.nio.file.Path;
import java.util.Map;

/**
 * Starts worker processes. Implementations return as soon as the process
 * is running; they never wait for it.
 */
public interface AgentLauncher {

    /**
     * @param blueprint   the agent to run
     * @param directory   prepared task directory, receives the logs
     * @param workingDir  directory the process runs in
     * @param environment variables added to the process environment
     */
    LaunchedWorker launch(AgentBlueprint blueprint, TaskDirectory directory, Path workingDir,
                          Map<String, String> environment);
}
