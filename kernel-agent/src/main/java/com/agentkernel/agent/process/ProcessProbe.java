package com.agentkernel.agent.process;

/**
 * Checks whether a worker process is still running.
 */
@FunctionalInterface
public interface ProcessProbe {

    Liveness probe(long pid);
}
