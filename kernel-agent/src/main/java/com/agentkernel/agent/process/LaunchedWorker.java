package com.agentkernel.agent.process;

import java.util.concurrent.CompletableFuture;

/**
 * A started worker process.
 *
 * @param pid  operating system process id
 * @param exit completes with the exit code when the process terminates
 */
public record LaunchedWorker(long pid, CompletableFuture<Integer> exit) {
}
