package com.agentkernel.agent.runtime;

import java.nio.file.Path;

/**
 * The per-task runtime directory a worker reads its inputs from and writes
 * its result to.
 */
public record TaskDirectory(String taskId, Path path) {

    public static final String TASK_FILE = "task.json";
    public static final String ENV_FILE = "env.sh";
    public static final String NOTES_FILE = "notes.md";
    public static final String STDOUT_LOG = "stdout.log";
    public static final String STDERR_LOG = "stderr.log";
    public static final String RESULT_FILE = "result.json";
    public static final String EXIT_CODE_FILE = "exit_code";
    public static final String WORKER_FILE = "worker.json";

    public Path taskFile() {
        return path.resolve(TASK_FILE);
    }

    public Path envFile() {
        return path.resolve(ENV_FILE);
    }

    public Path notesFile() {
        return path.resolve(NOTES_FILE);
    }

    public Path stdoutLog() {
        return path.resolve(STDOUT_LOG);
    }

    public Path stderrLog() {
        return path.resolve(STDERR_LOG);
    }

    public Path resultFile() {
        return path.resolve(RESULT_FILE);
    }

    public Path exitCodeFile() {
        return path.resolve(EXIT_CODE_FILE);
    }

    public Path workerFile() {
        return path.resolve(WORKER_FILE);
    }
}
