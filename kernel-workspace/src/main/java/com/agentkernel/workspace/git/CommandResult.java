package com.agentkernel.workspace.git;

/**
 * Exit code and combined stdout/stderr of an external command.
 */
public record CommandResult(int exitCode, String output) {

    public boolean succeeded() {
        return exitCode == 0;
    }

    public String trimmed() {
        return output == null ? "" : output.trim();
    }
}
