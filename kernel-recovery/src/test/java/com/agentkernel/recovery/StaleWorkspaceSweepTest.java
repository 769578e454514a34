package com.agentkernel.recovery;

import com.agentkernel.agent.runtime.TaskDirectory;
import com.agentkernel.core.model.CheckStatus;
import com.agentkernel.core.model.Task;
import com.agentkernel.workspace.git.WorkspaceManager;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class StaleWorkspaceSweepTest {

    @TempDir
    Path runtimeDir;

    private RecoveryFixture kernel;
    private WorkspaceManager workspaces;
    private StaleWorkspaceSweep sweep;

    @BeforeEach
    void setUp() {
        kernel = new RecoveryFixture(runtimeDir);
        workspaces = mock(WorkspaceManager.class);
        when(workspaces.branchNameFor(any(Task.class)))
            .thenAnswer(inv -> "agent/" + inv.<Task>getArgument(0).id());
        sweep = new StaleWorkspaceSweep(kernel.repository, workspaces, kernel.directories, kernel.time,
            Duration.ofHours(1));
    }

    private void withWorkspace(String... taskIds) {
        when(workspaces.listWorkspaceTaskIds()).thenReturn(List.of(taskIds));
        for (String id : taskIds) {
            when(workspaces.exists(id)).thenReturn(true);
        }
    }

    private Task accepted(String id) {
        kernel.claimedForWork(id);
        kernel.tasks.submit(id);
        kernel.tasks.recordCheckResult(id, "gatekeeper-review", CheckStatus.PASS, "ok");
        return kernel.tasks.accept(id).task();
    }

    @Test
    @DisplayName("Done tasks past the grace period are archived and their branch deleted")
    void testDoneTaskCleanedUp() throws IOException {
        accepted("T-1");
        TaskDirectory dir = kernel.directories.forTask("T-1");
        Files.createDirectories(dir.path());
        Files.writeString(dir.stdoutLog(), "log");
        withWorkspace("T-1");
        kernel.time.advanceHours(2);

        assertThat(sweep.run()).isEqualTo(1);

        verify(workspaces).cleanup("T-1");
        verify(workspaces).deleteRemoteBranch("agent/T-1");
        assertThat(dir.path()).doesNotExist();
    }

    @Test
    @DisplayName("Tasks inside the grace period keep their workspace")
    void testRecentTaskKept() {
        accepted("T-1");
        withWorkspace("T-1");
        kernel.time.advanceMinutes(30);

        assertThat(sweep.run()).isZero();
        verify(workspaces, never()).cleanup(anyString());
    }

    @Test
    @DisplayName("A done task that still needs a rebase keeps its remote branch")
    void testNeedsRebaseKeepsBranch() {
        accepted("T-1");
        kernel.tasks.markNeedsRebase("T-1", true, "conflicts with main");
        withWorkspace("T-1");
        kernel.time.advanceHours(2);

        sweep.run();

        verify(workspaces).cleanup("T-1");
        verify(workspaces, never()).deleteRemoteBranch(anyString());
    }

    @Test
    @DisplayName("Failed and rejected tasks lose their worktree but never their remote branch")
    void testFailedAndRejectedTasks() {
        kernel.claimedForWork("T-1");
        kernel.tasks.fail("T-1", "gave up");
        kernel.claimedForWork("T-2");
        kernel.tasks.submit("T-2");
        kernel.tasks.reject("T-2", "wrong approach");
        withWorkspace("T-1", "T-2");
        kernel.time.advanceHours(2);

        assertThat(sweep.run()).isEqualTo(2);

        verify(workspaces).cleanup("T-1");
        verify(workspaces).cleanup("T-2");
        verify(workspaces, never()).deleteRemoteBranch(anyString());
    }

    @Test
    @DisplayName("Workspaces of tasks unknown to the store are removed")
    void testUnknownTaskRemoved() {
        withWorkspace("T-gone");

        assertThat(sweep.run()).isEqualTo(1);
        verify(workspaces).cleanup("T-gone");
    }
}
