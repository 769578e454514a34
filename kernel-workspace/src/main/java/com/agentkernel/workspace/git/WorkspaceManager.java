package com.agentkernel.workspace.git;

import com.agentkernel.core.exception.WorkspaceException;
import com.agentkernel.core.model.Task;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.stream.Stream;

/**
 * Manages one isolated git worktree per task.
 *
 * <p>Layout under the workspace root:
 * <pre>
 *   {root}/{taskId}/worktree              detached worktree the agent edits
 *   {root}/{taskId}/worktree-origin.json  ref and commit it was created from
 * </pre>
 *
 * <p>A worktree is reused only while it still descends from what it was
 * created from: the recorded ref must equal the task's branch and the
 * recorded commit must be an ancestor of HEAD. Anything else is recreated.
 */
public class WorkspaceManager {

    private static final Logger log = LoggerFactory.getLogger(WorkspaceManager.class);

    static final String WORKTREE_DIR = "worktree";
    static final String ORIGIN_FILE = "worktree-origin.json";
    private static final String DETACHED = "HEAD";

    private final WorkspaceSettings settings;
    private final CommandRunner runner;
    private final ObjectMapper objectMapper;

    public WorkspaceManager(WorkspaceSettings settings, CommandRunner runner, ObjectMapper objectMapper) {
        this.settings = settings;
        this.runner = runner;
        this.objectMapper = objectMapper;
    }

    public Path taskDirectory(String taskId) {
        return settings.root().resolve(taskId);
    }

    public Path worktreePath(String taskId) {
        return taskDirectory(taskId).resolve(WORKTREE_DIR);
    }

    public boolean exists(String taskId) {
        return Files.isDirectory(worktreePath(taskId));
    }

    /**
     * Branch name a task's work is pushed under.
     */
    public String branchNameFor(Task task) {
        return settings.branchPrefix() + task.id();
    }

    /**
     * Create or reuse the worktree for a task, based on {@code task.branch()}.
     *
     * @return the prepared workspace
     * @throws WorkspaceException if neither the local nor the remote ref can be checked out
     */
    public Workspace prepare(Task task) {
        Path worktree = worktreePath(task.id());
        Optional<Origin> recorded = readOrigin(task.id());

        if (Files.isDirectory(worktree) && recorded.isPresent()) {
            Origin origin = recorded.get();
            if (origin.ref().equals(task.branch()) && isAncestorOfHead(worktree, origin.commit())) {
                log.info("Reusing worktree for {} at {} (from {})", task.id(), worktree, origin.ref());
                return new Workspace(task.id(), worktree, origin.ref(), origin.commit(), true);
            }
            log.info("Worktree for {} no longer matches {} ({}), recreating",
                task.id(), task.branch(), origin.ref());
        }

        if (Files.exists(worktree)) {
            removeWorktree(worktree);
        }
        return create(task, worktree);
    }

    private Workspace create(Task task, Path worktree) {
        try {
            Files.createDirectories(worktree.getParent());
        } catch (IOException e) {
            throw new WorkspaceException("Cannot create task directory " + worktree.getParent(), e);
        }

        String ref = task.branch();
        CommandResult added = runner.git(settings.repoRoot(),
            "worktree", "add", "--detach", worktree.toString(), ref);
        if (!added.succeeded()) {
            String remoteRef = settings.remote() + "/" + task.branch();
            log.debug("No local {} for {}, trying {}", ref, task.id(), remoteRef);
            runner.git(settings.repoRoot(), "fetch", settings.remote(), task.branch());
            added = runner.git(settings.repoRoot(), "worktree", "add", "--detach", worktree.toString(), remoteRef);
            if (!added.succeeded()) {
                throw new WorkspaceException(String.format(
                    "Cannot create worktree for %s from %s or %s: %s",
                    task.id(), ref, remoteRef, added.trimmed()));
            }
        }

        String commit = headCommit(worktree);
        writeOrigin(task.id(), new Origin(task.branch(), commit));
        log.info("Created worktree for {} at {} from {} ({})", task.id(), worktree, task.branch(), shortSha(commit));
        return new Workspace(task.id(), worktree, task.branch(), commit, false);
    }

    /**
     * Make sure the worktree is on {@code branch}: no-op when it already is,
     * create the branch at HEAD when detached.
     *
     * @throws WorkspaceException when it is on a different named branch
     */
    public String ensureNamedBranch(Path worktree, String branch) {
        String current = currentBranch(worktree);
        if (current.equals(branch)) {
            return branch;
        }
        if (!DETACHED.equals(current)) {
            throw new WorkspaceException(String.format(
                "Worktree %s is on branch '%s', expected '%s' or a detached HEAD", worktree, current, branch));
        }
        CommandResult created = runner.git(worktree, "checkout", "-b", branch);
        if (!created.succeeded()) {
            runner.gitChecked(worktree, "checkout", branch);
        }
        log.debug("Worktree {} now on {}", worktree, branch);
        return branch;
    }

    /**
     * Push the worktree's current branch to the remote.
     *
     * @param force use --force-with-lease (after a rebase)
     * @return the pushed branch
     */
    public String push(Path worktree, boolean force) {
        String branch = currentBranch(worktree);
        if (DETACHED.equals(branch)) {
            throw new WorkspaceException("Cannot push detached HEAD in " + worktree + "; name the branch first");
        }
        if (force) {
            runner.gitChecked(worktree, "push", "--force-with-lease", "-u", settings.remote(), branch);
        } else {
            runner.gitChecked(worktree, "push", "-u", settings.remote(), branch);
        }
        log.info("Pushed {} to {}", branch, settings.remote());
        return branch;
    }

    /**
     * Fetch and rebase onto {@code <remote>/<baseBranch>}. A conflicting
     * rebase is aborted before returning.
     */
    public RebaseResult rebaseOnBase(Path worktree, String baseBranch) {
        String upstream = settings.remote() + "/" + baseBranch;
        CommandResult fetched = runner.git(worktree, "fetch", settings.remote(), baseBranch);
        if (!fetched.succeeded()) {
            return RebaseResult.of(RebaseStatus.ERROR, "Failed to fetch " + upstream + ": " + fetched.trimmed());
        }

        CommandResult behind = runner.git(worktree, "rev-list", "--count", "HEAD.." + upstream);
        if (behind.succeeded() && "0".equals(behind.trimmed())) {
            return RebaseResult.of(RebaseStatus.UP_TO_DATE, "Already up to date with " + upstream);
        }

        CommandResult rebased = runner.git(worktree, "rebase", upstream);
        if (rebased.succeeded()) {
            log.info("Rebased {} onto {}", worktree, upstream);
            return RebaseResult.of(RebaseStatus.SUCCESS, "Rebased on " + upstream);
        }

        CommandResult aborted = runner.git(worktree, "rebase", "--abort");
        if (!aborted.succeeded()) {
            log.warn("rebase --abort failed in {}: {}", worktree, aborted.trimmed());
        }
        log.info("Rebase of {} onto {} conflicts", worktree, upstream);
        return new RebaseResult(RebaseStatus.CONFLICT, "Rebase conflict on " + upstream, rebased.trimmed());
    }

    /**
     * Whether merging the latest base into the worktree would conflict.
     * The trial merge is always aborted.
     */
    public boolean hasConflictsWithBase(Path worktree, String baseBranch) {
        String upstream = settings.remote() + "/" + baseBranch;
        runner.gitChecked(worktree, "fetch", settings.remote(), baseBranch);
        CommandResult merged = runner.git(worktree, "merge", "--no-commit", "--no-ff", upstream);
        CommandResult aborted = runner.git(worktree, "merge", "--abort");
        if (!aborted.succeeded()) {
            log.debug("Nothing to abort after trial merge in {}: {}", worktree, aborted.trimmed());
        }
        return !merged.succeeded();
    }

    /**
     * Remove a task's worktree and its origin record. Idempotent.
     */
    public void cleanup(String taskId) {
        Path worktree = worktreePath(taskId);
        if (Files.exists(worktree)) {
            removeWorktree(worktree);
        }
        try {
            Files.deleteIfExists(taskDirectory(taskId).resolve(ORIGIN_FILE));
        } catch (IOException e) {
            throw new WorkspaceException("Cannot delete origin record for " + taskId, e);
        }
        log.info("Removed worktree for {}", taskId);
    }

    /**
     * Delete a task branch on the remote.
     *
     * @return whether the remote accepted the deletion
     */
    public boolean deleteRemoteBranch(String branch) {
        CommandResult deleted = runner.git(settings.repoRoot(), "push", settings.remote(), "--delete", branch);
        if (deleted.succeeded()) {
            log.info("Deleted remote branch {}", branch);
            return true;
        }
        log.warn("Could not delete remote branch {}: {}", branch, deleted.trimmed());
        return false;
    }

    /**
     * IDs of tasks that currently have a worktree on disk.
     */
    public List<String> listWorkspaceTaskIds() {
        if (!Files.isDirectory(settings.root())) {
            return List.of();
        }
        List<String> ids = new ArrayList<>();
        try (Stream<Path> dirs = Files.list(settings.root())) {
            dirs.filter(dir -> Files.isDirectory(dir.resolve(WORKTREE_DIR)))
                .map(dir -> dir.getFileName().toString())
                .sorted()
                .forEach(ids::add);
        } catch (IOException e) {
            throw new WorkspaceException("Cannot list workspaces under " + settings.root(), e);
        }
        return ids;
    }

    public String headCommit(Path worktree) {
        return runner.gitChecked(worktree, "rev-parse", "HEAD").trimmed();
    }

    public String currentBranch(Path worktree) {
        return runner.gitChecked(worktree, "rev-parse", "--abbrev-ref", "HEAD").trimmed();
    }

    private boolean isAncestorOfHead(Path worktree, String commit) {
        return runner.git(worktree, "merge-base", "--is-ancestor", commit, "HEAD").succeeded();
    }

    private void removeWorktree(Path worktree) {
        CommandResult removed = runner.git(settings.repoRoot(), "worktree", "remove", "--force", worktree.toString());
        if (!removed.succeeded()) {
            log.debug("git worktree remove failed for {}: {}", worktree, removed.trimmed());
            deleteRecursively(worktree);
        }
        runner.git(settings.repoRoot(), "worktree", "prune");
    }

    private Optional<Origin> readOrigin(String taskId) {
        Path file = taskDirectory(taskId).resolve(ORIGIN_FILE);
        if (!Files.isRegularFile(file)) {
            return Optional.empty();
        }
        try {
            JsonNode node = objectMapper.readTree(file.toFile());
            String ref = node.path("ref").asText(null);
            String commit = node.path("commit").asText(null);
            if (ref == null || commit == null) {
                log.warn("Ignoring incomplete origin record {}", file);
                return Optional.empty();
            }
            return Optional.of(new Origin(ref, commit));
        } catch (IOException e) {
            log.warn("Ignoring unreadable origin record {}: {}", file, e.getMessage());
            return Optional.empty();
        }
    }

    private void writeOrigin(String taskId, Origin origin) {
        ObjectNode node = objectMapper.createObjectNode();
        node.put("ref", origin.ref());
        node.put("commit", origin.commit());
        try {
            objectMapper.writerWithDefaultPrettyPrinter()
                .writeValue(taskDirectory(taskId).resolve(ORIGIN_FILE).toFile(), node);
        } catch (IOException e) {
            throw new WorkspaceException("Cannot record worktree origin for " + taskId, e);
        }
    }

    private static void deleteRecursively(Path path) {
        if (!Files.exists(path)) {
            return;
        }
        try (Stream<Path> walk = Files.walk(path)) {
            for (Path p : walk.sorted(Comparator.reverseOrder()).toList()) {
                Files.deleteIfExists(p);
            }
        } catch (IOException e) {
            throw new WorkspaceException("Cannot delete " + path, e);
        }
    }

    private static String shortSha(String commit) {
        return commit.length() > 8 ? commit.substring(0, 8) : commit;
    }

    private record Origin(String ref, String commit) {
    }
}
