package com.agentkernel.workspace.pr;

import com.agentkernel.core.exception.WorkspaceException;
import com.agentkernel.workspace.git.CommandResult;
import com.agentkernel.workspace.git.CommandRunner;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.util.Locale;

/**
 * Pull requests through the GitHub {@code gh} CLI.
 */
public class GhCliPullRequestClient implements PullRequestClient {

    private static final Logger log = LoggerFactory.getLogger(GhCliPullRequestClient.class);

    static final String VIEW_QUERY = ".url + \" \" + (.number|tostring)";

    private final CommandRunner runner;
    private final String mergeMethod;

    public GhCliPullRequestClient(CommandRunner runner, String mergeMethod) {
        this.runner = runner;
        this.mergeMethod = mergeMethod == null || mergeMethod.isBlank() ? "merge" : mergeMethod;
    }

    @Override
    public PullRequest createOrFind(Path worktree, String branch, String baseBranch, String title, String body) {
        PullRequest existing = view(worktree, branch);
        if (existing != null) {
            log.debug("PR already open for {}: {}", branch, existing.url());
            return existing;
        }

        CommandResult created = runner.gh(worktree, "pr", "create",
            "--base", baseBranch, "--head", branch, "--title", title, "--body", body != null ? body : "");
        if (!created.succeeded()) {
            if (created.output().contains("already exists")) {
                PullRequest raced = view(worktree, branch);
                if (raced != null) {
                    return raced;
                }
            }
            throw new WorkspaceException("gh pr create failed for " + branch + ": " + created.trimmed());
        }

        String url = lastLine(created.trimmed());
        log.info("Opened PR {} for {}", url, branch);
        return new PullRequest(url, parseNumber(url), true);
    }

    @Override
    public MergeOutcome merge(Path worktree, String reference) {
        CommandResult merged = runner.gh(worktree, "pr", "merge", reference, "--" + mergeMethod);
        if (merged.succeeded()) {
            log.info("Merged PR {}", reference);
            return MergeOutcome.MERGED;
        }
        String output = merged.trimmed();
        String lower = output.toLowerCase(Locale.ROOT);
        if (lower.contains("conflict") || lower.contains("not mergeable")) {
            log.info("PR {} does not merge cleanly: {}", reference, output);
            return MergeOutcome.CONFLICT;
        }
        throw new WorkspaceException("gh pr merge failed for " + reference + ": " + output);
    }

    private PullRequest view(Path worktree, String branch) {
        CommandResult viewed = runner.gh(worktree, "pr", "view", branch, "--json", "url,number", "-q", VIEW_QUERY);
        if (!viewed.succeeded() || viewed.trimmed().isEmpty()) {
            return null;
        }
        String[] parts = viewed.trimmed().split(" ", 2);
        Integer number = parts.length > 1 ? parseInt(parts[1]) : null;
        return new PullRequest(parts[0], number, false);
    }

    static Integer parseNumber(String url) {
        int slash = url.lastIndexOf('/');
        return slash >= 0 ? parseInt(url.substring(slash + 1)) : null;
    }

    private static Integer parseInt(String text) {
        try {
            return Integer.valueOf(text.trim());
        } catch (NumberFormatException e) {
            return null;
        }
    }

    private static String lastLine(String output) {
        int newline = output.lastIndexOf('\n');
        return newline >= 0 ? output.substring(newline + 1).trim() : output;
    }
}
