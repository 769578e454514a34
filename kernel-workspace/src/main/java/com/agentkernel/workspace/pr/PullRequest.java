package com.agentkernel.workspace.pr;

/**
 * @param url     web URL, stored as the task's PR reference
 * @param number  PR number when the host reports one
 * @param created false when an existing PR for the branch was found
 */
public record PullRequest(String url, Integer number, boolean created) {
}
