package org.springaicommunity.github.reporter;

import org.jspecify.annotations.Nullable;

/**
 * The pull request a run reports on, as fetched from the GitHub API at the start of the
 * run.
 *
 * @param repoSlug repository in "owner/repo" format
 * @param pullRequestId the pull request number
 * @param headCommitSha sha of the latest commit on the pull request branch (null if the
 * API did not return one)
 * @param baseCommitSha sha of the commit the pull request is based on
 * @param visibility whether the base repository is public or private
 * @param description the pull request description (may be null)
 * @param htmlUrl web URL of the pull request
 */
public record PullRequestRef(String repoSlug, int pullRequestId, @Nullable String headCommitSha,
		@Nullable String baseCommitSha, RepoVisibility visibility, @Nullable String description, String htmlUrl) {

	public boolean hasHeadCommit() {
		return headCommitSha != null && !headCommitSha.isEmpty();
	}

}
