package org.springaicommunity.github.reporter;

import java.util.List;

/**
 * Interface for the GitHub REST API operations the reporter needs.
 *
 * <p>
 * Returns strongly-typed DTOs instead of raw JSON to provide type safety and encapsulate
 * the GitHub API response structure. Failures surface as
 * {@link GitHubHttpClient.GitHubApiException}.
 */
public interface ReviewService {

	/**
	 * Get a pull request.
	 * @param repoSlug Repository in "owner/repo" format
	 * @param number Pull request number
	 * @return the pull request details needed by a run
	 */
	PullRequestRef getPullRequest(String repoSlug, int number);

	/**
	 * Get all comments on the issue behind a pull request, oldest first. Every page is
	 * retrieved.
	 * @param repoSlug Repository in "owner/repo" format
	 * @param number Pull request number
	 * @return all issue comments
	 */
	List<ReportComment> getIssueComments(String repoSlug, int number);

	/**
	 * Post a new comment on the issue behind a pull request.
	 * @param repoSlug Repository in "owner/repo" format
	 * @param number Pull request number
	 * @param body Comment body
	 * @return id and URL of the new comment
	 */
	CommentResult createComment(String repoSlug, int number, String body);

	/**
	 * Replace the body of an existing comment, keeping its id.
	 * @param repoSlug Repository in "owner/repo" format
	 * @param commentId Comment id
	 * @param body New comment body
	 * @return id and URL of the comment
	 */
	CommentResult updateComment(String repoSlug, long commentId, String body);

	/**
	 * Delete a comment.
	 * @param repoSlug Repository in "owner/repo" format
	 * @param commentId Comment id
	 */
	void deleteComment(String repoSlug, long commentId);

	/**
	 * Set a commit status. Fails with a permission-denied
	 * {@link GitHubHttpClient.GitHubApiException} when the token cannot write to the
	 * repository.
	 * @param repoSlug Repository in "owner/repo" format
	 * @param sha Commit sha
	 * @param status State, description and target URL
	 * @param context Context identifying this check among others on the commit
	 */
	void setCommitStatus(String repoSlug, String sha, StatusOutcome status, String context);

}
