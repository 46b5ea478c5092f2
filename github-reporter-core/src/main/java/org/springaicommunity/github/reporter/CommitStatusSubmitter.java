package org.springaicommunity.github.reporter;

import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.PrintStream;

/**
 * Records the outcome of a run as a commit status on the pull request head.
 *
 * <p>
 * Tokens without write access to the repository (typical for forks and read-only bots on
 * open source projects) cannot set a status. That is an expected mode of operation:
 * <ul>
 * <li>without errors, the status description is printed to the console and the run
 * continues;</li>
 * <li>with errors, the submission is aborted so the build still fails, with a message that
 * tells private repositories apart (where granting access fixes it) from public ones.</li>
 * </ul>
 */
public class CommitStatusSubmitter {

	private static final Logger logger = LoggerFactory.getLogger(CommitStatusSubmitter.class);

	static final String MISSING_COMMIT_MESSAGE = "Couldn't find a commit to update its status";

	private final ReviewService reviewService;

	private final String context;

	private final PrintStream console;

	public CommitStatusSubmitter(ReviewService reviewService, String context, PrintStream console) {
		this.reviewService = reviewService;
		this.context = context;
		this.console = console;
	}

	/**
	 * Compute and submit the commit status for a run.
	 * @param findings the findings of the run
	 * @param pr the pull request whose head commit receives the status
	 * @param detailsUrl link to the report comment (null when none is left standing)
	 * @return the submission, aborted when the run must be failed
	 */
	public StatusSubmission submit(FindingSet findings, PullRequestRef pr, @Nullable String detailsUrl) {
		StatusOutcome outcome = StatusOutcome.from(findings, detailsUrl);

		if (!pr.hasHeadCommit()) {
			logger.error("Pull request {}#{} has no head commit sha", pr.repoSlug(), pr.pullRequestId());
			return StatusSubmission.aborted(outcome, MISSING_COMMIT_MESSAGE);
		}

		try {
			reviewService.setCommitStatus(pr.repoSlug(), pr.headCommitSha(), outcome, context);
			logger.info("Set status '{}' ({}) on {}", outcome.state().value(), outcome.description(),
					pr.headCommitSha());
			return StatusSubmission.submitted(outcome);
		}
		catch (GitHubHttpClient.GitHubApiException e) {
			if (!e.isPermissionDenied()) {
				throw e;
			}
			logger.warn("No write access to set a status on {}: {}", pr.repoSlug(), e.getMessage());
			if (findings.errorCount() == 0) {
				console.println(outcome.description());
				return StatusSubmission.skipped(outcome);
			}
			return StatusSubmission.aborted(outcome, abortMessage(findings.errorCount(), pr.visibility()));
		}
	}

	static String abortMessage(int errorCount, RepoVisibility visibility) {
		String found = "Found " + Pluralizer.pluralize(errorCount, "error");
		if (visibility == RepoVisibility.PRIVATE) {
			return "Danger has failed this build. \n" + found
					+ " and I don't have write access to the PR to set a PR status.";
		}
		return "Danger has failed this build. \n" + found + ".";
	}

}
