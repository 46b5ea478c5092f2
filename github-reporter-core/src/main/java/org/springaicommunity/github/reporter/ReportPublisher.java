package org.springaicommunity.github.reporter;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Publishes the findings of one review run to a pull request: a single report comment and
 * a commit status.
 *
 * <p>
 * One instance serves one run and may publish only once; a second call would post a
 * second set of results. Use {@link GitHubReporterBuilder#buildPublisher(String, int)} to
 * create one.
 */
public class ReportPublisher {

	private static final Logger logger = LoggerFactory.getLogger(ReportPublisher.class);

	private final ReviewService reviewService;

	private final IgnoreDirectiveScanner ignoreScanner;

	private final ReportCommentClassifier classifier;

	private final ReportReconciler reconciler;

	private final CommitStatusSubmitter statusSubmitter;

	private final ReporterProperties properties;

	private final String repoSlug;

	private final int pullRequestId;

	private final AtomicBoolean published = new AtomicBoolean(false);

	public ReportPublisher(ReviewService reviewService, IgnoreDirectiveScanner ignoreScanner,
			ReportCommentClassifier classifier, ReportReconciler reconciler, CommitStatusSubmitter statusSubmitter,
			ReporterProperties properties, String repoSlug, int pullRequestId) {
		this.reviewService = reviewService;
		this.ignoreScanner = ignoreScanner;
		this.classifier = classifier;
		this.reconciler = reconciler;
		this.statusSubmitter = statusSubmitter;
		this.properties = properties;
		this.repoSlug = repoSlug;
		this.pullRequestId = pullRequestId;
	}

	/**
	 * Publish with the configured reporter identity.
	 * @param findings the findings of the run
	 * @return the result of the run
	 */
	public PublishResult publish(FindingSet findings) {
		return publish(findings, properties.getDangerId());
	}

	/**
	 * Publish the findings of the run under the given reporter identity.
	 * @param findings the findings of the run
	 * @param dangerId the reporter identity
	 * @return {@link PublishResult.Completed}, or {@link PublishResult.FatalAbort} when
	 * the run must be failed
	 * @throws IllegalStateException if this publisher has already published
	 * @throws GitHubHttpClient.GitHubApiException if the pull request cannot be fetched
	 * or any other API call fails
	 */
	public PublishResult publish(FindingSet findings, String dangerId) {
		if (!published.compareAndSet(false, true)) {
			throw new IllegalStateException("Results have already been published for " + repoSlug + "#"
					+ pullRequestId + " in this run");
		}

		PullRequestRef pr = reviewService.getPullRequest(repoSlug, pullRequestId);
		logger.debug("Publishing to {} (head {}, {})", pr.htmlUrl(), pr.headCommitSha(), pr.visibility());

		FindingSet effective = findings;
		if (properties.isApplyIgnoreDirectives()) {
			IgnoreSet ignored = ignoreScanner.scan(pr.description());
			effective = findings.withoutIgnored(ignored);
			int suppressed = findings.errorCount() + findings.warningCount() - effective.errorCount()
					- effective.warningCount();
			if (suppressed > 0) {
				logger.info("Ignoring {} finding(s) silenced in the pull request description", suppressed);
			}
		}

		List<ReportComment> comments = reviewService.getIssueComments(repoSlug, pullRequestId);
		List<ReportComment> reportComments = classifier.classify(comments, dangerId);
		logger.debug("Found {} report comment(s) for '{}' among {} comment(s)", reportComments.size(), dangerId,
				comments.size());

		ReconcileOutcome reconcile = reconciler.reconcile(pr, reportComments, effective, dangerId);

		StatusSubmission submission = statusSubmitter.submit(effective, pr, reconcile.detailsUrl());
		if (submission.isAborted()) {
			return new PublishResult.FatalAbort(submission.abortMessage());
		}
		return new PublishResult.Completed(reconcile, submission.outcome(), submission.submitted());
	}

}
