package org.springaicommunity.github.reporter;

import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * Converges the report comment of one reporter identity with the current findings.
 *
 * <p>
 * Exactly one of three actions runs, decided in this order:
 * <ol>
 * <li><b>delete</b> when the previous report has no ledger and the current findings are
 * empty: every report comment of the identity is removed (nothing happens when there is
 * none);</li>
 * <li><b>update</b> when a report comment exists: the most recent one is edited in place
 * and older duplicates are removed;</li>
 * <li><b>create</b> otherwise: a new report comment is posted.</li>
 * </ol>
 * Afterwards at most one report comment of the identity is left on the pull request.
 * Comments of other identities and human comments are never touched.
 */
public class ReportReconciler {

	private static final Logger logger = LoggerFactory.getLogger(ReportReconciler.class);

	private final ReviewService reviewService;

	private final ReportCommentClassifier classifier;

	private final ReportRenderer renderer;

	public ReportReconciler(ReviewService reviewService, ReportCommentClassifier classifier,
			ReportRenderer renderer) {
		this.reviewService = reviewService;
		this.classifier = classifier;
		this.renderer = renderer;
	}

	/**
	 * Reconcile the report comment.
	 * @param pr the pull request
	 * @param reportComments this identity's report comments, oldest first (as returned by
	 * {@link ReportCommentClassifier#classify(List, String)})
	 * @param findings the current findings
	 * @param dangerId the reporter identity
	 * @return the action taken and the URL of the comment left standing
	 */
	public ReconcileOutcome reconcile(PullRequestRef pr, List<ReportComment> reportComments, FindingSet findings,
			String dangerId) {
		@Nullable
		ReportComment latest = reportComments.isEmpty() ? null : reportComments.get(reportComments.size() - 1);
		ViolationLedger previous = latest == null ? ViolationLedger.empty()
				: classifier.parseLedger(latest.body()).orElse(ViolationLedger.empty());

		if (previous.isEmpty() && findings.isEmpty()) {
			if (reportComments.isEmpty()) {
				logger.info("Nothing to report on {}#{} for '{}'", pr.repoSlug(), pr.pullRequestId(), dangerId);
				return ReconcileOutcome.noOp();
			}
			for (ReportComment comment : reportComments) {
				reviewService.deleteComment(pr.repoSlug(), comment.id());
			}
			logger.info("Nothing to report, deleted {} report comment(s) on {}#{} for '{}'", reportComments.size(),
					pr.repoSlug(), pr.pullRequestId(), dangerId);
			return ReconcileOutcome.deleted();
		}

		String body = renderer.render(findings, previous, dangerId);

		if (latest == null) {
			CommentResult created = reviewService.createComment(pr.repoSlug(), pr.pullRequestId(), body);
			logger.info("Created report comment {} on {}#{}", created.id(), pr.repoSlug(), pr.pullRequestId());
			return ReconcileOutcome.created(created);
		}

		CommentResult updated = reviewService.updateComment(pr.repoSlug(), latest.id(), body);
		for (ReportComment comment : reportComments) {
			if (comment.id() != latest.id()) {
				logger.debug("Deleting duplicate report comment {}", comment.id());
				reviewService.deleteComment(pr.repoSlug(), comment.id());
			}
		}
		logger.info("Updated report comment {} on {}#{}", updated.id(), pr.repoSlug(), pr.pullRequestId());
		return ReconcileOutcome.updated(updated);
	}

}
