package org.springaicommunity.github.reporter;

import org.jspecify.annotations.Nullable;

/**
 * Result of submitting a commit status.
 *
 * @param outcome the status computed for the run
 * @param submitted whether the status was recorded on the commit
 * @param abortMessage set when the run must be failed because the outcome could not be
 * recorded
 */
public record StatusSubmission(StatusOutcome outcome, boolean submitted, @Nullable String abortMessage) {

	public static StatusSubmission submitted(StatusOutcome outcome) {
		return new StatusSubmission(outcome, true, null);
	}

	public static StatusSubmission skipped(StatusOutcome outcome) {
		return new StatusSubmission(outcome, false, null);
	}

	public static StatusSubmission aborted(StatusOutcome outcome, String message) {
		return new StatusSubmission(outcome, false, message);
	}

	public boolean isAborted() {
		return abortMessage != null;
	}

}
