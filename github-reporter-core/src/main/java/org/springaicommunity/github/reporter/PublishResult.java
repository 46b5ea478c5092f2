package org.springaicommunity.github.reporter;

/**
 * Terminal result of publishing a run's findings.
 *
 * <p>
 * A {@link FatalAbort} means the run must be failed: the caller is expected to print the
 * message and exit with a non-zero status. The core never exits the process itself.
 */
public sealed interface PublishResult permits PublishResult.Completed, PublishResult.FatalAbort {

	/**
	 * Publishing finished; the run is not failed by the reporter (the status itself may
	 * still be a failure).
	 *
	 * @param reconcile what happened to the report comment
	 * @param status the status computed for the run
	 * @param statusSubmitted false when the status could not be recorded for lack of
	 * write access and the run had no errors
	 */
	record Completed(ReconcileOutcome reconcile, StatusOutcome status, boolean statusSubmitted)
			implements PublishResult {
	}

	/**
	 * The run must be aborted.
	 *
	 * @param message explanation for the user
	 */
	record FatalAbort(String message) implements PublishResult {
	}

}
