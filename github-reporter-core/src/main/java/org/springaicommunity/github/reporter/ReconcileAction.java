package org.springaicommunity.github.reporter;

/**
 * What the reconciler did to the report comment.
 */
public enum ReconcileAction {

	/** A new report comment was posted. */
	CREATED,

	/** The existing report comment was edited in place. */
	UPDATED,

	/** Nothing to report, existing report comments were removed. */
	DELETED,

	/** Nothing to report and nothing had been reported before. */
	NO_OP

}
