package org.springaicommunity.github.reporter;

/**
 * Renders the body of a report comment.
 *
 * <p>
 * Implementations must be pure and must embed {@link ReportSignature#marker(String)} for
 * the given identity, otherwise the report is not recognised on the next run.
 */
public interface ReportRenderer {

	/**
	 * Render a report body.
	 * @param findings the current findings
	 * @param previousLedger sticky findings of the previous report (empty on first run)
	 * @param dangerId the reporter identity
	 * @return the comment body
	 */
	String render(FindingSet findings, ViolationLedger previousLedger, String dangerId);

}
