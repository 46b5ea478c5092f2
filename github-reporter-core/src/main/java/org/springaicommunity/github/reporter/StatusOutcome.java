package org.springaicommunity.github.reporter;

import org.jspecify.annotations.Nullable;

import java.util.ArrayList;
import java.util.List;

/**
 * The commit status derived from a run's findings.
 *
 * @param state success when the run found no errors, failure otherwise
 * @param description short summary counting errors and warnings
 * @param targetUrl link to the report comment (null when no comment is left standing)
 */
public record StatusOutcome(StatusState state, String description, @Nullable String targetUrl) {

	static final String ALL_GREEN = "All green";

	/**
	 * Derive the status for a finding set. Only the error count decides the state.
	 * @param findings the findings of the run
	 * @param targetUrl the details URL to link the status to
	 * @return the status outcome
	 */
	public static StatusOutcome from(FindingSet findings, @Nullable String targetUrl) {
		StatusState state = findings.errorCount() == 0 ? StatusState.SUCCESS : StatusState.FAILURE;
		return new StatusOutcome(state, describe(findings), targetUrl);
	}

	static String describe(FindingSet findings) {
		List<String> parts = new ArrayList<>();
		if (findings.errorCount() > 0) {
			parts.add(Pluralizer.pluralize(findings.errorCount(), "error"));
		}
		if (findings.warningCount() > 0) {
			parts.add(Pluralizer.pluralize(findings.warningCount(), "warning"));
		}
		return parts.isEmpty() ? ALL_GREEN : String.join(", ", parts);
	}

	public boolean isSuccess() {
		return state == StatusState.SUCCESS;
	}

}
