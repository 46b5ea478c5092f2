package org.springaicommunity.github.reporter;

/**
 * Commit status states used by the reporter.
 */
public enum StatusState {

	SUCCESS("success"), FAILURE("failure");

	private final String value;

	StatusState(String value) {
		this.value = value;
	}

	/**
	 * The value sent to the GitHub statuses API.
	 * @return "success" or "failure"
	 */
	public String value() {
		return value;
	}

}
