package org.springaicommunity.github.reporter;

/**
 * The four kinds of finding a review run can produce.
 */
public enum FindingKind {

	WARNING("Warning"),

	ERROR("Error"),

	MESSAGE("Message"),

	MARKDOWN("Markdown");

	private final String title;

	FindingKind(String title) {
		this.title = title;
	}

	/**
	 * Human-readable singular title, used as the table heading of the rendered report.
	 * @return title such as "Error"
	 */
	public String title() {
		return title;
	}

}
