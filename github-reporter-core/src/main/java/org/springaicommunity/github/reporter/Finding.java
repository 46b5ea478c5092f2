package org.springaicommunity.github.reporter;

import java.util.Objects;

/**
 * One item reported by a review run.
 *
 * <p>
 * Findings carry no identity beyond their content: two findings with the same kind and
 * message are the same finding within a run.
 *
 * @param kind the finding kind
 * @param message the finding text (markdown allowed)
 * @param sticky whether the finding is remembered in the report ledger, so that it is
 * still shown (struck through) after it stops being reported
 */
public record Finding(FindingKind kind, String message, boolean sticky) {

	public Finding {
		Objects.requireNonNull(kind, "kind must not be null");
		Objects.requireNonNull(message, "message must not be null");
	}

	public static Finding warning(String message) {
		return new Finding(FindingKind.WARNING, message, false);
	}

	public static Finding error(String message) {
		return new Finding(FindingKind.ERROR, message, false);
	}

	public static Finding message(String message) {
		return new Finding(FindingKind.MESSAGE, message, false);
	}

	public static Finding markdown(String message) {
		return new Finding(FindingKind.MARKDOWN, message, false);
	}

	/**
	 * Returns a copy of this finding marked as sticky.
	 * @return sticky finding with the same kind and message
	 */
	public Finding asSticky() {
		return new Finding(kind, message, true);
	}

}
