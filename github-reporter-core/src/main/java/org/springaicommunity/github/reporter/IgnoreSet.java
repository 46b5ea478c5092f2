package org.springaicommunity.github.reporter;

import java.util.List;

/**
 * Findings the pull request author asked to silence, in the order their directives appear
 * in the pull request description. Duplicates are kept.
 *
 * @param tokens the quoted tokens of each ignore directive
 */
public record IgnoreSet(List<String> tokens) {

	public IgnoreSet {
		tokens = List.copyOf(tokens);
	}

	public static IgnoreSet empty() {
		return new IgnoreSet(List.of());
	}

	public boolean contains(String message) {
		return tokens.contains(message);
	}

	public boolean isEmpty() {
		return tokens.isEmpty();
	}

}
