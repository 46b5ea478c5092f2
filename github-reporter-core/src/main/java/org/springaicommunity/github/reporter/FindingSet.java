package org.springaicommunity.github.reporter;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * The findings produced by one review run, as four ordered lists.
 *
 * <p>
 * Immutable. Each list may only contain findings of its own kind.
 *
 * @param warnings findings of kind {@link FindingKind#WARNING}
 * @param errors findings of kind {@link FindingKind#ERROR}
 * @param messages findings of kind {@link FindingKind#MESSAGE}
 * @param markdowns findings of kind {@link FindingKind#MARKDOWN}
 */
public record FindingSet(List<Finding> warnings, List<Finding> errors, List<Finding> messages,
		List<Finding> markdowns) {

	public FindingSet {
		warnings = checkKind(FindingKind.WARNING, warnings);
		errors = checkKind(FindingKind.ERROR, errors);
		messages = checkKind(FindingKind.MESSAGE, messages);
		markdowns = checkKind(FindingKind.MARKDOWN, markdowns);
	}

	public static FindingSet empty() {
		return new FindingSet(List.of(), List.of(), List.of(), List.of());
	}

	/**
	 * Create a set by distributing findings to the list of their kind, preserving order.
	 * @param findings findings of any kind
	 * @return the finding set
	 */
	public static FindingSet of(Finding... findings) {
		return of(List.of(findings));
	}

	public static FindingSet of(List<Finding> findings) {
		Map<FindingKind, List<Finding>> byKind = new EnumMap<>(FindingKind.class);
		for (FindingKind kind : FindingKind.values()) {
			byKind.put(kind, new ArrayList<>());
		}
		for (Finding finding : findings) {
			byKind.get(finding.kind()).add(finding);
		}
		return new FindingSet(byKind.get(FindingKind.WARNING), byKind.get(FindingKind.ERROR),
				byKind.get(FindingKind.MESSAGE), byKind.get(FindingKind.MARKDOWN));
	}

	public List<Finding> get(FindingKind kind) {
		return switch (kind) {
			case WARNING -> warnings;
			case ERROR -> errors;
			case MESSAGE -> messages;
			case MARKDOWN -> markdowns;
		};
	}

	/**
	 * Returns true when the run has nothing to say in any of the four kinds.
	 * @return true if all lists are empty
	 */
	public boolean isEmpty() {
		return warnings.isEmpty() && errors.isEmpty() && messages.isEmpty() && markdowns.isEmpty();
	}

	public int errorCount() {
		return errors.size();
	}

	public int warningCount() {
		return warnings.size();
	}

	/**
	 * Drop the warnings and errors the pull request author asked to ignore. Messages and
	 * markdown notes are never suppressed.
	 * @param ignoreSet tokens parsed from the pull request description
	 * @return a new set without the ignored warnings and errors
	 */
	public FindingSet withoutIgnored(IgnoreSet ignoreSet) {
		if (ignoreSet.isEmpty()) {
			return this;
		}
		return new FindingSet(filter(warnings, ignoreSet), filter(errors, ignoreSet), messages, markdowns);
	}

	private static List<Finding> filter(List<Finding> findings, IgnoreSet ignoreSet) {
		return findings.stream().filter(finding -> !ignoreSet.contains(finding.message())).toList();
	}

	private static List<Finding> checkKind(FindingKind kind, List<Finding> findings) {
		if (findings == null) {
			return List.of();
		}
		for (Finding finding : findings) {
			if (finding.kind() != kind) {
				throw new IllegalArgumentException(
						"Expected only " + kind + " findings but got " + finding.kind() + ": " + finding.message());
			}
		}
		return List.copyOf(findings);
	}

}
