package org.springaicommunity.github.reporter;

import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Findings recovered from a previously posted report, grouped by kind.
 *
 * <p>
 * Only sticky findings are recorded. A ledger is derived fresh on every run from the most
 * recent report comment and discarded once the new report has been rendered.
 *
 * @param entries previously reported finding messages per kind; kinds without entries
 * are omitted
 */
public record ViolationLedger(Map<FindingKind, List<String>> entries) {

	public ViolationLedger {
		Map<FindingKind, List<String>> copy = new EnumMap<>(FindingKind.class);
		entries.forEach((kind, messages) -> {
			if (!messages.isEmpty()) {
				copy.put(kind, List.copyOf(messages));
			}
		});
		entries = Collections.unmodifiableMap(copy);
	}

	public static ViolationLedger empty() {
		return new ViolationLedger(Map.of());
	}

	public List<String> get(FindingKind kind) {
		return entries.getOrDefault(kind, List.of());
	}

	public boolean isEmpty() {
		return entries.isEmpty();
	}

}
