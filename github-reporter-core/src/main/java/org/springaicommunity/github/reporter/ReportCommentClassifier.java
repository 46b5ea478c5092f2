package org.springaicommunity.github.reporter;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Finds this reporter's comments among all comments of a pull request and recovers the
 * ledger of sticky findings from a previous report.
 */
public class ReportCommentClassifier {

	private static final Pattern TABLE = Pattern.compile("<table>(.*?)</table>",
			Pattern.DOTALL | Pattern.CASE_INSENSITIVE);

	private static final Pattern TABLE_KIND = Pattern.compile("data-kind=\"([^\"]*)\"", Pattern.CASE_INSENSITIVE);

	private static final Pattern STICKY_ROW = Pattern.compile(
			"<td data-sticky=\"true\">(?:<del>)?(.*?)(?:</del>)?\\s*</td>", Pattern.DOTALL | Pattern.CASE_INSENSITIVE);

	/**
	 * Select the comments generated for {@code dangerId}, keeping their order.
	 * @param comments all comments on the pull request, oldest first
	 * @param dangerId the reporter identity
	 * @return this identity's report comments, oldest first
	 */
	public List<ReportComment> classify(List<ReportComment> comments, String dangerId) {
		return comments.stream().filter(comment -> ReportSignature.isGeneratedBy(comment.body(), dangerId)).toList();
	}

	/**
	 * Parse the sticky findings listed in a rendered report body.
	 * @param body a report body
	 * @return the ledger, or empty when the body holds no report tables or no sticky rows
	 */
	public Optional<ViolationLedger> parseLedger(String body) {
		Map<FindingKind, List<String>> entries = new EnumMap<>(FindingKind.class);
		Matcher tables = TABLE.matcher(body);
		while (tables.find()) {
			String table = tables.group(1);
			Matcher kindMatcher = TABLE_KIND.matcher(table);
			if (!kindMatcher.find()) {
				continue;
			}
			Optional<FindingKind> kind = kindFromTitle(kindMatcher.group(1));
			if (kind.isEmpty()) {
				continue;
			}
			Matcher rows = STICKY_ROW.matcher(table);
			while (rows.find()) {
				entries.computeIfAbsent(kind.get(), k -> new ArrayList<>()).add(rows.group(1).strip());
			}
		}
		ViolationLedger ledger = new ViolationLedger(entries);
		return ledger.isEmpty() ? Optional.empty() : Optional.of(ledger);
	}

	static Optional<FindingKind> kindFromTitle(String title) {
		String lower = title.toLowerCase(Locale.ROOT);
		if (lower.contains("error")) {
			return Optional.of(FindingKind.ERROR);
		}
		if (lower.contains("warning")) {
			return Optional.of(FindingKind.WARNING);
		}
		if (lower.contains("message")) {
			return Optional.of(FindingKind.MESSAGE);
		}
		return Optional.empty();
	}

}
