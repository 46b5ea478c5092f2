package org.springaicommunity.github.reporter;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Default {@link ReportRenderer}: one HTML table per kind of violation, followed by the
 * markdown notes and the signature.
 *
 * <p>
 * Rows are written as {@code <td data-sticky="...">} cells so that
 * {@link ReportCommentClassifier#parseLedger(String)} can read the sticky ones back.
 * Ledger entries that are no longer reported are kept as struck-through sticky rows.
 */
public class MarkdownReportRenderer implements ReportRenderer {

	private static final Pattern CELL_TAG = Pattern.compile("<(/?)(td|del|table)\\b", Pattern.CASE_INSENSITIVE);

	private static final List<FindingKind> TABLE_KINDS = List.of(FindingKind.ERROR, FindingKind.WARNING,
			FindingKind.MESSAGE);

	@Override
	public String render(FindingSet findings, ViolationLedger previousLedger, String dangerId) {
		StringBuilder body = new StringBuilder();
		for (FindingKind kind : TABLE_KINDS) {
			appendTable(body, kind, findings.get(kind), previousLedger.get(kind));
		}
		for (Finding markdown : findings.markdowns()) {
			body.append(markdown.message()).append("\n\n");
		}
		body.append("<p align=\"right\" data-meta=\"generated_by_").append(dangerId).append("\">\n");
		body.append("  Generated by :no_entry_sign: github-reporter\n");
		body.append("</p>\n");
		body.append(ReportSignature.marker(dangerId)).append("\n");
		return body.toString();
	}

	private void appendTable(StringBuilder body, FindingKind kind, List<Finding> current, List<String> previous) {
		// same message reported twice is shown once; sticky wins
		Map<String, Boolean> rows = new LinkedHashMap<>();
		for (Finding finding : current) {
			rows.merge(cellText(finding.message()), finding.sticky(), Boolean::logicalOr);
		}
		List<String> resolved = new ArrayList<>();
		for (String entry : previous) {
			String message = cellText(entry);
			if (!rows.containsKey(message) && !resolved.contains(message)) {
				resolved.add(message);
			}
		}
		if (rows.isEmpty() && resolved.isEmpty()) {
			return;
		}

		body.append("<table>\n");
		body.append("  <thead>\n");
		body.append("    <tr>\n");
		body.append("      <th width=\"50\"></th>\n");
		body.append("      <th width=\"100%\" data-danger-table=\"true\" data-kind=\"")
			.append(kind.title())
			.append("\">\n");
		if (rows.isEmpty()) {
			body.append("        :white_check_mark: All resolved\n");
		}
		else {
			body.append("        ").append(Pluralizer.pluralize(rows.size(), kind.title())).append("\n");
		}
		body.append("      </th>\n");
		body.append("    </tr>\n");
		body.append("  </thead>\n");
		body.append("  <tbody>\n");
		rows.forEach((message, sticky) -> appendRow(body, emoji(kind), sticky, message));
		for (String message : resolved) {
			appendRow(body, ":white_check_mark:", true, "<del>" + message + "</del>");
		}
		body.append("  </tbody>\n");
		body.append("</table>\n\n");
	}

	private void appendRow(StringBuilder body, String emoji, boolean sticky, String cell) {
		body.append("    <tr>\n");
		body.append("      <td>").append(emoji).append("</td>\n");
		body.append("      <td data-sticky=\"").append(sticky).append("\">").append(cell).append("</td>\n");
		body.append("    </tr>\n");
	}

	/**
	 * The text of a finding as written to its table cell, and therefore as it comes back
	 * from {@link ReportCommentClassifier#parseLedger(String)}. Ledger entries are
	 * compared in this form.
	 * @param message the finding message
	 * @return the stripped message with table, cell and strike-through tags neutralised
	 */
	static String cellText(String message) {
		return CELL_TAG.matcher(message.strip()).replaceAll("&lt;$1$2");
	}

	private static String emoji(FindingKind kind) {
		return switch (kind) {
			case ERROR -> ":no_entry_sign:";
			case WARNING -> ":warning:";
			default -> ":book:";
		};
	}

}
