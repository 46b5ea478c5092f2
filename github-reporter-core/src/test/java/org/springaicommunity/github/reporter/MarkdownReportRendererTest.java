package org.springaicommunity.github.reporter;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.*;

@DisplayName("MarkdownReportRenderer Tests")
class MarkdownReportRendererTest {

	private final MarkdownReportRenderer renderer = new MarkdownReportRenderer();

	private final ReportCommentClassifier classifier = new ReportCommentClassifier();

	@Test
	@DisplayName("Should render an error table and the signature")
	void shouldRenderErrorTable() {
		String body = renderer.render(FindingSet.of(Finding.error("Tests are failing")), ViolationLedger.empty(),
				"danger");

		assertThat(body).contains("data-kind=\"Error\"")
			.contains("1 Error")
			.contains("<td data-sticky=\"false\">Tests are failing</td>")
			.doesNotContain("data-kind=\"Warning\"")
			.contains(ReportSignature.marker("danger"));
		assertThat(ReportSignature.isGeneratedBy(body, "danger")).isTrue();
		assertThat(ReportSignature.isGeneratedBy(body, "lint")).isFalse();
	}

	@Test
	@DisplayName("Should pluralize table titles and show duplicate messages once")
	void shouldPluralizeAndDeduplicate() {
		FindingSet findings = FindingSet.of(Finding.warning("Big PR"), Finding.warning("No tests"),
				Finding.warning("Big PR"));

		String body = renderer.render(findings, ViolationLedger.empty(), "danger");

		assertThat(body).contains("2 Warnings");
		assertThat(body.split("Big PR", -1)).hasSize(2);
	}

	@Test
	@DisplayName("Should render markdown notes after the tables")
	void shouldRenderMarkdownNotes() {
		FindingSet findings = FindingSet.of(Finding.markdown("### Coverage\n85%"), Finding.message("Thanks!"));

		String body = renderer.render(findings, ViolationLedger.empty(), "danger");

		assertThat(body).contains("data-kind=\"Message\"").contains("### Coverage\n85%");
		assertThat(body.indexOf("Thanks!")).isLessThan(body.indexOf("### Coverage"));
	}

	@Test
	@DisplayName("Should strike through resolved sticky findings and keep them in the ledger")
	void shouldStrikeThroughResolvedStickyFindings() {
		ViolationLedger previous = new ViolationLedger(Map.of(FindingKind.ERROR, List.of("Tests are failing")));

		String body = renderer.render(FindingSet.empty(), previous, "danger");

		assertThat(body).contains("<del>Tests are failing</del>").contains("All resolved");
		assertThat(classifier.parseLedger(body)).hasValueSatisfying(
				ledger -> assertThat(ledger.get(FindingKind.ERROR)).containsExactly("Tests are failing"));
	}

	@Test
	@DisplayName("Should produce a body whose ledger holds exactly the sticky findings")
	void shouldProduceParseableLedger() {
		FindingSet findings = FindingSet.of(Finding.error("Tests are failing").asSticky(), Finding.error("Lint"),
				Finding.warning("Big PR").asSticky());

		String body = renderer.render(findings, ViolationLedger.empty(), "danger");

		ViolationLedger ledger = classifier.parseLedger(body).orElseThrow();
		assertThat(ledger.get(FindingKind.ERROR)).containsExactly("Tests are failing");
		assertThat(ledger.get(FindingKind.WARNING)).containsExactly("Big PR");
	}

	@Test
	@DisplayName("Should not list a ledger entry as resolved while it is still reported")
	void shouldNotResolveStillReportedEntry() {
		ViolationLedger previous = new ViolationLedger(Map.of(FindingKind.WARNING, List.of("Big PR")));

		String body = renderer.render(FindingSet.of(Finding.warning("Big PR").asSticky()), previous, "danger");

		assertThat(body).doesNotContain("<del>").contains("1 Warning");
	}

	@ParameterizedTest
	@ValueSource(strings = { "Tests failing\n", "  Tests failing  ", "Bad cell </td> in message",
			"Nested </del> closing tag", "<del>pre-struck</del> text", "Mixed </TD><TD> case",
			"Breaks </table> out" })
	@DisplayName("Should keep a still-reported sticky finding out of the resolved rows across runs")
	void shouldMatchLedgerEntryOnNextRun(String message) {
		FindingSet findings = FindingSet.of(new Finding(FindingKind.ERROR, message, true));

		String first = renderer.render(findings, ViolationLedger.empty(), "danger");
		ViolationLedger ledger = classifier.parseLedger(first).orElseThrow();
		String second = renderer.render(findings, ledger, "danger");

		assertThat(ledger.get(FindingKind.ERROR)).hasSize(1);
		assertThat(second).isEqualTo(first).contains("1 Error").doesNotContain("<del>");
		assertThat(classifier.parseLedger(second)).contains(ledger);
	}

	@Test
	@DisplayName("Should keep a resolved entry with tag-like text stable across runs")
	void shouldKeepResolvedEntryStable() {
		FindingSet findings = FindingSet.of(new Finding(FindingKind.WARNING, "Row ends </td> early ", true));
		ViolationLedger ledger = classifier.parseLedger(renderer.render(findings, ViolationLedger.empty(), "danger"))
			.orElseThrow();

		String resolved = renderer.render(FindingSet.empty(), ledger, "danger");
		ViolationLedger resolvedLedger = classifier.parseLedger(resolved).orElseThrow();
		String again = renderer.render(FindingSet.empty(), resolvedLedger, "danger");

		assertThat(resolvedLedger).isEqualTo(ledger);
		assertThat(again).isEqualTo(resolved);
		assertThat(resolved.split("<del>", -1)).hasSize(2);
	}

	@Test
	@DisplayName("Should write a finding cell stripped with cell tags neutralised")
	void shouldNormaliseCellText() {
		assertThat(MarkdownReportRenderer.cellText("  a </td> b <del>c</DEL>\n"))
			.isEqualTo("a &lt;/td> b &lt;del>c&lt;/DEL>");
		assertThat(MarkdownReportRenderer.cellText("<tdx> and <b>bold</b>")).isEqualTo("<tdx> and <b>bold</b>");
	}

	@Test
	@DisplayName("Should be deterministic")
	void shouldBeDeterministic() {
		FindingSet findings = FindingSet.of(Finding.error("a"), Finding.warning("b"), Finding.message("c"));

		assertThat(renderer.render(findings, ViolationLedger.empty(), "x"))
			.isEqualTo(renderer.render(findings, ViolationLedger.empty(), "x"));
	}

}
