package org.springaicommunity.github.reporter;

import com.tngtech.archunit.core.importer.ImportOption;
import com.tngtech.archunit.junit.AnalyzeClasses;
import com.tngtech.archunit.junit.ArchTest;
import com.tngtech.archunit.lang.ArchRule;

import static com.tngtech.archunit.lang.syntax.ArchRuleDefinition.classes;
import static com.tngtech.archunit.lang.syntax.ArchRuleDefinition.noClasses;

/**
 * Architecture tests using ArchUnit to enforce dependency rules and layering.
 *
 * <h3>Interfaces (Contracts)</h3>
 * <ul>
 * <li>{@link GitHubClient} - HTTP operations for GitHub API</li>
 * <li>{@link ReviewService} - pull request, comment and status operations</li>
 * <li>{@link ReportRenderer} - report body rendering</li>
 * </ul>
 *
 * <h3>Dependency Rules</h3> <pre>
 *   Reconciliation → ReviewService (NOT the REST implementation)
 *   Services → GitHubClient (NOT GitHubHttpClient)
 *   Only GitHubReporterBuilder creates concrete implementations
 * </pre>
 */
@AnalyzeClasses(packages = "org.springaicommunity.github.reporter",
		importOptions = ImportOption.DoNotIncludeTests.class)
class ArchitectureTest {

	// ========== Interface Dependency Rules ==========

	@ArchTest
	static final ArchRule services_should_depend_on_client_interface = noClasses().that()
		.haveSimpleNameEndingWith("Service")
		.should()
		.dependOnClassesThat()
		.haveSimpleName("GitHubHttpClient")
		.because("Services should depend on GitHubClient interface, not the concrete GitHubHttpClient");

	@ArchTest
	static final ArchRule reconciliation_should_depend_on_review_service_interface = noClasses().that()
		.haveSimpleNameStartingWith("Report")
		.or()
		.haveSimpleName("CommitStatusSubmitter")
		.should()
		.dependOnClassesThat()
		.haveSimpleName("GitHubReviewService")
		.orShould()
		.dependOnClassesThat()
		.haveSimpleName("MarkdownReportRenderer")
		.because("Reconciliation should depend on the ReviewService and ReportRenderer interfaces");

	@ArchTest
	static final ArchRule core_should_not_exit_the_process = noClasses().should()
		.callMethod(System.class, "exit", int.class)
		.because("Aborts are returned as PublishResult.FatalAbort; only the CLI exits");

	// ========== Implementation Rules ==========

	@ArchTest
	static final ArchRule github_clients_should_implement_interface = classes().that()
		.haveSimpleNameEndingWith("GitHubClient")
		.and()
		.doNotHaveSimpleName("GitHubClient")
		.should()
		.implement(GitHubClient.class)
		.because("All *GitHubClient classes should implement the GitHubClient interface");

	@ArchTest
	static final ArchRule renderers_should_implement_interface = classes().that()
		.haveSimpleNameEndingWith("ReportRenderer")
		.and()
		.doNotHaveSimpleName("ReportRenderer")
		.should()
		.implement(ReportRenderer.class)
		.because("All *ReportRenderer classes should implement the ReportRenderer interface");

	// ========== Model Independence ==========

	@ArchTest
	static final ArchRule models_should_not_depend_on_services = noClasses().that()
		.haveSimpleNameEndingWith("Result")
		.or()
		.haveSimpleNameEndingWith("Outcome")
		.or()
		.haveSimpleNameEndingWith("Set")
		.or()
		.haveSimpleName("Finding")
		.or()
		.haveSimpleName("ViolationLedger")
		.or()
		.haveSimpleName("ReportComment")
		.or()
		.haveSimpleName("PullRequestRef")
		.or()
		.haveSimpleName("Author")
		.should()
		.dependOnClassesThat()
		.haveSimpleNameEndingWith("Service")
		.because("Model classes should be pure data without service dependencies");

	@ArchTest
	static final ArchRule support_classes_should_not_depend_on_services = noClasses().that()
		.haveSimpleNameEndingWith("Scanner")
		.or()
		.haveSimpleNameEndingWith("Parser")
		.or()
		.haveSimpleNameEndingWith("Reader")
		.should()
		.dependOnClassesThat()
		.haveSimpleNameEndingWith("Service")
		.because("Support classes should not depend on higher-level services");

	// ========== Builder/Configuration Rules ==========

	@ArchTest
	static final ArchRule only_builder_should_instantiate_http_client = noClasses().that()
		.doNotHaveSimpleName("GitHubReporterBuilder")
		.and()
		.doNotHaveSimpleName("GitHubHttpClient")
		.should()
		.callConstructor(GitHubHttpClient.class, String.class, String.class, java.time.Duration.class)
		.because("Only GitHubReporterBuilder should create the concrete HTTP client");

}
