package org.springaicommunity.github.reporter.cli;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springaicommunity.github.reporter.*;

import java.io.PrintStream;
import java.nio.file.Path;
import java.nio.file.Paths;

/**
 * GitHub Reporter CLI Application
 *
 * Plain Java command-line application that publishes the findings of a review run to a
 * pull request: one report comment per reporter identity and a commit status. No DI
 * container - uses GitHubReporterBuilder for service wiring.
 *
 * Usage: java -jar github-reporter-cli.jar --repo owner/repo --pr 42 --findings
 * findings.json [OPTIONS]
 *
 * Environment Variables: DANGER_GITHUB_API_TOKEN - GitHub API token for authentication
 *
 * Exit codes: 0 when the results were published, 1 when the build must fail.
 */
public class GitHubReporterCli {

	private static final Logger logger = LoggerFactory.getLogger(GitHubReporterCli.class);

	public static void main(String[] args) {
		try {
			int exitCode = run(args);
			if (exitCode != 0) {
				System.exit(exitCode);
			}
		}
		catch (Exception e) {
			logger.error("Publishing failed: {}", e.getMessage());
			System.exit(1);
		}
	}

	public static int run(String[] args) throws Exception {
		ReporterProperties properties = new ReporterProperties();
		ArgumentParser argumentParser = new ArgumentParser(properties);

		// Check for help request first
		if (argumentParser.isHelpRequested(args)) {
			System.out.println(argumentParser.generateHelpText());
			return 0;
		}

		ParsedConfiguration config = argumentParser.parseAndValidate(args);
		argumentParser.validateEnvironment();

		GitHubReporterBuilder builder = GitHubReporterBuilder.create()
			.properties(config.applyTo(properties))
			.tokenFromEnv()
			.apiBaseUrlFromEnv();
		return publish(config, builder, System.err);
	}

	/**
	 * Read the findings file and publish it with a prepared builder.
	 * @return process exit code
	 */
	static int publish(ParsedConfiguration config, GitHubReporterBuilder builder, PrintStream err)
			throws Exception {
		logConfiguration(config, builder.getProperties());

		Path findingsFile = Paths.get(config.findingsFile);
		FindingSet findings = new FindingsReader(ObjectMapperFactory.create()).read(findingsFile);
		logger.info("Read {} error(s), {} warning(s), {} message(s), {} markdown note(s) from {}",
				findings.errorCount(), findings.warningCount(), findings.messages().size(),
				findings.markdowns().size(), findingsFile);

		ReportPublisher publisher = builder.buildPublisher(config.repository, config.pullRequestId);
		PublishResult result = publisher.publish(findings, config.dangerId);

		if (result instanceof PublishResult.FatalAbort abort) {
			err.println();
			err.println(abort.message());
			return 1;
		}

		PublishResult.Completed completed = (PublishResult.Completed) result;
		logger.info("Report comment: {}", completed.reconcile().action());
		if (completed.reconcile().detailsUrl() != null) {
			logger.info("  URL: {}", completed.reconcile().detailsUrl());
		}
		logger.info("Status: {} ({}){}", completed.status().state().value(), completed.status().description(),
				completed.statusSubmitted() ? "" : " - not recorded, no write access");
		return 0;
	}

	private static void logConfiguration(ParsedConfiguration config, ReporterProperties properties) {
		logger.info("Configuration:");
		logger.info("  Repository: {}", config.repository);
		logger.info("  Pull request: #{}", config.pullRequestId);
		logger.info("  Findings: {}", config.findingsFile);
		logger.info("  Danger id: {}", properties.getDangerId());
		logger.info("  Status context: {}", properties.getStatusContext());
		logger.info("  Ignore directives: {}", properties.isApplyIgnoreDirectives());
		logger.info("  API: {}", properties.getApiBaseUrl());
		if (config.verbose) {
			logger.info("  Parsed: {}", config);
		}
	}

}
