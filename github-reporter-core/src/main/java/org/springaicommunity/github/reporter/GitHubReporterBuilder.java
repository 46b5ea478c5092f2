package org.springaicommunity.github.reporter;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.jspecify.annotations.Nullable;

import java.io.PrintStream;
import java.time.Duration;

/**
 * Builder for wiring the reporter without a dependency injection container.
 *
 * <p>
 * Example usage:
 * </p>
 *
 * <pre>
 * {@code
 * // Token from DANGER_GITHUB_API_TOKEN
 * ReportPublisher publisher = GitHubReporterBuilder.create()
 *     .tokenFromEnv()
 *     .apiBaseUrlFromEnv()
 *     .buildPublisher("owner/repo", 42);
 *
 * PublishResult result = publisher.publish(findings, "danger");
 *
 * // For testing with mock HTTP client
 * GitHubClient mockClient = mock(GitHubClient.class);
 * ReportPublisher testPublisher = GitHubReporterBuilder.create()
 *     .httpClient(mockClient)
 *     .buildPublisher("owner/repo", 42);
 * }
 * </pre>
 */
public class GitHubReporterBuilder {

	private @Nullable String token;

	private ReporterProperties properties;

	private @Nullable ObjectMapper objectMapper;

	private @Nullable GitHubClient httpClient;

	private @Nullable ReportRenderer renderer;

	private PrintStream console = System.out;

	private GitHubReporterBuilder() {
		this.properties = new ReporterProperties();
	}

	/**
	 * Create a new builder instance.
	 * @return new GitHubReporterBuilder
	 */
	public static GitHubReporterBuilder create() {
		return new GitHubReporterBuilder();
	}

	/**
	 * Set the GitHub token directly.
	 * @param token GitHub API token
	 * @return this builder
	 */
	public GitHubReporterBuilder token(String token) {
		this.token = token;
		return this;
	}

	/**
	 * Read the GitHub token from the DANGER_GITHUB_API_TOKEN environment variable.
	 * @return this builder
	 * @throws IllegalStateException if DANGER_GITHUB_API_TOKEN is not set
	 */
	public GitHubReporterBuilder tokenFromEnv() {
		this.token = EnvironmentSupport.get(EnvironmentSupport.TOKEN);
		if (this.token == null || this.token.trim().isEmpty()) {
			throw new IllegalStateException("No API token given, please provide one using `"
					+ EnvironmentSupport.TOKEN + "`");
		}
		return this;
	}

	/**
	 * Override the API base URL from DANGER_GITHUB_API_BASE_URL, or its legacy name
	 * DANGER_GITHUB_API_HOST, when either is set.
	 * @return this builder
	 */
	public GitHubReporterBuilder apiBaseUrlFromEnv() {
		String apiBaseUrl = EnvironmentSupport.firstOf(EnvironmentSupport.LEGACY_API_HOST,
				EnvironmentSupport.API_BASE_URL);
		if (apiBaseUrl != null) {
			properties.setApiBaseUrl(apiBaseUrl);
		}
		return this;
	}

	/**
	 * Set reporter properties.
	 * @param properties configuration properties (null to use defaults)
	 * @return this builder
	 */
	public GitHubReporterBuilder properties(@Nullable ReporterProperties properties) {
		if (properties != null) {
			this.properties = properties;
		}
		return this;
	}

	/**
	 * Set a custom ObjectMapper.
	 * @param objectMapper Jackson ObjectMapper (null to use default)
	 * @return this builder
	 */
	public GitHubReporterBuilder objectMapper(@Nullable ObjectMapper objectMapper) {
		this.objectMapper = objectMapper;
		return this;
	}

	/**
	 * Set a custom GitHubClient implementation. Useful for testing with mocks or for
	 * adding decorators.
	 *
	 * <p>
	 * When a custom client is provided, the token is not required.
	 * @param httpClient custom GitHubClient implementation (null to use default)
	 * @return this builder
	 */
	public GitHubReporterBuilder httpClient(@Nullable GitHubClient httpClient) {
		this.httpClient = httpClient;
		return this;
	}

	/**
	 * Set a custom report renderer.
	 * @param renderer renderer (null to use {@link MarkdownReportRenderer})
	 * @return this builder
	 */
	public GitHubReporterBuilder renderer(@Nullable ReportRenderer renderer) {
		this.renderer = renderer;
		return this;
	}

	/**
	 * Set where the status description is printed when it cannot be recorded on the
	 * commit.
	 * @param console output stream (defaults to standard output)
	 * @return this builder
	 */
	public GitHubReporterBuilder console(PrintStream console) {
		this.console = console;
		return this;
	}

	public ReporterProperties getProperties() {
		return properties;
	}

	/**
	 * Build a ReportPublisher for one run against one pull request.
	 * @param repoSlug repository in "owner/repo" format
	 * @param pullRequestId pull request number
	 * @return configured ReportPublisher
	 */
	public ReportPublisher buildPublisher(String repoSlug, int pullRequestId) {
		ReviewService reviewService = buildReviewService();
		ReportCommentClassifier classifier = new ReportCommentClassifier();
		ReportRenderer reportRenderer = this.renderer != null ? this.renderer : new MarkdownReportRenderer();
		ReportReconciler reconciler = new ReportReconciler(reviewService, classifier, reportRenderer);
		CommitStatusSubmitter submitter = new CommitStatusSubmitter(reviewService, properties.getStatusContext(),
				console);
		return new ReportPublisher(reviewService, new IgnoreDirectiveScanner(), classifier, reconciler, submitter,
				properties, repoSlug, pullRequestId);
	}

	/**
	 * Build the ReviewService directly (for advanced usage).
	 * @return configured ReviewService
	 */
	public ReviewService buildReviewService() {
		validateToken();
		ObjectMapper mapper = this.objectMapper != null ? this.objectMapper : ObjectMapperFactory.create();
		GitHubClient client = this.httpClient != null ? this.httpClient
				: new GitHubHttpClient(token, properties.getApiBaseUrl(),
						Duration.ofSeconds(properties.getConnectTimeoutSeconds()));
		return new GitHubReviewService(client, mapper, properties.getCommentsPerPage());
	}

	private void validateToken() {
		// Skip token validation if a custom httpClient is provided
		if (httpClient != null) {
			return;
		}
		if (token == null || token.trim().isEmpty()) {
			throw new IllegalStateException("GitHub token is required. Call token() or tokenFromEnv() first.");
		}
	}

}
