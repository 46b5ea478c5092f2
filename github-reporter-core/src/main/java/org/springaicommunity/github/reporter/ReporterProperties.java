package org.springaicommunity.github.reporter;

/**
 * Configuration properties for the reporter.
 *
 * <p>
 * Properties can be set directly via setters and are passed to
 * {@link GitHubReporterBuilder}; nothing is read from global state. Default values suit
 * github.com.
 */
public class ReporterProperties {

	/**
	 * Base URL of the GitHub REST API. Override for GitHub Enterprise.
	 */
	private String apiBaseUrl = "https://api.github.com";

	/**
	 * Identity of this reporter configuration. Reports of other identities on the same
	 * pull request are left alone.
	 */
	private String dangerId = "danger";

	/**
	 * Context of the commit status, distinguishing it from other checks on the commit.
	 */
	private String statusContext = "danger/danger";

	/**
	 * Page size used when retrieving issue comments (GitHub maximum is 100).
	 */
	private int commentsPerPage = 100;

	/**
	 * Drop warnings and errors named by "> danger: ignore" directives in the pull request
	 * description.
	 */
	private boolean applyIgnoreDirectives = true;

	/**
	 * HTTP connect timeout in seconds.
	 */
	private int connectTimeoutSeconds = 30;

	public String getApiBaseUrl() {
		return apiBaseUrl;
	}

	public void setApiBaseUrl(String apiBaseUrl) {
		this.apiBaseUrl = apiBaseUrl;
	}

	public String getDangerId() {
		return dangerId;
	}

	public void setDangerId(String dangerId) {
		this.dangerId = dangerId;
	}

	public String getStatusContext() {
		return statusContext;
	}

	public void setStatusContext(String statusContext) {
		this.statusContext = statusContext;
	}

	public int getCommentsPerPage() {
		return commentsPerPage;
	}

	public void setCommentsPerPage(int commentsPerPage) {
		this.commentsPerPage = commentsPerPage;
	}

	public boolean isApplyIgnoreDirectives() {
		return applyIgnoreDirectives;
	}

	public void setApplyIgnoreDirectives(boolean applyIgnoreDirectives) {
		this.applyIgnoreDirectives = applyIgnoreDirectives;
	}

	public int getConnectTimeoutSeconds() {
		return connectTimeoutSeconds;
	}

	public void setConnectTimeoutSeconds(int connectTimeoutSeconds) {
		this.connectTimeoutSeconds = connectTimeoutSeconds;
	}

}
