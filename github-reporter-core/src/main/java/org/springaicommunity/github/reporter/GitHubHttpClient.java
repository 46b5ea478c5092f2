package org.springaicommunity.github.reporter;

import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;

/**
 * HTTP client wrapper for GitHub REST API calls using the JDK HttpClient.
 *
 * <p>
 * Redirects are not followed: GitHub answers requests for a renamed or transferred
 * repository with {@code 301 Moved Permanently}, which is reported as a
 * {@link GitHubApiException} so the run fails instead of silently writing elsewhere.
 *
 * <p>
 * Extracts rate limit headers from all responses and makes them available via
 * {@link #getLastRateLimitInfo()}.
 */
public class GitHubHttpClient implements GitHubClient {

	private static final Logger logger = LoggerFactory.getLogger(GitHubHttpClient.class);

	private static final String JSON = "application/json";

	private final HttpClient httpClient;

	private final String token;

	private final String apiBaseUrl;

	private volatile @Nullable RateLimitInfo lastRateLimitInfo;

	public GitHubHttpClient(String token, String apiBaseUrl, Duration connectTimeout) {
		this.token = token;
		this.apiBaseUrl = apiBaseUrl.endsWith("/") ? apiBaseUrl.substring(0, apiBaseUrl.length() - 1) : apiBaseUrl;
		this.httpClient = HttpClient.newBuilder()
			.connectTimeout(connectTimeout)
			.followRedirects(HttpClient.Redirect.NEVER)
			.build();
	}

	@Override
	public @Nullable RateLimitInfo getLastRateLimitInfo() {
		return lastRateLimitInfo;
	}

	@Override
	public String get(String path) {
		return send("GET", path, requestBuilder(path).GET().build());
	}

	@Override
	public String post(String path, String body) {
		HttpRequest request = requestBuilder(path).header("Content-Type", JSON)
			.POST(HttpRequest.BodyPublishers.ofString(body))
			.build();
		return send("POST", path, request);
	}

	@Override
	public String patch(String path, String body) {
		HttpRequest request = requestBuilder(path).header("Content-Type", JSON)
			.method("PATCH", HttpRequest.BodyPublishers.ofString(body))
			.build();
		return send("PATCH", path, request);
	}

	@Override
	public void delete(String path) {
		send("DELETE", path, requestBuilder(path).DELETE().build());
	}

	String resolve(String path) {
		return path.startsWith("http") ? path : apiBaseUrl + path;
	}

	private HttpRequest.Builder requestBuilder(String path) {
		return HttpRequest.newBuilder()
			.uri(URI.create(resolve(path)))
			.header("Authorization", "token " + token)
			.header("Accept", "application/vnd.github.v3+json")
			.header("User-Agent", "github-reporter");
	}

	private String send(String method, String path, HttpRequest request) {
		logger.debug("{} {}", method, request.uri());
		long start = System.currentTimeMillis();
		try {
			String response = executeRequest(request);
			logger.debug("{} {} completed in {}ms ({} bytes)", method, path, System.currentTimeMillis() - start,
					response.length());
			return response;
		}
		catch (GitHubApiException e) {
			logger.debug("{} {} failed after {}ms: {}", method, path, System.currentTimeMillis() - start,
					e.getMessage());
			throw e;
		}
	}

	private String executeRequest(HttpRequest request) {
		try {
			HttpResponse<String> response = httpClient.send(request, HttpResponse.BodyHandlers.ofString());

			// Extract rate limit headers from ALL responses (2xx included)
			int remaining = parseIntHeader(response, "X-RateLimit-Remaining", -1);
			long reset = parseLongHeader(response, "X-RateLimit-Reset", -1);
			int limit = parseIntHeader(response, "X-RateLimit-Limit", -1);
			int used = parseIntHeader(response, "X-RateLimit-Used", -1);

			@Nullable
			RateLimitInfo rateLimit = null;
			if (remaining >= 0) {
				rateLimit = new RateLimitInfo(limit, remaining, reset, used);
				this.lastRateLimitInfo = rateLimit;
				if (rateLimit.isLow()) {
					logger.info("Rate limit low: {}/{} remaining, resets at {}", remaining, limit,
							rateLimit.getResetTime());
				}
				else {
					logger.debug("Rate limit: {}/{} remaining", remaining, limit);
				}
			}

			int statusCode = response.statusCode();
			String body = response.body() != null ? response.body() : "";
			if (statusCode >= 200 && statusCode < 300) {
				return body;
			}
			else if (statusCode == 301) {
				throw new GitHubApiException(GitHubApiException.MOVED_MESSAGE, statusCode, body, remaining, reset);
			}
			else if (statusCode == 401) {
				throw new GitHubApiException("Unauthorized: Bad credentials. Check DANGER_GITHUB_API_TOKEN.",
						statusCode, body, remaining, reset);
			}
			else if (statusCode == 403) {
				if (rateLimit != null && rateLimit.isExceeded()) {
					throw new GitHubApiException("Rate limit exceeded. Resets at " + rateLimit.getResetTime(),
							statusCode, body, remaining, reset);
				}
				throw new GitHubApiException("Forbidden: " + body, statusCode, body, remaining, reset);
			}
			else if (statusCode == 404) {
				throw new GitHubApiException("Not found: " + request.uri(), statusCode, body, remaining, reset);
			}
			else if (statusCode == 429) {
				throw new GitHubApiException("Too Many Requests (429). Resets at epoch: " + reset, statusCode, body,
						remaining, reset);
			}
			else {
				throw new GitHubApiException("GitHub API error: " + statusCode, statusCode, body, remaining, reset);
			}
		}
		catch (IOException e) {
			logger.error("HTTP request failed: {}", e.getMessage());
			throw new GitHubApiException("HTTP request failed: " + e.getMessage(), e);
		}
		catch (InterruptedException e) {
			Thread.currentThread().interrupt();
			throw new GitHubApiException("HTTP request interrupted", e);
		}
	}

	private static int parseIntHeader(HttpResponse<?> response, String headerName, int defaultValue) {
		return response.headers().firstValue(headerName).map(v -> {
			try {
				return Integer.parseInt(v);
			}
			catch (NumberFormatException e) {
				return defaultValue;
			}
		}).orElse(defaultValue);
	}

	private static long parseLongHeader(HttpResponse<?> response, String headerName, long defaultValue) {
		return response.headers().firstValue(headerName).map(v -> {
			try {
				return Long.parseLong(v);
			}
			catch (NumberFormatException e) {
				return defaultValue;
			}
		}).orElse(defaultValue);
	}

	/**
	 * Exception thrown when GitHub API calls fail.
	 *
	 * <p>
	 * Carries the HTTP status and rate limit information so callers can tell a missing
	 * write permission apart from rate limiting or a moved repository.
	 */
	public static class GitHubApiException extends RuntimeException {

		public static final String MOVED_MESSAGE = "Repo moved or renamed, make sure to update the git remote";

		private final int statusCode;

		private final @Nullable String responseBody;

		private final int rateLimitRemaining;

		private final long resetEpochSeconds;

		public GitHubApiException(String message, int statusCode, @Nullable String responseBody) {
			this(message, statusCode, responseBody, -1, -1);
		}

		public GitHubApiException(String message, int statusCode, @Nullable String responseBody,
				int rateLimitRemaining, long resetEpochSeconds) {
			super(message);
			this.statusCode = statusCode;
			this.responseBody = responseBody;
			this.rateLimitRemaining = rateLimitRemaining;
			this.resetEpochSeconds = resetEpochSeconds;
		}

		public GitHubApiException(String message, Throwable cause) {
			super(message, cause);
			this.statusCode = -1;
			this.responseBody = null;
			this.rateLimitRemaining = -1;
			this.resetEpochSeconds = -1;
		}

		public int getStatusCode() {
			return statusCode;
		}

		public @Nullable String getResponseBody() {
			return responseBody;
		}

		public int getRateLimitRemaining() {
			return rateLimitRemaining;
		}

		public long getResetEpochSeconds() {
			return resetEpochSeconds;
		}

		/**
		 * Returns true if this exception represents a rate limit error (either 403 with
		 * remaining=0 or 429).
		 */
		public boolean isRateLimitError() {
			return (statusCode == 429) || (statusCode == 403 && rateLimitRemaining == 0);
		}

		/**
		 * Returns true if the credentials lack access to the resource. GitHub answers
		 * 404 instead of 403 for repositories the token cannot write to.
		 */
		public boolean isPermissionDenied() {
			return statusCode == 401 || statusCode == 404 || (statusCode == 403 && !isRateLimitError());
		}

		public boolean isMoved() {
			return statusCode == 301;
		}

	}

}
