package org.springaicommunity.github.reporter;

import org.jspecify.annotations.Nullable;

/**
 * Interface for GitHub REST API HTTP operations.
 *
 * <p>
 * Provides abstraction over the GitHub REST API, enabling testability and decorator
 * implementations (caching, logging).
 */
public interface GitHubClient {

	/**
	 * Execute a GET request to the GitHub REST API.
	 * @param path API path (e.g., "/repos/owner/repo") or full URL
	 * @return Response body as String
	 * @throws GitHubHttpClient.GitHubApiException if the request fails
	 */
	String get(String path);

	/**
	 * Execute a POST request with a JSON body.
	 * @param path API path
	 * @param body Request body (JSON)
	 * @return Response body as String
	 * @throws GitHubHttpClient.GitHubApiException if the request fails
	 */
	String post(String path, String body);

	/**
	 * Execute a PATCH request with a JSON body.
	 * @param path API path
	 * @param body Request body (JSON)
	 * @return Response body as String
	 * @throws GitHubHttpClient.GitHubApiException if the request fails
	 */
	String patch(String path, String body);

	/**
	 * Execute a DELETE request.
	 * @param path API path
	 * @throws GitHubHttpClient.GitHubApiException if the request fails
	 */
	void delete(String path);

	/**
	 * Get the rate limit information from the most recent API response. Returns null if
	 * no rate limit headers have been observed yet.
	 * @return last observed RateLimitInfo, or null
	 */
	default @Nullable RateLimitInfo getLastRateLimitInfo() {
		return null;
	}

}
