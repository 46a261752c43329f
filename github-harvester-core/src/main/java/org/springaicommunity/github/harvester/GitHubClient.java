package org.springaicommunity.github.harvester;

import org.jspecify.annotations.Nullable;

import java.util.Map;

/**
 * Interface for GitHub REST API HTTP operations.
 *
 * <p>
 * Provides abstraction over the GitHub REST API, enabling testability and decorator
 * implementations (rate limiting, retrying, logging).
 */
public interface GitHubClient {

	/**
	 * Execute a GET request to the GitHub REST API.
	 * @param path API path (e.g., "/repos/owner/repo") or full URL
	 * @param parameters query parameters, encoded in iteration order
	 * @param limitClass quota bucket the request is charged against
	 * @return the response, whatever its status code
	 * @throws GitHubHttpClient.GitHubApiException if no response could be obtained
	 */
	ApiResponse get(String path, Map<String, String> parameters, LimitClass limitClass);

	/**
	 * Execute a GET request without query parameters.
	 * @param path API path or full URL
	 * @param limitClass quota bucket the request is charged against
	 * @return the response, whatever its status code
	 */
	default ApiResponse get(String path, LimitClass limitClass) {
		return get(path, Map.of(), limitClass);
	}

	/**
	 * Get the most recently observed rate limit for a quota bucket. Returns null if the
	 * implementation does not track rate limits.
	 * @param limitClass the quota bucket
	 * @return last observed RateLimitInfo, or null
	 */
	default @Nullable RateLimitInfo getRateLimitInfo(LimitClass limitClass) {
		return null;
	}

}
