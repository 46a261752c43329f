package org.springaicommunity.github.harvester;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Simple HTTP client wrapper for GitHub API calls using Java 11+ HttpClient.
 *
 * <p>
 * Returns every response as an {@link ApiResponse}, with the rate limit and pagination
 * headers already parsed. Only transport failures are thrown.
 */
public class GitHubHttpClient implements GitHubClient {

	private static final Logger logger = LoggerFactory.getLogger(GitHubHttpClient.class);

	static final String GITHUB_API_BASE = "https://api.github.com";

	private static final Duration TIMEOUT = Duration.ofSeconds(30);

	private final HttpClient httpClient;

	private final String baseUrl;

	private final String token;

	public GitHubHttpClient(String token) {
		this(token, GITHUB_API_BASE);
	}

	public GitHubHttpClient(String token, String baseUrl) {
		this.token = token;
		this.baseUrl = baseUrl.endsWith("/") ? baseUrl.substring(0, baseUrl.length() - 1) : baseUrl;
		this.httpClient = HttpClient.newBuilder()
			.connectTimeout(TIMEOUT)
			.followRedirects(HttpClient.Redirect.NORMAL)
			.build();
	}

	@Override
	public ApiResponse get(String path, Map<String, String> parameters, LimitClass limitClass) {
		String url = buildUrl(path, parameters);
		logger.debug("GET {} [{}]", url, limitClass.getDisplayName());
		long start = System.currentTimeMillis();

		HttpRequest request = HttpRequest.newBuilder()
			.uri(URI.create(url))
			.timeout(TIMEOUT)
			.header("Authorization", "Bearer " + token)
			.header("Accept", "application/vnd.github.v3+json")
			.header("User-Agent", "github-harvester")
			.GET()
			.build();

		try {
			ApiResponse response = executeRequest(request);
			logger.debug("GET {} -> {} in {}ms ({} bytes)", url, response.statusCode(),
					System.currentTimeMillis() - start, response.body().length());
			return response;
		}
		catch (GitHubApiException e) {
			logger.debug("GET {} failed after {}ms: {}", url, System.currentTimeMillis() - start, e.getMessage());
			throw e;
		}
	}

	String buildUrl(String path, Map<String, String> parameters) {
		String url = path.startsWith("http") ? path : baseUrl + path;
		if (parameters.isEmpty()) {
			return url;
		}
		String query = parameters.entrySet()
			.stream()
			.map(e -> encode(e.getKey()) + "=" + encode(e.getValue()))
			.collect(Collectors.joining("&"));
		return url + (url.contains("?") ? "&" : "?") + query;
	}

	private static String encode(String value) {
		return URLEncoder.encode(value, StandardCharsets.UTF_8);
	}

	private ApiResponse executeRequest(HttpRequest request) {
		try {
			HttpResponse<String> response = httpClient.send(request, HttpResponse.BodyHandlers.ofString());

			// Extract rate limit headers from ALL responses (2xx included)
			int remaining = parseIntHeader(response, "X-RateLimit-Remaining", -1);
			long reset = parseLongHeader(response, "X-RateLimit-Reset", -1);
			int limit = parseIntHeader(response, "X-RateLimit-Limit", -1);
			int used = parseIntHeader(response, "X-RateLimit-Used", -1);

			RateLimitInfo rateLimit = null;
			if (remaining >= 0) {
				rateLimit = new RateLimitInfo(limit, remaining, reset, used);
				logger.trace("Rate limit: {}/{} remaining, resets at epoch {}", remaining, limit, reset);
			}

			String link = response.headers().firstValue("Link").orElse(null);
			String body = response.body() != null ? response.body() : "";
			return new ApiResponse(response.statusCode(), body, rateLimit, link);
		}
		catch (IOException e) {
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
				return Integer.parseInt(v.trim());
			}
			catch (NumberFormatException e) {
				return defaultValue;
			}
		}).orElse(defaultValue);
	}

	private static long parseLongHeader(HttpResponse<?> response, String headerName, long defaultValue) {
		return response.headers().firstValue(headerName).map(v -> {
			try {
				return Long.parseLong(v.trim());
			}
			catch (NumberFormatException e) {
				return defaultValue;
			}
		}).orElse(defaultValue);
	}

	/**
	 * Exception thrown when a GitHub API call cannot be completed.
	 *
	 * <p>
	 * Network-level failures (connect, timeout, reset) are flagged so that
	 * {@link RateLimitedGitHubClient} can retry them with backoff.
	 */
	public static class GitHubApiException extends RuntimeException {

		private final boolean networkError;

		public GitHubApiException(String message, Throwable cause) {
			super(message, cause);
			this.networkError = cause instanceof IOException;
		}

		/**
		 * Returns true if this exception represents a transport failure rather than an
		 * HTTP error response.
		 */
		public boolean isNetworkError() {
			return networkError;
		}

	}

}
