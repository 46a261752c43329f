package org.springaicommunity.github.harvester;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.util.Map;

/**
 * Decorator that enforces the GitHub rate limit contract on a {@link GitHubClient}.
 *
 * <p>
 * Features:
 * <ul>
 * <li>Publishes the rate limit headers of every response to the shared
 * {@link RateBudget} of the request's {@link LimitClass}</li>
 * <li>Reset-aware waiting: a 403 with {@code X-RateLimit-Remaining: 0} and a reset
 * timestamp blocks the calling thread until the reset (plus a safety margin), then
 * repeats the same request. Other threads keep working until they observe the
 * exhaustion themselves.</li>
 * <li>A 403 without those headers is an access denial and is returned as-is</li>
 * <li>Exponential backoff for network failures, bounded by a maximum number of
 * attempts</li>
 * <li>Proactive pacing when the remaining budget runs low</li>
 * </ul>
 *
 * <p>
 * Example usage:
 *
 * <pre>
 * {@code
 * GitHubClient client = RateLimitedGitHubClient.builder()
 *     .wrapping(new GitHubHttpClient(token))
 *     .safetyMargin(Duration.ofSeconds(10))
 *     .maxNetworkRetries(5)
 *     .build();
 * }
 * </pre>
 */
public final class RateLimitedGitHubClient implements GitHubClient {

	private static final Logger logger = LoggerFactory.getLogger(RateLimitedGitHubClient.class);

	/**
	 * Waits longer than this are slept in one-minute slices with a progress log line.
	 */
	private static final long LONG_WAIT_MS = Duration.ofMinutes(5).toMillis();

	private static final long WAIT_SLICE_MS = Duration.ofMinutes(1).toMillis();

	private static final long MAX_NETWORK_RETRY_DELAY_MS = 60_000;

	private static final int BODY_PREVIEW_LENGTH = 200;

	private final GitHubClient delegate;

	private final RateBudget rateBudget;

	private final long safetyMarginMs;

	private final int maxNetworkRetries;

	private final long networkRetryDelayMs;

	private final int pacingThreshold;

	private final Sleeper sleeper;

	private final Clock clock;

	private RateLimitedGitHubClient(Builder builder) {
		this.delegate = builder.delegate;
		this.rateBudget = builder.rateBudget != null ? builder.rateBudget : new RateBudget();
		this.safetyMarginMs = builder.safetyMarginMs;
		this.maxNetworkRetries = builder.maxNetworkRetries;
		this.networkRetryDelayMs = builder.networkRetryDelayMs;
		this.pacingThreshold = builder.pacingThreshold;
		this.sleeper = builder.sleeper;
		this.clock = builder.clock;
	}

	/**
	 * Create a new builder for RateLimitedGitHubClient.
	 * @return new Builder instance
	 */
	public static Builder builder() {
		return new Builder();
	}

	@Override
	public ApiResponse get(String path, Map<String, String> parameters, LimitClass limitClass) {
		String description = "GET " + path + (parameters.isEmpty() ? "" : " " + parameters);
		int networkFailures = 0;
		long backoffMs = networkRetryDelayMs;

		while (true) {
			ApiResponse response;
			try {
				response = delegate.get(path, parameters, limitClass);
			}
			catch (GitHubHttpClient.GitHubApiException e) {
				if (!e.isNetworkError()) {
					throw e;
				}
				if (networkFailures >= maxNetworkRetries) {
					logger.error("{} failed after {} attempts: {}", description, networkFailures + 1, e.getMessage());
					throw e;
				}
				networkFailures++;
				logger.warn("{} failed (attempt {}/{}): {}. Retrying in {}ms...", description, networkFailures,
						maxNetworkRetries + 1, e.getMessage(), backoffMs);
				sleep(backoffMs);
				backoffMs = Math.min(backoffMs * 2, MAX_NETWORK_RETRY_DELAY_MS);
				continue;
			}

			RateLimitInfo rateLimit = response.rateLimit();
			if (rateLimit != null) {
				rateBudget.update(limitClass, rateLimit);
			}

			if (response.isQuotaExhausted() && rateLimit != null) {
				logger.warn("{} limit exceeded! Remaining requests: {}, resets at {} ({})",
						limitClass.getDisplayName(), rateLimit.remaining(), rateLimit.getResetTime(), description);
				waitForReset(rateLimit.reset());
				continue;
			}

			if (response.isForbidden()) {
				logger.warn("403 Forbidden: no access to {}. Response: {}", description,
						response.bodyPreview(BODY_PREVIEW_LENGTH));
				return response;
			}
			if (response.isUnprocessable()) {
				logger.warn("422 Unprocessable Entity for {}", description);
				return response;
			}
			if (!response.isSuccess()) {
				logger.warn("Error {} for {}. Response: {}", response.statusCode(), description,
						response.bodyPreview(BODY_PREVIEW_LENGTH));
				return response;
			}

			paceIfNeeded(limitClass, description);
			return response;
		}
	}

	@Override
	public RateLimitInfo getRateLimitInfo(LimitClass limitClass) {
		return rateBudget.get(limitClass);
	}

	/**
	 * Returns the shared budget this client publishes to.
	 * @return the rate budget
	 */
	public RateBudget getRateBudget() {
		return rateBudget;
	}

	/**
	 * Compute how long to wait for a quota reset: the time left until the reset epoch
	 * (never negative) plus the safety margin.
	 */
	long computeResetWait(long resetEpochSeconds) {
		long untilResetMs = Math.max(resetEpochSeconds * 1000 - clock.millis(), 0);
		return untilResetMs + safetyMarginMs;
	}

	private void waitForReset(long resetEpochSeconds) {
		long waitMs = computeResetWait(resetEpochSeconds);

		if (waitMs > LONG_WAIT_MS) {
			logger.info("Long wait for rate limit reset: {} minutes", String.format("%.1f", waitMs / 60_000.0));
			long remainingMs = waitMs;
			while (remainingMs > WAIT_SLICE_MS) {
				logger.info("  Remaining: {} minutes", String.format("%.1f", remainingMs / 60_000.0));
				sleep(WAIT_SLICE_MS);
				remainingMs -= WAIT_SLICE_MS;
			}
			sleep(remainingMs);
		}
		else {
			logger.info("Waiting {} seconds for rate limit reset", waitMs / 1000);
			sleep(waitMs);
		}
	}

	/**
	 * Proactive pacing: after a successful request, check the remaining budget of the
	 * request's limit class and spread the remaining requests evenly until the reset.
	 */
	private void paceIfNeeded(LimitClass limitClass, String description) {
		RateLimitInfo info = rateBudget.get(limitClass);
		if (info.remaining() <= 0 || info.remaining() >= pacingThreshold || !info.hasReset()) {
			return;
		}

		long secondsUntilReset = info.reset() - clock.millis() / 1000;
		if (secondsUntilReset > 0) {
			long paceMs = (secondsUntilReset * 1000) / info.remaining();
			paceMs = Math.min(paceMs, 10_000);
			paceMs = Math.max(paceMs, 100);

			logger.debug("Pacing: {}/{} {} remaining, sleeping {}ms ({})", info.remaining(), info.limit(),
					limitClass.getDisplayName(), paceMs, description);
			sleep(paceMs);
		}
	}

	private void sleep(long ms) {
		if (ms <= 0) {
			return;
		}
		try {
			sleeper.sleep(ms);
		}
		catch (InterruptedException e) {
			Thread.currentThread().interrupt();
			throw new GitHubHttpClient.GitHubApiException("Rate limit wait interrupted", e);
		}
	}

	/**
	 * Builder for {@link RateLimitedGitHubClient}.
	 *
	 * <p>
	 * Provides sensible defaults:
	 * <ul>
	 * <li>safetyMargin: 10 seconds past the reported reset</li>
	 * <li>maxNetworkRetries: 5</li>
	 * <li>networkRetryDelay: 5 seconds (doubles on each retry, capped at 60 seconds)</li>
	 * <li>pacingThreshold: 100 (start pacing when remaining drops below this)</li>
	 * </ul>
	 */
	public static class Builder {

		private GitHubClient delegate;

		private RateBudget rateBudget;

		private long safetyMarginMs = 10_000;

		private int maxNetworkRetries = 5;

		private long networkRetryDelayMs = 5_000;

		private int pacingThreshold = 100;

		private Sleeper sleeper = Sleeper.THREAD;

		private Clock clock = Clock.systemUTC();

		private Builder() {
		}

		/**
		 * Set the client to wrap with rate limit handling.
		 * @param client the GitHubClient to wrap (required)
		 * @return this builder
		 */
		public Builder wrapping(GitHubClient client) {
			this.delegate = client;
			return this;
		}

		/**
		 * Share an existing budget instead of creating a new one.
		 * @param rateBudget the budget to publish rate limit headers to
		 * @return this builder
		 */
		public Builder rateBudget(RateBudget rateBudget) {
			this.rateBudget = rateBudget;
			return this;
		}

		/**
		 * Set the extra time to wait past the reported reset.
		 * @param margin safety margin (default: 10 seconds)
		 * @return this builder
		 */
		public Builder safetyMargin(Duration margin) {
			this.safetyMarginMs = margin.toMillis();
			return this;
		}

		/**
		 * Set the maximum number of retries after a network failure.
		 * @param maxNetworkRetries maximum retries (default: 5)
		 * @return this builder
		 */
		public Builder maxNetworkRetries(int maxNetworkRetries) {
			this.maxNetworkRetries = maxNetworkRetries;
			return this;
		}

		/**
		 * Set the initial delay before retrying a network failure.
		 * @param delay initial delay (doubles on each retry, default: 5 seconds)
		 * @return this builder
		 */
		public Builder networkRetryDelay(Duration delay) {
			this.networkRetryDelayMs = delay.toMillis();
			return this;
		}

		/**
		 * Set the remaining request threshold for proactive pacing.
		 * @param threshold remaining request threshold (default: 100)
		 * @return this builder
		 */
		public Builder pacingThreshold(int threshold) {
			this.pacingThreshold = threshold;
			return this;
		}

		/**
		 * Replace the sleeping strategy (for tests).
		 * @param sleeper the sleeper to use
		 * @return this builder
		 */
		public Builder sleeper(Sleeper sleeper) {
			this.sleeper = sleeper;
			return this;
		}

		/**
		 * Replace the clock used to compute reset waits (for tests).
		 * @param clock the clock to use
		 * @return this builder
		 */
		public Builder clock(Clock clock) {
			this.clock = clock;
			return this;
		}

		/**
		 * Build the RateLimitedGitHubClient.
		 * @return configured RateLimitedGitHubClient
		 * @throws IllegalStateException if required parameters are missing or invalid
		 */
		public RateLimitedGitHubClient build() {
			if (delegate == null) {
				throw new IllegalStateException("A GitHubClient to wrap is required. Call wrapping() first.");
			}
			if (maxNetworkRetries < 0) {
				throw new IllegalStateException("maxNetworkRetries must be non-negative");
			}
			if (networkRetryDelayMs <= 0) {
				throw new IllegalStateException("networkRetryDelay must be positive");
			}
			if (safetyMarginMs < 0) {
				throw new IllegalStateException("safetyMargin must be non-negative");
			}
			return new RateLimitedGitHubClient(this);
		}

	}

}
