package org.springaicommunity.github.harvester;

import java.time.Instant;

/**
 * Rate limit information from the GitHub API.
 *
 * <p>
 * This record captures the rate limit status reported by the {@code X-RateLimit-*}
 * response headers for one {@link LimitClass}. Instances are immutable so that a
 * remaining/reset pair is always published together.
 *
 * @param limit the maximum number of requests allowed in the current window, or -1 if
 * unknown
 * @param remaining the number of requests remaining in the current window
 * @param reset the time when the rate limit resets (epoch seconds), or -1 if unknown
 * @param used the number of requests used in the current window, or -1 if unknown
 */
public record RateLimitInfo(int limit, int remaining, long reset, int used) {

	/**
	 * Returns the reset time as an Instant.
	 * @return the reset time
	 */
	public Instant getResetTime() {
		return Instant.ofEpochSecond(reset);
	}

	/**
	 * Returns true if the rate limit has been exceeded.
	 * @return true if no requests remaining
	 */
	public boolean isExceeded() {
		return remaining <= 0;
	}

	/**
	 * Returns true if the response carried a reset timestamp.
	 * @return true if the reset time is known
	 */
	public boolean hasReset() {
		return reset > 0;
	}

}
