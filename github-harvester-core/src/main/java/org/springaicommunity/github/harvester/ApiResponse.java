package org.springaicommunity.github.harvester;

import org.jspecify.annotations.Nullable;

/**
 * Raw response of a GitHub REST call.
 *
 * <p>
 * Non-2xx responses are returned as values rather than thrown so that callers can tell a
 * forbidden request from an exhausted quota and decide per endpoint how to degrade.
 *
 * @param statusCode the HTTP status code
 * @param body the response body (empty string when there was none)
 * @param rateLimit the parsed {@code X-RateLimit-*} headers, or null if absent
 * @param link the {@code Link} pagination header, or null if absent
 */
public record ApiResponse(int statusCode, String body, @Nullable RateLimitInfo rateLimit, @Nullable String link) {

	public boolean isSuccess() {
		return statusCode == 200;
	}

	/**
	 * Returns true if this response signals an exhausted quota: status 403 (or 429) with
	 * zero remaining requests and a known reset time. A 403 lacking either header is a
	 * plain access denial and must not be retried.
	 * @return true if the caller should wait for the reset and retry
	 */
	public boolean isQuotaExhausted() {
		return (statusCode == 403 || statusCode == 429) && rateLimit != null && rateLimit.isExceeded()
				&& rateLimit.hasReset();
	}

	public boolean isForbidden() {
		return statusCode == 403 && !isQuotaExhausted();
	}

	public boolean isUnprocessable() {
		return statusCode == 422;
	}

	/**
	 * Returns the body truncated for log output.
	 * @param maxLength maximum number of characters to keep
	 * @return the truncated body
	 */
	public String bodyPreview(int maxLength) {
		return body.length() <= maxLength ? body : body.substring(0, maxLength) + "...";
	}

}
