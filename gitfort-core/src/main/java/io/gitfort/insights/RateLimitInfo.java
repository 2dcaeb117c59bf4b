package io.gitfort.insights;

import java.time.Instant;

/**
 * Rate limit information from the GitHub API.
 *
 * <p>
 * Built from the {@code x-ratelimit-*} headers of every response, or from the body of
 * {@code GET /rate_limit}. The {@link RequestEngine} keeps the most recent one as its
 * single view of the provider quota.
 *
 * @param limit the maximum number of requests allowed per window
 * @param remaining the number of requests remaining in the current window
 * @param reset the time when the rate limit resets (epoch seconds)
 * @param used the number of requests used in the current window
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

}
