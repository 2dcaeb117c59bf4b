package io.gitfort.insights;

/**
 * Internal signal for a hard rate-limit hit (HTTP 403 with no remaining requests, or
 * HTTP 429). The {@link RequestEngine} handles it by waiting for the reset and re-queueing
 * the request. It never reaches callers: once the waits are exhausted the underlying
 * {@link GitHubApiException} is reported instead.
 */
public class RateLimitExceededException extends GitHubException {

	private final long resetEpochSeconds;

	public RateLimitExceededException(long resetEpochSeconds, GitHubApiException cause) {
		super("Rate limit exceeded. Resets at epoch: " + resetEpochSeconds, cause);
		this.resetEpochSeconds = resetEpochSeconds;
	}

	public long getResetEpochSeconds() {
		return resetEpochSeconds;
	}

}
