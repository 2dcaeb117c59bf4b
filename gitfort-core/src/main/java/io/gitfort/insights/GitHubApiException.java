package io.gitfort.insights;

import org.jspecify.annotations.Nullable;

/**
 * Exception thrown when a GitHub API call fails at the HTTP level.
 *
 * <p>
 * Carries the status code (or {@code -1} for network failures), the response body and the
 * rate limit snapshot read from the failed response, enabling rate-limit aware retry logic
 * in {@link RequestEngine}. When the engine gives up, this is the error callers receive.
 */
public class GitHubApiException extends GitHubException {

	private final int statusCode;

	private final @Nullable String responseBody;

	private final @Nullable RateLimitInfo rateLimit;

	public GitHubApiException(String message, int statusCode, @Nullable String responseBody) {
		this(message, statusCode, responseBody, null);
	}

	public GitHubApiException(String message, int statusCode, @Nullable String responseBody,
			@Nullable RateLimitInfo rateLimit) {
		super(message);
		this.statusCode = statusCode;
		this.responseBody = responseBody;
		this.rateLimit = rateLimit;
	}

	public GitHubApiException(String message, Throwable cause) {
		super(message, cause);
		this.statusCode = -1;
		this.responseBody = null;
		this.rateLimit = null;
	}

	public int getStatusCode() {
		return statusCode;
	}

	public @Nullable String getResponseBody() {
		return responseBody;
	}

	public @Nullable RateLimitInfo getRateLimit() {
		return rateLimit;
	}

	public long getResetEpochSeconds() {
		return rateLimit != null ? rateLimit.reset() : -1;
	}

	/**
	 * Returns true if this exception represents a hard rate limit (403 with no remaining
	 * requests, or 429).
	 */
	public boolean isRateLimitError() {
		return statusCode == 429 || (statusCode == 403 && rateLimit != null && rateLimit.remaining() == 0);
	}

	/**
	 * Returns true for errors that will not change on retry: bad request, bad
	 * credentials, plain forbidden, not found, gone and unprocessable entity.
	 */
	public boolean isPermanent() {
		return switch (statusCode) {
			case 400, 401, 404, 410, 422 -> true;
			case 403 -> !isRateLimitError();
			default -> false;
		};
	}

}
