package io.gitfort.insights;

import org.jspecify.annotations.Nullable;

/**
 * A successful (2xx) provider response.
 *
 * @param statusCode HTTP status code
 * @param body response body
 * @param rateLimit rate limit headers of the response, when present
 * @param link raw {@code Link} header used for pagination hints, when present
 */
public record GitHubResponse(int statusCode, String body, @Nullable RateLimitInfo rateLimit, @Nullable String link) {

	public static GitHubResponse ok(String body) {
		return new GitHubResponse(200, body, null, null);
	}

}
