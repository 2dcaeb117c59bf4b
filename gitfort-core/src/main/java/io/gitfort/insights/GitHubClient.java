package io.gitfort.insights;

/**
 * Interface for a single HTTP exchange with the GitHub REST or GraphQL API.
 *
 * <p>
 * Implementations perform exactly one attempt; queueing, rate-limit waits and retries are
 * the job of {@link RequestEngine}, which wraps a client. Keeping the seam this narrow lets
 * tests substitute a mock transport.
 */
public interface GitHubClient {

	/**
	 * Execute one request.
	 * @param request the request to send
	 * @return the 2xx response
	 * @throws GitHubApiException for non-2xx responses and network failures
	 * @throws TokenInvalidException if no valid token is available
	 */
	GitHubResponse execute(GitHubRequest request);

}
