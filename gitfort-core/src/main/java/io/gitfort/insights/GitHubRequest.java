package io.gitfort.insights;

import org.jspecify.annotations.Nullable;

/**
 * One logical call to the provider: a REST GET or a GraphQL POST.
 *
 * @param method HTTP method ("GET" or "POST")
 * @param target API path (e.g. "/repos/owner/repo") or absolute URL
 * @param body JSON request body for POST, null for GET
 */
public record GitHubRequest(String method, String target, @Nullable String body) {

	public static GitHubRequest get(String target) {
		return new GitHubRequest("GET", target, null);
	}

	public static GitHubRequest graphQL(String body) {
		return new GitHubRequest("POST", GitHubHttpClient.GITHUB_GRAPHQL_ENDPOINT, body);
	}

	/**
	 * Short form used in log messages.
	 * @return method and target
	 */
	public String describe() {
		return method + " " + target;
	}

}
