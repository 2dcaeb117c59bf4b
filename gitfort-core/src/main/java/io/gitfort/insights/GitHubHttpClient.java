package io.gitfort.insights;

import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;

/**
 * HTTP transport for GitHub API calls using the Java 11+ HttpClient.
 *
 * <p>
 * Resolves the bearer token from a {@link TokenAccessor} on every call, extracts rate limit
 * headers from all responses (2xx and errors) and maps non-2xx statuses to
 * {@link GitHubApiException}.
 */
public class GitHubHttpClient implements GitHubClient {

	private static final Logger logger = LoggerFactory.getLogger(GitHubHttpClient.class);

	static final String GITHUB_API_BASE = "https://api.github.com";

	static final String GITHUB_GRAPHQL_ENDPOINT = "https://api.github.com/graphql";

	static final String DEFAULT_USER_AGENT = "GitFort-Insights/1.0";

	private final HttpClient httpClient;

	private final TokenAccessor tokenAccessor;

	private final String apiBase;

	private final String userAgent;

	public GitHubHttpClient(TokenAccessor tokenAccessor) {
		this(tokenAccessor, GITHUB_API_BASE, DEFAULT_USER_AGENT);
	}

	/**
	 * Create a client against a custom API base, e.g. a GitHub Enterprise host or a local
	 * test server. The GraphQL endpoint is {@code <apiBase>/graphql}.
	 * @param tokenAccessor source of the bearer token
	 * @param apiBase base URL without trailing slash
	 * @param userAgent value of the User-Agent header
	 */
	public GitHubHttpClient(TokenAccessor tokenAccessor, String apiBase, String userAgent) {
		this.tokenAccessor = tokenAccessor;
		this.apiBase = apiBase;
		this.userAgent = userAgent;
		this.httpClient = HttpClient.newBuilder()
			.connectTimeout(Duration.ofSeconds(30))
			.followRedirects(HttpClient.Redirect.NORMAL)
			.build();
	}

	@Override
	public GitHubResponse execute(GitHubRequest request) {
		String token = resolveToken();
		String url = resolveUrl(request.target());

		HttpRequest.Builder builder = HttpRequest.newBuilder()
			.uri(URI.create(url))
			.timeout(Duration.ofSeconds(60))
			.header("Authorization", "Bearer " + token)
			.header("Accept", "application/vnd.github.v3+json")
			.header("User-Agent", userAgent);

		if ("POST".equals(request.method())) {
			String body = request.body() != null ? request.body() : "";
			builder.header("Content-Type", "application/json").POST(HttpRequest.BodyPublishers.ofString(body));
		}
		else {
			builder.GET();
		}

		logger.debug("{} {}", request.method(), url);
		long start = System.currentTimeMillis();
		try {
			GitHubResponse response = executeRequest(builder.build());
			logger.debug("{} {} completed in {}ms ({} bytes)", request.method(), url,
					System.currentTimeMillis() - start, response.body().length());
			return response;
		}
		catch (GitHubApiException e) {
			logger.debug("{} {} failed after {}ms: {}", request.method(), url, System.currentTimeMillis() - start,
					e.getMessage());
			throw e;
		}
	}

	private String resolveToken() {
		TokenInfo info = tokenAccessor.getToken();
		if (info == null) {
			throw new TokenInvalidException("No valid access token available");
		}
		if (!info.valid() || info.accessToken().isBlank()) {
			throw new TokenInvalidException(info.error() != null ? info.error() : "No valid access token available");
		}
		return info.accessToken();
	}

	private String resolveUrl(String target) {
		if (target.startsWith("http")) {
			if (target.equals(GITHUB_GRAPHQL_ENDPOINT)) {
				return apiBase + "/graphql";
			}
			return target;
		}
		return apiBase + target;
	}

	private GitHubResponse executeRequest(HttpRequest request) {
		try {
			HttpResponse<String> response = httpClient.send(request, HttpResponse.BodyHandlers.ofString());

			RateLimitInfo rateLimit = parseRateLimit(response);
			if (rateLimit != null) {
				if (rateLimit.remaining() < 100) {
					logger.info("Rate limit low: {}/{} remaining, resets at epoch {}", rateLimit.remaining(),
							rateLimit.limit(), rateLimit.reset());
				}
				else {
					logger.debug("Rate limit: {}/{} remaining, resets at epoch {}", rateLimit.remaining(),
							rateLimit.limit(), rateLimit.reset());
				}
			}

			int statusCode = response.statusCode();
			if (statusCode >= 200 && statusCode < 300) {
				return new GitHubResponse(statusCode, response.body(), rateLimit,
						response.headers().firstValue("Link").orElse(null));
			}
			else if (statusCode == 401) {
				throw new GitHubApiException("Unauthorized: Bad credentials", statusCode, response.body(), rateLimit);
			}
			else if (statusCode == 403) {
				if (rateLimit != null && rateLimit.remaining() == 0) {
					throw new GitHubApiException("Rate limit exceeded. Resets at epoch: " + rateLimit.reset(),
							statusCode, response.body(), rateLimit);
				}
				throw new GitHubApiException("Forbidden: " + request.uri(), statusCode, response.body(), rateLimit);
			}
			else if (statusCode == 404) {
				throw new GitHubApiException("Not found: " + request.uri(), statusCode, response.body(), rateLimit);
			}
			else if (statusCode == 429) {
				throw new GitHubApiException("Too Many Requests (429)", statusCode, response.body(), rateLimit);
			}
			else {
				throw new GitHubApiException("GitHub API error: " + statusCode, statusCode, response.body(),
						rateLimit);
			}
		}
		catch (IOException e) {
			logger.error("HTTP request failed: {}", e.getMessage());
			throw new GitHubApiException("HTTP request failed: " + e.getMessage(), e);
		}
		catch (InterruptedException e) {
			Thread.currentThread().interrupt();
			throw new GitHubApiException("HTTP request interrupted", e);
		}
	}

	private static @Nullable RateLimitInfo parseRateLimit(HttpResponse<?> response) {
		int remaining = parseIntHeader(response, "x-ratelimit-remaining", -1);
		long reset = parseLongHeader(response, "x-ratelimit-reset", -1);
		if (remaining < 0 || reset < 0) {
			return null;
		}
		int limit = parseIntHeader(response, "x-ratelimit-limit", -1);
		int used = parseIntHeader(response, "x-ratelimit-used", -1);
		return new RateLimitInfo(limit, remaining, reset, used);
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

}
