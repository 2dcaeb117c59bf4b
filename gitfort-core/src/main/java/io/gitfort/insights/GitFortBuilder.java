package io.gitfort.insights;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.jspecify.annotations.Nullable;

import java.time.Clock;
import java.time.Duration;
import java.time.ZoneId;

/**
 * Builder wiring the request engine, the data services and the analytics.
 *
 * <p>
 * Example usage:
 * </p>
 *
 * <pre>
 * {@code
 * // Token from GITHUB_TOKEN (or a .env file)
 * try (GitFort gitFort = GitFortBuilder.create().tokenFromEnv().build()) {
 *     StreakSummary summary = gitFort.streaks().getStreakSummary("octocat");
 * }
 *
 * // With custom configuration
 * GitFortProperties props = new GitFortProperties();
 * props.setTimeZone("Europe/Berlin");
 * props.setMaxRetries(5);
 *
 * GitFort gitFort = GitFortBuilder.create()
 *     .token("ghp_xxxxx")
 *     .properties(props)
 *     .listener(event -> System.out.println(event.type()))
 *     .build();
 *
 * // For testing with a mock transport
 * GitHubClient mockClient = mock(GitHubClient.class);
 * GitFort testInstance = GitFortBuilder.create()
 *     .httpClient(mockClient)
 *     .build();
 * }
 * </pre>
 */
public class GitFortBuilder {

	private @Nullable TokenAccessor tokenAccessor;

	private GitFortProperties properties;

	private @Nullable ObjectMapper objectMapper;

	private @Nullable GitHubClient httpClient;

	private NotificationListener listener = NotificationListener.NONE;

	private Clock clock = Clock.systemUTC();

	private GitFortBuilder() {
		this.properties = new GitFortProperties();
	}

	/**
	 * Create a new builder instance.
	 * @return new GitFortBuilder
	 */
	public static GitFortBuilder create() {
		return new GitFortBuilder();
	}

	/**
	 * Use a fixed personal access token.
	 * @param token GitHub personal access token
	 * @return this builder
	 */
	public GitFortBuilder token(String token) {
		if (token == null || token.isBlank()) {
			throw new IllegalArgumentException("token must not be blank");
		}
		this.tokenAccessor = TokenAccessor.of(token.trim());
		return this;
	}

	/**
	 * Read the token from {@code GITHUB_TOKEN}, with {@code .env} files consulted first.
	 * @return this builder
	 * @throws IllegalStateException if GITHUB_TOKEN is not set
	 */
	public GitFortBuilder tokenFromEnv() {
		String token = EnvironmentSupport.get("GITHUB_TOKEN");
		if (token == null || token.isBlank()) {
			throw new IllegalStateException(
					"GITHUB_TOKEN environment variable is required. Please set your GitHub personal access token.");
		}
		this.tokenAccessor = TokenAccessor.fromEnvironment();
		return this;
	}

	/**
	 * Supply tokens from an external session store.
	 * @param tokenAccessor accessor consulted before every call
	 * @return this builder
	 */
	public GitFortBuilder tokenAccessor(TokenAccessor tokenAccessor) {
		this.tokenAccessor = tokenAccessor;
		return this;
	}

	/**
	 * Set configuration properties.
	 * @param properties configuration properties (null to use defaults)
	 * @return this builder
	 */
	public GitFortBuilder properties(@Nullable GitFortProperties properties) {
		if (properties != null) {
			this.properties = properties;
		}
		return this;
	}

	/**
	 * Set a custom ObjectMapper.
	 * @param objectMapper Jackson ObjectMapper (null to use default)
	 * @return this builder
	 */
	public GitFortBuilder objectMapper(@Nullable ObjectMapper objectMapper) {
		this.objectMapper = objectMapper;
		return this;
	}

	/**
	 * Set the transport the request engine dispatches through. Useful for testing with
	 * mocks. When a custom client is provided, no token is required.
	 * @param httpClient custom GitHubClient implementation (null to use default)
	 * @return this builder
	 */
	public GitFortBuilder httpClient(@Nullable GitHubClient httpClient) {
		this.httpClient = httpClient;
		return this;
	}

	/**
	 * Set the receiver of streak, security and CI/CD notifications.
	 * @param listener notification listener (default: discard)
	 * @return this builder
	 */
	public GitFortBuilder listener(NotificationListener listener) {
		this.listener = listener;
		return this;
	}

	public GitFortBuilder clock(Clock clock) {
		this.clock = clock;
		return this;
	}

	/**
	 * Build all services around one request engine.
	 * @return the configured instance, to be closed when no longer needed
	 * @throws IllegalStateException if neither a token nor a custom client was provided
	 */
	public GitFort build() {
		GitHubClient transport = httpClient != null ? httpClient : createHttpClient();
		ObjectMapper mapper = objectMapper != null ? objectMapper : ObjectMapperFactory.create();
		ZoneId zone = ZoneId.of(properties.getTimeZone());

		RequestEngine engine = RequestEngine.builder().wrapping(transport).properties(properties).clock(clock).build();
		GitHubRestService restService = new GitHubRestService(engine, mapper);
		GitHubGraphQLService graphQLService = new GitHubGraphQLService(engine, mapper, clock);

		ExpiringCache<StreakSummary> streakCache = new ExpiringCache<>(
				Duration.ofMinutes(properties.getStreakCacheTtlMinutes()), ExpiringCache.DEFAULT_MAX_SIZE);
		StreakCalculator calculator = new StreakCalculator(zone, properties.getRiskThresholdHours());
		StreakRiskDetector riskDetector = new StreakRiskDetector(RiskDetectionConfig.defaults().withZone(zone));
		StreakService streakService = new StreakService(graphQLService, calculator, riskDetector, streakCache,
				listener, clock, properties.getStreakLookbackDays(),
				Duration.ofMinutes(properties.getStreakCacheTtlMinutes()));

		BuildFailureDetector failureDetector = new BuildFailureDetector(restService, new BuildFailureClassifier(),
				listener, clock);
		RepositoryScanService scanService = new RepositoryScanService(restService, new ContentSecurityScanner(),
				listener, clock, properties.getSecurityAlertThreshold());

		return new GitFort(engine, restService, graphQLService, streakService, failureDetector, scanService,
				streakCache, properties);
	}

	private GitHubClient createHttpClient() {
		if (tokenAccessor == null) {
			throw new IllegalStateException(
					"GitHub token is required. Call token(), tokenFromEnv() or tokenAccessor() first.");
		}
		return new GitHubHttpClient(tokenAccessor, properties.getApiBaseUrl(), properties.getUserAgent());
	}

}
