package io.gitfort.insights;

/**
 * The services of one GitFort instance. All of them share a single {@link RequestEngine}
 * and therefore a single view of the rate limit.
 *
 * <p>
 * Closing the instance stops the engine, failing requests still queued, and the streak
 * cache sweeper.
 */
public final class GitFort implements AutoCloseable {

	private final RequestEngine engine;

	private final RestService restService;

	private final GraphQLService graphQLService;

	private final StreakService streakService;

	private final BuildFailureDetector buildFailureDetector;

	private final RepositoryScanService scanService;

	private final ExpiringCache<StreakSummary> streakCache;

	private final GitFortProperties properties;

	GitFort(RequestEngine engine, RestService restService, GraphQLService graphQLService, StreakService streakService,
			BuildFailureDetector buildFailureDetector, RepositoryScanService scanService,
			ExpiringCache<StreakSummary> streakCache, GitFortProperties properties) {
		this.engine = engine;
		this.restService = restService;
		this.graphQLService = graphQLService;
		this.streakService = streakService;
		this.buildFailureDetector = buildFailureDetector;
		this.scanService = scanService;
		this.streakCache = streakCache;
		this.properties = properties;
	}

	public RequestEngine engine() {
		return engine;
	}

	public RestService rest() {
		return restService;
	}

	public GraphQLService graphQL() {
		return graphQLService;
	}

	public StreakService streaks() {
		return streakService;
	}

	public BuildFailureDetector buildFailures() {
		return buildFailureDetector;
	}

	public RepositoryScanService scanner() {
		return scanService;
	}

	public GitFortProperties properties() {
		return properties;
	}

	@Override
	public void close() {
		engine.close();
		streakCache.close();
	}

}
