package io.gitfort.insights;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.SortedMap;
import java.util.TreeMap;

/**
 * Service for GitHub GraphQL API operations.
 *
 * <p>
 * Builds the queries, sends them through the {@link GitHubClient} (normally the
 * {@link RequestEngine}) and converts the JSON responses to typed records at the service
 * boundary.
 */
public class GitHubGraphQLService implements GraphQLService {

	private static final Logger logger = LoggerFactory.getLogger(GitHubGraphQLService.class);

	private static final String CALENDAR_FIELDS = """
			contributionCalendar {
			    totalContributions
			    weeks {
			        contributionDays {
			            date
			            contributionCount
			        }
			    }
			}
			""";

	private final GitHubClient client;

	private final ObjectMapper objectMapper;

	private final Clock clock;

	public GitHubGraphQLService(GitHubClient client, ObjectMapper objectMapper) {
		this(client, objectMapper, Clock.systemUTC());
	}

	public GitHubGraphQLService(GitHubClient client, ObjectMapper objectMapper, Clock clock) {
		this.client = client;
		this.objectMapper = objectMapper;
		this.clock = clock;
	}

	@Override
	public JsonNode executeQuery(String query, @Nullable Map<String, Object> variables) {
		String requestBody;
		try {
			Map<String, Object> payload = new LinkedHashMap<>();
			payload.put("query", query);
			payload.put("variables", variables != null ? variables : Map.of());
			requestBody = objectMapper.writeValueAsString(payload);
		}
		catch (JsonProcessingException e) {
			throw new GitHubException("Failed to serialize GraphQL request", e);
		}

		GitHubResponse response = client.execute(GitHubRequest.graphQL(requestBody));

		JsonNode root;
		try {
			root = objectMapper.readTree(response.body());
		}
		catch (JsonProcessingException e) {
			throw new GitHubException("Invalid GraphQL response: " + e.getOriginalMessage(), e);
		}

		JsonNode errors = root.path("errors");
		if (errors.isArray() && !errors.isEmpty()) {
			GraphQLException exception = new GraphQLException(errors);
			logger.error("GraphQL query failed: {}", exception.getMessage());
			throw exception;
		}
		return root.path("data");
	}

	@Override
	public List<ContributionDay> getContributions(String username, Instant from, Instant to) {
		String query = """
				query($username: String!, $from: DateTime!, $to: DateTime!) {
				    user(login: $username) {
				        contributionsCollection(from: $from, to: $to) {
				""" + CALENDAR_FIELDS + """
				        }
				    }
				}
				""";

		Map<String, Object> variables = Map.of("username", username, "from", from.toString(), "to", to.toString());
		JsonNode data = executeQuery(query, variables);

		JsonNode calendar = data.path("user").path("contributionsCollection").path("contributionCalendar");
		if (JsonNodes.isAbsent(calendar)) {
			throw new NoDataException("No contribution data found for user " + username);
		}
		return parseCalendar(calendar);
	}

	@Override
	public List<ContributionDay> getContributionsForStreak(String username, int days) {
		Instant to = clock.instant();
		Instant from = to.minus(days, ChronoUnit.DAYS);
		return getContributions(username, from, to);
	}

	@Override
	public SortedMap<Integer, List<ContributionDay>> getOptimizedContributions(String username, List<Integer> years) {
		List<Integer> requested = years.isEmpty() ? List.of(LocalDate.now(clock.withZone(ZoneOffset.UTC)).getYear())
				: years;

		StringBuilder query = new StringBuilder("query($username: String!) {\n");
		for (int year : requested) {
			query.append("    year")
				.append(year)
				.append(": user(login: $username) {\n")
				.append("        contributionsCollection(from: \"")
				.append(year)
				.append("-01-01T00:00:00Z\", to: \"")
				.append(year)
				.append("-12-31T23:59:59Z\") {\n")
				.append(CALENDAR_FIELDS)
				.append("        }\n    }\n");
		}
		query.append("}\n");

		JsonNode data = executeQuery(query.toString(), Map.of("username", username));

		SortedMap<Integer, List<ContributionDay>> result = new TreeMap<>();
		for (int year : requested) {
			JsonNode calendar = data.path("year" + year).path("contributionsCollection").path("contributionCalendar");
			if (JsonNodes.isAbsent(calendar)) {
				logger.warn("No contribution calendar for {} in {}", username, year);
				continue;
			}
			result.put(year, parseCalendar(calendar));
		}
		return result;
	}

	@Override
	public List<Integer> getContributionYears(String username) {
		String query = """
				query($username: String!) {
				    user(login: $username) {
				        contributionsCollection {
				            contributionYears
				        }
				    }
				}
				""";

		JsonNode years = executeQuery(query, Map.of("username", username)).path("user")
			.path("contributionsCollection")
			.path("contributionYears");
		if (!years.isArray()) {
			throw new NoDataException("No contribution years found for user " + username);
		}
		List<Integer> result = new ArrayList<>();
		years.forEach(year -> result.add(year.asInt()));
		return result;
	}

	@Override
	public UserProfile getUserProfile(String username) {
		String query = """
				query($username: String!) {
				    user(login: $username) {
				        id
				        databaseId
				        login
				        name
				        email
				        avatarUrl
				        bio
				        company
				        location
				        websiteUrl
				        twitterUsername
				        createdAt
				        updatedAt
				        followers { totalCount }
				        following { totalCount }
				        repositories(privacy: PUBLIC) { totalCount }
				        contributionsCollection {
				            totalCommitContributions
				            totalIssueContributions
				            totalPullRequestContributions
				            totalPullRequestReviewContributions
				        }
				    }
				}
				""";

		JsonNode user = executeQuery(query, Map.of("username", username)).path("user");
		if (JsonNodes.isAbsent(user)) {
			throw new NoDataException("User not found: " + username);
		}
		JsonNode contributions = user.path("contributionsCollection");
		return new UserProfile(JsonNodes.text(user, "id", ""), user.path("databaseId").asLong(),
				JsonNodes.text(user, "login", username), JsonNodes.text(user, "name"), JsonNodes.text(user, "email"),
				JsonNodes.text(user, "avatarUrl"), JsonNodes.text(user, "bio"), JsonNodes.text(user, "company"),
				JsonNodes.text(user, "location"), JsonNodes.text(user, "websiteUrl"),
				JsonNodes.text(user, "twitterUsername"), JsonNodes.instant(user, "createdAt"),
				JsonNodes.instant(user, "updatedAt"), user.path("followers").path("totalCount").asInt(0),
				user.path("following").path("totalCount").asInt(0),
				user.path("repositories").path("totalCount").asInt(0),
				contributions.path("totalCommitContributions").asInt(0),
				contributions.path("totalIssueContributions").asInt(0),
				contributions.path("totalPullRequestContributions").asInt(0),
				contributions.path("totalPullRequestReviewContributions").asInt(0));
	}

	@Override
	public RepositoryLanguages getRepositoryLanguages(String owner, String repo) {
		String query = """
				query($owner: String!, $repo: String!) {
				    repository(owner: $owner, name: $repo) {
				        languages(first: 10, orderBy: {field: SIZE, direction: DESC}) {
				            edges {
				                size
				                node {
				                    name
				                    color
				                }
				            }
				            totalSize
				        }
				    }
				}
				""";

		JsonNode repository = executeQuery(query, Map.of("owner", owner, "repo", repo)).path("repository");
		if (JsonNodes.isAbsent(repository)) {
			throw new NoDataException("Repository not found: " + owner + "/" + repo);
		}
		JsonNode languages = repository.path("languages");
		List<LanguageShare> shares = new ArrayList<>();
		for (JsonNode edge : JsonNodes.array(languages.path("edges"))) {
			JsonNode node = edge.path("node");
			shares.add(new LanguageShare(JsonNodes.text(node, "name", "unknown"), JsonNodes.text(node, "color"),
					edge.path("size").asLong(0)));
		}
		return new RepositoryLanguages(shares, languages.path("totalSize").asLong(0));
	}

	@Override
	public RepositoryDetails getRepositoryDetails(String owner, String repo) {
		String query = """
				query($owner: String!, $repo: String!) {
				    repository(owner: $owner, name: $repo) {
				        id
				        databaseId
				        name
				        nameWithOwner
				        description
				        url
				        homepageUrl
				        isPrivate
				        isFork
				        isArchived
				        createdAt
				        updatedAt
				        pushedAt
				        stargazerCount
				        forkCount
				        watchers { totalCount }
				        issues(states: OPEN) { totalCount }
				        pullRequests(states: OPEN) { totalCount }
				        releases { totalCount }
				        primaryLanguage { name color }
				        licenseInfo { name spdxId }
				        defaultBranchRef { name }
				    }
				}
				""";

		JsonNode node = executeQuery(query, Map.of("owner", owner, "repo", repo)).path("repository");
		if (JsonNodes.isAbsent(node)) {
			throw new NoDataException("Repository not found: " + owner + "/" + repo);
		}
		return new RepositoryDetails(JsonNodes.text(node, "id", ""), node.path("databaseId").asLong(),
				JsonNodes.text(node, "name", repo), JsonNodes.text(node, "nameWithOwner", owner + "/" + repo),
				JsonNodes.text(node, "description"), JsonNodes.text(node, "url", ""),
				JsonNodes.text(node, "homepageUrl"), node.path("isPrivate").asBoolean(false),
				node.path("isFork").asBoolean(false), node.path("isArchived").asBoolean(false),
				JsonNodes.instant(node, "createdAt"), JsonNodes.instant(node, "updatedAt"),
				JsonNodes.instant(node, "pushedAt"), node.path("stargazerCount").asInt(0),
				node.path("forkCount").asInt(0), node.path("watchers").path("totalCount").asInt(0),
				node.path("issues").path("totalCount").asInt(0),
				node.path("pullRequests").path("totalCount").asInt(0),
				node.path("releases").path("totalCount").asInt(0),
				JsonNodes.text(node.path("primaryLanguage"), "name"),
				JsonNodes.text(node.path("licenseInfo"), "spdxId"),
				JsonNodes.text(node.path("defaultBranchRef"), "name"));
	}

	// ========== JSON Parsing Methods ==========

	private List<ContributionDay> parseCalendar(JsonNode calendar) {
		List<ContributionDay> days = new ArrayList<>();
		for (JsonNode week : JsonNodes.array(calendar.path("weeks"))) {
			for (JsonNode day : JsonNodes.array(week.path("contributionDays"))) {
				String date = JsonNodes.text(day, "date");
				if (date == null) {
					logger.warn("Skipping contribution day without date");
					continue;
				}
				days.add(ContributionDay.of(date, Math.max(0, day.path("contributionCount").asInt(0))));
			}
		}
		days.sort(Comparator.comparing(ContributionDay::date));
		return days;
	}

}
