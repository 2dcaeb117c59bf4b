package io.gitfort.insights;

import com.fasterxml.jackson.databind.JsonNode;
import org.jspecify.annotations.Nullable;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.SortedMap;

/**
 * Interface for GitHub GraphQL API operations.
 *
 * <p>
 * Extracted to enable mocking in tests. Every method issues its requests through the
 * {@link RequestEngine}; errors surface as the typed {@link GitHubException} subclasses.
 */
public interface GraphQLService {

	/**
	 * Execute a GraphQL query with variables.
	 * @param query GraphQL query string
	 * @param variables query variables (can be null)
	 * @return the {@code data} node of the response
	 * @throws GraphQLException if the response carries a non-empty {@code errors} array,
	 * even alongside partial data
	 */
	JsonNode executeQuery(String query, @Nullable Map<String, Object> variables);

	/**
	 * Daily contribution counts of a user between two instants.
	 * @param username user login
	 * @param from window start
	 * @param to window end
	 * @return contribution days sorted ascending by date
	 * @throws NoDataException if the response has no contribution calendar
	 */
	List<ContributionDay> getContributions(String username, Instant from, Instant to);

	/**
	 * Contribution counts for the trailing {@code days} days up to now.
	 * @param username user login
	 * @param days window length
	 * @return contribution days sorted ascending by date
	 */
	List<ContributionDay> getContributionsForStreak(String username, int days);

	/**
	 * Contribution calendars of several years fetched with a single request using one
	 * aliased sub-query per year.
	 * @param username user login
	 * @param years calendar years; empty means the current year
	 * @return contribution days per year, ordered by year
	 */
	SortedMap<Integer, List<ContributionDay>> getOptimizedContributions(String username, List<Integer> years);

	/**
	 * Years in which the user has contributions.
	 * @param username user login
	 * @return contribution years as reported, most recent first
	 * @throws NoDataException if the user or the years list is absent
	 */
	List<Integer> getContributionYears(String username);

	/**
	 * Public profile of a user.
	 * @param username user login
	 * @return the profile
	 * @throws NoDataException if the user does not exist
	 */
	UserProfile getUserProfile(String username);

	/**
	 * Top ten languages of a repository by size.
	 * @param owner repository owner
	 * @param repo repository name
	 * @return languages with sizes
	 * @throws NoDataException if the repository does not exist
	 */
	RepositoryLanguages getRepositoryLanguages(String owner, String repo);

	/**
	 * Repository metadata.
	 * @param owner repository owner
	 * @param repo repository name
	 * @return repository details
	 * @throws NoDataException if the repository does not exist
	 */
	RepositoryDetails getRepositoryDetails(String owner, String repo);

}
