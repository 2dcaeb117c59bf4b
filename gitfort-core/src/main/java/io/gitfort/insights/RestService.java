package io.gitfort.insights;

import java.util.List;

/**
 * Interface for GitHub REST API operations.
 *
 * <p>
 * Returns strongly-typed records instead of raw JSON to provide type safety and encapsulate
 * the GitHub API response structure. List operations follow REST pagination to the end.
 */
public interface RestService {

	/**
	 * Get current rate limit status with an out-of-band {@code GET /rate_limit} call.
	 * @return rate limit information of the core resource
	 */
	RateLimitInfo getRateLimit();

	/**
	 * Repositories of a user, most recently updated first.
	 * @param username user login
	 * @return all repositories across pages
	 */
	List<Repository> getRepositories(String username);

	/**
	 * All workflow runs of a repository.
	 * @param owner repository owner
	 * @param repo repository name
	 * @return runs, newest first
	 */
	List<WorkflowRun> getWorkflowRuns(String owner, String repo);

	/**
	 * Workflow runs of a repository matching the given filters.
	 * @param owner repository owner
	 * @param repo repository name
	 * @param query status/branch/actor/event/created filters
	 * @return matching runs, newest first
	 */
	List<WorkflowRun> getWorkflowRuns(String owner, String repo, WorkflowRunQuery query);

	/**
	 * Jobs of a workflow run with their steps.
	 * @param owner repository owner
	 * @param repo repository name
	 * @param runId workflow run id
	 * @return jobs in the order GitHub reports them
	 */
	List<WorkflowJob> getWorkflowRunJobs(String owner, String repo, long runId);

	/**
	 * Text content of a file in the default branch.
	 * @param owner repository owner
	 * @param repo repository name
	 * @param path file path
	 * @return decoded UTF-8 text
	 * @throws ContentNotFoundException if the path does not exist or is not a regular file
	 */
	String getRepositoryContent(String owner, String repo, String path);

	/**
	 * All files of the default branch, from the recursive tree of HEAD.
	 * @param owner repository owner
	 * @param repo repository name
	 * @return blob entries with path and size
	 */
	List<TreeEntry> getRepositoryTree(String owner, String repo);

}
