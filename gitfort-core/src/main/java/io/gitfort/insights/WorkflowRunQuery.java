package io.gitfort.insights;

import org.jspecify.annotations.Nullable;

import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.util.StringJoiner;

/**
 * Filters for {@code GET /repos/{owner}/{repo}/actions/runs}. All filters are optional.
 *
 * @param status run status or conclusion filter (e.g. "completed", "failure")
 * @param branch branch name
 * @param actor login of the triggering user
 * @param event triggering event
 * @param createdAfter only runs created at or after this instant
 * @param headSha commit sha
 * @param excludePullRequests omit pull request data from the response
 */
public record WorkflowRunQuery(@Nullable String status, @Nullable String branch, @Nullable String actor,
		@Nullable String event, @Nullable Instant createdAfter, @Nullable String headSha,
		boolean excludePullRequests) {

	public static WorkflowRunQuery all() {
		return new WorkflowRunQuery(null, null, null, null, null, null, false);
	}

	/**
	 * Completed runs created at or after the given instant.
	 * @param since window start
	 * @return query
	 */
	public static WorkflowRunQuery completedSince(Instant since) {
		return new WorkflowRunQuery("completed", null, null, null, since, null, false);
	}

	/**
	 * All runs created at or after the given instant.
	 * @param since window start
	 * @return query
	 */
	public static WorkflowRunQuery createdSince(Instant since) {
		return new WorkflowRunQuery(null, null, null, null, since, null, false);
	}

	public WorkflowRunQuery withBranch(String branch) {
		return new WorkflowRunQuery(status, branch, actor, event, createdAfter, headSha, excludePullRequests);
	}

	/**
	 * Encode the filters as query parameters (without leading '?' or paging parameters).
	 * @return encoded parameters, possibly empty
	 */
	String toQueryString() {
		StringJoiner params = new StringJoiner("&");
		append(params, "status", status);
		append(params, "branch", branch);
		append(params, "actor", actor);
		append(params, "event", event);
		if (createdAfter != null) {
			append(params, "created", ">=" + createdAfter);
		}
		append(params, "head_sha", headSha);
		if (excludePullRequests) {
			params.add("exclude_pull_requests=true");
		}
		return params.toString();
	}

	private static void append(StringJoiner params, String name, @Nullable String value) {
		if (value != null && !value.isEmpty()) {
			params.add(name + "=" + URLEncoder.encode(value, StandardCharsets.UTF_8));
		}
	}

}
