package io.gitfort.insights;

import org.jspecify.annotations.Nullable;

import java.time.Duration;
import java.time.Instant;

/**
 * A GitHub Actions workflow run. Read-only snapshot of the provider record.
 *
 * @param id run id
 * @param name run name
 * @param workflowId id of the workflow definition
 * @param workflowName workflow name (falls back to the run name)
 * @param headBranch branch the run executed on
 * @param headSha commit the run executed on
 * @param status queued, in_progress or completed
 * @param conclusion success, failure, cancelled, ... or null while running
 * @param event triggering event
 * @param actor login of the triggering user
 * @param runNumber sequential run number
 * @param runAttempt attempt number of this run
 * @param createdAt creation time
 * @param updatedAt last update
 * @param runStartedAt time execution started
 * @param htmlUrl link to the run page
 */
public record WorkflowRun(long id, String name, long workflowId, String workflowName, @Nullable String headBranch,
		@Nullable String headSha, String status, @Nullable String conclusion, @Nullable String event,
		@Nullable String actor, int runNumber, int runAttempt, @Nullable Instant createdAt,
		@Nullable Instant updatedAt, @Nullable Instant runStartedAt, @Nullable String htmlUrl) {

	public boolean isCompleted() {
		return "completed".equals(status);
	}

	public boolean isFailure() {
		return "failure".equals(conclusion);
	}

	/**
	 * Time from the start of execution to the last update, or zero when either is unknown.
	 * @return run duration
	 */
	public Duration duration() {
		Instant start = runStartedAt != null ? runStartedAt : createdAt;
		if (start == null || updatedAt == null || updatedAt.isBefore(start)) {
			return Duration.ZERO;
		}
		return Duration.between(start, updatedAt);
	}

}
