package io.gitfort.insights;

import org.jspecify.annotations.Nullable;

import java.time.Duration;
import java.time.Instant;

/**
 * A classified failed workflow run.
 *
 * @param runId workflow run id
 * @param workflowName workflow name
 * @param repository "owner/repo"
 * @param branch head branch ("unknown" when absent)
 * @param failureType classified category
 * @param failureReason {@code Step "X" failed in job "Y"} or {@code Job "Y" failed}
 * @param failedStep name of the first failed step, if any
 * @param failedJob name of the first failed job
 * @param timestamp run creation time
 * @param duration run duration, if known
 * @param actor login of the triggering user
 * @param commitSha head commit
 * @param recurring whether the normalized reason occurs more than once in the window
 * @param similarFailures other failures in the window with the same normalized reason
 * @param severity severity of the matched pattern
 * @param category category of the matched pattern
 * @param suggestedFix remediation hint of the failure type
 */
public record BuildFailure(long runId, String workflowName, String repository, String branch,
		FailureType failureType, String failureReason, @Nullable String failedStep, String failedJob,
		Instant timestamp, @Nullable Duration duration, @Nullable String actor, @Nullable String commitSha,
		boolean recurring, int similarFailures, Severity severity, String category, String suggestedFix) {

	public BuildFailure withRecurrence(int similarFailures) {
		return new BuildFailure(runId, workflowName, repository, branch, failureType, failureReason, failedStep,
				failedJob, timestamp, duration, actor, commitSha, similarFailures > 0, similarFailures, severity,
				category, suggestedFix);
	}

}
