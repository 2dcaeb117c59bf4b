package io.gitfort.insights;

import org.jspecify.annotations.Nullable;

import java.time.Instant;

/**
 * One step of a workflow job.
 *
 * @param number step number within the job
 * @param name step name
 * @param status queued, in_progress or completed
 * @param conclusion step conclusion, null while running
 * @param startedAt start time
 * @param completedAt completion time
 */
public record WorkflowStep(int number, String name, String status, @Nullable String conclusion,
		@Nullable Instant startedAt, @Nullable Instant completedAt) {

	public boolean isFailure() {
		return "failure".equals(conclusion);
	}

}
