package io.gitfort.insights;

import org.jspecify.annotations.Nullable;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * One job of a workflow run with its steps.
 *
 * @param id job id
 * @param runId id of the owning run
 * @param name job name
 * @param status queued, in_progress or completed
 * @param conclusion job conclusion, null while running
 * @param startedAt start time
 * @param completedAt completion time
 * @param runnerName runner that executed the job
 * @param steps steps in execution order
 */
public record WorkflowJob(long id, long runId, String name, String status, @Nullable String conclusion,
		@Nullable Instant startedAt, @Nullable Instant completedAt, @Nullable String runnerName,
		List<WorkflowStep> steps) {

	public boolean isFailure() {
		return "failure".equals(conclusion);
	}

	/**
	 * First step whose conclusion is failure.
	 * @return the failed step, if any
	 */
	public Optional<WorkflowStep> firstFailedStep() {
		return steps.stream().filter(WorkflowStep::isFailure).findFirst();
	}

}
