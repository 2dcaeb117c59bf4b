package io.gitfort.insights;

import java.time.Instant;
import java.util.List;

/**
 * Builders for workflow runs and jobs used across the failure tests.
 */
final class WorkflowFixtures {

	static final Instant CREATED = Instant.parse("2024-06-03T10:00:00Z");

	private WorkflowFixtures() {
	}

	static WorkflowRun run(long id, String workflow, String conclusion) {
		return run(id, workflow, "main", conclusion, CREATED, 300);
	}

	static WorkflowRun run(long id, String workflow, String branch, String conclusion, Instant createdAt,
			long durationSeconds) {
		return new WorkflowRun(id, workflow + " #" + id, 7L, workflow, branch, "abc" + id, "completed", conclusion,
				"push", "octocat", (int) id, 1, createdAt, createdAt.plusSeconds(durationSeconds), createdAt,
				"https://github.com/acme/api/actions/runs/" + id);
	}

	static WorkflowJob failedJob(long runId, String jobName, String failedStepName) {
		return new WorkflowJob(runId * 10, runId, jobName, "completed", "failure", CREATED, CREATED.plusSeconds(60),
				"ubuntu-runner",
				List.of(step(1, "Checkout", "success"), step(2, failedStepName, "failure"),
						step(3, "Cleanup", "skipped")));
	}

	static WorkflowJob jobWithoutFailedStep(long runId, String jobName) {
		return new WorkflowJob(runId * 10, runId, jobName, "completed", "failure", CREATED, CREATED.plusSeconds(60),
				null, List.of(step(1, "Checkout", "success")));
	}

	static WorkflowJob successfulJob(long runId, String jobName) {
		return new WorkflowJob(runId * 10 + 1, runId, jobName, "completed", "success", CREATED,
				CREATED.plusSeconds(60), null, List.of(step(1, "Checkout", "success")));
	}

	static WorkflowStep step(int number, String name, String conclusion) {
		return new WorkflowStep(number, name, "completed", conclusion, CREATED, CREATED.plusSeconds(5));
	}

}
