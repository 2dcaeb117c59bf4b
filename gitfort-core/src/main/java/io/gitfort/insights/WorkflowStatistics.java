package io.gitfort.insights;

import java.time.Duration;
import java.util.List;

/**
 * Success and duration figures over the completed runs of a window.
 *
 * @param totalRuns completed runs
 * @param successfulRuns runs concluded with success
 * @param failedRuns runs concluded with failure
 * @param cancelledRuns runs concluded as cancelled
 * @param successRate successful runs in percent of total, 0 when there are none
 * @param averageDuration mean duration of runs with a known duration
 * @param mostFailingWorkflows up to five workflows with the most failures, most first
 */
public record WorkflowStatistics(int totalRuns, int successfulRuns, int failedRuns, int cancelledRuns,
		double successRate, Duration averageDuration, List<FailureCount> mostFailingWorkflows) {

	public record FailureCount(String workflowName, int failures) {
	}

}
