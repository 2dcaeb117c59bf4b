package io.gitfort.insights;

import org.jspecify.annotations.Nullable;

import java.time.Duration;
import java.util.List;
import java.util.Map;

/**
 * Aggregate view over the failures of one window. Count maps keep first-encounter order.
 *
 * @param totalFailures number of classified failures
 * @param failuresByType failures per type
 * @param failuresByWorkflow failures per workflow name
 * @param failuresByBranch failures per branch
 * @param recurringFailures failures marked recurring
 * @param criticalFailures failures with critical severity
 * @param averageTimeToFailure mean duration of failures with a known duration
 * @param mostProblematicWorkflow workflow with most failures, ties to the first encountered
 * @param mostProblematicBranch branch with most failures, ties to the first encountered
 * @param failureTrends per day and type, ascending by date
 */
public record FailureAnalysis(int totalFailures, Map<FailureType, Integer> failuresByType,
		Map<String, Integer> failuresByWorkflow, Map<String, Integer> failuresByBranch, int recurringFailures,
		int criticalFailures, Duration averageTimeToFailure, @Nullable String mostProblematicWorkflow,
		@Nullable String mostProblematicBranch, List<FailureTrend> failureTrends) {
}
