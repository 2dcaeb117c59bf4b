package io.gitfort.insights;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Finds failed workflow runs of a repository, classifies them and raises notifications for
 * critical ones.
 */
public class BuildFailureDetector {

	private static final Logger logger = LoggerFactory.getLogger(BuildFailureDetector.class);

	private static final int TOP_WORKFLOWS = 5;

	private final RestService restService;

	private final BuildFailureClassifier classifier;

	private final NotificationListener listener;

	private final Clock clock;

	public BuildFailureDetector(RestService restService, BuildFailureClassifier classifier,
			NotificationListener listener, Clock clock) {
		this.restService = restService;
		this.classifier = classifier;
		this.listener = listener;
		this.clock = clock;
	}

	public BuildFailureClassifier getClassifier() {
		return classifier;
	}

	/**
	 * Failed runs completed within the last {@code days}, classified and marked for
	 * recurrence. Runs whose jobs cannot be fetched are skipped.
	 * @param owner repository owner
	 * @param repo repository name
	 * @param days window length
	 * @return failures, newest first
	 */
	public List<BuildFailure> detectBuildFailures(String owner, String repo, int days) {
		String repository = owner + "/" + repo;
		List<WorkflowRun> failedRuns = restService.getWorkflowRuns(owner, repo, WorkflowRunQuery.completedSince(since(days)))
			.stream()
			.filter(WorkflowRun::isFailure)
			.toList();
		logger.info("Found {} failed workflow runs in {} over the last {} days", failedRuns.size(), repository, days);

		List<BuildFailure> failures = new ArrayList<>();
		for (WorkflowRun run : failedRuns) {
			try {
				BuildFailure failure = classifier.classify(run,
						restService.getWorkflowRunJobs(owner, repo, run.id()), repository);
				if (failure != null) {
					failures.add(failure);
				}
			}
			catch (GitHubException e) {
				logger.warn("Skipping run {} of {}: could not fetch jobs: {}", run.id(), repository, e.getMessage());
			}
		}

		List<BuildFailure> marked = classifier.markRecurrence(failures);
		notifyCritical(repository, marked);
		return marked;
	}

	public FailureAnalysis analyzeFailurePatterns(String owner, String repo, int days) {
		return classifier.analyze(detectBuildFailures(owner, repo, days));
	}

	public List<BuildFailure> detectDeploymentIssues(String owner, String repo, int days) {
		return classifier.deploymentIssues(detectBuildFailures(owner, repo, days));
	}

	public List<RecurringFailure> identifyRecurringFailures(String owner, String repo, int days) {
		return classifier.identifyRecurringFailures(detectBuildFailures(owner, repo, days));
	}

	/**
	 * Success rate, average duration and most failing workflows over completed runs.
	 * @param owner repository owner
	 * @param repo repository name
	 * @param days window length
	 * @return statistics of the window
	 */
	public WorkflowStatistics workflowStatistics(String owner, String repo, int days) {
		List<WorkflowRun> runs = restService.getWorkflowRuns(owner, repo, WorkflowRunQuery.completedSince(since(days)));
		int successful = 0;
		int failed = 0;
		int cancelled = 0;
		long totalMillis = 0;
		int timed = 0;
		Map<String, Integer> failuresByWorkflow = new LinkedHashMap<>();
		for (WorkflowRun run : runs) {
			if ("success".equals(run.conclusion())) {
				successful++;
			}
			else if (run.isFailure()) {
				failed++;
				failuresByWorkflow.merge(run.workflowName(), 1, Integer::sum);
			}
			else if ("cancelled".equals(run.conclusion())) {
				cancelled++;
			}
			Duration duration = run.duration();
			if (!duration.isZero()) {
				totalMillis += duration.toMillis();
				timed++;
			}
		}

		List<WorkflowStatistics.FailureCount> top = failuresByWorkflow.entrySet()
			.stream()
			.map(entry -> new WorkflowStatistics.FailureCount(entry.getKey(), entry.getValue()))
			.sorted(Comparator.comparingInt(WorkflowStatistics.FailureCount::failures).reversed())
			.limit(TOP_WORKFLOWS)
			.toList();
		double successRate = runs.isEmpty() ? 0.0 : successful * 100.0 / runs.size();
		return new WorkflowStatistics(runs.size(), successful, failed, cancelled, successRate,
				Duration.ofMillis(timed > 0 ? totalMillis / timed : 0), top);
	}

	private Instant since(int days) {
		if (days <= 0) {
			throw new IllegalArgumentException("days must be positive: " + days);
		}
		return clock.instant().minus(Duration.ofDays(days));
	}

	private void notifyCritical(String repository, List<BuildFailure> failures) {
		for (BuildFailure failure : failures) {
			if (failure.severity() != Severity.CRITICAL) {
				continue;
			}
			Map<String, Object> payload = new LinkedHashMap<>();
			payload.put("runId", failure.runId());
			payload.put("workflow", failure.workflowName());
			payload.put("branch", failure.branch());
			payload.put("failureType", failure.failureType().name());
			payload.put("reason", failure.failureReason());
			payload.put("suggestedFix", failure.suggestedFix());
			listener.onEvent(new NotificationEvent(NotificationType.CICD_FAILURE, repository, payload, clock.instant()));
		}
	}

}
