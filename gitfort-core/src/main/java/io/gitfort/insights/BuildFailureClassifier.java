package io.gitfort.insights;

import org.jspecify.annotations.Nullable;

import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Classifies failed workflow runs and aggregates them. Pure and deterministic: the same
 * input always yields equal output.
 *
 * <p>
 * Recurrence is a property of the whole window: every failure is compared with all others
 * in the list passed to {@link #markRecurrence(List)}, regardless of order.
 */
public class BuildFailureClassifier {

	private static final Pattern DIGITS = Pattern.compile("\\d+");

	private static final Pattern QUOTES = Pattern.compile("['\"]");

	private static final Pattern WHITESPACE = Pattern.compile("\\s+");

	private final List<FailurePattern> patterns;

	public BuildFailureClassifier() {
		this(FailurePatterns.DEFAULT);
	}

	public BuildFailureClassifier(List<FailurePattern> patterns) {
		this.patterns = List.copyOf(patterns);
	}

	/**
	 * Classify one failed run from its jobs.
	 * @param run the failed run
	 * @param jobs jobs of the run
	 * @param repository "owner/repo"
	 * @return the failure, or null when no job failed
	 */
	public @Nullable BuildFailure classify(WorkflowRun run, List<WorkflowJob> jobs, String repository) {
		WorkflowJob failedJob = jobs.stream().filter(WorkflowJob::isFailure).findFirst().orElse(null);
		if (failedJob == null) {
			return null;
		}
		WorkflowStep failedStep = failedJob.firstFailedStep().orElse(null);
		String reason = failureReason(failedJob, failedStep);
		FailurePattern pattern = FailurePatterns.match(patterns, reason);

		Duration duration = run.duration();
		Instant timestamp = run.createdAt() != null ? run.createdAt()
				: run.updatedAt() != null ? run.updatedAt() : Instant.EPOCH;
		return new BuildFailure(run.id(), run.workflowName(), repository,
				run.headBranch() != null ? run.headBranch() : "unknown", pattern.type(), reason,
				failedStep != null ? failedStep.name() : null, failedJob.name(), timestamp,
				duration.isZero() ? null : duration, run.actor(), run.headSha(), false, 0, pattern.severity(),
				pattern.category(), pattern.type().getSuggestedFix());
	}

	public FailurePattern matchPattern(String reason) {
		return FailurePatterns.match(patterns, reason);
	}

	/**
	 * Mark each failure with the number of other failures sharing its normalized reason.
	 * @param failures all failures of the window
	 * @return the same failures, in order, with recurrence filled in
	 */
	public List<BuildFailure> markRecurrence(List<BuildFailure> failures) {
		Map<String, Integer> counts = new LinkedHashMap<>();
		for (BuildFailure failure : failures) {
			counts.merge(normalizeReason(failure.failureReason()), 1, Integer::sum);
		}
		List<BuildFailure> marked = new ArrayList<>(failures.size());
		for (BuildFailure failure : failures) {
			int occurrences = counts.get(normalizeReason(failure.failureReason()));
			marked.add(failure.withRecurrence(occurrences - 1));
		}
		return marked;
	}

	/**
	 * Lowercase, digit runs to {@code X}, quotes removed, whitespace collapsed and trimmed.
	 */
	public static String normalizeReason(String reason) {
		String normalized = reason.toLowerCase(Locale.ROOT);
		normalized = DIGITS.matcher(normalized).replaceAll("X");
		normalized = QUOTES.matcher(normalized).replaceAll("");
		normalized = WHITESPACE.matcher(normalized).replaceAll(" ");
		return normalized.trim();
	}

	public FailureAnalysis analyze(List<BuildFailure> failures) {
		Map<FailureType, Integer> byType = new LinkedHashMap<>();
		Map<String, Integer> byWorkflow = new LinkedHashMap<>();
		Map<String, Integer> byBranch = new LinkedHashMap<>();
		Map<LocalDate, Map<FailureType, Integer>> byDay = new LinkedHashMap<>();
		int recurring = 0;
		int critical = 0;
		long totalMillis = 0;
		int withDuration = 0;

		for (BuildFailure failure : failures) {
			byType.merge(failure.failureType(), 1, Integer::sum);
			byWorkflow.merge(failure.workflowName(), 1, Integer::sum);
			byBranch.merge(failure.branch(), 1, Integer::sum);
			if (failure.recurring()) {
				recurring++;
			}
			if (failure.severity() == Severity.CRITICAL) {
				critical++;
			}
			Duration duration = failure.duration();
			if (duration != null && !duration.isZero()) {
				totalMillis += duration.toMillis();
				withDuration++;
			}
			LocalDate day = LocalDate.ofInstant(failure.timestamp(), ZoneOffset.UTC);
			byDay.computeIfAbsent(day, key -> new LinkedHashMap<>()).merge(failure.failureType(), 1, Integer::sum);
		}

		List<FailureTrend> trends = new ArrayList<>();
		byDay.forEach((day, types) -> types.forEach((type, count) -> trends.add(new FailureTrend(day, type, count))));
		trends.sort(Comparator.comparing(FailureTrend::date));

		return new FailureAnalysis(failures.size(), Collections.unmodifiableMap(byType),
				Collections.unmodifiableMap(byWorkflow), Collections.unmodifiableMap(byBranch), recurring, critical,
				Duration.ofMillis(withDuration > 0 ? totalMillis / withDuration : 0), mostFrequent(byWorkflow),
				mostFrequent(byBranch), List.copyOf(trends));
	}

	/**
	 * Normalized reasons occurring at least twice, most frequent first.
	 * @param failures failures of the window
	 * @return recurring patterns
	 */
	public List<RecurringFailure> identifyRecurringFailures(List<BuildFailure> failures) {
		Map<String, List<BuildFailure>> groups = new LinkedHashMap<>();
		for (BuildFailure failure : failures) {
			groups.computeIfAbsent(normalizeReason(failure.failureReason()), key -> new ArrayList<>()).add(failure);
		}

		List<RecurringFailure> result = new ArrayList<>();
		groups.forEach((pattern, group) -> {
			if (group.size() < 2) {
				return;
			}
			Set<String> workflows = new LinkedHashSet<>();
			Set<String> branches = new LinkedHashSet<>();
			Instant first = group.get(0).timestamp();
			Instant last = first;
			for (BuildFailure failure : group) {
				workflows.add(failure.workflowName());
				branches.add(failure.branch());
				first = failure.timestamp().isBefore(first) ? failure.timestamp() : first;
				last = failure.timestamp().isAfter(last) ? failure.timestamp() : last;
			}
			result.add(new RecurringFailure(pattern, group.size(), List.copyOf(workflows), List.copyOf(branches),
					first, last, group.get(0).severity()));
		});
		result.sort(Comparator.comparingInt(RecurringFailure::count).reversed());
		return result;
	}

	public List<BuildFailure> deploymentIssues(List<BuildFailure> failures) {
		return failures.stream()
			.filter(failure -> failure.failureType() == FailureType.DEPLOYMENT
					|| "deployment".equals(failure.category()))
			.toList();
	}

	private static String failureReason(WorkflowJob job, @Nullable WorkflowStep step) {
		if (step != null) {
			return "Step \"" + step.name() + "\" failed in job \"" + job.name() + "\"";
		}
		return "Job \"" + job.name() + "\" failed";
	}

	private static <K> @Nullable K mostFrequent(Map<K, Integer> counts) {
		K best = null;
		int bestCount = 0;
		for (Map.Entry<K, Integer> entry : counts.entrySet()) {
			if (entry.getValue() > bestCount) {
				best = entry.getKey();
				bestCount = entry.getValue();
			}
		}
		return best;
	}

}
