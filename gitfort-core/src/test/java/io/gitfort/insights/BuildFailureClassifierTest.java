package io.gitfort.insights;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.util.List;

import static io.gitfort.insights.WorkflowFixtures.*;
import static org.assertj.core.api.Assertions.*;

@DisplayName("BuildFailureClassifier Tests")
class BuildFailureClassifierTest {

	private final BuildFailureClassifier classifier = new BuildFailureClassifier();

	private BuildFailure classify(long runId, String workflow, String job, String step) {
		return classifier.classify(run(runId, workflow, "failure"), List.of(failedJob(runId, job, step)), "acme/api");
	}

	@Nested
	@DisplayName("Classification Tests")
	class ClassificationTest {

		@Test
		@DisplayName("Should describe the first failed step of the first failed job")
		void shouldDescribeFailedStep() {
			WorkflowRun run = run(1, "CI", "failure");
			List<WorkflowJob> jobs = List.of(successfulJob(1, "Lint"), failedJob(1, "Build", "Compile"),
					failedJob(1, "Test", "Unit"));

			BuildFailure failure = classifier.classify(run, jobs, "acme/api");

			assertThat(failure).isNotNull();
			assertThat(failure.failureReason()).isEqualTo("Step \"Compile\" failed in job \"Build\"");
			assertThat(failure.failedJob()).isEqualTo("Build");
			assertThat(failure.failedStep()).isEqualTo("Compile");
			assertThat(failure.repository()).isEqualTo("acme/api");
			assertThat(failure.branch()).isEqualTo("main");
			assertThat(failure.duration()).isEqualTo(Duration.ofMinutes(5));
			assertThat(failure.timestamp()).isEqualTo(CREATED);
			assertThat(failure.recurring()).isFalse();
		}

		@Test
		@DisplayName("Should fall back to the job when no step failed")
		void shouldDescribeFailedJob() {
			BuildFailure failure = classifier.classify(run(2, "CI", "failure"), List.of(jobWithoutFailedStep(2, "Setup")),
					"acme/api");

			assertThat(failure.failureReason()).isEqualTo("Job \"Setup\" failed");
			assertThat(failure.failedStep()).isNull();
		}

		@Test
		@DisplayName("Should return null when no job failed")
		void shouldIgnoreRunsWithoutFailedJobs() {
			assertThat(classifier.classify(run(3, "CI", "failure"), List.of(successfulJob(3, "Build")), "acme/api"))
				.isNull();
		}

		@Test
		@DisplayName("Should use unknown for a missing branch and no duration when untimed")
		void shouldHandleMissingRunData() {
			WorkflowRun run = new WorkflowRun(4, "CI", 7L, "CI", null, null, "completed", "failure", null, null, 4, 1,
					null, Instant.parse("2024-06-03T11:00:00Z"), null, null);

			BuildFailure failure = classifier.classify(run, List.of(failedJob(4, "Build", "Compile")), "acme/api");

			assertThat(failure.branch()).isEqualTo("unknown");
			assertThat(failure.duration()).isNull();
			assertThat(failure.timestamp()).isEqualTo(Instant.parse("2024-06-03T11:00:00Z"));
		}

		@Test
		@DisplayName("Should attach severity, category and suggested fix of the matched pattern")
		void shouldAttachPatternDetails() {
			BuildFailure failure = classify(5, "CI", "Build", "Compilation failed check");

			assertThat(failure.failureType()).isEqualTo(FailureType.BUILD);
			assertThat(failure.severity()).isEqualTo(Severity.HIGH);
			assertThat(failure.category()).isEqualTo("build");
			assertThat(failure.suggestedFix()).isEqualTo(FailureType.BUILD.getSuggestedFix());
		}

	}

	@Nested
	@DisplayName("Pattern Table Tests")
	class PatternTableTest {

		@ParameterizedTest(name = "{0} -> {1}")
		@CsvSource({ "Compilation failed in module core, BUILD", "Unexpected SYNTAX ERROR near line 4, BUILD",
				"1 test failed, TEST", "Assertion error: expected 2, TEST", "Deployment failed on prod, DEPLOYMENT",
				"Module not found: lodash, DEPENDENCY", "npm: package not found, DEPENDENCY",
				"network timeout while fetching, TIMEOUT", "runner lost communication, INFRASTRUCTURE",
				"network unreachable, INFRASTRUCTURE", "segfault, UNKNOWN" })
		@DisplayName("Should classify by the first matching row")
		void shouldClassifyByFirstMatch(String reason, FailureType expected) {
			assertThat(classifier.matchPattern(reason).type()).isEqualTo(expected);
		}

		@Test
		@DisplayName("Should use a custom table")
		void shouldUseCustomTable() {
			BuildFailureClassifier custom = new BuildFailureClassifier(List.of(new FailurePattern(FailureType.DEPLOYMENT,
					"release", "Release job failures", Severity.CRITICAL, "deployment")));

			assertThat(custom.matchPattern("Step \"Publish\" failed in job \"Release\"").severity())
				.isEqualTo(Severity.CRITICAL);
			assertThat(custom.matchPattern("compilation failed")).isEqualTo(FailurePattern.UNKNOWN);
		}

	}

	@Nested
	@DisplayName("Recurrence Tests")
	class RecurrenceTest {

		@Test
		@DisplayName("Should mark failures sharing a normalized reason as recurring")
		void shouldMarkRecurring() {
			List<BuildFailure> failures = List.of(classify(1, "CI", "CI", "Build"), classify(2, "CI", "CI", "Build"),
					classify(3, "Release", "Release", "Deploy"));

			List<BuildFailure> marked = classifier.markRecurrence(failures);

			assertThat(marked).extracting(BuildFailure::recurring).containsExactly(true, true, false);
			assertThat(marked).extracting(BuildFailure::similarFailures).containsExactly(1, 1, 0);
		}

		@Test
		@DisplayName("Should normalize case, digits, quotes and whitespace")
		void shouldNormalizeReason() {
			assertThat(BuildFailureClassifier.normalizeReason("  Step \"Test 12\"   failed in job 'CI-3' "))
				.isEqualTo("step test X failed in job ci-X");
			assertThat(BuildFailureClassifier.normalizeReason("Timeout after 300s"))
				.isEqualTo(BuildFailureClassifier.normalizeReason("timeout after 45s"));
		}

		@Test
		@DisplayName("Should group recurring failures most frequent first")
		void shouldIdentifyRecurringFailures() {
			List<BuildFailure> failures = List.of(classify(1, "CI", "Lint", "Style"), classify(2, "CI", "Test", "Unit"),
					classify(3, "Nightly", "Test", "Unit"), classify(4, "CI", "Test", "Unit"),
					classify(5, "CI", "Lint", "Style"), classify(6, "CI", "Docs", "Publish"));

			List<RecurringFailure> recurring = classifier.identifyRecurringFailures(failures);

			assertThat(recurring).extracting(RecurringFailure::count).containsExactly(3, 2);
			assertThat(recurring.get(0).pattern()).isEqualTo("step unit failed in job test");
			assertThat(recurring.get(0).workflows()).containsExactly("CI", "Nightly");
		}

	}

	@Nested
	@DisplayName("Analysis Tests")
	class AnalysisTest {

		@Test
		@DisplayName("Should aggregate failures by type, workflow and branch")
		void shouldAggregate() {
			BuildFailure first = classifier.classify(
					run(1, "CI", "main", "failure", Instant.parse("2024-06-01T10:00:00Z"), 120),
					List.of(failedJob(1, "Test", "1 test failed")), "acme/api");
			BuildFailure second = classifier.classify(
					run(2, "CI", "feature", "failure", Instant.parse("2024-06-02T10:00:00Z"), 240),
					List.of(failedJob(2, "Build", "Compilation failed")), "acme/api");
			BuildFailure third = classifier.classify(
					run(3, "Deploy", "main", "failure", Instant.parse("2024-06-02T12:00:00Z"), 0),
					List.of(failedJob(3, "Ship", "Upload")), "acme/api");

			FailureAnalysis analysis = classifier.analyze(classifier.markRecurrence(List.of(first, second, third)));

			assertThat(analysis.totalFailures()).isEqualTo(3);
			assertThat(analysis.failuresByType()).containsEntry(FailureType.TEST, 1)
				.containsEntry(FailureType.BUILD, 1)
				.containsEntry(FailureType.UNKNOWN, 1);
			assertThat(analysis.failuresByWorkflow()).containsEntry("CI", 2).containsEntry("Deploy", 1);
			assertThat(analysis.mostProblematicWorkflow()).isEqualTo("CI");
			assertThat(analysis.mostProblematicBranch()).isEqualTo("main");
			assertThat(analysis.averageTimeToFailure()).isEqualTo(Duration.ofMinutes(3));
			assertThat(analysis.recurringFailures()).isZero();
			assertThat(analysis.failureTrends()).extracting(FailureTrend::date)
				.containsExactly(LocalDate.of(2024, 6, 1), LocalDate.of(2024, 6, 2), LocalDate.of(2024, 6, 2));
		}

		@Test
		@DisplayName("Should produce an empty analysis for no failures")
		void shouldAnalyzeNothing() {
			FailureAnalysis analysis = classifier.analyze(List.of());

			assertThat(analysis.totalFailures()).isZero();
			assertThat(analysis.mostProblematicWorkflow()).isNull();
			assertThat(analysis.averageTimeToFailure()).isZero();
		}

		@Test
		@DisplayName("Should be deterministic for the same input")
		void shouldBeDeterministic() {
			List<BuildFailure> failures = classifier.markRecurrence(List.of(classify(1, "CI", "CI", "Build"),
					classify(2, "CI", "CI", "Build"), classify(3, "Release", "Release", "Deploy")));

			assertThat(classifier.analyze(failures)).isEqualTo(classifier.analyze(failures));
			assertThat(classifier.identifyRecurringFailures(failures))
				.isEqualTo(classifier.identifyRecurringFailures(failures));
		}

		@Test
		@DisplayName("Should select deployment failures")
		void shouldSelectDeploymentIssues() {
			List<BuildFailure> failures = List.of(classify(1, "CI", "CI", "Deployment failed gate"),
					classify(2, "CI", "CI", "Build"));

			assertThat(classifier.deploymentIssues(failures)).extracting(BuildFailure::runId).containsExactly(1L);
		}

	}

}
