package io.gitfort.insights.cli;

import ch.qos.logback.classic.Level;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.gitfort.insights.ArgumentParser;
import io.gitfort.insights.BuildFailure;
import io.gitfort.insights.BuildFailureClassifier;
import io.gitfort.insights.BuildFailureDetector;
import io.gitfort.insights.FailureAnalysis;
import io.gitfort.insights.GitFort;
import io.gitfort.insights.GitFortBuilder;
import io.gitfort.insights.GitFortProperties;
import io.gitfort.insights.GitHubException;
import io.gitfort.insights.ObjectMapperFactory;
import io.gitfort.insights.ParsedConfiguration;
import io.gitfort.insights.RateLimitInfo;
import io.gitfort.insights.RecurringFailure;
import io.gitfort.insights.RepositoryScanReport;
import io.gitfort.insights.ScanOptions;
import io.gitfort.insights.Severity;
import io.gitfort.insights.StreakRiskAnalysis;
import io.gitfort.insights.StreakSummary;
import io.gitfort.insights.Vulnerability;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.PrintStream;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.function.Function;

/**
 * GitFort Insights CLI.
 *
 * <p>
 * Usage: {@code java -jar gitfort-cli.jar <command> [target] [OPTIONS]}. Results go to
 * standard output, logging to standard error.
 *
 * <p>
 * Exit codes: 0 success, 1 failure, 2 usage error.
 */
public class GitFortCli {

	private static final Logger logger = LoggerFactory.getLogger(GitFortCli.class);

	static final int EXIT_OK = 0;

	static final int EXIT_FAILURE = 1;

	static final int EXIT_USAGE = 2;

	public static void main(String[] args) {
		int exitCode = run(args);
		if (exitCode != EXIT_OK) {
			System.exit(exitCode);
		}
	}

	public static int run(String[] args) {
		return run(args, System.out, properties -> GitFortBuilder.create().tokenFromEnv().properties(properties).build());
	}

	/**
	 * Run one command.
	 * @param args command line
	 * @param out where results are printed
	 * @param factory creates the services for the parsed properties
	 * @return process exit code
	 */
	static int run(String[] args, PrintStream out, Function<GitFortProperties, GitFort> factory) {
		GitFortProperties properties = new GitFortProperties();
		ArgumentParser argumentParser = new ArgumentParser(properties);

		if (argumentParser.isHelpRequested(args)) {
			out.println(argumentParser.generateHelpText());
			return EXIT_OK;
		}

		ParsedConfiguration config;
		try {
			config = argumentParser.parseAndValidate(args);
		}
		catch (IllegalArgumentException e) {
			logger.error(e.getMessage());
			out.println(argumentParser.generateHelpText());
			return EXIT_USAGE;
		}

		if (config.verbose) {
			properties.setVerbose(true);
			enableVerboseLogging();
		}
		properties.setMaxFiles(config.maxFiles);
		properties.setFailureWindowDays(config.days);
		logger.debug("Configuration: {}", config);

		try (GitFort gitFort = factory.apply(properties)) {
			Object result = execute(gitFort, config);
			out.println(config.json ? toJson(result) : render(result));
			return EXIT_OK;
		}
		catch (GitHubException e) {
			logger.error("{} failed: {}", config.command, e.getMessage());
			return EXIT_FAILURE;
		}
		catch (IllegalStateException e) {
			logger.error(e.getMessage());
			return EXIT_FAILURE;
		}
	}

	private static Object execute(GitFort gitFort, ParsedConfiguration config) {
		String command = config.command != null ? config.command : "";
		switch (command) {
			case "streak": {
				String username = Objects.requireNonNull(config.target);
				StreakSummary summary = gitFort.streaks().getStreakSummary(username);
				StreakRiskAnalysis risk = gitFort.streaks().analyzeRisk(username);
				return new StreakReport(summary, risk);
			}
			case "failures": {
				BuildFailureDetector detector = gitFort.buildFailures();
				List<BuildFailure> failures = detector.detectBuildFailures(config.owner(), config.repo(), config.days);
				BuildFailureClassifier classifier = detector.getClassifier();
				return new FailureReport(Objects.requireNonNull(config.target), config.days, failures,
						classifier.analyze(failures), classifier.identifyRecurringFailures(failures));
			}
			case "scan":
				return gitFort.scanner()
					.scanRepository(config.owner(), config.repo(),
							ScanOptions.from(gitFort.properties()).withMaxFiles(config.maxFiles));
			case "rate-limit":
				return gitFort.rest().getRateLimit();
			default:
				throw new IllegalStateException("Unknown command: " + command);
		}
	}

	private static String render(Object result) {
		StringBuilder text = new StringBuilder();
		if (result instanceof StreakReport report) {
			renderStreak(text, report);
		}
		else if (result instanceof FailureReport report) {
			renderFailures(text, report);
		}
		else if (result instanceof RepositoryScanReport report) {
			renderScan(text, report);
		}
		else if (result instanceof RateLimitInfo rateLimit) {
			text.append("Rate limit: ")
				.append(rateLimit.remaining())
				.append('/')
				.append(rateLimit.limit())
				.append(" remaining, resets at ")
				.append(rateLimit.getResetTime())
				.append('\n');
		}
		return text.toString();
	}

	private static void renderStreak(StringBuilder text, StreakReport report) {
		StreakSummary summary = report.summary();
		text.append("Streak for ").append(summary.username()).append('\n');
		text.append("  Current streak: ").append(summary.streak().currentStreak()).append(" days\n");
		text.append("  Longest streak: ").append(summary.streak().longestStreak()).append(" days\n");
		text.append("  Last contribution: ")
			.append(summary.streak().lastContributionDate() != null ? summary.streak().lastContributionDate() : "none")
			.append('\n');
		text.append("  Contributions: ")
			.append(summary.contributions().totalContributions())
			.append(" over ")
			.append(summary.contributions().activeDays())
			.append(" active days\n");
		text.append("  Risk: ")
			.append(report.risk().level())
			.append(" - ")
			.append(report.risk().risk().message())
			.append('\n');
		for (String recommendation : report.risk().recommendations()) {
			text.append("    * ").append(recommendation).append('\n');
		}
	}

	private static void renderFailures(StringBuilder text, FailureReport report) {
		FailureAnalysis analysis = report.analysis();
		text.append("Build failures in ")
			.append(report.repository())
			.append(" (last ")
			.append(report.days())
			.append(" days): ")
			.append(analysis.totalFailures())
			.append('\n');
		for (BuildFailure failure : report.failures()) {
			text.append("  #")
				.append(failure.runId())
				.append(' ')
				.append(failure.workflowName())
				.append(" [")
				.append(failure.branch())
				.append("] ")
				.append(failure.failureType())
				.append('/')
				.append(failure.severity())
				.append(failure.recurring() ? " (recurring)" : "")
				.append(": ")
				.append(failure.failureReason())
				.append('\n');
			text.append("      fix: ").append(failure.suggestedFix()).append('\n');
		}
		if (analysis.mostProblematicWorkflow() != null) {
			text.append("  Most problematic workflow: ").append(analysis.mostProblematicWorkflow()).append('\n');
		}
		for (RecurringFailure recurring : report.recurring()) {
			text.append("  Recurring x")
				.append(recurring.count())
				.append(": ")
				.append(recurring.pattern())
				.append('\n');
		}
	}

	private static void renderScan(StringBuilder text, RepositoryScanReport report) {
		text.append("Secret scan of ")
			.append(report.repository())
			.append(": ")
			.append(report.result().scannedFiles())
			.append(" of ")
			.append(report.result().totalFiles())
			.append(" files scanned\n");
		text.append("  Risk score: ")
			.append(report.riskScore())
			.append(", security score: ")
			.append(report.securityScore())
			.append('\n');
		Map<Severity, Long> counts = new LinkedHashMap<>();
		for (Severity severity : Severity.values()) {
			counts.put(severity, report.result().count(severity));
		}
		text.append("  Findings: ").append(counts).append('\n');
		for (Vulnerability vulnerability : report.result().vulnerabilities()) {
			text.append("  ")
				.append(vulnerability.file())
				.append(':')
				.append(vulnerability.line())
				.append(' ')
				.append(vulnerability.severity())
				.append(' ')
				.append(vulnerability.description())
				.append('\n');
		}
	}

	private static String toJson(Object result) {
		ObjectMapper mapper = ObjectMapperFactory.createForReports();
		try {
			return mapper.writeValueAsString(result);
		}
		catch (JsonProcessingException e) {
			throw new IllegalStateException("Could not render result as JSON", e);
		}
	}

	private static void enableVerboseLogging() {
		if (LoggerFactory.getLogger("io.gitfort.insights") instanceof ch.qos.logback.classic.Logger logbackLogger) {
			logbackLogger.setLevel(Level.DEBUG);
		}
	}

	record StreakReport(StreakSummary summary, StreakRiskAnalysis risk) {
	}

	record FailureReport(String repository, int days, List<BuildFailure> failures, FailureAnalysis analysis,
			List<RecurringFailure> recurring) {
	}

}
