package io.gitfort.insights;

import java.util.List;

/**
 * The ordered failure classification table.
 *
 * <p>
 * Order matters: a reason is classified by the first row whose substring it contains, so
 * "network timeout" is a TIMEOUT, not an INFRASTRUCTURE failure.
 */
public final class FailurePatterns {

	public static final List<FailurePattern> DEFAULT = List.of(
			new FailurePattern(FailureType.BUILD, "compilation failed", "Code compilation errors", Severity.HIGH,
					"build"),
			new FailurePattern(FailureType.BUILD, "syntax error", "Syntax errors in code", Severity.HIGH, "build"),
			new FailurePattern(FailureType.TEST, "test failed", "Unit or integration test failures", Severity.MEDIUM,
					"testing"),
			new FailurePattern(FailureType.TEST, "assertion error", "Test assertion failures", Severity.MEDIUM,
					"testing"),
			new FailurePattern(FailureType.DEPLOYMENT, "deployment failed", "Deployment process failures",
					Severity.CRITICAL, "deployment"),
			new FailurePattern(FailureType.DEPENDENCY, "module not found", "Missing or incorrect dependencies",
					Severity.HIGH, "dependencies"),
			new FailurePattern(FailureType.DEPENDENCY, "package not found", "Package installation failures",
					Severity.HIGH, "dependencies"),
			new FailurePattern(FailureType.TIMEOUT, "timeout", "Process or step timeouts", Severity.MEDIUM,
					"performance"),
			new FailurePattern(FailureType.INFRASTRUCTURE, "runner", "CI/CD runner issues", Severity.LOW,
					"infrastructure"),
			new FailurePattern(FailureType.INFRASTRUCTURE, "network", "Network connectivity issues", Severity.LOW,
					"infrastructure"));

	private FailurePatterns() {
	}

	/**
	 * First matching row of the table, or {@link FailurePattern#UNKNOWN}.
	 * @param table ordered patterns
	 * @param reason failure reason text
	 * @return the matching pattern
	 */
	public static FailurePattern match(List<FailurePattern> table, String reason) {
		for (FailurePattern pattern : table) {
			if (pattern.matches(reason)) {
				return pattern;
			}
		}
		return FailurePattern.UNKNOWN;
	}

}
