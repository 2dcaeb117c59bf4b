package io.gitfort.insights;

/**
 * Category of a failed workflow run, each with a fixed remediation hint.
 */
public enum FailureType {

	BUILD("Check compilation errors and fix syntax issues"),

	TEST("Review failing tests and update test cases or fix implementation"),

	DEPLOYMENT("Verify deployment configuration and target environment"),

	DEPENDENCY("Update dependencies or fix version conflicts"),

	TIMEOUT("Optimize performance or increase timeout limits"),

	INFRASTRUCTURE("Check runner availability and resource limits"),

	UNKNOWN("Review logs and error messages for specific guidance");

	private final String suggestedFix;

	FailureType(String suggestedFix) {
		this.suggestedFix = suggestedFix;
	}

	public String getSuggestedFix() {
		return suggestedFix;
	}

}
