package io.gitfort.insights;

import java.util.Locale;

/**
 * One row of the failure classification table: a lowercase substring and what a match
 * means.
 *
 * @param type failure category
 * @param pattern substring looked up case-insensitively in the failure reason
 * @param description what the pattern indicates
 * @param severity severity assigned on match
 * @param category reporting category
 */
public record FailurePattern(FailureType type, String pattern, String description, Severity severity,
		String category) {

	/**
	 * Result for reasons no pattern matches.
	 */
	public static final FailurePattern UNKNOWN = new FailurePattern(FailureType.UNKNOWN, "unknown",
			"Unknown failure type", Severity.MEDIUM, "general");

	public boolean matches(String reason) {
		return reason.toLowerCase(Locale.ROOT).contains(pattern.toLowerCase(Locale.ROOT));
	}

}
