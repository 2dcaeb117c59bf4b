package io.gitfort.insights;

/**
 * A secret found on one line of a file.
 *
 * @param file repository path
 * @param line 1-based line number
 * @param type detector family
 * @param severity detector severity
 * @param description what was found
 * @param suggestion remediation of the family
 */
public record Vulnerability(String file, int line, VulnerabilityType type, Severity severity, String description,
		String suggestion) {
}
