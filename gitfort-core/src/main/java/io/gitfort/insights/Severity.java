package io.gitfort.insights;

/**
 * Severity of a build failure or a security finding, ordered from least to most severe.
 */
public enum Severity {

	LOW, MEDIUM, HIGH, CRITICAL

}
