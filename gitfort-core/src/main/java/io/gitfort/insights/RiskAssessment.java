package io.gitfort.insights;

/**
 * Risk tier of a streak at one moment.
 *
 * @param level risk tier
 * @param message human readable summary
 * @param hoursRemaining hours left until the streak deadline, never negative
 */
public record RiskAssessment(RiskLevel level, String message, double hoursRemaining) {

	public int severity() {
		return level.getSeverity();
	}

}
