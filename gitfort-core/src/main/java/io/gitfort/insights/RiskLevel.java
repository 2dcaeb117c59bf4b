package io.gitfort.insights;

/**
 * Streak risk tiers, ordered by severity.
 */
public enum RiskLevel {

	SAFE(1, "Your streak is safe", 24),

	WARNING(2, "Consider making a contribution soon", 8),

	DANGER(3, "Your streak is at risk", 4),

	CRITICAL(4, "Your streak will end soon", 1);

	private final int severity;

	private final String message;

	private final int notificationCooldownHours;

	RiskLevel(int severity, String message, int notificationCooldownHours) {
		this.severity = severity;
		this.message = message;
		this.notificationCooldownHours = notificationCooldownHours;
	}

	public int getSeverity() {
		return severity;
	}

	public String getMessage() {
		return message;
	}

	/**
	 * Minimum hours between two risk notifications at this level.
	 */
	public int getNotificationCooldownHours() {
		return notificationCooldownHours;
	}

}
