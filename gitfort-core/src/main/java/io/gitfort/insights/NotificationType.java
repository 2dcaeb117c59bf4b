package io.gitfort.insights;

/**
 * Kinds of events the analytics publish for delivery by the host application.
 */
public enum NotificationType {

	STREAK_RISK, SECURITY_ALERT, CICD_FAILURE, WEEKLY_DIGEST

}
