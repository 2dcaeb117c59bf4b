package io.gitfort.insights;

import java.time.Instant;

/**
 * Cached streak view of one user.
 *
 * @param username user login
 * @param streak streak statistics
 * @param contributions activity totals over the same window
 * @param calculatedAt when the summary was computed
 */
public record StreakSummary(String username, StreakStats streak, ContributionStats contributions,
		Instant calculatedAt) {
}
