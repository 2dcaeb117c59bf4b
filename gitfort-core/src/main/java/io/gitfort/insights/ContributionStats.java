package io.gitfort.insights;

/**
 * Activity totals over a contribution sequence.
 *
 * @param totalContributions sum of all counts
 * @param averagePerDay total divided by the number of days, rounded to two decimals
 * @param maxContributionsInDay highest single-day count
 * @param activeDays days with at least one contribution
 * @param streakDays current streak length
 */
public record ContributionStats(int totalContributions, double averagePerDay, int maxContributionsInDay,
		int activeDays, int streakDays) {

	public static ContributionStats empty() {
		return new ContributionStats(0, 0.0, 0, 0, 0);
	}

}
