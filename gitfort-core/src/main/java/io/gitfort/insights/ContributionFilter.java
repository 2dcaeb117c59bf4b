package io.gitfort.insights;

import org.jspecify.annotations.Nullable;

/**
 * Selection applied to a contribution sequence before computing statistics.
 *
 * @param minContributions keep only days with at least this many contributions
 * @param includeWeekends keep Saturdays and Sundays
 * @param maxDays keep only the most recent N days
 */
public record ContributionFilter(@Nullable Integer minContributions, boolean includeWeekends,
		@Nullable Integer maxDays) {

	public static ContributionFilter none() {
		return new ContributionFilter(null, true, null);
	}

	public static ContributionFilter weekdaysOnly() {
		return new ContributionFilter(null, false, null);
	}

}
