package io.gitfort.insights;

import java.time.LocalDate;

/**
 * Contribution count for one calendar date, as reported by the contribution calendar.
 *
 * @param date calendar date in the provider's reporting timezone
 * @param contributionCount number of contributions on that date (never negative)
 */
public record ContributionDay(LocalDate date, int contributionCount) {

	public ContributionDay {
		if (contributionCount < 0) {
			throw new IllegalArgumentException("contributionCount must be non-negative: " + contributionCount);
		}
	}

	public static ContributionDay of(String isoDate, int contributionCount) {
		return new ContributionDay(LocalDate.parse(isoDate), contributionCount);
	}

	public boolean hasContributions() {
		return contributionCount > 0;
	}

}
