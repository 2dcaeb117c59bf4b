package io.gitfort.insights;

import org.jspecify.annotations.Nullable;

import java.time.LocalDate;

/**
 * Streak summary of a contribution sequence. Derived data, recomputed from scratch on each
 * evaluation.
 *
 * @param currentStreak consecutive contributing days ending today (or yesterday)
 * @param longestStreak longest run of consecutive contributing days
 * @param atRisk whether too many hours have passed since the last contribution
 * @param lastContributionDate latest date with contributions
 * @param streakStartDate first day of the current streak
 * @param longestStreakStartDate first day of the longest streak
 * @param longestStreakEndDate last day of the longest streak
 */
public record StreakStats(int currentStreak, int longestStreak, boolean atRisk,
		@Nullable LocalDate lastContributionDate, @Nullable LocalDate streakStartDate,
		@Nullable LocalDate longestStreakStartDate, @Nullable LocalDate longestStreakEndDate) {
}
