package io.gitfort.insights;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.DayOfWeek;
import java.time.LocalDate;
import java.time.YearMonth;
import java.time.temporal.TemporalAdjusters;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.SortedMap;
import java.util.TreeMap;

/**
 * Filtering, grouping and totals over contribution sequences.
 */
public class ContributionStatistics {

	private final StreakCalculator streakCalculator;

	public ContributionStatistics(StreakCalculator streakCalculator) {
		this.streakCalculator = streakCalculator;
	}

	public ContributionStats calculate(List<ContributionDay> days, LocalDate today) {
		if (days.isEmpty()) {
			return ContributionStats.empty();
		}
		int total = 0;
		int max = 0;
		int active = 0;
		for (ContributionDay day : days) {
			total += day.contributionCount();
			max = Math.max(max, day.contributionCount());
			if (day.hasContributions()) {
				active++;
			}
		}
		double average = BigDecimal.valueOf(total)
			.divide(BigDecimal.valueOf(days.size()), 2, RoundingMode.HALF_UP)
			.doubleValue();
		return new ContributionStats(total, average, max, active, streakCalculator.currentStreak(days, today));
	}

	/**
	 * Apply a filter; the result is sorted ascending by date.
	 * @param days contribution sequence
	 * @param filter selection to apply
	 * @return filtered days
	 */
	public List<ContributionDay> filter(List<ContributionDay> days, ContributionFilter filter) {
		List<ContributionDay> result = new ArrayList<>(days);
		result.sort(Comparator.comparing(ContributionDay::date));
		if (filter.minContributions() != null) {
			int min = filter.minContributions();
			result.removeIf(day -> day.contributionCount() < min);
		}
		if (!filter.includeWeekends()) {
			result.removeIf(day -> day.date().getDayOfWeek() == DayOfWeek.SATURDAY
					|| day.date().getDayOfWeek() == DayOfWeek.SUNDAY);
		}
		if (filter.maxDays() != null && result.size() > filter.maxDays()) {
			result = new ArrayList<>(result.subList(result.size() - filter.maxDays(), result.size()));
		}
		return result;
	}

	public List<ContributionDay> filterByDateRange(List<ContributionDay> days, LocalDate from, LocalDate to) {
		List<ContributionDay> result = new ArrayList<>();
		for (ContributionDay day : days) {
			if (!day.date().isBefore(from) && !day.date().isAfter(to)) {
				result.add(day);
			}
		}
		return result;
	}

	public SortedMap<YearMonth, List<ContributionDay>> groupByMonth(List<ContributionDay> days) {
		SortedMap<YearMonth, List<ContributionDay>> grouped = new TreeMap<>();
		for (ContributionDay day : days) {
			grouped.computeIfAbsent(YearMonth.from(day.date()), key -> new ArrayList<>()).add(day);
		}
		return grouped;
	}

	/**
	 * Group by week, keyed by the Sunday that starts each week.
	 */
	public SortedMap<LocalDate, List<ContributionDay>> groupByWeek(List<ContributionDay> days) {
		SortedMap<LocalDate, List<ContributionDay>> grouped = new TreeMap<>();
		for (ContributionDay day : days) {
			LocalDate weekStart = day.date().with(TemporalAdjusters.previousOrSame(DayOfWeek.SUNDAY));
			grouped.computeIfAbsent(weekStart, key -> new ArrayList<>()).add(day);
		}
		return grouped;
	}

}
