package io.gitfort.insights;

import org.jspecify.annotations.Nullable;

import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Streak computations over a sequence of {@link ContributionDay}s. Stateless; "today" is
 * always passed in so results are reproducible.
 *
 * <p>
 * A streak counts consecutive calendar days with at least one contribution. A day without
 * contributions today does not break the current streak until the day is over, so the
 * backward walk starts at yesterday when today is still empty.
 */
public class StreakCalculator {

	public static final double DEFAULT_RISK_THRESHOLD_HOURS = 20;

	private final ZoneId zone;

	private final double riskThresholdHours;

	public StreakCalculator() {
		this(ZoneOffset.UTC);
	}

	public StreakCalculator(ZoneId zone) {
		this(zone, DEFAULT_RISK_THRESHOLD_HOURS);
	}

	/**
	 * @param zone zone in which calendar dates and "today" are interpreted
	 * @param riskThresholdHours hours since the last contribution after which a streak is at
	 * risk
	 */
	public StreakCalculator(ZoneId zone, double riskThresholdHours) {
		this.zone = zone;
		this.riskThresholdHours = riskThresholdHours;
	}

	public int currentStreak(List<ContributionDay> days, LocalDate today) {
		Map<LocalDate, Integer> counts = countsByDate(days);
		LocalDate check = streakAnchor(counts, today);
		int streak = 0;
		while (counts.getOrDefault(check, 0) > 0) {
			streak++;
			check = check.minusDays(1);
		}
		return streak;
	}

	public int longestStreak(List<ContributionDay> days) {
		int longest = 0;
		int run = 0;
		LocalDate previous = null;
		for (ContributionDay day : sortedAscending(days)) {
			if (day.hasContributions()) {
				run = (previous == null || previous.plusDays(1).equals(day.date())) ? run + 1 : 1;
				previous = day.date();
			}
			else {
				run = 0;
				previous = null;
			}
			longest = Math.max(longest, run);
		}
		return longest;
	}

	/**
	 * Whether more than {@code thresholdHours} passed since the last contribution.
	 * @param lastContribution last contribution time, null when there is none
	 * @param now evaluation time
	 * @param thresholdHours hours after which the streak is at risk
	 * @return true if absent or older than the threshold
	 */
	public boolean isAtRisk(@Nullable Instant lastContribution, Instant now, double thresholdHours) {
		if (lastContribution == null) {
			return true;
		}
		double hours = Duration.between(lastContribution, now).toMillis() / 3_600_000.0;
		return hours > thresholdHours;
	}

	public boolean isAtRisk(@Nullable Instant lastContribution, Instant now) {
		return isAtRisk(lastContribution, now, riskThresholdHours);
	}

	/**
	 * Full streak summary at the given instant.
	 * @param days contribution sequence in any order
	 * @param now evaluation time; today is its date in the calculator's zone
	 * @return streak statistics
	 */
	public StreakStats statistics(List<ContributionDay> days, Instant now) {
		LocalDate today = LocalDate.ofInstant(now, zone);
		Map<LocalDate, Integer> counts = countsByDate(days);

		int current = currentStreak(days, today);
		LocalDate streakStart = current > 0 ? streakAnchor(counts, today).minusDays(current - 1L) : null;
		LocalDate lastContribution = lastContributionDate(days);
		Instant lastInstant = lastContribution != null ? startOfDay(lastContribution) : null;

		LocalDate[] longestRange = longestStreakRange(days);
		return new StreakStats(current, longestStreak(days), isAtRisk(lastInstant, now), lastContribution,
				streakStart, longestRange[0], longestRange[1]);
	}

	public @Nullable LocalDate lastContributionDate(List<ContributionDay> days) {
		LocalDate last = null;
		for (ContributionDay day : days) {
			if (day.hasContributions() && (last == null || day.date().isAfter(last))) {
				last = day.date();
			}
		}
		return last;
	}

	/**
	 * Instant at which a contribution date starts in the calculator's zone.
	 */
	public Instant startOfDay(LocalDate date) {
		return date.atStartOfDay(zone).toInstant();
	}

	public ZoneId getZone() {
		return zone;
	}

	private static LocalDate streakAnchor(Map<LocalDate, Integer> counts, LocalDate today) {
		return counts.getOrDefault(today, 0) > 0 ? today : today.minusDays(1);
	}

	/**
	 * Start and end of the first longest run; both null without contributions.
	 */
	private LocalDate[] longestStreakRange(List<ContributionDay> days) {
		LocalDate[] best = new LocalDate[2];
		int longest = 0;
		int run = 0;
		LocalDate runStart = null;
		LocalDate previous = null;
		for (ContributionDay day : sortedAscending(days)) {
			if (day.hasContributions()) {
				if (previous == null || !previous.plusDays(1).equals(day.date())) {
					run = 0;
					runStart = day.date();
				}
				run++;
				previous = day.date();
				if (run > longest) {
					longest = run;
					best[0] = runStart;
					best[1] = day.date();
				}
			}
			else {
				run = 0;
				previous = null;
			}
		}
		return best;
	}

	private static Map<LocalDate, Integer> countsByDate(List<ContributionDay> days) {
		Map<LocalDate, Integer> counts = new HashMap<>();
		for (ContributionDay day : days) {
			counts.merge(day.date(), day.contributionCount(), Integer::sum);
		}
		return counts;
	}

	/**
	 * One entry per date, counts of duplicate dates summed, ascending by date.
	 */
	private static List<ContributionDay> sortedAscending(List<ContributionDay> days) {
		Map<LocalDate, Integer> merged = new TreeMap<>(countsByDate(days));
		List<ContributionDay> sorted = new ArrayList<>(merged.size());
		merged.forEach((date, count) -> sorted.add(new ContributionDay(date, count)));
		return sorted;
	}

}
