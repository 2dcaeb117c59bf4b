package io.gitfort.insights;

import org.jspecify.annotations.Nullable;

import java.time.DayOfWeek;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalTime;
import java.time.ZonedDateTime;
import java.util.ArrayList;
import java.util.List;

/**
 * Tiered streak risk model used for notifications.
 *
 * <p>
 * Elapsed hours since the last contribution are reduced by a weekend grace and mapped to a
 * {@link RiskLevel}. The grace equals the weekend time inside the elapsed window, capped at
 * {@link RiskDetectionConfig#gracePeriodHours()}, so severity never decreases as time
 * passes. Without any contribution history the result is CRITICAL.
 */
public class StreakRiskDetector {

	private static final double MILLIS_PER_HOUR = 3_600_000.0;

	private final RiskDetectionConfig config;

	public StreakRiskDetector() {
		this(RiskDetectionConfig.defaults());
	}

	public StreakRiskDetector(RiskDetectionConfig config) {
		this.config = config;
	}

	public RiskDetectionConfig getConfig() {
		return config;
	}

	/**
	 * Analyze the risk of losing a streak.
	 * @param lastContribution time of the last contribution, null without history
	 * @param currentStreak current streak length in days
	 * @param now evaluation time
	 * @return tier, recommendations and deadlines
	 */
	public StreakRiskAnalysis analyzeStreakRisk(@Nullable Instant lastContribution, int currentStreak, Instant now) {
		boolean weekend = isWeekend(now);
		if (lastContribution == null) {
			RiskAssessment risk = new RiskAssessment(RiskLevel.CRITICAL, "No contribution history found", 0);
			return new StreakRiskAnalysis(risk,
					List.of("Start your contribution streak today", "Make your first commit to begin tracking"), now,
					null, 0, weekend);
		}

		double hoursSince = hoursBetween(lastContribution, now);
		RiskAssessment risk = assess(lastContribution, now);
		Instant deadline = nextContributionDeadline(lastContribution);
		Instant streakEnd = risk.level().compareTo(RiskLevel.DANGER) >= 0 ? deadline : null;

		return new StreakRiskAnalysis(risk, recommendations(risk, weekend, currentStreak), deadline, streakEnd,
				(int) Math.floor(Math.max(0, hoursSince) / 24), weekend);
	}

	/**
	 * Risk tier only.
	 * @param lastContribution time of the last contribution
	 * @param now evaluation time
	 * @return the assessment
	 */
	public RiskAssessment assess(Instant lastContribution, Instant now) {
		double adjusted = Math.max(0, hoursBetween(lastContribution, now) - weekendGraceHours(lastContribution, now));
		double hoursRemaining = Math.max(0, config.criticalThresholdHours() - adjusted);

		RiskLevel level;
		if (adjusted < config.safeThresholdHours()) {
			level = RiskLevel.SAFE;
		}
		else if (adjusted < config.warningThresholdHours()) {
			level = RiskLevel.WARNING;
		}
		else if (adjusted < config.dangerThresholdHours()) {
			level = RiskLevel.DANGER;
		}
		else {
			level = RiskLevel.CRITICAL;
		}
		return new RiskAssessment(level, level.getMessage(), hoursRemaining);
	}

	/**
	 * Predicted end of the streak: the end of the day after the last contribution.
	 * @return the end instant, or null without history or streak
	 */
	public @Nullable Instant getStreakEndPrediction(@Nullable Instant lastContribution, int currentStreak) {
		if (lastContribution == null || currentStreak == 0) {
			return null;
		}
		return nextContributionDeadline(lastContribution);
	}

	public boolean isStreakInDanger(@Nullable Instant lastContribution, int currentStreak, Instant now) {
		if (lastContribution == null || currentStreak == 0) {
			return true;
		}
		return assess(lastContribution, now).level().compareTo(RiskLevel.DANGER) >= 0;
	}

	/**
	 * Hours until the end of the day after the last contribution.
	 * @return remaining hours, 0 without history or when already past
	 */
	public double hoursUntilStreakEnd(@Nullable Instant lastContribution, Instant now) {
		if (lastContribution == null) {
			return 0;
		}
		return Math.max(0, hoursBetween(now, nextContributionDeadline(lastContribution)));
	}

	/**
	 * Whether a risk notification should go out now. Never for SAFE; otherwise only when
	 * the tier's cooldown has passed since the previous notification.
	 * @param lastContribution time of the last contribution
	 * @param currentStreak current streak length
	 * @param lastNotificationSent time of the previous notification, null if none
	 * @param now evaluation time
	 * @return true if a notification is due
	 */
	public boolean shouldSendRiskNotification(@Nullable Instant lastContribution, int currentStreak,
			@Nullable Instant lastNotificationSent, Instant now) {
		RiskLevel level = analyzeStreakRisk(lastContribution, currentStreak, now).level();
		if (level == RiskLevel.SAFE) {
			return false;
		}
		if (lastNotificationSent == null) {
			return true;
		}
		return hoursBetween(lastNotificationSent, now) >= level.getNotificationCooldownHours();
	}

	private Instant nextContributionDeadline(Instant lastContribution) {
		LocalDate day = LocalDate.ofInstant(lastContribution, config.zone()).plusDays(1);
		return day.atTime(LocalTime.MAX).atZone(config.zone()).toInstant();
	}

	/**
	 * Weekend time between the two instants, capped at the grace period.
	 */
	private double weekendGraceHours(Instant from, Instant to) {
		if (!config.considerWeekends() || config.gracePeriodHours() <= 0 || !to.isAfter(from)) {
			return 0;
		}
		double grace = 0;
		ZonedDateTime dayStart = from.atZone(config.zone()).toLocalDate().atStartOfDay(config.zone());
		while (dayStart.toInstant().isBefore(to) && grace < config.gracePeriodHours()) {
			ZonedDateTime nextDay = dayStart.plusDays(1);
			if (isWeekend(dayStart.getDayOfWeek())) {
				Instant overlapStart = max(from, dayStart.toInstant());
				Instant overlapEnd = min(to, nextDay.toInstant());
				grace += hoursBetween(overlapStart, overlapEnd);
			}
			dayStart = nextDay;
		}
		return Math.min(grace, config.gracePeriodHours());
	}

	private List<String> recommendations(RiskAssessment risk, boolean weekend, int currentStreak) {
		List<String> recommendations = new ArrayList<>();
		switch (risk.level()) {
			case SAFE -> {
				recommendations.add("Keep up the great work!");
				if (currentStreak > 0) {
					recommendations.add("You're on a " + currentStreak + "-day streak");
				}
			}
			case WARNING -> {
				recommendations.add("Plan your next contribution");
				recommendations.add("Set a reminder to contribute today");
				if (weekend) {
					recommendations.add("Weekend contributions count too");
				}
			}
			case DANGER -> {
				recommendations.add("Make a contribution as soon as possible");
				recommendations.add("Even a small commit counts");
				recommendations.add("Consider working on documentation or README updates");
			}
			case CRITICAL -> {
				recommendations.add("URGENT: Your streak will end very soon");
				recommendations.add("Make any contribution immediately");
				recommendations.add("Quick fixes: update comments, fix typos, or add documentation");
				if (risk.hoursRemaining() > 0) {
					recommendations.add(
							"You have approximately " + Math.round(risk.hoursRemaining()) + " hours left");
				}
			}
		}
		return List.copyOf(recommendations);
	}

	private boolean isWeekend(Instant instant) {
		return isWeekend(instant.atZone(config.zone()).getDayOfWeek());
	}

	private static boolean isWeekend(DayOfWeek day) {
		return day == DayOfWeek.SATURDAY || day == DayOfWeek.SUNDAY;
	}

	private static double hoursBetween(Instant from, Instant to) {
		return Duration.between(from, to).toMillis() / MILLIS_PER_HOUR;
	}

	private static Instant max(Instant a, Instant b) {
		return a.isAfter(b) ? a : b;
	}

	private static Instant min(Instant a, Instant b) {
		return a.isBefore(b) ? a : b;
	}

}
