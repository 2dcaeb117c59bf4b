package io.gitfort.insights;

import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Fetches a user's contribution history, derives streak statistics and raises streak risk
 * notifications.
 *
 * <p>
 * Summaries are cached per user for the configured time to live so repeated lookups do
 * not spend rate limit.
 */
public class StreakService {

	private static final Logger logger = LoggerFactory.getLogger(StreakService.class);

	private static final String CACHE_PREFIX = "streak:";

	private final GraphQLService graphQLService;

	private final StreakCalculator calculator;

	private final ContributionStatistics statistics;

	private final StreakRiskDetector riskDetector;

	private final ExpiringCache<StreakSummary> cache;

	private final NotificationListener listener;

	private final Clock clock;

	private final int lookbackDays;

	private final Duration cacheTtl;

	public StreakService(GraphQLService graphQLService, StreakCalculator calculator, StreakRiskDetector riskDetector,
			ExpiringCache<StreakSummary> cache, NotificationListener listener, Clock clock, int lookbackDays,
			Duration cacheTtl) {
		this.graphQLService = graphQLService;
		this.calculator = calculator;
		this.statistics = new ContributionStatistics(calculator);
		this.riskDetector = riskDetector;
		this.cache = cache;
		this.listener = listener;
		this.clock = clock;
		this.lookbackDays = lookbackDays;
		this.cacheTtl = cacheTtl;
	}

	/**
	 * Streak summary of a user, served from cache while fresh.
	 * @param username user login
	 * @return the summary
	 */
	public StreakSummary getStreakSummary(String username) {
		StreakSummary cached = cache.get(CACHE_PREFIX + username);
		if (cached != null) {
			logger.debug("Streak summary for {} served from cache", username);
			return cached;
		}
		return refresh(username);
	}

	/**
	 * Recompute the summary from freshly fetched contributions, replacing the cached one.
	 * @param username user login
	 * @return the new summary
	 */
	public StreakSummary refresh(String username) {
		Instant now = clock.instant();
		List<ContributionDay> days = graphQLService.getContributionsForStreak(username, lookbackDays);
		LocalDate today = LocalDate.ofInstant(now, calculator.getZone());

		StreakSummary summary = new StreakSummary(username, calculator.statistics(days, now),
				statistics.calculate(days, today), now);
		cache.put(CACHE_PREFIX + username, summary, cacheTtl);
		logger.info("Streak for {}: current {} days, longest {} days{}", username, summary.streak().currentStreak(),
				summary.streak().longestStreak(), summary.streak().atRisk() ? " (at risk)" : "");
		return summary;
	}

	/**
	 * Risk analysis for a user's current streak.
	 * @param username user login
	 * @return the analysis at the current time
	 */
	public StreakRiskAnalysis analyzeRisk(String username) {
		StreakStats streak = getStreakSummary(username).streak();
		return riskDetector.analyzeStreakRisk(lastContributionInstant(streak), streak.currentStreak(), clock.instant());
	}

	/**
	 * Publish a {@link NotificationType#STREAK_RISK} event when the streak is at risk and the
	 * cooldown of its tier has passed.
	 * @param username user login
	 * @param lastNotificationSent time of the previous risk notification, null if none
	 * @return true if an event was published
	 */
	public boolean notifyIfAtRisk(String username, @Nullable Instant lastNotificationSent) {
		StreakStats streak = getStreakSummary(username).streak();
		Instant now = clock.instant();
		Instant lastContribution = lastContributionInstant(streak);
		if (!riskDetector.shouldSendRiskNotification(lastContribution, streak.currentStreak(), lastNotificationSent,
				now)) {
			return false;
		}

		StreakRiskAnalysis analysis = riskDetector.analyzeStreakRisk(lastContribution, streak.currentStreak(), now);
		Map<String, Object> payload = new LinkedHashMap<>();
		payload.put("level", analysis.level().name());
		payload.put("severity", analysis.risk().severity());
		payload.put("message", analysis.risk().message());
		payload.put("currentStreak", streak.currentStreak());
		payload.put("hoursRemaining", analysis.risk().hoursRemaining());
		payload.put("recommendations", analysis.recommendations());
		listener.onEvent(new NotificationEvent(NotificationType.STREAK_RISK, username, payload, now));
		logger.info("Streak risk notification for {} at level {}", username, analysis.level());
		return true;
	}

	public void invalidate(String username) {
		cache.delete(CACHE_PREFIX + username);
	}

	private @Nullable Instant lastContributionInstant(StreakStats streak) {
		LocalDate last = streak.lastContributionDate();
		return last != null ? calculator.startOfDay(last) : null;
	}

}
