package io.gitfort.insights;

import org.jspecify.annotations.Nullable;

import java.time.Instant;
import java.util.List;

/**
 * Result of {@link StreakRiskDetector#analyzeStreakRisk}.
 *
 * @param risk tier, message and hours remaining
 * @param recommendations suggestions for the tier, most important first
 * @param nextContributionDeadline end of the day after the last contribution
 * @param streakEndDate predicted streak end, only for DANGER and CRITICAL
 * @param daysWithoutContribution whole days since the last contribution
 * @param weekend whether the evaluation moment falls on a weekend
 */
public record StreakRiskAnalysis(RiskAssessment risk, List<String> recommendations,
		Instant nextContributionDeadline, @Nullable Instant streakEndDate, int daysWithoutContribution,
		boolean weekend) {

	public RiskLevel level() {
		return risk.level();
	}

}
