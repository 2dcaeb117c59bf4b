package io.gitfort.insights;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.time.Duration;
import java.time.Instant;

import static org.assertj.core.api.Assertions.*;

@DisplayName("StreakRiskDetector Tests")
class StreakRiskDetectorTest {

	// a Wednesday
	private static final Instant LAST = Instant.parse("2024-06-05T10:00:00Z");

	private final StreakRiskDetector detector = new StreakRiskDetector();

	private static Instant hoursAfter(Instant instant, double hours) {
		return instant.plus(Duration.ofMinutes(Math.round(hours * 60)));
	}

	@Nested
	@DisplayName("Tier Tests")
	class TierTest {

		@ParameterizedTest(name = "{0}h since last contribution -> {1}")
		@CsvSource({ "0, SAFE", "5, SAFE", "7.9, SAFE", "8, WARNING", "15.9, WARNING", "16, DANGER", "19.9, DANGER",
				"20, CRITICAL", "30, CRITICAL" })
		@DisplayName("Should map elapsed hours to tiers with strict bounds")
		void shouldMapTiers(double hours, RiskLevel expected) {
			assertThat(detector.assess(LAST, hoursAfter(LAST, hours)).level()).isEqualTo(expected);
		}

		@Test
		@DisplayName("Should estimate the hours left before the deadline")
		void shouldEstimateHoursRemaining() {
			RiskAssessment risk = detector.assess(LAST, hoursAfter(LAST, 5));

			assertThat(risk.hoursRemaining()).isCloseTo(19.0, within(0.01));
			assertThat(risk.message()).isEqualTo("Your streak is safe");
			assertThat(detector.assess(LAST, hoursAfter(LAST, 40)).hoursRemaining()).isZero();
		}

		@Test
		@DisplayName("Should report CRITICAL without contribution history")
		void shouldBeCriticalWithoutHistory() {
			StreakRiskAnalysis analysis = detector.analyzeStreakRisk(null, 0, LAST);

			assertThat(analysis.level()).isEqualTo(RiskLevel.CRITICAL);
			assertThat(analysis.risk().message()).isEqualTo("No contribution history found");
			assertThat(analysis.recommendations()).containsExactly("Start your contribution streak today",
					"Make your first commit to begin tracking");
			assertThat(analysis.streakEndDate()).isNull();
		}

	}

	@Nested
	@DisplayName("Weekend Grace Tests")
	class WeekendGraceTest {

		// Friday 22:00 UTC
		private final Instant friday = Instant.parse("2024-05-31T22:00:00Z");

		@Test
		@DisplayName("Should discount weekend hours up to the grace period")
		void shouldDiscountWeekendHours() {
			// 9h elapsed, 7 of them on Saturday: grace capped at 2h leaves 7h
			Instant saturdayMorning = Instant.parse("2024-06-01T07:00:00Z");

			assertThat(detector.assess(friday, saturdayMorning).level()).isEqualTo(RiskLevel.SAFE);
			assertThat(new StreakRiskDetector(RiskDetectionConfig.defaults().withWeekendGrace(false, 0))
				.assess(friday, saturdayMorning)
				.level()).isEqualTo(RiskLevel.WARNING);
		}

		@Test
		@DisplayName("Should not grant grace on weekdays")
		void shouldNotDiscountWeekdays() {
			assertThat(detector.assess(LAST, hoursAfter(LAST, 9)).level()).isEqualTo(RiskLevel.WARNING);
		}

		@Test
		@DisplayName("Should never lower the tier as time passes")
		void shouldNeverLowerSeverityOverTime() {
			int previous = 0;
			for (int minutes = 0; minutes <= 72 * 60; minutes += 15) {
				Instant now = friday.plus(Duration.ofMinutes(minutes));
				int severity = detector.assess(friday, now).severity();

				assertThat(severity).as("after %d minutes", minutes).isGreaterThanOrEqualTo(previous);
				previous = severity;
			}
		}

	}

	@Nested
	@DisplayName("Analysis Tests")
	class AnalysisTest {

		@Test
		@DisplayName("Should set the deadline to the end of the next day")
		void shouldComputeDeadline() {
			StreakRiskAnalysis analysis = detector.analyzeStreakRisk(LAST, 4, hoursAfter(LAST, 2));

			assertThat(analysis.nextContributionDeadline()).isEqualTo(Instant.parse("2024-06-06T23:59:59.999999999Z"));
			assertThat(analysis.streakEndDate()).isNull();
			assertThat(analysis.recommendations()).containsExactly("Keep up the great work!",
					"You're on a 4-day streak");
		}

		@Test
		@DisplayName("Should predict the streak end once in danger")
		void shouldPredictEndInDanger() {
			StreakRiskAnalysis analysis = detector.analyzeStreakRisk(LAST, 4, hoursAfter(LAST, 17));

			assertThat(analysis.level()).isEqualTo(RiskLevel.DANGER);
			assertThat(analysis.streakEndDate()).isEqualTo(analysis.nextContributionDeadline());
			assertThat(detector.isStreakInDanger(LAST, 4, hoursAfter(LAST, 17))).isTrue();
		}

		@Test
		@DisplayName("Should count whole days without contribution")
		void shouldCountDaysWithout() {
			assertThat(detector.analyzeStreakRisk(LAST, 1, hoursAfter(LAST, 50)).daysWithoutContribution())
				.isEqualTo(2);
		}

		@Test
		@DisplayName("Should compute hours until the streak ends")
		void shouldComputeHoursUntilEnd() {
			Instant now = Instant.parse("2024-06-06T20:00:00Z");

			assertThat(detector.hoursUntilStreakEnd(LAST, now)).isCloseTo(4.0, within(0.01));
			assertThat(detector.hoursUntilStreakEnd(null, now)).isZero();
			assertThat(detector.getStreakEndPrediction(LAST, 0)).isNull();
		}

	}

	@Nested
	@DisplayName("Notification Cooldown Tests")
	class CooldownTest {

		@Test
		@DisplayName("Should never notify while safe")
		void shouldNotNotifyWhenSafe() {
			assertThat(detector.shouldSendRiskNotification(LAST, 3, null, hoursAfter(LAST, 2))).isFalse();
		}

		@Test
		@DisplayName("Should notify the first time a tier is reached")
		void shouldNotifyFirstTime() {
			assertThat(detector.shouldSendRiskNotification(LAST, 3, null, hoursAfter(LAST, 10))).isTrue();
		}

		@Test
		@DisplayName("Should respect the cooldown of the current tier")
		void shouldRespectCooldown() {
			Instant now = hoursAfter(LAST, 12);

			assertThat(RiskLevel.WARNING.getNotificationCooldownHours()).isEqualTo(8);
			assertThat(detector.shouldSendRiskNotification(LAST, 3, hoursAfter(now, -7), now)).isFalse();
			assertThat(detector.shouldSendRiskNotification(LAST, 3, hoursAfter(now, -8), now)).isTrue();
		}

		@Test
		@DisplayName("Should use the short cooldown when critical")
		void shouldUseCriticalCooldown() {
			Instant now = hoursAfter(LAST, 22);

			assertThat(detector.shouldSendRiskNotification(LAST, 3, hoursAfter(now, -1), now)).isTrue();
			assertThat(detector.shouldSendRiskNotification(LAST, 3, hoursAfter(now, -0.5), now)).isFalse();
		}

	}

	@Test
	@DisplayName("Should reject descending thresholds")
	void shouldRejectDescendingThresholds() {
		assertThatThrownBy(() -> new RiskDetectionConfig(10, 8, 20, 24, java.time.ZoneOffset.UTC, true, 2))
			.isInstanceOf(IllegalArgumentException.class);
	}

}
