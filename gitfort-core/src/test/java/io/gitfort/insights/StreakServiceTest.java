package io.gitfort.insights;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.*;
import static org.mockito.Mockito.*;

/**
 * Unit tests for {@link StreakService}.
 */
@ExtendWith(MockitoExtension.class)
@DisplayName("StreakService Tests")
class StreakServiceTest {

	@Mock
	private GraphQLService mockGraphQL;

	private final MutableClock clock = new MutableClock(Instant.parse("2024-06-05T09:00:00Z"));

	private final List<NotificationEvent> events = new ArrayList<>();

	private ExpiringCache<StreakSummary> cache;

	private StreakService service;

	@BeforeEach
	void setUp() {
		cache = new ExpiringCache<>(Duration.ofMinutes(5), 100, Duration.ZERO, clock);
		service = new StreakService(mockGraphQL, new StreakCalculator(ZoneOffset.UTC), new StreakRiskDetector(), cache,
				events::add, clock, 365, Duration.ofMinutes(5));
	}

	@AfterEach
	void tearDown() {
		cache.close();
	}

	private static List<ContributionDay> history(LocalDate lastActive, int streak) {
		List<ContributionDay> days = new ArrayList<>();
		for (int i = streak - 1; i >= 0; i--) {
			days.add(new ContributionDay(lastActive.minusDays(i), 2));
		}
		return days;
	}

	@Nested
	@DisplayName("Summary Tests")
	class SummaryTest {

		@Test
		@DisplayName("Should derive streak and totals from the contribution history")
		void shouldBuildSummary() {
			when(mockGraphQL.getContributionsForStreak("octocat", 365))
				.thenReturn(history(LocalDate.of(2024, 6, 5), 3));

			StreakSummary summary = service.getStreakSummary("octocat");

			assertThat(summary.username()).isEqualTo("octocat");
			assertThat(summary.streak().currentStreak()).isEqualTo(3);
			assertThat(summary.contributions().totalContributions()).isEqualTo(6);
			assertThat(summary.calculatedAt()).isEqualTo(clock.instant());
		}

		@Test
		@DisplayName("Should serve a fresh summary from cache")
		void shouldUseCache() {
			when(mockGraphQL.getContributionsForStreak("octocat", 365))
				.thenReturn(history(LocalDate.of(2024, 6, 5), 3));

			service.getStreakSummary("octocat");
			clock.advance(Duration.ofMinutes(4));
			service.getStreakSummary("octocat");

			verify(mockGraphQL, times(1)).getContributionsForStreak("octocat", 365);
		}

		@Test
		@DisplayName("Should refetch once the cached summary expires or is invalidated")
		void shouldRefetchAfterExpiry() {
			when(mockGraphQL.getContributionsForStreak("octocat", 365))
				.thenReturn(history(LocalDate.of(2024, 6, 5), 3));

			service.getStreakSummary("octocat");
			clock.advance(Duration.ofMinutes(6));
			service.getStreakSummary("octocat");
			service.invalidate("octocat");
			service.getStreakSummary("octocat");

			verify(mockGraphQL, times(3)).getContributionsForStreak("octocat", 365);
		}

		@Test
		@DisplayName("Should propagate fetch failures")
		void shouldPropagateFailures() {
			when(mockGraphQL.getContributionsForStreak("ghost", 365))
				.thenThrow(new NoDataException("No user data returned for ghost"));

			assertThatThrownBy(() -> service.getStreakSummary("ghost")).isInstanceOf(NoDataException.class);
		}

	}

	@Nested
	@DisplayName("Risk Notification Tests")
	class RiskNotificationTest {

		@Test
		@DisplayName("Should publish a streak risk event when the streak is in danger")
		void shouldPublishEvent() {
			// last contribution on June 4th, evaluated 21h into June 5th
			when(mockGraphQL.getContributionsForStreak("octocat", 365))
				.thenReturn(history(LocalDate.of(2024, 6, 4), 5));
			clock.set(Instant.parse("2024-06-05T21:00:00Z"));

			boolean sent = service.notifyIfAtRisk("octocat", null);

			assertThat(sent).isTrue();
			assertThat(events).singleElement().satisfies(event -> {
				assertThat(event.type()).isEqualTo(NotificationType.STREAK_RISK);
				assertThat(event.subject()).isEqualTo("octocat");
				assertThat(event.payload()).containsEntry("level", "CRITICAL")
					.containsEntry("currentStreak", 5)
					.containsKeys("message", "severity", "hoursRemaining", "recommendations");
			});
		}

		@Test
		@DisplayName("Should stay quiet while the streak is safe")
		void shouldNotPublishWhenSafe() {
			when(mockGraphQL.getContributionsForStreak("octocat", 365))
				.thenReturn(history(LocalDate.of(2024, 6, 5), 2));
			clock.set(Instant.parse("2024-06-05T05:00:00Z"));

			assertThat(service.notifyIfAtRisk("octocat", null)).isFalse();
			assertThat(events).isEmpty();
		}

		@Test
		@DisplayName("Should respect the cooldown since the last notification")
		void shouldRespectCooldown() {
			when(mockGraphQL.getContributionsForStreak("octocat", 365))
				.thenReturn(history(LocalDate.of(2024, 6, 4), 5));
			clock.set(Instant.parse("2024-06-05T21:00:00Z"));

			assertThat(service.notifyIfAtRisk("octocat", clock.instant().minusSeconds(600))).isFalse();
			assertThat(events).isEmpty();
		}

		@Test
		@DisplayName("Should analyze risk from the cached summary")
		void shouldAnalyzeRisk() {
			when(mockGraphQL.getContributionsForStreak("octocat", 365))
				.thenReturn(history(LocalDate.of(2024, 6, 4), 5));
			clock.set(Instant.parse("2024-06-04T17:00:00Z"));

			StreakRiskAnalysis analysis = service.analyzeRisk("octocat");

			assertThat(analysis.level()).isEqualTo(RiskLevel.DANGER);
			assertThat(analysis.nextContributionDeadline()).isEqualTo(Instant.parse("2024-06-05T23:59:59.999999999Z"));
			assertThat(analysis.streakEndDate()).isEqualTo(analysis.nextContributionDeadline());
		}

	}

}
