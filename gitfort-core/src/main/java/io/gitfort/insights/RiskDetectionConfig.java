package io.gitfort.insights;

import java.time.ZoneId;
import java.time.ZoneOffset;

/**
 * Thresholds of the streak risk model. Elapsed hours below {@code safeThresholdHours} are
 * SAFE, below {@code warningThresholdHours} WARNING, below {@code dangerThresholdHours}
 * DANGER, anything else CRITICAL. {@code criticalThresholdHours} is the deadline used for
 * the hours-remaining estimate.
 *
 * @param safeThresholdHours upper bound of SAFE (default 8)
 * @param warningThresholdHours upper bound of WARNING (default 16)
 * @param dangerThresholdHours upper bound of DANGER (default 20)
 * @param criticalThresholdHours streak deadline (default 24)
 * @param zone zone used to decide whether a moment falls on a weekend
 * @param considerWeekends whether weekend grace applies
 * @param gracePeriodHours maximum weekend grace (default 2)
 */
public record RiskDetectionConfig(double safeThresholdHours, double warningThresholdHours,
		double dangerThresholdHours, double criticalThresholdHours, ZoneId zone, boolean considerWeekends,
		double gracePeriodHours) {

	public RiskDetectionConfig {
		if (!(safeThresholdHours <= warningThresholdHours && warningThresholdHours <= dangerThresholdHours
				&& dangerThresholdHours <= criticalThresholdHours)) {
			throw new IllegalArgumentException("Risk thresholds must be ascending: " + safeThresholdHours + ", "
					+ warningThresholdHours + ", " + dangerThresholdHours + ", " + criticalThresholdHours);
		}
		if (gracePeriodHours < 0) {
			throw new IllegalArgumentException("gracePeriodHours must be non-negative");
		}
	}

	public static RiskDetectionConfig defaults() {
		return new RiskDetectionConfig(8, 16, 20, 24, ZoneOffset.UTC, true, 2);
	}

	public RiskDetectionConfig withZone(ZoneId zone) {
		return new RiskDetectionConfig(safeThresholdHours, warningThresholdHours, dangerThresholdHours,
				criticalThresholdHours, zone, considerWeekends, gracePeriodHours);
	}

	public RiskDetectionConfig withWeekendGrace(boolean considerWeekends, double gracePeriodHours) {
		return new RiskDetectionConfig(safeThresholdHours, warningThresholdHours, dangerThresholdHours,
				criticalThresholdHours, zone, considerWeekends, gracePeriodHours);
	}

}
