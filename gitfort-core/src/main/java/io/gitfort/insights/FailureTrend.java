package io.gitfort.insights;

import java.time.LocalDate;

/**
 * Number of failures of one type on one day.
 *
 * @param date UTC day
 * @param type failure type
 * @param count failures of that type on that day
 */
public record FailureTrend(LocalDate date, FailureType type, int count) {
}
