package io.gitfort.insights;

import java.time.Instant;
import java.util.List;

/**
 * A normalized failure reason seen at least twice in a window.
 *
 * @param pattern normalized reason
 * @param count occurrences
 * @param workflows distinct workflows, first-encounter order
 * @param branches distinct branches, first-encounter order
 * @param firstSeen earliest occurrence
 * @param lastSeen latest occurrence
 * @param severity severity of the first occurrence
 */
public record RecurringFailure(String pattern, int count, List<String> workflows, List<String> branches,
		Instant firstSeen, Instant lastSeen, Severity severity) {
}
