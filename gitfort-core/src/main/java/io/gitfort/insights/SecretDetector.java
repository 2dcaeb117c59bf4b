package io.gitfort.insights;

import org.jspecify.annotations.Nullable;

import java.util.function.Predicate;
import java.util.regex.Pattern;

/**
 * One secret pattern. A match is reported unless the optional validator rejects it.
 *
 * @param type family the finding belongs to
 * @param pattern pattern searched for on each line
 * @param severity severity of a finding
 * @param description finding description
 * @param validator extra check on the matched text, null to accept every match
 */
public record SecretDetector(VulnerabilityType type, Pattern pattern, Severity severity, String description,
		@Nullable Predicate<String> validator) {

	public SecretDetector(VulnerabilityType type, String regex, Severity severity, String description) {
		this(type, Pattern.compile(regex), severity, description, null);
	}

	public boolean accepts(String match) {
		return validator == null || validator.test(match);
	}

}
