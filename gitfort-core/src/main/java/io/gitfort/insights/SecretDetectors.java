package io.gitfort.insights;

import java.util.Arrays;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Built-in detectors, grouped by family. Adding a detector is a data change only.
 */
public final class SecretDetectors {

	private static final Pattern AWS_SECRET_SHAPE = Pattern.compile("[A-Za-z0-9/+=]{40}");

	private static final Pattern DIGITS_ONLY = Pattern.compile("[0-9]+");

	private static final Pattern HEX_32 = Pattern.compile("[0-9a-f]{32}");

	public static final List<SecretDetector> ENVIRONMENT = List.of(
			new SecretDetector(VulnerabilityType.ENV_VAR,
					"(?:^|[^a-zA-Z0-9_])([A-Z_][A-Z0-9_]*)\\s*=\\s*[\"']([^\"'\\s]{8,})[\"']", Severity.MEDIUM,
					"Hardcoded environment variable detected"),
			new SecretDetector(VulnerabilityType.ENV_VAR,
					Pattern.compile("(?:password|secret|key|token|api_key|auth)\\s*[:=]\\s*[\"']([^\"'\\s]{6,})[\"']",
							Pattern.CASE_INSENSITIVE),
					Severity.HIGH, "Hardcoded sensitive credential detected", null),
			new SecretDetector(VulnerabilityType.ENV_VAR,
					"process\\.env\\.([A-Z_][A-Z0-9_]*)\\s*\\|\\|\\s*[\"']([^\"'\\s]{6,})[\"']", Severity.MEDIUM,
					"Environment variable with hardcoded fallback"));

	public static final List<SecretDetector> AWS = List.of(
			new SecretDetector(VulnerabilityType.AWS_KEY, "AKIA[0-9A-Z]{16}", Severity.CRITICAL,
					"AWS Access Key ID detected"),
			new SecretDetector(VulnerabilityType.AWS_KEY, AWS_SECRET_SHAPE, Severity.CRITICAL,
					"Potential AWS Secret Access Key detected", SecretDetectors::isAwsSecretLike),
			new SecretDetector(VulnerabilityType.AWS_KEY,
					Pattern.compile(
							"aws[_-]?(?:access[_-]?key|secret[_-]?key|session[_-]?token)\\s*[:=]\\s*[\"']([^\"'\\s]{16,})[\"']",
							Pattern.CASE_INSENSITIVE),
					Severity.CRITICAL, "AWS credential in configuration detected", null));

	public static final List<SecretDetector> API_KEYS = List.of(
			new SecretDetector(VulnerabilityType.API_KEY,
					Pattern.compile("(?:api[_-]?key|token|secret)\\s*[:=]\\s*[\"']([a-zA-Z0-9_-]{20,})[\"']",
							Pattern.CASE_INSENSITIVE),
					Severity.HIGH, "Generic API key or token detected", null),
			new SecretDetector(VulnerabilityType.API_KEY, "sk-[a-zA-Z0-9]{48}", Severity.CRITICAL,
					"OpenAI API key detected"),
			new SecretDetector(VulnerabilityType.API_KEY, "ghp_[a-zA-Z0-9]{36}", Severity.CRITICAL,
					"GitHub Personal Access Token detected"),
			new SecretDetector(VulnerabilityType.API_KEY, "gho_[a-zA-Z0-9]{36}", Severity.CRITICAL,
					"GitHub OAuth Token detected"),
			new SecretDetector(VulnerabilityType.API_KEY, "AIza[0-9A-Za-z_-]{35}", Severity.HIGH,
					"Google API key detected"),
			new SecretDetector(VulnerabilityType.API_KEY, HEX_32, Severity.MEDIUM,
					"Potential MD5 hash or API key detected", SecretDetectors::isPlausibleHexKey));

	public static final List<SecretDetector> PRIVATE_KEYS = List.of(
			new SecretDetector(VulnerabilityType.PRIVATE_KEY, "-----BEGIN\\s+(?:RSA\\s+)?PRIVATE\\s+KEY-----",
					Severity.CRITICAL, "RSA private key detected"),
			new SecretDetector(VulnerabilityType.PRIVATE_KEY, "-----BEGIN\\s+DSA\\s+PRIVATE\\s+KEY-----",
					Severity.CRITICAL, "DSA private key detected"),
			new SecretDetector(VulnerabilityType.PRIVATE_KEY, "-----BEGIN\\s+EC\\s+PRIVATE\\s+KEY-----",
					Severity.CRITICAL, "ECDSA private key detected"),
			new SecretDetector(VulnerabilityType.PRIVATE_KEY, "-----BEGIN\\s+OPENSSH\\s+PRIVATE\\s+KEY-----",
					Severity.CRITICAL, "OpenSSH private key detected"),
			new SecretDetector(VulnerabilityType.PRIVATE_KEY, "-----BEGIN\\s+PGP\\s+PRIVATE\\s+KEY\\s+BLOCK-----",
					Severity.CRITICAL, "PGP private key detected"),
			new SecretDetector(VulnerabilityType.PRIVATE_KEY, "-----BEGIN\\s+CERTIFICATE-----", Severity.MEDIUM,
					"Certificate detected"));

	/**
	 * All detectors in scan order: environment, AWS, API keys, private keys.
	 */
	public static final List<SecretDetector> ALL = concat(ENVIRONMENT, AWS, API_KEYS, PRIVATE_KEYS);

	private SecretDetectors() {
	}

	/**
	 * Exactly 40 characters of the key alphabet, not all digits, and containing at least one
	 * of {@code / + =}.
	 */
	static boolean isAwsSecretLike(String match) {
		return AWS_SECRET_SHAPE.matcher(match).matches() && !DIGITS_ONLY.matcher(match).matches()
				&& (match.indexOf('/') >= 0 || match.indexOf('+') >= 0 || match.indexOf('=') >= 0);
	}

	static boolean isPlausibleHexKey(String match) {
		return HEX_32.matcher(match).matches() && !match.matches("0+") && !match.matches("f+");
	}

	@SafeVarargs
	private static List<SecretDetector> concat(List<SecretDetector>... groups) {
		return Arrays.stream(groups).flatMap(List::stream).toList();
	}

}
