package io.gitfort.insights;

import org.jspecify.annotations.Nullable;

/**
 * Supplies the bearer token for each outbound call. Credential issuance, refresh and
 * storage belong to the caller; the access layer only asks for the current token.
 */
@FunctionalInterface
public interface TokenAccessor {

	/**
	 * Get the current token.
	 * @return token info, or null when no session exists
	 */
	@Nullable
	TokenInfo getToken();

	/**
	 * A fixed token, as used by the CLI and by tests.
	 * @param token personal access token
	 * @return accessor always returning the token
	 */
	static TokenAccessor of(String token) {
		TokenInfo info = TokenInfo.of(token);
		return () -> info;
	}

	/**
	 * Read the token from {@code GITHUB_TOKEN}, consulting {@code .env} files first.
	 * @return accessor resolving the variable on each call
	 */
	static TokenAccessor fromEnvironment() {
		return () -> {
			String token = EnvironmentSupport.get("GITHUB_TOKEN");
			if (token == null || token.isBlank()) {
				return TokenInfo.invalid("GITHUB_TOKEN environment variable is not set");
			}
			return TokenInfo.of(token.trim());
		};
	}

}
