package io.gitfort.insights;

import org.jspecify.annotations.Nullable;

/**
 * Result of asking a {@link TokenAccessor} for the current bearer token.
 *
 * @param accessToken the token (empty when invalid)
 * @param valid whether the token may be used
 * @param error why the token is unusable, when known
 */
public record TokenInfo(String accessToken, boolean valid, @Nullable String error) {

	public static TokenInfo of(String accessToken) {
		return new TokenInfo(accessToken, true, null);
	}

	public static TokenInfo invalid(String error) {
		return new TokenInfo("", false, error);
	}

}
