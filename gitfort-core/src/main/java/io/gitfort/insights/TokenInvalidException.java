package io.gitfort.insights;

/**
 * The {@link TokenAccessor} reported no usable token. Raised before any network call is
 * made and never retried.
 */
public class TokenInvalidException extends GitHubException {

	public TokenInvalidException(String message) {
		super(message);
	}

}
