package io.gitfort.insights;

/**
 * The response was well formed but the expected nested data is absent, for example the
 * contribution calendar of an unknown user. Retrying would not help.
 */
public class NoDataException extends GitHubException {

	public NoDataException(String message) {
		super(message);
	}

}
