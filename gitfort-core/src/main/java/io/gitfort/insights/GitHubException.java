package io.gitfort.insights;

/**
 * Base type for every failure raised by the GitHub access layer.
 */
public class GitHubException extends RuntimeException {

	public GitHubException(String message) {
		super(message);
	}

	public GitHubException(String message, Throwable cause) {
		super(message, cause);
	}

}
