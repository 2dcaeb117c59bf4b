package io.gitfort.insights;

/**
 * The requested repository path does not resolve to a regular file with content.
 */
public class ContentNotFoundException extends GitHubException {

	private final String path;

	public ContentNotFoundException(String path) {
		super("Content not found or not a file: " + path);
		this.path = path;
	}

	public String getPath() {
		return path;
	}

}
