package io.gitfort.insights;

import org.jspecify.annotations.Nullable;

/**
 * Parsed command line: one command, its target and the options.
 */
public class ParsedConfiguration {

	// streak | failures | scan | rate-limit
	public @Nullable String command;

	// user login for streak, owner/repo for failures and scan
	public @Nullable String target;

	public int days;

	public int maxFiles;

	public boolean json = false;

	public boolean verbose = false;

	public boolean helpRequested = false;

	public ParsedConfiguration(GitFortProperties defaultProperties) {
		this.days = defaultProperties.getFailureWindowDays();
		this.maxFiles = defaultProperties.getMaxFiles();
		this.verbose = defaultProperties.isVerbose();
	}

	/**
	 * Owner part of an {@code owner/repo} target.
	 */
	public String owner() {
		return repositoryParts()[0];
	}

	public String repo() {
		return repositoryParts()[1];
	}

	private String[] repositoryParts() {
		if (target == null || !target.contains("/")) {
			throw new IllegalStateException("Target is not a repository: " + target);
		}
		return target.split("/", 2);
	}

	@Override
	public String toString() {
		return "ParsedConfiguration{" + "command='" + command + '\'' + ", target='" + target + '\'' + ", days=" + days
				+ ", maxFiles=" + maxFiles + ", json=" + json + ", verbose=" + verbose + ", helpRequested="
				+ helpRequested + '}';
	}

}
