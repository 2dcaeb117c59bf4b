package io.gitfort.insights;

import java.util.ArrayList;
import java.util.List;

/**
 * Command-line argument parser for the GitFort CLI. Pure Java, no I/O, so it can be tested
 * without a token or network access.
 */
public class ArgumentParser {

	static final List<String> COMMANDS = List.of("streak", "failures", "scan", "rate-limit");

	private static final String REPOSITORY_FORMAT = "^[a-zA-Z0-9._-]+/[a-zA-Z0-9._-]+$";

	private static final String LOGIN_FORMAT = "^[a-zA-Z0-9](?:[a-zA-Z0-9-]{0,38})$";

	private final GitFortProperties defaultProperties;

	public ArgumentParser(GitFortProperties defaultProperties) {
		this.defaultProperties = defaultProperties;
	}

	/**
	 * Parse command-line arguments and return configuration.
	 * @param args Command-line arguments
	 * @return Parsed configuration object
	 * @throws IllegalArgumentException if arguments are invalid
	 */
	public ParsedConfiguration parseAndValidate(String[] args) {
		ParsedConfiguration config = new ParsedConfiguration(defaultProperties);
		List<String> positional = new ArrayList<>();

		for (int i = 0; i < args.length; i++) {
			String arg = args[i];

			switch (arg) {
				case "--days":
					config.days = parsePositive(getRequiredValue(args, i, "days"), "days");
					i++;
					break;

				case "--max-files":
					config.maxFiles = parsePositive(getRequiredValue(args, i, "max-files"), "max files");
					i++;
					break;

				case "--json":
					config.json = true;
					break;

				case "-v", "--verbose":
					config.verbose = true;
					break;

				case "-h", "--help":
					config.helpRequested = true;
					break;

				default:
					if (arg.startsWith("-")) {
						throw new IllegalArgumentException("Unknown option: " + arg);
					}
					positional.add(arg);
					break;
			}
		}

		if (!positional.isEmpty()) {
			config.command = positional.get(0);
		}
		if (positional.size() > 1) {
			config.target = positional.get(1);
		}
		if (positional.size() > 2) {
			throw new IllegalArgumentException("Unexpected argument: " + positional.get(2));
		}

		if (!config.helpRequested) {
			validateConfiguration(config);
		}
		return config;
	}

	/**
	 * Check if help is requested without full parsing.
	 * @param args Command-line arguments
	 * @return true if help is requested or no arguments were given
	 */
	public boolean isHelpRequested(String[] args) {
		if (args.length == 0) {
			return true;
		}
		for (String arg : args) {
			if ("-h".equals(arg) || "--help".equals(arg)) {
				return true;
			}
		}
		return false;
	}

	/**
	 * Generate help text for command-line usage.
	 * @return Help text string
	 */
	public String generateHelpText() {
		StringBuilder help = new StringBuilder();
		help.append("Usage: gitfort <command> [target] [OPTIONS]\n");
		help.append("\n");
		help.append("Contribution streaks, CI/CD failure analysis and secret scanning for GitHub.\n");
		help.append("\n");
		help.append("COMMANDS:\n");
		help.append("    streak <user>             Current and longest streak with risk analysis\n");
		help.append("    failures <owner/repo>     Classified workflow failures and patterns\n");
		help.append("    scan <owner/repo>         Scan the default branch for committed secrets\n");
		help.append("    rate-limit                Show the remaining API quota\n");
		help.append("\n");
		help.append("OPTIONS:\n");
		help.append("    -h, --help                Show this help message\n");
		help.append("    --days N                  Failure analysis window in days (default: ")
			.append(defaultProperties.getFailureWindowDays())
			.append(")\n");
		help.append("    --max-files N             Maximum files to scan (default: ")
			.append(defaultProperties.getMaxFiles())
			.append(")\n");
		help.append("    --json                    Print results as JSON\n");
		help.append("    -v, --verbose             Enable verbose logging\n");
		help.append("\n");
		help.append("ENVIRONMENT VARIABLES:\n");
		help.append("    GITHUB_TOKEN              GitHub personal access token (required)\n");
		help.append("                              Also read from a .env file\n");
		help.append("\n");
		help.append("EXAMPLES:\n");
		help.append("    gitfort streak octocat\n");
		help.append("    gitfort failures octocat/hello-world --days 14\n");
		help.append("    gitfort scan octocat/hello-world --max-files 100 --json\n");
		help.append("\n");
		return help.toString();
	}

	/**
	 * Validate environment (GitHub token, etc.)
	 * @throws IllegalStateException if environment is invalid
	 */
	public void validateEnvironment() {
		String githubToken = EnvironmentSupport.get("GITHUB_TOKEN");
		if (githubToken == null || githubToken.trim().isEmpty()) {
			throw new IllegalStateException(
					"GITHUB_TOKEN environment variable is required. Please set your GitHub personal access token: export GITHUB_TOKEN=your_token_here");
		}
	}

	private String getRequiredValue(String[] args, int currentIndex, String optionName) {
		if (currentIndex + 1 >= args.length) {
			throw new IllegalArgumentException("Missing value for " + optionName + " option");
		}
		return args[currentIndex + 1];
	}

	private static int parsePositive(String value, String name) {
		int parsed;
		try {
			parsed = Integer.parseInt(value);
		}
		catch (NumberFormatException e) {
			throw new IllegalArgumentException("Invalid " + name + " '" + value + "': must be a positive integer");
		}
		if (parsed <= 0) {
			throw new IllegalArgumentException("Invalid " + name + " '" + value + "': must be a positive integer");
		}
		return parsed;
	}

	private void validateConfiguration(ParsedConfiguration config) {
		List<String> errors = new ArrayList<>();

		if (config.command == null) {
			errors.add("A command is required (one of " + String.join(", ", COMMANDS) + ")");
		}
		else if (!COMMANDS.contains(config.command)) {
			errors.add("Unknown command: " + config.command + " (must be one of " + String.join(", ", COMMANDS) + ")");
		}
		else if ("streak".equals(config.command)) {
			if (config.target == null) {
				errors.add("streak requires a user login");
			}
			else if (!config.target.matches(LOGIN_FORMAT)) {
				errors.add("Invalid user login: " + config.target);
			}
		}
		else if ("rate-limit".equals(config.command)) {
			if (config.target != null) {
				errors.add("rate-limit takes no target");
			}
		}
		else if (config.target == null) {
			errors.add(config.command + " requires a repository in format 'owner/repo'");
		}
		else if (!config.target.matches(REPOSITORY_FORMAT)) {
			errors.add("Repository must be in format 'owner/repo' (e.g., 'octocat/hello-world')");
		}

		if (!errors.isEmpty()) {
			StringBuilder errorMsg = new StringBuilder("Configuration validation failed:");
			for (String error : errors) {
				errorMsg.append("\n  - ").append(error);
			}
			throw new IllegalArgumentException(errorMsg.toString());
		}
	}

}
