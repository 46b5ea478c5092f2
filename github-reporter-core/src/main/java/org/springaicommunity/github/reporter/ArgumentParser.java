package org.springaicommunity.github.reporter;

import java.util.ArrayList;
import java.util.List;

/**
 * Command-line argument parser for the reporter CLI. Pure Java implementation with no
 * framework dependencies for maximum testability.
 */
public class ArgumentParser {

	private final ReporterProperties defaultProperties;

	public ArgumentParser(ReporterProperties defaultProperties) {
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

		for (int i = 0; i < args.length; i++) {
			String arg = args[i];

			switch (arg) {
				case "-r", "--repo":
					config.repository = getRequiredValue(args, i, "repository");
					i++; // Skip next argument since we consumed it
					break;

				case "-p", "--pr":
					String prStr = getRequiredValue(args, i, "pr");
					try {
						config.pullRequestId = Integer.parseInt(prStr);
					}
					catch (NumberFormatException e) {
						throw new IllegalArgumentException(
								"Invalid pull request number '" + prStr + "': must be a positive integer");
					}
					i++;
					break;

				case "-f", "--findings":
					config.findingsFile = getRequiredValue(args, i, "findings");
					i++;
					break;

				case "--danger-id":
					config.dangerId = getRequiredValue(args, i, "danger-id");
					i++;
					break;

				case "--status-context":
					config.statusContext = getRequiredValue(args, i, "status-context");
					i++;
					break;

				case "--no-ignore-directives":
					config.applyIgnoreDirectives = false;
					break;

				case "-v", "--verbose":
					config.verbose = true;
					break;

				case "-h", "--help":
					config.helpRequested = true;
					break;

				default:
					throw new IllegalArgumentException("Unknown option: " + arg);
			}
		}

		if (!config.helpRequested) {
			validateConfiguration(config);
		}
		return config;
	}

	/**
	 * Check if help was requested without parsing all arguments.
	 * @param args Command-line arguments
	 * @return true if help was requested
	 */
	public boolean isHelpRequested(String[] args) {
		for (String arg : args) {
			if ("-h".equals(arg) || "--help".equals(arg)) {
				return true;
			}
		}
		return false;
	}

	/**
	 * Generate help text for command-line usage.
	 * @return Formatted help text
	 */
	public String generateHelpText() {
		StringBuilder help = new StringBuilder();
		help.append("GitHub Reporter\n");
		help.append("\n");
		help.append("USAGE:\n");
		help.append("    github-reporter --repo <owner/repo> --pr <number> --findings <file> [OPTIONS]\n");
		help.append("\n");
		help.append("OPTIONS:\n");
		help.append("    -h, --help                Show this help message\n");
		help.append("    -r, --repo <repo>         Repository in format owner/repo (required)\n");
		help.append("    -p, --pr <number>         Pull request number (required)\n");
		help.append("    -f, --findings <file>     Findings JSON file (required)\n");
		help.append("    --danger-id <id>          Reporter identity, one report per identity (default: ")
			.append(defaultProperties.getDangerId())
			.append(")\n");
		help.append("    --status-context <ctx>    Commit status context (default: ")
			.append(defaultProperties.getStatusContext())
			.append(")\n");
		help.append("    --no-ignore-directives    Do not honour '> danger: ignore \"...\"' in the PR description\n");
		help.append("    -v, --verbose             Enable verbose logging\n");
		help.append("\n");
		help.append("FINDINGS FILE:\n");
		help.append("    {\"warnings\": [...], \"errors\": [...], \"messages\": [...], \"markdowns\": [...]}\n");
		help.append("    Entries are strings or {\"message\": \"...\", \"sticky\": true}\n");
		help.append("\n");
		help.append("ENVIRONMENT VARIABLES:\n");
		help.append("    DANGER_GITHUB_API_TOKEN     GitHub API token (required)\n");
		help.append("    DANGER_GITHUB_API_BASE_URL  API base URL for GitHub Enterprise\n");
		help.append("    DANGER_GITHUB_API_HOST      Legacy name of DANGER_GITHUB_API_BASE_URL\n");
		help.append("\n");
		help.append("EXIT CODES:\n");
		help.append("    0  results published\n");
		help.append("    1  the build must fail (errors found but no status could be set, or any failure)\n");
		help.append("\n");
		help.append("EXAMPLES:\n");
		help.append("    github-reporter --repo spring-projects/spring-ai --pr 4347 --findings build/findings.json\n");
		help.append("    github-reporter -r owner/repo -p 12 -f findings.json --danger-id lint --verbose\n");
		return help.toString();
	}

	/**
	 * Validate environment (GitHub token, etc.)
	 * @throws IllegalStateException if environment is invalid
	 */
	public void validateEnvironment() {
		String githubToken = EnvironmentSupport.get(EnvironmentSupport.TOKEN);
		if (githubToken == null || githubToken.trim().isEmpty()) {
			throw new IllegalStateException("No API token given, please provide one using `"
					+ EnvironmentSupport.TOKEN + "`: export " + EnvironmentSupport.TOKEN + "=your_token_here");
		}
	}

	private String getRequiredValue(String[] args, int currentIndex, String optionName) {
		if (currentIndex + 1 >= args.length) {
			throw new IllegalArgumentException("Missing value for " + optionName + " option");
		}
		return args[currentIndex + 1];
	}

	private void validateConfiguration(ParsedConfiguration config) {
		List<String> errors = new ArrayList<>();

		if (config.repository == null || config.repository.trim().isEmpty()) {
			errors.add("Repository cannot be empty");
		}
		else if (!config.repository.matches("^[a-zA-Z0-9._-]+/[a-zA-Z0-9._-]+$")) {
			errors.add("Repository must be in format 'owner/repo' (e.g., 'spring-projects/spring-ai')");
		}

		if (config.pullRequestId <= 0) {
			errors.add("Pull request number must be positive (got: " + config.pullRequestId + ")");
		}

		if (config.findingsFile == null || config.findingsFile.trim().isEmpty()) {
			errors.add("Findings file is required");
		}

		if (config.dangerId.trim().isEmpty()) {
			errors.add("Danger id cannot be empty");
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
