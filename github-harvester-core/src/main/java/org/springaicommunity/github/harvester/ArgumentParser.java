package org.springaicommunity.github.harvester;

import java.util.ArrayList;
import java.util.List;

/**
 * Command-line argument parser for the harvester. Accepts an optional leading
 * {@code collect} command word followed by options.
 */
public class ArgumentParser {

	static final String COLLECT_COMMAND = "collect";

	private final HarvestProperties defaultProperties;

	public ArgumentParser(HarvestProperties defaultProperties) {
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
				case "--token":
					config.token = getRequiredValue(args, i, "token");
					i++;
					break;

				case "--repos":
					config.maxRepositories = parseInt(getRequiredValue(args, i, "repos"), "repos");
					i++;
					break;

				case "--contributors":
					config.maxContributors = parseInt(getRequiredValue(args, i, "contributors"), "contributors");
					i++;
					break;

				case "--min-contributions":
					config.minContributions = parseInt(getRequiredValue(args, i, "min-contributions"),
							"min-contributions");
					i++;
					break;

				case "--min-commits":
					config.minCommits = parseInt(getRequiredValue(args, i, "min-commits"), "min-commits");
					i++;
					break;

				case "--max-commits":
					config.maxCommitsPerContributor = parseInt(getRequiredValue(args, i, "max-commits"),
							"max-commits");
					i++;
					break;

				case "--workers":
					config.maxWorkers = parseInt(getRequiredValue(args, i, "workers"), "workers");
					i++;
					break;

				case "-o", "--output":
					config.outputFile = getRequiredValue(args, i, "output");
					i++;
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
					if (i != 0 || !COLLECT_COMMAND.equals(arg)) {
						throw new IllegalArgumentException("Unexpected argument: " + arg);
					}
					break;
			}
		}

		validateConfiguration(config);

		return config;
	}

	/**
	 * Check if help is requested without full parsing.
	 * @param args Command-line arguments
	 * @return true if help is requested
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
		help.append("Usage: github-harvester collect [OPTIONS]\n");
		help.append("\n");
		help.append("Collect contributor and commit data from popular technical GitHub repositories.\n");
		help.append("\n");
		help.append("OPTIONS:\n");
		help.append("    -h, --help                 Show this help message\n");
		help.append("    --token TOKEN              GitHub API token (or use GITHUB_TOKEN / GH_TOKEN)\n");
		help.append("    --repos N                  Maximum repositories to analyze (default: ")
			.append(defaultProperties.getMaxRepositories())
			.append(")\n");
		help.append("    --contributors N           Maximum contributors per repository (default: ")
			.append(defaultProperties.getMaxContributors())
			.append(")\n");
		help.append("    --min-contributions N      Minimum contributions per contributor (default: ")
			.append(defaultProperties.getMinContributions())
			.append(")\n");
		help.append("    --min-commits N            Minimum commits per repository (default: ")
			.append(defaultProperties.getMinCommits())
			.append(")\n");
		help.append("    --max-commits N            Maximum commits per contributor (default: ")
			.append(defaultProperties.getMaxCommitsPerContributor())
			.append(")\n");
		help.append("    --workers N                Number of worker threads (default: ")
			.append(defaultProperties.getMaxWorkers())
			.append(")\n");
		help.append("    -o, --output FILE          Output CSV file (default: github_data_<timestamp>.csv)\n");
		help.append("    -v, --verbose              Enable verbose logging\n");
		help.append("\n");
		help.append("ENVIRONMENT VARIABLES:\n");
		help.append("    GITHUB_TOKEN, GH_TOKEN     GitHub personal access token (also read from .env)\n");
		help.append("\n");
		help.append("EXAMPLES:\n");
		help.append("    github-harvester collect --token ghp_yourtoken123 --repos 50\n");
		help.append("    github-harvester collect --repos 100 --min-commits 2000 --output my_data.csv\n");
		help.append("\n");
		return help.toString();
	}

	private String getRequiredValue(String[] args, int currentIndex, String optionName) {
		if (currentIndex + 1 >= args.length) {
			throw new IllegalArgumentException("Missing value for " + optionName + " option");
		}
		return args[currentIndex + 1];
	}

	private int parseInt(String value, String optionName) {
		try {
			return Integer.parseInt(value);
		}
		catch (NumberFormatException e) {
			throw new IllegalArgumentException("Invalid " + optionName + " '" + value + "': must be an integer");
		}
	}

	private void validateConfiguration(ParsedConfiguration config) {
		List<String> errors = new ArrayList<>();

		requirePositive(errors, "repos", config.maxRepositories);
		requirePositive(errors, "contributors", config.maxContributors);
		requirePositive(errors, "max-commits", config.maxCommitsPerContributor);
		requirePositive(errors, "workers", config.maxWorkers);

		if (config.minContributions < 0) {
			errors.add("min-contributions must not be negative (got: " + config.minContributions + ")");
		}
		if (config.minCommits < 0) {
			errors.add("min-commits must not be negative (got: " + config.minCommits + ")");
		}
		if (config.token != null && config.token.isBlank()) {
			errors.add("token must not be blank");
		}

		if (!errors.isEmpty()) {
			StringBuilder errorMsg = new StringBuilder("Configuration validation failed:");
			for (String error : errors) {
				errorMsg.append("\n  - ").append(error);
			}
			throw new IllegalArgumentException(errorMsg.toString());
		}
	}

	private void requirePositive(List<String> errors, String name, int value) {
		if (value <= 0) {
			errors.add(name + " must be positive (got: " + value + ")");
		}
	}

}
