package org.springaicommunity.github.harvester.cli;

import ch.qos.logback.classic.Level;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springaicommunity.github.harvester.*;

import java.io.IOException;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.function.Supplier;

/**
 * GitHub Harvester CLI Application
 *
 * Plain Java command-line application that discovers popular technical repositories,
 * expands them into their top contributors and writes each contributor's commits to a
 * CSV file. Services are wired with GitHubHarvesterBuilder.
 *
 * Usage: java -jar github-harvester-cli.jar collect [OPTIONS]
 *
 * Environment Variables: GITHUB_TOKEN or GH_TOKEN - GitHub personal access token
 *
 * Examples: java -jar github-harvester-cli.jar collect --repos 50 java -jar
 * github-harvester-cli.jar collect --repos 100 --min-commits 2000 --output my_data.csv
 */
public class GitHubHarvesterCli {

	private static final Logger logger = LoggerFactory.getLogger(GitHubHarvesterCli.class);

	static final DateTimeFormatter OUTPUT_TIMESTAMP = DateTimeFormatter.ofPattern("yyyyMMdd_HHmmss");

	private static final String BASE_PACKAGE = "org.springaicommunity.github.harvester";

	public static void main(String[] args) {
		try {
			int exitCode = run(args);
			if (exitCode != 0) {
				System.exit(exitCode);
			}
		}
		catch (Exception e) {
			logger.error("Collection failed: {}", e.getMessage(), e);
			System.exit(1);
		}
	}

	public static int run(String[] args) throws IOException {
		return run(args, EnvironmentSupport::resolveToken);
	}

	static int run(String[] args, Supplier<String> environmentToken) throws IOException {
		HarvestProperties properties = new HarvestProperties();
		ArgumentParser argumentParser = new ArgumentParser(properties);

		if (argumentParser.isHelpRequested(args)) {
			System.out.println(argumentParser.generateHelpText());
			return 0;
		}

		ParsedConfiguration config;
		try {
			config = argumentParser.parseAndValidate(args);
		}
		catch (IllegalArgumentException e) {
			logger.error("Invalid arguments: {}", e.getMessage());
			logger.error("Use --help for usage information");
			return 1;
		}

		if (config.verbose) {
			enableVerboseLogging();
		}

		String token = config.token != null ? config.token : environmentToken.get();
		if (token == null || token.isBlank()) {
			logger.error("GitHub token is required for data collection.");
			logger.error("Use --token argument or set GITHUB_TOKEN environment variable.");
			return 1;
		}

		config.applyTo(properties);
		Path output = resolveOutput(config.outputFile);

		DatasetCollectionService collector = GitHubHarvesterBuilder.create()
			.token(token)
			.properties(properties)
			.buildCollector();
		HarvestResult result = collector.collect();

		new CsvDatasetSink().write(result.rows(), output);

		logSummary(result, output);
		return 0;
	}

	static Path resolveOutput(String outputFile) {
		if (outputFile != null) {
			return Paths.get(outputFile);
		}
		return Paths.get("github_data_" + LocalDateTime.now().format(OUTPUT_TIMESTAMP) + ".csv");
	}

	private static void enableVerboseLogging() {
		Logger base = LoggerFactory.getLogger(BASE_PACKAGE);
		if (base instanceof ch.qos.logback.classic.Logger logbackLogger) {
			logbackLogger.setLevel(Level.DEBUG);
		}
	}

	private static void logSummary(HarvestResult result, Path output) {
		logger.info("Collection completed in {} seconds", String.format("%.2f", result.elapsed().toMillis() / 1000.0));
		if (result.isEmpty()) {
			logger.warn("No records collected; wrote header only to {}", output);
			return;
		}
		logger.info("Collection Summary:");
		logger.info("  Unique repositories: {}", result.uniqueRepositories());
		logger.info("  Unique contributors: {}", result.uniqueContributors());
		logger.info("  Total records: {}", result.rows().size());
		logger.info("  Records with commits: {}", result.rowsWithCommits());
		logger.info("  Records without commits: {}", result.rowsWithoutCommits());
		logger.info("  Output file: {}", output);
	}

}
