package org.springaicommunity.github.harvester;

import org.jspecify.annotations.Nullable;

/**
 * Parsed configuration result from command-line arguments.
 */
public class ParsedConfiguration {

	// Credentials
	public @Nullable String token;

	// Discovery
	public int maxRepositories;

	public int minCommits;

	// Expansion
	public int maxContributors;

	public int minContributions;

	// Harvest
	public int maxCommitsPerContributor;

	public int maxWorkers;

	// Output
	public @Nullable String outputFile = null; // null = timestamped default name

	public boolean verbose = false;

	public boolean helpRequested = false;

	public ParsedConfiguration(HarvestProperties defaultProperties) {
		this.maxRepositories = defaultProperties.getMaxRepositories();
		this.minCommits = defaultProperties.getMinCommits();
		this.maxContributors = defaultProperties.getMaxContributors();
		this.minContributions = defaultProperties.getMinContributions();
		this.maxCommitsPerContributor = defaultProperties.getMaxCommitsPerContributor();
		this.maxWorkers = defaultProperties.getMaxWorkers();
	}

	/**
	 * Copy the parsed limits onto a properties object.
	 * @param properties target properties
	 * @return the same properties instance
	 */
	public HarvestProperties applyTo(HarvestProperties properties) {
		properties.setMaxRepositories(maxRepositories);
		properties.setMinCommits(minCommits);
		properties.setMaxContributors(maxContributors);
		properties.setMinContributions(minContributions);
		properties.setMaxCommitsPerContributor(maxCommitsPerContributor);
		properties.setMaxWorkers(maxWorkers);
		return properties;
	}

	@Override
	public String toString() {
		return "ParsedConfiguration{" + "token=" + (token != null ? "***" : "null") + ", maxRepositories="
				+ maxRepositories + ", minCommits=" + minCommits + ", maxContributors=" + maxContributors
				+ ", minContributions=" + minContributions + ", maxCommitsPerContributor=" + maxCommitsPerContributor
				+ ", maxWorkers=" + maxWorkers + ", outputFile='" + outputFile + '\'' + ", verbose=" + verbose
				+ ", helpRequested=" + helpRequested + '}';
	}

}
