package org.springaicommunity.github.harvester;

/**
 * Configuration properties for a harvest run.
 *
 * <p>
 * This class provides configuration options for the size of the crawl, the degree of
 * parallelism and the way the GitHub rate limits are respected. Properties can be set
 * directly via setters, through {@link ArgumentParser}, or passed to
 * {@link GitHubHarvesterBuilder}.
 *
 * <p>
 * Default values match the command line defaults. Lower the caps for quick sample runs;
 * raise the worker counts only with a token that has a full core quota.
 */
public class HarvestProperties {

	/**
	 * Number of repositories to accept during discovery.
	 */
	private int maxRepositories = 100;

	/**
	 * Maximum number of contributors kept per repository.
	 */
	private int maxContributors = 50;

	/**
	 * Minimum contributions for a contributor to be kept.
	 */
	private int minContributions = 100;

	/**
	 * Minimum commit count for a repository to be accepted.
	 */
	private int minCommits = 1000;

	/**
	 * Maximum number of commits fetched per contributor and repository.
	 */
	private int maxCommitsPerContributor = 1000;

	/**
	 * Number of threads harvesting commits.
	 */
	private int maxWorkers = 50;

	/**
	 * Number of threads listing contributors of accepted repositories.
	 */
	private int expansionConcurrency = 50;

	/**
	 * Search API query used to find candidate repositories.
	 */
	private String searchQuery = "stars:1000..66739 -language:HTML -language:TypeScript -language:Markdown";

	/**
	 * Pause in milliseconds between search result pages.
	 */
	private long searchPageDelayMs = 1000;

	/**
	 * Pause in milliseconds between contributor pages.
	 */
	private long contributorPageDelayMs = 100;

	/**
	 * Pause in milliseconds between commit pages.
	 */
	private long commitPageDelayMs = 200;

	/**
	 * Page size for contributor listings.
	 */
	private int contributorsPerPage = 100;

	/**
	 * Page size for commit listings.
	 */
	private int commitsPerPage = 10;

	/**
	 * Seconds to wait past the reported reset when the quota is exhausted.
	 */
	private int rateLimitSafetyMarginSeconds = 10;

	/**
	 * Maximum retries after a network failure before the request fails.
	 */
	private int maxNetworkRetries = 5;

	/**
	 * Initial delay in milliseconds before retrying a network failure (doubles per retry).
	 */
	private long networkRetryDelayMs = 5000;

	/**
	 * Remaining-request count below which requests are proactively spaced out.
	 */
	private int pacingThreshold = 100;

	/**
	 * Drop contributors whose profile has no location instead of writing them with an unknown location.
	 */
	private boolean skipContributorsWithoutLocation = true;

	public int getMaxRepositories() {
		return maxRepositories;
	}

	public void setMaxRepositories(int maxRepositories) {
		this.maxRepositories = maxRepositories;
	}

	public int getMaxContributors() {
		return maxContributors;
	}

	public void setMaxContributors(int maxContributors) {
		this.maxContributors = maxContributors;
	}

	public int getMinContributions() {
		return minContributions;
	}

	public void setMinContributions(int minContributions) {
		this.minContributions = minContributions;
	}

	public int getMinCommits() {
		return minCommits;
	}

	public void setMinCommits(int minCommits) {
		this.minCommits = minCommits;
	}

	public int getMaxCommitsPerContributor() {
		return maxCommitsPerContributor;
	}

	public void setMaxCommitsPerContributor(int maxCommitsPerContributor) {
		this.maxCommitsPerContributor = maxCommitsPerContributor;
	}

	public int getMaxWorkers() {
		return maxWorkers;
	}

	public void setMaxWorkers(int maxWorkers) {
		this.maxWorkers = maxWorkers;
	}

	public int getExpansionConcurrency() {
		return expansionConcurrency;
	}

	public void setExpansionConcurrency(int expansionConcurrency) {
		this.expansionConcurrency = expansionConcurrency;
	}

	public String getSearchQuery() {
		return searchQuery;
	}

	public void setSearchQuery(String searchQuery) {
		this.searchQuery = searchQuery;
	}

	public long getSearchPageDelayMs() {
		return searchPageDelayMs;
	}

	public void setSearchPageDelayMs(long searchPageDelayMs) {
		this.searchPageDelayMs = searchPageDelayMs;
	}

	public long getContributorPageDelayMs() {
		return contributorPageDelayMs;
	}

	public void setContributorPageDelayMs(long contributorPageDelayMs) {
		this.contributorPageDelayMs = contributorPageDelayMs;
	}

	public long getCommitPageDelayMs() {
		return commitPageDelayMs;
	}

	public void setCommitPageDelayMs(long commitPageDelayMs) {
		this.commitPageDelayMs = commitPageDelayMs;
	}

	public int getContributorsPerPage() {
		return contributorsPerPage;
	}

	public void setContributorsPerPage(int contributorsPerPage) {
		this.contributorsPerPage = contributorsPerPage;
	}

	public int getCommitsPerPage() {
		return commitsPerPage;
	}

	public void setCommitsPerPage(int commitsPerPage) {
		this.commitsPerPage = commitsPerPage;
	}

	public int getRateLimitSafetyMarginSeconds() {
		return rateLimitSafetyMarginSeconds;
	}

	public void setRateLimitSafetyMarginSeconds(int rateLimitSafetyMarginSeconds) {
		this.rateLimitSafetyMarginSeconds = rateLimitSafetyMarginSeconds;
	}

	public int getMaxNetworkRetries() {
		return maxNetworkRetries;
	}

	public void setMaxNetworkRetries(int maxNetworkRetries) {
		this.maxNetworkRetries = maxNetworkRetries;
	}

	public long getNetworkRetryDelayMs() {
		return networkRetryDelayMs;
	}

	public void setNetworkRetryDelayMs(long networkRetryDelayMs) {
		this.networkRetryDelayMs = networkRetryDelayMs;
	}

	public int getPacingThreshold() {
		return pacingThreshold;
	}

	public void setPacingThreshold(int pacingThreshold) {
		this.pacingThreshold = pacingThreshold;
	}

	public boolean isSkipContributorsWithoutLocation() {
		return skipContributorsWithoutLocation;
	}

	public void setSkipContributorsWithoutLocation(boolean skipContributorsWithoutLocation) {
		this.skipContributorsWithoutLocation = skipContributorsWithoutLocation;
	}

}
