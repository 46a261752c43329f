package org.springaicommunity.github.harvester;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.jspecify.annotations.Nullable;

import java.time.Duration;

/**
 * Builder for wiring the harvester services without a container.
 *
 * <p>
 * Example usage:
 * </p>
 *
 * <pre>
 * {@code
 * // Token from GITHUB_TOKEN / GH_TOKEN
 * DatasetCollectionService collector = GitHubHarvesterBuilder.create()
 *     .tokenFromEnv()
 *     .buildCollector();
 *
 * // Custom limits
 * HarvestProperties props = new HarvestProperties();
 * props.setMaxRepositories(20);
 *
 * DatasetCollectionService collector = GitHubHarvesterBuilder.create()
 *     .token("ghp_xxxxx")
 *     .properties(props)
 *     .buildCollector();
 *
 * HarvestResult result = collector.collect();
 * }
 * </pre>
 */
public class GitHubHarvesterBuilder {

	private @Nullable String token;

	private HarvestProperties properties;

	private @Nullable ObjectMapper objectMapper;

	private @Nullable GitHubClient httpClient;

	private @Nullable GitHubClient client;

	private @Nullable RepositoryClassifier classifier;

	private Sleeper sleeper = Sleeper.THREAD;

	private GitHubHarvesterBuilder() {
		this.properties = new HarvestProperties();
	}

	/**
	 * Create a new builder instance.
	 * @return new GitHubHarvesterBuilder
	 */
	public static GitHubHarvesterBuilder create() {
		return new GitHubHarvesterBuilder();
	}

	/**
	 * Set the GitHub token directly.
	 * @param token GitHub personal access token
	 * @return this builder
	 */
	public GitHubHarvesterBuilder token(@Nullable String token) {
		this.token = token;
		return this;
	}

	/**
	 * Read the GitHub token from {@code GITHUB_TOKEN} or {@code GH_TOKEN}.
	 * @return this builder
	 * @throws IllegalStateException if neither variable is set
	 */
	public GitHubHarvesterBuilder tokenFromEnv() {
		this.token = EnvironmentSupport.resolveToken();
		if (this.token == null) {
			throw new IllegalStateException(
					"GITHUB_TOKEN or GH_TOKEN environment variable is required. Please set your GitHub personal access token.");
		}
		return this;
	}

	/**
	 * Set harvest properties.
	 * @param properties configuration properties (null to use defaults)
	 * @return this builder
	 */
	public GitHubHarvesterBuilder properties(@Nullable HarvestProperties properties) {
		if (properties != null) {
			this.properties = properties;
		}
		return this;
	}

	/**
	 * Set a custom ObjectMapper.
	 * @param objectMapper Jackson ObjectMapper (null to use default)
	 * @return this builder
	 */
	public GitHubHarvesterBuilder objectMapper(@Nullable ObjectMapper objectMapper) {
		this.objectMapper = objectMapper;
		return this;
	}

	/**
	 * Set the raw transport. It is still wrapped in a {@link RateLimitedGitHubClient}
	 * configured from the properties. When set, the token is not required.
	 * @param httpClient raw GitHubClient implementation (null to use default)
	 * @return this builder
	 */
	public GitHubHarvesterBuilder httpClient(@Nullable GitHubClient httpClient) {
		this.httpClient = httpClient;
		return this;
	}

	/**
	 * Set a fully decorated client that is used as-is, bypassing the rate-limit wrapper.
	 * Useful for testing with mocks. When set, the token is not required.
	 * @param client GitHubClient used directly (null to build one)
	 * @return this builder
	 */
	public GitHubHarvesterBuilder client(@Nullable GitHubClient client) {
		this.client = client;
		return this;
	}

	/**
	 * Set a custom repository classifier.
	 * @param classifier classifier (null to use {@link KeywordRepositoryClassifier})
	 * @return this builder
	 */
	public GitHubHarvesterBuilder classifier(@Nullable RepositoryClassifier classifier) {
		this.classifier = classifier;
		return this;
	}

	/**
	 * Set the sleeper used for rate-limit waits and courtesy delays.
	 * @param sleeper sleeper implementation
	 * @return this builder
	 */
	public GitHubHarvesterBuilder sleeper(Sleeper sleeper) {
		this.sleeper = sleeper;
		return this;
	}

	/**
	 * Build the RestService directly (for advanced usage).
	 * @return configured RestService
	 */
	public RestService buildRestService() {
		validateToken();
		return createRestService();
	}

	/**
	 * Build the full collection pipeline.
	 * @return configured DatasetCollectionService
	 */
	public DatasetCollectionService buildCollector() {
		validateToken();
		RestService restService = createRestService();
		RepositoryClassifier repositoryClassifier = this.classifier != null ? this.classifier
				: new KeywordRepositoryClassifier();

		RepositoryDiscoveryService discovery = new RepositoryDiscoveryService(restService,
				repositoryClassifier, properties);
		ContributorExpansionService expansion = new ContributorExpansionService(restService);
		CommitHarvestService harvest = new CommitHarvestService(restService, properties);
		return new DatasetCollectionService(discovery, expansion, harvest, properties);
	}

	private void validateToken() {
		if (client != null || httpClient != null) {
			return;
		}
		if (token == null || token.trim().isEmpty()) {
			throw new IllegalStateException("GitHub token is required. Call token() or tokenFromEnv() first.");
		}
	}

	private RestService createRestService() {
		ObjectMapper mapper = this.objectMapper != null ? this.objectMapper : ObjectMapperFactory.create();
		GitHubClient github = this.client != null ? this.client : rateLimited(transport());
		Paginator paginator = new Paginator(github, mapper, sleeper);
		return new GitHubRestService(github, mapper, paginator, properties);
	}

	private GitHubClient transport() {
		if (httpClient != null) {
			return httpClient;
		}
		if (token == null) {
			throw new IllegalStateException("GitHub token is required. Call token() or tokenFromEnv() first.");
		}
		return new GitHubHttpClient(token.trim());
	}

	private RateLimitedGitHubClient rateLimited(GitHubClient transport) {
		return RateLimitedGitHubClient.builder()
			.wrapping(transport)
			.safetyMargin(Duration.ofSeconds(properties.getRateLimitSafetyMarginSeconds()))
			.maxNetworkRetries(properties.getMaxNetworkRetries())
			.networkRetryDelay(Duration.ofMillis(properties.getNetworkRetryDelayMs()))
			.pacingThreshold(properties.getPacingThreshold())
			.sleeper(sleeper)
			.build();
	}

}
