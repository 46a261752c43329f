package org.springaicommunity.github.harvester;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.util.List;

/**
 * Runs a complete collection: repository discovery, contributor expansion and commit
 * harvest, strictly one phase after the other.
 *
 * <p>
 * Upstream failures never escape {@link #collect()}; each phase degrades to whatever it
 * managed to gather.
 */
public class DatasetCollectionService {

	private static final Logger logger = LoggerFactory.getLogger(DatasetCollectionService.class);

	private final RepositoryDiscoveryService discoveryService;

	private final ContributorExpansionService expansionService;

	private final CommitHarvestService harvestService;

	private final HarvestProperties properties;

	private final Clock clock;

	public DatasetCollectionService(RepositoryDiscoveryService discoveryService,
			ContributorExpansionService expansionService, CommitHarvestService harvestService,
			HarvestProperties properties) {
		this(discoveryService, expansionService, harvestService, properties, Clock.systemUTC());
	}

	DatasetCollectionService(RepositoryDiscoveryService discoveryService, ContributorExpansionService expansionService,
			CommitHarvestService harvestService, HarvestProperties properties, Clock clock) {
		this.discoveryService = discoveryService;
		this.expansionService = expansionService;
		this.harvestService = harvestService;
		this.properties = properties;
		this.clock = clock;
	}

	public HarvestResult collect() {
		long start = clock.millis();
		logConfiguration();

		List<Repository> repositories = discoveryService.discover(properties.getMaxRepositories(),
				properties.getMinCommits());
		if (repositories.isEmpty()) {
			logger.warn("No suitable repositories found");
			return HarvestResult.empty(Duration.ofMillis(clock.millis() - start));
		}
		logger.info("Selected {} TECHNICAL repositories for analysis", repositories.size());

		List<WorkItem> workItems = expansionService.expandAll(repositories, properties.getMaxContributors(),
				properties.getMinContributions(), properties.getExpansionConcurrency());

		HarvestBatch batch = harvestService.harvestAll(workItems, properties.getMaxWorkers(),
				properties.getMaxCommitsPerContributor());

		HarvestResult result = new HarvestResult(batch.rows(), repositories.size(), workItems.size(),
				batch.failedWorkItems(), Duration.ofMillis(clock.millis() - start));
		logSummary(result);
		return result;
	}

	private void logConfiguration() {
		logger.info("Starting GitHub data collection...");
		logger.info("Configuration:");
		logger.info("  Repositories: {}", properties.getMaxRepositories());
		logger.info("  Contributors per repo: {}", properties.getMaxContributors());
		logger.info("  Min contributions: {}", properties.getMinContributions());
		logger.info("  Min commits per repo: {}", properties.getMinCommits());
		logger.info("  Max commits per contributor: {}", properties.getMaxCommitsPerContributor());
		logger.info("  Worker threads: {}", properties.getMaxWorkers());
	}

	private void logSummary(HarvestResult result) {
		logger.info("Collection completed in {} seconds", String.format("%.2f", result.elapsed().toMillis() / 1000.0));
		logger.info("  Repositories accepted: {}", result.repositoriesAccepted());
		logger.info("  Contributors processed: {}", result.workItems());
		logger.info("  Records collected: {}", result.rows().size());
		if (result.failedWorkItems() > 0) {
			logger.warn("  Contributors failed: {}", result.failedWorkItems());
		}
	}

}
