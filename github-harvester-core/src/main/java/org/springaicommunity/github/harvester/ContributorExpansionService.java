package org.springaicommunity.github.harvester;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Expands accepted repositories into harvest work items, one per qualifying contributor.
 */
public class ContributorExpansionService {

	private static final Logger logger = LoggerFactory.getLogger(ContributorExpansionService.class);

	private final RestService restService;

	public ContributorExpansionService(RestService restService) {
		this.restService = restService;
	}

	/**
	 * List the contributors of one repository that have at least
	 * {@code minContributions} contributions, capped at {@code maxContributors}.
	 * @param repository the accepted repository
	 * @param maxContributors maximum number of contributors
	 * @param minContributions minimum contributions per contributor
	 * @return contributors in API order
	 */
	public List<Contributor> expand(Repository repository, int maxContributors, int minContributions) {
		logger.info("Analyzing repository: {} ({}, {} commits, type: {}, stars: {})", repository.fullName(),
				repository.language() != null ? repository.language() : "No language", repository.commitCount(),
				repository.type() != null ? repository.type().getValue() : "unknown", repository.stars());

		List<Contributor> contributors = restService.getContributors(repository.ownerLogin(), repository.name(),
				maxContributors, minContributions);
		logger.info("  Found contributors for {}: {}", repository.fullName(), contributors.size());
		return contributors;
	}

	/**
	 * Expand all repositories concurrently, at most {@code concurrency} at a time.
	 *
	 * <p>
	 * The returned list is complete before harvesting starts. Work items of one repository
	 * stay together in API order; repositories appear in completion order. A repository
	 * whose listing fails is logged and contributes no work items.
	 * @param repositories accepted repositories
	 * @param maxContributors maximum number of contributors per repository
	 * @param minContributions minimum contributions per contributor
	 * @param concurrency maximum number of repositories listed in parallel
	 * @return all work items
	 */
	public List<WorkItem> expandAll(List<Repository> repositories, int maxContributors, int minContributions,
			int concurrency) {
		logger.info("Starting parallel analysis of {} TECHNICAL repositories...", repositories.size());

		FanOut.Outcome<List<WorkItem>> outcome = FanOut.map("expand", repositories, concurrency, repository -> {
			List<WorkItem> items = new ArrayList<>();
			for (Contributor contributor : expand(repository, maxContributors, minContributions)) {
				items.add(new WorkItem(repository, contributor));
			}
			return items;
		}, repository -> "repository " + repository.fullName(), completed -> {
		});

		List<WorkItem> workItems = new ArrayList<>();
		outcome.results().forEach(workItems::addAll);

		logger.info("Total contributors collected for processing: {}", workItems.size());
		if (outcome.failures() > 0) {
			logger.warn("{} repositories could not be expanded", outcome.failures());
		}
		return workItems;
	}

}
