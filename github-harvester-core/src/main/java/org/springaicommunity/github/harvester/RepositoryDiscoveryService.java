package org.springaicommunity.github.harvester;

import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Finds popular technical repositories with a substantial commit history.
 *
 * <p>
 * Candidates are taken from the search API in stars-descending order. Each one is checked
 * by the {@link RepositoryClassifier}, then its commit count is looked up; it is accepted
 * when the count reaches the configured minimum. Acceptance order is search order.
 */
public class RepositoryDiscoveryService {

	private static final Logger logger = LoggerFactory.getLogger(RepositoryDiscoveryService.class);

	/**
	 * Upper bound of the search page size; pages are over-fetched because many
	 * candidates are rejected.
	 */
	static final int MAX_SEARCH_PAGE_SIZE = 50;

	static final int OVER_FETCH_FACTOR = 3;

	private final RestService restService;

	private final RepositoryClassifier classifier;

	private final HarvestProperties properties;

	public RepositoryDiscoveryService(RestService restService, RepositoryClassifier classifier,
			HarvestProperties properties) {
		this.restService = restService;
		this.classifier = classifier;
		this.properties = properties;
	}

	/**
	 * Discover up to {@code targetCount} repositories with at least {@code minCommits}
	 * commits.
	 * @param targetCount number of repositories wanted
	 * @param minCommits minimum commit count
	 * @return accepted repositories in search order, classified; possibly fewer than
	 * requested if the search results run out or a search page fails
	 */
	public List<Repository> discover(int targetCount, int minCommits) {
		if (targetCount <= 0) {
			return List.of();
		}

		logger.info("Getting popular TECHNICAL repositories...");
		logger.info("Filtering: skipping repositories without programming language, content collections and with < {} commits",
				minCommits);

		int perPage = Math.min(MAX_SEARCH_PAGE_SIZE, targetCount * OVER_FETCH_FACTOR);
		List<Repository> accepted = new ArrayList<>();

		try {
			restService.searchRepositories(properties.getSearchQuery(), perPage, targetCount, candidate -> {
				Repository repository = evaluate(candidate, minCommits);
				if (repository != null) {
					accepted.add(repository);
					logger.info("Found suitable repositories: {}/{}", accepted.size(), targetCount);
				}
				return repository;
			});
			logger.info("Discovery finished: {} repositories accepted", accepted.size());
		}
		catch (RuntimeException e) {
			logger.error("Repository discovery stopped early, keeping {} accepted repositories: {}", accepted.size(),
					e.getMessage(), e);
		}
		return List.copyOf(accepted);
	}

	/**
	 * Apply the acceptance rules to one search candidate.
	 * @return the candidate enriched with its commit count and type, or null if rejected
	 */
	@Nullable Repository evaluate(Repository candidate, int minCommits) {
		if (!classifier.isTechnical(candidate)) {
			return null;
		}

		logger.info("Checking commits for {}...", candidate.fullName());
		int commitCount;
		try {
			commitCount = restService.getCommitCount(candidate.ownerLogin(), candidate.name());
		}
		catch (RuntimeException e) {
			if (Thread.currentThread().isInterrupted()) {
				throw e;
			}
			logger.warn("Skipped: commit lookup failed for {}: {}", candidate.fullName(), e.getMessage());
			return null;
		}

		if (commitCount < minCommits) {
			logger.info("Skipped: too few commits ({} < {}) - {}", commitCount, minCommits, candidate.fullName());
			return null;
		}

		Repository repository = candidate.withCommitCount(commitCount);
		repository = repository.withType(classifier.classify(repository));
		logger.info("Added repository: {} ({} commits, {}, stars: {}, type: {})", repository.fullName(), commitCount,
				repository.language() != null ? repository.language() : "No language", repository.stars(),
				repository.type() != null ? repository.type().getValue() : "unknown");
		return repository;
	}

}
