package org.springaicommunity.github.harvester;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Harvests the commits of each work item into result rows on a bounded worker pool.
 */
public class CommitHarvestService {

	private static final Logger logger = LoggerFactory.getLogger(CommitHarvestService.class);

	static final int PROGRESS_INTERVAL = 5;

	private final RestService restService;

	private final boolean skipContributorsWithoutLocation;

	public CommitHarvestService(RestService restService, HarvestProperties properties) {
		this.restService = restService;
		this.skipContributorsWithoutLocation = properties.isSkipContributorsWithoutLocation();
	}

	/**
	 * Harvest one work item.
	 *
	 * <p>
	 * A contributor without a location yields no rows unless skipping is disabled, in
	 * which case the location is recorded as {@value UserProfile#UNKNOWN_LOCATION}. A
	 * contributor with a location but no commits yields one row with unavailable commit
	 * fields.
	 * @param workItem repository and contributor
	 * @param maxCommits maximum commits to fetch for the contributor
	 * @return rows for this work item
	 */
	public List<ResultRow> harvest(WorkItem workItem, int maxCommits) {
		Repository repository = workItem.repository();
		Contributor contributor = workItem.contributor();

		UserProfile profile = restService.getUser(contributor.login());
		String location;
		if (profile.hasLocation()) {
			location = profile.location();
		}
		else if (skipContributorsWithoutLocation) {
			logger.debug("Skipping {} in {}: no location", contributor.login(), repository.fullName());
			return List.of();
		}
		else {
			location = UserProfile.UNKNOWN_LOCATION;
		}

		List<CommitRecord> commits = restService.getCommitsByAuthor(repository.ownerLogin(), repository.name(),
				contributor.login(), maxCommits);

		List<ResultRow> rows = new ArrayList<>();
		if (commits.isEmpty()) {
			rows.add(ResultRow.of(workItem, location, CommitRecord.UNAVAILABLE));
		}
		else {
			for (CommitRecord commit : commits) {
				rows.add(ResultRow.of(workItem, location, commit));
			}
		}

		logger.info("Processed contributor: {} ({} commits)", contributor.login(), commits.size());
		return rows;
	}

	/**
	 * Harvest all work items with at most {@code maxWorkers} in flight. Rows of a single
	 * work item stay contiguous; work items appear in completion order. A failing work
	 * item is logged and counted and does not affect the others.
	 * @param workItems items produced by contributor expansion
	 * @param maxWorkers worker pool size
	 * @param maxCommits maximum commits per contributor
	 * @return harvested rows and failure count
	 */
	public HarvestBatch harvestAll(List<WorkItem> workItems, int maxWorkers, int maxCommits) {
		int total = workItems.size();
		logger.info("Processing {} contributors with {} workers...", total, maxWorkers);

		FanOut.Outcome<List<ResultRow>> outcome = FanOut.map("harvest", workItems, maxWorkers,
				workItem -> harvest(workItem, maxCommits),
				workItem -> "contributor " + workItem.contributor().login() + " in "
						+ workItem.repository().fullName(),
				completed -> {
					if (completed % PROGRESS_INTERVAL == 0 || completed == total) {
						logger.info("Processed contributors: {}/{}", completed, total);
					}
				});

		List<ResultRow> rows = new ArrayList<>();
		outcome.results().forEach(rows::addAll);
		return new HarvestBatch(rows, outcome.failures());
	}

}
