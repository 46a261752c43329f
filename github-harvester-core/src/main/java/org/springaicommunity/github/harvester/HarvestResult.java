package org.springaicommunity.github.harvester;

import java.time.Duration;
import java.util.List;

/**
 * Outcome of a full collection run.
 *
 * @param rows harvested rows in completion order
 * @param repositoriesAccepted number of repositories accepted by discovery
 * @param workItems number of work items produced by expansion
 * @param failedWorkItems number of work items whose harvest failed
 * @param elapsed wall-clock duration of the run
 */
public record HarvestResult(List<ResultRow> rows, int repositoriesAccepted, int workItems, int failedWorkItems,
		Duration elapsed) {

	public HarvestResult {
		rows = List.copyOf(rows);
	}

	public static HarvestResult empty(Duration elapsed) {
		return new HarvestResult(List.of(), 0, 0, 0, elapsed);
	}

	public boolean isEmpty() {
		return rows.isEmpty();
	}

	public long uniqueRepositories() {
		return rows.stream().mapToLong(ResultRow::repoId).distinct().count();
	}

	public long uniqueContributors() {
		return rows.stream().map(ResultRow::contributorLogin).distinct().count();
	}

	public long rowsWithCommits() {
		return rows.stream().filter(ResultRow::hasCommit).count();
	}

	public long rowsWithoutCommits() {
		return rows.size() - rowsWithCommits();
	}

}
