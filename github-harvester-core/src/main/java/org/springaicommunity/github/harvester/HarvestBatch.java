package org.springaicommunity.github.harvester;

import java.util.List;

/**
 * Rows produced by one harvest pass and the number of work items that failed.
 */
public record HarvestBatch(List<ResultRow> rows, int failedWorkItems) {

	public HarvestBatch {
		rows = List.copyOf(rows);
	}

}
