package org.springaicommunity.github.harvester;

import java.util.List;

/**
 * One flattened dataset row: a repository, one of its contributors and one commit (or
 * the {@link CommitRecord#UNAVAILABLE} placeholder).
 */
public record ResultRow(long repoId, String repoName, String repoType, int stars, String contributorLogin,
		String contributorLocation, int contributions, String commitSha, String commitDate, String commitMessage) {

	/**
	 * Column names in output order.
	 */
	public static final List<String> COLUMNS = List.of("repo_id", "repo_name", "repo_type", "stars",
			"contributor_login", "contributor_location", "contributions", "commit_sha", "commit_date",
			"commit_message");

	public static ResultRow of(WorkItem item, String location, CommitRecord commit) {
		Repository repo = item.repository();
		RepositoryType type = repo.type();
		return new ResultRow(repo.id(), repo.fullName(), type != null ? type.getValue() : "", repo.stars(),
				item.contributor().login(), location, item.contributor().contributions(), commit.sha(), commit.date(),
				commit.message());
	}

	public boolean hasCommit() {
		return !CommitRecord.NOT_AVAILABLE.equals(commitSha);
	}

	/**
	 * Values in {@link #COLUMNS} order.
	 * @return the row values
	 */
	public List<Object> values() {
		return List.of(repoId, repoName, repoType, stars, contributorLogin, contributorLocation, contributions,
				commitSha, commitDate, commitMessage);
	}

}
