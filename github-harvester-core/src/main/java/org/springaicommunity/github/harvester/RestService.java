package org.springaicommunity.github.harvester;

import org.jspecify.annotations.Nullable;

import java.util.List;
import java.util.function.Function;

/**
 * Interface for the GitHub REST API operations used by the harvester.
 *
 * <p>
 * Returns strongly-typed records instead of raw JSON to provide type safety and
 * encapsulate the GitHub API response structure. Missing or malformed fields degrade to
 * defaults rather than failing the call.
 */
public interface RestService {

	/**
	 * Page through the repository search API, sorted by stars descending.
	 *
	 * <p>
	 * The acceptor is applied to each candidate in search order and may enrich it; it
	 * returns null to reject the candidate. Paging stops as soon as {@code maxItems}
	 * candidates are accepted.
	 * @param query search query (GitHub search syntax)
	 * @param perPage number of candidates requested per page
	 * @param maxItems maximum number of accepted repositories
	 * @param acceptor per-candidate acceptance decision
	 * @return accepted repositories in search order
	 */
	List<Repository> searchRepositories(String query, int perPage, int maxItems,
			Function<Repository, @Nullable Repository> acceptor);

	/**
	 * Get the total commit count of a repository's default branch.
	 *
	 * <p>
	 * Requests a single commit per page and reads the last page number from the
	 * {@code Link} header. Falls back to the size of the returned page when the header is
	 * missing, which underestimates large histories.
	 * @param owner Repository owner
	 * @param repo Repository name
	 * @return commit count, or 0 if the repository could not be read
	 */
	int getCommitCount(String owner, String repo);

	/**
	 * Get contributors of a repository, excluding anonymous contributors.
	 * @param owner Repository owner
	 * @param repo Repository name
	 * @param maxContributors maximum number of contributors to return
	 * @param minContributions contributors below this count are filtered out
	 * @return contributors in API order (most contributions first)
	 */
	List<Contributor> getContributors(String owner, String repo, int maxContributors, int minContributions);

	/**
	 * Get commits authored by a user in a repository, newest first.
	 * @param owner Repository owner
	 * @param repo Repository name
	 * @param author Author login
	 * @param maxCommits maximum number of commits to return
	 * @return normalized commit records
	 */
	List<CommitRecord> getCommitsByAuthor(String owner, String repo, String author, int maxCommits);

	/**
	 * Get a user profile. When the profile cannot be retrieved the location is reported
	 * as {@link UserProfile#UNKNOWN_LOCATION}.
	 * @param login GitHub username
	 * @return the user's profile
	 */
	UserProfile getUser(String login);

}
