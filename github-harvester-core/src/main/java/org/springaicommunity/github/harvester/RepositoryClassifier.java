package org.springaicommunity.github.harvester;

/**
 * Categorizes repositories found by the search API.
 *
 * <p>
 * Implementations must be pure functions of the repository metadata: they are called
 * concurrently and must not perform I/O.
 */
public interface RepositoryClassifier {

	/**
	 * Decide whether a repository contains program code rather than curated content
	 * (lists, books, course material).
	 * @param repository the candidate repository
	 * @return true if the repository should be considered for the dataset
	 */
	boolean isTechnical(Repository repository);

	/**
	 * Assign a category to an accepted repository.
	 * @param repository the accepted repository
	 * @return the repository category
	 */
	RepositoryType classify(Repository repository);

}
