package org.springaicommunity.github.harvester;

import org.jspecify.annotations.Nullable;

import java.util.List;

/**
 * A repository returned by the search API, candidate for inclusion in the dataset.
 *
 * <p>
 * The commit count is looked up lazily during discovery and the type is assigned once the
 * repository is accepted; both are carried as copies via {@link #withCommitCount(int)}
 * and {@link #withType(RepositoryType)}.
 *
 * @param id the unique repository ID
 * @param name the repository name (without owner)
 * @param fullName the full repository name in "owner/repo" format
 * @param ownerLogin the owner's login
 * @param organization the owning organization's login, if the API reported one
 * @param language the primary language, if detected
 * @param description the repository description (may be null)
 * @param topics the repository topics
 * @param stars the stargazer count
 * @param commitCount the number of commits, or -1 if not looked up yet
 * @param type the assigned category, or null before acceptance
 */
public record Repository(long id, String name, String fullName, String ownerLogin, @Nullable String organization,
		@Nullable String language, @Nullable String description, List<String> topics, int stars, int commitCount,
		@Nullable RepositoryType type) {

	public Repository {
		topics = List.copyOf(topics);
	}

	public Repository withCommitCount(int commitCount) {
		return new Repository(id, name, fullName, ownerLogin, organization, language, description, topics, stars,
				commitCount, type);
	}

	public Repository withType(RepositoryType type) {
		return new Repository(id, name, fullName, ownerLogin, organization, language, description, topics, stars,
				commitCount, type);
	}

}
