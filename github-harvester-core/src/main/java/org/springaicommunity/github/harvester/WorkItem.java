package org.springaicommunity.github.harvester;

/**
 * Unit of concurrent harvesting: one contributor within one accepted repository.
 *
 * @param repository the accepted repository
 * @param contributor the contributor to harvest commits for
 */
public record WorkItem(Repository repository, Contributor contributor) {
}
