package org.springaicommunity.github.harvester;

/**
 * A contributor listed for a repository.
 *
 * @param login the contributor's GitHub username
 * @param contributions the number of contributions to the repository
 */
public record Contributor(String login, int contributions) {
}
