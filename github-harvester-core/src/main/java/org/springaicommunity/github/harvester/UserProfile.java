package org.springaicommunity.github.harvester;

import org.jspecify.annotations.Nullable;

/**
 * The parts of a GitHub user profile the harvester needs.
 *
 * @param login the GitHub username
 * @param location the free-text location from the profile, null if not set
 */
public record UserProfile(String login, @Nullable String location) {

	/**
	 * Location reported when the profile itself could not be retrieved.
	 */
	public static final String UNKNOWN_LOCATION = "Unknown";

	public boolean hasLocation() {
		return location != null && !location.isBlank();
	}

}
