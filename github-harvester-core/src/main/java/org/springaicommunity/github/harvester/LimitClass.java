package org.springaicommunity.github.harvester;

/**
 * GitHub API quota buckets. Search requests and all other REST requests are throttled
 * independently, each with its own remaining-request budget and reset time.
 */
public enum LimitClass {

	/**
	 * The search API bucket (30 requests per minute for authenticated users).
	 */
	SEARCH("Search API"),

	/**
	 * The core REST API bucket (5000 requests per hour for authenticated users).
	 */
	CORE("Core API");

	private final String displayName;

	LimitClass(String displayName) {
		this.displayName = displayName;
	}

	public String getDisplayName() {
		return displayName;
	}

}
