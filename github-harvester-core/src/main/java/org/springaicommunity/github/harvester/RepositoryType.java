package org.springaicommunity.github.harvester;

/**
 * Category assigned to an accepted repository by a {@link RepositoryClassifier}.
 */
public enum RepositoryType {

	CORPORATE("corporate"),

	EDUCATIONAL("educational"),

	OPEN_SOURCE("open_source");

	private final String value;

	RepositoryType(String value) {
		this.value = value;
	}

	/**
	 * Returns the value written to the dataset.
	 * @return the lower-case category name
	 */
	public String getValue() {
		return value;
	}

}
