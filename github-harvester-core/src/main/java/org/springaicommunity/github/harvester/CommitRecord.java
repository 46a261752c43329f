package org.springaicommunity.github.harvester;

/**
 * A normalized commit authored by a contributor.
 *
 * @param sha the abbreviated commit SHA (at most 8 characters)
 * @param date the author date as {@code yyyy-MM-dd HH:mm:ss}, or {@code N/A}
 * @param message the cleaned commit message, or {@code N/A}
 */
public record CommitRecord(String sha, String date, String message) {

	public static final String NOT_AVAILABLE = "N/A";

	/**
	 * Placeholder used when a contributor has no commits within the cap.
	 */
	public static final CommitRecord UNAVAILABLE = new CommitRecord(NOT_AVAILABLE, NOT_AVAILABLE, NOT_AVAILABLE);

	/**
	 * Build a record from raw API values, applying the standard normalization.
	 * @param sha full commit SHA
	 * @param rawDate ISO-8601 author date
	 * @param rawMessage raw commit message
	 * @return the normalized record
	 */
	public static CommitRecord of(String sha, String rawDate, String rawMessage) {
		return new CommitRecord(CommitNormalizer.shortSha(sha), CommitNormalizer.formatDate(rawDate),
				CommitNormalizer.cleanMessage(rawMessage));
	}

	public boolean isAvailable() {
		return !NOT_AVAILABLE.equals(sha);
	}

}
