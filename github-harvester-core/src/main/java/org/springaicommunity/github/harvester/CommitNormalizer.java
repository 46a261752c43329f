package org.springaicommunity.github.harvester;

import org.jspecify.annotations.Nullable;

import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.regex.Pattern;

/**
 * Normalization of raw commit fields before they are written to the dataset.
 */
public final class CommitNormalizer {

	static final int MAX_MESSAGE_LENGTH = 200;

	static final int SHORT_SHA_LENGTH = 8;

	private static final String ELLIPSIS = "...";

	private static final Pattern WHITESPACE = Pattern.compile("\\s+");

	private static final DateTimeFormatter OUTPUT_FORMAT = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss");

	private CommitNormalizer() {
	}

	/**
	 * Collapse all whitespace runs to a single space and truncate to 200 characters, the
	 * last three being an ellipsis when truncated.
	 * @param message raw commit message
	 * @return cleaned message, or {@code N/A} if empty
	 */
	public static String cleanMessage(@Nullable String message) {
		if (message == null || message.isEmpty()) {
			return CommitRecord.NOT_AVAILABLE;
		}
		String cleaned = WHITESPACE.matcher(message.strip()).replaceAll(" ");
		if (cleaned.length() > MAX_MESSAGE_LENGTH) {
			cleaned = cleaned.substring(0, MAX_MESSAGE_LENGTH - ELLIPSIS.length()) + ELLIPSIS;
		}
		return cleaned;
	}

	/**
	 * Format an ISO-8601 timestamp as {@code yyyy-MM-dd HH:mm:ss} in its own offset.
	 * Unparseable input is returned unchanged.
	 * @param date raw timestamp
	 * @return formatted timestamp, or {@code N/A} if empty
	 */
	public static String formatDate(@Nullable String date) {
		if (date == null || date.isEmpty()) {
			return CommitRecord.NOT_AVAILABLE;
		}
		try {
			return OffsetDateTime.parse(date).format(OUTPUT_FORMAT);
		}
		catch (DateTimeParseException e) {
			try {
				return LocalDateTime.parse(date).format(OUTPUT_FORMAT);
			}
			catch (DateTimeParseException ignored) {
				return date;
			}
		}
	}

	public static String shortSha(@Nullable String sha) {
		if (sha == null) {
			return "";
		}
		return sha.length() > SHORT_SHA_LENGTH ? sha.substring(0, SHORT_SHA_LENGTH) : sha;
	}

}
