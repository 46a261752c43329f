package org.springaicommunity.github.harvester;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.params.provider.ValueSource;

import static org.assertj.core.api.Assertions.*;

@DisplayName("CommitNormalizer Tests")
class CommitNormalizerTest {

	@Nested
	@DisplayName("Message Cleaning Tests")
	class MessageCleaningTest {

		@Test
		@DisplayName("Should collapse all whitespace runs to single spaces")
		void shouldCollapseWhitespace() {
			assertThat(CommitNormalizer.cleanMessage("  Fix\n\nnull   check\tin\r\nparser  "))
				.isEqualTo("Fix null check in parser");
		}

		@Test
		@DisplayName("Should truncate a 250 character message to 200 with an ellipsis")
		void shouldTruncateLongMessage() {
			String cleaned = CommitNormalizer.cleanMessage("a".repeat(250));

			assertThat(cleaned).hasSize(200).startsWith("a".repeat(197)).endsWith("...");
		}

		@Test
		@DisplayName("Should keep a message of exactly 200 characters")
		void shouldKeepExactLimit() {
			String message = "b".repeat(200);

			assertThat(CommitNormalizer.cleanMessage(message)).isEqualTo(message);
		}

		@Test
		@DisplayName("Should map missing messages to N/A")
		void shouldMapMissingToNotAvailable() {
			assertThat(CommitNormalizer.cleanMessage(null)).isEqualTo("N/A");
			assertThat(CommitNormalizer.cleanMessage("")).isEqualTo("N/A");
		}

		@ParameterizedTest
		@ValueSource(strings = { "Initial commit", "  spaced \n\n out  ", "N/A", "", "line one\nline two\n\n* bullet" })
		@DisplayName("Should be idempotent")
		void shouldBeIdempotent(String message) {
			String once = CommitNormalizer.cleanMessage(message);

			assertThat(CommitNormalizer.cleanMessage(once)).isEqualTo(once);
			assertThat(once.length()).isLessThanOrEqualTo(CommitNormalizer.MAX_MESSAGE_LENGTH);
		}

		@Test
		@DisplayName("Should be idempotent on a truncated message")
		void shouldBeIdempotentAfterTruncation() {
			String once = CommitNormalizer.cleanMessage("word ".repeat(80));

			assertThat(once).hasSize(CommitNormalizer.MAX_MESSAGE_LENGTH).endsWith("...");
			assertThat(CommitNormalizer.cleanMessage(once)).isEqualTo(once);
		}

	}

	@Nested
	@DisplayName("Date Formatting Tests")
	class DateFormattingTest {

		@ParameterizedTest
		@CsvSource({ "2024-01-15T10:30:00Z, 2024-01-15 10:30:00", "2023-12-31T23:59:59+02:00, 2023-12-31 23:59:59",
				"2024-03-01T08:05:09, 2024-03-01 08:05:09" })
		@DisplayName("Should format ISO timestamps")
		void shouldFormatIsoTimestamps(String raw, String expected) {
			assertThat(CommitNormalizer.formatDate(raw)).isEqualTo(expected);
		}

		@Test
		@DisplayName("Should return unparseable dates unchanged")
		void shouldReturnUnparseableUnchanged() {
			assertThat(CommitNormalizer.formatDate("yesterday")).isEqualTo("yesterday");
		}

		@Test
		@DisplayName("Should map missing dates to N/A")
		void shouldMapMissingDates() {
			assertThat(CommitNormalizer.formatDate(null)).isEqualTo("N/A");
			assertThat(CommitNormalizer.formatDate("")).isEqualTo("N/A");
		}

	}

	@Nested
	@DisplayName("SHA Tests")
	class ShaTest {

		@Test
		@DisplayName("Should keep the first eight characters")
		void shouldAbbreviateSha() {
			assertThat(CommitNormalizer.shortSha("6dcb09b5b57875f334f61aebed695e2e4193db5e")).isEqualTo("6dcb09b5");
		}

		@Test
		@DisplayName("Should keep short values as-is")
		void shouldKeepShortSha() {
			assertThat(CommitNormalizer.shortSha("abc")).isEqualTo("abc");
			assertThat(CommitNormalizer.shortSha(null)).isEmpty();
		}

		@Test
		@DisplayName("Should normalize all fields when building a commit record")
		void shouldBuildCommitRecord() {
			CommitRecord record = CommitRecord.of("6dcb09b5b57875f334f61aebed695e2e4193db5e", "2024-01-15T10:30:00Z",
					"Fix bug\n\nDetails here");

			assertThat(record).isEqualTo(new CommitRecord("6dcb09b5", "2024-01-15 10:30:00", "Fix bug Details here"));
			assertThat(record.isAvailable()).isTrue();
			assertThat(CommitRecord.UNAVAILABLE.isAvailable()).isFalse();
		}

	}

}
