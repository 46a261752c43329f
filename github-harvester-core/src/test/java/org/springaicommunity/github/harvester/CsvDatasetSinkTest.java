package org.springaicommunity.github.harvester;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.assertj.core.api.Assertions.*;

@DisplayName("CsvDatasetSink Tests")
class CsvDatasetSinkTest {

	private static final String HEADER = "repo_id,repo_name,repo_type,stars,contributor_login,contributor_location,"
			+ "contributions,commit_sha,commit_date,commit_message";

	@TempDir
	Path tempDir;

	private final CsvDatasetSink sink = new CsvDatasetSink();

	private final WorkItem item = new WorkItem(TestRepositories.accepted(42, "owner", "repo"),
			new Contributor("alice", 321));

	@Test
	@DisplayName("Should write a header and one record per row")
	void shouldWriteRows() throws IOException {
		Path output = tempDir.resolve("data.csv");
		List<ResultRow> rows = List.of(
				ResultRow.of(item, "Berlin", new CommitRecord("abcdef12", "2024-01-15 10:30:00", "Fix parser")),
				ResultRow.of(item, "Berlin", CommitRecord.UNAVAILABLE));

		sink.write(rows, output);

		List<String> lines = Files.readAllLines(output, StandardCharsets.UTF_8);
		assertThat(lines).containsExactly(HEADER,
				"42,owner/repo,open_source,1042,alice,Berlin,321,abcdef12,2024-01-15 10:30:00,Fix parser",
				"42,owner/repo,open_source,1042,alice,Berlin,321,N/A,N/A,N/A");
	}

	@Test
	@DisplayName("Should quote values containing commas and quotes")
	void shouldQuoteSpecialCharacters() throws IOException {
		Path output = tempDir.resolve("quoted.csv");
		ResultRow row = ResultRow.of(item, "San Francisco, CA",
				new CommitRecord("abcdef12", "2024-01-15 10:30:00", "Say \"hello\""));

		sink.write(List.of(row), output);

		assertThat(Files.readAllLines(output, StandardCharsets.UTF_8)).last()
			.isEqualTo("42,owner/repo,open_source,1042,alice,\"San Francisco, CA\",321,abcdef12,2024-01-15 10:30:00,"
					+ "\"Say \"\"hello\"\"\"");
	}

	@Test
	@DisplayName("Should write a header-only file for no rows")
	void shouldWriteHeaderOnly() throws IOException {
		Path output = tempDir.resolve("empty.csv");

		sink.write(List.of(), output);

		assertThat(Files.readAllLines(output, StandardCharsets.UTF_8)).containsExactly(HEADER);
	}

	@Test
	@DisplayName("Should create missing parent directories")
	void shouldCreateParentDirectories() throws IOException {
		Path output = tempDir.resolve("nested/dir/data.csv");

		sink.write(List.of(ResultRow.of(item, "Berlin", CommitRecord.UNAVAILABLE)), output);

		assertThat(output).exists();
	}

	@Test
	@DisplayName("Should keep non-ASCII text intact")
	void shouldWriteUtf8() throws IOException {
		Path output = tempDir.resolve("utf8.csv");

		sink.write(List.of(ResultRow.of(item, "München", CommitRecord.UNAVAILABLE)), output);

		assertThat(Files.readString(output, StandardCharsets.UTF_8)).contains("München");
	}

}
