package org.springaicommunity.github.harvester;

import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVPrinter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedWriter;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

/**
 * Writes rows as a UTF-8 CSV file with a header line in {@link ResultRow#COLUMNS} order.
 */
public class CsvDatasetSink implements DatasetSink {

	private static final Logger logger = LoggerFactory.getLogger(CsvDatasetSink.class);

	private final CSVFormat format;

	public CsvDatasetSink() {
		this.format = CSVFormat.DEFAULT.builder().setHeader(ResultRow.COLUMNS.toArray(new String[0])).build();
	}

	@Override
	public void write(List<ResultRow> rows, Path destination) throws IOException {
		Path parent = destination.toAbsolutePath().getParent();
		if (parent != null) {
			Files.createDirectories(parent);
		}

		if (rows.isEmpty()) {
			logger.warn("No data to save, writing header only to {}", destination);
		}

		try (BufferedWriter writer = Files.newBufferedWriter(destination, StandardCharsets.UTF_8);
				CSVPrinter printer = new CSVPrinter(writer, format)) {
			for (ResultRow row : rows) {
				printer.printRecord(row.values());
			}
		}

		long withCommits = rows.stream().filter(ResultRow::hasCommit).count();
		logger.info("Data saved to {}", destination);
		logger.info("Total records: {}", rows.size());
		logger.info("Records with commit information: {}", withCommits);
		logger.info("Records without commit information: {}", rows.size() - withCommits);
	}

}
