package org.springaicommunity.github.harvester;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;

/**
 * Persists harvested rows.
 */
public interface DatasetSink {

	/**
	 * Write all rows to the destination, replacing any existing content.
	 * @param rows rows to write, possibly empty
	 * @param destination target file
	 * @throws IOException if the destination cannot be written
	 */
	void write(List<ResultRow> rows, Path destination) throws IOException;

}
