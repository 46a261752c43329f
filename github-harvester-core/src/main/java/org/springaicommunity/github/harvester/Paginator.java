package org.springaicommunity.github.harvester;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.function.Function;

/**
 * Follows page numbers of a GitHub listing until enough items are accepted or the listing
 * runs out.
 *
 * <p>
 * Items are mapped one at a time in upstream order. The mapper returns {@code null} to
 * reject an item; once {@code maxItems} items are accepted no further item is mapped and
 * no further page is requested. A page shorter than the page size, an empty page, a
 * non-200 response or a body without the expected array all end the listing.
 */
public class Paginator {

	private static final Logger logger = LoggerFactory.getLogger(Paginator.class);

	private final GitHubClient client;

	private final ObjectMapper objectMapper;

	private final Sleeper sleeper;

	public Paginator(GitHubClient client, ObjectMapper objectMapper, Sleeper sleeper) {
		this.client = client;
		this.objectMapper = objectMapper;
		this.sleeper = sleeper;
	}

	/**
	 * Collect up to {@code maxItems} accepted items from a paginated listing.
	 * @param query the listing to page through
	 * @param maxItems maximum number of accepted items to return
	 * @param mapper converts a JSON item, returning null to reject it
	 * @param <T> the item type
	 * @return accepted items in upstream order, never more than {@code maxItems}
	 */
	public <T> List<T> collect(PageQuery query, int maxItems, Function<JsonNode, @Nullable T> mapper) {
		List<T> results = new ArrayList<>();
		int page = 1;

		while (results.size() < maxItems) {
			ApiResponse response = client.get(query.path(), query.forPage(page), query.limitClass());
			if (!response.isSuccess()) {
				logger.debug("Stopping pagination of {} at page {}: status {}", query.path(), page,
						response.statusCode());
				break;
			}

			JsonNode items = readItems(response, query);
			if (items == null || items.isEmpty()) {
				break;
			}

			for (JsonNode item : items) {
				T mapped = mapper.apply(item);
				if (mapped != null) {
					results.add(mapped);
					if (results.size() >= maxItems) {
						break;
					}
				}
			}

			if (items.size() < query.perPage()) {
				break;
			}

			page++;
			if (results.size() < maxItems) {
				pause(query);
			}
		}

		logger.debug("Collected {} items from {} ({} pages)", results.size(), query.path(), page);
		return results;
	}

	private @Nullable JsonNode readItems(ApiResponse response, PageQuery query) {
		try {
			JsonNode root = objectMapper.readTree(response.body());
			JsonNode items = query.itemsField() != null ? root.path(query.itemsField()) : root;
			if (!items.isArray()) {
				logger.warn("Unexpected response shape for {}: no item array", query.path());
				return null;
			}
			return items;
		}
		catch (Exception e) {
			logger.warn("Failed to parse page of {}: {}", query.path(), e.getMessage());
			return null;
		}
	}

	private void pause(PageQuery query) {
		long delayMs = query.courtesyDelay().toMillis();
		if (delayMs <= 0) {
			return;
		}
		try {
			sleeper.sleep(delayMs);
		}
		catch (InterruptedException e) {
			Thread.currentThread().interrupt();
			throw new GitHubHttpClient.GitHubApiException("Pagination interrupted", e);
		}
	}

}
