package org.springaicommunity.github.harvester;

import org.jspecify.annotations.Nullable;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Describes a paginated listing for the {@link Paginator}.
 *
 * @param path API path of the listing
 * @param parameters query parameters sent with every page (page and per_page are added)
 * @param limitClass quota bucket the requests are charged against
 * @param perPage page size requested from the API
 * @param itemsField name of the array field holding the items when the response is an
 * object (search endpoints), or null when the response body is the array itself
 * @param courtesyDelay fixed pause between page requests
 */
public record PageQuery(String path, Map<String, String> parameters, LimitClass limitClass, int perPage,
		@Nullable String itemsField, Duration courtesyDelay) {

	public PageQuery {
		if (perPage <= 0) {
			throw new IllegalArgumentException("perPage must be positive: " + perPage);
		}
		parameters = new LinkedHashMap<>(parameters);
	}

	/**
	 * A listing whose response body is a JSON array, charged to the core limit.
	 */
	public static PageQuery list(String path, Map<String, String> parameters, int perPage, Duration courtesyDelay) {
		return new PageQuery(path, parameters, LimitClass.CORE, perPage, null, courtesyDelay);
	}

	/**
	 * A search listing whose items sit under {@code "items"}, charged to the search
	 * limit.
	 */
	public static PageQuery search(String path, Map<String, String> parameters, int perPage, Duration courtesyDelay) {
		return new PageQuery(path, parameters, LimitClass.SEARCH, perPage, "items", courtesyDelay);
	}

	Map<String, String> forPage(int page) {
		Map<String, String> params = new LinkedHashMap<>(parameters);
		params.put("page", String.valueOf(page));
		params.put("per_page", String.valueOf(perPage));
		return params;
	}

}
