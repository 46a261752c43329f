package org.springaicommunity.github.harvester;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Function;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Service for GitHub REST API operations.
 *
 * <p>
 * Converts GitHub API JSON responses to strongly-typed records at the service boundary.
 * Listings go through the {@link Paginator}; page sizes and courtesy delays come from
 * {@link HarvestProperties}.
 */
public class GitHubRestService implements RestService {

	private static final Logger logger = LoggerFactory.getLogger(GitHubRestService.class);

	static final Pattern LAST_PAGE_PATTERN = Pattern.compile("page=(\\d+)>; rel=\"last\"");

	private final GitHubClient httpClient;

	private final ObjectMapper objectMapper;

	private final Paginator paginator;

	private final HarvestProperties properties;

	public GitHubRestService(GitHubClient httpClient, ObjectMapper objectMapper, Paginator paginator,
			HarvestProperties properties) {
		this.httpClient = httpClient;
		this.objectMapper = objectMapper;
		this.paginator = paginator;
		this.properties = properties;
	}

	@Override
	public List<Repository> searchRepositories(String query, int perPage, int maxItems,
			Function<Repository, @Nullable Repository> acceptor) {
		Map<String, String> params = new LinkedHashMap<>();
		params.put("q", query);
		params.put("sort", "stars");
		params.put("order", "desc");

		PageQuery pageQuery = PageQuery.search("/search/repositories", params, perPage,
				Duration.ofMillis(properties.getSearchPageDelayMs()));
		return paginator.collect(pageQuery, maxItems, node -> {
			Repository candidate = parseRepository(node);
			return candidate != null ? acceptor.apply(candidate) : null;
		});
	}

	@Override
	public int getCommitCount(String owner, String repo) {
		ApiResponse response = httpClient.get("/repos/" + owner + "/" + repo + "/commits", Map.of("per_page", "1"),
				LimitClass.CORE);
		if (!response.isSuccess()) {
			return 0;
		}

		Integer lastPage = parseLastPage(response.link());
		if (lastPage != null) {
			return lastPage;
		}

		try {
			JsonNode commits = objectMapper.readTree(response.body());
			return commits.isArray() ? commits.size() : 0;
		}
		catch (Exception e) {
			logger.warn("Failed to parse commits of {}/{}: {}", owner, repo, e.getMessage());
			return 0;
		}
	}

	@Override
	public List<Contributor> getContributors(String owner, String repo, int maxContributors, int minContributions) {
		Map<String, String> params = new LinkedHashMap<>();
		params.put("anon", "0");

		PageQuery query = PageQuery.list("/repos/" + owner + "/" + repo + "/contributors", params,
				properties.getContributorsPerPage(), Duration.ofMillis(properties.getContributorPageDelayMs()));
		List<Contributor> contributors = paginator.collect(query, maxContributors, node -> {
			Contributor contributor = parseContributor(node);
			return contributor != null && contributor.contributions() >= minContributions ? contributor : null;
		});

		logger.info("Contributors after filtering for {}/{}: {} (minimum {} commits)", owner, repo,
				contributors.size(), minContributions);
		return contributors;
	}

	@Override
	public List<CommitRecord> getCommitsByAuthor(String owner, String repo, String author, int maxCommits) {
		Map<String, String> params = new LinkedHashMap<>();
		params.put("author", author);

		PageQuery query = PageQuery.list("/repos/" + owner + "/" + repo + "/commits", params,
				properties.getCommitsPerPage(), Duration.ofMillis(properties.getCommitPageDelayMs()));
		return paginator.collect(query, maxCommits, this::parseCommit);
	}

	@Override
	public UserProfile getUser(String login) {
		ApiResponse response = httpClient.get("/users/" + login, Map.of(), LimitClass.CORE);
		if (!response.isSuccess()) {
			return new UserProfile(login, UserProfile.UNKNOWN_LOCATION);
		}
		try {
			JsonNode node = objectMapper.readTree(response.body());
			return new UserProfile(node.path("login").asText(login), textOrNull(node.path("location")));
		}
		catch (Exception e) {
			logger.warn("Failed to parse user {}: {}", login, e.getMessage());
			return new UserProfile(login, UserProfile.UNKNOWN_LOCATION);
		}
	}

	// ========== JSON Parsing Methods ==========

	static @Nullable Integer parseLastPage(@Nullable String linkHeader) {
		if (linkHeader == null || linkHeader.isEmpty()) {
			return null;
		}
		Matcher matcher = LAST_PAGE_PATTERN.matcher(linkHeader);
		return matcher.find() ? Integer.valueOf(matcher.group(1)) : null;
	}

	@Nullable Repository parseRepository(JsonNode node) {
		if (node == null || node.isMissingNode() || node.isNull() || !node.isObject()) {
			return null;
		}

		try {
			String name = node.path("name").asText("");
			String ownerLogin = node.path("owner").path("login").asText("");
			String fullName = node.path("full_name").asText(ownerLogin + "/" + name);

			List<String> topics = new ArrayList<>();
			for (JsonNode topic : node.path("topics")) {
				topics.add(topic.asText());
			}

			return new Repository(node.path("id").asLong(), name, fullName, ownerLogin, parseOrganization(node),
					textOrNull(node.path("language")), textOrNull(node.path("description")), topics,
					node.path("stargazers_count").asInt(0), -1, null);
		}
		catch (Exception e) {
			logger.warn("Failed to parse repository: {}", e.getMessage());
			return null;
		}
	}

	private @Nullable String parseOrganization(JsonNode node) {
		JsonNode organization = node.path("organization");
		if (organization.isObject()) {
			return textOrNull(organization.path("login"));
		}
		return textOrNull(organization);
	}

	@Nullable Contributor parseContributor(JsonNode node) {
		String login = textOrNull(node.path("login"));
		if (login == null) {
			return null;
		}
		return new Contributor(login, node.path("contributions").asInt(0));
	}

	@Nullable CommitRecord parseCommit(JsonNode node) {
		JsonNode commit = node.path("commit");
		if (!commit.isObject()) {
			return null;
		}
		return CommitRecord.of(node.path("sha").asText(""), commit.path("author").path("date").asText(""),
				commit.path("message").asText(""));
	}

	private static @Nullable String textOrNull(JsonNode node) {
		if (node.isMissingNode() || node.isNull()) {
			return null;
		}
		String text = node.asText();
		return text.isEmpty() ? null : text;
	}

}
