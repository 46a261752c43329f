package org.springaicommunity.github.harvester;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;
import java.util.stream.IntStream;

import static org.assertj.core.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

/**
 * Tests for GitHubRestService with a mocked GitHubClient. No real GitHub API calls.
 */
@DisplayName("GitHubRestService Tests")
@ExtendWith(MockitoExtension.class)
class GitHubRestServiceTest {

	@Mock
	private GitHubClient mockHttpClient;

	private GitHubRestService restService;

	@BeforeEach
	void setUp() {
		HarvestProperties properties = new HarvestProperties();
		Paginator paginator = new Paginator(mockHttpClient, ObjectMapperFactory.create(), ms -> {
		});
		restService = new GitHubRestService(mockHttpClient, ObjectMapperFactory.create(), paginator, properties);
	}

	private static ApiResponse ok(String body) {
		return new ApiResponse(200, body, null, null);
	}

	private static String contributors(int... contributions) {
		return IntStream.range(0, contributions.length)
			.mapToObj(i -> "{\"login\":\"user" + i + "\",\"contributions\":" + contributions[i] + "}")
			.collect(Collectors.joining(",", "[", "]"));
	}

	@Nested
	@DisplayName("Commit Count Tests")
	class CommitCountTest {

		@Test
		@DisplayName("Should read the commit count from the last-page link")
		void shouldReadLastPageLink() {
			String link = "<https://api.github.com/repositories/1/commits?per_page=1&page=2>; rel=\"next\", "
					+ "<https://api.github.com/repositories/1/commits?per_page=1&page=34567>; rel=\"last\"";
			when(mockHttpClient.get("/repos/owner/repo/commits", Map.of("per_page", "1"), LimitClass.CORE))
				.thenReturn(new ApiResponse(200, "[{\"sha\":\"abc\"}]", null, link));

			assertThat(restService.getCommitCount("owner", "repo")).isEqualTo(34567);
		}

		@Test
		@DisplayName("Should fall back to the returned page size without a link")
		void shouldFallBackToPageSize() {
			when(mockHttpClient.get("/repos/owner/repo/commits", Map.of("per_page", "1"), LimitClass.CORE))
				.thenReturn(ok("[{\"sha\":\"abc\"}]"));

			assertThat(restService.getCommitCount("owner", "repo")).isEqualTo(1);
		}

		@Test
		@DisplayName("Should count zero for an inaccessible repository")
		void shouldCountZeroOnError() {
			when(mockHttpClient.get("/repos/owner/repo/commits", Map.of("per_page", "1"), LimitClass.CORE))
				.thenReturn(new ApiResponse(409, "{\"message\":\"Git Repository is empty.\"}", null, null));

			assertThat(restService.getCommitCount("owner", "repo")).isZero();
		}

		@Test
		@DisplayName("Should parse last page only from a rel=last link")
		void shouldParseLastPage() {
			assertThat(GitHubRestService.parseLastPage(null)).isNull();
			assertThat(GitHubRestService.parseLastPage("")).isNull();
			assertThat(GitHubRestService.parseLastPage("<https://x/commits?page=2>; rel=\"next\"")).isNull();
			assertThat(GitHubRestService.parseLastPage("<https://x/commits?page=7>; rel=\"last\"")).isEqualTo(7);
		}

	}

	@Nested
	@DisplayName("Contributor Tests")
	class ContributorTest {

		@Test
		@DisplayName("Should keep only contributors meeting the minimum")
		void shouldFilterByMinimum() {
			when(mockHttpClient.get(eq("/repos/owner/repo/contributors"), anyMap(), eq(LimitClass.CORE)))
				.thenReturn(ok(contributors(500, 300, 150, 100, 99, 40)));

			List<Contributor> result = restService.getContributors("owner", "repo", 50, 100);

			assertThat(result).extracting(Contributor::contributions).containsExactly(500, 300, 150, 100);
			assertThat(result).allMatch(c -> c.contributions() >= 100);
		}

		@Test
		@DisplayName("Should cap a large listing at the maximum")
		void shouldCapAtMaximum() {
			int[] many = IntStream.range(0, 100).map(i -> 10_000 - i).toArray();
			when(mockHttpClient.get(eq("/repos/owner/repo/contributors"), anyMap(), eq(LimitClass.CORE)))
				.thenReturn(ok(contributors(many)));

			List<Contributor> result = restService.getContributors("owner", "repo", 50, 100);

			assertThat(result).hasSize(50);
			assertThat(result.get(0).login()).isEqualTo("user0");
			verify(mockHttpClient, times(1)).get(eq("/repos/owner/repo/contributors"), anyMap(), eq(LimitClass.CORE));
		}

		@Test
		@DisplayName("Should exclude anonymous contributors")
		@SuppressWarnings("unchecked")
		void shouldExcludeAnonymous() {
			when(mockHttpClient.get(eq("/repos/owner/repo/contributors"), anyMap(), eq(LimitClass.CORE)))
				.thenReturn(ok("[]"));
			ArgumentCaptor<Map<String, String>> captor = ArgumentCaptor.forClass(Map.class);

			restService.getContributors("owner", "repo", 50, 100);

			verify(mockHttpClient).get(eq("/repos/owner/repo/contributors"), captor.capture(), eq(LimitClass.CORE));
			assertThat(captor.getValue()).containsEntry("anon", "0").containsEntry("per_page", "100");
		}

	}

	@Nested
	@DisplayName("Commit Tests")
	class CommitTest {

		@Test
		@DisplayName("Should fetch normalized commits filtered by author")
		@SuppressWarnings("unchecked")
		void shouldFetchCommitsByAuthor() {
			String body = """
					[
					  {
					    "sha": "6dcb09b5b57875f334f61aebed695e2e4193db5e",
					    "commit": {
					      "author": {"name": "Octo Cat", "date": "2024-01-15T10:30:00Z"},
					      "message": "Fix all the bugs\\n\\nCloses #42"
					    }
					  },
					  {"sha": "broken"}
					]
					""";
			when(mockHttpClient.get(eq("/repos/owner/repo/commits"), anyMap(), eq(LimitClass.CORE)))
				.thenReturn(ok(body));
			ArgumentCaptor<Map<String, String>> captor = ArgumentCaptor.forClass(Map.class);

			List<CommitRecord> commits = restService.getCommitsByAuthor("owner", "repo", "octocat", 1000);

			assertThat(commits).containsExactly(new CommitRecord("6dcb09b5", "2024-01-15 10:30:00", "Fix all the bugs Closes #42"));
			verify(mockHttpClient).get(eq("/repos/owner/repo/commits"), captor.capture(), eq(LimitClass.CORE));
			assertThat(captor.getValue()).containsEntry("author", "octocat").containsEntry("per_page", "10");
		}

	}

	@Nested
	@DisplayName("User Tests")
	class UserTest {

		@Test
		@DisplayName("Should read the user's location")
		void shouldReadLocation() {
			when(mockHttpClient.get("/users/octocat", Map.of(), LimitClass.CORE))
				.thenReturn(ok("{\"login\":\"octocat\",\"location\":\"San Francisco\"}"));

			UserProfile profile = restService.getUser("octocat");

			assertThat(profile.location()).isEqualTo("San Francisco");
			assertThat(profile.hasLocation()).isTrue();
		}

		@Test
		@DisplayName("Should report a missing location")
		void shouldReportMissingLocation() {
			when(mockHttpClient.get("/users/octocat", Map.of(), LimitClass.CORE))
				.thenReturn(ok("{\"login\":\"octocat\",\"location\":null}"));

			assertThat(restService.getUser("octocat").hasLocation()).isFalse();
		}

		@Test
		@DisplayName("Should fall back to Unknown when the lookup fails")
		void shouldFallBackToUnknown() {
			when(mockHttpClient.get("/users/ghost", Map.of(), LimitClass.CORE))
				.thenReturn(new ApiResponse(404, "{\"message\":\"Not Found\"}", null, null));

			assertThat(restService.getUser("ghost").location()).isEqualTo(UserProfile.UNKNOWN_LOCATION);
		}

	}

	@Nested
	@DisplayName("Search Tests")
	class SearchTest {

		@Test
		@DisplayName("Should parse search results and apply the acceptor")
		void shouldParseAndAccept() {
			String body = """
					{
					  "total_count": 2,
					  "items": [
					    {
					      "id": 1,
					      "name": "spring-boot",
					      "full_name": "spring-projects/spring-boot",
					      "owner": {"login": "spring-projects"},
					      "organization": {"login": "spring-projects"},
					      "language": "Java",
					      "description": "Spring Boot",
					      "topics": ["java", "spring"],
					      "stargazers_count": 75000
					    },
					    {
					      "id": 2,
					      "name": "notes",
					      "full_name": "someone/notes",
					      "owner": {"login": "someone"},
					      "language": null,
					      "stargazers_count": 1200
					    }
					  ]
					}
					""";
			when(mockHttpClient.get(eq("/search/repositories"), anyMap(), eq(LimitClass.SEARCH)))
				.thenReturn(ok(body));

			List<Repository> result = restService.searchRepositories("stars:>1000", 50, 10,
					repository -> repository.language() != null ? repository : null);

			assertThat(result).hasSize(1);
			Repository repository = result.get(0);
			assertThat(repository.fullName()).isEqualTo("spring-projects/spring-boot");
			assertThat(repository.ownerLogin()).isEqualTo("spring-projects");
			assertThat(repository.organization()).isEqualTo("spring-projects");
			assertThat(repository.topics()).containsExactly("java", "spring");
			assertThat(repository.stars()).isEqualTo(75000);
			assertThat(repository.commitCount()).isEqualTo(-1);
		}

		@Test
		@DisplayName("Should send the query sorted by stars descending")
		@SuppressWarnings("unchecked")
		void shouldSendSortedQuery() {
			when(mockHttpClient.get(eq("/search/repositories"), anyMap(), eq(LimitClass.SEARCH)))
				.thenReturn(ok("{\"items\":[]}"));
			ArgumentCaptor<Map<String, String>> captor = ArgumentCaptor.forClass(Map.class);

			restService.searchRepositories("stars:>1000", 30, 10, repository -> repository);

			verify(mockHttpClient).get(eq("/search/repositories"), captor.capture(), eq(LimitClass.SEARCH));
			assertThat(captor.getValue()).containsEntry("q", "stars:>1000")
				.containsEntry("sort", "stars")
				.containsEntry("order", "desc")
				.containsEntry("per_page", "30");
		}

	}

}
