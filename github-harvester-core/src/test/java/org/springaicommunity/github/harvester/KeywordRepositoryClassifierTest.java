package org.springaicommunity.github.harvester;

import org.jspecify.annotations.Nullable;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.List;

import static org.assertj.core.api.Assertions.*;

@DisplayName("KeywordRepositoryClassifier Tests")
class KeywordRepositoryClassifierTest {

	private final KeywordRepositoryClassifier classifier = new KeywordRepositoryClassifier();

	private static Repository repo(String owner, String name, @Nullable String organization, @Nullable String language,
			@Nullable String description, List<String> topics) {
		return new Repository(1L, name, owner + "/" + name, owner, organization, language, description, topics, 50_000,
				-1, null);
	}

	@Nested
	@DisplayName("Technical Filter Tests")
	class TechnicalFilterTest {

		@Test
		@DisplayName("Should accept a code repository with a programming language")
		void shouldAcceptCodeRepository() {
			Repository repository = repo("spring-projects", "spring-boot", null, "Java",
					"Spring Boot helps you to create Spring-powered, production-grade applications and services",
					List.of());

			assertThat(classifier.isTechnical(repository)).isTrue();
		}

		@ParameterizedTest
		@ValueSource(strings = { "Markdown", "HTML", "" })
		@DisplayName("Should reject repositories without a programming language")
		void shouldRejectNonProgrammingLanguages(String language) {
			Repository repository = repo("owner", "docs", null, language, "Project site", List.of());

			assertThat(classifier.isTechnical(repository)).isFalse();
		}

		@Test
		@DisplayName("Should reject repositories with no language at all")
		void shouldRejectMissingLanguage() {
			assertThat(classifier.isTechnical(repo("owner", "stuff", null, null, null, List.of()))).isFalse();
		}

		@Test
		@DisplayName("Should reject content collections with two or more keyword hits")
		void shouldRejectContentCollections() {
			Repository repository = repo("EbookFoundation", "free-programming-books", null, "Python",
					"Freely available programming books", List.of());

			assertThat(classifier.isTechnical(repository)).isFalse();
		}

		@Test
		@DisplayName("Should accept a single keyword hit")
		void shouldAcceptSingleKeywordHit() {
			Repository repository = repo("owner", "server", null, "Go", "A guide-friendly HTTP router", List.of());

			assertThat(classifier.isTechnical(repository)).isTrue();
		}

		@Test
		@DisplayName("Should reject known non-technical repository names")
		void shouldRejectKnownNames() {
			Repository repository = repo("trekhleb", "javascript-algorithms", null, "JavaScript",
					"Algorithms and data structures implemented in JavaScript", List.of());

			assertThat(classifier.isTechnical(repository)).isFalse();
		}

	}

	@Nested
	@DisplayName("Classification Tests")
	class ClassificationTest {

		@Test
		@DisplayName("Should classify well-known company owners as corporate")
		void shouldClassifyCorporateOwner() {
			Repository repository = repo("Microsoft", "vscode", null, "TypeScript", "Visual Studio Code", List.of());

			assertThat(classifier.classify(repository)).isEqualTo(RepositoryType.CORPORATE);
		}

		@Test
		@DisplayName("Should classify organization-owned repositories as corporate")
		void shouldClassifyOrganizationOwned() {
			Repository repository = repo("spring-projects", "spring-framework", "spring-projects", "Java",
					"Spring Framework", List.of());

			assertThat(classifier.classify(repository)).isEqualTo(RepositoryType.CORPORATE);
		}

		@Test
		@DisplayName("Should classify course material as educational")
		void shouldClassifyEducationalText() {
			Repository repository = repo("someone", "cs101", null, "Python", "University course labs and homework",
					List.of());

			assertThat(classifier.classify(repository)).isEqualTo(RepositoryType.EDUCATIONAL);
		}

		@Test
		@DisplayName("Should classify by educational topic")
		void shouldClassifyEducationalTopic() {
			Repository repository = repo("someone", "algos", null, "Python", "Algorithms in Python",
					List.of("Education", "python"));

			assertThat(classifier.classify(repository)).isEqualTo(RepositoryType.EDUCATIONAL);
		}

		@Test
		@DisplayName("Should default to open source")
		void shouldDefaultToOpenSource() {
			Repository repository = repo("tokio-rs", "tokio", null, "Rust",
					"A runtime for writing reliable asynchronous applications with Rust", List.of("async", "rust"));

			assertThat(classifier.classify(repository)).isEqualTo(RepositoryType.OPEN_SOURCE);
		}

	}

}
