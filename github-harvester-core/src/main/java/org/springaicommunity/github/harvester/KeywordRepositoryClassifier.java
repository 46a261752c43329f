package org.springaicommunity.github.harvester;

import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * {@link RepositoryClassifier} based on keyword and pattern matching over the repository
 * name, description, owner and topics.
 */
public class KeywordRepositoryClassifier implements RepositoryClassifier {

	private static final Logger logger = LoggerFactory.getLogger(KeywordRepositoryClassifier.class);

	private static final Set<String> NON_PROGRAMMING_LANGUAGES = Set.of("Markdown", "HTML");

	private static final Set<String> CORPORATE_OWNERS = Set.of("google", "microsoft", "facebook", "apple", "amazon",
			"netflix", "twitter", "linkedin", "uber", "airbnb", "spotify", "docker", "mozilla", "adobe", "oracle",
			"ibm", "intel", "nvidia", "github", "apache", "kubernetes", "elastic", "mongodb", "redis");

	private static final Set<String> EDUCATIONAL_KEYWORDS = Set.of("university", "college", "edu", "academy",
			"school", "course", "tutorial", "learning", "bootcamp", "curriculum", "assignment", "homework", "student",
			"coursera", "udemy", "udacity", "edx", "lab-", "project-", "exercise", "workshop", "training");

	private static final Set<String> EDUCATIONAL_TOPICS = Set.of("education", "learning", "tutorial", "course",
			"students", "labs");

	private static final Set<String> NON_TECH_KEYWORDS = Set.of("book", "books", "paper", "papers", "article",
			"articles", "curriculum", "syllabus", "lecture", "lectures", "notes", "resource", "resources", "list",
			"awesome", "collection", "interview", "interview-questions", "cheatsheet", "cheat-sheet", "guide",
			"tutorial", "learning", "study", "studying", "blog", "blog-posts", "writing", "documentation", "roadmap",
			"public api's");

	private static final Set<String> KNOWN_NON_TECH_NAMES = Set.of("awesome", "awesome-list", "interview", "books",
			"paper", "curriculum", "syllabus", "lecture-notes", "javascript-algorithms");

	private static final List<Pattern> NON_TECH_PATTERNS = List.of(Pattern.compile("awesome.*list"),
			Pattern.compile("curriculum"), Pattern.compile("syllabus"), Pattern.compile("lecture.*notes"),
			Pattern.compile("interview.*questions"), Pattern.compile("book.*collection"));

	/**
	 * Keyword hits needed before a repository is treated as content or course material.
	 */
	private static final int KEYWORD_THRESHOLD = 2;

	@Override
	public boolean isTechnical(Repository repository) {
		String language = repository.language();
		if (language == null || language.isEmpty() || NON_PROGRAMMING_LANGUAGES.contains(language)) {
			logger.info("Skipped: no programming language - {}", repository.fullName());
			return false;
		}

		String text = lower(repository.name()) + " " + lower(repository.description());
		if (countMatches(text, NON_TECH_KEYWORDS) >= KEYWORD_THRESHOLD) {
			logger.info("Skipped: non-technical content - {}", repository.fullName());
			return false;
		}

		if (isLikelyNonTechnical(repository)) {
			logger.info("Skipped: likely non-technical - {}", repository.fullName());
			return false;
		}

		return true;
	}

	@Override
	public RepositoryType classify(Repository repository) {
		String organization = lower(repository.organization());
		if (CORPORATE_OWNERS.contains(lower(repository.ownerLogin())) || !organization.isEmpty()) {
			return RepositoryType.CORPORATE;
		}

		String text = lower(repository.name()) + " " + lower(repository.description());
		if (countMatches(text, EDUCATIONAL_KEYWORDS) >= KEYWORD_THRESHOLD) {
			return RepositoryType.EDUCATIONAL;
		}

		boolean educationalTopic = repository.topics()
			.stream()
			.map(KeywordRepositoryClassifier::lower)
			.anyMatch(EDUCATIONAL_TOPICS::contains);
		if (educationalTopic) {
			return RepositoryType.EDUCATIONAL;
		}

		return RepositoryType.OPEN_SOURCE;
	}

	private boolean isLikelyNonTechnical(Repository repository) {
		String fullName = lower(repository.fullName());
		for (String name : KNOWN_NON_TECH_NAMES) {
			if (fullName.contains(name)) {
				return true;
			}
		}

		String text = fullName + " " + lower(repository.description());
		return NON_TECH_PATTERNS.stream().anyMatch(pattern -> pattern.matcher(text).find());
	}

	private static long countMatches(String text, Set<String> keywords) {
		return keywords.stream().filter(text::contains).count();
	}

	private static String lower(@Nullable String text) {
		return text == null ? "" : text.toLowerCase(Locale.ROOT);
	}

}
