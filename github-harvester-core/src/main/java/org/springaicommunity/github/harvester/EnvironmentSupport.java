package org.springaicommunity.github.harvester;

import io.github.cdimascio.dotenv.Dotenv;
import org.jspecify.annotations.Nullable;

import java.util.List;

/**
 * Resolves environment variables from {@code .env} files and the system environment.
 *
 * <p>
 * Lookup order:
 * <ol>
 * <li>{@code .env} file in the current working directory, then the system
 * environment</li>
 * <li>{@code .env} file in the user's home directory</li>
 * </ol>
 */
public final class EnvironmentSupport {

	/**
	 * Variables consulted for the GitHub token, in order.
	 */
	public static final List<String> TOKEN_VARIABLES = List.of("GITHUB_TOKEN", "GH_TOKEN");

	private static final Dotenv CWD_DOTENV = Dotenv.configure().ignoreIfMissing().ignoreIfMalformed().load();

	private static final Dotenv HOME_DOTENV = loadHomeDotenv();

	private static Dotenv loadHomeDotenv() {
		String home = System.getProperty("user.home");
		if (home != null) {
			return Dotenv.configure().directory(home).ignoreIfMissing().ignoreIfMalformed().load();
		}
		return CWD_DOTENV;
	}

	private EnvironmentSupport() {
	}

	/**
	 * Get an environment variable value.
	 * @param name the variable name
	 * @return the value, or {@code null} if not found
	 */
	@Nullable
	public static String get(String name) {
		String value = CWD_DOTENV.get(name);
		if (value == null) {
			value = HOME_DOTENV.get(name);
		}
		return value;
	}

	/**
	 * Resolve the GitHub token from {@code GITHUB_TOKEN}, falling back to
	 * {@code GH_TOKEN}.
	 * @return the first non-blank token, or {@code null} if none is set
	 */
	@Nullable
	public static String resolveToken() {
		for (String variable : TOKEN_VARIABLES) {
			String value = get(variable);
			if (value != null && !value.isBlank()) {
				return value.trim();
			}
		}
		return null;
	}

}
