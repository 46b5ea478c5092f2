package org.springaicommunity.github.reporter;

import io.github.cdimascio.dotenv.Dotenv;
import org.jspecify.annotations.Nullable;

/**
 * Resolves environment variables by checking a {@code .env} file first, then falling back
 * to the system environment. The {@code .env} file is loaded once and cached for the
 * lifetime of the process.
 *
 * <p>
 * Lookup order:
 * <ol>
 * <li>{@code .env} file in the current working directory (if present)</li>
 * <li>System environment variable ({@link System#getenv})</li>
 * <li>{@code .env} file in the user's home directory (if present)</li>
 * </ol>
 */
public final class EnvironmentSupport {

	/** API token used for every GitHub call. */
	public static final String TOKEN = "DANGER_GITHUB_API_TOKEN";

	/** GitHub Enterprise API base URL. */
	public static final String API_BASE_URL = "DANGER_GITHUB_API_BASE_URL";

	/** Older name of {@link #API_BASE_URL}, still honoured. */
	public static final String LEGACY_API_HOST = "DANGER_GITHUB_API_HOST";

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
	public static @Nullable String get(String name) {
		String value = CWD_DOTENV.get(name);
		if (value == null) {
			value = HOME_DOTENV.get(name);
		}
		return value;
	}

	/**
	 * Get the first non-blank value among several variable names.
	 * @param names variable names in order of preference
	 * @return the value, or {@code null} if none is set
	 */
	public static @Nullable String firstOf(String... names) {
		for (String name : names) {
			String value = get(name);
			if (value != null && !value.isBlank()) {
				return value;
			}
		}
		return null;
	}

}
