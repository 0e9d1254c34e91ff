package org.springaicommunity.oauth2.client;

import io.github.cdimascio.dotenv.Dotenv;
import org.jspecify.annotations.Nullable;

/**
 * Resolves environment variables by checking a {@code .env} file first, then falling back
 * to the system environment. The {@code .env} files are loaded once per process.
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

	public static final String CLIENT_ID = "OAUTH2_CLIENT_ID";

	public static final String CLIENT_SECRET = "OAUTH2_CLIENT_SECRET";

	public static final String AUTHORIZE_ENDPOINT = "OAUTH2_AUTHORIZE_ENDPOINT";

	public static final String TOKEN_ENDPOINT = "OAUTH2_TOKEN_ENDPOINT";

	public static final String REDIRECT_URI = "OAUTH2_REDIRECT_URI";

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
	 * Get a required environment variable value.
	 * @param name the variable name
	 * @return the non-blank value
	 * @throws IllegalStateException if the variable is missing or blank
	 */
	public static String require(String name) {
		String value = get(name);
		if (value == null || value.trim().isEmpty()) {
			throw new IllegalStateException(name + " environment variable is required.");
		}
		return value;
	}

}
