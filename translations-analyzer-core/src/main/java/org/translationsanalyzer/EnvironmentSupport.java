package org.translationsanalyzer;

import io.github.cdimascio.dotenv.Dotenv;
import org.jspecify.annotations.Nullable;

/**
 * Resolves environment variables from the system environment, falling back to a
 * {@code .env} file in the working directory. The {@code .env} file is loaded once and
 * cached for the lifetime of the process.
 *
 * <p>
 * Recognized variables:
 * <ul>
 * <li>{@value #ROOT_PATH_VARIABLE}: default monorepo root</li>
 * <li>{@value #CONFIG_FILE_VARIABLE}: default settings file</li>
 * </ul>
 */
public final class EnvironmentSupport {

	public static final String ROOT_PATH_VARIABLE = "TRANSLATIONS_ANALYZER_ROOT";

	public static final String CONFIG_FILE_VARIABLE = "TRANSLATIONS_ANALYZER_CONFIG";

	private static final Dotenv CWD_DOTENV = Dotenv.configure().ignoreIfMissing().ignoreIfMalformed().load();

	private EnvironmentSupport() {
	}

	/**
	 * Get an environment variable value.
	 * @param name the variable name
	 * @return the value, or {@code null} if not found
	 */
	@Nullable
	public static String get(String name) {
		return CWD_DOTENV.get(name);
	}

	/**
	 * Get an environment variable value, or {@code defaultValue} when unset or blank.
	 */
	public static String getOrDefault(String name, String defaultValue) {
		String value = get(name);
		return value == null || value.isBlank() ? defaultValue : value;
	}

}
