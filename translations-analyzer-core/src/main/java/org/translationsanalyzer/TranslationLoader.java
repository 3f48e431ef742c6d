package org.translationsanalyzer;

import java.nio.file.Path;
import java.util.Map;

/**
 * Parses one translation file into its key/value pairs.
 */
public interface TranslationLoader {

	/**
	 * Load a translation file.
	 * @param path the file to read
	 * @return translations keyed by translation key, in file order
	 * @throws TranslationLoadException if the file cannot be read or parsed
	 */
	Map<String, String> load(Path path) throws TranslationLoadException;

}
