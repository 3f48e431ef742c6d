package org.translationsanalyzer;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;

/**
 * Locates translation files below a monorepo root.
 *
 * <p>
 * Abstracts file system traversal to enable testability.
 */
public interface TranslationFileSearch {

	/**
	 * Find every translation file below {@code root}.
	 * @param root monorepo root directory
	 * @return matching files, sorted
	 * @throws IOException if the root cannot be read
	 */
	List<Path> search(Path root) throws IOException;

}
