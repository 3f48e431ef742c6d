package org.translationsanalyzer;

import java.nio.file.Path;
import java.util.List;

/**
 * Every translation entry loaded from a monorepo, merged into one immutable collection.
 *
 * @param root monorepo root the file paths are relative to
 * @param filesFound number of translation files discovered
 * @param entries loaded entries
 * @param failures files that failed to load and were skipped
 */
public record TranslationCorpus(Path root, int filesFound, List<TranslationEntry> entries,
		List<LoadFailure> failures) {

	public TranslationCorpus {
		entries = List.copyOf(entries);
		failures = List.copyOf(failures);
	}

}
