package org.translationsanalyzer;

import java.util.List;

/**
 * Summary plus the list of duplicated texts of a single project.
 *
 * @param filesFound number of translation files discovered in the monorepo
 * @param packagePath the analyzed project
 * @param globalReport summary of the project, files found included
 * @param duplications duplicated texts, most frequent first
 */
public record DetailedReport(int filesFound, String packagePath, GlobalReport globalReport,
		List<DuplicatedTranslation> duplications) {
}
