package org.translationsanalyzer;

import java.util.List;
import java.util.Set;

/**
 * Detailed view of one duplicated text of the analyzed project.
 *
 * @param translationValue the duplicated text
 * @param occurrencesCount number of entries in the corpus carrying this text
 * @param duplicationTypes every category the text was found in
 * @param interPackage inter-package count summed over the project's entries with this text
 * @param commonTranslation common translation count summed over the same entries
 * @param externalProjects external projects count summed over the same entries
 * @param locations every entry carrying the text, sorted by file path then key
 */
public record DuplicatedTranslation(String translationValue, int occurrencesCount,
		Set<DuplicationType> duplicationTypes, int interPackage, int commonTranslation, int externalProjects,
		List<DuplicationLocation> locations) {
}
