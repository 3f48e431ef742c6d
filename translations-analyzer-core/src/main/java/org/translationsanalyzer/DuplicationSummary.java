package org.translationsanalyzer;

/**
 * Duplication counts of one project, summed over its duplication records.
 *
 * @param interPackageDuplication duplicates found inside the project itself
 * @param commonTranslationDuplication duplicates found in common translations modules
 * @param externalProjectsDuplication duplicates found in unrelated projects
 * @param totalDuplication sum of the three counts
 */
public record DuplicationSummary(int interPackageDuplication, int commonTranslationDuplication,
		int externalProjectsDuplication, int totalDuplication) {

	public static DuplicationSummary empty() {
		return new DuplicationSummary(0, 0, 0, 0);
	}

	public static DuplicationSummary of(int interPackage, int commonTranslation, int externalProjects) {
		return new DuplicationSummary(interPackage, commonTranslation, externalProjects,
				interPackage + commonTranslation + externalProjects);
	}

}
