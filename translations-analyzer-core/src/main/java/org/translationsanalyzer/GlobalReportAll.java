package org.translationsanalyzer;

import java.util.List;

/**
 * Duplication summaries of every project of the monorepo.
 *
 * @param filesFound number of translation files discovered
 * @param projects one report per discovered project, sorted by project path
 */
public record GlobalReportAll(int filesFound, List<ProjectReport> projects) {

	/**
	 * Counts summed over every project.
	 */
	public DuplicationSummary total() {
		int inter = 0;
		int common = 0;
		int external = 0;
		for (ProjectReport project : projects) {
			inter += project.summary().interPackageDuplication();
			common += project.summary().commonTranslationDuplication();
			external += project.summary().externalProjectsDuplication();
		}
		return DuplicationSummary.of(inter, common, external);
	}

}
