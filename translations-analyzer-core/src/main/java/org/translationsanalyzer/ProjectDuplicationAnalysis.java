package org.translationsanalyzer;

import java.util.List;

/**
 * Outcome of analyzing one target project against the shared content index.
 *
 * @param projectPath the target project
 * @param entriesAnalyzed number of entries the project defines
 * @param records one record per duplicated entry, ordered by file path then key
 */
public record ProjectDuplicationAnalysis(String projectPath, int entriesAnalyzed, List<DuplicationRecord> records) {

	public boolean hasDuplications() {
		return !records.isEmpty();
	}

}
