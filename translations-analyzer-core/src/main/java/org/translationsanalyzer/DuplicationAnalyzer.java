package org.translationsanalyzer;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;

/**
 * Classifies the duplicated texts of a target project.
 *
 * <p>
 * For every entry of the project, the group of entries sharing its text is looked up in the
 * {@link ContentIndex}. Each other member of the group is counted once, in the first
 * matching category: member of the target project (inter-package), member of a common
 * translations module, or anything else (external). Members with the same file and key as
 * the analyzed entry are skipped.
 *
 * <p>
 * The analyzer keeps no state between calls and performs no I/O.
 */
public class DuplicationAnalyzer {

	private final List<String> commonTranslationPaths;

	public DuplicationAnalyzer(Collection<String> commonTranslationPaths) {
		this.commonTranslationPaths = List.copyOf(commonTranslationPaths);
	}

	public List<String> getCommonTranslationPaths() {
		return commonTranslationPaths;
	}

	/**
	 * Analyze the entries of one project.
	 * @param targetProject project path under analysis
	 * @param projectEntries the project's own entries
	 * @param index content index of the whole corpus
	 * @return the analysis; empty when the project has no duplicated text
	 */
	public ProjectDuplicationAnalysis analyze(String targetProject, Collection<TranslationEntry> projectEntries,
			ContentIndex index) {
		List<TranslationEntry> ordered = projectEntries.stream().sorted(TranslationEntry.BY_LOCATION).toList();
		List<DuplicationRecord> records = new ArrayList<>();

		for (TranslationEntry entry : ordered) {
			List<TranslationEntry> group = index.group(entry.value());
			if (group.size() <= 1) {
				continue;
			}

			int interPackage = 0;
			int commonTranslation = 0;
			int externalProjects = 0;
			for (TranslationEntry member : group) {
				if (member.sameLocationAs(entry)) {
					continue;
				}
				if (member.belongsTo(targetProject)) {
					interPackage++;
				}
				else if (isCommonTranslation(member)) {
					commonTranslation++;
				}
				else {
					externalProjects++;
				}
			}

			if (interPackage + commonTranslation + externalProjects == 0) {
				continue;
			}
			records.add(new DuplicationRecord(entry, group.size(), interPackage, commonTranslation, externalProjects));
		}

		return new ProjectDuplicationAnalysis(targetProject, ordered.size(), List.copyOf(records));
	}

	private boolean isCommonTranslation(TranslationEntry member) {
		String projectPath = member.projectPath();
		return projectPath != null && ProjectClassifier.isCommonTranslations(projectPath, commonTranslationPaths);
	}

}
