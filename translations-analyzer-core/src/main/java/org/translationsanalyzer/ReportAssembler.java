package org.translationsanalyzer;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Turns duplication records into summary and detailed reports.
 *
 * <p>
 * Detailed output is ordered by occurrence count (descending) then by text, and locations
 * by file path then key, so two runs over the same corpus produce identical reports.
 */
public class ReportAssembler {

	static final Comparator<DuplicatedTranslation> DETAIL_ORDER = Comparator
		.comparingInt(DuplicatedTranslation::occurrencesCount)
		.reversed()
		.thenComparing(DuplicatedTranslation::translationValue);

	public DuplicationSummary summarize(List<DuplicationRecord> records) {
		int inter = 0;
		int common = 0;
		int external = 0;
		for (DuplicationRecord record : records) {
			inter += record.interPackage();
			common += record.commonTranslation();
			external += record.externalProjects();
		}
		return DuplicationSummary.of(inter, common, external);
	}

	/**
	 * One detailed line per distinct duplicated text.
	 * @param analysis analysis of the target project
	 * @param index the content index the analysis ran against
	 * @return detailed duplications, most frequent first
	 */
	public List<DuplicatedTranslation> detail(ProjectDuplicationAnalysis analysis, ContentIndex index) {
		Map<String, List<DuplicationRecord>> byValue = new LinkedHashMap<>();
		for (DuplicationRecord record : analysis.records()) {
			byValue.computeIfAbsent(record.value(), k -> new ArrayList<>()).add(record);
		}

		List<DuplicatedTranslation> details = new ArrayList<>(byValue.size());
		for (Map.Entry<String, List<DuplicationRecord>> value : byValue.entrySet()) {
			Set<DuplicationType> types = EnumSet.noneOf(DuplicationType.class);
			int inter = 0;
			int common = 0;
			int external = 0;
			for (DuplicationRecord record : value.getValue()) {
				types.addAll(record.types());
				inter += record.interPackage();
				common += record.commonTranslation();
				external += record.externalProjects();
			}

			List<DuplicationLocation> locations = index.group(value.getKey())
				.stream()
				.map(member -> new DuplicationLocation(member.filePath(), member.key(),
						member.belongsTo(analysis.projectPath())))
				.toList();

			details.add(new DuplicatedTranslation(value.getKey(), locations.size(),
					Collections.unmodifiableSet(types), inter, common, external, locations));
		}

		details.sort(DETAIL_ORDER);
		return List.copyOf(details);
	}

	public GlobalReport globalReport(int filesFound, ProjectDuplicationAnalysis analysis) {
		return new GlobalReport(filesFound, analysis.projectPath(), summarize(analysis.records()));
	}

	public DetailedReport detailedReport(int filesFound, ProjectDuplicationAnalysis analysis, ContentIndex index) {
		return new DetailedReport(filesFound, analysis.projectPath(), globalReport(filesFound, analysis),
				detail(analysis, index));
	}

	public ProjectReport projectReport(int filesFound, ProjectDuplicationAnalysis analysis) {
		return new ProjectReport(analysis.projectPath(), filesFound, summarize(analysis.records()));
	}

}
