package org.translationsanalyzer;

import java.util.stream.Collectors;

/**
 * Renders reports as plain text for the console.
 *
 * <p>
 * Rendering only reads the report records, so identical reports always render to identical
 * text.
 */
public class ReportRenderer {

	static final String OWN_PROJECT_MARKER = "**";

	public String renderSummary(DuplicationSummary summary) {
		StringBuilder out = new StringBuilder();
		out.append("Global duplication report :\n");
		out.append("Inter-package duplication : ").append(summary.interPackageDuplication()).append('\n');
		out.append("Common-translation duplication : ").append(summary.commonTranslationDuplication()).append('\n');
		out.append("External-projects duplication : ").append(summary.externalProjectsDuplication()).append('\n');
		out.append("Total duplication : ").append(summary.totalDuplication()).append('\n');
		return out.toString();
	}

	public String render(GlobalReport report) {
		return "Found " + report.filesFound() + " files\n" + "Analyse project : " + report.packagePath() + "\n"
				+ renderSummary(report.summary());
	}

	public String render(GlobalReportAll report) {
		StringBuilder out = new StringBuilder();
		out.append("Found ").append(report.filesFound()).append(" files\n");
		for (ProjectReport project : report.projects()) {
			out.append("Analyse project : ").append(project.packagePath()).append('\n');
			out.append(renderSummary(project.summary()));
		}
		return out.toString();
	}

	public String render(DetailedReport report) {
		StringBuilder out = new StringBuilder();
		out.append("Found ").append(report.filesFound()).append(" files\n");
		out.append("Analyse project : ").append(report.packagePath()).append('\n');
		out.append(renderSummary(report.globalReport().summary()));

		for (DuplicatedTranslation duplication : report.duplications()) {
			String types = duplication.duplicationTypes()
				.stream()
				.map(DuplicationType::label)
				.collect(Collectors.joining(", "));
			out.append('\n');
			out.append(" ========= Duplication seen : ")
				.append(duplication.occurrencesCount())
				.append(" times, type : ")
				.append(types)
				.append(" ==========\n");
			out.append(" ========= ").append(duplication.translationValue()).append(" ==========\n");
			for (DuplicationLocation location : duplication.locations()) {
				out.append(location.ownProject() ? OWN_PROJECT_MARKER : "")
					.append(' ')
					.append(location.filePath())
					.append(" - ")
					.append(location.key())
					.append('\n');
			}
		}
		return out.toString();
	}

}
