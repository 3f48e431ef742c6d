package org.translationsanalyzer;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Entry point of an analysis: discovers translation files, loads them, builds the shared
 * content index and runs the duplication analysis for one or every project.
 *
 * <p>
 * Instances are created with {@link TranslationsAnalyzerBuilder}.
 */
public class TranslationsAnalyzer {

	private static final Logger logger = LoggerFactory.getLogger(TranslationsAnalyzer.class);

	private final TranslationFileSearch fileSearch;

	private final TranslationCorpusLoader corpusLoader;

	private final DuplicationAnalyzer duplicationAnalyzer;

	private final ReportAssembler reportAssembler;

	public TranslationsAnalyzer(TranslationFileSearch fileSearch, TranslationCorpusLoader corpusLoader,
			DuplicationAnalyzer duplicationAnalyzer, ReportAssembler reportAssembler) {
		this.fileSearch = fileSearch;
		this.corpusLoader = corpusLoader;
		this.duplicationAnalyzer = duplicationAnalyzer;
		this.reportAssembler = reportAssembler;
	}

	/**
	 * Discover and load every translation file below {@code root}.
	 * @param root monorepo root
	 * @return the loaded corpus
	 */
	public TranslationCorpus loadCorpus(Path root) throws IOException, TranslationLoadException {
		Path normalizedRoot = root.toAbsolutePath().normalize();
		List<Path> files = fileSearch.search(normalizedRoot);
		logger.info("Found {} files", files.size());
		TranslationCorpus corpus = corpusLoader.load(normalizedRoot, files);
		if (!corpus.failures().isEmpty()) {
			logger.warn("{} translation files could not be loaded", corpus.failures().size());
		}
		return corpus;
	}

	public GlobalReport globalReportForProject(Path root, String projectPath)
			throws IOException, TranslationLoadException {
		return globalReportForProject(loadCorpus(root), projectPath);
	}

	public DetailedReport detailedReportForProject(Path root, String projectPath)
			throws IOException, TranslationLoadException {
		return detailedReportForProject(loadCorpus(root), projectPath);
	}

	public GlobalReportAll globalReportAll(Path root) throws IOException, TranslationLoadException {
		return globalReportAll(loadCorpus(root));
	}

	/**
	 * Summarize the duplications of one project of an already loaded corpus.
	 */
	public GlobalReport globalReportForProject(TranslationCorpus corpus, String projectPath) {
		return globalReportForProject(corpus, ContentIndex.build(corpus.entries()), projectPath);
	}

	/**
	 * Summarize one project against a content index built once for the corpus. Use this form
	 * when reporting several projects of the same corpus.
	 * @param corpus the loaded corpus
	 * @param index content index of {@code corpus}
	 * @param projectPath project to analyze
	 * @return the project summary
	 */
	public GlobalReport globalReportForProject(TranslationCorpus corpus, ContentIndex index, String projectPath) {
		ProjectDuplicationAnalysis analysis = analyze(corpus, index, normalizeProjectPath(projectPath));
		return reportAssembler.globalReport(corpus.filesFound(), analysis);
	}

	/**
	 * List the duplications of one project of an already loaded corpus.
	 */
	public DetailedReport detailedReportForProject(TranslationCorpus corpus, String projectPath) {
		return detailedReportForProject(corpus, ContentIndex.build(corpus.entries()), projectPath);
	}

	public DetailedReport detailedReportForProject(TranslationCorpus corpus, ContentIndex index,
			String projectPath) {
		ProjectDuplicationAnalysis analysis = analyze(corpus, index, normalizeProjectPath(projectPath));
		return reportAssembler.detailedReport(corpus.filesFound(), analysis, index);
	}

	/**
	 * Summarize every project of an already loaded corpus. The content index is built once
	 * and shared by all projects.
	 */
	public GlobalReportAll globalReportAll(TranslationCorpus corpus) {
		return globalReportAll(corpus, ContentIndex.build(corpus.entries()));
	}

	public GlobalReportAll globalReportAll(TranslationCorpus corpus, ContentIndex index) {
		ProjectIndex projects = ProjectIndex.build(corpus.entries());
		if (!projects.unclassified().isEmpty()) {
			logger.debug("{} translations belong to no project", projects.unclassified().size());
		}

		List<ProjectReport> reports = new ArrayList<>(projects.projects().size());
		for (Map.Entry<String, List<TranslationEntry>> project : projects.projects().entrySet()) {
			logger.info("Analyse project : {}", project.getKey());
			ProjectDuplicationAnalysis analysis = duplicationAnalyzer.analyze(project.getKey(), project.getValue(),
					index);
			reports.add(reportAssembler.projectReport(corpus.filesFound(), analysis));
		}
		return new GlobalReportAll(corpus.filesFound(), List.copyOf(reports));
	}

	private ProjectDuplicationAnalysis analyze(TranslationCorpus corpus, ContentIndex index, String projectPath) {
		logger.info("Analyse project : {}", projectPath);
		List<TranslationEntry> projectEntries = ProjectIndex.translationsForProject(projectPath, corpus.entries());
		if (projectEntries.isEmpty()) {
			logger.warn("No translations found for project {}", projectPath);
		}
		return duplicationAnalyzer.analyze(projectPath, projectEntries, index);
	}

	static String normalizeProjectPath(String projectPath) {
		String normalized = projectPath.trim().replace('\\', '/');
		while (normalized.endsWith("/")) {
			normalized = normalized.substring(0, normalized.length() - 1);
		}
		return normalized;
	}

}
