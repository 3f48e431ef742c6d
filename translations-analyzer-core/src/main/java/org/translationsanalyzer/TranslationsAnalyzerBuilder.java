package org.translationsanalyzer;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.jspecify.annotations.Nullable;

/**
 * Builder for creating a {@link TranslationsAnalyzer}.
 *
 * <p>
 * Example usage:
 * </p>
 *
 * <pre>
 * {@code
 * // Defaults
 * TranslationsAnalyzer analyzer = TranslationsAnalyzerBuilder.create().build();
 *
 * // With custom configuration
 * AnalyzerSettings settings = new AnalyzerSettings();
 * settings.setTranslationFileRegex("^Messages_en_GB\\.json$");
 *
 * TranslationsAnalyzer analyzer = TranslationsAnalyzerBuilder.create()
 *     .settings(settings)
 *     .build();
 *
 * GlobalReport report = analyzer.globalReportForProject(Path.of("."), "packages/manager/apps/zimbra");
 *
 * // For testing with a stubbed loader
 * TranslationLoader loader = mock(TranslationLoader.class);
 * TranslationsAnalyzer testAnalyzer = TranslationsAnalyzerBuilder.create()
 *     .translationLoader(loader)
 *     .build();
 * }
 * </pre>
 */
public class TranslationsAnalyzerBuilder {

	private AnalyzerSettings settings;

	@Nullable
	private ObjectMapper objectMapper;

	@Nullable
	private TranslationFileSearch fileSearch;

	@Nullable
	private TranslationLoader translationLoader;

	private TranslationsAnalyzerBuilder() {
		this.settings = new AnalyzerSettings();
	}

	/**
	 * Create a new builder instance.
	 * @return new TranslationsAnalyzerBuilder
	 */
	public static TranslationsAnalyzerBuilder create() {
		return new TranslationsAnalyzerBuilder();
	}

	/**
	 * Set analyzer settings.
	 * @param settings configuration (null to use defaults)
	 * @return this builder
	 */
	public TranslationsAnalyzerBuilder settings(@Nullable AnalyzerSettings settings) {
		if (settings != null) {
			this.settings = settings;
		}
		return this;
	}

	/**
	 * Set a custom ObjectMapper used by the default JSON loader.
	 * @param objectMapper Jackson ObjectMapper (null to use default)
	 * @return this builder
	 */
	public TranslationsAnalyzerBuilder objectMapper(@Nullable ObjectMapper objectMapper) {
		this.objectMapper = objectMapper;
		return this;
	}

	/**
	 * Set a custom file search. When set, the regex and skip directories of the settings
	 * are not used.
	 * @param fileSearch custom TranslationFileSearch (null to use default)
	 * @return this builder
	 */
	public TranslationsAnalyzerBuilder fileSearch(@Nullable TranslationFileSearch fileSearch) {
		this.fileSearch = fileSearch;
		return this;
	}

	/**
	 * Set a custom translation loader.
	 * @param translationLoader custom TranslationLoader (null to use default)
	 * @return this builder
	 */
	public TranslationsAnalyzerBuilder translationLoader(@Nullable TranslationLoader translationLoader) {
		this.translationLoader = translationLoader;
		return this;
	}

	/**
	 * Build the analyzer.
	 * @return configured TranslationsAnalyzer
	 * @throws IllegalArgumentException if the settings are invalid
	 */
	public TranslationsAnalyzer build() {
		settings.validate();

		ObjectMapper mapper = this.objectMapper != null ? this.objectMapper : ObjectMapperFactory.create();
		TranslationFileSearch search = this.fileSearch != null ? this.fileSearch
				: new FileSystemTranslationFileSearch(settings.getTranslationFileRegex(),
						settings.getSkipDirectories());
		TranslationLoader loader = this.translationLoader != null ? this.translationLoader
				: new JsonTranslationLoader(mapper);

		ProjectClassifier classifier = new ProjectClassifier(settings.getProjectMarkers());
		TranslationCorpusLoader corpusLoader = new TranslationCorpusLoader(loader, classifier,
				settings.getLoaderThreads(), settings.getLoadFailurePolicy());
		DuplicationAnalyzer duplicationAnalyzer = new DuplicationAnalyzer(
				settings.getCommonTranslationsModulesPath());

		return new TranslationsAnalyzer(search, corpusLoader, duplicationAnalyzer, new ReportAssembler());
	}

}
