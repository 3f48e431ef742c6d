package org.translationsanalyzer.cli;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.translationsanalyzer.*;

import java.io.PrintStream;
import java.nio.file.Path;
import java.nio.file.Paths;

/**
 * Translations Analyzer CLI Application
 *
 * Plain Java command-line application reporting duplicated translations of a monorepo.
 * Uses TranslationsAnalyzerBuilder for service wiring.
 *
 * Usage: java -jar translations-analyzer-cli.jar COMMAND [OPTIONS]
 *
 * Environment Variables: TRANSLATIONS_ANALYZER_ROOT - default monorepo root,
 * TRANSLATIONS_ANALYZER_CONFIG - default settings file
 *
 * Examples: java -jar translations-analyzer-cli.jar global-report --root-path ~/manager
 * java -jar translations-analyzer-cli.jar detailed-report --package-path
 * packages/manager/apps/zimbra java -jar translations-analyzer-cli.jar global-report
 * --format json
 */
public class TranslationsAnalyzerCli {

	private static final Logger logger = LoggerFactory.getLogger(TranslationsAnalyzerCli.class);

	public static void main(String[] args) {
		int exitCode = run(args, System.out);
		if (exitCode != 0) {
			System.exit(exitCode);
		}
	}

	/**
	 * Run the analyzer.
	 * @param args command-line arguments
	 * @param out where reports are printed
	 * @return process exit code: 0 on success, 1 on invalid arguments or failure
	 */
	public static int run(String[] args, PrintStream out) {
		ArgumentParser argumentParser = new ArgumentParser();

		// Check for help request first
		if (argumentParser.isHelpRequested(args)) {
			out.println(argumentParser.generateHelpText());
			return 0;
		}

		ParsedConfiguration config;
		try {
			config = argumentParser.parseAndValidate(args);
		}
		catch (IllegalArgumentException e) {
			logger.error("{}", e.getMessage());
			logger.error("Try --help for usage");
			return 1;
		}

		try {
			return analyze(config, out);
		}
		catch (Exception e) {
			logger.error("Analysis failed: {}", e.getMessage());
			if (config.verbose) {
				logger.error("Stack trace:", e);
			}
			return 1;
		}
	}

	private static int analyze(ParsedConfiguration config, PrintStream out) throws Exception {
		Path rootPath = Paths.get(config.rootPath);
		logger.info("Root path : {}", rootPath.toAbsolutePath().normalize());

		ObjectMapper objectMapper = ObjectMapperFactory.create();
		AnalyzerSettings settings = new SettingsLoader(objectMapper).load(Paths.get(config.configFilePath));

		if (config.verbose) {
			logConfiguration(config, settings);
		}

		TranslationsAnalyzer analyzer = TranslationsAnalyzerBuilder.create()
			.settings(settings)
			.objectMapper(objectMapper)
			.build();

		ReportRenderer renderer = new ReportRenderer();
		Object report;
		String text;
		if (config.isDetailed()) {
			DetailedReport detailed = analyzer.detailedReportForProject(rootPath, config.packagePath);
			report = detailed;
			text = renderer.render(detailed);
		}
		else if (config.packagePath != null) {
			GlobalReport global = analyzer.globalReportForProject(rootPath, config.packagePath);
			report = global;
			text = renderer.render(global);
		}
		else {
			GlobalReportAll all = analyzer.globalReportAll(rootPath);
			report = all;
			text = renderer.render(all);
		}

		if (config.format == OutputFormat.JSON) {
			out.println(objectMapper.writerWithDefaultPrettyPrinter().writeValueAsString(report));
		}
		else {
			out.print(text);
		}
		return 0;
	}

	private static void logConfiguration(ParsedConfiguration config, AnalyzerSettings settings) {
		logger.info("Configuration:");
		logger.info("  Command: {}", config.command);
		logger.info("  Root path: {}", config.rootPath);
		logger.info("  Config file: {}", config.configFilePath);
		logger.info("  Package path: {}", config.packagePath != null ? config.packagePath : "(all projects)");
		logger.info("  Format: {}", config.format);
		logger.info("  Translation file regex: {}", settings.getTranslationFileRegex());
		logger.info("  Skip directories: {}", settings.getSkipDirectories());
		logger.info("  Common translations modules: {}", settings.getCommonTranslationsModulesPath());
		logger.info("  Project markers: {}", settings.getProjectMarkers());
		logger.info("  Loader threads: {}", settings.getLoaderThreads());
		logger.info("  Load failure policy: {}", settings.getLoadFailurePolicy());
	}

}
