package org.translationsanalyzer;

import java.util.ArrayList;
import java.util.List;

/**
 * Command-line argument parser for the translations analyzer. Pure Java implementation for
 * maximum testability.
 */
public class ArgumentParser {

	public static final String GLOBAL_REPORT = "global-report";

	public static final String DETAILED_REPORT = "detailed-report";

	private static final List<String> COMMANDS = List.of(GLOBAL_REPORT, DETAILED_REPORT);

	private final String defaultRootPath;

	private final String defaultConfigFilePath;

	/**
	 * Parser whose defaults come from {@code TRANSLATIONS_ANALYZER_ROOT} and
	 * {@code TRANSLATIONS_ANALYZER_CONFIG}, then from the working directory and
	 * {@code settings.json}.
	 */
	public ArgumentParser() {
		this(EnvironmentSupport.getOrDefault(EnvironmentSupport.ROOT_PATH_VARIABLE, "."),
				EnvironmentSupport.getOrDefault(EnvironmentSupport.CONFIG_FILE_VARIABLE,
						SettingsLoader.DEFAULT_SETTINGS_FILE));
	}

	public ArgumentParser(String defaultRootPath, String defaultConfigFilePath) {
		this.defaultRootPath = defaultRootPath;
		this.defaultConfigFilePath = defaultConfigFilePath;
	}

	/**
	 * Parse command-line arguments and return configuration.
	 * @param args Command-line arguments
	 * @return Parsed configuration object
	 * @throws IllegalArgumentException if arguments are invalid
	 */
	public ParsedConfiguration parseAndValidate(String[] args) {
		ParsedConfiguration config = new ParsedConfiguration(defaultRootPath, defaultConfigFilePath);

		for (int i = 0; i < args.length; i++) {
			String arg = args[i];

			switch (arg) {
				case GLOBAL_REPORT, DETAILED_REPORT:
					if (config.command != null) {
						throw new IllegalArgumentException(
								"Only one command allowed, got '" + config.command + "' and '" + arg + "'");
					}
					config.command = arg;
					break;

				case "--root-path":
					config.rootPath = getRequiredValue(args, i, "root-path");
					i++; // Skip next argument since we consumed it
					break;

				case "--config-file-path":
					config.configFilePath = getRequiredValue(args, i, "config-file-path");
					i++; // Skip next argument since we consumed it
					break;

				case "-p", "--package-path":
					config.packagePath = getRequiredValue(args, i, "package-path");
					i++; // Skip next argument since we consumed it
					break;

				case "-f", "--format":
					String format = getRequiredValue(args, i, "format").toLowerCase();
					if (!List.of("text", "json").contains(format)) {
						throw new IllegalArgumentException("Invalid format '" + format + "': must be 'text' or 'json'");
					}
					config.format = OutputFormat.valueOf(format.toUpperCase());
					i++; // Skip next argument since we consumed it
					break;

				case "-v", "--verbose":
					config.verbose = true;
					break;

				case "-h", "--help":
					config.helpRequested = true;
					break;

				default:
					if (arg.startsWith("-")) {
						throw new IllegalArgumentException("Unknown option: " + arg);
					}
					throw new IllegalArgumentException("Unknown command: " + arg + " (must be '" + GLOBAL_REPORT
							+ "' or '" + DETAILED_REPORT + "')");
			}
		}

		// Validate configuration
		validateConfiguration(config);

		return config;
	}

	/**
	 * Check if help is requested without full parsing.
	 * @param args Command-line arguments
	 * @return true if help is requested
	 */
	public boolean isHelpRequested(String[] args) {
		for (String arg : args) {
			if ("-h".equals(arg) || "--help".equals(arg)) {
				return true;
			}
		}
		return false;
	}

	/**
	 * Generate help text for command-line usage.
	 * @return Help text string
	 */
	public String generateHelpText() {
		StringBuilder help = new StringBuilder();
		help.append("Usage: translations-analyzer <COMMAND> [OPTIONS]\n");
		help.append("\n");
		help.append("Detect duplicated translations across the projects of a monorepo.\n");
		help.append("\n");
		help.append("COMMANDS:\n");
		help.append("    global-report           Duplication counts for one project, or for every project\n");
		help.append("                            when --package-path is omitted\n");
		help.append("    detailed-report         Duplication counts and every duplicated text of one project\n");
		help.append("                            (requires --package-path)\n");
		help.append("\n");
		help.append("OPTIONS:\n");
		help.append("    -h, --help              Show this help message\n");
		help.append("    --root-path DIR         Monorepo root (default: ").append(defaultRootPath).append(")\n");
		help.append("    --config-file-path FILE Settings file (default: ")
			.append(defaultConfigFilePath)
			.append(", built-in defaults when missing)\n");
		help.append("    -p, --package-path PATH Project to analyze, e.g. packages/manager/apps/zimbra\n");
		help.append("    -f, --format FORMAT     Output format: text, json (default: text)\n");
		help.append("    -v, --verbose           Enable verbose logging\n");
		help.append("\n");
		help.append("CONFIGURATION:\n");
		help.append("    The settings file is JSON with the following optional properties:\n");
		help.append("      common_translations_modules_path   Shared translation module paths\n");
		help.append("      translation_file_regex             Regex matched against file names\n");
		help.append("      skip_directories                   Directory names never descended into\n");
		help.append("      project_markers                    Directory names marking projects (apps, modules)\n");
		help.append("      loader_threads                     Parallel file loaders\n");
		help.append("      load_failure_policy                SKIP or FAIL on unreadable files\n");
		help.append("\n");
		help.append("ENVIRONMENT VARIABLES:\n");
		help.append("    ").append(EnvironmentSupport.ROOT_PATH_VARIABLE).append("  Default monorepo root\n");
		help.append("    ").append(EnvironmentSupport.CONFIG_FILE_VARIABLE).append("  Default settings file\n");
		help.append("\n");
		help.append("EXAMPLES:\n");
		help.append("    translations-analyzer global-report --root-path ~/manager\n");
		help.append("    translations-analyzer global-report --package-path packages/manager/apps/zimbra\n");
		help.append("    translations-analyzer detailed-report --package-path packages/manager/apps/zimbra\n");
		help.append("    translations-analyzer global-report --format json > report.json\n");
		help.append("\n");

		return help.toString();
	}

	private String getRequiredValue(String[] args, int currentIndex, String optionName) {
		if (currentIndex + 1 >= args.length) {
			throw new IllegalArgumentException("Missing value for " + optionName + " option");
		}
		return args[currentIndex + 1];
	}

	private void validateConfiguration(ParsedConfiguration config) {
		if (config.helpRequested) {
			return;
		}

		List<String> errors = new ArrayList<>();

		if (config.command == null) {
			errors.add("A command is required: " + String.join(" or ", COMMANDS));
		}

		if (config.rootPath == null || config.rootPath.trim().isEmpty()) {
			errors.add("Root path cannot be empty");
		}

		if (config.configFilePath == null || config.configFilePath.trim().isEmpty()) {
			errors.add("Config file path cannot be empty");
		}

		if (config.packagePath != null && config.packagePath.trim().isEmpty()) {
			errors.add("Package path cannot be empty");
		}

		if (config.isDetailed() && config.packagePath == null) {
			errors.add("The detailed-report command requires --package-path");
		}

		// Report validation errors
		if (!errors.isEmpty()) {
			StringBuilder errorMsg = new StringBuilder("Configuration validation failed:");
			for (String error : errors) {
				errorMsg.append("\n  - ").append(error);
			}
			throw new IllegalArgumentException(errorMsg.toString());
		}
	}

}
