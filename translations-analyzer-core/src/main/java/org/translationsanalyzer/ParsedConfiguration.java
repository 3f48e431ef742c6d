package org.translationsanalyzer;

import org.jspecify.annotations.Nullable;

/**
 * Parsed configuration result from command-line arguments.
 */
public class ParsedConfiguration {

	// Command: global-report or detailed-report
	@Nullable
	public String command;

	// Monorepo root and settings file
	public String rootPath;

	public String configFilePath;

	// Target project, null = every project (global-report only)
	@Nullable
	public String packagePath = null;

	// Output
	public OutputFormat format = OutputFormat.TEXT;

	public boolean verbose = false;

	public boolean helpRequested = false;

	public ParsedConfiguration(String defaultRootPath, String defaultConfigFilePath) {
		this.command = null;
		this.rootPath = defaultRootPath;
		this.configFilePath = defaultConfigFilePath;
	}

	public boolean isDetailed() {
		return ArgumentParser.DETAILED_REPORT.equals(command);
	}

	@Override
	public String toString() {
		return "ParsedConfiguration{" + "command='" + command + '\'' + ", rootPath='" + rootPath + '\''
				+ ", configFilePath='" + configFilePath + '\'' + ", packagePath='" + packagePath + '\'' + ", format="
				+ format + ", verbose=" + verbose + ", helpRequested=" + helpRequested + '}';
	}

}
