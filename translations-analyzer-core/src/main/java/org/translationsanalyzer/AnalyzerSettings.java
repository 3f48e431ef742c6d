package org.translationsanalyzer;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

/**
 * Configuration of a translations analysis.
 *
 * <p>
 * Properties can be set directly via setters or read from a {@code settings.json} file with
 * {@link SettingsLoader}. Defaults target a monorepo laid out as
 * {@code packages/manager/apps/*} and {@code packages/manager/modules/*} with French
 * {@code Messages_fr_FR.json} files.
 */
public class AnalyzerSettings {

	/**
	 * Project paths of the modules whose translations are meant to be shared.
	 */
	private List<String> commonTranslationsModulesPath = new ArrayList<>(
			List.of("packages/manager/modules/common-translations"));

	/**
	 * Regular expression matched against file names to select translation files.
	 */
	private String translationFileRegex = "^Messages_fr_FR\\.json$";

	/**
	 * Directory names never descended into.
	 */
	private List<String> skipDirectories = new ArrayList<>(List.of(".git", "node_modules", "target", ".idea",
			".vscode", "dist", "build", "manager-tools"));

	/**
	 * Directory names marking a project boundary: a project is {@code <marker>/<name>}.
	 */
	private List<String> projectMarkers = new ArrayList<>(List.of("apps", "modules"));

	/**
	 * Number of workers loading translation files.
	 */
	private int loaderThreads = Runtime.getRuntime().availableProcessors();

	/**
	 * Behavior when a translation file cannot be loaded.
	 */
	private LoadFailurePolicy loadFailurePolicy = LoadFailurePolicy.SKIP;

	public List<String> getCommonTranslationsModulesPath() {
		return commonTranslationsModulesPath;
	}

	public void setCommonTranslationsModulesPath(List<String> commonTranslationsModulesPath) {
		this.commonTranslationsModulesPath = commonTranslationsModulesPath;
	}

	public String getTranslationFileRegex() {
		return translationFileRegex;
	}

	public void setTranslationFileRegex(String translationFileRegex) {
		this.translationFileRegex = translationFileRegex;
	}

	public List<String> getSkipDirectories() {
		return skipDirectories;
	}

	public void setSkipDirectories(List<String> skipDirectories) {
		this.skipDirectories = skipDirectories;
	}

	public List<String> getProjectMarkers() {
		return projectMarkers;
	}

	public void setProjectMarkers(List<String> projectMarkers) {
		this.projectMarkers = projectMarkers;
	}

	public int getLoaderThreads() {
		return loaderThreads;
	}

	public void setLoaderThreads(int loaderThreads) {
		this.loaderThreads = loaderThreads;
	}

	public LoadFailurePolicy getLoadFailurePolicy() {
		return loadFailurePolicy;
	}

	public void setLoadFailurePolicy(LoadFailurePolicy loadFailurePolicy) {
		this.loadFailurePolicy = loadFailurePolicy;
	}

	/**
	 * Check the settings before any analysis runs.
	 * @throws IllegalArgumentException listing every invalid property
	 */
	public void validate() {
		List<String> errors = new ArrayList<>();

		if (translationFileRegex == null || translationFileRegex.isEmpty()) {
			errors.add("Translation file regex cannot be empty");
		}
		else {
			try {
				Pattern.compile(translationFileRegex);
			}
			catch (PatternSyntaxException e) {
				errors.add("Invalid translation file regex '" + translationFileRegex + "': " + e.getDescription());
			}
		}

		if (commonTranslationsModulesPath == null) {
			errors.add("Common translations modules path cannot be null");
		}
		else if (commonTranslationsModulesPath.stream().anyMatch(p -> p == null || p.isBlank())) {
			errors.add("Common translations modules path entries cannot be blank");
		}

		if (skipDirectories == null) {
			errors.add("Skip directories cannot be null");
		}

		if (projectMarkers == null || projectMarkers.isEmpty()) {
			errors.add("At least one project marker is required");
		}
		else if (projectMarkers.stream().anyMatch(m -> m == null || m.isBlank() || m.contains("/"))) {
			errors.add("Project markers must be single, non-blank directory names");
		}

		if (loaderThreads < 1) {
			errors.add("Loader threads must be positive (got: " + loaderThreads + ")");
		}

		if (loadFailurePolicy == null) {
			errors.add("Load failure policy cannot be null");
		}

		if (!errors.isEmpty()) {
			StringBuilder errorMsg = new StringBuilder("Settings validation failed:");
			for (String error : errors) {
				errorMsg.append("\n  - ").append(error);
			}
			throw new IllegalArgumentException(errorMsg.toString());
		}
	}

	@Override
	public String toString() {
		return "AnalyzerSettings{" + "commonTranslationsModulesPath=" + commonTranslationsModulesPath
				+ ", translationFileRegex='" + translationFileRegex + '\'' + ", skipDirectories=" + skipDirectories
				+ ", projectMarkers=" + projectMarkers + ", loaderThreads=" + loaderThreads + ", loadFailurePolicy="
				+ loadFailurePolicy + '}';
	}

}
