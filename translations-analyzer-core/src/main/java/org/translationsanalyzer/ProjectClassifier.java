package org.translationsanalyzer;

import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Derives the owning project of a translation file from its path.
 *
 * <p>
 * The project path is the prefix of the file path up to and including the first
 * {@code <marker>/<name>} pair, for instance {@code packages/manager/apps/zimbra} for
 * {@code packages/manager/apps/zimbra/src/translations/Messages_fr_FR.json}. The
 * transformation is a pure string operation: no file system access is made.
 */
public class ProjectClassifier {

	private final List<String> markers;

	private final Pattern projectPattern;

	public ProjectClassifier(Collection<String> markers) {
		if (markers.isEmpty()) {
			throw new IllegalArgumentException("At least one project marker is required");
		}
		this.markers = List.copyOf(markers);
		String alternatives = this.markers.stream().map(Pattern::quote).collect(Collectors.joining("|"));
		// the project name must be followed by at least one more segment (the file itself)
		this.projectPattern = Pattern.compile("^((?:.*?/)?(" + alternatives + ")/[^/]+)/");
	}

	public static ProjectClassifier withDefaultMarkers() {
		return new ProjectClassifier(List.of("apps", "modules"));
	}

	public List<String> getMarkers() {
		return markers;
	}

	/**
	 * Classify a file path.
	 * @param filePath repo-relative or absolute file path
	 * @return the owning project, or empty when no marker segment is present
	 */
	public Optional<ProjectIdentity> classify(String filePath) {
		Matcher matcher = projectPattern.matcher(normalize(filePath));
		if (!matcher.find()) {
			return Optional.empty();
		}
		return Optional.of(new ProjectIdentity(matcher.group(1), PackageType.fromMarker(matcher.group(2))));
	}

	/**
	 * Create a translation entry with its derived project.
	 */
	public TranslationEntry entry(String filePath, String key, String value) {
		String normalized = normalize(filePath);
		return new TranslationEntry(normalized, key, value, classify(normalized).orElse(null));
	}

	/**
	 * Whether {@code projectPath} is, or lies below, one of the common translation paths.
	 * @param projectPath a classified project path
	 * @param commonPaths configured common-translations module paths
	 * @return true if the project is a common translations module
	 */
	public static boolean isCommonTranslations(String projectPath, Collection<String> commonPaths) {
		for (String commonPath : commonPaths) {
			String common = stripTrailingSlash(normalize(commonPath));
			if (common.isEmpty()) {
				continue;
			}
			if (projectPath.equals(common) || projectPath.startsWith(common + "/")) {
				return true;
			}
		}
		return false;
	}

	static String normalize(String path) {
		return path.replace('\\', '/');
	}

	private static String stripTrailingSlash(String path) {
		String result = path;
		while (result.endsWith("/")) {
			result = result.substring(0, result.length() - 1);
		}
		return result;
	}

}
