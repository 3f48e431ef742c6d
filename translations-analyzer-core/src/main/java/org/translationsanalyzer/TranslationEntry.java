package org.translationsanalyzer;

import org.jspecify.annotations.Nullable;

import java.util.Comparator;

/**
 * One key/value pair loaded from a translation file.
 *
 * <p>
 * Entries are created through {@link ProjectClassifier#entry(String, String, String)} so that
 * the owning project is derived once, at load time. An entry whose path carries no project
 * marker has a {@code null} project: it still takes part in the content index but is never
 * the subject of a project-scoped analysis.
 *
 * @param filePath repo-relative path of the source file, using forward slashes
 * @param key translation key, unique within its file
 * @param value translated text, possibly empty
 * @param project owning project, or {@code null} when the path is unclassifiable
 */
public record TranslationEntry(String filePath, String key, String value, @Nullable ProjectIdentity project) {

	/**
	 * Ordering used everywhere entries are emitted: file path, then key.
	 */
	public static final Comparator<TranslationEntry> BY_LOCATION = Comparator.comparing(TranslationEntry::filePath)
		.thenComparing(TranslationEntry::key);

	public boolean isClassified() {
		return project != null;
	}

	@Nullable
	public String projectPath() {
		return project != null ? project.projectPath() : null;
	}

	/**
	 * Whether this entry and {@code other} come from the same file and key.
	 */
	public boolean sameLocationAs(TranslationEntry other) {
		return filePath.equals(other.filePath) && key.equals(other.key);
	}

	public boolean belongsTo(String targetProject) {
		return targetProject.equals(projectPath());
	}

}
