package org.translationsanalyzer;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.SortedMap;
import java.util.TreeMap;

/**
 * Entries grouped by owning project path.
 *
 * <p>
 * Unclassifiable entries never form a project; they are kept aside in
 * {@link #unclassified()}.
 */
public final class ProjectIndex {

	private final SortedMap<String, List<TranslationEntry>> projects;

	private final List<TranslationEntry> unclassified;

	private ProjectIndex(SortedMap<String, List<TranslationEntry>> projects, List<TranslationEntry> unclassified) {
		this.projects = projects;
		this.unclassified = unclassified;
	}

	public static ProjectIndex build(Collection<TranslationEntry> entries) {
		SortedMap<String, List<TranslationEntry>> grouping = new TreeMap<>();
		List<TranslationEntry> unclassified = new ArrayList<>();
		for (TranslationEntry entry : entries) {
			String projectPath = entry.projectPath();
			if (projectPath == null) {
				unclassified.add(entry);
			}
			else {
				grouping.computeIfAbsent(projectPath, k -> new ArrayList<>()).add(entry);
			}
		}

		SortedMap<String, List<TranslationEntry>> projects = new TreeMap<>();
		for (Map.Entry<String, List<TranslationEntry>> project : grouping.entrySet()) {
			List<TranslationEntry> members = project.getValue();
			members.sort(TranslationEntry.BY_LOCATION);
			projects.put(project.getKey(), List.copyOf(members));
		}
		unclassified.sort(TranslationEntry.BY_LOCATION);
		return new ProjectIndex(Collections.unmodifiableSortedMap(projects), List.copyOf(unclassified));
	}

	/**
	 * Entries whose project path equals {@code targetProject} exactly. Entries of nested
	 * sub-packages are not included.
	 * @param targetProject project path to select
	 * @param entries every loaded entry
	 * @return the project's entries sorted by file path then key
	 */
	public static List<TranslationEntry> translationsForProject(String targetProject,
			Collection<TranslationEntry> entries) {
		return entries.stream()
			.filter(entry -> entry.belongsTo(targetProject))
			.sorted(TranslationEntry.BY_LOCATION)
			.toList();
	}

	/**
	 * Project paths in lexicographic order mapped to their sorted entries.
	 */
	public SortedMap<String, List<TranslationEntry>> projects() {
		return projects;
	}

	public List<TranslationEntry> entriesOf(String projectPath) {
		return projects.getOrDefault(projectPath, List.of());
	}

	public List<TranslationEntry> unclassified() {
		return unclassified;
	}

}
