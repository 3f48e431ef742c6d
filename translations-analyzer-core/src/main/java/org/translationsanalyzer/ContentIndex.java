package org.translationsanalyzer;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Immutable index of translation entries grouped by their exact translated text.
 *
 * <p>
 * Two entries with different keys but identical text land in the same group; two entries
 * with the same key but different text do not. Every group is sorted by file path then key,
 * so the index does not depend on the order in which entries were loaded. The index is built
 * once per run and shared, read-only, by every per-project analysis.
 */
public final class ContentIndex {

	private final Map<String, List<TranslationEntry>> groups;

	private final int entryCount;

	private ContentIndex(Map<String, List<TranslationEntry>> groups, int entryCount) {
		this.groups = groups;
		this.entryCount = entryCount;
	}

	/**
	 * Group entries by value.
	 * @param entries every loaded entry, in any order
	 * @return the index
	 */
	public static ContentIndex build(Collection<TranslationEntry> entries) {
		Map<String, List<TranslationEntry>> grouping = new HashMap<>();
		for (TranslationEntry entry : entries) {
			grouping.computeIfAbsent(entry.value(), k -> new ArrayList<>()).add(entry);
		}

		Map<String, List<TranslationEntry>> sorted = new HashMap<>(grouping.size());
		for (Map.Entry<String, List<TranslationEntry>> group : grouping.entrySet()) {
			List<TranslationEntry> members = group.getValue();
			members.sort(TranslationEntry.BY_LOCATION);
			sorted.put(group.getKey(), List.copyOf(members));
		}
		return new ContentIndex(Collections.unmodifiableMap(sorted), entries.size());
	}

	/**
	 * All entries sharing {@code value}.
	 * @param value translated text
	 * @return the sorted group, or an empty list if no entry has this text
	 */
	public List<TranslationEntry> group(String value) {
		return groups.getOrDefault(value, List.of());
	}

	public int occurrences(String value) {
		return group(value).size();
	}

	public Set<String> distinctValues() {
		return groups.keySet();
	}

	/**
	 * Values carried by more than one entry, sorted.
	 */
	public List<String> duplicatedValues() {
		return groups.entrySet()
			.stream()
			.filter(e -> e.getValue().size() > 1)
			.map(Map.Entry::getKey)
			.sorted()
			.toList();
	}

	public int entryCount() {
		return entryCount;
	}

}
