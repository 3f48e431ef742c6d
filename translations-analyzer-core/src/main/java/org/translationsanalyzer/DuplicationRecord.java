package org.translationsanalyzer;

import java.util.EnumSet;
import java.util.Set;

/**
 * Duplication status of one translation entry of the target project.
 *
 * <p>
 * The three counters are independent: a text found once in the common module and twice in
 * unrelated projects yields {@code commonTranslation = 1} and {@code externalProjects = 2}.
 * The entry itself is never counted.
 *
 * @param entry the analyzed entry of the target project
 * @param occurrencesCount number of entries in the whole corpus sharing the entry's text,
 * the entry included
 * @param interPackage other entries of the target project with the same text
 * @param commonTranslation entries of common translations modules with the same text
 * @param externalProjects entries of any other project, or of no project, with the same text
 */
public record DuplicationRecord(TranslationEntry entry, int occurrencesCount, int interPackage,
		int commonTranslation, int externalProjects) {

	public String value() {
		return entry.value();
	}

	public int duplicateCount() {
		return interPackage + commonTranslation + externalProjects;
	}

	/**
	 * Categories with a non-zero count.
	 */
	public Set<DuplicationType> types() {
		Set<DuplicationType> types = EnumSet.noneOf(DuplicationType.class);
		if (interPackage > 0) {
			types.add(DuplicationType.INTER_PACKAGE);
		}
		if (commonTranslation > 0) {
			types.add(DuplicationType.COMMON_TRANSLATION);
		}
		if (externalProjects > 0) {
			types.add(DuplicationType.EXTERNAL_PROJECTS);
		}
		return types;
	}

}
