package org.translationsanalyzer;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Where a duplicated translation recurs, seen from a target project.
 */
public enum DuplicationType {

	/**
	 * Another key inside the target project carries the same text.
	 */
	INTER_PACKAGE("InterPackage"),

	/**
	 * The text is already available in a common translations module.
	 */
	COMMON_TRANSLATION("CommonTranslation"),

	/**
	 * The text also appears in an unrelated project.
	 */
	EXTERNAL_PROJECTS("ExternalProjects");

	private final String label;

	DuplicationType(String label) {
		this.label = label;
	}

	@JsonValue
	public String label() {
		return label;
	}

	@Override
	public String toString() {
		return label;
	}

}
