package org.translationsanalyzer;

/**
 * What to do when a translation file fails to load.
 */
public enum LoadFailurePolicy {

	/**
	 * Log a warning, leave the file out of the corpus and keep going.
	 */
	SKIP,

	/**
	 * Abort the whole run.
	 */
	FAIL

}
