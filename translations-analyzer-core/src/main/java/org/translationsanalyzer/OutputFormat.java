package org.translationsanalyzer;

/**
 * Report output formats.
 */
public enum OutputFormat {

	TEXT, JSON

}
