package org.translationsanalyzer;

/**
 * A translation file left out of the corpus.
 *
 * @param filePath the file that failed to load
 * @param reason why it failed
 */
public record LoadFailure(String filePath, String reason) {
}
