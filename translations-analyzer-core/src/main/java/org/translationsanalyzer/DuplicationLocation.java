package org.translationsanalyzer;

/**
 * One place where a duplicated text is defined.
 *
 * @param filePath repo-relative translation file path
 * @param key translation key
 * @param ownProject whether the file belongs to the analyzed project
 */
public record DuplicationLocation(String filePath, String key, boolean ownProject) {
}
