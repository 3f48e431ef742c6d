package org.translationsanalyzer;

import com.fasterxml.jackson.annotation.JsonUnwrapped;

/**
 * Duplication summary of a single project.
 *
 * @param filesFound number of translation files discovered in the monorepo
 * @param packagePath the analyzed project
 * @param summary duplication counts
 */
public record GlobalReport(int filesFound, String packagePath, @JsonUnwrapped DuplicationSummary summary) {
}
