package org.translationsanalyzer;

import com.fasterxml.jackson.annotation.JsonUnwrapped;

/**
 * Per-project line of a whole-repository report.
 *
 * @param packagePath the project
 * @param filesFound number of translation files discovered in the monorepo
 * @param summary duplication counts of the project
 */
public record ProjectReport(String packagePath, int filesFound, @JsonUnwrapped DuplicationSummary summary) {
}
