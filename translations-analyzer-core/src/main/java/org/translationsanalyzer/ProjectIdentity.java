package org.translationsanalyzer;

/**
 * The project owning a translation file.
 *
 * @param projectPath path prefix identifying the project, e.g.
 * {@code packages/manager/apps/zimbra}
 * @param packageType whether the project lives under an apps or a modules marker
 */
public record ProjectIdentity(String projectPath, PackageType packageType) {
}
