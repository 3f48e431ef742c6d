package org.translationsanalyzer;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.assertj.core.api.Assertions.*;

@DisplayName("FileSystemTranslationFileSearch Tests")
class FileSystemTranslationFileSearchTest {

	private static final String FRENCH_FILES = "^Messages_fr_FR\\.json$";

	@TempDir
	Path root;

	private Path touch(String relativePath) throws IOException {
		Path file = root.resolve(relativePath);
		Files.createDirectories(file.getParent());
		return Files.writeString(file, "{}");
	}

	@Test
	@DisplayName("Should find matching files at any depth, sorted")
	void shouldFindMatchingFiles() throws IOException {
		Path second = touch("packages/manager/apps/zimbra/src/Messages_fr_FR.json");
		Path first = touch("packages/manager/apps/mail/Messages_fr_FR.json");
		touch("packages/manager/apps/mail/Messages_en_GB.json");
		touch("packages/manager/apps/mail/Messages_fr_FR.json.bak");

		List<Path> files = new FileSystemTranslationFileSearch(FRENCH_FILES, List.of()).search(root);

		assertThat(files).containsExactly(first, second);
	}

	@Test
	@DisplayName("Should prune skipped directories at every depth")
	void shouldPruneSkippedDirectories() throws IOException {
		Path kept = touch("apps/web/Messages_fr_FR.json");
		touch("node_modules/lib/Messages_fr_FR.json");
		touch("apps/web/node_modules/dep/Messages_fr_FR.json");
		touch("apps/web/dist/Messages_fr_FR.json");

		List<Path> files = new FileSystemTranslationFileSearch(FRENCH_FILES, List.of("node_modules", "dist"))
			.search(root);

		assertThat(files).containsExactly(kept);
	}

	@Test
	@DisplayName("Should match the regex anywhere in the file name when unanchored")
	void shouldUseFindSemantics() throws IOException {
		Path file = touch("apps/web/Messages_fr_FR.json");

		assertThat(new FileSystemTranslationFileSearch("fr_FR", List.of()).search(root)).containsExactly(file);
	}

	@Test
	@DisplayName("Should return nothing for an empty tree")
	void shouldReturnNothingForEmptyTree() throws IOException {
		assertThat(new FileSystemTranslationFileSearch(FRENCH_FILES, List.of()).search(root)).isEmpty();
	}

	@Test
	@DisplayName("Should reject an invalid regex")
	void shouldRejectInvalidRegex() {
		assertThatThrownBy(() -> new FileSystemTranslationFileSearch("[unclosed", List.of()))
			.isInstanceOf(IllegalArgumentException.class)
			.hasMessageContaining("Invalid regex pattern");
	}

	@Test
	@DisplayName("Should fail when the root is not a directory")
	void shouldFailOnMissingRoot() {
		FileSystemTranslationFileSearch search = new FileSystemTranslationFileSearch(FRENCH_FILES, List.of());

		assertThatThrownBy(() -> search.search(root.resolve("missing"))).isInstanceOf(IOException.class)
			.hasMessageContaining("Unable to read path");
	}

}
